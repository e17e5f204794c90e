/**
 * Phaedra II
 *
 * Copyright (C) 2016-2025 Open Analytics
 *
 * ===========================================================================
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the Apache License as published by
 * The Apache Software Foundation, either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Apache License for more details.
 *
 * You should have received a copy of the Apache License
 * along with this program.  If not, see <http://www.apache.org/licenses/>
 */
package eu.openanalytics.phaedra.sampletrackingservice.sequence;

import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchType;

/**
 * The named counters kept by the sequencer.
 */
public enum CounterName {

    CASE("case_counter"),
    SPECIMEN("specimen_counter"),
    AMPLIFICATION_BATCH("amplification_batch_counter"),
    SEPARATION_BATCH("separation_batch_counter"),
    RERUN_BATCH("rerun_batch_counter");

    private final String name;

    CounterName(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static CounterName forBatchType(BatchType batchType) {
        return switch (batchType) {
            case AMPLIFICATION -> AMPLIFICATION_BATCH;
            case SEPARATION -> SEPARATION_BATCH;
            case RERUN -> RERUN_BATCH;
        };
    }

    public static CounterName fromName(String name) {
        for (CounterName counterName : values()) {
            if (counterName.name.equals(name)) return counterName;
        }
        throw new IllegalArgumentException(String.format("Unknown sequence counter '%s'", name));
    }
}
