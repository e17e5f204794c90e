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
package eu.openanalytics.phaedra.sampletrackingservice.enumeration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states of a specimen. The main path runs from {@link #REGISTERED} to {@link #DELIVERED};
 * {@link #RERUN_REQUIRED}, {@link #RERUN_BATCHED} and {@link #FAILED} are side branches.
 */
public enum WorkflowState {

    REGISTERED("registered"),
    SAMPLE_COLLECTED("sample_collected"),
    PCR_READY("pcr_ready"),
    PCR_BATCHED("pcr_batched"),
    PCR_COMPLETED("pcr_completed"),
    ELECTRO_READY("electro_ready"),
    ELECTRO_BATCHED("electro_batched"),
    ELECTRO_COMPLETED("electro_completed"),
    ANALYSIS_READY("analysis_ready"),
    IN_ANALYSIS("in_analysis"),
    ANALYSIS_COMPLETED("analysis_completed"),
    REPORT_GENERATED("report_generated"),
    DELIVERED("delivered"),
    RERUN_REQUIRED("rerun_required"),
    RERUN_BATCHED("rerun_batched"),
    FAILED("failed");

    private final String code;

    WorkflowState(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == FAILED;
    }

    @JsonCreator
    public static WorkflowState fromCode(String code) {
        for (WorkflowState state : values()) {
            if (state.code.equalsIgnoreCase(code) || state.name().equalsIgnoreCase(code)) return state;
        }
        throw new IllegalArgumentException(String.format("Unknown workflow state '%s'", code));
    }
}
