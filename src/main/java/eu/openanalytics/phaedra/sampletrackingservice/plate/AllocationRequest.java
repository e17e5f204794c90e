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
package eu.openanalytics.phaedra.sampletrackingservice.plate;

import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchType;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AllocationRequest {

    BatchType batchType;

    String operator;

    LocalDate processingDate;

    /** Specimens in the order they should be placed. */
    List<String> specimenCodes;

    /** Defaults to the configured control positions when null. */
    ControlPolicy controlPolicy;

    /** Required for rerun batches, optional for separation batches. */
    String sourceBatchCode;
}
