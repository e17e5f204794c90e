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
package eu.openanalytics.phaedra.sampletrackingservice.dto;

import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchStatus;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchType;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
@NoArgsConstructor(force = true, access = AccessLevel.PRIVATE) // Jackson deserialize compatibility
public class BatchDTO {

    Long id;

    String batchCode;

    BatchType batchType;

    String operator;

    LocalDate processingDate;

    BatchStatus status;

    int totalSpecimens;

    String sourceBatchCode;

    /** Well position to specimen code or control tag, A1..H12. */
    Map<String, String> layout;

    LocalDateTime createdOn;

    LocalDateTime completedOn;
}
