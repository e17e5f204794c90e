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
package eu.openanalytics.phaedra.sampletrackingservice.model;

import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchStatus;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchType;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.MappedCollection;

@Value
@With
@Builder(toBuilder = true)
@AllArgsConstructor
public class Batch {
    @Id
    Long id;

    @NotNull
    String batchCode;

    @NotNull
    BatchType batchType;

    @NotNull
    String operator;

    LocalDate processingDate;

    @NotNull
    BatchStatus status;

    int totalSpecimens;

    String sourceBatchCode;

    /**
     * Occupied wells keyed by position ({@code A1}..{@code H12}). The layout never changes after creation.
     */
    @MappedCollection(idColumn = "batch_id", keyColumn = "position")
    Map<String, Well> wells;

    LocalDateTime createdOn;

    LocalDateTime completedOn;
}
