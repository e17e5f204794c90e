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

import eu.openanalytics.phaedra.sampletrackingservice.enumeration.Sex;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.SpecimenRole;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
@NoArgsConstructor(force = true, access = AccessLevel.PRIVATE) // Jackson deserialize compatibility
public class SpecimenDTO {

    Long id;

    String specimenCode;

    /** Compact relation notation for children, e.g. {@code 25_420(25_421)F}; the plain code otherwise. */
    String displayCode;

    String caseNumber;

    String kitCode;

    SpecimenRole role;

    Sex sex;

    String linkedSpecimenCode;

    LocalDate collectionDate;

    WorkflowState workflowState;

    String amplificationBatchCode;

    String separationBatchCode;

    int rerunCount;

    LocalDateTime createdOn;

    LocalDateTime updatedOn;
}
