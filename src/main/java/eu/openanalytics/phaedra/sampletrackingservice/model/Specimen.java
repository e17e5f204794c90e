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

import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchType;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.Sex;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.SpecimenRole;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.springframework.data.annotation.Id;

/**
 * One biological sample of one person in one case.
 * The relation to the other case members is kept as separate fields (role, sex, linked specimen);
 * the compact notation such as {@code 25_420(25_421)F} is only rendered for display.
 */
@Value
@With
@Builder(toBuilder = true)
@AllArgsConstructor
public class Specimen {
    @Id
    Long id;

    @NotNull
    String specimenCode;

    String caseNumber;

    String kitCode;

    @NotNull
    SpecimenRole role;

    Sex sex;

    String linkedSpecimenCode;

    LocalDate collectionDate;

    @NotNull
    WorkflowState workflowState;

    String amplificationBatchCode;

    String separationBatchCode;

    int rerunCount;

    LocalDateTime createdOn;

    LocalDateTime updatedOn;

    public Specimen withBatchCode(BatchType batchType, String batchCode) {
        return batchType.isAmplifying() ? withAmplificationBatchCode(batchCode) : withSeparationBatchCode(batchCode);
    }
}
