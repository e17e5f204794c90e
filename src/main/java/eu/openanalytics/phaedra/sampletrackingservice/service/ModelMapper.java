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
package eu.openanalytics.phaedra.sampletrackingservice.service;

import eu.openanalytics.phaedra.sampletrackingservice.codec.SpecimenRelationCodec;
import eu.openanalytics.phaedra.sampletrackingservice.dto.BatchDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.BatchLineageDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.LabCaseDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.SequenceCounterDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.SpecimenDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.WorkflowEventDTO;
import eu.openanalytics.phaedra.sampletrackingservice.model.Batch;
import eu.openanalytics.phaedra.sampletrackingservice.model.BatchLineage;
import eu.openanalytics.phaedra.sampletrackingservice.model.LabCase;
import eu.openanalytics.phaedra.sampletrackingservice.model.SequenceCounter;
import eu.openanalytics.phaedra.sampletrackingservice.model.Specimen;
import eu.openanalytics.phaedra.sampletrackingservice.model.WorkflowEvent;
import eu.openanalytics.phaedra.sampletrackingservice.plate.PlateLayout;
import org.modelmapper.Conditions;
import org.modelmapper.config.Configuration;
import org.modelmapper.convention.MatchingStrategies;
import org.modelmapper.convention.NameTransformers;
import org.modelmapper.convention.NamingConventions;
import org.springframework.stereotype.Service;

@Service
public class ModelMapper {

    private final org.modelmapper.ModelMapper modelMapper = new org.modelmapper.ModelMapper();

    private final SpecimenRelationCodec relationCodec;

    public ModelMapper(SpecimenRelationCodec relationCodec) {
        this.relationCodec = relationCodec;

        Configuration builderConfiguration = modelMapper.getConfiguration().copy()
                .setDestinationNameTransformer(NameTransformers.builder())
                .setDestinationNamingConvention(NamingConventions.builder())
                .setMatchingStrategy(MatchingStrategies.STRICT);

        // displayCode and specimens are derived, they are filled in by map(Specimen) and the case lookup
        modelMapper.createTypeMap(Specimen.class, SpecimenDTO.SpecimenDTOBuilder.class, builderConfiguration)
                .setPropertyCondition(Conditions.isNotNull());

        modelMapper.createTypeMap(LabCase.class, LabCaseDTO.LabCaseDTOBuilder.class, builderConfiguration)
                .setPropertyCondition(Conditions.isNotNull());

        // ensure that objects can be mapped
        modelMapper.createTypeMap(WorkflowEvent.class, WorkflowEventDTO.WorkflowEventDTOBuilder.class, builderConfiguration)
                .setPropertyCondition(Conditions.isNotNull())
                .validate();

        modelMapper.createTypeMap(SequenceCounter.class, SequenceCounterDTO.SequenceCounterDTOBuilder.class, builderConfiguration)
                .setPropertyCondition(Conditions.isNotNull())
                .validate();

        modelMapper.createTypeMap(BatchLineage.class, BatchLineageDTO.BatchLineageDTOBuilder.class, builderConfiguration)
                .setPropertyCondition(Conditions.isNotNull())
                .validate();
    }

    /**
     * Maps a {@link Specimen} to a {@link SpecimenDTO.SpecimenDTOBuilder}, including its display code.
     * The return value can be further customized by calling the builder methods.
     */
    public SpecimenDTO.SpecimenDTOBuilder map(Specimen specimen) {
        SpecimenDTO.SpecimenDTOBuilder builder = SpecimenDTO.builder();
        modelMapper.map(specimen, builder);
        return builder.displayCode(relationCodec.display(specimen));
    }

    /**
     * Maps a {@link LabCase} to a {@link LabCaseDTO.LabCaseDTOBuilder}, without specimens.
     */
    public LabCaseDTO.LabCaseDTOBuilder map(LabCase labCase) {
        LabCaseDTO.LabCaseDTOBuilder builder = LabCaseDTO.builder();
        modelMapper.map(labCase, builder);
        return builder;
    }

    public WorkflowEventDTO.WorkflowEventDTOBuilder map(WorkflowEvent workflowEvent) {
        WorkflowEventDTO.WorkflowEventDTOBuilder builder = WorkflowEventDTO.builder();
        modelMapper.map(workflowEvent, builder);
        return builder;
    }

    public SequenceCounterDTO.SequenceCounterDTOBuilder map(SequenceCounter sequenceCounter) {
        SequenceCounterDTO.SequenceCounterDTOBuilder builder = SequenceCounterDTO.builder();
        modelMapper.map(sequenceCounter, builder);
        return builder;
    }

    public BatchLineageDTO.BatchLineageDTOBuilder map(BatchLineage batchLineage) {
        BatchLineageDTO.BatchLineageDTOBuilder builder = BatchLineageDTO.builder();
        modelMapper.map(batchLineage, builder);
        return builder;
    }

    /**
     * Maps a {@link Batch} to a {@link BatchDTO.BatchDTOBuilder}. The wells are flattened into an ordered layout.
     */
    public BatchDTO.BatchDTOBuilder map(Batch batch) {
        return BatchDTO.builder()
                .id(batch.getId())
                .batchCode(batch.getBatchCode())
                .batchType(batch.getBatchType())
                .operator(batch.getOperator())
                .processingDate(batch.getProcessingDate())
                .status(batch.getStatus())
                .totalSpecimens(batch.getTotalSpecimens())
                .sourceBatchCode(batch.getSourceBatchCode())
                .layout(PlateLayout.describe(batch))
                .createdOn(batch.getCreatedOn())
                .completedOn(batch.getCompletedOn());
    }
}
