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
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchStatus;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchType;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.ControlType;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.Sex;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.SpecimenRole;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import eu.openanalytics.phaedra.sampletrackingservice.model.Batch;
import eu.openanalytics.phaedra.sampletrackingservice.model.LabCase;
import eu.openanalytics.phaedra.sampletrackingservice.model.SequenceCounter;
import eu.openanalytics.phaedra.sampletrackingservice.model.Specimen;
import eu.openanalytics.phaedra.sampletrackingservice.model.Well;
import eu.openanalytics.phaedra.sampletrackingservice.model.WorkflowEvent;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ModelMapperTest {

    private final ModelMapper modelMapper = new ModelMapper(new SpecimenRelationCodec());

    @Test
    public void mapSpecimen() {
        var specimen = Specimen.builder()
                .id(5L)
                .specimenCode("25_420")
                .caseNumber("25_121")
                .role(SpecimenRole.CHILD)
                .sex(Sex.F)
                .linkedSpecimenCode("25_421")
                .workflowState(WorkflowState.PCR_BATCHED)
                .amplificationBatchCode("LDS_3")
                .rerunCount(2)
                .build();

        var dto = modelMapper.map(specimen).build();

        Assertions.assertEquals(5L, dto.getId());
        Assertions.assertEquals("25_420", dto.getSpecimenCode());
        Assertions.assertEquals("25_421", dto.getLinkedSpecimenCode());
        Assertions.assertEquals("25_420(25_421)F", dto.getDisplayCode());
        Assertions.assertEquals(WorkflowState.PCR_BATCHED, dto.getWorkflowState());
        Assertions.assertEquals("LDS_3", dto.getAmplificationBatchCode());
        Assertions.assertNull(dto.getSeparationBatchCode());
        Assertions.assertEquals(2, dto.getRerunCount());
    }

    @Test
    public void mapBatchFlattensLayout() {
        var batch = Batch.builder()
                .batchCode("LDS_1")
                .batchType(BatchType.AMPLIFICATION)
                .operator("alice")
                .status(BatchStatus.ACTIVE)
                .totalSpecimens(1)
                .wells(Map.of("H12", Well.ofControl(ControlType.NEGATIVE_CONTROL), "A3", Well.ofSpecimen("25_420"), "A1", Well.ofControl(ControlType.ALLELIC_LADDER)))
                .build();

        var dto = modelMapper.map(batch).build();

        Assertions.assertEquals("LDS_1", dto.getBatchCode());
        Assertions.assertEquals(List.of("A1", "A3", "H12"), List.copyOf(dto.getLayout().keySet()));
        Assertions.assertEquals("25_420", dto.getLayout().get("A3"));
    }

    @Test
    public void mapEventAndCounter() {
        var event = modelMapper.map(WorkflowEvent.builder()
                .specimenCode("25_420")
                .fromState(WorkflowState.REGISTERED)
                .toState(WorkflowState.SAMPLE_COLLECTED)
                .changedBy("system")
                .build()).build();
        Assertions.assertEquals(WorkflowState.REGISTERED, event.getFromState());
        Assertions.assertEquals("system", event.getChangedBy());

        var counter = modelMapper.map(SequenceCounter.builder().name("case_counter").nextValue(122).prefix("25").width(3).build()).build();
        Assertions.assertEquals(122, counter.getNextValue());
        Assertions.assertEquals("25", counter.getPrefix());
    }

    @Test
    public void constructsWithImmutableEntities() {
        Assertions.assertDoesNotThrow(() -> new ModelMapper(new SpecimenRelationCodec()));
    }

    @Test
    public void mapLabCaseWithoutSpecimens() {
        var labCase = modelMapper.map(LabCase.builder()
                .id(3L)
                .caseNumber("25_121")
                .kitCode("KIT-7")
                .submissionDate(LocalDate.of(2025, 3, 14))
                .motherPresent(true)
                .build()).build();

        Assertions.assertEquals("25_121", labCase.getCaseNumber());
        Assertions.assertEquals("KIT-7", labCase.getKitCode());
        Assertions.assertEquals(LocalDate.of(2025, 3, 14), labCase.getSubmissionDate());
        Assertions.assertTrue(labCase.isMotherPresent());
        Assertions.assertNull(labCase.getSpecimens());
    }
}
