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

import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchOutcome;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchStatus;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchType;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.ControlType;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import eu.openanalytics.phaedra.sampletrackingservice.exception.BatchNotFoundException;
import eu.openanalytics.phaedra.sampletrackingservice.exception.CapacityExceededException;
import eu.openanalytics.phaedra.sampletrackingservice.exception.DuplicateSpecimenInRequestException;
import eu.openanalytics.phaedra.sampletrackingservice.exception.LineageMismatchException;
import eu.openanalytics.phaedra.sampletrackingservice.exception.SpecimenNotEligibleException;
import eu.openanalytics.phaedra.sampletrackingservice.exception.SpecimenNotFoundException;
import eu.openanalytics.phaedra.sampletrackingservice.model.Batch;
import eu.openanalytics.phaedra.sampletrackingservice.support.SampleTrackingFixture;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class PlateAllocationServiceTest {

    private static final List<String> FAMILY = List.of("25_420", "25_421", "25_422");

    private SampleTrackingFixture fixture;
    private PlateAllocationService plateAllocationService;

    @BeforeEach
    public void before() {
        fixture = new SampleTrackingFixture().withBatchCounters();
        plateAllocationService = fixture.plateAllocationService;
        FAMILY.forEach(code -> fixture.addSpecimen(code, WorkflowState.SAMPLE_COLLECTED));
    }

    @Test
    public void amplificationBatchWithDefaultControls() {
        var batch = allocate(BatchType.AMPLIFICATION, FAMILY, null);

        Assertions.assertEquals("LDS_1", batch.getBatchCode());
        Assertions.assertEquals(BatchStatus.ACTIVE, batch.getStatus());
        Assertions.assertEquals(3, batch.getTotalSpecimens());
        Assertions.assertEquals(LocalDate.of(2025, 3, 14), batch.getProcessingDate());

        var layout = plateAllocationService.layoutOf("LDS_1");
        Assertions.assertEquals(6, layout.size());
        Assertions.assertEquals("allelic_ladder", layout.get("A1"));
        Assertions.assertEquals("positive_control", layout.get("A2"));
        Assertions.assertEquals("25_420", layout.get("A3"));
        Assertions.assertEquals("25_421", layout.get("A4"));
        Assertions.assertEquals("25_422", layout.get("A5"));
        Assertions.assertEquals("negative_control", layout.get("H12"));

        for (String code : FAMILY) {
            var specimen = fixture.specimen(code);
            Assertions.assertEquals(WorkflowState.PCR_BATCHED, specimen.getWorkflowState());
            Assertions.assertEquals("LDS_1", specimen.getAmplificationBatchCode());
            Assertions.assertNull(specimen.getSeparationBatchCode());
            Assertions.assertEquals("alice", fixture.workflowService.getHistory(code).get(0).getChangedBy());
        }
        Assertions.assertEquals(FAMILY, plateAllocationService.getSpecimensOfBatch("LDS_1").stream().map(s -> s.getSpecimenCode()).toList());
    }

    @Test
    public void batchCodesFollowTheCounter() {
        allocate(BatchType.AMPLIFICATION, List.of("25_420"), null);
        var second = allocate(BatchType.AMPLIFICATION, List.of("25_421"), null);

        Assertions.assertEquals("LDS_2", second.getBatchCode());
        Assertions.assertEquals(2, plateAllocationService.getBatches(BatchType.AMPLIFICATION).size());
        Assertions.assertTrue(plateAllocationService.getBatches(BatchType.SEPARATION).isEmpty());
    }

    @Test
    public void specimensKeepCallerOrder() {
        allocate(BatchType.AMPLIFICATION, List.of("25_422", "25_420", "25_421"), ControlPolicy.none());

        var layout = plateAllocationService.layoutOf("LDS_1");
        Assertions.assertEquals(Map.of("A1", "25_422", "A2", "25_420", "A3", "25_421"), layout);
    }

    @Test
    public void duplicateSpecimensAreRejected() {
        var ex = Assertions.assertThrows(DuplicateSpecimenInRequestException.class,
                () -> allocate(BatchType.AMPLIFICATION, List.of("25_420", "25_421", "25_420"), null));

        Assertions.assertEquals("Specimens requested more than once: 25_420", ex.getMessage());
        assertNothingChanged();
    }

    @Test
    public void capacityIsCheckedBeforeLookup() {
        var codes = IntStream.range(0, 94).mapToObj(i -> String.format("26_%03d", i)).toList();

        Assertions.assertThrows(CapacityExceededException.class, () -> allocate(BatchType.AMPLIFICATION, codes, null));
        assertNothingChanged();
    }

    @Test
    public void fullPlateIsAccepted() {
        var codes = IntStream.range(0, 93).mapToObj(i -> String.format("26_%03d", i)).toList();
        codes.forEach(code -> fixture.addSpecimen(code, WorkflowState.PCR_READY));

        var batch = allocate(BatchType.AMPLIFICATION, codes, null);

        Assertions.assertEquals(96, batch.getWells().size());
        Assertions.assertEquals(93, batch.getTotalSpecimens());
    }

    @Test
    public void emptyRequestAndMissingOperatorAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> allocate(BatchType.AMPLIFICATION, List.of(), null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> plateAllocationService.allocate(AllocationRequest.builder()
                .batchType(BatchType.AMPLIFICATION)
                .operator(" ")
                .specimenCodes(FAMILY)
                .build()));
        assertNothingChanged();
    }

    @Test
    public void unknownSpecimenIsRejected() {
        var ex = Assertions.assertThrows(SpecimenNotFoundException.class,
                () -> allocate(BatchType.AMPLIFICATION, List.of("25_420", "25_999"), null));

        Assertions.assertEquals("25_999", ex.getSpecimenCode());
        assertNothingChanged();
    }

    @Test
    public void ineligibleSpecimenIsRejected() {
        fixture.addSpecimen("25_430", WorkflowState.REGISTERED);

        var ex = Assertions.assertThrows(SpecimenNotEligibleException.class,
                () -> allocate(BatchType.AMPLIFICATION, List.of("25_420", "25_430"), null));

        Assertions.assertEquals("Specimen 25_430 in state registered cannot enter a amplification batch", ex.getMessage());
        Assertions.assertEquals(WorkflowState.SAMPLE_COLLECTED, fixture.specimen("25_420").getWorkflowState());
        assertNothingChanged();
    }

    @Test
    public void separationFromAmplification() {
        allocate(BatchType.AMPLIFICATION, FAMILY, null);
        fixture.batchCompletionService.complete("LDS_1", BatchOutcome.COMPLETED, List.of());

        var batch = plateAllocationService.allocate(AllocationRequest.builder()
                .batchType(BatchType.SEPARATION)
                .operator("bob")
                .specimenCodes(List.of("25_420", "25_422"))
                .sourceBatchCode("LDS_1")
                .build());

        Assertions.assertEquals("ELEC_1", batch.getBatchCode());
        Assertions.assertEquals("LDS_1", batch.getSourceBatchCode());
        Assertions.assertEquals(WorkflowState.ELECTRO_BATCHED, fixture.specimen("25_420").getWorkflowState());
        Assertions.assertEquals("ELEC_1", fixture.specimen("25_420").getSeparationBatchCode());
        Assertions.assertEquals("LDS_1", fixture.specimen("25_420").getAmplificationBatchCode());
        Assertions.assertEquals(WorkflowState.PCR_COMPLETED, fixture.specimen("25_421").getWorkflowState());
        Assertions.assertEquals(2, fixture.batchLineageService.lineageOf("ELEC_1").size());
    }

    @Test
    public void separationWithForeignSpecimenLeavesRecordsUnchanged() {
        allocate(BatchType.AMPLIFICATION, List.of("25_420", "25_421"), null);
        fixture.batchCompletionService.complete("LDS_1", BatchOutcome.COMPLETED, List.of());
        fixture.addSpecimen("25_500", WorkflowState.PCR_COMPLETED);

        Assertions.assertThrows(LineageMismatchException.class, () -> plateAllocationService.allocate(AllocationRequest.builder()
                .batchType(BatchType.SEPARATION)
                .operator("bob")
                .specimenCodes(List.of("25_420", "25_500"))
                .sourceBatchCode("LDS_1")
                .build()));

        Assertions.assertEquals(WorkflowState.PCR_COMPLETED, fixture.specimen("25_420").getWorkflowState());
        Assertions.assertNull(fixture.specimen("25_420").getSeparationBatchCode());
        Assertions.assertEquals(WorkflowState.PCR_COMPLETED, fixture.specimen("25_500").getWorkflowState());
        Assertions.assertEquals(1, fixture.batchRepository.count());
        Assertions.assertEquals(1, fixture.sequenceCounterService.peek("separation_batch_counter").getNextValue());
        Assertions.assertTrue(fixture.batchLineageRepository.findBySourceBatchCode("LDS_1").isEmpty());
    }

    @Test
    public void separationFromUnknownSourceFails() {
        fixture.addSpecimen("25_500", WorkflowState.ELECTRO_READY);

        Assertions.assertThrows(BatchNotFoundException.class, () -> plateAllocationService.allocate(AllocationRequest.builder()
                .batchType(BatchType.SEPARATION)
                .operator("bob")
                .specimenCodes(List.of("25_500"))
                .sourceBatchCode("LDS_77")
                .build()));
    }

    @Test
    public void rerunOfFailedSpecimens() {
        allocate(BatchType.AMPLIFICATION, FAMILY, null);
        fixture.batchCompletionService.complete("LDS_1", BatchOutcome.COMPLETED, List.of("25_421", "25_422"));

        var batch = plateAllocationService.allocate(AllocationRequest.builder()
                .batchType(BatchType.RERUN)
                .operator("carol")
                .specimenCodes(List.of("25_422", "25_421"))
                .sourceBatchCode("LDS_1")
                .build());

        Assertions.assertEquals("LDS_1_RR", batch.getBatchCode());
        var specimen = fixture.specimen("25_421");
        Assertions.assertEquals(WorkflowState.RERUN_BATCHED, specimen.getWorkflowState());
        Assertions.assertEquals(1, specimen.getRerunCount());
        Assertions.assertEquals("LDS_1_RR", specimen.getAmplificationBatchCode());
        Assertions.assertEquals(0, fixture.specimen("25_420").getRerunCount());
        Assertions.assertEquals(List.of("LDS_1_RR"),
                fixture.batchLineageService.derivedBatches("LDS_1").stream().map(Batch::getBatchCode).toList());
    }

    @Test
    public void rerunMustCarryEveryFailedSpecimen() {
        allocate(BatchType.AMPLIFICATION, FAMILY, null);
        fixture.batchCompletionService.complete("LDS_1", BatchOutcome.COMPLETED, List.of("25_421", "25_422"));

        Assertions.assertThrows(LineageMismatchException.class, () -> plateAllocationService.allocate(AllocationRequest.builder()
                .batchType(BatchType.RERUN)
                .operator("carol")
                .specimenCodes(List.of("25_421"))
                .sourceBatchCode("LDS_1")
                .build()));
        Assertions.assertEquals(WorkflowState.RERUN_REQUIRED, fixture.specimen("25_421").getWorkflowState());
        Assertions.assertEquals(0, fixture.specimen("25_421").getRerunCount());
    }

    @Test
    public void rerunWithoutSourceFails() {
        fixture.addSpecimen("25_500", WorkflowState.RERUN_REQUIRED);

        Assertions.assertThrows(LineageMismatchException.class, () -> allocate(BatchType.RERUN, List.of("25_500"), null));
    }

    @Test
    public void customControlsAreStored() {
        var policy = ControlPolicy.of(Map.of("D6", ControlType.ALLELIC_LADDER));

        var batch = allocate(BatchType.AMPLIFICATION, FAMILY, policy);

        Assertions.assertEquals(ControlType.ALLELIC_LADDER, batch.getWells().get("D6").getControlType());
        Assertions.assertEquals(4, batch.getWells().size());
    }

    private Batch allocate(BatchType batchType, List<String> specimenCodes, ControlPolicy controlPolicy) {
        return plateAllocationService.allocate(AllocationRequest.builder()
                .batchType(batchType)
                .operator("alice")
                .specimenCodes(specimenCodes)
                .controlPolicy(controlPolicy)
                .build());
    }

    private void assertNothingChanged() {
        Assertions.assertEquals(0, fixture.batchRepository.count());
        Assertions.assertEquals(1, fixture.sequenceCounterService.peek("amplification_batch_counter").getNextValue());
        for (String code : FAMILY) {
            Assertions.assertEquals(WorkflowState.SAMPLE_COLLECTED, fixture.specimen(code).getWorkflowState());
            Assertions.assertNull(fixture.specimen(code).getAmplificationBatchCode());
        }
    }
}
