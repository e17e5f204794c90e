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
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchType;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import eu.openanalytics.phaedra.sampletrackingservice.model.Batch;
import eu.openanalytics.phaedra.sampletrackingservice.model.Specimen;
import eu.openanalytics.phaedra.sampletrackingservice.support.SampleTrackingFixture;
import eu.openanalytics.phaedra.sampletrackingservice.workflow.TransitionResult;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class BatchQueueServiceTest {

    private SampleTrackingFixture fixture;
    private BatchQueueService batchQueueService;

    @BeforeEach
    public void before() {
        fixture = new SampleTrackingFixture().withBatchCounters();
        batchQueueService = fixture.batchQueueService;
    }

    @Test
    public void queueIsOrderedBySpecimenNumber() {
        fixture.addSpecimen("25_1000", WorkflowState.PCR_READY);
        fixture.addSpecimen("25_099", WorkflowState.SAMPLE_COLLECTED);
        fixture.addSpecimen("25_100", WorkflowState.PCR_READY);
        fixture.addSpecimen("25_050", WorkflowState.REGISTERED);

        var queue = batchQueueService.queue(BatchType.AMPLIFICATION);

        Assertions.assertEquals(List.of("25_099", "25_100", "25_1000"), queue.stream().map(Specimen::getSpecimenCode).toList());
    }

    @Test
    public void specimensAlreadyOnAPlateAreNotQueued() {
        fixture.addSpecimen("25_001", WorkflowState.ELECTRO_BATCHED);
        fixture.specimenRepository.save(fixture.specimen("25_001").withSeparationBatchCode("ELEC_4"));
        fixture.addSpecimen("25_002", WorkflowState.ELECTRO_READY);

        var queue = batchQueueService.queue(BatchType.SEPARATION);

        Assertions.assertEquals(List.of("25_002"), queue.stream().map(Specimen::getSpecimenCode).toList());
    }

    @Test
    public void specimenIsQueuedAgainAfterAFailedSeparationAndRerun() {
        fixture.addSpecimen("25_001", WorkflowState.PCR_READY);
        var amplification = allocate(BatchType.AMPLIFICATION, null);
        fixture.batchCompletionService.complete(amplification.getBatchCode(), BatchOutcome.COMPLETED, List.of());

        var separation = allocate(BatchType.SEPARATION, amplification.getBatchCode());
        fixture.batchCompletionService.complete(separation.getBatchCode(), BatchOutcome.FAILED, List.of());

        var rerun = allocate(BatchType.RERUN, separation.getBatchCode());
        fixture.batchCompletionService.complete(rerun.getBatchCode(), BatchOutcome.COMPLETED, List.of());

        var specimen = fixture.specimen("25_001");
        Assertions.assertEquals(WorkflowState.PCR_COMPLETED, specimen.getWorkflowState());
        Assertions.assertEquals("ELEC_1", specimen.getSeparationBatchCode());
        Assertions.assertEquals(List.of("25_001"),
                batchQueueService.queue(BatchType.SEPARATION).stream().map(Specimen::getSpecimenCode).toList());
    }

    @Test
    public void rerunQueueKeepsLinkedSpecimens() {
        fixture.addSpecimen("25_001", WorkflowState.RERUN_REQUIRED);
        fixture.specimenRepository.save(fixture.specimen("25_001").withAmplificationBatchCode("LDS_3"));

        Assertions.assertEquals(1, batchQueueService.queue(BatchType.RERUN).size());
    }

    @Test
    public void nothingIsCreatedBelowTheMinimum() {
        addReady(7);

        var batch = batchQueueService.createFromQueue(BatchType.AMPLIFICATION, "alice", null, null);

        Assertions.assertTrue(batch.isEmpty());
        Assertions.assertEquals(0, fixture.batchRepository.count());
        Assertions.assertEquals(WorkflowState.PCR_READY, fixture.specimen("25_000").getWorkflowState());
    }

    @Test
    public void batchIsCreatedFromTheQueue() {
        addReady(10);

        var batch = batchQueueService.createFromQueue(BatchType.AMPLIFICATION, "alice", LocalDate.of(2025, 4, 1), null).orElseThrow();

        Assertions.assertEquals("LDS_1", batch.getBatchCode());
        Assertions.assertEquals(10, batch.getTotalSpecimens());
        Assertions.assertEquals(LocalDate.of(2025, 4, 1), batch.getProcessingDate());
        Assertions.assertEquals("25_000", batch.getWells().get("A3").getSpecimenCode());
        Assertions.assertTrue(batchQueueService.queue(BatchType.AMPLIFICATION).isEmpty());
    }

    @Test
    public void queueBeyondOnePlateIsSplit() {
        addReady(100);

        var batch = batchQueueService.createFromQueue(BatchType.AMPLIFICATION, "alice", null, ControlPolicy.none()).orElseThrow();

        Assertions.assertEquals(96, batch.getTotalSpecimens());
        Assertions.assertEquals(List.of("25_096", "25_097", "25_098", "25_099"),
                batchQueueService.queue(BatchType.AMPLIFICATION).stream().map(Specimen::getSpecimenCode).toList());
    }

    @Test
    public void rerunBatchesAreNotCreatedFromTheQueue() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> batchQueueService.createFromQueue(BatchType.RERUN, "alice", null, null));
    }

    @Test
    public void promoteReady() {
        fixture.addSpecimen("25_002", WorkflowState.PCR_COMPLETED);
        fixture.addSpecimen("25_001", WorkflowState.PCR_COMPLETED);
        fixture.addSpecimen("25_003", WorkflowState.PCR_BATCHED);

        var results = batchQueueService.promoteReady(WorkflowState.PCR_COMPLETED, WorkflowState.ELECTRO_READY);

        Assertions.assertEquals(List.of("25_001", "25_002"), results.stream().map(TransitionResult::getSpecimenCode).toList());
        Assertions.assertEquals(WorkflowState.ELECTRO_READY, fixture.specimen("25_001").getWorkflowState());
        Assertions.assertEquals(WorkflowState.PCR_BATCHED, fixture.specimen("25_003").getWorkflowState());
    }

    private Batch allocate(BatchType batchType, String sourceBatchCode) {
        return fixture.plateAllocationService.allocate(AllocationRequest.builder()
                .batchType(batchType)
                .operator("alice")
                .specimenCodes(List.of("25_001"))
                .sourceBatchCode(sourceBatchCode)
                .build());
    }

    private void addReady(int count) {
        IntStream.range(0, count).forEach(i -> fixture.addSpecimen(String.format("25_%03d", i), WorkflowState.PCR_READY));
    }
}
