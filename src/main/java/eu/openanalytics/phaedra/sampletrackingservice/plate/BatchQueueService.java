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

import eu.openanalytics.phaedra.sampletrackingservice.config.SampleTrackingProperties;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchType;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import eu.openanalytics.phaedra.sampletrackingservice.model.Batch;
import eu.openanalytics.phaedra.sampletrackingservice.model.Specimen;
import eu.openanalytics.phaedra.sampletrackingservice.repository.SpecimenRepository;
import eu.openanalytics.phaedra.sampletrackingservice.workflow.TransitionResult;
import eu.openanalytics.phaedra.sampletrackingservice.workflow.WorkflowService;
import eu.openanalytics.phaedra.sampletrackingservice.workflow.WorkflowStateMachine;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Specimens waiting for a plate, and automatic batch creation once enough of them are waiting.
 */
@Service
public class BatchQueueService {

    private static final Comparator<Specimen> BY_SPECIMEN_NUMBER = Comparator
            .comparingLong((Specimen s) -> NumberUtils.toLong(StringUtils.substringAfterLast(s.getSpecimenCode(), "_"), Long.MAX_VALUE))
            .thenComparing(Specimen::getSpecimenCode);

    private final SpecimenRepository specimenRepository;
    private final PlateAllocationService plateAllocationService;
    private final WorkflowService workflowService;
    private final WorkflowStateMachine stateMachine;
    private final SampleTrackingProperties properties;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    public BatchQueueService(SpecimenRepository specimenRepository, PlateAllocationService plateAllocationService,
            WorkflowService workflowService, WorkflowStateMachine stateMachine, SampleTrackingProperties properties) {
        this.specimenRepository = specimenRepository;
        this.plateAllocationService = plateAllocationService;
        this.workflowService = workflowService;
        this.stateMachine = stateMachine;
        this.properties = properties;
    }

    /**
     * Specimens whose state allows them to enter a batch of the given type, ordered by specimen number.
     * A specimen that comes back from a rerun is listed again even though it keeps its earlier batch codes.
     */
    public List<Specimen> queue(BatchType batchType) {
        WorkflowState batchedState = batchType.getBatchedState();
        return Arrays.stream(WorkflowState.values())
                .filter(state -> stateMachine.canTransition(state, batchedState))
                .flatMap(state -> specimenRepository.findByWorkflowState(state).stream())
                .sorted(BY_SPECIMEN_NUMBER)
                .toList();
    }

    /**
     * Fills a new batch from the queue, up to the free capacity of the plate. Nothing is created while fewer
     * specimens than the configured minimum are waiting.
     */
    public Optional<Batch> createFromQueue(BatchType batchType, String operator, LocalDate processingDate, ControlPolicy controlPolicy) {
        if (batchType == BatchType.RERUN) {
            throw new IllegalArgumentException("Rerun batches are created from their source batch, not from the queue");
        }
        ControlPolicy policy = controlPolicy == null ? plateAllocationService.defaultControlPolicy() : controlPolicy;
        List<Specimen> waiting = queue(batchType);
        int minimum = properties.getQueue().getMinimumBatchSize();
        if (waiting.isEmpty() || waiting.size() < minimum) {
            logger.info("{} specimen(s) waiting for a {} batch, at least {} needed", waiting.size(), batchType.getCode(), minimum);
            return Optional.empty();
        }

        int freeWells = WellPosition.CAPACITY - policy.size();
        List<String> specimenCodes = waiting.stream()
                .limit(freeWells)
                .map(Specimen::getSpecimenCode)
                .toList();
        return Optional.of(plateAllocationService.allocate(AllocationRequest.builder()
                .batchType(batchType)
                .operator(operator)
                .processingDate(processingDate)
                .specimenCodes(specimenCodes)
                .controlPolicy(policy)
                .build()));
    }

    /**
     * Moves every specimen waiting in {@code from} to {@code to}, for example {@code pcr_completed} to {@code electro_ready}.
     */
    public List<TransitionResult> promoteReady(WorkflowState from, WorkflowState to) {
        List<String> specimenCodes = specimenRepository.findByWorkflowState(from).stream()
                .sorted(BY_SPECIMEN_NUMBER)
                .map(Specimen::getSpecimenCode)
                .toList();
        return workflowService.transitionMany(specimenCodes, to);
    }
}
