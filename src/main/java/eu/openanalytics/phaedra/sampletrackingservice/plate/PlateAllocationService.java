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
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchStatus;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchType;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import eu.openanalytics.phaedra.sampletrackingservice.exception.BatchNotFoundException;
import eu.openanalytics.phaedra.sampletrackingservice.exception.DuplicateSpecimenInRequestException;
import eu.openanalytics.phaedra.sampletrackingservice.exception.SpecimenNotEligibleException;
import eu.openanalytics.phaedra.sampletrackingservice.exception.SpecimenNotFoundException;
import eu.openanalytics.phaedra.sampletrackingservice.lineage.BatchLineageService;
import eu.openanalytics.phaedra.sampletrackingservice.model.Batch;
import eu.openanalytics.phaedra.sampletrackingservice.model.Specimen;
import eu.openanalytics.phaedra.sampletrackingservice.model.Well;
import eu.openanalytics.phaedra.sampletrackingservice.repository.BatchRepository;
import eu.openanalytics.phaedra.sampletrackingservice.repository.SpecimenRepository;
import eu.openanalytics.phaedra.sampletrackingservice.sequence.CounterName;
import eu.openanalytics.phaedra.sampletrackingservice.sequence.SequenceCounterService;
import eu.openanalytics.phaedra.sampletrackingservice.workflow.WorkflowService;
import eu.openanalytics.phaedra.sampletrackingservice.workflow.WorkflowStateMachine;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Creates batches: places specimens and controls on a 96-well plate and moves the specimens into the batched state.
 */
@Service
public class PlateAllocationService {

    private final SpecimenRepository specimenRepository;
    private final BatchRepository batchRepository;
    private final SequenceCounterService sequenceCounterService;
    private final WorkflowService workflowService;
    private final WorkflowStateMachine stateMachine;
    private final BatchLineageService batchLineageService;
    private final TransactionOperations transactionOperations;
    private final SampleTrackingProperties properties;
    private final Clock clock;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    public PlateAllocationService(SpecimenRepository specimenRepository, BatchRepository batchRepository,
            SequenceCounterService sequenceCounterService, WorkflowService workflowService, WorkflowStateMachine stateMachine,
            BatchLineageService batchLineageService, TransactionOperations transactionOperations,
            SampleTrackingProperties properties, Clock clock) {
        this.specimenRepository = specimenRepository;
        this.batchRepository = batchRepository;
        this.sequenceCounterService = sequenceCounterService;
        this.workflowService = workflowService;
        this.stateMachine = stateMachine;
        this.batchLineageService = batchLineageService;
        this.transactionOperations = transactionOperations;
        this.properties = properties;
        this.clock = clock;
    }

    public ControlPolicy defaultControlPolicy() {
        return ControlPolicy.defaultPolicy(properties.getPlate());
    }

    /**
     * Creates a batch from the request. Either the batch, its layout, every specimen update and the lineage
     * rows are all stored, or nothing is: every check runs before the batch code is reserved.
     */
    public Batch allocate(AllocationRequest request) {
        BatchType batchType = request.getBatchType();
        List<String> specimenCodes = request.getSpecimenCodes() == null ? List.of() : request.getSpecimenCodes();
        ControlPolicy controlPolicy = request.getControlPolicy() == null ? defaultControlPolicy() : request.getControlPolicy();

        if (batchType == null) throw new IllegalArgumentException("Batch type is mandatory");
        if (StringUtils.isBlank(request.getOperator())) throw new IllegalArgumentException("Operator is mandatory");
        checkDuplicates(specimenCodes);
        PlateLayout.checkCapacity(controlPolicy, specimenCodes.size());
        if (specimenCodes.isEmpty()) throw new IllegalArgumentException("A batch needs at least one specimen");

        return transactionOperations.execute(status -> {
            Map<String, Specimen> specimens = lockSpecimens(specimenCodes);
            WorkflowState batchedState = batchType.getBatchedState();
            for (String specimenCode : specimenCodes) {
                Specimen specimen = specimens.get(specimenCode);
                if (!stateMachine.canTransition(specimen.getWorkflowState(), batchedState)) {
                    throw new SpecimenNotEligibleException(specimenCode, specimen.getWorkflowState(), batchType);
                }
            }
            if (request.getSourceBatchCode() != null || batchType == BatchType.RERUN) {
                batchLineageService.verify(batchType, request.getSourceBatchCode(), specimenCodes);
            }

            String batchCode = sequenceCounterService.reserveOne(CounterName.forBatchType(batchType).getName());
            Map<String, Well> wells = PlateLayout.arrange(controlPolicy, specimenCodes);
            String context = String.format("%s batch %s", batchType.getCode(), batchCode);

            for (String specimenCode : specimenCodes) {
                Specimen specimen = specimens.get(specimenCode).withBatchCode(batchType, batchCode);
                if (batchType == BatchType.RERUN) {
                    specimen = specimen.withRerunCount(specimen.getRerunCount() + 1);
                }
                specimenRepository.save(workflowService.applyTransition(specimen, batchedState, request.getOperator(), context));
            }

            Batch batch = batchRepository.save(Batch.builder()
                    .batchCode(batchCode)
                    .batchType(batchType)
                    .operator(request.getOperator())
                    .processingDate(request.getProcessingDate() == null ? LocalDate.now(clock) : request.getProcessingDate())
                    .status(BatchStatus.ACTIVE)
                    .totalSpecimens(specimenCodes.size())
                    .sourceBatchCode(request.getSourceBatchCode())
                    .wells(wells)
                    .createdOn(LocalDateTime.now(clock))
                    .build());

            if (request.getSourceBatchCode() != null) {
                batchLineageService.record(batchCode, request.getSourceBatchCode(), specimenCodes);
            }

            logger.info("Created {} batch {} with {} specimen(s) and {} control(s), operator {}",
                    batchType.getCode(), batchCode, specimenCodes.size(), controlPolicy.size(), request.getOperator());
            return batch;
        });
    }

    public Batch getBatch(String batchCode) {
        return batchRepository.findByBatchCode(batchCode)
                .orElseThrow(() -> new BatchNotFoundException(batchCode));
    }

    public List<Batch> getBatches(BatchType batchType) {
        return batchRepository.findByBatchType(batchType);
    }

    /**
     * Specimens of a batch in well order.
     */
    public List<Specimen> getSpecimensOfBatch(String batchCode) {
        Batch batch = getBatch(batchCode);
        List<String> specimenCodes = PlateLayout.specimenCodes(batch);
        Map<String, Specimen> byCode = new HashMap<>();
        for (String specimenCode : specimenCodes) {
            specimenRepository.findBySpecimenCode(specimenCode).ifPresent(s -> byCode.put(specimenCode, s));
        }
        return specimenCodes.stream().filter(byCode::containsKey).map(byCode::get).toList();
    }

    /**
     * Position to specimen code or control tag, ordered A1..H12.
     */
    public Map<String, String> layoutOf(String batchCode) {
        return PlateLayout.describe(getBatch(batchCode));
    }

    private static void checkDuplicates(List<String> specimenCodes) {
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new TreeSet<>();
        for (String specimenCode : specimenCodes) {
            if (!seen.add(specimenCode)) duplicates.add(specimenCode);
        }
        if (!duplicates.isEmpty()) throw new DuplicateSpecimenInRequestException(duplicates);
    }

    private Map<String, Specimen> lockSpecimens(List<String> specimenCodes) {
        Map<String, Specimen> specimens = new HashMap<>();
        for (Specimen specimen : specimenRepository.findAllBySpecimenCodeForUpdate(new TreeSet<>(specimenCodes))) {
            specimens.put(specimen.getSpecimenCode(), specimen);
        }
        String missing = CollectionUtils.subtract(specimenCodes, specimens.keySet()).stream().findFirst().orElse(null);
        if (missing != null) throw new SpecimenNotFoundException(missing);
        return specimens;
    }
}
