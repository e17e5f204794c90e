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
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import eu.openanalytics.phaedra.sampletrackingservice.exception.BatchNotActiveException;
import eu.openanalytics.phaedra.sampletrackingservice.exception.BatchNotFoundException;
import eu.openanalytics.phaedra.sampletrackingservice.model.Batch;
import eu.openanalytics.phaedra.sampletrackingservice.repository.BatchRepository;
import eu.openanalytics.phaedra.sampletrackingservice.workflow.TransitionResult;
import eu.openanalytics.phaedra.sampletrackingservice.workflow.WorkflowService;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.collections4.CollectionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

@Service
public class BatchCompletionService {

    private final BatchRepository batchRepository;
    private final WorkflowService workflowService;
    private final TransactionOperations transactionOperations;
    private final Clock clock;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    public BatchCompletionService(BatchRepository batchRepository, WorkflowService workflowService,
            TransactionOperations transactionOperations, Clock clock) {
        this.batchRepository = batchRepository;
        this.workflowService = workflowService;
        this.transactionOperations = transactionOperations;
        this.clock = clock;
    }

    /**
     * Closes an active batch. Specimens listed as failed, or every specimen when the whole batch failed,
     * are sent to {@code rerun_required}; the others move to the completed state of the batch type.
     *
     * @return one result per specimen of the batch, in well order
     */
    public List<TransitionResult> complete(String batchCode, BatchOutcome outcome, Collection<String> failedSpecimenCodes) {
        return transactionOperations.execute(status -> {
            Batch batch = batchRepository.findByBatchCodeForUpdate(batchCode)
                    .orElseThrow(() -> new BatchNotFoundException(batchCode));
            if (batch.getStatus() != BatchStatus.ACTIVE) {
                throw new BatchNotActiveException(batchCode, batch.getStatus());
            }

            List<String> specimenCodes = PlateLayout.specimenCodes(batch);
            Set<String> failed = failedSpecimenCodes == null ? Set.of() : new HashSet<>(failedSpecimenCodes);
            Collection<String> unknown = CollectionUtils.subtract(failed, specimenCodes);
            if (!unknown.isEmpty()) {
                throw new IllegalArgumentException(String.format("Specimens %s are not part of batch %s", unknown, batchCode));
            }

            boolean batchFailed = outcome == BatchOutcome.FAILED;
            batchRepository.save(batch
                    .withStatus(batchFailed ? BatchStatus.FAILED : BatchStatus.COMPLETED)
                    .withCompletedOn(LocalDateTime.now(clock)));

            String context = String.format("completion of batch %s", batchCode);
            List<TransitionResult> results = new ArrayList<>(specimenCodes.size());
            for (String specimenCode : specimenCodes) {
                WorkflowState target = batchFailed || failed.contains(specimenCode)
                        ? WorkflowState.RERUN_REQUIRED
                        : batch.getBatchType().getCompletedState();
                results.addAll(workflowService.transitionMany(List.of(specimenCode), target, batch.getOperator(), context));
            }

            long rerun = results.stream().filter(r -> r.isSuccess() && r.getWorkflowState() == WorkflowState.RERUN_REQUIRED).count();
            logger.info("Batch {} closed as {}: {} specimen(s), {} sent to rerun", batchCode, outcome, specimenCodes.size(), rerun);
            return results;
        });
    }
}
