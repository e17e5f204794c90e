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
package eu.openanalytics.phaedra.sampletrackingservice.workflow;

import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import eu.openanalytics.phaedra.sampletrackingservice.exception.IllegalTransitionException;
import eu.openanalytics.phaedra.sampletrackingservice.exception.SpecimenNotFoundException;
import eu.openanalytics.phaedra.sampletrackingservice.model.Specimen;
import eu.openanalytics.phaedra.sampletrackingservice.model.WorkflowEvent;
import eu.openanalytics.phaedra.sampletrackingservice.repository.SpecimenRepository;
import eu.openanalytics.phaedra.sampletrackingservice.repository.WorkflowEventRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

@Service
public class WorkflowService {

    public static final String SYSTEM_USER = "system";

    private final SpecimenRepository specimenRepository;
    private final WorkflowEventRepository workflowEventRepository;
    private final WorkflowStateMachine stateMachine;
    private final TransactionOperations transactionOperations;
    private final Clock clock;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    public WorkflowService(SpecimenRepository specimenRepository, WorkflowEventRepository workflowEventRepository,
            WorkflowStateMachine stateMachine, TransactionOperations transactionOperations, Clock clock) {
        this.specimenRepository = specimenRepository;
        this.workflowEventRepository = workflowEventRepository;
        this.stateMachine = stateMachine;
        this.transactionOperations = transactionOperations;
        this.clock = clock;
    }

    public Specimen transition(String specimenCode, WorkflowState targetState) {
        return transition(specimenCode, targetState, SYSTEM_USER, null);
    }

    /**
     * Moves one specimen to {@code targetState}. The specimen row is locked for the duration of the change,
     * so concurrent transitions of the same specimen are applied one after the other.
     */
    public Specimen transition(String specimenCode, WorkflowState targetState, String changedBy, String context) {
        return transactionOperations.execute(status -> {
            Specimen specimen = specimenRepository.findBySpecimenCodeForUpdate(specimenCode)
                    .orElseThrow(() -> new SpecimenNotFoundException(specimenCode));
            return specimenRepository.save(applyTransition(specimen, targetState, changedBy, context));
        });
    }

    /**
     * Moves every specimen independently. A missing specimen or an illegal transition is reported in the
     * result list (one entry per input code, in input order) and does not affect the other specimens.
     */
    public List<TransitionResult> transitionMany(List<String> specimenCodes, WorkflowState targetState) {
        return transitionMany(specimenCodes, targetState, SYSTEM_USER, null);
    }

    public List<TransitionResult> transitionMany(List<String> specimenCodes, WorkflowState targetState, String changedBy, String context) {
        List<TransitionResult> results = new ArrayList<>(specimenCodes.size());
        for (String specimenCode : specimenCodes) {
            TransitionResult result = transactionOperations.execute(status -> tryTransition(specimenCode, targetState, changedBy, context));
            if (!result.isSuccess()) {
                logger.warn("Specimen {} not moved to {}: {}", specimenCode, targetState.getCode(), result.getMessage());
            }
            results.add(result);
        }
        return results;
    }

    /**
     * Validates and applies a transition on a specimen the caller has already loaded (and locked),
     * and records the workflow event. The returned specimen still has to be saved by the caller.
     */
    public Specimen applyTransition(Specimen specimen, WorkflowState targetState, String changedBy, String context) {
        WorkflowState currentState = specimen.getWorkflowState();
        stateMachine.checkTransition(specimen.getSpecimenCode(), currentState, targetState);

        LocalDateTime now = LocalDateTime.now(clock);
        workflowEventRepository.save(WorkflowEvent.builder()
                .specimenCode(specimen.getSpecimenCode())
                .fromState(currentState)
                .toState(targetState)
                .changedBy(changedBy == null ? SYSTEM_USER : changedBy)
                .context(context)
                .changedOn(now)
                .build());
        logger.debug("Specimen {}: {} -> {}", specimen.getSpecimenCode(), currentState.getCode(), targetState.getCode());

        return specimen.withWorkflowState(targetState).withUpdatedOn(now);
    }

    public List<WorkflowEvent> getHistory(String specimenCode) {
        if (specimenRepository.findBySpecimenCode(specimenCode).isEmpty()) {
            throw new SpecimenNotFoundException(specimenCode);
        }
        return workflowEventRepository.findBySpecimenCodeOrderByIdAsc(specimenCode);
    }

    private TransitionResult tryTransition(String specimenCode, WorkflowState targetState, String changedBy, String context) {
        Optional<Specimen> specimen = specimenRepository.findBySpecimenCodeForUpdate(specimenCode);
        if (specimen.isEmpty()) {
            return TransitionResult.notFound(specimenCode, new SpecimenNotFoundException(specimenCode).getMessage());
        }
        WorkflowState currentState = specimen.get().getWorkflowState();
        if (!stateMachine.canTransition(currentState, targetState)) {
            return TransitionResult.illegal(specimenCode, currentState,
                    new IllegalTransitionException(specimenCode, currentState, targetState).getMessage());
        }
        Specimen updated = specimenRepository.save(applyTransition(specimen.get(), targetState, changedBy, context));
        return TransitionResult.success(specimenCode, updated.getWorkflowState());
    }
}
