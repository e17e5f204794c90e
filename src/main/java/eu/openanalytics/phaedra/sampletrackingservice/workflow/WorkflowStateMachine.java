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

import static eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState.*;

import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import eu.openanalytics.phaedra.sampletrackingservice.exception.IllegalTransitionException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * The single table of legal specimen state transitions. Every state change in the service is checked here.
 *
 * <ol>
 * <li>Main path: registered, sample_collected, pcr_ready, pcr_batched, pcr_completed, electro_ready,
 * electro_batched, electro_completed, analysis_ready, in_analysis, analysis_completed, report_generated, delivered</li>
 * <li>Batching shortcuts: sample_collected to pcr_batched, pcr_completed to electro_batched</li>
 * <li>Rerun branch: any non-terminal state to rerun_required, then rerun_batched, then back to pcr_completed</li>
 * <li>Any non-terminal state to failed</li>
 * </ol>
 */
@Component
public class WorkflowStateMachine {

    public static final List<WorkflowState> MAIN_PATH = List.of(
            REGISTERED, SAMPLE_COLLECTED, PCR_READY, PCR_BATCHED, PCR_COMPLETED,
            ELECTRO_READY, ELECTRO_BATCHED, ELECTRO_COMPLETED,
            ANALYSIS_READY, IN_ANALYSIS, ANALYSIS_COMPLETED, REPORT_GENERATED, DELIVERED);

    private final Map<WorkflowState, Set<WorkflowState>> transitions;

    public WorkflowStateMachine() {
        Map<WorkflowState, Set<WorkflowState>> table = new EnumMap<>(WorkflowState.class);
        for (WorkflowState state : WorkflowState.values()) {
            table.put(state, EnumSet.noneOf(WorkflowState.class));
        }

        for (int i = 0; i + 1 < MAIN_PATH.size(); i++) {
            table.get(MAIN_PATH.get(i)).add(MAIN_PATH.get(i + 1));
        }
        table.get(SAMPLE_COLLECTED).add(PCR_BATCHED);
        table.get(PCR_COMPLETED).add(ELECTRO_BATCHED);

        table.get(RERUN_REQUIRED).add(RERUN_BATCHED);
        table.get(RERUN_BATCHED).add(PCR_COMPLETED);

        for (WorkflowState state : WorkflowState.values()) {
            if (state.isTerminal()) continue;
            if (state != RERUN_REQUIRED) table.get(state).add(RERUN_REQUIRED);
            table.get(state).add(FAILED);
        }

        table.replaceAll((state, targets) -> Collections.unmodifiableSet(targets));
        this.transitions = Collections.unmodifiableMap(table);
    }

    public boolean canTransition(WorkflowState from, WorkflowState to) {
        return from != null && to != null && transitions.get(from).contains(to);
    }

    public Set<WorkflowState> allowedTargets(WorkflowState from) {
        return transitions.get(from);
    }

    public void checkTransition(String specimenCode, WorkflowState from, WorkflowState to) {
        if (!canTransition(from, to)) {
            throw new IllegalTransitionException(specimenCode, from, to);
        }
    }
}
