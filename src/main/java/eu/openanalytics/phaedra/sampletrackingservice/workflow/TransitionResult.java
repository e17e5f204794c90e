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

import eu.openanalytics.phaedra.sampletrackingservice.enumeration.TransitionOutcome;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one item of a bulk transition.
 */
@Value
@AllArgsConstructor
public class TransitionResult {
    String specimenCode;
    TransitionOutcome outcome;
    WorkflowState workflowState;
    String message;

    public static TransitionResult success(String specimenCode, WorkflowState workflowState) {
        return new TransitionResult(specimenCode, TransitionOutcome.SUCCESS, workflowState, null);
    }

    public static TransitionResult notFound(String specimenCode, String message) {
        return new TransitionResult(specimenCode, TransitionOutcome.NOT_FOUND, null, message);
    }

    public static TransitionResult illegal(String specimenCode, WorkflowState currentState, String message) {
        return new TransitionResult(specimenCode, TransitionOutcome.ILLEGAL_TRANSITION, currentState, message);
    }

    public boolean isSuccess() {
        return outcome == TransitionOutcome.SUCCESS;
    }
}
