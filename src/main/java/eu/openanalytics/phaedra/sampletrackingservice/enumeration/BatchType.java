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
package eu.openanalytics.phaedra.sampletrackingservice.enumeration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BatchType {

    AMPLIFICATION("amplification", WorkflowState.PCR_BATCHED, WorkflowState.PCR_COMPLETED),
    SEPARATION("separation", WorkflowState.ELECTRO_BATCHED, WorkflowState.ELECTRO_COMPLETED),
    RERUN("rerun", WorkflowState.RERUN_BATCHED, WorkflowState.PCR_COMPLETED);

    private final String code;
    private final WorkflowState batchedState;
    private final WorkflowState completedState;

    BatchType(String code, WorkflowState batchedState, WorkflowState completedState) {
        this.code = code;
        this.batchedState = batchedState;
        this.completedState = completedState;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * The state a specimen enters when it is placed on a plate of this type.
     */
    public WorkflowState getBatchedState() {
        return batchedState;
    }

    /**
     * The state a specimen enters when a batch of this type completes successfully.
     */
    public WorkflowState getCompletedState() {
        return completedState;
    }

    /**
     * Amplification and rerun batches both (re-)amplify DNA and share the amplification linkage field.
     */
    public boolean isAmplifying() {
        return this == AMPLIFICATION || this == RERUN;
    }

    @JsonCreator
    public static BatchType fromCode(String code) {
        for (BatchType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) return type;
        }
        throw new IllegalArgumentException(String.format("Unknown batch type '%s'", code));
    }
}
