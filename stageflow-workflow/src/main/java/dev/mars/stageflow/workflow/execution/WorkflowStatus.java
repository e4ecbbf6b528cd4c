/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.stageflow.workflow.execution;

/**
 * Enumeration of workflow execution statuses.
 */
public enum WorkflowStatus {

    /**
     * Workflow is waiting to be picked up by the engine.
     */
    PENDING,

    /**
     * Workflow stages are being executed.
     */
    RUNNING,

    /**
     * Stage loop and end stage finished without a fatal stage failure.
     */
    COMPLETED,

    /**
     * A stage failed fatally, or the workflow was rejected before any stage ran.
     */
    FAILED,

    /**
     * Execution was interrupted.
     */
    CANCELLED;

    /**
     * Checks if the status represents a terminal state.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Checks if the status represents an active state.
     */
    public boolean isActive() {
        return this == RUNNING;
    }

    /**
     * Checks if the status represents a successful completion.
     */
    public boolean isSuccessful() {
        return this == COMPLETED;
    }
}
