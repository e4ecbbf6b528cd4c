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

import dev.mars.stageflow.workflow.definition.WorkflowDocument;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous entry point for running workflow documents.
 */
public interface WorkflowEngine {

    /**
     * Validates and runs a workflow document.
     *
     * @param document the loaded workflow document
     * @param inputs the workflow inputs
     * @param options options applied to the run and to every nested workflow
     * @return future containing the workflow execution result
     */
    CompletableFuture<WorkflowExecution> execute(WorkflowDocument document, Map<String, String> inputs,
                                                 ExecutionOptions options);

    /**
     * Validates and runs a workflow document under a caller-chosen execution id.
     *
     * @param executionId the id used for {@link #getStatus(String)} and {@link #cancel(String)}
     * @param document the loaded workflow document
     * @param inputs the workflow inputs
     * @param options options applied to the run and to every nested workflow
     * @return future containing the workflow execution result
     */
    CompletableFuture<WorkflowExecution> execute(String executionId, WorkflowDocument document,
                                                 Map<String, String> inputs, ExecutionOptions options);

    /**
     * Gets the status of a workflow execution.
     *
     * @param executionId the execution ID
     * @return the current workflow status, or null for an unknown execution
     */
    WorkflowStatus getStatus(String executionId);

    /**
     * Cancels a running workflow execution by interrupting it.
     *
     * @param executionId the execution ID
     * @return true if the workflow was still running and has been signalled
     */
    boolean cancel(String executionId);

    /**
     * Shuts down the workflow engine and cleans up resources.
     */
    void shutdown();
}
