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

import dev.mars.stageflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.stageflow.workflow.definition.WorkflowDocument;
import dev.mars.stageflow.workflow.validation.ValidationResult;
import dev.mars.stageflow.workflow.validation.WorkflowValidator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs workflows on a cached thread pool, one thread per root workflow.
 * Each document is validated first; an invalid document completes as a failed execution without running
 * any stage. Cancellation interrupts the worker thread, which the executor reports as CANCELLED.
 * Statuses of finished executions are kept for the most recent {@value #DEFAULT_STATUS_RETENTION} runs only.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 */
public class SimpleWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = Logger.getLogger(SimpleWorkflowEngine.class.getName());

    static final int DEFAULT_STATUS_RETENTION = 1000;

    private final WorkflowExecutor executor;
    private final WorkflowValidator validator;
    private final ExecutorService executorService;
    private final Map<String, FutureTask<WorkflowExecution>> activeExecutions;
    private final Map<String, WorkflowStatus> statuses;
    private final Map<String, WorkflowStatus> finishedStatuses;
    private volatile boolean shutdown = false;

    public SimpleWorkflowEngine(WorkflowExecutor executor) {
        this(executor, new WorkflowValidator(executor.getRegistry(), executor.getServices()));
    }

    public SimpleWorkflowEngine(WorkflowExecutor executor, WorkflowValidator validator) {
        this(executor, validator, DEFAULT_STATUS_RETENTION);
    }

    SimpleWorkflowEngine(WorkflowExecutor executor, WorkflowValidator validator, int statusRetention) {
        if (statusRetention < 1) {
            throw new IllegalArgumentException("Status retention must be at least 1");
        }
        this.executor = Objects.requireNonNull(executor, "Workflow executor cannot be null");
        this.validator = Objects.requireNonNull(validator, "Workflow validator cannot be null");
        this.executorService = Executors.newCachedThreadPool();
        this.activeExecutions = new ConcurrentHashMap<>();
        this.statuses = new ConcurrentHashMap<>();
        this.finishedStatuses = Collections.synchronizedMap(new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, WorkflowStatus> eldest) {
                return size() > statusRetention;
            }
        });
    }

    @Override
    public CompletableFuture<WorkflowExecution> execute(WorkflowDocument document, Map<String, String> inputs,
                                                        ExecutionOptions options) {
        return execute(UUID.randomUUID().toString(), document, inputs, options);
    }

    @Override
    public CompletableFuture<WorkflowExecution> execute(String executionId, WorkflowDocument document,
                                                        Map<String, String> inputs, ExecutionOptions options) {
        if (shutdown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }
        Objects.requireNonNull(executionId, "Execution id cannot be null");
        Objects.requireNonNull(document, "Workflow document cannot be null");
        Objects.requireNonNull(options, "Execution options cannot be null");

        ExecutionContext context = new ExecutionContext(inputs, document.getEnvironmentVariables());
        CompletableFuture<WorkflowExecution> result = new CompletableFuture<>();
        FutureTask<WorkflowExecution> task = new FutureTask<>(() -> runWorkflow(executionId, document, context, options)) {
            @Override
            protected void done() {
                if (isCancelled()) {
                    finish(executionId, WorkflowStatus.CANCELLED);
                    result.complete(cancelledExecution(executionId, document, context));
                    return;
                }
                try {
                    WorkflowExecution execution = get();
                    finish(executionId, execution.getStatus());
                    result.complete(execution);
                } catch (Exception e) {
                    finish(executionId, WorkflowStatus.FAILED);
                    result.completeExceptionally(e.getCause() != null ? e.getCause() : e);
                }
            }
        };

        if (activeExecutions.putIfAbsent(executionId, task) != null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Workflow execution already running: " + executionId));
        }
        finishedStatuses.remove(executionId);
        statuses.put(executionId, WorkflowStatus.PENDING);
        executorService.execute(task);
        return result;
    }

    @Override
    public WorkflowStatus getStatus(String executionId) {
        WorkflowStatus status = statuses.get(executionId);
        return status != null ? status : finishedStatuses.get(executionId);
    }

    @Override
    public boolean cancel(String executionId) {
        FutureTask<WorkflowExecution> task = activeExecutions.get(executionId);
        if (task == null || task.isDone()) {
            return false;
        }
        logger.info("Cancelling workflow execution: " + executionId);
        return task.cancel(true);
    }

    @Override
    public void shutdown() {
        shutdown = true;
        executorService.shutdownNow();
        logger.info("SimpleWorkflowEngine shutdown initiated");
    }

    private WorkflowExecution runWorkflow(String executionId, WorkflowDocument document, ExecutionContext context,
                                          ExecutionOptions options) {
        // No-op when the task was cancelled before it got here
        statuses.replace(executionId, WorkflowStatus.PENDING, WorkflowStatus.RUNNING);
        String name = document.getDefinition().getName();

        ValidationResult validation = validator.validate(document);
        validation.getWarnings().forEach(warning -> logger.warning(name + ": " + warning.getMessage()));
        if (!validation.isValid()) {
            WorkflowConfigurationException error = new WorkflowConfigurationException(validation.getErrorMessages());
            // Log without stack trace for cleaner output
            logger.log(Level.SEVERE, "Workflow validation failed: " + executionId + " - " + error.getMessage());
            Instant now = Instant.now();
            return new WorkflowExecution(executionId, name, context, WorkflowStatus.FAILED, now, now, List.of(),
                    Map.of(), "Workflow validation failed: " + error.getMessage(), error);
        }

        WorkflowExecution execution = executor.execute(document, context, options, executionId);
        logger.info("Workflow execution completed: " + executionId + " with status: " + execution.getStatus());
        return execution;
    }

    private void finish(String executionId, WorkflowStatus status) {
        finishedStatuses.put(executionId, status);
        statuses.remove(executionId);
        activeExecutions.remove(executionId);
    }

    private static WorkflowExecution cancelledExecution(String executionId, WorkflowDocument document,
                                                        ExecutionContext context) {
        Instant now = Instant.now();
        return new WorkflowExecution(executionId, document.getDefinition().getName(), context,
                WorkflowStatus.CANCELLED, now, now, List.of(), Map.of(), "Workflow execution was cancelled.", null);
    }
}
