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

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one workflow invocation: terminal status, per-stage records, end-stage outputs
 * and the success or failure message.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 */
public class WorkflowExecution {

    private final String executionId;
    private final String workflowName;
    private final ExecutionContext context;
    private final WorkflowStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final List<StageExecution> stageExecutions;
    private final Map<String, String> outputs;
    private final String message;
    private final Throwable cause;

    public WorkflowExecution(String executionId, String workflowName, ExecutionContext context,
                             WorkflowStatus status, Instant startTime, Instant endTime,
                             List<StageExecution> stageExecutions, Map<String, String> outputs,
                             String message, Throwable cause) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflowName = Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        this.context = Objects.requireNonNull(context, "Execution context cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.endTime = endTime;
        this.stageExecutions = stageExecutions != null ? List.copyOf(stageExecutions) : List.of();
        this.outputs = outputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outputs)) : Map.of();
        this.message = message;
        this.cause = cause;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public ExecutionContext getContext() {
        return context;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public Optional<Duration> getDuration() {
        return endTime != null ? Optional.of(Duration.between(startTime, endTime)) : Optional.empty();
    }

    public List<StageExecution> getStageExecutions() {
        return stageExecutions;
    }

    public Optional<StageExecution> findStageExecution(String stageName) {
        return stageExecutions.stream()
                .filter(stage -> stage.getStageName().equalsIgnoreCase(stageName))
                .reduce((first, second) -> second);
    }

    /**
     * End-stage outputs; empty unless the workflow completed.
     */
    public Map<String, String> getOutputs() {
        return outputs;
    }

    /**
     * The end stage's result message on success, the failure reason otherwise.
     */
    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    public Optional<Path> getOutputFilePath() {
        return context.getOutputFilePath();
    }

    public boolean isSuccessful() {
        return status.isSuccessful();
    }

    public boolean isRunning() {
        return status.isActive();
    }

    public boolean isCompleted() {
        return status.isTerminal();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowExecution that = (WorkflowExecution) o;
        return Objects.equals(executionId, that.executionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId);
    }

    @Override
    public String toString() {
        return "WorkflowExecution{" +
               "executionId='" + executionId + '\'' +
               ", workflowName='" + workflowName + '\'' +
               ", status=" + status +
               ", startTime=" + startTime +
               ", endTime=" + endTime +
               ", stageCount=" + stageExecutions.size() +
               '}';
    }

    /**
     * Outcome of a single stage visit. A stage reached twice through a jump is recorded twice.
     */
    public static class StageExecution {

        public enum StageStatus {
            COMPLETED, SKIPPED, FAILED, JUMPED
        }

        private final String stageName;
        private final String kind;
        private final StageStatus status;
        private final Instant startTime;
        private final Instant endTime;
        private final Integer statusCode;
        private final int retries;
        private final String jumpTarget;
        private final String errorMessage;

        public StageExecution(String stageName, String kind, StageStatus status, Instant startTime, Instant endTime,
                              Integer statusCode, int retries, String jumpTarget, String errorMessage) {
            this.stageName = Objects.requireNonNull(stageName, "Stage name cannot be null");
            this.kind = kind;
            this.status = Objects.requireNonNull(status, "Status cannot be null");
            this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
            this.endTime = endTime;
            this.statusCode = statusCode;
            this.retries = retries;
            this.jumpTarget = jumpTarget;
            this.errorMessage = errorMessage;
        }

        public static StageExecution skipped(String stageName, String kind, Instant at) {
            return new StageExecution(stageName, kind, StageStatus.SKIPPED, at, at, null, 0, null, null);
        }

        public String getStageName() {
            return stageName;
        }

        public String getKind() {
            return kind;
        }

        public StageStatus getStatus() {
            return status;
        }

        public Instant getStartTime() {
            return startTime;
        }

        public Optional<Instant> getEndTime() {
            return Optional.ofNullable(endTime);
        }

        public Optional<Duration> getDuration() {
            return endTime != null ? Optional.of(Duration.between(startTime, endTime)) : Optional.empty();
        }

        public Optional<Integer> getStatusCode() {
            return Optional.ofNullable(statusCode);
        }

        public int getRetries() {
            return retries;
        }

        public Optional<String> getJumpTarget() {
            return Optional.ofNullable(jumpTarget);
        }

        public Optional<String> getErrorMessage() {
            return Optional.ofNullable(errorMessage);
        }

        @Override
        public String toString() {
            return "StageExecution{" +
                   "stageName='" + stageName + '\'' +
                   ", status=" + status +
                   ", statusCode=" + statusCode +
                   ", retries=" + retries +
                   '}';
        }
    }
}
