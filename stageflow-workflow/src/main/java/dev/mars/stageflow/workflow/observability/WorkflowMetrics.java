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

package dev.mars.stageflow.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the Stageflow engine. Without an SDK registered the global
 * meter is a no-op, so recording is always safe.
 *
 * Provides:
 * - stageflow.workflow.active (gauge) - Currently running workflow invocations
 * - stageflow.workflow.total / completed / failed / cancelled (counters)
 * - stageflow.workflow.duration.seconds (histogram)
 * - stageflow.stage.total / failed / skipped (counters)
 * - stageflow.stage.duration.seconds (histogram)
 * - stageflow.stage.retries (counter)
 * - stageflow.circuit.opened / blocked (counters)
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0 (OpenTelemetry)
 */
public class WorkflowMetrics {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    private static final String METER_NAME = "stageflow-workflow";

    private static WorkflowMetrics instance;

    // Counters
    private final LongCounter workflowsTotal;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsCancelled;
    private final LongCounter stagesTotal;
    private final LongCounter stagesFailed;
    private final LongCounter stagesSkipped;
    private final LongCounter stageRetries;
    private final LongCounter circuitOpened;
    private final LongCounter circuitBlocked;

    // Histograms
    private final DoubleHistogram workflowDuration;
    private final DoubleHistogram stageDuration;

    private final AtomicLong activeWorkflows = new AtomicLong(0);

    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> EXECUTION_MODE_KEY = AttributeKey.stringKey("execution.mode");
    private static final AttributeKey<String> STAGE_KIND_KEY = AttributeKey.stringKey("stage.kind");
    private static final AttributeKey<String> BREAKER_NAME_KEY = AttributeKey.stringKey("circuit.name");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    private WorkflowMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        workflowsTotal = counter(meter, "stageflow.workflow.total", "Total number of workflow invocations started");
        workflowsCompleted = counter(meter, "stageflow.workflow.completed", "Number of completed workflow invocations");
        workflowsFailed = counter(meter, "stageflow.workflow.failed", "Number of failed workflow invocations");
        workflowsCancelled = counter(meter, "stageflow.workflow.cancelled", "Number of cancelled workflow invocations");
        stagesTotal = counter(meter, "stageflow.stage.total", "Total number of stages executed");
        stagesFailed = counter(meter, "stageflow.stage.failed", "Number of failed stages");
        stagesSkipped = counter(meter, "stageflow.stage.skipped", "Number of stages skipped by runIf");
        stageRetries = counter(meter, "stageflow.stage.retries", "Number of endpoint call retries");
        circuitOpened = counter(meter, "stageflow.circuit.opened", "Number of circuit breaker openings");
        circuitBlocked = counter(meter, "stageflow.circuit.blocked", "Number of calls rejected by an open circuit");

        workflowDuration = meter.histogramBuilder("stageflow.workflow.duration.seconds")
                .setDescription("Workflow duration in seconds")
                .setUnit("s")
                .build();

        stageDuration = meter.histogramBuilder("stageflow.stage.duration.seconds")
                .setDescription("Stage duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("stageflow.workflow.active")
                .setDescription("Number of currently running workflow invocations")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.info("WorkflowMetrics initialized");
    }

    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics();
        }
        return instance;
    }

    public void recordWorkflowStarted(String workflowName, String executionMode) {
        workflowsTotal.add(1, workflowAttributes(workflowName, executionMode));
        activeWorkflows.incrementAndGet();
    }

    public void recordWorkflowCompleted(String workflowName, String executionMode, double durationSeconds) {
        Attributes attrs = workflowAttributes(workflowName, executionMode);
        workflowsCompleted.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
    }

    public void recordWorkflowFailed(String workflowName, String executionMode, String failureReason) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(EXECUTION_MODE_KEY, executionMode)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();
        workflowsFailed.add(1, attrs);
    }

    public void recordWorkflowCancelled(String workflowName, String executionMode) {
        workflowsCancelled.add(1, workflowAttributes(workflowName, executionMode));
    }

    /**
     * Leaves the active gauge. Called once for every {@link #recordWorkflowStarted}, whatever the outcome.
     */
    public void recordWorkflowFinished() {
        activeWorkflows.decrementAndGet();
    }

    public void recordStageExecuted(String workflowName, String stageKind, double durationSeconds) {
        Attributes attrs = stageAttributes(workflowName, stageKind);
        stagesTotal.add(1, attrs);
        stageDuration.record(durationSeconds, attrs);
    }

    public void recordStageFailed(String workflowName, String stageKind, String failureReason) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(STAGE_KIND_KEY, stageKind)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();
        stagesFailed.add(1, attrs);
    }

    public void recordStageSkipped(String workflowName, String stageKind) {
        stagesSkipped.add(1, stageAttributes(workflowName, stageKind));
    }

    public void recordRetry(String workflowName, String stageKind) {
        stageRetries.add(1, stageAttributes(workflowName, stageKind));
    }

    public void recordCircuitOpened(String breakerName) {
        circuitOpened.add(1, Attributes.of(BREAKER_NAME_KEY, breakerName));
    }

    public void recordCircuitBlocked(String breakerName) {
        circuitBlocked.add(1, Attributes.of(BREAKER_NAME_KEY, breakerName));
    }

    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }

    private static LongCounter counter(Meter meter, String name, String description) {
        return meter.counterBuilder(name)
                .setDescription(description)
                .setUnit("1")
                .build();
    }

    private static Attributes workflowAttributes(String workflowName, String executionMode) {
        return Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(EXECUTION_MODE_KEY, executionMode)
                .build();
    }

    private static Attributes stageAttributes(String workflowName, String stageKind) {
        return Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(STAGE_KIND_KEY, stageKind)
                .build();
    }
}
