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


package dev.mars.stageflow.workflow.plugin.workflow;

import dev.mars.stageflow.core.exceptions.StageFailureException;
import dev.mars.stageflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.stageflow.workflow.definition.WorkflowDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowDocument;
import dev.mars.stageflow.workflow.definition.WorkflowStageDefinition;
import dev.mars.stageflow.workflow.execution.ExecutionContext;
import dev.mars.stageflow.workflow.execution.ExecutionOptions;
import dev.mars.stageflow.workflow.execution.WorkflowExecution;
import dev.mars.stageflow.workflow.execution.WorkflowStatus;
import dev.mars.stageflow.workflow.loader.YamlWorkflowLoader;
import dev.mars.stageflow.workflow.plugin.NestedWorkflowRunner;
import dev.mars.stageflow.workflow.plugin.StageExecutionContext;
import dev.mars.stageflow.workflow.plugin.StageOutcome;
import dev.mars.stageflow.workflow.plugin.StageServices;
import dev.mars.stageflow.workflow.plugin.StageValidationContext;
import dev.mars.stageflow.workflow.plugin.http.MockPayloadService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for stages that run another workflow.
 */
class WorkflowStagePluginTest {

    private static final String CHILD_WORKFLOW = """
            version: "1.0"
            name: Notify
            input:
              - name: orderId
              - name: channel
                required: false
            stages: []
            """;

    @TempDir
    Path tempDir;

    private WorkflowStagePlugin plugin;
    private WorkflowDocument parent;
    private ExecutionContext context;
    private AtomicReference<ExecutionContext> childContext;
    private WorkflowStatus childStatus;

    @BeforeEach
    void setUp() throws Exception {
        Files.writeString(tempDir.resolve("notify.yaml"), CHILD_WORKFLOW);
        plugin = new WorkflowStagePlugin(StageServices.builder().workflowLoader(new YamlWorkflowLoader()).build());

        WorkflowDefinition definition = WorkflowDefinition.builder("Orders")
                .version("1.0")
                .references(new WorkflowDefinition.References(
                        List.of(new WorkflowDefinition.WorkflowReference("notify", "notify.yaml")), List.of(), null))
                .build();
        parent = new WorkflowDocument(definition, tempDir.resolve("orders.yaml"), Map.of("region", "eu"));
        context = new ExecutionContext(Map.of("orderId", "o-7"), Map.of("region", "eu"));
        context.getContext().put("traceId", "t-1");
        childContext = new AtomicReference<>();
        childStatus = WorkflowStatus.COMPLETED;
    }

    // ========== Execution Tests ==========

    @Test
    void testRunsChildWithResolvedInputsAndCollectsOutput() throws Exception {
        WorkflowStageDefinition stage = stage().build();

        StageOutcome outcome = plugin.execute(stage, stageContext(ExecutionOptions.builder().build()));

        assertTrue(outcome.getJumpTarget().isEmpty());
        ExecutionContext child = childContext.get();
        assertEquals("o-7", child.getInputs().get("orderId"));
        assertEquals("t-1", child.getContext().get("traceId"));
        assertEquals(1, child.getIndentLevel());

        assertEquals("sent", context.getWorkflowOutputs().get("SendNotice").get("status"));
        assertEquals("Ok", context.getWorkflowResults().get("SendNotice").get(ExecutionContext.RESULT_STATUS));
        assertEquals("notified", context.getWorkflowResults().get("SendNotice").get(ExecutionContext.RESULT_MESSAGE));
    }

    @Test
    void testChildFailureIsRecordedThenRaised() throws Exception {
        childStatus = WorkflowStatus.FAILED;

        StageFailureException exception = assertThrows(StageFailureException.class,
                () -> plugin.execute(stage().build(), stageContext(ExecutionOptions.builder().build())));

        assertEquals("SendNotice", exception.getStageName());
        Map<String, String> result = context.getWorkflowResults().get("SendNotice");
        assertEquals("Error", result.get(ExecutionContext.RESULT_STATUS));
        assertEquals(exception.getMessage(), result.get(ExecutionContext.RESULT_MESSAGE));
        assertTrue(context.getWorkflowOutputs().containsKey("SendNotice"));
        assertTrue(plugin.getCapabilities().continueOnError());
    }

    @Test
    void testMockedStageUsesMockOutput() throws Exception {
        WorkflowStageDefinition stage = stage()
                .mock(new WorkflowStageDefinition.Mock(null, null, null, Map.of("status", "mocked {{input.orderId}}")))
                .build();

        plugin.execute(stage, stageContext(ExecutionOptions.builder().mocked(true).build()));

        assertNull(childContext.get());
        assertEquals("mocked o-7", context.getWorkflowOutputs().get("SendNotice").get("status"));
        assertEquals("Ok", context.getWorkflowResults().get("SendNotice").get(ExecutionContext.RESULT_STATUS));
    }

    @Test
    void testMockedStageWithoutOutputIsRejected() {
        WorkflowStageDefinition stage = stage()
                .mock(new WorkflowStageDefinition.Mock(200, null, null, null))
                .build();

        assertThrows(WorkflowConfigurationException.class,
                () -> plugin.execute(stage, stageContext(ExecutionOptions.builder().mocked(true).build())));
    }

    @Test
    void testAutoVarsFileSuppliesInputsWhenStageHasNone() throws Exception {
        Files.writeString(tempDir.resolve("notify.wfvars"), "global:\n  orderId: from-vars\n");
        WorkflowStageDefinition stage = WorkflowStageDefinition.builder("SendNotice", "Workflow")
                .workflowRef("notify")
                .build();

        plugin.execute(stage, stageContext(ExecutionOptions.builder().build()));

        assertEquals("from-vars", childContext.get().getInputs().get("orderId"));
    }

    @Test
    void testVarsOverrideSuppressesAutoVarsFile() throws Exception {
        Files.writeString(tempDir.resolve("notify.wfvars"), "global:\n  orderId: from-vars\n");
        WorkflowStageDefinition stage = WorkflowStageDefinition.builder("SendNotice", "Workflow")
                .workflowRef("notify")
                .build();

        plugin.execute(stage, stageContext(ExecutionOptions.builder().varsOverrideActive(true).build()));

        assertTrue(childContext.get().getInputs().isEmpty());
    }

    @Test
    void testUnknownReferenceIsConfigurationError() {
        WorkflowStageDefinition stage = WorkflowStageDefinition.builder("SendNotice", "Workflow")
                .workflowRef("billing")
                .build();

        WorkflowConfigurationException exception = assertThrows(WorkflowConfigurationException.class,
                () -> plugin.execute(stage, stageContext(ExecutionOptions.builder().build())));
        assertEquals("Workflow reference 'billing' was not found.", exception.getMessage());
    }

    // ========== Validation Tests ==========

    @Test
    void testValidStageHasNoErrors() {
        assertEquals(List.of(), validate(stage().build()));
    }

    @Test
    void testMissingAndUnknownInputsAreReported() {
        List<String> errors = validate(WorkflowStageDefinition.builder("SendNotice", "Workflow")
                .workflowRef("notify")
                .inputs(Map.of("orderRef", "x"))
                .build());

        assertEquals(List.of(
                "Stage 'SendNotice' is missing required input 'orderId' for workflow 'Notify'.",
                "Stage 'SendNotice' provides unknown input 'orderRef' for workflow 'Notify'."), errors);
    }

    @Test
    void testVersionMismatchNeedsAllowVersion() throws Exception {
        Files.writeString(tempDir.resolve("notify.yaml"), CHILD_WORKFLOW.replace("\"1.0\"", "\"2.0\""));

        assertEquals(List.of("Stage 'SendNotice' references workflow version '2.0' which differs from parent version '1.0'."),
                validate(stage().build()));
        assertEquals(List.of(), validate(stage().allowVersion("2.0").build()));
    }

    @Test
    void testResilienceSettingsAreRejected() {
        List<String> errors = validate(stage()
                .retry(new WorkflowStageDefinition.Retry(null, 1, 10, List.of(503), null))
                .build());

        assertTrue(errors.contains("Stage 'SendNotice' retry is only supported for endpoint stages."));
    }

    @Test
    void testUndeclaredReferenceIsReported() {
        List<String> errors = validate(WorkflowStageDefinition.builder("SendNotice", "Workflow")
                .workflowRef("billing")
                .build());

        assertEquals(List.of("Stage 'SendNotice' workflowRef 'billing' is not declared in references."), errors);
    }

    @Test
    void testMissingReferencedFileIsReported() throws Exception {
        Files.delete(tempDir.resolve("notify.yaml"));

        List<String> errors = validate(stage().build());

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("Referenced workflow 'notify' was not found at"));
    }

    private WorkflowStageDefinition.Builder stage() {
        return WorkflowStageDefinition.builder("SendNotice", "Workflow")
                .workflowRef("notify")
                .inputs(Map.of("orderId", "{{input.orderId}}"));
    }

    private StageExecutionContext stageContext(ExecutionOptions options) {
        NestedWorkflowRunner runner = (document, nested) -> {
            childContext.set(nested);
            nested.putWorkflowOutput(document.getDefinition().getName(), Map.of("status", "sent"));
            Instant now = Instant.now();
            return new WorkflowExecution("child-1", document.getDefinition().getName(), nested, childStatus,
                    now, now, List.of(), Map.of(), "notified", null);
        };
        return new StageExecutionContext(parent, context, options, runner);
    }

    private List<String> validate(WorkflowStageDefinition stage) {
        List<String> errors = new ArrayList<>();
        plugin.validate(stage, new StageValidationContext(parent, new YamlWorkflowLoader(), new MockPayloadService()),
                errors);
        return errors;
    }
}
