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

import dev.mars.stageflow.core.exceptions.SelfJumpException;
import dev.mars.stageflow.core.exceptions.StageFailureException;
import dev.mars.stageflow.http.EndpointInvoker;
import dev.mars.stageflow.http.EndpointRequest;
import dev.mars.stageflow.http.EndpointResponse;
import dev.mars.stageflow.workflow.definition.ApiCatalogVersion;
import dev.mars.stageflow.workflow.definition.ApiDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowDocument;
import dev.mars.stageflow.workflow.execution.WorkflowExecution.StageExecution;
import dev.mars.stageflow.workflow.loader.YamlWorkflowLoader;
import dev.mars.stageflow.workflow.observability.WorkflowMetrics;
import dev.mars.stageflow.workflow.output.WorkflowOutputWriter;
import dev.mars.stageflow.workflow.plugin.StageServices;
import dev.mars.stageflow.workflow.resilience.RetryExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the synchronous stage loop: bindings, skips, jumps, failures and nested workflows.
 */
class WorkflowExecutorTest {

    private static final String ORDER_WORKFLOW = """
            version: "1"
            id: wf-orders
            name: Orders
            references:
              apis:
                - name: ordersApi
                  definition: Orders
            input:
              - name: customerId
              - name: notify
                required: false
            initStage:
              variables:
                - name: channel
                  type: Fixed
                  value: "web-{{input.customerId}}"
              context:
                tenant: acme
            stages:
              - name: Create
                kind: Endpoint
                apiRef: ordersApi
                endpoint: "/customers/{{input.customerId}}/orders"
                httpVerb: POST
                expectedStatus: 201
                headers:
                  X-Channel: "{{global.channel}}"
                output:
                  orderId: "{{response.id}}"
                jumpOnStatus:
                  409: endStage
                set:
                  orderId: "{{stage:Create.output.orderId}}"
                context:
                  lastStage: Create
              - name: Notify
                kind: Endpoint
                apiRef: ordersApi
                endpoint: "/orders/{{global.orderId}}/notify"
                httpVerb: POST
                expectedStatus: 202
                runIf: "{{input.notify}} == 'yes'"
              - name: Confirm
                kind: Endpoint
                apiRef: ordersApi
                endpoint: "/orders/{{global.orderId}}/confirm"
                httpVerb: POST
                expectedStatus: 200
                context:
                  lastStage: Confirm
            endStage:
              output:
                orderId: "{{global.orderId}}"
              context:
                outcome: done
              contextOnFailure: true
              result:
                message: "Order {{global.orderId}} confirmed"
            """;

    @Mock
    private EndpointInvoker endpointInvoker;

    @TempDir
    Path tempDir;

    private final List<Long> sleeps = new ArrayList<>();
    private final YamlWorkflowLoader loader = new YamlWorkflowLoader();
    private final Clock clock = Clock.fixed(Instant.parse("2025-08-18T10:15:30Z"), ZoneOffset.UTC);

    private WorkflowExecutor executor;
    private ExecutionOptions options;

    @BeforeEach
    void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        executor = createExecutor(null, millis -> sleeps.add(millis));

        ApiCatalogVersion catalog = new ApiCatalogVersion("2025.1", Map.of("dev", "https://api.test"),
                List.of(new ApiDefinition("Orders", null, "/orders/v1")));
        options = ExecutionOptions.builder().environment("dev").catalogVersion(catalog).build();
    }

    @AfterEach
    void tearDown() {
        // Clear any interrupt left by the cancellation test
        Thread.interrupted();
    }

    // ========== Stage Loop Tests ==========

    @Test
    void testStagesRunInOrderWithBindings() throws Exception {
        when(endpointInvoker.invoke(any())).thenReturn(
                new EndpointResponse(201, "{\"id\":\"o-1\"}", Map.of()),
                new EndpointResponse(200, "{}", Map.of()));

        WorkflowExecution execution = executor.execute(document(ORDER_WORKFLOW), Map.of("customerId", "c-1"), options);

        assertEquals(WorkflowStatus.COMPLETED, execution.getStatus(), execution.getMessage().orElse(""));
        assertEquals(Map.of("orderId", "o-1"), execution.getOutputs());
        assertEquals(Optional.of("Order o-1 confirmed"), execution.getMessage());

        ArgumentCaptor<EndpointRequest> requests = ArgumentCaptor.forClass(EndpointRequest.class);
        verify(endpointInvoker, times(2)).invoke(requests.capture());
        assertEquals("https://api.test/orders/v1/customers/c-1/orders", requests.getAllValues().get(0).getUrl());
        assertEquals("web-c-1", requests.getAllValues().get(0).getHeaders().get("X-Channel"));
        assertEquals("https://api.test/orders/v1/orders/o-1/confirm", requests.getAllValues().get(1).getUrl());

        ExecutionContext context = execution.getContext();
        assertEquals("acme", context.getContext().get("tenant"));
        assertEquals("Confirm", context.getContext().get("lastStage"));
        assertEquals("done", context.getContext().get("outcome"));
        assertEquals("Ok", context.getWorkflowResults().get("Orders").get(ExecutionContext.RESULT_STATUS));
    }

    @Test
    void testRunIfFalseSkipsStage() throws Exception {
        when(endpointInvoker.invoke(any())).thenReturn(
                new EndpointResponse(201, "{\"id\":\"o-1\"}", Map.of()),
                new EndpointResponse(200, "{}", Map.of()));

        WorkflowExecution execution = executor.execute(document(ORDER_WORKFLOW),
                Map.of("customerId", "c-1", "notify", "no"), options);

        assertEquals(WorkflowStatus.COMPLETED, execution.getStatus());
        assertEquals(StageExecution.StageStatus.SKIPPED, execution.findStageExecution("Notify").get().getStatus());
        verify(endpointInvoker, times(2)).invoke(any());
    }

    @Test
    void testRunIfTrueRunsStage() throws Exception {
        when(endpointInvoker.invoke(any())).thenReturn(
                new EndpointResponse(201, "{\"id\":\"o-1\"}", Map.of()),
                new EndpointResponse(202, "{}", Map.of()),
                new EndpointResponse(200, "{}", Map.of()));

        WorkflowExecution execution = executor.execute(document(ORDER_WORKFLOW),
                Map.of("customerId", "c-1", "notify", "yes"), options);

        assertEquals(WorkflowStatus.COMPLETED, execution.getStatus());
        assertEquals(StageExecution.StageStatus.COMPLETED, execution.findStageExecution("Notify").get().getStatus());
        verify(endpointInvoker, times(3)).invoke(any());
    }

    @Test
    void testJumpToEndStageSkipsRemainingStages() throws Exception {
        when(endpointInvoker.invoke(any())).thenReturn(new EndpointResponse(409, "{\"id\":\"o-9\"}", Map.of()));

        WorkflowExecution execution = executor.execute(document(ORDER_WORKFLOW), Map.of("customerId", "c-1"), options);

        assertEquals(WorkflowStatus.COMPLETED, execution.getStatus());
        assertEquals(1, execution.getStageExecutions().size());
        StageExecution create = execution.getStageExecutions().get(0);
        assertEquals(StageExecution.StageStatus.JUMPED, create.getStatus());
        assertEquals(Optional.of("endStage"), create.getJumpTarget());
        assertEquals(Optional.of(409), create.getStatusCode());
        assertEquals(Map.of("orderId", "o-9"), execution.getOutputs());
        verify(endpointInvoker, times(1)).invoke(any());
    }

    @Test
    void testUnknownJumpTargetContinuesWithNextStage() throws Exception {
        when(endpointInvoker.invoke(any())).thenReturn(
                new EndpointResponse(409, "{\"id\":\"o-1\"}", Map.of()),
                new EndpointResponse(200, "{}", Map.of()));

        WorkflowExecution execution = executor.execute(
                document(ORDER_WORKFLOW.replace("409: endStage", "409: Cancel")), Map.of("customerId", "c-1"), options);

        assertEquals(WorkflowStatus.COMPLETED, execution.getStatus());
        assertEquals(StageExecution.StageStatus.COMPLETED, execution.findStageExecution("Confirm").get().getStatus());
    }

    @Test
    void testSelfJumpRepeatsStageOutsideMockedMode() throws Exception {
        when(endpointInvoker.invoke(any())).thenReturn(
                new EndpointResponse(202, "{}", Map.of()),
                new EndpointResponse(200, "{}", Map.of()));

        WorkflowExecution execution = executor.execute(document(POLL_WORKFLOW), Map.of(), options);

        assertEquals(WorkflowStatus.COMPLETED, execution.getStatus());
        List<StageExecution> stages = execution.getStageExecutions();
        assertEquals(2, stages.size());
        assertEquals(StageExecution.StageStatus.JUMPED, stages.get(0).getStatus());
        assertEquals(StageExecution.StageStatus.COMPLETED, stages.get(1).getStatus());
    }

    @Test
    void testSelfJumpFailsInMockedMode() throws Exception {
        ExecutionOptions mocked = ExecutionOptions.builder().mocked(true).build();

        WorkflowExecution execution = executor.execute(document(POLL_WORKFLOW), Map.of(), mocked);

        assertEquals(WorkflowStatus.FAILED, execution.getStatus());
        assertInstanceOf(SelfJumpException.class, execution.getCause().orElseThrow());
        verify(endpointInvoker, never()).invoke(any());
    }

    // ========== Failure Tests ==========

    @Test
    void testMissingRequiredInputFails() throws Exception {
        WorkflowExecution execution = executor.execute(document(ORDER_WORKFLOW), Map.of(), options);

        assertEquals(WorkflowStatus.FAILED, execution.getStatus());
        assertEquals(Optional.of("Required input 'customerId' was not provided."), execution.getMessage());
        verify(endpointInvoker, never()).invoke(any());
    }

    @Test
    void testStageFailureFailsWorkflowAndAppliesContextOnFailure() throws Exception {
        when(endpointInvoker.invoke(any())).thenReturn(new EndpointResponse(500, "", Map.of()));

        WorkflowExecution execution = executor.execute(document(ORDER_WORKFLOW), Map.of("customerId", "c-1"), options);

        assertEquals(WorkflowStatus.FAILED, execution.getStatus());
        assertEquals(Optional.of("Stage 'Create' returned 500 but expected 201."), execution.getMessage());
        assertInstanceOf(StageFailureException.class, execution.getCause().orElseThrow());
        assertTrue(execution.getOutputs().isEmpty());

        StageExecution create = execution.findStageExecution("Create").orElseThrow();
        assertEquals(StageExecution.StageStatus.FAILED, create.getStatus());
        assertEquals(Optional.of(500), create.getStatusCode());

        ExecutionContext context = execution.getContext();
        assertEquals("done", context.getContext().get("outcome"));
        assertEquals("Error", context.getWorkflowResults().get("Orders").get(ExecutionContext.RESULT_STATUS));
    }

    @Test
    void testDelayUsesSleeperAndInterruptCancels() throws Exception {
        String delayed = ORDER_WORKFLOW.replace("expectedStatus: 201", "expectedStatus: 201\n    delaySeconds: 2");
        WorkflowExecutor interrupted = createExecutor(null, millis -> {
            sleeps.add(millis);
            throw new InterruptedException("stop");
        });

        WorkflowExecution execution = interrupted.execute(document(delayed), Map.of("customerId", "c-1"), options);

        assertEquals(WorkflowStatus.CANCELLED, execution.getStatus());
        assertEquals(List.of(2000L), sleeps);
        assertTrue(Thread.currentThread().isInterrupted());
        verify(endpointInvoker, never()).invoke(any());
    }

    // ========== Nested Workflow Tests ==========

    @Test
    void testNestedWorkflowOutputsAreVisibleToParent() throws Exception {
        Files.writeString(tempDir.resolve("notify.yaml"), """
                version: "1"
                id: wf-notify
                name: Notify Customer
                input:
                  - name: orderId
                stages: []
                endStage:
                  output:
                    messageId: "m-{{input.orderId}}"
                  context:
                    notified: "{{context.tenant}}"
                  result:
                    message: "sent"
                """);

        WorkflowExecution execution = executor.execute(document(PARENT_WORKFLOW), Map.of("orderId", "o-1"), options);

        assertEquals(WorkflowStatus.COMPLETED, execution.getStatus(), execution.getMessage().orElse(""));
        assertEquals(Map.of("messageId", "m-o-1", "status", "Ok", "message", "sent"), execution.getOutputs());
    }

    @Test
    void testFailingWorkflowStageContinues() throws Exception {
        // notify.yaml is absent, so the stage fails to load its workflow
        String parent = PARENT_WORKFLOW.substring(0, PARENT_WORKFLOW.indexOf("endStage:"));

        WorkflowExecution execution = executor.execute(document(parent), Map.of("orderId", "o-1"), options);

        assertEquals(WorkflowStatus.COMPLETED, execution.getStatus());
        StageExecution send = execution.findStageExecution("SendNotice").orElseThrow();
        assertEquals(StageExecution.StageStatus.FAILED, send.getStatus());
        assertEquals("Error", execution.getContext().getWorkflowResults().get("SendNotice")
                .get(ExecutionContext.RESULT_STATUS));
        assertEquals("after", execution.getContext().getGlobals().get("step"));
    }

    @Test
    void testChildWorkflowFailureIsVisibleToLaterStages() throws Exception {
        Files.writeString(tempDir.resolve("notify.yaml"), """
                version: "1"
                id: wf-notify
                name: Notify Customer
                references:
                  apis:
                    - name: ordersApi
                      definition: Orders
                input:
                  - name: orderId
                stages:
                  - name: Send
                    kind: Endpoint
                    apiRef: ordersApi
                    endpoint: "/orders/{{input.orderId}}/notify"
                    httpVerb: POST
                    expectedStatus: 200
                """);
        String parent = """
                version: "1"
                id: wf-parent
                name: Parent
                input:
                  - name: orderId
                references:
                  apis:
                    - name: ordersApi
                      definition: Orders
                  workflows:
                    - name: notify
                      path: notify.yaml
                stages:
                  - name: SendNotice
                    kind: Workflow
                    workflowRef: notify
                    inputs:
                      orderId: "{{input.orderId}}"
                    set:
                      childStatus: "{{stage:SendNotice.workflow.result.status}}"
                  - name: Escalate
                    kind: Endpoint
                    apiRef: ordersApi
                    endpoint: "/orders/{{input.orderId}}/escalate"
                    httpVerb: POST
                    expectedStatus: 200
                    runIf: "{{global.childStatus}} == 'Error'"
                """;
        when(endpointInvoker.invoke(any())).thenReturn(
                new EndpointResponse(500, "", Map.of()),
                new EndpointResponse(200, "{}", Map.of()));

        WorkflowExecution execution = executor.execute(document(parent), Map.of("orderId", "o-1"), options);

        assertEquals(WorkflowStatus.COMPLETED, execution.getStatus(), execution.getMessage().orElse(""));
        assertEquals(StageExecution.StageStatus.FAILED,
                execution.findStageExecution("SendNotice").orElseThrow().getStatus());
        assertEquals(StageExecution.StageStatus.COMPLETED,
                execution.findStageExecution("Escalate").orElseThrow().getStatus());
        assertEquals("Error", execution.getContext().getGlobals().get("childStatus"));

        ArgumentCaptor<EndpointRequest> requests = ArgumentCaptor.forClass(EndpointRequest.class);
        verify(endpointInvoker, times(2)).invoke(requests.capture());
        assertEquals("https://api.test/orders/v1/orders/o-1/notify", requests.getAllValues().get(0).getUrl());
        assertEquals("https://api.test/orders/v1/orders/o-1/escalate", requests.getAllValues().get(1).getUrl());
    }

    @Test
    void testCancelledChildWorkflowLeavesActiveGauge() throws Exception {
        Files.writeString(tempDir.resolve("notify.yaml"), """
                version: "1"
                id: wf-notify
                name: Notify Customer
                references:
                  apis:
                    - name: ordersApi
                      definition: Orders
                input:
                  - name: orderId
                stages:
                  - name: Send
                    kind: Endpoint
                    apiRef: ordersApi
                    endpoint: "/orders/{{input.orderId}}/notify"
                    httpVerb: POST
                    expectedStatus: 200
                    delaySeconds: 1
                """);
        WorkflowMetrics metrics = WorkflowMetrics.getInstance();
        WorkflowExecutor interrupted = createExecutor(null, millis -> {
            throw new InterruptedException("stop");
        }, metrics);
        long activeBefore = metrics.getActiveWorkflows();

        WorkflowExecution execution = interrupted.execute(document(PARENT_WORKFLOW), Map.of("orderId", "o-1"), options);

        assertEquals(WorkflowStatus.CANCELLED, execution.getStatus());
        assertEquals(activeBefore, metrics.getActiveWorkflows());
        verify(endpointInvoker, never()).invoke(any());
    }

    // ========== Output Tests ==========

    @Test
    void testOutputFileIsWrittenWhenEnabled() throws Exception {
        WorkflowExecutor writing = createExecutor(
                new WorkflowOutputWriter(tempDir.resolve("out").toString(), clock), millis -> { });
        when(endpointInvoker.invoke(any())).thenReturn(
                new EndpointResponse(201, "{\"id\":\"o-1\"}", Map.of()),
                new EndpointResponse(200, "{}", Map.of()));

        WorkflowExecution execution = writing.execute(document("output: true\n" + ORDER_WORKFLOW),
                Map.of("customerId", "c-1"), options);

        assertEquals(WorkflowStatus.COMPLETED, execution.getStatus());
        Path outputFile = execution.getOutputFilePath().orElseThrow();
        assertTrue(Files.exists(outputFile));
        assertTrue(Files.readString(outputFile).contains("o-1"));
    }

    private static final String POLL_WORKFLOW = """
            version: "1"
            id: wf-poll
            name: Poll
            references:
              apis:
                - name: ordersApi
                  definition: Orders
            stages:
              - name: Poll
                kind: Endpoint
                apiRef: ordersApi
                endpoint: "/jobs/1"
                httpVerb: GET
                expectedStatus: 200
                jumpOnStatus:
                  202: Poll
                mock:
                  status: 202
                  payload: "{}"
            """;

    private static final String PARENT_WORKFLOW = """
            version: "1"
            id: wf-parent
            name: Parent
            input:
              - name: orderId
            references:
              workflows:
                - name: notify
                  path: notify.yaml
            initStage:
              context:
                tenant: acme
            stages:
              - name: SendNotice
                kind: Workflow
                workflowRef: notify
                inputs:
                  orderId: "{{input.orderId}}"
                set:
                  step: after
            endStage:
              output:
                messageId: "{{stage:SendNotice.workflow.output.messageId}}"
                status: "{{stage:SendNotice.workflow.result.status}}"
                message: "{{stage:SendNotice.workflow.result.message}}"
            """;

    private WorkflowExecutor createExecutor(WorkflowOutputWriter outputWriter, RetryExecutor.Sleeper sleeper)
            throws Exception {
        return createExecutor(outputWriter, sleeper, null);
    }

    private WorkflowExecutor createExecutor(WorkflowOutputWriter outputWriter, RetryExecutor.Sleeper sleeper,
                                            WorkflowMetrics metrics) throws Exception {
        StageServices services = StageServices.builder()
                .endpointInvoker(endpointInvoker)
                .retryExecutor(new RetryExecutor(millis -> { }))
                .workflowLoader(loader)
                .metrics(metrics)
                .build();
        return WorkflowExecutor.builder()
                .services(services)
                .pluginIds(List.of("http"))
                .outputWriter(outputWriter)
                .clock(clock)
                .sleeper(sleeper)
                .build();
    }

    private WorkflowDocument document(String yaml) throws Exception {
        return new WorkflowDocument(loader.parseFromString(yaml), tempDir.resolve("workflow.yaml"), Map.of());
    }
}
