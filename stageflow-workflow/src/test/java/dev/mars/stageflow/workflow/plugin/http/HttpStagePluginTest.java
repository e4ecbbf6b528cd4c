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


package dev.mars.stageflow.workflow.plugin.http;

import dev.mars.stageflow.core.exceptions.CircuitOpenException;
import dev.mars.stageflow.core.exceptions.RetryExhaustedException;
import dev.mars.stageflow.core.exceptions.StageFailureException;
import dev.mars.stageflow.core.exceptions.TransportException;
import dev.mars.stageflow.http.EndpointInvoker;
import dev.mars.stageflow.http.EndpointRequest;
import dev.mars.stageflow.http.EndpointResponse;
import dev.mars.stageflow.workflow.definition.ApiCatalogVersion;
import dev.mars.stageflow.workflow.definition.ApiDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowDocument;
import dev.mars.stageflow.workflow.definition.WorkflowStageDefinition;
import dev.mars.stageflow.workflow.execution.ExecutionContext;
import dev.mars.stageflow.workflow.execution.ExecutionOptions;
import dev.mars.stageflow.workflow.loader.WorkflowLoader;
import dev.mars.stageflow.workflow.plugin.StageExecutionContext;
import dev.mars.stageflow.workflow.plugin.StageOutcome;
import dev.mars.stageflow.workflow.plugin.StageServices;
import dev.mars.stageflow.workflow.plugin.StageValidationContext;
import dev.mars.stageflow.workflow.resilience.RetryExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.file.Files;
import java.nio.file.Path;
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
 * Tests for endpoint stages run through the http plugin against a mocked invoker.
 */
class HttpStagePluginTest {

    @Mock
    private EndpointInvoker endpointInvoker;

    @Mock
    private WorkflowLoader workflowLoader;

    @TempDir
    Path tempDir;

    private HttpStagePlugin plugin;
    private WorkflowDocument document;
    private ExecutionContext context;
    private ExecutionOptions options;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        StageServices services = StageServices.builder()
                .endpointInvoker(endpointInvoker)
                .retryExecutor(new RetryExecutor(millis -> { }))
                .build();
        plugin = new HttpStagePlugin(services);

        WorkflowDefinition definition = WorkflowDefinition.builder("Orders")
                .references(new WorkflowDefinition.References(List.of(),
                        List.of(new WorkflowDefinition.ApiReference("ordersApi", "Orders")), null))
                .build();
        document = new WorkflowDocument(definition, tempDir.resolve("orders.yaml"), Map.of());
        context = new ExecutionContext(Map.of("customer", "c-1"), Map.of());

        ApiCatalogVersion catalog = new ApiCatalogVersion("2025.1", Map.of("dev", "https://api.test"),
                List.of(new ApiDefinition("Orders", null, "/orders/v1")));
        options = ExecutionOptions.builder().environment("dev").catalogVersion(catalog).build();
    }

    // ========== Execution Tests ==========

    @Test
    void testSuccessfulCallStoresOutputs() throws Exception {
        when(endpointInvoker.invoke(any())).thenReturn(new EndpointResponse(201, "{\"id\":\"o-1\"}", Map.of()));
        WorkflowStageDefinition stage = createStage()
                .output(Map.of("orderId", "{{response.id}}"))
                .build();

        StageOutcome outcome = plugin.execute(stage, stageContext(options));

        ArgumentCaptor<EndpointRequest> request = ArgumentCaptor.forClass(EndpointRequest.class);
        verify(endpointInvoker).invoke(request.capture());
        assertEquals("https://api.test/orders/v1/customers/c-1/orders", request.getValue().getUrl());
        assertEquals("POST", request.getValue().getMethod());

        assertEquals(Optional.of(201), outcome.getStatusCode());
        assertTrue(outcome.getJumpTarget().isEmpty());
        Map<String, String> output = context.getEndpointOutputs().get("create");
        assertEquals("o-1", output.get("orderId"));
        assertEquals("201", output.get("http_status"));
    }

    @Test
    void testJumpTakesPrecedenceOverExpectedStatus() throws Exception {
        when(endpointInvoker.invoke(any())).thenReturn(new EndpointResponse(409, "{}", Map.of()));
        WorkflowStageDefinition stage = createStage()
                .jumpOnStatus(Map.of(409, "endStage"))
                .build();

        StageOutcome outcome = plugin.execute(stage, stageContext(options));

        assertEquals(Optional.of("endStage"), outcome.getJumpTarget());
        assertEquals("409", context.getEndpointOutputs().get("Create").get("http_status"));
    }

    @Test
    void testUnexpectedStatusFailsStage() throws Exception {
        when(endpointInvoker.invoke(any())).thenReturn(new EndpointResponse(500, "", Map.of()));

        StageFailureException exception = assertThrows(StageFailureException.class,
                () -> plugin.execute(createStage().build(), stageContext(options)));

        assertEquals(500, exception.getStatusCode());
        assertTrue(exception.getMessage().contains("Stage 'Create' returned 500 but expected 201."));
        assertTrue(context.getEndpointOutputs().containsKey("Create"));
    }

    @Test
    void testRetriesUntilExpectedStatus() throws Exception {
        when(endpointInvoker.invoke(any())).thenReturn(
                new EndpointResponse(503, "", Map.of()),
                new EndpointResponse(503, "", Map.of()),
                new EndpointResponse(201, "{}", Map.of()));
        WorkflowStageDefinition stage = createStage()
                .retry(new WorkflowStageDefinition.Retry(null, 2, 0, List.of(503), null))
                .build();

        StageOutcome outcome = plugin.execute(stage, stageContext(options));

        assertEquals(2, outcome.getRetries());
        verify(endpointInvoker, times(3)).invoke(any());
    }

    @Test
    void testExhaustedRetriesReportAttempts() throws Exception {
        when(endpointInvoker.invoke(any())).thenReturn(new EndpointResponse(503, "", Map.of()));
        WorkflowStageDefinition stage = createStage()
                .retry(new WorkflowStageDefinition.Retry(null, 2, 0, List.of(503), null))
                .build();

        RetryExhaustedException exception = assertThrows(RetryExhaustedException.class,
                () -> plugin.execute(stage, stageContext(options)));

        assertEquals(3, exception.getAttempts());
        assertEquals(503, exception.getStatusCode());
    }

    @Test
    void testTransportFailureFailsStage() throws Exception {
        when(endpointInvoker.invoke(any())).thenThrow(new TransportException("POST", "https://api.test", "refused"));

        StageFailureException exception = assertThrows(StageFailureException.class,
                () -> plugin.execute(createStage().build(), stageContext(options)));

        assertTrue(exception.getMessage().contains("Stage 'Create' failed with exception:"));
        assertInstanceOf(TransportException.class, exception.getCause());
    }

    @Test
    void testOpenCircuitBlocksCallsWithinInvocation() throws Exception {
        when(endpointInvoker.invoke(any())).thenReturn(new EndpointResponse(503, "", Map.of()));
        WorkflowStageDefinition stage = createStage()
                .retry(new WorkflowStageDefinition.Retry(null, 0, 0, List.of(503), null))
                .circuitBreaker(new WorkflowStageDefinition.CircuitBreaker(null, 1, 60000, 1, null, null))
                .build();
        StageExecutionContext stageContext = stageContext(options);

        assertThrows(StageFailureException.class, () -> plugin.execute(stage, stageContext));
        CircuitOpenException blocked = assertThrows(CircuitOpenException.class,
                () -> plugin.execute(stage, stageContext));

        assertEquals("Create", blocked.getBreakerName());
        verify(endpointInvoker, times(1)).invoke(any());
    }

    @Test
    void testMockedModeUsesMockPayload() throws Exception {
        WorkflowStageDefinition stage = createStage()
                .output(Map.of("orderId", "{{response.id}}"))
                .mock(new WorkflowStageDefinition.Mock(201, "{\"id\":\"{{input.customer}}\"}", null, null))
                .build();
        ExecutionOptions mocked = ExecutionOptions.builder().environment("dev").mocked(true).build();

        StageOutcome outcome = plugin.execute(stage, stageContext(mocked));

        verify(endpointInvoker, never()).invoke(any());
        assertEquals(Optional.of(201), outcome.getStatusCode());
        assertEquals("c-1", context.getEndpointOutputs().get("Create").get("orderId"));
    }

    @Test
    void testMockPayloadFileIsResolvedAgainstWorkflowDirectory() throws Exception {
        Files.writeString(tempDir.resolve("created.json"), "{\"id\":\"from-file\"}");
        WorkflowStageDefinition stage = createStage()
                .output(Map.of("orderId", "{{response.id}}"))
                .mock(new WorkflowStageDefinition.Mock(null, null, "created.json", null))
                .build();
        ExecutionOptions mocked = ExecutionOptions.builder().environment("dev").mocked(true).build();

        plugin.execute(stage, stageContext(mocked));

        assertEquals("from-file", context.getEndpointOutputs().get("Create").get("orderId"));
    }

    // ========== Validation Tests ==========

    @Test
    void testValidStageHasNoErrors() {
        assertEquals(List.of(), validate(createStage()
                .retry(new WorkflowStageDefinition.Retry(null, 2, 100, List.of(503), null))
                .build()));
    }

    @Test
    void testMissingFieldsAreReported() {
        List<String> errors = validate(WorkflowStageDefinition.builder("Bare", "Endpoint").build());

        assertTrue(errors.contains("Stage 'Bare' apiRef is required for http stages."));
        assertTrue(errors.contains("Stage 'Bare' endpoint is required for http stages."));
        assertTrue(errors.contains("Stage 'Bare' httpVerb is required for http stages."));
        assertTrue(errors.contains("Stage 'Bare' expectedStatus must be a positive integer."));
    }

    @Test
    void testUndeclaredApiRefIsReported() {
        List<String> errors = validate(createStage().apiRef("billingApi").build());

        assertEquals(List.of("Stage 'Create' apiRef 'billingApi' is not declared in references.apis."), errors);
    }

    @Test
    void testCircuitBreakerWithoutRetryIsReported() {
        List<String> errors = validate(createStage()
                .circuitBreaker(new WorkflowStageDefinition.CircuitBreaker(null, 1, 1000, 1, null, null))
                .build());

        assertTrue(errors.contains("Stage 'Create' circuitBreaker requires retry."));
    }

    @Test
    void testInvalidMockPayloadIsReported() {
        List<String> errors = validate(createStage()
                .mock(new WorkflowStageDefinition.Mock(200, "{\"id\": {{input.customer}}", null, null))
                .build());

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("Stage 'Create' mock payload is not valid JSON:"));
    }

    @Test
    void testCapabilities() {
        assertTrue(plugin.getCapabilities().allowsResponseTokens());
        assertTrue(plugin.getCapabilities().supportsJumpOnStatus());
        assertFalse(plugin.getCapabilities().continueOnError());
        assertTrue(plugin.getStageKinds().contains("Endpoint"));
    }

    private WorkflowStageDefinition.Builder createStage() {
        return WorkflowStageDefinition.builder("Create", "Endpoint")
                .apiRef("ordersApi")
                .endpoint("/customers/{{input.customer}}/orders")
                .httpVerb("POST")
                .body("{\"customer\":\"{{input.customer}}\"}")
                .expectedStatus(201);
    }

    private StageExecutionContext stageContext(ExecutionOptions executionOptions) {
        return new StageExecutionContext(document, context, executionOptions, (childDocument, childContext) -> {
            throw new AssertionError("No nested workflows expected");
        });
    }

    private List<String> validate(WorkflowStageDefinition stage) {
        List<String> errors = new ArrayList<>();
        plugin.validate(stage, new StageValidationContext(document, workflowLoader, new MockPayloadService()), errors);
        return errors;
    }
}
