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
import dev.mars.stageflow.core.exceptions.StageflowException;
import dev.mars.stageflow.core.exceptions.TransportException;
import dev.mars.stageflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.stageflow.http.EndpointInvoker;
import dev.mars.stageflow.http.EndpointRequest;
import dev.mars.stageflow.http.EndpointResponse;
import dev.mars.stageflow.workflow.definition.ApiCatalogVersion;
import dev.mars.stageflow.workflow.definition.WorkflowDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowStageDefinition;
import dev.mars.stageflow.workflow.execution.ExecutionContext;
import dev.mars.stageflow.workflow.execution.ExecutionLogFormat;
import dev.mars.stageflow.workflow.execution.StageMessageEmitter;
import dev.mars.stageflow.workflow.observability.WorkflowMetrics;
import dev.mars.stageflow.workflow.plugin.StageExecutionContext;
import dev.mars.stageflow.workflow.plugin.StageOutcome;
import dev.mars.stageflow.workflow.plugin.StageServices;
import dev.mars.stageflow.workflow.resilience.CircuitBreaker;
import dev.mars.stageflow.workflow.resilience.CircuitBreakerPolicy;
import dev.mars.stageflow.workflow.resilience.ResiliencePolicyResolver;
import dev.mars.stageflow.workflow.resilience.RetryExecutor;
import dev.mars.stageflow.workflow.resilience.RetryPolicy;
import dev.mars.stageflow.workflow.template.ResponseContext;
import dev.mars.stageflow.workflow.template.TemplateResolver;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes one endpoint stage: circuit breaker around retry around a single call (real or mocked),
 * followed by output capture, the stage message and the jump/expected-status decision.
 * <p>
 * The breaker is consulted once before the retry loop and updated once after it. A failure, for
 * breaker purposes, is a transport error left after the last retry or a final status that is in the
 * retry policy's status set.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 */
public class EndpointStageExecutor {

    private static final Logger logger = Logger.getLogger(EndpointStageExecutor.class.getName());

    static final String HTTP_STATUS_OUTPUT = "http_status";
    private static final int DEFAULT_MOCK_STATUS = 200;

    private final TemplateResolver templateResolver;
    private final StageMessageEmitter messageEmitter;
    private final EndpointInvoker endpointInvoker;
    private final MockPayloadService mockPayloadService;
    private final RetryExecutor retryExecutor;
    private final EndpointRequestFactory requestFactory;
    private final Optional<WorkflowMetrics> metrics;

    public EndpointStageExecutor(StageServices services) {
        Objects.requireNonNull(services, "Stage services cannot be null");
        this.templateResolver = services.getTemplateResolver();
        this.messageEmitter = services.getMessageEmitter();
        this.endpointInvoker = services.getEndpointInvoker();
        this.mockPayloadService = services.getMockPayloadService();
        this.retryExecutor = services.getRetryExecutor();
        this.requestFactory = new EndpointRequestFactory(templateResolver);
        this.metrics = services.getMetrics();
    }

    public StageOutcome execute(WorkflowStageDefinition stage, StageExecutionContext stageContext)
            throws StageflowException, InterruptedException {
        WorkflowDefinition definition = stageContext.getDefinition();
        ExecutionContext context = stageContext.getExecutionContext();
        String logPrefix = ExecutionLogFormat.indent(context) +
                           ExecutionLogFormat.stageTag(definition.getName(), stage.getName());

        Optional<RetryPolicy> retryPolicy = ResiliencePolicyResolver.resolveRetry(definition, stage);
        Optional<CircuitBreakerPolicy> breakerPolicy =
                ResiliencePolicyResolver.resolveCircuitBreaker(definition, stage, retryPolicy);
        CircuitBreaker breaker = breakerPolicy
                .map(policy -> context.getCircuitBreakers().getOrCreate(policy.getName()))
                .orElse(null);

        if (breaker != null && !breaker.tryAcquire()) {
            CircuitBreakerPolicy policy = breakerPolicy.get();
            messageEmitter.emitNotice(policy.getOnBlockedMessage().orElse(null), context, Level.INFO);
            metrics.ifPresent(m -> m.recordCircuitBlocked(policy.getName()));
            throw new CircuitOpenException(definition.getName(), stage.getName(), policy.getName(),
                    breaker.remainingBreakMs());
        }

        RetryExecutor.Attempt<EndpointResponse> attempt;
        if (stageContext.isMocked() && stage.getMock().isPresent()) {
            EndpointResponse mockResponse = buildMockResponse(stage, stageContext);
            attempt = () -> mockResponse;
        } else {
            EndpointRequest request = requestFactory.create(stage, resolveBaseUrl(stage, stageContext), context);
            attempt = () -> invoke(request, logPrefix);
        }

        RetryExecutor.RetryOutcome<EndpointResponse> outcome = retryExecutor.execute(
                attempt,
                EndpointResponse::getStatusCode,
                retryPolicy.orElse(null),
                (retry, maxRetries, delayMs, reason) -> {
                    logger.info(logPrefix + " retrying in " + delayMs + "ms after " + reason +
                               " (retry " + retry + "/" + maxRetries + ").");
                    metrics.ifPresent(m -> m.recordRetry(definition.getName(), stage.getKind()));
                });

        if (outcome.isFailure()) {
            TransportException failure = outcome.getFailure();
            if (breaker != null) {
                recordBreakerFailure(breaker, breakerPolicy.get(), context);
            }
            retryPolicy.flatMap(RetryPolicy::getOnExceptionMessage)
                    .ifPresent(message -> messageEmitter.emitNotice(message, context, Level.SEVERE));

            String message = String.format("Stage '%s' failed with exception: %s", stage.getName(), failure.getMessage());
            if (outcome.getRetries() > 0) {
                throw new RetryExhaustedException(definition.getName(), stage.getName(), null,
                        outcome.getRetries() + 1, message, failure);
            }
            throw new StageFailureException(definition.getName(), stage.getName(), message, failure);
        }

        EndpointResponse response = outcome.getResult();
        int status = response.getStatusCode();
        if (breaker != null) {
            if (retryPolicy.get().isRetryStatus(status)) {
                recordBreakerFailure(breaker, breakerPolicy.get(), context);
            } else if (breaker.recordSuccess(breakerPolicy.get())) {
                logger.info(logPrefix + " circuit breaker '" + breaker.getName() + "' closed.");
            }
        }

        ResponseContext responseContext = new ResponseContext(response);
        Map<String, String> output = new LinkedHashMap<>(
                templateResolver.resolveAll(stage.getOutput(), context, responseContext));
        if (output.keySet().stream().noneMatch(HTTP_STATUS_OUTPUT::equalsIgnoreCase)) {
            output.put(HTTP_STATUS_OUTPUT, String.valueOf(status));
        }
        context.putEndpointOutput(stage.getName(), output);
        messageEmitter.emit(definition, stage, context, responseContext);

        String jumpTarget = stage.getJumpOnStatus().get(status);
        if (jumpTarget != null && !jumpTarget.isBlank()) {
            return StageOutcome.jumpTo(jumpTarget, status, outcome.getRetries());
        }

        Optional<Integer> expectedStatus = stage.getExpectedStatus();
        if (expectedStatus.isPresent() && expectedStatus.get() != status) {
            String message = String.format("Stage '%s' returned %d but expected %d.",
                    stage.getName(), status, expectedStatus.get());
            if (outcome.getRetries() > 0 && retryPolicy.get().isRetryStatus(status)) {
                throw new RetryExhaustedException(definition.getName(), stage.getName(), status,
                        outcome.getRetries() + 1, message, null);
            }
            throw new StageFailureException(definition.getName(), stage.getName(), status, message);
        }
        return StageOutcome.completed(status, outcome.getRetries());
    }

    private EndpointResponse invoke(EndpointRequest request, String logPrefix)
            throws TransportException, InterruptedException {
        logger.fine(logPrefix + " request: " + request.getMethod() + " " + request.getUrl());
        EndpointResponse response = endpointInvoker.invoke(request);
        logger.fine(logPrefix + " response status: " + response.getStatusCode() + ".");

        if (response.getStatusCode() == 400) {
            String body = response.getBody().isBlank() ? "<empty>" : response.getBody();
            logger.severe(logPrefix + " returned 400. Response body: " + body);
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(logPrefix + " request body: " + request.getBody().filter(b -> !b.isBlank()).orElse("<empty>"));
            }
        } else if (response.getStatusCode() == 404) {
            logger.severe(logPrefix + " returned 404 for url: " + request.getUrl());
        }
        return response;
    }

    private void recordBreakerFailure(CircuitBreaker breaker, CircuitBreakerPolicy policy, ExecutionContext context) {
        if (breaker.recordFailure(policy)) {
            logger.warning(ExecutionLogFormat.indent(context) + "Circuit breaker '" + policy.getName() +
                          "' opened for " + policy.getBreakMs() + " ms.");
            messageEmitter.emitNotice(policy.getOnOpenMessage().orElse(null), context, Level.INFO);
            metrics.ifPresent(m -> m.recordCircuitOpened(policy.getName()));
        }
    }

    private String resolveBaseUrl(WorkflowStageDefinition stage, StageExecutionContext stageContext)
            throws WorkflowConfigurationException {
        String apiRef = stage.getApiRef().filter(ref -> !ref.isBlank())
                .orElseThrow(() -> new WorkflowConfigurationException(
                        String.format("Stage '%s' apiRef is required for http stages.", stage.getName())));
        ApiCatalogVersion catalogVersion = stageContext.getCatalogVersion()
                .orElseThrow(() -> new WorkflowConfigurationException(String.format(
                        "Stage '%s' requires an API catalog version to resolve apiRef '%s'.",
                        stage.getName(), apiRef)));

        Map<String, String> baseUrls = ApiBaseUrlResolver.buildLookup(
                stageContext.getDefinition(), catalogVersion, stageContext.getEnvironment());
        String baseUrl = baseUrls.get(apiRef);
        if (baseUrl == null) {
            throw new WorkflowConfigurationException(String.format(
                    "Stage '%s' apiRef '%s' was not found in workflow references.", stage.getName(), apiRef));
        }
        return baseUrl;
    }

    private EndpointResponse buildMockResponse(WorkflowStageDefinition stage, StageExecutionContext stageContext)
            throws WorkflowConfigurationException {
        WorkflowStageDefinition.Mock mock = stage.getMock().orElseThrow();
        Optional<String> payload = mock.getPayload().filter(value -> !value.isBlank());
        Optional<String> payloadFile = mock.getPayloadFile().filter(value -> !value.isBlank());
        if (payload.isPresent() && payloadFile.isPresent()) {
            throw new WorkflowConfigurationException(String.format(
                    "Stage '%s' mock cannot define both payload and payloadFile.", stage.getName()));
        }

        String rawPayload = payloadFile.isPresent()
                ? mockPayloadService.loadRawPayloadFromFile(payloadFile.get(), stageContext.getDocument().getDirectory())
                : mockPayloadService.loadRawPayload(payload.orElse(""));
        if (rawPayload.isBlank()) {
            throw new WorkflowConfigurationException(
                    String.format("Stage '%s' mock payload is required.", stage.getName()));
        }

        String resolvedPayload = templateResolver.resolve(rawPayload, stageContext.getExecutionContext());
        Optional<String> jsonError = MockPayloadService.findJsonError(resolvedPayload);
        if (jsonError.isPresent()) {
            throw new WorkflowConfigurationException(String.format(
                    "Stage '%s' mock payload is not valid JSON: %s", stage.getName(), jsonError.get()));
        }

        int status = mock.getStatus().or(stage::getExpectedStatus).orElse(DEFAULT_MOCK_STATUS);
        return new EndpointResponse(status, resolvedPayload, Map.of());
    }
}
