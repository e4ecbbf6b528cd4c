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

import dev.mars.stageflow.core.exceptions.StageflowException;
import dev.mars.stageflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.stageflow.workflow.definition.CircuitBreakerDefinition;
import dev.mars.stageflow.workflow.definition.RetryPolicyDefinition;
import dev.mars.stageflow.workflow.definition.StageKinds;
import dev.mars.stageflow.workflow.definition.WorkflowDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowStageDefinition;
import dev.mars.stageflow.workflow.plugin.BuiltInStagePlugins;
import dev.mars.stageflow.workflow.plugin.StageExecutionContext;
import dev.mars.stageflow.workflow.plugin.StageOutcome;
import dev.mars.stageflow.workflow.plugin.StagePlugin;
import dev.mars.stageflow.workflow.plugin.StagePluginCapabilities;
import dev.mars.stageflow.workflow.plugin.StageServices;
import dev.mars.stageflow.workflow.plugin.StageValidationContext;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Built-in plugin for endpoint stages ({@code Endpoint}, or its alias {@code Http}).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 */
public class HttpStagePlugin implements StagePlugin {

    private static final Set<String> STAGE_KINDS =
            Collections.unmodifiableSet(new LinkedHashSet<>(List.of(StageKinds.ENDPOINT, StageKinds.HTTP)));
    private static final StagePluginCapabilities CAPABILITIES = new StagePluginCapabilities(true, true, false);

    private final EndpointStageExecutor executor;

    public HttpStagePlugin(StageServices services) {
        this.executor = new EndpointStageExecutor(services);
    }

    @Override
    public String getId() {
        return BuiltInStagePlugins.HTTP_PLUGIN_ID;
    }

    @Override
    public Set<String> getStageKinds() {
        return STAGE_KINDS;
    }

    @Override
    public StagePluginCapabilities getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    public StageOutcome execute(WorkflowStageDefinition stage, StageExecutionContext context)
            throws StageflowException, InterruptedException {
        return executor.execute(stage, context);
    }

    @Override
    public void validate(WorkflowStageDefinition stage, StageValidationContext context, List<String> errors) {
        String name = stage.getName();
        Optional<String> apiRef = stage.getApiRef().filter(value -> !value.isBlank());
        if (apiRef.isEmpty()) {
            errors.add(String.format("Stage '%s' apiRef is required for http stages.", name));
        } else if (!context.getApiReferences().contains(apiRef.get())) {
            errors.add(String.format("Stage '%s' apiRef '%s' is not declared in references.apis.", name, apiRef.get()));
        }

        if (stage.getEndpoint().filter(value -> !value.isBlank()).isEmpty()) {
            errors.add(String.format("Stage '%s' endpoint is required for http stages.", name));
        }
        if (stage.getHttpVerb().filter(value -> !value.isBlank()).isEmpty()) {
            errors.add(String.format("Stage '%s' httpVerb is required for http stages.", name));
        }
        if (stage.getExpectedStatus().filter(status -> status > 0).isEmpty()) {
            errors.add(String.format("Stage '%s' expectedStatus must be a positive integer.", name));
        }
        for (Integer status : stage.getJumpOnStatus().keySet()) {
            if (status == null || status <= 0) {
                errors.add(String.format("Stage '%s' jump status must be a positive integer.", name));
            }
        }

        if (stage.getCircuitBreaker().isPresent() && stage.getRetry().isEmpty()) {
            errors.add(String.format("Stage '%s' circuitBreaker requires retry.", name));
        }
        validateRetry(context.getResilience(), stage, errors);
        validateCircuitBreaker(context.getResilience(), stage, errors);
        validateMock(stage, context, errors);
    }

    private static void validateRetry(WorkflowDefinition.Resilience resilience, WorkflowStageDefinition stage,
                                      List<String> errors) {
        if (stage.getRetry().isEmpty()) {
            return;
        }
        WorkflowStageDefinition.Retry retry = stage.getRetry().get();
        String name = stage.getName();

        if (retry.getHttpStatus().isEmpty()) {
            errors.add(String.format("Stage '%s' retry httpStatus is required.", name));
        } else if (retry.getHttpStatus().stream().anyMatch(status -> status == null || status <= 0)) {
            errors.add(String.format("Stage '%s' retry httpStatus must contain positive integers.", name));
        }

        RetryPolicyDefinition shared = null;
        Optional<String> ref = retry.getRef().filter(value -> !value.isBlank());
        if (ref.isPresent()) {
            shared = resilience.getRetries().get(ref.get());
            if (shared == null) {
                errors.add(String.format("Stage '%s' retry ref '%s' was not found in resilience.retries.",
                        name, ref.get()));
            }
        }

        Integer maxRetries = retry.getMaxRetries().orElse(shared != null ? shared.getMaxRetries().orElse(null) : null);
        Integer delayMs = retry.getDelayMs().orElse(shared != null ? shared.getDelayMs().orElse(null) : null);
        if (maxRetries == null || maxRetries <= 0) {
            errors.add(String.format("Stage '%s' retry maxRetries must be a positive integer.", name));
        }
        if (delayMs == null || delayMs <= 0) {
            errors.add(String.format("Stage '%s' retry delayMs must be a positive integer.", name));
        }
    }

    private static void validateCircuitBreaker(WorkflowDefinition.Resilience resilience,
                                               WorkflowStageDefinition stage, List<String> errors) {
        if (stage.getCircuitBreaker().isEmpty()) {
            return;
        }
        WorkflowStageDefinition.CircuitBreaker breaker = stage.getCircuitBreaker().get();
        String name = stage.getName();

        CircuitBreakerDefinition shared = null;
        Optional<String> ref = breaker.getRef().filter(value -> !value.isBlank());
        if (ref.isPresent()) {
            shared = resilience.getCircuitBreakers().get(ref.get());
            if (shared == null) {
                errors.add(String.format("Stage '%s' circuitBreaker ref '%s' was not found in resilience.circuitBreakers.",
                        name, ref.get()));
            }
        }

        Integer failureThreshold = breaker.getFailureThreshold()
                .orElse(shared != null ? shared.getFailureThreshold().orElse(null) : null);
        Integer breakMs = breaker.getBreakMs()
                .orElse(shared != null ? shared.getBreakMs().orElse(null) : null);
        Integer closeOnSuccessAttempts = breaker.getCloseOnSuccessAttempts()
                .orElse(shared != null ? shared.getCloseOnSuccessAttempts().orElse(null) : null);

        if (failureThreshold == null || failureThreshold <= 0) {
            errors.add(String.format("Stage '%s' circuitBreaker failureThreshold must be a positive integer.", name));
        }
        if (breakMs == null || breakMs <= 0) {
            errors.add(String.format("Stage '%s' circuitBreaker breakMs must be a positive integer.", name));
        }
        if (closeOnSuccessAttempts != null && closeOnSuccessAttempts <= 0) {
            errors.add(String.format("Stage '%s' circuitBreaker closeOnSuccessAttempts must be a positive integer.", name));
        }
    }

    private static void validateMock(WorkflowStageDefinition stage, StageValidationContext context, List<String> errors) {
        if (stage.getMock().isEmpty()) {
            return;
        }
        WorkflowStageDefinition.Mock mock = stage.getMock().get();
        String name = stage.getName();
        Optional<String> payload = mock.getPayload().filter(value -> !value.isBlank());
        Optional<String> payloadFile = mock.getPayloadFile().filter(value -> !value.isBlank());

        if (payload.isPresent() && payloadFile.isPresent()) {
            errors.add(String.format("Stage '%s' mock cannot define both payload and payloadFile.", name));
            return;
        }
        if (mock.getStatus().filter(status -> status <= 0).isPresent()) {
            errors.add(String.format("Stage '%s' mock status must be a positive integer.", name));
        }
        if (payload.isEmpty() && payloadFile.isEmpty()) {
            errors.add(String.format("Stage '%s' mock payload or payloadFile is required.", name));
            return;
        }

        String raw;
        try {
            raw = payloadFile.isPresent()
                    ? context.getMockPayloadService().loadRawPayloadFromFile(payloadFile.get(),
                            context.getDocument().getDirectory())
                    : payload.get();
        } catch (WorkflowConfigurationException e) {
            errors.add(String.format("Stage '%s' %s", name, e.getMessage()));
            return;
        }

        MockPayloadService.findJsonError(MockPayloadService.sanitizeJsonForValidation(raw))
                .ifPresent(error -> errors.add(String.format("Stage '%s' mock payload is not valid JSON: %s", name, error)));
    }
}
