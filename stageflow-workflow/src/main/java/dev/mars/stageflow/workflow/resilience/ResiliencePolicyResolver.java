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

package dev.mars.stageflow.workflow.resilience;

import dev.mars.stageflow.workflow.definition.CircuitBreakerDefinition;
import dev.mars.stageflow.workflow.definition.RetryPolicyDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowStageDefinition;

import java.util.LinkedHashSet;
import java.util.Optional;

/**
 * Merges a stage's inline resilience fields over the named policies they reference, field by field.
 * A retry policy needs a retry count, a delay and at least one retry status; a circuit breaker
 * additionally needs an effective retry policy, whose statuses define what counts as a failure.
 */
public final class ResiliencePolicyResolver {

    private ResiliencePolicyResolver() {
    }

    public static Optional<RetryPolicy> resolveRetry(WorkflowDefinition definition, WorkflowStageDefinition stage) {
        Optional<WorkflowStageDefinition.Retry> retry = stage.getRetry();
        if (retry.isEmpty()) {
            return Optional.empty();
        }

        RetryPolicyDefinition shared = retry.get().getRef()
                .filter(ref -> !ref.isBlank())
                .map(ref -> definition.getResilience().getRetries().get(ref))
                .orElse(null);

        Integer maxRetries = retry.get().getMaxRetries()
                .orElse(shared != null ? shared.getMaxRetries().orElse(null) : null);
        Integer delayMs = retry.get().getDelayMs()
                .orElse(shared != null ? shared.getDelayMs().orElse(null) : null);
        if (maxRetries == null || delayMs == null || retry.get().getHttpStatus().isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new RetryPolicy(maxRetries, delayMs,
                new LinkedHashSet<>(retry.get().getHttpStatus()),
                retry.get().getOnExceptionMessage().orElse(null)));
    }

    public static Optional<CircuitBreakerPolicy> resolveCircuitBreaker(WorkflowDefinition definition,
                                                                       WorkflowStageDefinition stage,
                                                                       Optional<RetryPolicy> retryPolicy) {
        Optional<WorkflowStageDefinition.CircuitBreaker> breaker = stage.getCircuitBreaker();
        if (breaker.isEmpty() || retryPolicy.isEmpty()) {
            return Optional.empty();
        }

        Optional<String> ref = breaker.get().getRef().filter(value -> !value.isBlank());
        CircuitBreakerDefinition shared = ref
                .map(value -> definition.getResilience().getCircuitBreakers().get(value))
                .orElse(null);

        Integer failureThreshold = breaker.get().getFailureThreshold()
                .orElse(shared != null ? shared.getFailureThreshold().orElse(null) : null);
        Integer breakMs = breaker.get().getBreakMs()
                .orElse(shared != null ? shared.getBreakMs().orElse(null) : null);
        int closeOnSuccessAttempts = breaker.get().getCloseOnSuccessAttempts()
                .orElse(shared != null ? shared.getCloseOnSuccessAttempts().orElse(1) : 1);
        if (failureThreshold == null || breakMs == null) {
            return Optional.empty();
        }

        return Optional.of(new CircuitBreakerPolicy(
                ref.orElse(stage.getName()),
                failureThreshold,
                breakMs,
                closeOnSuccessAttempts,
                breaker.get().getOnOpenMessage().orElse(null),
                breaker.get().getOnBlockedMessage().orElse(null)));
    }
}
