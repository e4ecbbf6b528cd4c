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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResiliencePolicyResolverTest {

    private WorkflowDefinition definition;

    @BeforeEach
    void setUp() {
        definition = WorkflowDefinition.builder("orders")
                .resilience(new WorkflowDefinition.Resilience(
                        Map.of("standard", new RetryPolicyDefinition(3, 200)),
                        Map.of("ordersApi", new CircuitBreakerDefinition(5, 30000, 2))))
                .build();
    }

    @Test
    void testInlineFieldsOverrideSharedRetryPolicy() {
        WorkflowStageDefinition stage = WorkflowStageDefinition.builder("Create", "Endpoint")
                .retry(new WorkflowStageDefinition.Retry("standard", 1, null, List.of(503, 504), "Gave up"))
                .build();

        RetryPolicy policy = ResiliencePolicyResolver.resolveRetry(definition, stage).orElseThrow();

        assertEquals(1, policy.getMaxRetries());
        assertEquals(200, policy.getDelayMs());
        assertEquals(Set.of(503, 504), policy.getRetryStatuses());
        assertEquals(Optional.of("Gave up"), policy.getOnExceptionMessage());
    }

    @Test
    void testRetryWithoutStatusesIsIgnored() {
        WorkflowStageDefinition stage = WorkflowStageDefinition.builder("Create", "Endpoint")
                .retry(new WorkflowStageDefinition.Retry("standard", null, null, List.of(), null))
                .build();

        assertTrue(ResiliencePolicyResolver.resolveRetry(definition, stage).isEmpty());
    }

    @Test
    void testRetryWithoutDelayIsIgnored() {
        WorkflowStageDefinition stage = WorkflowStageDefinition.builder("Create", "Endpoint")
                .retry(new WorkflowStageDefinition.Retry(null, 2, null, List.of(503), null))
                .build();

        assertTrue(ResiliencePolicyResolver.resolveRetry(definition, stage).isEmpty());
    }

    @Test
    void testBreakerNamedAfterSharedReference() {
        WorkflowStageDefinition stage = WorkflowStageDefinition.builder("Create", "Endpoint")
                .retry(new WorkflowStageDefinition.Retry("standard", null, null, List.of(503), null))
                .circuitBreaker(new WorkflowStageDefinition.CircuitBreaker("ordersApi", null, 1000, null,
                        "Opened", "Blocked"))
                .build();

        Optional<RetryPolicy> retry = ResiliencePolicyResolver.resolveRetry(definition, stage);
        CircuitBreakerPolicy policy = ResiliencePolicyResolver.resolveCircuitBreaker(definition, stage, retry)
                .orElseThrow();

        assertEquals("ordersApi", policy.getName());
        assertEquals(5, policy.getFailureThreshold());
        assertEquals(1000, policy.getBreakMs());
        assertEquals(2, policy.getCloseOnSuccessAttempts());
        assertEquals(Optional.of("Blocked"), policy.getOnBlockedMessage());
    }

    @Test
    void testInlineBreakerNamedAfterStage() {
        WorkflowStageDefinition stage = WorkflowStageDefinition.builder("Create", "Endpoint")
                .retry(new WorkflowStageDefinition.Retry(null, 0, 0, List.of(500), null))
                .circuitBreaker(new WorkflowStageDefinition.CircuitBreaker(null, 2, 500, null, null, null))
                .build();

        Optional<RetryPolicy> retry = ResiliencePolicyResolver.resolveRetry(definition, stage);
        CircuitBreakerPolicy policy = ResiliencePolicyResolver.resolveCircuitBreaker(definition, stage, retry)
                .orElseThrow();

        assertEquals("Create", policy.getName());
        assertEquals(1, policy.getCloseOnSuccessAttempts());
    }

    @Test
    void testBreakerRequiresRetryPolicy() {
        WorkflowStageDefinition stage = WorkflowStageDefinition.builder("Create", "Endpoint")
                .circuitBreaker(new WorkflowStageDefinition.CircuitBreaker(null, 2, 500, 1, null, null))
                .build();

        assertTrue(ResiliencePolicyResolver.resolveCircuitBreaker(definition, stage, Optional.empty()).isEmpty());
    }
}
