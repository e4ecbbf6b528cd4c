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

package dev.mars.stageflow.workflow.definition;

import java.util.Objects;
import java.util.Optional;

/**
 * Named circuit breaker policy from the workflow's {@code resilience.circuitBreakers} section.
 */
public class CircuitBreakerDefinition {

    private final Integer failureThreshold;
    private final Integer breakMs;
    private final Integer closeOnSuccessAttempts;

    public CircuitBreakerDefinition(Integer failureThreshold, Integer breakMs, Integer closeOnSuccessAttempts) {
        this.failureThreshold = failureThreshold;
        this.breakMs = breakMs;
        this.closeOnSuccessAttempts = closeOnSuccessAttempts;
    }

    public Optional<Integer> getFailureThreshold() {
        return Optional.ofNullable(failureThreshold);
    }

    public Optional<Integer> getBreakMs() {
        return Optional.ofNullable(breakMs);
    }

    public Optional<Integer> getCloseOnSuccessAttempts() {
        return Optional.ofNullable(closeOnSuccessAttempts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CircuitBreakerDefinition that = (CircuitBreakerDefinition) o;
        return Objects.equals(failureThreshold, that.failureThreshold) &&
               Objects.equals(breakMs, that.breakMs) &&
               Objects.equals(closeOnSuccessAttempts, that.closeOnSuccessAttempts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(failureThreshold, breakMs, closeOnSuccessAttempts);
    }

    @Override
    public String toString() {
        return "CircuitBreakerDefinition{" +
               "failureThreshold=" + failureThreshold +
               ", breakMs=" + breakMs +
               ", closeOnSuccessAttempts=" + closeOnSuccessAttempts +
               '}';
    }
}
