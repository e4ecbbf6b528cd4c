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
 * Named retry policy from the workflow's {@code resilience.retries} section.
 * Fields are optional so a stage can override any of them.
 */
public class RetryPolicyDefinition {

    private final Integer maxRetries;
    private final Integer delayMs;

    public RetryPolicyDefinition(Integer maxRetries, Integer delayMs) {
        this.maxRetries = maxRetries;
        this.delayMs = delayMs;
    }

    public Optional<Integer> getMaxRetries() {
        return Optional.ofNullable(maxRetries);
    }

    public Optional<Integer> getDelayMs() {
        return Optional.ofNullable(delayMs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryPolicyDefinition that = (RetryPolicyDefinition) o;
        return Objects.equals(maxRetries, that.maxRetries) && Objects.equals(delayMs, that.delayMs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxRetries, delayMs);
    }

    @Override
    public String toString() {
        return "RetryPolicyDefinition{maxRetries=" + maxRetries + ", delayMs=" + delayMs + '}';
    }
}
