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

import java.util.Objects;
import java.util.Optional;

/**
 * Effective circuit breaker settings for one stage. Breakers are shared by name:
 * the referenced policy name, or the stage name for inline breakers.
 */
public final class CircuitBreakerPolicy {

    private final String name;
    private final int failureThreshold;
    private final long breakMs;
    private final int closeOnSuccessAttempts;
    private final String onOpenMessage;
    private final String onBlockedMessage;

    public CircuitBreakerPolicy(String name, int failureThreshold, long breakMs, int closeOnSuccessAttempts,
                                String onOpenMessage, String onBlockedMessage) {
        this.name = Objects.requireNonNull(name, "Circuit breaker name cannot be null");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        this.failureThreshold = failureThreshold;
        this.breakMs = Math.max(0, breakMs);
        this.closeOnSuccessAttempts = Math.max(1, closeOnSuccessAttempts);
        this.onOpenMessage = onOpenMessage;
        this.onBlockedMessage = onBlockedMessage;
    }

    public String getName() {
        return name;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public long getBreakMs() {
        return breakMs;
    }

    public int getCloseOnSuccessAttempts() {
        return closeOnSuccessAttempts;
    }

    public Optional<String> getOnOpenMessage() {
        return Optional.ofNullable(onOpenMessage);
    }

    public Optional<String> getOnBlockedMessage() {
        return Optional.ofNullable(onBlockedMessage);
    }

    @Override
    public String toString() {
        return "CircuitBreakerPolicy{" +
               "name='" + name + '\'' +
               ", failureThreshold=" + failureThreshold +
               ", breakMs=" + breakMs +
               ", closeOnSuccessAttempts=" + closeOnSuccessAttempts +
               '}';
    }
}
