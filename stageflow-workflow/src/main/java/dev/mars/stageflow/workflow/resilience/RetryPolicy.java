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

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Effective retry settings for one stage after merging the named policy with inline overrides.
 * Delay is fixed between attempts.
 */
public final class RetryPolicy {

    private final int maxRetries;
    private final long delayMs;
    private final Set<Integer> retryStatuses;
    private final String onExceptionMessage;

    public RetryPolicy(int maxRetries, long delayMs, Set<Integer> retryStatuses, String onExceptionMessage) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative");
        }
        this.maxRetries = maxRetries;
        this.delayMs = delayMs;
        this.retryStatuses = Set.copyOf(new LinkedHashSet<>(Objects.requireNonNull(retryStatuses,
                "Retry statuses cannot be null")));
        this.onExceptionMessage = onExceptionMessage;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getDelayMs() {
        return delayMs;
    }

    public Set<Integer> getRetryStatuses() {
        return retryStatuses;
    }

    public boolean isRetryStatus(int statusCode) {
        return retryStatuses.contains(statusCode);
    }

    public Optional<String> getOnExceptionMessage() {
        return Optional.ofNullable(onExceptionMessage);
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + maxRetries + ", delayMs=" + delayMs + ", retryStatuses=" + retryStatuses + '}';
    }
}
