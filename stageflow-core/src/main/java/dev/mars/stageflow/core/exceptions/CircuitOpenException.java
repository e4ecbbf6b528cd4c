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

package dev.mars.stageflow.core.exceptions;

/**
 * A stage call rejected by an open circuit breaker. No transport call was made.
 */
public class CircuitOpenException extends StageFailureException {

    private final String breakerName;
    private final long remainingBreakMs;

    public CircuitOpenException(String workflowName, String stageName, String breakerName, long remainingBreakMs) {
        super(workflowName, stageName,
                String.format("Circuit breaker '%s' is open for stage '%s' (%d ms remaining).",
                        breakerName, stageName, remainingBreakMs));
        this.breakerName = breakerName;
        this.remainingBreakMs = remainingBreakMs;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public long getRemainingBreakMs() {
        return remainingBreakMs;
    }
}
