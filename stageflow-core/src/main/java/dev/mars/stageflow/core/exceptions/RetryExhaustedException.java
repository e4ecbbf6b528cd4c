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
 * A stage failure after every retry permitted by its retry policy was used.
 */
public class RetryExhaustedException extends StageFailureException {

    private final int attempts;

    public RetryExhaustedException(String workflowName, String stageName, Integer statusCode,
                                   int attempts, String message, Throwable cause) {
        super(workflowName, stageName, statusCode, message, cause);
        this.attempts = attempts;
    }

    /**
     * Total attempts made, the initial call included.
     */
    public int getAttempts() {
        return attempts;
    }
}
