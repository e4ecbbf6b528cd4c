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
 * Exception thrown when a stage does not complete as expected, for example
 * when an endpoint answers with a status that is neither expected nor mapped to a jump.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class StageFailureException extends StageflowException {

    private final String workflowName;
    private final String stageName;
    private final Integer statusCode;

    public StageFailureException(String workflowName, String stageName, String message) {
        this(workflowName, stageName, null, message, null);
    }

    public StageFailureException(String workflowName, String stageName, String message, Throwable cause) {
        this(workflowName, stageName, null, message, cause);
    }

    public StageFailureException(String workflowName, String stageName, Integer statusCode, String message) {
        this(workflowName, stageName, statusCode, message, null);
    }

    public StageFailureException(String workflowName, String stageName, Integer statusCode,
                                 String message, Throwable cause) {
        super(message, cause);
        this.workflowName = workflowName;
        this.stageName = stageName;
        this.statusCode = statusCode;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public String getStageName() {
        return stageName;
    }

    /**
     * The last HTTP status observed, or {@code null} when the stage failed before a response arrived.
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
