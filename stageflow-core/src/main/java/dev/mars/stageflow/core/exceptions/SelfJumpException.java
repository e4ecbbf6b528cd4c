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
 * Raised when a stage's jump target is the stage itself while running mocked,
 * where the same synthetic response would loop forever.
 */
public class SelfJumpException extends StageFailureException {

    public SelfJumpException(String workflowName, String stageName) {
        super(workflowName, stageName,
                String.format("Stage '%s' in workflow '%s' jumps to itself while running mocked.", stageName, workflowName));
    }
}
