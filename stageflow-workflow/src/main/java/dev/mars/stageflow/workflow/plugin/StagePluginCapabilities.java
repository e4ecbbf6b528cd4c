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


package dev.mars.stageflow.workflow.plugin;

/**
 * Flags the executor and validator consult for a stage kind.
 *
 * @param allowsResponseTokens whether {@code response.*} tokens may appear in the stage's output and message
 * @param supportsJumpOnStatus whether {@code jumpOnStatus} is meaningful for the stage
 * @param continueOnError whether a failure is recorded as a result instead of failing the workflow
 */
public record StagePluginCapabilities(boolean allowsResponseTokens, boolean supportsJumpOnStatus,
                                      boolean continueOnError) {
}
