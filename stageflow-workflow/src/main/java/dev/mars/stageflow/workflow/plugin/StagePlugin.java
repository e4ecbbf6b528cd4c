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

import dev.mars.stageflow.core.exceptions.StageflowException;
import dev.mars.stageflow.workflow.definition.WorkflowStageDefinition;

import java.util.List;
import java.util.Set;

/**
 * Handler for one or more stage kinds. A plugin validates stages of its kinds before a run
 * and executes them during one.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 */
public interface StagePlugin {

    /**
     * Identifier used in the {@code stageflow.plugins} configuration list.
     */
    String getId();

    /**
     * Stage kinds this plugin handles, matched case-insensitively.
     */
    Set<String> getStageKinds();

    StagePluginCapabilities getCapabilities();

    /**
     * Adds a message to {@code errors} for every problem found in the stage.
     */
    void validate(WorkflowStageDefinition stage, StageValidationContext context, List<String> errors);

    /**
     * Executes the stage against the invocation's scopes.
     *
     * @return what the executor should do next
     * @throws StageflowException if the stage fails
     * @throws InterruptedException if the run is cancelled
     */
    StageOutcome execute(WorkflowStageDefinition stage, StageExecutionContext context)
            throws StageflowException, InterruptedException;
}
