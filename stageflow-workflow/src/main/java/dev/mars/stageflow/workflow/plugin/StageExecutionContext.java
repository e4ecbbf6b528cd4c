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

import dev.mars.stageflow.workflow.definition.ApiCatalogVersion;
import dev.mars.stageflow.workflow.definition.WorkflowDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowDocument;
import dev.mars.stageflow.workflow.execution.ExecutionContext;
import dev.mars.stageflow.workflow.execution.ExecutionOptions;

import java.util.Objects;
import java.util.Optional;

/**
 * Everything a plugin sees while executing one stage of one workflow invocation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 */
public class StageExecutionContext {

    private final WorkflowDocument document;
    private final ExecutionContext executionContext;
    private final ExecutionOptions options;
    private final NestedWorkflowRunner nestedRunner;

    public StageExecutionContext(WorkflowDocument document, ExecutionContext executionContext,
                                 ExecutionOptions options, NestedWorkflowRunner nestedRunner) {
        this.document = Objects.requireNonNull(document, "Workflow document cannot be null");
        this.executionContext = Objects.requireNonNull(executionContext, "Execution context cannot be null");
        this.options = Objects.requireNonNull(options, "Execution options cannot be null");
        this.nestedRunner = Objects.requireNonNull(nestedRunner, "Nested workflow runner cannot be null");
    }

    public WorkflowDocument getDocument() {
        return document;
    }

    public WorkflowDefinition getDefinition() {
        return document.getDefinition();
    }

    public ExecutionContext getExecutionContext() {
        return executionContext;
    }

    public ExecutionOptions getOptions() {
        return options;
    }

    public boolean isMocked() {
        return options.isMocked();
    }

    public String getEnvironment() {
        return options.getEnvironment();
    }

    public Optional<ApiCatalogVersion> getCatalogVersion() {
        return options.getCatalogVersion();
    }

    public NestedWorkflowRunner getNestedRunner() {
        return nestedRunner;
    }
}
