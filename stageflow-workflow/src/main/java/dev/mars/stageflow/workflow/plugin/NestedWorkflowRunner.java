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

import dev.mars.stageflow.workflow.definition.WorkflowDocument;
import dev.mars.stageflow.workflow.execution.ExecutionContext;
import dev.mars.stageflow.workflow.execution.WorkflowExecution;

/**
 * Runs a child workflow synchronously with the options of the current run.
 * Failures are reported through the returned execution; only cancellation is thrown.
 */
@FunctionalInterface
public interface NestedWorkflowRunner {

    WorkflowExecution run(WorkflowDocument document, ExecutionContext context) throws InterruptedException;
}
