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


package dev.mars.stageflow.workflow.loader;

import dev.mars.stageflow.workflow.definition.WorkflowDocument;

import java.nio.file.Path;
import java.util.Map;

/**
 * Loads workflow documents from disk. The engine calls this synchronously when it dispatches
 * a {@code Workflow} stage, so implementations must be safe to call repeatedly for the same file.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 */
public interface WorkflowLoader {

    /**
     * Loads and maps a workflow file.
     *
     * @param workflowFile path to the workflow document
     * @param parentEnvironment environment inherited from the caller; its entries override the document's
     *                          own environment file. May be empty.
     * @return the parsed document with its absolute path and merged environment
     * @throws WorkflowParseException if the file cannot be read, is not valid YAML or cannot be mapped
     */
    WorkflowDocument load(Path workflowFile, Map<String, String> parentEnvironment) throws WorkflowParseException;
}
