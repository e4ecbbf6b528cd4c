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

import dev.mars.stageflow.workflow.definition.WorkflowDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowDocument;
import dev.mars.stageflow.workflow.loader.WorkflowLoader;
import dev.mars.stageflow.workflow.plugin.http.MockPayloadService;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only view of a workflow document prepared for per-stage validation.
 * Workflow references are resolved to absolute paths relative to the document's directory.
 */
public class StageValidationContext {

    private final WorkflowDocument document;
    private final WorkflowLoader workflowLoader;
    private final MockPayloadService mockPayloadService;
    private final Map<String, Path> workflowReferences;
    private final Set<String> apiReferences;

    public StageValidationContext(WorkflowDocument document, WorkflowLoader workflowLoader,
                                  MockPayloadService mockPayloadService) {
        this.document = Objects.requireNonNull(document, "Workflow document cannot be null");
        this.workflowLoader = Objects.requireNonNull(workflowLoader, "Workflow loader cannot be null");
        this.mockPayloadService = Objects.requireNonNull(mockPayloadService, "Mock payload service cannot be null");

        Map<String, Path> workflows = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (WorkflowDefinition.WorkflowReference reference : document.getDefinition().getReferences().getWorkflows()) {
            if (reference.getName() != null && reference.getPath() != null) {
                workflows.put(reference.getName(),
                        document.getDirectory().resolve(reference.getPath()).toAbsolutePath().normalize());
            }
        }
        this.workflowReferences = Collections.unmodifiableMap(workflows);

        Set<String> apis = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (WorkflowDefinition.ApiReference reference : document.getDefinition().getReferences().getApis()) {
            if (reference.getName() != null) {
                apis.add(reference.getName());
            }
        }
        this.apiReferences = Collections.unmodifiableSet(apis);
    }

    public WorkflowDocument getDocument() {
        return document;
    }

    public WorkflowDefinition getDefinition() {
        return document.getDefinition();
    }

    public WorkflowLoader getWorkflowLoader() {
        return workflowLoader;
    }

    public MockPayloadService getMockPayloadService() {
        return mockPayloadService;
    }

    public Map<String, Path> getWorkflowReferences() {
        return workflowReferences;
    }

    public Set<String> getApiReferences() {
        return apiReferences;
    }

    public Map<String, String> getEnvironmentVariables() {
        return document.getEnvironmentVariables();
    }

    public WorkflowDefinition.Resilience getResilience() {
        return document.getDefinition().getResilience();
    }
}
