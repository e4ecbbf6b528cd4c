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

package dev.mars.stageflow.workflow.definition;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A loaded workflow: its definition, the absolute file it came from and the merged environment variables.
 */
public class WorkflowDocument {

    private final WorkflowDefinition definition;
    private final Path filePath;
    private final Map<String, String> environmentVariables;

    public WorkflowDocument(WorkflowDefinition definition, Path filePath, Map<String, String> environmentVariables) {
        this.definition = Objects.requireNonNull(definition, "Definition cannot be null");
        this.filePath = Objects.requireNonNull(filePath, "File path cannot be null");
        Map<String, String> env = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (environmentVariables != null) {
            env.putAll(environmentVariables);
        }
        this.environmentVariables = Collections.unmodifiableMap(env);
    }

    public WorkflowDefinition getDefinition() {
        return definition;
    }

    public Path getFilePath() {
        return filePath;
    }

    public Path getDirectory() {
        Path parent = filePath.toAbsolutePath().getParent();
        return parent != null ? parent : filePath.toAbsolutePath();
    }

    public Map<String, String> getEnvironmentVariables() {
        return environmentVariables;
    }

    @Override
    public String toString() {
        return "WorkflowDocument{workflow='" + definition.getName() + "', path=" + filePath + '}';
    }
}
