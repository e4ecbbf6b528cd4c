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

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed form of a workflow document: references, inputs, init stage, resilience policies,
 * the ordered stage list and the end stage.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public class WorkflowDefinition {

    private final String version;
    private final String id;
    private final String name;
    private final String description;
    private final boolean output;
    private final References references;
    private final List<InputDefinition> inputs;
    private final InitStage initStage;
    private final Resilience resilience;
    private final List<WorkflowStageDefinition> stages;
    private final EndStage endStage;

    private WorkflowDefinition(Builder builder) {
        this.version = builder.version;
        this.id = builder.id;
        this.name = Objects.requireNonNull(builder.name, "Workflow name cannot be null");
        this.description = builder.description;
        this.output = builder.output;
        this.references = builder.references != null ? builder.references : References.empty();
        this.inputs = builder.inputs != null ? List.copyOf(builder.inputs) : List.of();
        this.initStage = builder.initStage;
        this.resilience = builder.resilience != null ? builder.resilience : Resilience.empty();
        this.stages = builder.stages != null ? List.copyOf(builder.stages) : List.of();
        this.endStage = builder.endStage;
    }

    public String getVersion() {
        return version;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Whether end-stage outputs are produced and written to the output file.
     */
    public boolean isOutput() {
        return output;
    }

    public References getReferences() {
        return references;
    }

    public List<InputDefinition> getInputs() {
        return inputs;
    }

    public Optional<InitStage> getInitStage() {
        return Optional.ofNullable(initStage);
    }

    public Resilience getResilience() {
        return resilience;
    }

    public List<WorkflowStageDefinition> getStages() {
        return stages;
    }

    public Optional<EndStage> getEndStage() {
        return Optional.ofNullable(endStage);
    }

    public Optional<WorkflowStageDefinition> findStage(String stageName) {
        return stages.stream()
                .filter(stage -> stage.getName().equalsIgnoreCase(stageName))
                .findFirst();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return output == that.output &&
               Objects.equals(version, that.version) &&
               Objects.equals(id, that.id) &&
               Objects.equals(name, that.name) &&
               Objects.equals(stages, that.stages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, id, name, output, stages);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "version='" + version + '\'' +
               ", id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", stages=" + stages.size() +
               '}';
    }

    public static class References {
        private final List<WorkflowReference> workflows;
        private final List<ApiReference> apis;
        private final String environmentFile;

        public References(List<WorkflowReference> workflows, List<ApiReference> apis, String environmentFile) {
            this.workflows = workflows != null ? List.copyOf(workflows) : List.of();
            this.apis = apis != null ? List.copyOf(apis) : List.of();
            this.environmentFile = environmentFile;
        }

        public static References empty() {
            return new References(null, null, null);
        }

        public List<WorkflowReference> getWorkflows() {
            return workflows;
        }

        public List<ApiReference> getApis() {
            return apis;
        }

        public Optional<String> getEnvironmentFile() {
            return Optional.ofNullable(environmentFile);
        }

        public Optional<WorkflowReference> findWorkflow(String name) {
            return workflows.stream().filter(ref -> ref.getName().equalsIgnoreCase(name)).findFirst();
        }

        public Optional<ApiReference> findApi(String name) {
            return apis.stream().filter(ref -> ref.getName().equalsIgnoreCase(name)).findFirst();
        }
    }

    /**
     * Alias for a child workflow file, relative to the referencing workflow.
     */
    public static class WorkflowReference {
        private final String name;
        private final String path;

        public WorkflowReference(String name, String path) {
            this.name = Objects.requireNonNull(name, "Reference name cannot be null");
            this.path = Objects.requireNonNull(path, "Reference path cannot be null");
        }

        public String getName() {
            return name;
        }

        public String getPath() {
            return path;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            WorkflowReference that = (WorkflowReference) o;
            return name.equals(that.name) && path.equals(that.path);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, path);
        }
    }

    /**
     * Alias for an API catalog definition.
     */
    public static class ApiReference {
        private final String name;
        private final String definition;

        public ApiReference(String name, String definition) {
            this.name = Objects.requireNonNull(name, "Reference name cannot be null");
            this.definition = Objects.requireNonNull(definition, "Definition name cannot be null");
        }

        public String getName() {
            return name;
        }

        public String getDefinition() {
            return definition;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ApiReference that = (ApiReference) o;
            return name.equals(that.name) && definition.equals(that.definition);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, definition);
        }
    }

    public static class InputDefinition {
        private final String name;
        private final String type;
        private final boolean required;
        private final String description;

        public InputDefinition(String name, String type, boolean required, String description) {
            this.name = Objects.requireNonNull(name, "Input name cannot be null");
            this.type = type;
            this.required = required;
            this.description = description;
        }

        public String getName() {
            return name;
        }

        public String getType() {
            return type;
        }

        public boolean isRequired() {
            return required;
        }

        public String getDescription() {
            return description;
        }
    }

    public static class InitStage {
        private final List<VariableDefinition> variables;
        private final Map<String, String> context;

        public InitStage(List<VariableDefinition> variables, Map<String, String> context) {
            this.variables = variables != null ? List.copyOf(variables) : List.of();
            this.context = OrderedMaps.copyOf(context);
        }

        public List<VariableDefinition> getVariables() {
            return variables;
        }

        /**
         * Initial context values; they never overwrite context already present.
         */
        public Map<String, String> getContext() {
            return context;
        }
    }

    public static class Resilience {
        private final Map<String, RetryPolicyDefinition> retries;
        private final Map<String, CircuitBreakerDefinition> circuitBreakers;

        public Resilience(Map<String, RetryPolicyDefinition> retries,
                          Map<String, CircuitBreakerDefinition> circuitBreakers) {
            this.retries = OrderedMaps.copyOf(retries);
            this.circuitBreakers = OrderedMaps.copyOf(circuitBreakers);
        }

        public static Resilience empty() {
            return new Resilience(null, null);
        }

        public Map<String, RetryPolicyDefinition> getRetries() {
            return retries;
        }

        public Map<String, CircuitBreakerDefinition> getCircuitBreakers() {
            return circuitBreakers;
        }
    }

    public static class EndStage {
        private final Map<String, String> output;
        private final boolean outputJson;
        private final Map<String, String> context;
        private final String resultMessage;
        private final boolean contextOnFailure;

        public EndStage(Map<String, String> output, boolean outputJson, Map<String, String> context,
                        String resultMessage, boolean contextOnFailure) {
            this.output = OrderedMaps.copyOf(output);
            this.outputJson = outputJson;
            this.context = OrderedMaps.copyOf(context);
            this.resultMessage = resultMessage;
            this.contextOnFailure = contextOnFailure;
        }

        public Map<String, String> getOutput() {
            return output;
        }

        /**
         * When writing the output file, embed values that look like JSON as JSON.
         */
        public boolean isOutputJson() {
            return outputJson;
        }

        public Map<String, String> getContext() {
            return context;
        }

        public Optional<String> getResultMessage() {
            return Optional.ofNullable(resultMessage);
        }

        /**
         * Whether the {@code context} writes also run after the stage loop failed.
         */
        public boolean isContextOnFailure() {
            return contextOnFailure;
        }
    }

    public static class Builder {
        private final String name;
        private String version;
        private String id;
        private String description;
        private boolean output;
        private References references;
        private List<InputDefinition> inputs;
        private InitStage initStage;
        private Resilience resilience;
        private List<WorkflowStageDefinition> stages;
        private EndStage endStage;

        private Builder(String name) {
            this.name = name;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder output(boolean output) {
            this.output = output;
            return this;
        }

        public Builder references(References references) {
            this.references = references;
            return this;
        }

        public Builder inputs(List<InputDefinition> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder initStage(InitStage initStage) {
            this.initStage = initStage;
            return this;
        }

        public Builder resilience(Resilience resilience) {
            this.resilience = resilience;
            return this;
        }

        public Builder stages(List<WorkflowStageDefinition> stages) {
            this.stages = stages;
            return this;
        }

        public Builder endStage(EndStage endStage) {
            this.endStage = endStage;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(this);
        }
    }
}
