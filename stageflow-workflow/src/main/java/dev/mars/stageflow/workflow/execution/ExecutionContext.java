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

package dev.mars.stageflow.workflow.execution;

import dev.mars.stageflow.workflow.resilience.CircuitBreakerRegistry;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Variable scopes of a single workflow invocation. A nested workflow gets its own instance;
 * only its {@code context} map starts as a copy of the parent's.
 * <p>
 * Instances are confined to the thread running the invocation and are not thread-safe.
 * All lookups are case-insensitive.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public class ExecutionContext {

    public static final String RESULT_STATUS = "status";
    public static final String RESULT_MESSAGE = "message";

    private final Map<String, String> inputs;
    private final Map<String, String> environmentVariables;
    private final Map<String, String> globals = caseInsensitiveMap();
    private final Map<String, String> context;
    private final Map<String, Map<String, String>> endpointOutputs = caseInsensitiveMap();
    private final Map<String, Map<String, String>> workflowOutputs = caseInsensitiveMap();
    private final Map<String, Map<String, String>> workflowResults = caseInsensitiveMap();
    private final CircuitBreakerRegistry circuitBreakers = new CircuitBreakerRegistry();
    private final int indentLevel;
    private Path outputFilePath;

    public ExecutionContext(Map<String, String> inputs, Map<String, String> environmentVariables) {
        this(inputs, environmentVariables, null, 0);
    }

    public ExecutionContext(Map<String, String> inputs, Map<String, String> environmentVariables,
                            Map<String, String> parentContext, int indentLevel) {
        this.inputs = Collections.unmodifiableMap(copy(inputs));
        this.environmentVariables = Collections.unmodifiableMap(copy(environmentVariables));
        this.context = copy(parentContext);
        this.indentLevel = Math.max(0, indentLevel);
    }

    public Map<String, String> getInputs() {
        return inputs;
    }

    public Map<String, String> getEnvironmentVariables() {
        return environmentVariables;
    }

    /**
     * Init-stage values and stage {@code set} bindings.
     */
    public Map<String, String> getGlobals() {
        return globals;
    }

    /**
     * The mutable map carried across stages and into nested workflows.
     */
    public Map<String, String> getContext() {
        return context;
    }

    public Map<String, Map<String, String>> getEndpointOutputs() {
        return Collections.unmodifiableMap(endpointOutputs);
    }

    public Map<String, Map<String, String>> getWorkflowOutputs() {
        return Collections.unmodifiableMap(workflowOutputs);
    }

    public Map<String, Map<String, String>> getWorkflowResults() {
        return Collections.unmodifiableMap(workflowResults);
    }

    public void putEndpointOutput(String stageName, Map<String, String> output) {
        endpointOutputs.put(Objects.requireNonNull(stageName, "Stage name cannot be null"),
                Collections.unmodifiableMap(copy(output)));
    }

    public void putWorkflowOutput(String stageName, Map<String, String> output) {
        workflowOutputs.put(Objects.requireNonNull(stageName, "Stage name cannot be null"),
                Collections.unmodifiableMap(copy(output)));
    }

    public void putWorkflowResult(String stageName, String status, String message) {
        Map<String, String> result = caseInsensitiveMap();
        result.put(RESULT_STATUS, status != null ? status : "");
        result.put(RESULT_MESSAGE, message != null ? message : "");
        workflowResults.put(Objects.requireNonNull(stageName, "Stage name cannot be null"),
                Collections.unmodifiableMap(result));
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return circuitBreakers;
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    public Optional<Path> getOutputFilePath() {
        return Optional.ofNullable(outputFilePath);
    }

    public void setOutputFilePath(Path outputFilePath) {
        this.outputFilePath = outputFilePath;
    }

    @Override
    public String toString() {
        return "ExecutionContext{" +
               "inputs=" + inputs.keySet() +
               ", globals=" + globals.keySet() +
               ", context=" + context.keySet() +
               ", indentLevel=" + indentLevel +
               '}';
    }

    private static <V> Map<String, V> caseInsensitiveMap() {
        return new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    }

    private static Map<String, String> copy(Map<String, String> source) {
        Map<String, String> copy = caseInsensitiveMap();
        if (source != null) {
            copy.putAll(source);
        }
        return copy;
    }
}
