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

import dev.mars.stageflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.stageflow.workflow.definition.CircuitBreakerDefinition;
import dev.mars.stageflow.workflow.definition.RetryPolicyDefinition;
import dev.mars.stageflow.workflow.definition.VariableDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowDocument;
import dev.mars.stageflow.workflow.definition.WorkflowStageDefinition;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * YAML implementation of {@link WorkflowLoader} based on SnakeYAML.
 * <p>
 * Uses the safe constructor, so documents can only produce maps, lists and scalars.
 * Unknown keys are ignored. The document's {@code references.environmentFile} is resolved
 * relative to the workflow file and merged with the parent environment, the parent winning.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class YamlWorkflowLoader implements WorkflowLoader {

    private static final Logger logger = Logger.getLogger(YamlWorkflowLoader.class.getName());

    private final EnvironmentFileLoader environmentFileLoader;

    public YamlWorkflowLoader() {
        this(new EnvironmentFileLoader());
    }

    public YamlWorkflowLoader(EnvironmentFileLoader environmentFileLoader) {
        this.environmentFileLoader = environmentFileLoader;
    }

    @Override
    public WorkflowDocument load(Path workflowFile, Map<String, String> parentEnvironment) throws WorkflowParseException {
        if (workflowFile == null) {
            throw new WorkflowParseException("Workflow path is required.");
        }
        if (!Files.isRegularFile(workflowFile)) {
            throw new WorkflowParseException("Workflow file was not found: " + workflowFile);
        }

        String content;
        try {
            content = Files.readString(workflowFile);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + workflowFile, e);
        }

        Path absolutePath = workflowFile.toAbsolutePath().normalize();
        WorkflowDefinition definition = parseFromString(content);
        Map<String, String> environment = resolveEnvironment(definition, absolutePath, parentEnvironment);
        logger.fine("Loaded workflow '" + definition.getName() + "' from " + absolutePath);
        return new WorkflowDocument(definition, absolutePath, environment);
    }

    /**
     * Maps YAML content into a workflow definition without touching the file system.
     */
    public WorkflowDefinition parseFromString(String yamlContent) throws WorkflowParseException {
        Object loaded;
        try {
            // Yaml instances are not thread-safe
            loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(yamlContent);
        } catch (MarkedYAMLException e) {
            int line = e.getProblemMark() != null ? e.getProblemMark().getLine() + 1 : -1;
            throw new WorkflowParseException(null, line, null, "Failed to parse workflow YAML: " + e.getProblem(), e);
        } catch (YAMLException e) {
            throw new WorkflowParseException("Failed to parse workflow YAML: " + e.getMessage(), e);
        }

        if (!(loaded instanceof Map)) {
            throw new WorkflowParseException("Workflow file is empty or invalid.");
        }
        return parseWorkflowDefinition(asMap(loaded));
    }

    private Map<String, String> resolveEnvironment(WorkflowDefinition definition, Path workflowFile,
                                                   Map<String, String> parentEnvironment) throws WorkflowParseException {
        Map<String, String> variables = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        String envFile = definition.getReferences().getEnvironmentFile().filter(value -> !value.isBlank()).orElse(null);
        if (envFile != null) {
            Path resolved = workflowFile.getParent().resolve(envFile).toAbsolutePath().normalize();
            try {
                variables.putAll(environmentFileLoader.load(resolved));
            } catch (WorkflowConfigurationException e) {
                throw new WorkflowParseException(definition.getName(), -1, "references.environmentFile", e.getMessage(), e);
            }
        }
        if (parentEnvironment != null) {
            variables.putAll(parentEnvironment);
        }
        return variables;
    }

    private WorkflowDefinition parseWorkflowDefinition(Map<String, Object> data) throws WorkflowParseException {
        String name = getStringValue(data, "name");
        if (name == null || name.trim().isEmpty()) {
            throw new WorkflowParseException("name", "Workflow name is required");
        }

        try {
            return WorkflowDefinition.builder(name)
                    .version(getStringValue(data, "version"))
                    .id(getStringValue(data, "id"))
                    .description(getStringValue(data, "description"))
                    .output(getBooleanValue(data, "output", false))
                    .references(parseReferences(getMapValue(data, "references")))
                    .inputs(parseInputs(getListValue(data, "input")))
                    .initStage(parseInitStage(getMapValue(data, "initStage")))
                    .resilience(parseResilience(getMapValue(data, "resilience")))
                    .stages(parseStages(getListValue(data, "stages")))
                    .endStage(parseEndStage(getMapValue(data, "endStage")))
                    .build();
        } catch (WorkflowParseException e) {
            throw e.forWorkflow(name);
        }
    }

    private WorkflowDefinition.References parseReferences(Map<String, Object> data) throws WorkflowParseException {
        if (data == null) {
            return WorkflowDefinition.References.empty();
        }

        List<WorkflowDefinition.WorkflowReference> workflows = new ArrayList<>();
        List<Map<String, Object>> workflowList = getListValue(data, "workflows");
        for (int i = 0; i < workflowList.size(); i++) {
            Map<String, Object> item = workflowList.get(i);
            String name = requireString(item, "name", "references.workflows[" + i + "].name");
            String path = requireString(item, "path", "references.workflows[" + i + "].path");
            workflows.add(new WorkflowDefinition.WorkflowReference(name, path));
        }

        List<WorkflowDefinition.ApiReference> apis = new ArrayList<>();
        List<Map<String, Object>> apiList = getListValue(data, "apis");
        for (int i = 0; i < apiList.size(); i++) {
            Map<String, Object> item = apiList.get(i);
            String name = requireString(item, "name", "references.apis[" + i + "].name");
            String definition = requireString(item, "definition", "references.apis[" + i + "].definition");
            apis.add(new WorkflowDefinition.ApiReference(name, definition));
        }

        return new WorkflowDefinition.References(workflows, apis, getStringValue(data, "environmentFile"));
    }

    private List<WorkflowDefinition.InputDefinition> parseInputs(List<Map<String, Object>> inputList)
            throws WorkflowParseException {
        List<WorkflowDefinition.InputDefinition> inputs = new ArrayList<>();
        for (int i = 0; i < inputList.size(); i++) {
            Map<String, Object> item = inputList.get(i);
            inputs.add(new WorkflowDefinition.InputDefinition(
                    requireString(item, "name", "input[" + i + "].name"),
                    getStringValue(item, "type", "Text"),
                    getBooleanValue(item, "required", true),
                    getStringValue(item, "description")));
        }
        return inputs;
    }

    private WorkflowDefinition.InitStage parseInitStage(Map<String, Object> data) throws WorkflowParseException {
        if (data == null) {
            return null;
        }
        List<VariableDefinition> variables = new ArrayList<>();
        List<Map<String, Object>> variableList = getListValue(data, "variables");
        for (int i = 0; i < variableList.size(); i++) {
            variables.add(parseVariable(variableList.get(i), "initStage.variables[" + i + "]"));
        }
        return new WorkflowDefinition.InitStage(variables, getStringMap(data, "context"));
    }

    private VariableDefinition parseVariable(Map<String, Object> data, String path) throws WorkflowParseException {
        String name = requireString(data, "name", path + ".name");
        VariableDefinition.VariableType type;
        try {
            type = VariableDefinition.VariableType.fromString(requireString(data, "type", path + ".type"));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path + ".type", e.getMessage());
        }

        return VariableDefinition.builder(name, type)
                .value(getStringValue(data, "value"))
                .min(getIntegerValue(data, "min", path))
                .max(getIntegerValue(data, "max", path))
                .padding(getIntegerValue(data, "padding", path))
                .length(getIntegerValue(data, "length", path))
                .from(firstString(data, "fromDateTime", "fromDate", "fromTime", "from"))
                .to(firstString(data, "toDateTime", "toDate", "toTime", "to"))
                .format(getStringValue(data, "format"))
                .start(getIntegerValue(data, "start", path))
                .step(getIntegerValue(data, "step", path))
                .build();
    }

    private WorkflowDefinition.Resilience parseResilience(Map<String, Object> data) throws WorkflowParseException {
        if (data == null) {
            return WorkflowDefinition.Resilience.empty();
        }

        Map<String, RetryPolicyDefinition> retries = new LinkedHashMap<>();
        Map<String, Object> retryMap = getMapValue(data, "retries");
        if (retryMap != null) {
            for (Map.Entry<String, Object> entry : retryMap.entrySet()) {
                Map<String, Object> policy = asMap(entry.getValue());
                String path = "resilience.retries." + entry.getKey();
                retries.put(entry.getKey(), new RetryPolicyDefinition(
                        getIntegerValue(policy, "maxRetries", path),
                        getIntegerValue(policy, "delayMs", path)));
            }
        }

        Map<String, CircuitBreakerDefinition> breakers = new LinkedHashMap<>();
        Map<String, Object> breakerMap = getMapValue(data, "circuitBreakers");
        if (breakerMap != null) {
            for (Map.Entry<String, Object> entry : breakerMap.entrySet()) {
                Map<String, Object> policy = asMap(entry.getValue());
                String path = "resilience.circuitBreakers." + entry.getKey();
                breakers.put(entry.getKey(), new CircuitBreakerDefinition(
                        getIntegerValue(policy, "failureThreshold", path),
                        getIntegerValue(policy, "breakMs", path),
                        getIntegerValue(policy, "closeOnSuccessAttempts", path)));
            }
        }
        return new WorkflowDefinition.Resilience(retries, breakers);
    }

    private List<WorkflowStageDefinition> parseStages(List<Map<String, Object>> stageList) throws WorkflowParseException {
        List<WorkflowStageDefinition> stages = new ArrayList<>();
        for (int i = 0; i < stageList.size(); i++) {
            stages.add(parseStage(stageList.get(i), "stages[" + i + "]"));
        }
        return stages;
    }

    private WorkflowStageDefinition parseStage(Map<String, Object> data, String path) throws WorkflowParseException {
        String name = requireString(data, "name", path + ".name");
        String kind = requireString(data, "kind", path + ".kind");

        return WorkflowStageDefinition.builder(name, kind)
                .runIf(getStringValue(data, "runIf"))
                .apiRef(getStringValue(data, "apiRef"))
                .endpoint(getStringValue(data, "endpoint"))
                .httpVerb(getStringValue(data, "httpVerb"))
                .expectedStatus(getIntegerValue(data, "expectedStatus", path))
                .headers(getStringMap(data, "headers"))
                .query(getStringMap(data, "query"))
                .body(getStringValue(data, "body"))
                .workflowRef(getStringValue(data, "workflowRef"))
                .inputs(getStringMap(data, "inputs"))
                .debug(getStringMap(data, "debug"))
                .message(getStringValue(data, "message"))
                .output(getStringMap(data, "output"))
                .jumpOnStatus(parseJumpOnStatus(getMapValue(data, "jumpOnStatus"), path + ".jumpOnStatus"))
                .delaySeconds(getIntegerValue(data, "delaySeconds", path))
                .allowVersion(getStringValue(data, "allowVersion"))
                .set(getStringMap(data, "set"))
                .context(getStringMap(data, "context"))
                .mock(parseMock(getMapValue(data, "mock"), path + ".mock"))
                .retry(parseRetry(getMapValue(data, "retry"), path + ".retry"))
                .circuitBreaker(parseCircuitBreaker(getMapValue(data, "circuitBreaker"), path + ".circuitBreaker"))
                .build();
    }

    private Map<Integer, String> parseJumpOnStatus(Map<String, Object> data, String path) throws WorkflowParseException {
        Map<Integer, String> jumps = new LinkedHashMap<>();
        if (data == null) {
            return jumps;
        }
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            Integer status = toInteger(entry.getKey(), path);
            jumps.put(status, entry.getValue() != null ? entry.getValue().toString() : null);
        }
        return jumps;
    }

    private WorkflowStageDefinition.Mock parseMock(Map<String, Object> data, String path) throws WorkflowParseException {
        if (data == null) {
            return null;
        }
        Map<String, String> output = getMapValue(data, "output") != null ? getStringMap(data, "output") : null;
        return new WorkflowStageDefinition.Mock(
                getIntegerValue(data, "status", path),
                getStringValue(data, "payload"),
                getStringValue(data, "payloadFile"),
                output);
    }

    private WorkflowStageDefinition.Retry parseRetry(Map<String, Object> data, String path) throws WorkflowParseException {
        if (data == null) {
            return null;
        }
        List<Integer> httpStatus = new ArrayList<>();
        Object statusValue = data.get("httpStatus");
        if (statusValue instanceof List) {
            for (Object item : (List<?>) statusValue) {
                httpStatus.add(toInteger(item, path + ".httpStatus"));
            }
        } else if (statusValue != null) {
            httpStatus.add(toInteger(statusValue, path + ".httpStatus"));
        }

        Map<String, Object> messages = getMapValue(data, "messages");
        return new WorkflowStageDefinition.Retry(
                getStringValue(data, "ref"),
                getIntegerValue(data, "maxRetries", path),
                getIntegerValue(data, "delayMs", path),
                httpStatus,
                getStringValue(messages, "onException"));
    }

    private WorkflowStageDefinition.CircuitBreaker parseCircuitBreaker(Map<String, Object> data, String path)
            throws WorkflowParseException {
        if (data == null) {
            return null;
        }
        Map<String, Object> messages = getMapValue(data, "messages");
        return new WorkflowStageDefinition.CircuitBreaker(
                getStringValue(data, "ref"),
                getIntegerValue(data, "failureThreshold", path),
                getIntegerValue(data, "breakMs", path),
                getIntegerValue(data, "closeOnSuccessAttempts", path),
                getStringValue(messages, "onOpen"),
                getStringValue(messages, "onBlocked"));
    }

    private WorkflowDefinition.EndStage parseEndStage(Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        Map<String, Object> result = getMapValue(data, "result");
        return new WorkflowDefinition.EndStage(
                getStringMap(data, "output"),
                getBooleanValue(data, "outputJson", true),
                getStringMap(data, "context"),
                getStringValue(result, "message"),
                getBooleanValue(data, "contextOnFailure", false));
    }

    // Utility methods for safe type conversion
    private String requireString(Map<String, Object> data, String key, String fieldPath) throws WorkflowParseException {
        String value = getStringValue(data, key);
        if (value == null || value.trim().isEmpty()) {
            throw new WorkflowParseException(fieldPath, "Required field '" + key + "' is missing");
        }
        return value;
    }

    private String getStringValue(Map<String, Object> data, String key) {
        return getStringValue(data, key, null);
    }

    private String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private String firstString(Map<String, Object> data, String... keys) {
        for (String key : keys) {
            String value = getStringValue(data, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value) {
        if (!(value instanceof Map)) {
            return null;
        }
        // Keys may be numbers or booleans in YAML
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<Object, Object>) value).forEach((key, item) -> result.put(String.valueOf(key), item));
        return result;
    }

    private Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        return asMap(data.get(key));
    }

    private List<Map<String, Object>> getListValue(Map<String, Object> data, String key) {
        List<Map<String, Object>> result = new ArrayList<>();
        if (data == null || !(data.get(key) instanceof List)) {
            return result;
        }
        for (Object item : (List<?>) data.get(key)) {
            Map<String, Object> map = asMap(item);
            if (map != null) {
                result.add(map);
            }
        }
        return result;
    }

    private Map<String, String> getStringMap(Map<String, Object> data, String key) {
        Map<String, String> result = new LinkedHashMap<>();
        Map<String, Object> map = getMapValue(data, key);
        if (map == null) {
            return result;
        }
        map.forEach((name, value) -> result.put(name, value != null ? value.toString() : ""));
        return result;
    }

    private boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    private Integer getIntegerValue(Map<String, Object> data, String key, String path) throws WorkflowParseException {
        if (data == null || data.get(key) == null) {
            return null;
        }
        return toInteger(data.get(key), path + "." + key);
    }

    private Integer toInteger(Object value, String fieldPath) throws WorkflowParseException {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(fieldPath, "Expected an integer but found '" + value + "'");
        }
    }
}
