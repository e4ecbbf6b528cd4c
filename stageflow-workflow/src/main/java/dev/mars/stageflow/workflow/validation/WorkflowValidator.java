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


package dev.mars.stageflow.workflow.validation;

import dev.mars.stageflow.workflow.definition.CircuitBreakerDefinition;
import dev.mars.stageflow.workflow.definition.RetryPolicyDefinition;
import dev.mars.stageflow.workflow.definition.StageKinds;
import dev.mars.stageflow.workflow.definition.VariableDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowDocument;
import dev.mars.stageflow.workflow.definition.WorkflowStageDefinition;
import dev.mars.stageflow.workflow.execution.WorkflowExecutor;
import dev.mars.stageflow.workflow.loader.WorkflowLoader;
import dev.mars.stageflow.workflow.loader.WorkflowParseException;
import dev.mars.stageflow.workflow.plugin.StagePlugin;
import dev.mars.stageflow.workflow.plugin.StagePluginRegistry;
import dev.mars.stageflow.workflow.plugin.StageServices;
import dev.mars.stageflow.workflow.plugin.StageValidationContext;
import dev.mars.stageflow.workflow.plugin.http.MockPayloadService;
import dev.mars.stageflow.workflow.template.RunIfExpression;
import dev.mars.stageflow.workflow.template.TemplateResolver;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Static validation of a loaded workflow document, run before any stage executes.
 * <p>
 * Checks the document metadata, stage names and kinds, jump targets, resilience policies and the scope of every
 * template token, then delegates kind-specific rules to the registered stage plugins.
 * A reference to a stage that is declared later is only a warning, since a backwards jump can make it valid.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 */
public class WorkflowValidator {

    private static final Logger logger = Logger.getLogger(WorkflowValidator.class.getName());

    private static final int MAX_DELAY_SECONDS = 60;
    private static final String HTTP_STATUS_OUTPUT = "http_status";

    private final StagePluginRegistry registry;
    private final WorkflowLoader workflowLoader;
    private final MockPayloadService mockPayloadService;
    private final UnaryOperator<String> systemEnvironment;

    public WorkflowValidator(StagePluginRegistry registry, StageServices services) {
        this(registry, services.getWorkflowLoader(), services.getMockPayloadService(), System::getenv);
    }

    public WorkflowValidator(StagePluginRegistry registry, WorkflowLoader workflowLoader,
                             MockPayloadService mockPayloadService, UnaryOperator<String> systemEnvironment) {
        this.registry = Objects.requireNonNull(registry, "Plugin registry cannot be null");
        this.workflowLoader = Objects.requireNonNull(workflowLoader, "Workflow loader cannot be null");
        this.mockPayloadService = Objects.requireNonNull(mockPayloadService, "Mock payload service cannot be null");
        this.systemEnvironment = Objects.requireNonNull(systemEnvironment, "System environment cannot be null");
    }

    public ValidationResult validate(WorkflowDocument document) {
        Objects.requireNonNull(document, "Workflow document cannot be null");
        WorkflowDefinition definition = document.getDefinition();
        ValidationResult result = new ValidationResult();

        validateMetadata(definition, result);
        validateInputs(definition, result);
        validateInitStage(definition, result);
        validateEndStage(definition, result);
        validateResilience(definition.getResilience(), result);
        validateStages(document, result);
        validateJumps(definition, result);
        new TokenScopeCheck(document, result).run();

        logger.fine("Validated workflow '" + definition.getName() + "': " + result);
        return result;
    }

    private static void validateMetadata(WorkflowDefinition definition, ValidationResult result) {
        if (isBlank(definition.getVersion())) {
            result.addError("version", "Workflow version is required.");
        }
        if (isBlank(definition.getId())) {
            result.addError("id", "Workflow id is required.");
        }
        if (isBlank(definition.getName())) {
            result.addError("name", "Workflow name is required.");
        }
    }

    private static void validateInputs(WorkflowDefinition definition, ValidationResult result) {
        Set<String> names = caseInsensitiveSet();
        for (WorkflowDefinition.InputDefinition input : definition.getInputs()) {
            if (isBlank(input.getName())) {
                result.addError("input", "Input name is required.");
            } else if (!names.add(input.getName())) {
                result.addError("input", String.format("Duplicate input name '%s'.", input.getName()));
            }
        }
    }

    private static void validateInitStage(WorkflowDefinition definition, ValidationResult result) {
        if (definition.getInitStage().isEmpty()) {
            return;
        }
        Set<String> inputs = caseInsensitiveSet();
        definition.getInputs().forEach(input -> inputs.add(input.getName()));

        Set<String> names = caseInsensitiveSet();
        for (VariableDefinition variable : definition.getInitStage().get().getVariables()) {
            String name = variable.getName();
            if (!names.add(name)) {
                result.addError("initStage.variables", String.format("Duplicate init-stage variable name '%s'.", name));
            }
            if (inputs.contains(name)) {
                result.addError("initStage.variables",
                        String.format("Init-stage variable '%s' duplicates an input with the same name.", name));
            }
            if (variable.getValue().filter(value -> !value.isBlank()).isEmpty()) {
                continue;
            }
            if (hasRangeSettings(variable)) {
                result.addError("initStage.variables",
                        String.format("Init-stage variable '%s' cannot define value with range settings.", name));
            }
            VariableDefinition.VariableType type = variable.getType();
            if (type == VariableDefinition.VariableType.DATETIME || type == VariableDefinition.VariableType.DATE
                    || type == VariableDefinition.VariableType.TIME) {
                result.addError("initStage.variables",
                        String.format("Init-stage variable '%s' must use type 'Fixed' when value is provided.", name));
            }
        }
    }

    private static boolean hasRangeSettings(VariableDefinition variable) {
        return variable.getMin().isPresent() || variable.getMax().isPresent() || variable.getPadding().isPresent()
                || variable.getLength().isPresent() || variable.getFrom().isPresent() || variable.getTo().isPresent()
                || variable.getFormat().isPresent() || variable.getStart().isPresent() || variable.getStep().isPresent();
    }

    private static void validateEndStage(WorkflowDefinition definition, ValidationResult result) {
        if (!definition.isOutput()) {
            return;
        }
        boolean hasOutput = definition.getEndStage().map(endStage -> !endStage.getOutput().isEmpty()).orElse(false);
        if (!hasOutput) {
            result.addError("endStage.output", "End-stage output is required when workflow output is enabled.");
        }
    }

    private static void validateResilience(WorkflowDefinition.Resilience resilience, ValidationResult result) {
        for (Map.Entry<String, RetryPolicyDefinition> entry : resilience.getRetries().entrySet()) {
            RetryPolicyDefinition policy = entry.getValue();
            if (policy.getMaxRetries().filter(value -> value > 0).isEmpty()) {
                result.addError("resilience.retries." + entry.getKey(),
                        String.format("Retry policy '%s' maxRetries must be a positive integer.", entry.getKey()));
            }
            if (policy.getDelayMs().filter(value -> value > 0).isEmpty()) {
                result.addError("resilience.retries." + entry.getKey(),
                        String.format("Retry policy '%s' delayMs must be a positive integer.", entry.getKey()));
            }
        }
        for (Map.Entry<String, CircuitBreakerDefinition> entry : resilience.getCircuitBreakers().entrySet()) {
            CircuitBreakerDefinition policy = entry.getValue();
            if (policy.getFailureThreshold().filter(value -> value > 0).isEmpty()) {
                result.addError("resilience.circuitBreakers." + entry.getKey(), String.format(
                        "Circuit breaker '%s' failureThreshold must be a positive integer.", entry.getKey()));
            }
            if (policy.getBreakMs().filter(value -> value > 0).isEmpty()) {
                result.addError("resilience.circuitBreakers." + entry.getKey(),
                        String.format("Circuit breaker '%s' breakMs must be a positive integer.", entry.getKey()));
            }
        }
    }

    private void validateStages(WorkflowDocument document, ValidationResult result) {
        StageValidationContext validationContext =
                new StageValidationContext(document, workflowLoader, mockPayloadService);
        Set<String> names = caseInsensitiveSet();
        List<WorkflowStageDefinition> stages = document.getDefinition().getStages();
        if (stages.isEmpty()) {
            result.addError("stages", "Workflow must define at least one stage.");
        }

        for (int i = 0; i < stages.size(); i++) {
            WorkflowStageDefinition stage = stages.get(i);
            String fieldPath = "stages[" + i + "]";
            if (isBlank(stage.getName())) {
                result.addError(fieldPath, "Stage name is required.");
                continue;
            }
            if (!names.add(stage.getName())) {
                result.addError(fieldPath, String.format("Duplicate stage name '%s'.", stage.getName()));
            }

            int delay = stage.getDelaySeconds().orElse(0);
            if (delay < 0 || delay > MAX_DELAY_SECONDS) {
                result.addError(fieldPath + ".delaySeconds", String.format(
                        "Stage '%s' delaySeconds must be between 0 and %d.", stage.getName(), MAX_DELAY_SECONDS));
            }

            Optional<StagePlugin> plugin = registry.findByKind(stage.getKind());
            if (plugin.isEmpty()) {
                result.addError(fieldPath + ".kind", String.format(
                        "Stage '%s' kind '%s' is not handled by any registered plugin.", stage.getName(), stage.getKind()));
                continue;
            }

            if (stage.getMock().isPresent() && StageKinds.isWorkflow(stage.getKind())) {
                WorkflowStageDefinition.Mock mock = stage.getMock().get();
                if (mock.getPayload().isPresent() || mock.getPayloadFile().isPresent()) {
                    result.addError(fieldPath + ".mock", String.format(
                            "Stage '%s' mock payload is not supported for workflow stages.", stage.getName()));
                }
                if (mock.getOutput().filter(output -> !output.isEmpty()).isEmpty()) {
                    result.addError(fieldPath + ".mock", String.format(
                            "Stage '%s' mock output is required for workflow stages.", stage.getName()));
                }
            }

            List<String> pluginErrors = new ArrayList<>();
            plugin.get().validate(stage, validationContext, pluginErrors);
            result.addErrors(fieldPath, pluginErrors);
        }
    }

    private void validateJumps(WorkflowDefinition definition, ValidationResult result) {
        Set<String> stageNames = caseInsensitiveSet();
        definition.getStages().forEach(stage -> stageNames.add(stage.getName()));

        for (WorkflowStageDefinition stage : definition.getStages()) {
            if (stage.getJumpOnStatus().isEmpty()) {
                continue;
            }
            boolean supported = registry.findByKind(stage.getKind())
                    .map(plugin -> plugin.getCapabilities().supportsJumpOnStatus())
                    .orElse(true);
            if (!supported) {
                result.addError(stage.getName() + ".jumpOnStatus", String.format(
                        "Stage '%s' jumpOnStatus is not supported for kind '%s'.", stage.getName(), stage.getKind()));
                continue;
            }
            for (String target : stage.getJumpOnStatus().values()) {
                if (isBlank(target)) {
                    result.addError(stage.getName() + ".jumpOnStatus",
                            String.format("Stage '%s' has an empty jump target.", stage.getName()));
                } else if (!isEndTarget(target) && !stageNames.contains(target)) {
                    result.addError(stage.getName() + ".jumpOnStatus",
                            String.format("Stage '%s' jump target '%s' does not exist.", stage.getName(), target));
                }
            }
        }
    }

    private static boolean isEndTarget(String target) {
        return WorkflowExecutor.JUMP_END.equalsIgnoreCase(target)
                || WorkflowExecutor.JUMP_END_STAGE.equalsIgnoreCase(target);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static Set<String> caseInsensitiveSet() {
        return new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    }

    /**
     * Checks every template in the document against the names in scope where it is evaluated.
     */
    private final class TokenScopeCheck {

        private final WorkflowDocument document;
        private final WorkflowDefinition definition;
        private final ValidationResult result;
        private final Set<String> inputs = caseInsensitiveSet();
        private final Set<String> globals = caseInsensitiveSet();
        private final Map<String, Integer> stageOrder = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, Set<String>> endpointOutputs = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, Set<String>> workflowOutputs = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        TokenScopeCheck(WorkflowDocument document, ValidationResult result) {
            this.document = document;
            this.definition = document.getDefinition();
            this.result = result;
        }

        void run() {
            definition.getInputs().forEach(input -> inputs.add(input.getName()));
            definition.getInitStage().ifPresent(init -> init.getVariables().forEach(v -> globals.add(v.getName())));
            collectStageOutputs();

            int endIndex = definition.getStages().size();
            definition.getInitStage().ifPresent(init -> {
                init.getVariables().forEach(variable -> variable.getValue()
                        .ifPresent(value -> check(value, "init-stage variable", -1, false)));
                init.getContext().values().forEach(value -> check(value, "init-stage context", -1, false));
            });

            List<WorkflowStageDefinition> stages = definition.getStages();
            for (int i = 0; i < stages.size(); i++) {
                checkStage(stages.get(i), i);
            }

            definition.getEndStage().ifPresent(endStage -> {
                endStage.getOutput().values().forEach(value -> check(value, "end-stage output", endIndex, false));
                endStage.getContext().values().forEach(value -> check(value, "end-stage context", endIndex, false));
                endStage.getResultMessage()
                        .ifPresent(value -> check(value, "end-stage result message", endIndex, false));
            });
        }

        private void collectStageOutputs() {
            List<WorkflowStageDefinition> stages = definition.getStages();
            for (int i = 0; i < stages.size(); i++) {
                WorkflowStageDefinition stage = stages.get(i);
                stageOrder.putIfAbsent(stage.getName(), i);
                if (StageKinds.isWorkflow(stage.getKind())) {
                    workflowOutputs.put(stage.getName(), childOutputs(stage));
                } else if (registry.findByKind(stage.getKind()).isPresent()) {
                    Set<String> outputs = caseInsensitiveSet();
                    outputs.add(HTTP_STATUS_OUTPUT);
                    outputs.addAll(stage.getOutput().keySet());
                    endpointOutputs.put(stage.getName(), outputs);
                }
            }
        }

        private Set<String> childOutputs(WorkflowStageDefinition stage) {
            Set<String> outputs = caseInsensitiveSet();
            if (stage.getMock().isPresent()) {
                stage.getMock().get().getOutput().ifPresent(mockOutput -> outputs.addAll(mockOutput.keySet()));
            }
            Optional<Path> path = stage.getWorkflowRef()
                    .flatMap(ref -> definition.getReferences().findWorkflow(ref))
                    .filter(reference -> reference.getPath() != null)
                    .map(reference -> document.getDirectory().resolve(reference.getPath()).toAbsolutePath().normalize());
            if (path.isEmpty()) {
                return outputs;
            }
            try {
                WorkflowDocument child = workflowLoader.load(path.get(), document.getEnvironmentVariables());
                child.getDefinition().getEndStage().ifPresent(endStage -> outputs.addAll(endStage.getOutput().keySet()));
            } catch (WorkflowParseException e) {
                // The workflow stage plugin reports the load failure
                logger.fine("Outputs of workflow '" + stage.getWorkflowRef().orElse("") + "' unavailable: " + e.getMessage());
            }
            return outputs;
        }

        private void checkStage(WorkflowStageDefinition stage, int index) {
            String prefix = "stage '" + stage.getName() + "' ";
            boolean allowResponse = registry.findByKind(stage.getKind())
                    .map(plugin -> plugin.getCapabilities().allowsResponseTokens())
                    .orElse(false);

            stage.getHeaders().values().forEach(value -> check(value, prefix + "header", index, false));
            stage.getQuery().values().forEach(value -> check(value, prefix + "query", index, false));
            stage.getBody().ifPresent(value -> check(value, prefix + "body", index, false));
            stage.getInputs().values().forEach(value -> check(value, prefix + "input", index, false));
            stage.getDebug().values().forEach(value -> check(value, prefix + "debug", index, false));
            stage.getMessage().ifPresent(value -> check(value, prefix + "message", index, allowResponse));
            stage.getOutput().values().forEach(value -> check(value, prefix + "output", index, allowResponse));
            stage.getMock().flatMap(WorkflowStageDefinition.Mock::getOutput)
                    .ifPresent(output -> output.values().forEach(value -> check(value, prefix + "mock output", index, false)));

            stage.getRunIf().filter(expression -> !expression.isBlank()).ifPresent(expression -> {
                if (!RunIfExpression.isValid(expression)) {
                    result.addError(stage.getName() + ".runIf",
                            String.format("Invalid runIf expression '%s' in %srunIf.", expression, prefix));
                } else {
                    checkToken(RunIfExpression.parse(expression).getToken(), prefix + "runIf", index, false);
                }
            });

            // set and context run after the stage, so its own outputs and bindings are in scope
            stage.getSet().values().forEach(value -> check(value, prefix + "set", index + 1, false));
            stage.getContext().values().forEach(value -> check(value, prefix + "context", index + 1, false));
            globals.addAll(stage.getSet().keySet());
        }

        private void check(String template, String location, int stageIndex, boolean allowResponse) {
            for (String token : TemplateResolver.extractTokens(template)) {
                checkToken(token, location, stageIndex, allowResponse);
            }
        }

        private void checkToken(String token, String location, int stageIndex, boolean allowResponse) {
            Optional<String> projection = TemplateResolver.jsonProjectionSource(token);
            String effective = projection.orElse(token);
            String[] segments = TemplateResolver.splitToken(effective);
            if (segments.length == 0) {
                result.addError(location, String.format("Invalid token in %s.", location));
                return;
            }

            switch (segments[0].toLowerCase(Locale.ROOT)) {
                case "input":
                    if (segments.length < 2 || !inputs.contains(segments[1])) {
                        result.addError(location, String.format("Unknown input '%s' in %s.", token, location));
                    }
                    break;
                case "global":
                    if (segments.length < 2 || !globals.contains(segments[1])) {
                        result.addError(location, String.format("Unknown global '%s' in %s.", token, location));
                    }
                    break;
                case "context":
                    if (segments.length < 2) {
                        result.addError(location, String.format("Invalid context token '%s' in %s.", token, location));
                    }
                    break;
                case "env":
                    checkEnvironment(token, segments, location);
                    break;
                case "response":
                    if (!allowResponse) {
                        result.addError(location,
                                String.format("Response token '%s' is not allowed in %s.", token, location));
                    }
                    break;
                case "system":
                    checkSystem(token, segments, location);
                    break;
                case "stage":
                case "stages":
                    checkStageToken(token, segments, location, stageIndex);
                    break;
                case "endpoint":
                    checkStageOutput(token, segments, endpointOutputs, "endpoint", location, stageIndex);
                    break;
                case "workflow":
                    checkStageOutput(token, segments, workflowOutputs, "workflow", location, stageIndex);
                    break;
                default:
                    result.addError(location, String.format("Unknown token '%s' in %s.", token, location));
            }
        }

        private void checkEnvironment(String token, String[] segments, String location) {
            if (segments.length < 2) {
                result.addError(location, String.format("Invalid env token '%s' in %s.", token, location));
                return;
            }
            if (!document.getEnvironmentVariables().containsKey(segments[1])
                    && systemEnvironment.apply(segments[1]) == null) {
                result.addError(location, String.format(
                        "Environment variable '%s' was not defined for token '%s' in %s.", segments[1], token, location));
            }
        }

        private void checkSystem(String token, String[] segments, String location) {
            boolean valid = segments.length >= 3 && (
                    (segments[1].equalsIgnoreCase("uuid") && segments[2].equalsIgnoreCase("new"))
                    || (Set.of("datetime", "date", "time").contains(segments[1].toLowerCase(Locale.ROOT))
                        && Set.of("now", "utcnow").contains(segments[2].toLowerCase(Locale.ROOT))));
            if (!valid) {
                result.addError(location, String.format("Invalid token '%s' in %s.", token, location));
            }
        }

        private void checkStageToken(String token, String[] segments, String location, int stageIndex) {
            if (segments.length >= 5 && segments[2].equalsIgnoreCase("workflow")) {
                String stageName = segments[1];
                if (!workflowOutputs.containsKey(stageName)) {
                    result.addError(location, String.format(
                            "stage '%s' outputs were not found in %s.", stageName, location));
                    return;
                }
                if (segments[3].equalsIgnoreCase("result")) {
                    if (!segments[4].equalsIgnoreCase("status") && !segments[4].equalsIgnoreCase("message")) {
                        result.addError(location, String.format(
                                "stage '%s' workflow result '%s' was not found in %s.", stageName, segments[4], location));
                        return;
                    }
                } else if (!segments[3].equalsIgnoreCase("output")
                        || !workflowOutputs.get(stageName).contains(segments[4])) {
                    result.addError(location, String.format(
                            "stage '%s' output '%s' was not found in %s.", stageName, segments[4], location));
                    return;
                }
                checkOrder(stageName, location, stageIndex);
                return;
            }

            if (endpointOutputs.containsKey(segments.length > 1 ? segments[1] : "")) {
                checkStageOutput(token, segments, endpointOutputs, "stage", location, stageIndex);
            } else {
                checkStageOutput(token, segments, workflowOutputs, "stage", location, stageIndex);
            }
        }

        private void checkStageOutput(String token, String[] segments, Map<String, Set<String>> outputs, String kind,
                                      String location, int stageIndex) {
            if (segments.length < 4 || !segments[2].equalsIgnoreCase("output")) {
                result.addError(location, String.format(
                        "Invalid %s token '%s'. Expected '%s:<name>.output.<key>' in %s.", kind, token, kind, location));
                return;
            }
            Set<String> keys = outputs.get(segments[1]);
            if (keys == null) {
                result.addError(location, String.format(
                        "%s '%s' outputs were not found in %s.", kind, segments[1], location));
                return;
            }
            if (!keys.contains(segments[3])) {
                result.addError(location, String.format(
                        "%s '%s' output '%s' was not found in %s.", kind, segments[1], segments[3], location));
                return;
            }
            checkOrder(segments[1], location, stageIndex);
        }

        private void checkOrder(String stageName, String location, int stageIndex) {
            Integer declared = stageOrder.get(stageName);
            if (declared != null && declared >= stageIndex) {
                result.addWarning(location, String.format(
                        "Stage '%s' is referenced in %s before it runs.", stageName, location));
            }
        }
    }
}
