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


package dev.mars.stageflow.workflow.plugin.workflow;

import dev.mars.stageflow.core.exceptions.StageFailureException;
import dev.mars.stageflow.core.exceptions.StageflowException;
import dev.mars.stageflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.stageflow.workflow.definition.StageKinds;
import dev.mars.stageflow.workflow.definition.WorkflowDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowDocument;
import dev.mars.stageflow.workflow.definition.WorkflowStageDefinition;
import dev.mars.stageflow.workflow.execution.ExecutionContext;
import dev.mars.stageflow.workflow.execution.ExecutionLogFormat;
import dev.mars.stageflow.workflow.execution.WorkflowExecution;
import dev.mars.stageflow.workflow.loader.VarsFileLoader;
import dev.mars.stageflow.workflow.loader.VarsFileResolution;
import dev.mars.stageflow.workflow.loader.WorkflowParseException;
import dev.mars.stageflow.workflow.plugin.BuiltInStagePlugins;
import dev.mars.stageflow.workflow.plugin.StageExecutionContext;
import dev.mars.stageflow.workflow.plugin.StageOutcome;
import dev.mars.stageflow.workflow.plugin.StagePlugin;
import dev.mars.stageflow.workflow.plugin.StagePluginCapabilities;
import dev.mars.stageflow.workflow.plugin.StageServices;
import dev.mars.stageflow.workflow.plugin.StageValidationContext;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Built-in plugin for {@code Workflow} stages. Runs the referenced child workflow through the
 * executor's nested runner and projects its end-stage outputs and terminal result back into the parent.
 * <p>
 * A failing child, whether it fails to load or fails while running, surfaces as a {@link StageFailureException}
 * after its outputs and {@code Error} result are recorded. The plugin declares {@code continueOnError}, so the
 * executor marks the stage FAILED and carries on; the parent may branch on
 * {@code stage:<name>.workflow.result.status}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 */
public class WorkflowStagePlugin implements StagePlugin {

    private static final Logger logger = Logger.getLogger(WorkflowStagePlugin.class.getName());

    public static final String RESULT_OK = "Ok";
    public static final String RESULT_ERROR = "Error";

    private static final Set<String> STAGE_KINDS = Set.of(StageKinds.WORKFLOW);
    private static final StagePluginCapabilities CAPABILITIES = new StagePluginCapabilities(false, false, true);

    private final StageServices services;

    public WorkflowStagePlugin(StageServices services) {
        this.services = services;
    }

    @Override
    public String getId() {
        return BuiltInStagePlugins.WORKFLOW_PLUGIN_ID;
    }

    @Override
    public Set<String> getStageKinds() {
        return STAGE_KINDS;
    }

    @Override
    public StagePluginCapabilities getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    public void validate(WorkflowStageDefinition stage, StageValidationContext context, List<String> errors) {
        String name = stage.getName();
        if (stage.getRetry().isPresent()) {
            errors.add(String.format("Stage '%s' retry is only supported for endpoint stages.", name));
        }
        if (stage.getCircuitBreaker().isPresent()) {
            errors.add(String.format("Stage '%s' circuitBreaker is only supported for endpoint stages.", name));
        }

        Optional<String> workflowRef = stage.getWorkflowRef().filter(value -> !value.isBlank());
        if (workflowRef.isEmpty()) {
            errors.add(String.format("Stage '%s' workflowRef is required for workflow stages.", name));
            return;
        }

        Path referencePath = context.getWorkflowReferences().get(workflowRef.get());
        if (referencePath == null) {
            errors.add(String.format("Stage '%s' workflowRef '%s' is not declared in references.", name, workflowRef.get()));
            return;
        }
        if (!Files.isRegularFile(referencePath)) {
            errors.add(String.format("Referenced workflow '%s' was not found at '%s'.", workflowRef.get(), referencePath));
            return;
        }

        try {
            WorkflowDocument referenced = context.getWorkflowLoader().load(referencePath, context.getEnvironmentVariables());
            validateInputs(stage, referenced.getDefinition(), errors);
            validateVersion(stage, context.getDefinition().getVersion(), referenced.getDefinition().getVersion(), errors);
        } catch (WorkflowParseException e) {
            errors.add(String.format("Referenced workflow '%s' failed to load: %s", workflowRef.get(), e.getMessage()));
        }
    }

    @Override
    public StageOutcome execute(WorkflowStageDefinition stage, StageExecutionContext context)
            throws StageflowException, InterruptedException {
        WorkflowDefinition definition = context.getDefinition();
        ExecutionContext execution = context.getExecutionContext();
        String workflowRef = stage.getWorkflowRef().filter(value -> !value.isBlank())
                .orElseThrow(() -> new WorkflowConfigurationException(
                        String.format("Stage '%s' workflowRef is required.", stage.getName())));

        WorkflowDefinition.WorkflowReference reference = definition.getReferences().findWorkflow(workflowRef)
                .orElseThrow(() -> new WorkflowConfigurationException(
                        String.format("Workflow reference '%s' was not found.", workflowRef)));

        Path nestedPath = context.getDocument().getDirectory().resolve(reference.getPath()).toAbsolutePath().normalize();
        WorkflowDocument nestedDocument = services.getWorkflowLoader().load(nestedPath, execution.getEnvironmentVariables());
        String nestedName = nestedDocument.getDefinition().getName();
        String stageTag = ExecutionLogFormat.stageTag(definition.getName(), stage.getName());

        logger.fine(ExecutionLogFormat.indent(execution) + stageTag + " resolved workflow '" + nestedName
                + "' at '" + nestedDocument.getFilePath() + "'.");
        logger.info(ExecutionLogFormat.indent(execution) + "Calling nested workflow "
                + ExecutionLogFormat.workflowTag(nestedName) + " from stage " + stageTag + ".");

        if (context.isMocked() && stage.getMock().isPresent()) {
            applyMockOutput(stage, execution);
            execution.putWorkflowResult(stage.getName(), RESULT_OK, "");
            services.getMessageEmitter().emit(definition, stage, execution, null);
            return StageOutcome.proceed();
        }

        Map<String, String> nestedInputs = resolveInputs(stage, nestedDocument, context);
        ExecutionContext nestedContext = new ExecutionContext(nestedInputs, nestedDocument.getEnvironmentVariables(),
                execution.getContext(), execution.getIndentLevel() + 1);

        WorkflowExecution nestedResult = context.getNestedRunner().run(nestedDocument, nestedContext);

        Map<String, String> nestedOutput = nestedContext.getWorkflowOutputs().get(nestedName);
        execution.putWorkflowOutput(stage.getName(), nestedOutput != null ? nestedOutput : Map.of());
        if (!nestedResult.getStatus().isSuccessful()) {
            String message = nestedResult.getMessage().filter(value -> !value.isBlank())
                    .orElse(String.format("Workflow '%s' ended with status %s.", nestedName, nestedResult.getStatus()));
            execution.putWorkflowResult(stage.getName(), RESULT_ERROR, message);
            throw new StageFailureException(definition.getName(), stage.getName(), message);
        }
        execution.putWorkflowResult(stage.getName(), RESULT_OK, nestedResult.getMessage().orElse(""));
        services.getMessageEmitter().emit(definition, stage, execution, null);
        return StageOutcome.proceed();
    }

    private Map<String, String> resolveInputs(WorkflowStageDefinition stage, WorkflowDocument nestedDocument,
                                              StageExecutionContext context) throws WorkflowConfigurationException {
        ExecutionContext execution = context.getExecutionContext();
        Map<String, String> nestedInputs = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        boolean hasStageInputs = !stage.getInputs().isEmpty();
        for (Map.Entry<String, String> input : stage.getInputs().entrySet()) {
            nestedInputs.put(input.getKey(), services.getTemplateResolver().resolve(input.getValue(), execution));
        }

        Optional<Path> varsPath = VarsFileLoader.resolveAutoVarsFile(nestedDocument.getFilePath());
        if (varsPath.isEmpty()) {
            return nestedInputs;
        }

        String childIndent = ExecutionLogFormat.indent(execution.getIndentLevel() + 1);
        if (context.getOptions().isVarsOverrideActive()) {
            logger.info(childIndent + "Vars file: overrided by main workflow");
        } else if (!hasStageInputs) {
            try {
                VarsFileResolution resolution = services.getVarsFileLoader().loadWithDetails(varsPath.get(),
                        context.getEnvironment(), nestedDocument.getDefinition().getVersion());
                nestedInputs.clear();
                nestedInputs.putAll(resolution.getValues());
                logger.info(childIndent + "Vars file: " + varsPath.get() + " (auto)");
                logVarsSources(resolution, execution.getIndentLevel() + 2);
            } catch (WorkflowConfigurationException e) {
                throw new WorkflowConfigurationException(String.format("Failed to load vars file [%s] for workflow '%s': %s",
                        varsPath.get(), nestedDocument.getDefinition().getName(), e.getMessage()), e);
            }
        }
        return nestedInputs;
    }

    private void applyMockOutput(WorkflowStageDefinition stage, ExecutionContext execution)
            throws WorkflowConfigurationException {
        Map<String, String> mockOutput = stage.getMock().flatMap(WorkflowStageDefinition.Mock::getOutput)
                .filter(output -> !output.isEmpty())
                .orElseThrow(() -> new WorkflowConfigurationException(
                        String.format("Stage '%s' mock output is required for workflow stages.", stage.getName())));

        Map<String, String> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : mockOutput.entrySet()) {
            resolved.put(entry.getKey(), services.getTemplateResolver().resolve(entry.getValue(), execution));
        }
        execution.putWorkflowOutput(stage.getName(), resolved);
    }

    private static void logVarsSources(VarsFileResolution resolution, int indentLevel) {
        String indent = ExecutionLogFormat.indent(indentLevel);
        if (resolution.getSources().isEmpty()) {
            logger.fine(indent + "Vars file variable sources: (none)");
            return;
        }
        logger.fine(indent + "Vars file variable sources:");
        new TreeMap<>(resolution.getSources())
                .forEach((key, source) -> logger.fine(indent + "  " + key + ": " + source.describe()));
    }

    private static void validateInputs(WorkflowStageDefinition stage, WorkflowDefinition referenced, List<String> errors) {
        Set<String> declared = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (WorkflowDefinition.InputDefinition input : referenced.getInputs()) {
            declared.add(input.getName());
        }
        Set<String> provided = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        provided.addAll(stage.getInputs().keySet());

        for (WorkflowDefinition.InputDefinition input : referenced.getInputs()) {
            if (input.isRequired() && !provided.contains(input.getName())) {
                errors.add(String.format("Stage '%s' is missing required input '%s' for workflow '%s'.",
                        stage.getName(), input.getName(), referenced.getName()));
            }
        }
        for (String input : stage.getInputs().keySet()) {
            if (!declared.contains(input)) {
                errors.add(String.format("Stage '%s' provides unknown input '%s' for workflow '%s'.",
                        stage.getName(), input, referenced.getName()));
            }
        }
    }

    private static void validateVersion(WorkflowStageDefinition stage, String parentVersion, String referencedVersion,
                                        List<String> errors) {
        if (isBlank(parentVersion) || isBlank(referencedVersion) || parentVersion.equalsIgnoreCase(referencedVersion)) {
            return;
        }
        if (stage.getAllowVersion().filter(allowed -> allowed.equalsIgnoreCase(referencedVersion)).isPresent()) {
            return;
        }
        errors.add(String.format("Stage '%s' references workflow version '%s' which differs from parent version '%s'.",
                stage.getName(), referencedVersion, parentVersion));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
