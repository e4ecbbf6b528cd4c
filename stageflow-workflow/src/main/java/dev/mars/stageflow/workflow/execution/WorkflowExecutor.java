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

import dev.mars.stageflow.config.StageflowConfiguration;
import dev.mars.stageflow.core.exceptions.SelfJumpException;
import dev.mars.stageflow.core.exceptions.StageFailureException;
import dev.mars.stageflow.core.exceptions.StageflowException;
import dev.mars.stageflow.core.exceptions.TemplateResolutionException;
import dev.mars.stageflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.stageflow.http.HttpEndpointInvoker;
import dev.mars.stageflow.workflow.definition.VariableDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowDocument;
import dev.mars.stageflow.workflow.definition.WorkflowStageDefinition;
import dev.mars.stageflow.workflow.observability.WorkflowMetrics;
import dev.mars.stageflow.workflow.output.WorkflowOutputWriter;
import dev.mars.stageflow.workflow.plugin.BuiltInStagePlugins;
import dev.mars.stageflow.workflow.plugin.StageExecutionContext;
import dev.mars.stageflow.workflow.plugin.StageOutcome;
import dev.mars.stageflow.workflow.plugin.StagePlugin;
import dev.mars.stageflow.workflow.plugin.StagePluginRegistry;
import dev.mars.stageflow.workflow.plugin.StagePluginRegistryBuilder;
import dev.mars.stageflow.workflow.plugin.StageServices;
import dev.mars.stageflow.workflow.resilience.RetryExecutor;
import dev.mars.stageflow.workflow.template.TemplateResolver;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a workflow document synchronously on the calling thread: init stage, the stage loop with
 * {@code runIf} skips and status jumps, then the end stage.
 * <p>
 * Stage and workflow failures never escape as exceptions. They are reported as a {@link WorkflowExecution}
 * with status {@link WorkflowStatus#FAILED}. Interrupting the calling thread cancels the run; the interrupt
 * flag is restored and the execution is reported as {@link WorkflowStatus#CANCELLED}.
 * <p>
 * Nested workflows run through the same instance with the options of the top-level run, each with its
 * own {@link ExecutionContext}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowExecutor {

    private static final Logger logger = Logger.getLogger(WorkflowExecutor.class.getName());

    public static final String JUMP_END = "end";
    public static final String JUMP_END_STAGE = "endStage";
    public static final String RESULT_OK = "Ok";
    public static final String RESULT_ERROR = "Error";

    private final StagePluginRegistry registry;
    private final StageServices services;
    private final TemplateResolver templateResolver;
    private final RunIfEvaluator runIfEvaluator;
    private final InitVariableGenerator variableGenerator;
    private final WorkflowOutputWriter outputWriter;
    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final RetryExecutor.Sleeper sleeper;

    private WorkflowExecutor(Builder builder, StagePluginRegistry registry, StageServices services) {
        this.registry = registry;
        this.services = services;
        this.templateResolver = services.getTemplateResolver();
        this.runIfEvaluator = new RunIfEvaluator(templateResolver);
        this.variableGenerator = builder.variableGenerator != null ? builder.variableGenerator : new InitVariableGenerator();
        this.outputWriter = builder.outputWriter;
        this.metrics = services.getMetrics().orElse(null);
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.sleeper = builder.sleeper != null ? builder.sleeper : Thread::sleep;
    }

    public static Builder builder() {
        return new Builder();
    }

    public StagePluginRegistry getRegistry() {
        return registry;
    }

    public StageServices getServices() {
        return services;
    }

    /**
     * Runs a root workflow with the given inputs and the document's environment.
     */
    public WorkflowExecution execute(WorkflowDocument document, Map<String, String> inputs, ExecutionOptions options) {
        return execute(document, new ExecutionContext(inputs, document.getEnvironmentVariables()), options);
    }

    /**
     * Runs a root workflow in a prepared context.
     */
    public WorkflowExecution execute(WorkflowDocument document, ExecutionContext context, ExecutionOptions options) {
        return execute(document, context, options, UUID.randomUUID().toString());
    }

    WorkflowExecution execute(WorkflowDocument document, ExecutionContext context, ExecutionOptions options,
                              String executionId) {
        Objects.requireNonNull(document, "Workflow document cannot be null");
        Objects.requireNonNull(context, "Execution context cannot be null");
        Objects.requireNonNull(options, "Execution options cannot be null");

        Instant startTime = clock.instant();
        try {
            return run(document, context, options, executionId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            String name = document.getDefinition().getName();
            logger.warning(ExecutionLogFormat.indent(context) + "Workflow " + ExecutionLogFormat.workflowTag(name)
                    + " was cancelled.");
            return new WorkflowExecution(executionId, name, context, WorkflowStatus.CANCELLED, startTime,
                    clock.instant(), List.of(), Map.of(), "Workflow execution was cancelled.", e);
        }
    }

    private WorkflowExecution run(WorkflowDocument document, ExecutionContext context, ExecutionOptions options,
                                  String executionId) throws InterruptedException {
        String name = document.getDefinition().getName();
        String mode = options.getMode().name();
        Instant startTime = clock.instant();

        if (metrics != null) {
            metrics.recordWorkflowStarted(name, mode);
        }
        try {
            return runStarted(document, context, options, executionId, startTime);
        } catch (InterruptedException e) {
            if (metrics != null) {
                metrics.recordWorkflowCancelled(name, mode);
            }
            throw e;
        } finally {
            // Nested runs pass through here too, so every started invocation leaves the active gauge
            if (metrics != null) {
                metrics.recordWorkflowFinished();
            }
        }
    }

    private WorkflowExecution runStarted(WorkflowDocument document, ExecutionContext context, ExecutionOptions options,
                                         String executionId, Instant startTime) throws InterruptedException {
        WorkflowDefinition definition = document.getDefinition();
        String name = definition.getName();
        String mode = options.getMode().name();
        String indent = ExecutionLogFormat.indent(context);
        String workflowTag = ExecutionLogFormat.workflowTag(name);
        List<WorkflowExecution.StageExecution> stageExecutions = new ArrayList<>();

        logger.fine(indent + "Starting workflow execution: " + executionId + " " + workflowTag + " in mode: " + mode);

        StageExecutionContext stageContext = new StageExecutionContext(document, context, options,
                (childDocument, childContext) -> run(childDocument, childContext, options, UUID.randomUUID().toString()));

        try {
            if (!options.isMocked()) {
                validateRequiredInputs(definition, context);
            }
            initializeGlobals(definition, context);
            logger.info(indent + workflowTag + "#initStage processed.");

            runStages(definition, context, stageContext, stageExecutions);

            Map<String, String> outputs = resolveEndStageOutputs(definition, context);
            context.putWorkflowOutput(name, outputs);
            applyEndStageContext(definition, context);
            logger.info(indent + workflowTag + "#endStage processed.");

            if (definition.isOutput() && outputWriter != null) {
                Optional<Path> outputFile = outputWriter.write(document, outputs);
                outputFile.ifPresent(context::setOutputFilePath);
            }

            String message = definition.getEndStage().flatMap(WorkflowDefinition.EndStage::getResultMessage)
                    .filter(template -> !template.isBlank())
                    .map(template -> templateResolver.resolve(template, context))
                    .orElse("");
            context.putWorkflowResult(name, RESULT_OK, message);

            Instant endTime = clock.instant();
            long elapsed = Duration.between(startTime, endTime).toMillis();
            logger.info(indent + "Workflow " + workflowTag + " completed in " + elapsed + " ms.");
            if (metrics != null) {
                metrics.recordWorkflowCompleted(name, mode, elapsed / 1000.0);
            }
            return new WorkflowExecution(executionId, name, context, WorkflowStatus.COMPLETED, startTime, endTime,
                    stageExecutions, outputs, message, null);

        } catch (StageflowException | TemplateResolutionException | IOException e) {
            // Log without stack trace for cleaner output
            logger.log(Level.SEVERE, indent + "Workflow " + workflowTag + " failed: " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Workflow execution exception details for: " + executionId, e);
            }
            applyContextOnFailure(definition, context);
            context.putWorkflowResult(name, RESULT_ERROR, e.getMessage());
            if (metrics != null) {
                metrics.recordWorkflowFailed(name, mode, e.getClass().getSimpleName());
            }
            return new WorkflowExecution(executionId, name, context, WorkflowStatus.FAILED, startTime, clock.instant(),
                    stageExecutions, Map.of(), e.getMessage(), e);
        }
    }

    private void runStages(WorkflowDefinition definition, ExecutionContext context, StageExecutionContext stageContext,
                           List<WorkflowExecution.StageExecution> stageExecutions)
            throws StageflowException, InterruptedException {
        List<WorkflowStageDefinition> stages = definition.getStages();
        Map<String, Integer> stageIndex = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (int i = 0; i < stages.size(); i++) {
            stageIndex.putIfAbsent(stages.get(i).getName(), i);
        }

        String indent = ExecutionLogFormat.indent(context);
        int index = 0;
        while (index < stages.size()) {
            WorkflowStageDefinition stage = stages.get(index);
            String stageTag = ExecutionLogFormat.stageTag(definition.getName(), stage.getName());

            if (!runIfEvaluator.shouldRun(stage, context)) {
                logger.info(indent + stageTag + " skipped.");
                stageExecutions.add(WorkflowExecution.StageExecution.skipped(stage.getName(), stage.getKind(),
                        clock.instant()));
                if (metrics != null) {
                    metrics.recordStageSkipped(definition.getName(), stage.getKind());
                }
                index++;
                continue;
            }

            applyDelay(stage, context, stageTag);
            if (stageContext.getOptions().isDebug()) {
                printDebug(stage, context, stageTag);
            }

            StagePlugin plugin = registry.findByKind(stage.getKind())
                    .orElseThrow(() -> new WorkflowConfigurationException(String.format(
                            "Stage '%s' kind '%s' is not handled by any registered plugin.",
                            stage.getName(), stage.getKind())));

            logger.info(indent + stageTag + " started.");
            Instant stageStart = clock.instant();
            StageOutcome outcome;
            try {
                outcome = plugin.execute(stage, stageContext);
            } catch (StageflowException | TemplateResolutionException e) {
                Instant stageEnd = clock.instant();
                long elapsed = Duration.between(stageStart, stageEnd).toMillis();
                logger.severe(indent + stageTag + " failed after " + elapsed + " ms: " + e.getMessage());
                if (metrics != null) {
                    metrics.recordStageFailed(definition.getName(), stage.getKind(), e.getClass().getSimpleName());
                }
                stageExecutions.add(new WorkflowExecution.StageExecution(stage.getName(), stage.getKind(),
                        WorkflowExecution.StageExecution.StageStatus.FAILED, stageStart, stageEnd,
                        statusCodeOf(e), 0, null, e.getMessage()));

                if (!plugin.getCapabilities().continueOnError()) {
                    throw e;
                }
                context.putWorkflowResult(stage.getName(), RESULT_ERROR, e.getMessage());
                applyStageBindings(stage, context);
                index++;
                continue;
            }

            Instant stageEnd = clock.instant();
            long elapsed = Duration.between(stageStart, stageEnd).toMillis();
            logger.info(indent + stageTag + " completed in " + elapsed + " ms.");
            if (metrics != null) {
                metrics.recordStageExecuted(definition.getName(), stage.getKind(), elapsed / 1000.0);
            }
            applyStageBindings(stage, context);

            Optional<String> jumpTarget = outcome.getJumpTarget();
            stageExecutions.add(new WorkflowExecution.StageExecution(stage.getName(), stage.getKind(),
                    jumpTarget.isPresent()
                            ? WorkflowExecution.StageExecution.StageStatus.JUMPED
                            : WorkflowExecution.StageExecution.StageStatus.COMPLETED,
                    stageStart, stageEnd, outcome.getStatusCode().orElse(null), outcome.getRetries(),
                    jumpTarget.orElse(null), null));

            if (jumpTarget.isEmpty()) {
                index++;
                continue;
            }

            String target = jumpTarget.get();
            logger.info(indent + stageTag + " jump target: " + target + ".");
            if (JUMP_END.equalsIgnoreCase(target) || JUMP_END_STAGE.equalsIgnoreCase(target)) {
                break;
            }
            if (target.equalsIgnoreCase(stage.getName())) {
                if (stageContext.isMocked()) {
                    throw new SelfJumpException(definition.getName(), stage.getName());
                }
                logger.warning(indent + stageTag + " jumps to itself.");
            }

            Integer next = stageIndex.get(target);
            if (next == null) {
                logger.warning(indent + stageTag + " jump target '" + target
                        + "' was not found. Continuing with the next stage.");
                index++;
            } else {
                index = next;
            }
        }
    }

    private void validateRequiredInputs(WorkflowDefinition definition, ExecutionContext context)
            throws WorkflowConfigurationException {
        for (WorkflowDefinition.InputDefinition input : definition.getInputs()) {
            if (input.isRequired() && !context.getInputs().containsKey(input.getName())) {
                throw new WorkflowConfigurationException(
                        String.format("Required input '%s' was not provided.", input.getName()));
            }
        }
    }

    private void initializeGlobals(WorkflowDefinition definition, ExecutionContext context)
            throws WorkflowConfigurationException {
        if (definition.getInitStage().isEmpty()) {
            return;
        }
        WorkflowDefinition.InitStage initStage = definition.getInitStage().get();

        for (VariableDefinition variable : initStage.getVariables()) {
            String resolvedValue = variable.getValue()
                    .map(value -> templateResolver.resolve(value, context))
                    .orElse(null);
            context.getGlobals().put(variable.getName(), variableGenerator.generate(variable, resolvedValue, 1));
        }

        // A context copied from the parent workflow wins over the seed values
        for (Map.Entry<String, String> entry : initStage.getContext().entrySet()) {
            if (!context.getContext().containsKey(entry.getKey())) {
                context.getContext().put(entry.getKey(), templateResolver.resolve(entry.getValue(), context));
            }
        }
    }

    private void applyDelay(WorkflowStageDefinition stage, ExecutionContext context, String stageTag)
            throws InterruptedException {
        int delaySeconds = stage.getDelaySeconds().orElse(0);
        if (delaySeconds <= 0) {
            return;
        }
        logger.fine(ExecutionLogFormat.indent(context) + stageTag + " delay: " + delaySeconds + "s.");
        sleeper.sleep(delaySeconds * 1000L);
    }

    private void printDebug(WorkflowStageDefinition stage, ExecutionContext context, String stageTag) {
        if (stage.getDebug().isEmpty()) {
            return;
        }
        String indent = ExecutionLogFormat.indent(context);
        logger.info(indent + stageTag + " debug:");
        for (Map.Entry<String, String> entry : stage.getDebug().entrySet()) {
            logger.info(indent + " " + entry.getKey() + ": " + templateResolver.resolve(entry.getValue(), context));
        }
    }

    private void applyStageBindings(WorkflowStageDefinition stage, ExecutionContext context) {
        for (Map.Entry<String, String> entry : stage.getSet().entrySet()) {
            context.getGlobals().put(entry.getKey(), templateResolver.resolve(entry.getValue(), context));
        }
        for (Map.Entry<String, String> entry : stage.getContext().entrySet()) {
            context.getContext().put(entry.getKey(), templateResolver.resolve(entry.getValue(), context));
        }
    }

    private Map<String, String> resolveEndStageOutputs(WorkflowDefinition definition, ExecutionContext context) {
        Map<String, String> outputs = new LinkedHashMap<>();
        definition.getEndStage().ifPresent(endStage -> endStage.getOutput()
                .forEach((key, template) -> outputs.put(key, templateResolver.resolve(template, context))));
        return outputs;
    }

    private void applyEndStageContext(WorkflowDefinition definition, ExecutionContext context) {
        definition.getEndStage().ifPresent(endStage -> endStage.getContext()
                .forEach((key, template) -> context.getContext().put(key, templateResolver.resolve(template, context))));
    }

    private void applyContextOnFailure(WorkflowDefinition definition, ExecutionContext context) {
        if (definition.getEndStage().filter(WorkflowDefinition.EndStage::isContextOnFailure).isEmpty()) {
            return;
        }
        try {
            applyEndStageContext(definition, context);
        } catch (TemplateResolutionException e) {
            logger.warning(ExecutionLogFormat.indent(context) + ExecutionLogFormat.workflowTag(definition.getName())
                    + "#endStage context could not be applied after failure: " + e.getMessage());
        }
    }

    private static Integer statusCodeOf(Exception e) {
        if (e instanceof StageFailureException) {
            return ((StageFailureException) e).getStatusCode();
        }
        return null;
    }

    /**
     * Assembles an executor from configuration. Unset collaborators fall back to the defaults derived
     * from {@link StageflowConfiguration}.
     */
    public static class Builder {
        private StageflowConfiguration configuration;
        private StageServices services;
        private StagePluginRegistry registry;
        private List<String> pluginIds;
        private final Map<String, Supplier<? extends StagePlugin>> externalPlugins = new LinkedHashMap<>();
        private InitVariableGenerator variableGenerator;
        private WorkflowOutputWriter outputWriter;
        private boolean outputWriterSet;
        private Clock clock;
        private RetryExecutor.Sleeper sleeper;

        private Builder() {
        }

        public Builder configuration(StageflowConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder services(StageServices services) {
            this.services = services;
            return this;
        }

        /**
         * Uses a prebuilt registry instead of assembling one from plugin ids.
         */
        public Builder registry(StagePluginRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder pluginIds(List<String> pluginIds) {
            this.pluginIds = pluginIds;
            return this;
        }

        public Builder externalPlugin(String pluginId, Supplier<? extends StagePlugin> factory) {
            this.externalPlugins.put(pluginId, factory);
            return this;
        }

        public Builder variableGenerator(InitVariableGenerator variableGenerator) {
            this.variableGenerator = variableGenerator;
            return this;
        }

        /**
         * Output file writer; {@code null} disables output files.
         */
        public Builder outputWriter(WorkflowOutputWriter outputWriter) {
            this.outputWriter = outputWriter;
            this.outputWriterSet = true;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sleeper used for stage {@code delaySeconds}.
         */
        public Builder sleeper(RetryExecutor.Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public WorkflowExecutor build() throws WorkflowConfigurationException {
            StageflowConfiguration config = configuration != null ? configuration : new StageflowConfiguration();

            StageServices stageServices = services;
            if (stageServices == null) {
                StageServices.Builder servicesBuilder = StageServices.builder()
                        .endpointInvoker(new HttpEndpointInvoker(config));
                if (config.isMetricsEnabled()) {
                    servicesBuilder.metrics(WorkflowMetrics.getInstance());
                }
                stageServices = servicesBuilder.build();
            }

            StagePluginRegistry pluginRegistry = registry;
            if (pluginRegistry == null) {
                StagePluginRegistryBuilder registryBuilder = new StagePluginRegistryBuilder(
                        BuiltInStagePlugins.createCatalog(stageServices), BuiltInStagePlugins.REQUIRED_PLUGIN_IDS,
                        externalPlugins);
                pluginRegistry = registryBuilder.build(pluginIds != null ? pluginIds : config.getPlugins());
            }

            if (!outputWriterSet) {
                outputWriter = new WorkflowOutputWriter(config.getOutputDirectory(),
                        clock != null ? clock : Clock.systemUTC());
            }

            logger.fine("Workflow executor built with plugins " + pluginRegistry);
            return new WorkflowExecutor(this, pluginRegistry, stageServices);
        }
    }
}
