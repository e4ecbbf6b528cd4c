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

import dev.mars.stageflow.workflow.definition.WorkflowDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowStageDefinition;
import dev.mars.stageflow.workflow.template.ResponseContext;
import dev.mars.stageflow.workflow.template.TemplateResolver;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves user-authored message templates and writes them to the execution log.
 */
public class StageMessageEmitter {

    private static final Logger logger = Logger.getLogger(StageMessageEmitter.class.getName());

    private final TemplateResolver templateResolver;

    public StageMessageEmitter(TemplateResolver templateResolver) {
        this.templateResolver = Objects.requireNonNull(templateResolver, "Template resolver cannot be null");
    }

    /**
     * Emits a stage's {@code message}. The response is in scope for endpoint stages only.
     */
    public void emit(WorkflowDefinition definition, WorkflowStageDefinition stage, ExecutionContext context,
                     ResponseContext response) {
        if (stage.getMessage().isEmpty() || stage.getMessage().get().isBlank()) {
            return;
        }

        String resolved = templateResolver.resolve(stage.getMessage().get(), context, response);
        if (!resolved.isBlank()) {
            logger.info(ExecutionLogFormat.indent(context) +
                       ExecutionLogFormat.stageTag(definition.getName(), stage.getName()) + " message: " + resolved);
        }
    }

    /**
     * Emits a resilience message such as a circuit breaker's {@code onOpen}.
     */
    public void emitNotice(String template, ExecutionContext context, Level level) {
        if (template == null || template.isBlank()) {
            return;
        }

        String resolved = templateResolver.resolve(template, context);
        if (!resolved.isBlank()) {
            logger.log(level, ExecutionLogFormat.indent(context) + resolved);
        }
    }
}
