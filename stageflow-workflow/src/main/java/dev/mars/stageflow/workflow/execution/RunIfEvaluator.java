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

import dev.mars.stageflow.core.exceptions.TemplateResolutionException;
import dev.mars.stageflow.workflow.definition.WorkflowStageDefinition;
import dev.mars.stageflow.workflow.template.RunIfExpression;
import dev.mars.stageflow.workflow.template.TemplateResolver;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Decides whether a stage runs. A condition that cannot be parsed or resolved counts as not satisfied.
 */
public class RunIfEvaluator {
    private static final Logger logger = Logger.getLogger(RunIfEvaluator.class.getName());

    private final TemplateResolver templateResolver;

    public RunIfEvaluator(TemplateResolver templateResolver) {
        this.templateResolver = Objects.requireNonNull(templateResolver, "Template resolver cannot be null");
    }

    public boolean shouldRun(WorkflowStageDefinition stage, ExecutionContext context) {
        Optional<String> runIf = stage.getRunIf().filter(expression -> !expression.isBlank());
        return runIf.isEmpty() || evaluate(runIf.get(), context);
    }

    public boolean evaluate(String expression, ExecutionContext context) {
        RunIfExpression parsed;
        try {
            parsed = RunIfExpression.parse(expression);
        } catch (IllegalArgumentException e) {
            logger.warning(e.getMessage() + " Treating the condition as not satisfied.");
            return false;
        }

        Optional<String> actual;
        try {
            actual = templateResolver.resolveOptional(parsed.getToken(), context, null);
        } catch (TemplateResolutionException e) {
            logger.warning("runIf '" + expression + "' could not be resolved: " + e.getMessage() +
                          " Treating the condition as not satisfied.");
            return false;
        }
        return parsed.matches(actual);
    }
}
