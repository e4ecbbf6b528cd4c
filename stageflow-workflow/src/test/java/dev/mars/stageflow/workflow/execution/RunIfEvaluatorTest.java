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

import dev.mars.stageflow.workflow.definition.WorkflowStageDefinition;
import dev.mars.stageflow.workflow.template.RunIfExpression;
import dev.mars.stageflow.workflow.template.TemplateResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for runIf conditions, including the null and empty-value rules.
 */
class RunIfEvaluatorTest {

    private RunIfEvaluator evaluator;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        evaluator = new RunIfEvaluator(new TemplateResolver());
        context = new ExecutionContext(Map.of("tag", "", "env", "prod"), Map.of());
        context.putEndpointOutput("check", Map.of("http_status", "404"));
    }

    @Test
    void testEmptyInputIsNotNull() {
        assertTrue(evaluator.evaluate("{{input.tag}} != null", context));
        assertFalse(evaluator.evaluate("{{input.tag}} == null", context));
    }

    @Test
    void testAbsentInputMatchesNull() {
        ExecutionContext withoutTag = new ExecutionContext(Map.of(), Map.of());
        assertFalse(evaluator.evaluate("{{input.tag}} != null", withoutTag));
        assertTrue(evaluator.evaluate("{{input.tag}} == null", withoutTag));
    }

    @Test
    void testEqualityWithQuotedAndNumericLiterals() {
        assertTrue(evaluator.evaluate("{{input.env}} == \"prod\"", context));
        assertTrue(evaluator.evaluate("{{input.env}} != 'dev'", context));
        assertTrue(evaluator.evaluate("{{stage:check.output.http_status}} == 404", context));
    }

    @Test
    void testListMembership() {
        assertTrue(evaluator.evaluate("{{input.env}} in [\"prod\", \"staging\"]", context));
        assertFalse(evaluator.evaluate("{{input.env}} not in ['prod']", context));
        assertTrue(evaluator.evaluate("{{stage:check.output.http_status}} in [200, 404]", context));
    }

    @Test
    void testInvalidExpressionIsNotSatisfied() {
        assertFalse(evaluator.evaluate("input.env == prod", context));
        assertFalse(RunIfExpression.isValid("{{input.env}} ~= 'prod'"));
    }

    @Test
    void testResolutionErrorIsNotSatisfied() {
        assertFalse(evaluator.evaluate("{{unknown.root}} == 'x'", context));
        assertFalse(evaluator.evaluate("{{stage:check.bad}} != null", context));
    }

    @Test
    void testStageWithoutRunIfAlwaysRuns() {
        WorkflowStageDefinition stage = WorkflowStageDefinition.builder("plain", "Endpoint").build();
        assertTrue(evaluator.shouldRun(stage, context));

        WorkflowStageDefinition guarded = WorkflowStageDefinition.builder("guarded", "Endpoint")
                .runIf("{{input.env}} == 'dev'")
                .build();
        assertFalse(evaluator.shouldRun(guarded, context));
    }
}
