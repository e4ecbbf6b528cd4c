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

import dev.mars.stageflow.core.exceptions.WorkflowConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValidationResultTest {

    private ValidationResult result;

    @BeforeEach
    void setUp() {
        result = new ValidationResult();
    }

    @Test
    void testEmptyResultIsValid() throws Exception {
        assertTrue(result.isValid());
        assertFalse(result.hasWarnings());
        result.throwIfInvalid();
    }

    @Test
    void testWarningsDoNotInvalidate() {
        result.addWarning("stages[1]", "Stage 'B' is referenced before it runs.");

        assertTrue(result.isValid());
        assertEquals(1, result.getWarningCount());
        assertEquals("stages[1]", result.getWarnings().get(0).getFieldPath());
        assertEquals(ValidationResult.ValidationIssue.Severity.WARNING, result.getWarnings().get(0).getSeverity());
    }

    @Test
    void testPluginErrorsShareFieldPath() {
        result.addErrors("stages[0]", List.of("first", "second"));

        assertEquals(2, result.getErrorCount());
        assertTrue(result.getErrors().stream().allMatch(issue -> "stages[0]".equals(issue.getFieldPath())));
    }

    @Test
    void testThrowIfInvalidCarriesEveryMessage() {
        result.addError("Workflow version is required.");
        result.addError("id", "Workflow id is required.");

        WorkflowConfigurationException exception =
                assertThrows(WorkflowConfigurationException.class, () -> result.throwIfInvalid());
        assertEquals(List.of("Workflow version is required.", "Workflow id is required."), exception.getErrors());
    }

    @Test
    void testIssuesAreReturnedAsCopies() {
        result.addError("x");

        assertThrows(UnsupportedOperationException.class, () -> result.getErrors().clear());
        assertEquals(1, result.getErrorCount());
    }
}
