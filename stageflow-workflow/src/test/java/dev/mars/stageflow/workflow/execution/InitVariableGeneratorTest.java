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

import dev.mars.stageflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.stageflow.workflow.definition.VariableDefinition;
import dev.mars.stageflow.workflow.definition.VariableDefinition.VariableType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Random;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InitVariableGeneratorTest {

    private InitVariableGenerator generator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-08-18T10:15:30Z"), ZoneOffset.UTC);
        generator = new InitVariableGenerator(clock, new Random(42));
    }

    @Test
    void testFixedReturnsResolvedValue() throws Exception {
        VariableDefinition variable = VariableDefinition.builder("tenant", VariableType.FIXED).value("{{input.t}}").build();

        assertEquals("acme", generator.generate(variable, "acme", 1));
        assertThrows(WorkflowConfigurationException.class, () -> generator.generate(variable, " ", 1));
    }

    @Test
    void testNumberStaysWithinBoundsAndIsPadded() throws Exception {
        VariableDefinition variable = VariableDefinition.builder("n", VariableType.NUMBER)
                .min(5).max(9).padding(4).build();

        for (int i = 0; i < 200; i++) {
            String value = generator.generate(variable, null, 1);
            assertEquals(4, value.length());
            int number = Integer.parseInt(value);
            assertTrue(number >= 5 && number <= 9, value);
        }
    }

    @Test
    void testNumberBoundsAreSwappedWhenReversed() throws Exception {
        VariableDefinition variable = VariableDefinition.builder("n", VariableType.NUMBER).min(10).max(1).build();

        int number = Integer.parseInt(generator.generate(variable, null, 1));
        assertTrue(number >= 1 && number <= 10);
    }

    @Test
    void testTextUsesRequestedLength() throws Exception {
        assertEquals(16, generator.generate(VariableDefinition.builder("t", VariableType.TEXT).build(), null, 1).length());
        String text = generator.generate(VariableDefinition.builder("t", VariableType.TEXT).length(5).build(), null, 1);
        assertTrue(text.matches("[A-Za-z0-9]{5}"), text);
    }

    @Test
    void testGuidIsParsable() throws Exception {
        String value = generator.generate(VariableDefinition.builder("g", VariableType.GUID).build(), null, 1);

        assertEquals(value, UUID.fromString(value).toString());
    }

    @Test
    void testDateWithinWindowAndFormatted() throws Exception {
        VariableDefinition variable = VariableDefinition.builder("d", VariableType.DATE)
                .from("2025-03-01").to("2025-03-05").build();

        LocalDate date = LocalDate.parse(generator.generate(variable, null, 1));
        assertFalse(date.isBefore(LocalDate.of(2025, 3, 1)));
        assertFalse(date.isAfter(LocalDate.of(2025, 3, 5)));

        VariableDefinition formatted = VariableDefinition.builder("d", VariableType.DATE)
                .from("2025-03-01").to("2025-03-01").format("dd/MM/yyyy").build();
        assertEquals("01/03/2025", generator.generate(formatted, null, 1));
    }

    @Test
    void testDateDefaultsAroundClock() throws Exception {
        LocalDate date = LocalDate.parse(generator.generate(
                VariableDefinition.builder("d", VariableType.DATE).build(), null, 1));

        assertFalse(date.isBefore(LocalDate.of(2025, 7, 18)));
        assertFalse(date.isAfter(LocalDate.of(2025, 9, 18)));
    }

    @Test
    void testDateTimeWithinWindow() throws Exception {
        VariableDefinition variable = VariableDefinition.builder("dt", VariableType.DATETIME)
                .from("2025-01-01T00:00:00Z").to("2025-01-02T00:00:00Z").build();

        OffsetDateTime value = OffsetDateTime.parse(generator.generate(variable, null, 1));
        assertFalse(value.isBefore(OffsetDateTime.parse("2025-01-01T00:00:00Z")));
        assertFalse(value.isAfter(OffsetDateTime.parse("2025-01-02T00:00:00Z")));
    }

    @Test
    void testTimeWithinWindow() throws Exception {
        VariableDefinition variable = VariableDefinition.builder("t", VariableType.TIME)
                .from("09:00:00").to("09:30:00").build();

        LocalTime time = LocalTime.parse(generator.generate(variable, null, 1));
        assertFalse(time.isBefore(LocalTime.of(9, 0)));
        assertFalse(time.isAfter(LocalTime.of(9, 30)));
    }

    @Test
    void testSequenceUsesIndex() throws Exception {
        VariableDefinition variable = VariableDefinition.builder("s", VariableType.SEQUENCE)
                .start(100).step(5).padding(5).build();

        assertEquals("00100", generator.generate(variable, null, 1));
        assertEquals("00110", generator.generate(variable, null, 3));
    }

    @Test
    void testInvalidBoundIsReportedWithVariableName() {
        VariableDefinition variable = VariableDefinition.builder("shipDate", VariableType.DATE).from("not-a-date").build();

        WorkflowConfigurationException exception = assertThrows(WorkflowConfigurationException.class,
                () -> generator.generate(variable, null, 1));
        assertTrue(exception.getMessage().startsWith("Variable 'shipDate' could not be generated:"));
    }
}
