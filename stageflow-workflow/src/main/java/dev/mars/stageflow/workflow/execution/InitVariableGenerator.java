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

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Random;
import java.util.UUID;

/**
 * Produces the values of init-stage variables.
 * <p>
 * Date and time windows default to one month either side of now; a time window defaults to the whole day.
 * {@code from}/{@code to} are ISO-8601 values, reversed bounds are swapped.
 */
public class InitVariableGenerator {

    static final int DEFAULT_MIN = 1;
    static final int DEFAULT_MAX = 100;
    static final int DEFAULT_TEXT_LENGTH = 16;

    private static final String TEXT_CHARACTERS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final DateTimeFormatter DEFAULT_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DEFAULT_TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Clock clock;
    private final Random random;

    public InitVariableGenerator() {
        this(Clock.systemUTC(), new Random());
    }

    public InitVariableGenerator(Clock clock, Random random) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.random = Objects.requireNonNull(random, "Random cannot be null");
    }

    /**
     * Generates a value for the variable.
     *
     * @param variable the declaration
     * @param resolvedValue the declaration's {@code value} with templates already resolved, or null
     * @param index one-based position used by sequences
     */
    public String generate(VariableDefinition variable, String resolvedValue, int index)
            throws WorkflowConfigurationException {
        try {
            switch (variable.getType()) {
                case FIXED:
                    if (resolvedValue == null || resolvedValue.isBlank()) {
                        throw new WorkflowConfigurationException("Fixed variables require a value.");
                    }
                    return resolvedValue;
                case NUMBER:
                    return formatNumber(randomNumber(variable.getMin().orElse(DEFAULT_MIN),
                            variable.getMax().orElse(DEFAULT_MAX)), variable.getPadding().orElse(null));
                case TEXT:
                    return randomText(variable.getLength().orElse(DEFAULT_TEXT_LENGTH));
                case GUID:
                    return UUID.randomUUID().toString();
                case DATETIME:
                    return randomDateTime(variable).format(formatter(variable, DateTimeFormatter.ISO_OFFSET_DATE_TIME));
                case DATE:
                    return randomDate(variable).format(formatter(variable, DEFAULT_DATE_FORMAT));
                case TIME:
                    return randomTime(variable).format(formatter(variable, DEFAULT_TIME_FORMAT));
                case SEQUENCE:
                    long start = variable.getStart().orElse(1);
                    long step = Math.max(1, variable.getStep().orElse(1));
                    return formatNumber(Math.addExact(start, Math.multiplyExact(index - 1L, step)),
                            variable.getPadding().orElse(null));
                default:
                    throw new WorkflowConfigurationException("Unsupported variable type: " + variable.getType());
            }
        } catch (DateTimeParseException | IllegalArgumentException | ArithmeticException e) {
            throw new WorkflowConfigurationException(
                    String.format("Variable '%s' could not be generated: %s", variable.getName(), e.getMessage()), e);
        }
    }

    private long randomNumber(int min, int max) {
        if (max < min) {
            int swap = min;
            min = max;
            max = swap;
        }
        return Math.min(max, min + (long) (random.nextDouble() * ((long) max - min + 1)));
    }

    private String randomText(int length) {
        StringBuilder sb = new StringBuilder(Math.max(0, length));
        for (int i = 0; i < length; i++) {
            sb.append(TEXT_CHARACTERS.charAt(random.nextInt(TEXT_CHARACTERS.length())));
        }
        return sb.toString();
    }

    private OffsetDateTime randomDateTime(VariableDefinition variable) {
        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
        OffsetDateTime from = variable.getFrom().map(OffsetDateTime::parse).orElse(null);
        OffsetDateTime to = variable.getTo().map(OffsetDateTime::parse).orElse(null);

        OffsetDateTime start = from != null ? from : (to != null ? to.minusMonths(1) : now.minusMonths(1));
        OffsetDateTime end = to != null ? to : (from != null ? start.plusMonths(1) : now.plusMonths(1));
        if (end.isBefore(start)) {
            OffsetDateTime swap = start;
            start = end;
            end = swap;
        }
        long span = ChronoUnit.MILLIS.between(start, end);
        return start.plus(nextLongInclusive(span), ChronoUnit.MILLIS);
    }

    private LocalDate randomDate(VariableDefinition variable) {
        LocalDate today = LocalDate.now(clock);
        LocalDate from = variable.getFrom().map(LocalDate::parse).orElse(null);
        LocalDate to = variable.getTo().map(LocalDate::parse).orElse(null);

        LocalDate start = from != null ? from : (to != null ? to.minusMonths(1) : today.minusMonths(1));
        LocalDate end = to != null ? to : (from != null ? start.plusMonths(1) : today.plusMonths(1));
        if (end.isBefore(start)) {
            LocalDate swap = start;
            start = end;
            end = swap;
        }
        return start.plusDays(nextLongInclusive(ChronoUnit.DAYS.between(start, end)));
    }

    private LocalTime randomTime(VariableDefinition variable) {
        LocalTime start = variable.getFrom().map(LocalTime::parse).orElse(LocalTime.MIN);
        LocalTime end = variable.getTo().map(LocalTime::parse).orElse(LocalTime.MAX);
        if (end.isBefore(start)) {
            LocalTime swap = start;
            start = end;
            end = swap;
        }
        return start.plusSeconds(nextLongInclusive(ChronoUnit.SECONDS.between(start, end)));
    }

    private long nextLongInclusive(long bound) {
        if (bound <= 0) {
            return 0;
        }
        return Math.min(bound, (long) (random.nextDouble() * (bound + 1)));
    }

    private static DateTimeFormatter formatter(VariableDefinition variable, DateTimeFormatter fallback) {
        return variable.getFormat().filter(format -> !format.isBlank())
                .map(DateTimeFormatter::ofPattern)
                .orElse(fallback);
    }

    private static String formatNumber(long value, Integer padding) {
        if (padding != null && padding >= 1) {
            return String.format("%0" + padding + "d", value);
        }
        return Long.toString(value);
    }
}
