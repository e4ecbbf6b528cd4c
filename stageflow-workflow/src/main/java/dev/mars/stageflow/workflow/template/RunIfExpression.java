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

package dev.mars.stageflow.workflow.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed {@code runIf} condition: one token compared against a literal with
 * {@code ==}, {@code !=}, {@code in} or {@code not in}.
 * <pre>
 *   {{input.tag}} != null
 *   {{context.mode}} == "full"
 *   {{stage:create.output.http_status}} in [200, 201]
 * </pre>
 */
public final class RunIfExpression {

    private static final String LITERAL = "(?:-?\\d+(?:\\.\\d+)?|\"[^\"]*\"|'[^']*')";
    private static final Pattern EXPRESSION = Pattern.compile(
            "^\\s*\\{\\{\\s*(.+?)\\s*\\}\\}\\s*(==|!=|not\\s+in|in)\\s*" +
            "(null|" + LITERAL + "|\\[(?:\\s*" + LITERAL + "\\s*(?:,\\s*" + LITERAL + "\\s*)*)?\\])\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LIST_ITEM = Pattern.compile(LITERAL);

    private final String token;
    private final Operator operator;
    private final String expected;
    private final List<String> expectedValues;

    private RunIfExpression(String token, Operator operator, String expected, List<String> expectedValues) {
        this.token = token;
        this.operator = operator;
        this.expected = expected;
        this.expectedValues = expectedValues;
    }

    /**
     * @throws IllegalArgumentException if the expression does not follow the supported grammar
     */
    public static RunIfExpression parse(String expression) {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Matcher matcher = EXPRESSION.matcher(expression);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid runIf expression '" + expression + "'.");
        }

        Operator operator = Operator.fromSymbol(matcher.group(2));
        String rawValue = matcher.group(3);
        if (operator == Operator.IN || operator == Operator.NOT_IN) {
            return new RunIfExpression(matcher.group(1), operator, null, parseList(rawValue));
        }
        String expected = rawValue.equalsIgnoreCase("null") ? null : unquote(rawValue);
        return new RunIfExpression(matcher.group(1), operator, expected, List.of());
    }

    public static boolean isValid(String expression) {
        return expression != null && EXPRESSION.matcher(expression).matches();
    }

    public String getToken() {
        return token;
    }

    public Operator getOperator() {
        return operator;
    }

    /**
     * Whether the condition holds for the resolved token value; an empty value means the token is absent.
     * {@code null} only matches an absent value. List membership treats an absent value as empty text.
     */
    public boolean matches(Optional<String> actual) {
        switch (operator) {
            case IN:
                return expectedValues.contains(actual.orElse(""));
            case NOT_IN:
                return !expectedValues.contains(actual.orElse(""));
            case EQUALS:
                return isEqual(actual);
            case NOT_EQUALS:
                return !isEqual(actual);
            default:
                throw new IllegalStateException("Unhandled operator " + operator);
        }
    }

    private boolean isEqual(Optional<String> actual) {
        if (expected == null) {
            return actual.isEmpty();
        }
        return expected.equals(actual.orElse(""));
    }

    private static List<String> parseList(String rawValue) {
        List<String> values = new ArrayList<>();
        Matcher items = LIST_ITEM.matcher(rawValue.substring(1, rawValue.length() - 1));
        while (items.find()) {
            values.add(unquote(items.group()));
        }
        return List.copyOf(values);
    }

    private static String unquote(String value) {
        if (value.length() >= 2 &&
            ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    @Override
    public String toString() {
        return "{{" + token + "}} " + operator.symbol + " " +
               (operator == Operator.IN || operator == Operator.NOT_IN ? expectedValues : expected);
    }

    public enum Operator {
        EQUALS("=="),
        NOT_EQUALS("!="),
        IN("in"),
        NOT_IN("not in");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        static Operator fromSymbol(String symbol) {
            String normalized = symbol.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
            for (Operator operator : values()) {
                if (operator.symbol.equals(normalized)) {
                    return operator;
                }
            }
            throw new IllegalArgumentException("Unknown runIf operator '" + symbol + "'.");
        }
    }
}
