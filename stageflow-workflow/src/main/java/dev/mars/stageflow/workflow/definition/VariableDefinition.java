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

package dev.mars.stageflow.workflow.definition;

import java.util.Objects;
import java.util.Optional;

/**
 * A variable declared in the init stage. Its generated value becomes a {@code global} scope entry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 */
public class VariableDefinition {

    private final String name;
    private final VariableType type;
    private final String value;
    private final Integer min;
    private final Integer max;
    private final Integer padding;
    private final Integer length;
    private final String from;
    private final String to;
    private final String format;
    private final Integer start;
    private final Integer step;

    private VariableDefinition(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Variable name cannot be null");
        this.type = Objects.requireNonNull(builder.type, "Variable type cannot be null");
        this.value = builder.value;
        this.min = builder.min;
        this.max = builder.max;
        this.padding = builder.padding;
        this.length = builder.length;
        this.from = builder.from;
        this.to = builder.to;
        this.format = builder.format;
        this.start = builder.start;
        this.step = builder.step;
    }

    public String getName() {
        return name;
    }

    public VariableType getType() {
        return type;
    }

    public Optional<String> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<Integer> getMin() {
        return Optional.ofNullable(min);
    }

    public Optional<Integer> getMax() {
        return Optional.ofNullable(max);
    }

    public Optional<Integer> getPadding() {
        return Optional.ofNullable(padding);
    }

    public Optional<Integer> getLength() {
        return Optional.ofNullable(length);
    }

    /**
     * Lower bound for DateTime, Date and Time values, in ISO-8601 form.
     */
    public Optional<String> getFrom() {
        return Optional.ofNullable(from);
    }

    /**
     * Upper bound for DateTime, Date and Time values, in ISO-8601 form.
     */
    public Optional<String> getTo() {
        return Optional.ofNullable(to);
    }

    public Optional<String> getFormat() {
        return Optional.ofNullable(format);
    }

    public Optional<Integer> getStart() {
        return Optional.ofNullable(start);
    }

    public Optional<Integer> getStep() {
        return Optional.ofNullable(step);
    }

    public static Builder builder(String name, VariableType type) {
        return new Builder(name, type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VariableDefinition that = (VariableDefinition) o;
        return Objects.equals(name, that.name) &&
               type == that.type &&
               Objects.equals(value, that.value) &&
               Objects.equals(format, that.format);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, value, format);
    }

    @Override
    public String toString() {
        return "VariableDefinition{" +
               "name='" + name + '\'' +
               ", type=" + type +
               '}';
    }

    /**
     * Kinds of generated init-stage values.
     */
    public enum VariableType {
        /** Templated literal; a value is required. */
        FIXED,
        /** Random integer between min (default 1) and max (default 100), optionally zero padded. */
        NUMBER,
        /** Random alphanumeric text of the given length (default 16). */
        TEXT,
        /** Random UUID. */
        GUID,
        /** Random timestamp within the from/to window. */
        DATETIME,
        /** Random date within the from/to window. */
        DATE,
        /** Random time of day within the from/to window. */
        TIME,
        /** Start plus (index - 1) times step. */
        SEQUENCE;

        public static VariableType fromString(String value) {
            for (VariableType type : values()) {
                if (type.name().equalsIgnoreCase(value)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown variable type: " + value);
        }
    }

    public static class Builder {
        private final String name;
        private final VariableType type;
        private String value;
        private Integer min;
        private Integer max;
        private Integer padding;
        private Integer length;
        private String from;
        private String to;
        private String format;
        private Integer start;
        private Integer step;

        private Builder(String name, VariableType type) {
            this.name = name;
            this.type = type;
        }

        public Builder value(String value) {
            this.value = value;
            return this;
        }

        public Builder min(Integer min) {
            this.min = min;
            return this;
        }

        public Builder max(Integer max) {
            this.max = max;
            return this;
        }

        public Builder padding(Integer padding) {
            this.padding = padding;
            return this;
        }

        public Builder length(Integer length) {
            this.length = length;
            return this;
        }

        public Builder from(String from) {
            this.from = from;
            return this;
        }

        public Builder to(String to) {
            this.to = to;
            return this;
        }

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public Builder start(Integer start) {
            this.start = start;
            return this;
        }

        public Builder step(Integer step) {
            this.step = step;
            return this;
        }

        public VariableDefinition build() {
            return new VariableDefinition(this);
        }
    }
}
