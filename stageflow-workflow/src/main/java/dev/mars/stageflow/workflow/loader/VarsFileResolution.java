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


package dev.mars.stageflow.workflow.loader;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Values resolved from a vars file together with the section each value came from.
 */
public class VarsFileResolution {

    private final Map<String, String> values;
    private final Map<String, Source> sources;

    public VarsFileResolution(Map<String, String> values, Map<String, Source> sources) {
        this.values = Collections.unmodifiableMap(caseInsensitiveCopy(values));
        this.sources = Collections.unmodifiableMap(caseInsensitiveCopy(sources));
    }

    public Map<String, String> getValues() {
        return values;
    }

    public Map<String, Source> getSources() {
        return sources;
    }

    private static <V> Map<String, V> caseInsensitiveCopy(Map<String, V> source) {
        Map<String, V> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (source != null) {
            copy.putAll(source);
        }
        return copy;
    }

    /**
     * Section of the vars file a value was taken from.
     */
    public record Source(Scope scope, String environment, String version) {

        public enum Scope {
            GLOBAL, ENVIRONMENT, VERSION
        }

        public static final Source GLOBAL = new Source(Scope.GLOBAL, null, null);

        public static Source forEnvironment(String environment) {
            return new Source(Scope.ENVIRONMENT, environment, null);
        }

        public static Source forVersion(String environment, String version) {
            return new Source(Scope.VERSION, environment, version);
        }

        public String describe() {
            switch (scope) {
                case ENVIRONMENT:
                    return "environment " + environment;
                case VERSION:
                    return "environment " + environment + " / version " + version;
                default:
                    return "global";
            }
        }
    }
}
