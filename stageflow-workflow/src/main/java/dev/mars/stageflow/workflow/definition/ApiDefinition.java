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

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * An API in the catalog. Per-environment base URLs here take precedence over the catalog version's.
 */
public class ApiDefinition {

    private final String name;
    private final Map<String, String> baseUrl;
    private final String basePath;

    public ApiDefinition(String name, Map<String, String> baseUrl, String basePath) {
        this.name = Objects.requireNonNull(name, "API name cannot be null");
        Map<String, String> urls = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (baseUrl != null) {
            urls.putAll(baseUrl);
        }
        this.baseUrl = urls;
        this.basePath = basePath;
    }

    public String getName() {
        return name;
    }

    public Optional<String> getBaseUrl(String environment) {
        return Optional.ofNullable(baseUrl.get(environment));
    }

    public Optional<String> getBasePath() {
        return Optional.ofNullable(basePath);
    }

    @Override
    public String toString() {
        return "ApiDefinition{name='" + name + "', environments=" + baseUrl.keySet() + '}';
    }
}
