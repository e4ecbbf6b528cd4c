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

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One version of the API catalog: per-environment base URLs and the API definitions it contains.
 */
public class ApiCatalogVersion {

    private final String version;
    private final Map<String, String> baseUrl;
    private final List<ApiDefinition> definitions;

    public ApiCatalogVersion(String version, Map<String, String> baseUrl, List<ApiDefinition> definitions) {
        this.version = Objects.requireNonNull(version, "Catalog version cannot be null");
        Map<String, String> urls = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (baseUrl != null) {
            urls.putAll(baseUrl);
        }
        this.baseUrl = urls;
        this.definitions = definitions != null ? List.copyOf(definitions) : List.of();
    }

    public String getVersion() {
        return version;
    }

    public Optional<String> getBaseUrl(String environment) {
        return Optional.ofNullable(baseUrl.get(environment));
    }

    public List<ApiDefinition> getDefinitions() {
        return definitions;
    }

    public Optional<ApiDefinition> findDefinition(String name) {
        return definitions.stream().filter(definition -> definition.getName().equalsIgnoreCase(name)).findFirst();
    }

    @Override
    public String toString() {
        return "ApiCatalogVersion{version='" + version + "', definitions=" + definitions.size() + '}';
    }
}
