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


package dev.mars.stageflow.workflow.plugin.http;

import dev.mars.stageflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.stageflow.workflow.definition.ApiCatalogVersion;
import dev.mars.stageflow.workflow.definition.ApiDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowDefinition;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Maps a workflow's API aliases to base URLs for an environment.
 * A definition's own URL for the environment wins over the catalog version's; the definition's
 * base path is appended to either.
 */
public final class ApiBaseUrlResolver {

    private ApiBaseUrlResolver() {
    }

    public static Map<String, String> buildLookup(WorkflowDefinition definition, ApiCatalogVersion catalogVersion,
                                                  String environment) throws WorkflowConfigurationException {
        Map<String, String> baseUrls = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (WorkflowDefinition.ApiReference reference : definition.getReferences().getApis()) {
            ApiDefinition apiDefinition = catalogVersion.findDefinition(reference.getDefinition())
                    .orElseThrow(() -> new WorkflowConfigurationException(String.format(
                            "API definition '%s' was not found in catalog version '%s'.",
                            reference.getDefinition(), catalogVersion.getVersion())));

            String baseUrl = resolveBaseUrl(catalogVersion, apiDefinition, environment)
                    .orElseThrow(() -> new WorkflowConfigurationException(String.format(
                            "Environment '%s' was not found for API definition '%s' in catalog version '%s'.",
                            environment, apiDefinition.getName(), catalogVersion.getVersion())));

            baseUrls.put(reference.getName(), combine(baseUrl, apiDefinition.getBasePath().orElse(null)));
        }
        return baseUrls;
    }

    public static Optional<String> resolveBaseUrl(ApiCatalogVersion catalogVersion, ApiDefinition definition,
                                                  String environment) {
        Optional<String> own = definition.getBaseUrl(environment);
        return own.isPresent() ? own : catalogVersion.getBaseUrl(environment);
    }

    static String combine(String baseUrl, String basePath) {
        if (basePath == null || basePath.isBlank()) {
            return baseUrl;
        }
        return trimTrailing(baseUrl) + "/" + trimLeading(trimTrailing(basePath));
    }

    static String trimTrailing(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }

    static String trimLeading(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == '/') {
            start++;
        }
        return value.substring(start);
    }
}
