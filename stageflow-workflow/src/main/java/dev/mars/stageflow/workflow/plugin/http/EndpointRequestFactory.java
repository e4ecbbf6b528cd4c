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
import dev.mars.stageflow.http.EndpointRequest;
import dev.mars.stageflow.workflow.definition.WorkflowStageDefinition;
import dev.mars.stageflow.workflow.execution.ExecutionContext;
import dev.mars.stageflow.workflow.template.TemplateResolver;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Builds the HTTP request for an endpoint stage by resolving its path, query, headers and body templates.
 */
public class EndpointRequestFactory {

    static final String DEFAULT_CONTENT_TYPE = "application/json";
    private static final String BEARER_PREFIX = "Bearer ";

    private final TemplateResolver templateResolver;

    public EndpointRequestFactory(TemplateResolver templateResolver) {
        this.templateResolver = Objects.requireNonNull(templateResolver, "Template resolver cannot be null");
    }

    public EndpointRequest create(WorkflowStageDefinition stage, String baseUrl, ExecutionContext context)
            throws WorkflowConfigurationException {
        String endpoint = stage.getEndpoint().filter(value -> !value.isBlank())
                .orElseThrow(() -> new WorkflowConfigurationException(
                        String.format("Stage '%s' endpoint is required.", stage.getName())));
        String httpVerb = stage.getHttpVerb().filter(value -> !value.isBlank())
                .orElseThrow(() -> new WorkflowConfigurationException(
                        String.format("Stage '%s' httpVerb is required.", stage.getName())));

        String path = templateResolver.resolve(endpoint, context);
        StringBuilder url = new StringBuilder(ApiBaseUrlResolver.trimTrailing(baseUrl))
                .append('/')
                .append(ApiBaseUrlResolver.trimLeading(path));
        if (!stage.getQuery().isEmpty()) {
            StringJoiner query = new StringJoiner("&");
            for (Map.Entry<String, String> entry : stage.getQuery().entrySet()) {
                query.add(encode(entry.getKey()) + "=" + encode(templateResolver.resolve(entry.getValue(), context)));
            }
            url.append('?').append(query);
        }

        EndpointRequest.Builder builder = EndpointRequest.builder()
                .method(httpVerb.trim())
                .url(url.toString());

        String contentType = null;
        for (Map.Entry<String, String> header : stage.getHeaders().entrySet()) {
            String value = templateResolver.resolve(header.getValue(), context);
            if (header.getKey().equalsIgnoreCase("Authorization")) {
                value = normalizeAuthorization(value);
            }
            if (header.getKey().equalsIgnoreCase("Content-Type")) {
                contentType = value.trim();
            } else {
                builder.header(header.getKey(), value);
            }
        }

        if (stage.getBody().filter(body -> !body.isBlank()).isPresent()) {
            builder.body(templateResolver.resolve(stage.getBody().get(), context))
                    .contentType(contentType != null ? contentType : DEFAULT_CONTENT_TYPE);
        } else if (contentType != null) {
            builder.body("").contentType(contentType);
        }
        return builder.build();
    }

    /**
     * Strips quotes and whitespace around a bearer token, as left behind by copied credentials.
     */
    static String normalizeAuthorization(String value) {
        if (value.length() < BEARER_PREFIX.length() ||
            !value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return value;
        }

        String token = value.substring(BEARER_PREFIX.length());
        int start = 0;
        int end = token.length();
        while (start < end && isTokenPadding(token.charAt(start))) {
            start++;
        }
        while (end > start && isTokenPadding(token.charAt(end - 1))) {
            end--;
        }
        return BEARER_PREFIX + token.substring(start, end);
    }

    private static boolean isTokenPadding(char c) {
        return c == '"' || c == ' ' || c == '\n' || c == '\r';
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
