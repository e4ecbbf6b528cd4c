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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EndpointRequestFactoryTest {

    private EndpointRequestFactory factory;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        factory = new EndpointRequestFactory(new TemplateResolver());
        context = new ExecutionContext(Map.of("customer", "c 1", "token", "\"abc\" "), Map.of());
    }

    @Test
    void testBuildsUrlFromBaseUrlPathAndQuery() throws Exception {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("customer", "{{input.customer}}");
        query.put("page", "2");
        WorkflowStageDefinition stage = WorkflowStageDefinition.builder("List", "Endpoint")
                .endpoint("/orders")
                .httpVerb(" get ")
                .query(query)
                .build();

        EndpointRequest request = factory.create(stage, "https://api.test/v1/", context);

        assertEquals("GET", request.getMethod());
        assertEquals("https://api.test/v1/orders?customer=c%201&page=2", request.getUrl());
        assertEquals(Optional.empty(), request.getBody());
    }

    @Test
    void testBodyDefaultsToJsonContentType() throws Exception {
        WorkflowStageDefinition stage = WorkflowStageDefinition.builder("Create", "Endpoint")
                .endpoint("orders")
                .httpVerb("POST")
                .body("{\"customer\":\"{{input.customer}}\"}")
                .build();

        EndpointRequest request = factory.create(stage, "https://api.test", context);

        assertEquals("https://api.test/orders", request.getUrl());
        assertEquals(Optional.of("{\"customer\":\"c 1\"}"), request.getBody());
        assertEquals(Optional.of("application/json"), request.getContentType());
    }

    @Test
    void testContentTypeHeaderBecomesRequestContentType() throws Exception {
        WorkflowStageDefinition stage = WorkflowStageDefinition.builder("Create", "Endpoint")
                .endpoint("orders")
                .httpVerb("POST")
                .headers(Map.of("Content-Type", "text/plain"))
                .body("hello")
                .build();

        EndpointRequest request = factory.create(stage, "https://api.test", context);

        assertEquals(Optional.of("text/plain"), request.getContentType());
        assertFalse(request.getHeaders().containsKey("Content-Type"));
    }

    @Test
    void testBearerTokenIsNormalized() throws Exception {
        WorkflowStageDefinition stage = WorkflowStageDefinition.builder("Get", "Endpoint")
                .endpoint("orders")
                .httpVerb("GET")
                .headers(Map.of("Authorization", "Bearer {{input.token}}"))
                .build();

        EndpointRequest request = factory.create(stage, "https://api.test", context);

        assertEquals("Bearer abc", request.getHeaders().get("Authorization"));
    }

    @Test
    void testNormalizeAuthorizationLeavesOtherSchemesAlone() {
        assertEquals("Basic \"x\"", EndpointRequestFactory.normalizeAuthorization("Basic \"x\""));
        assertEquals("Bearer t", EndpointRequestFactory.normalizeAuthorization("bearer \"t\"\n"));
    }

    @Test
    void testMissingEndpointIsConfigurationError() {
        WorkflowStageDefinition stage = WorkflowStageDefinition.builder("Get", "Endpoint")
                .httpVerb("GET")
                .build();

        WorkflowConfigurationException exception = assertThrows(WorkflowConfigurationException.class,
                () -> factory.create(stage, "https://api.test", context));
        assertEquals("Stage 'Get' endpoint is required.", exception.getMessage());
    }
}
