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

import dev.mars.stageflow.core.exceptions.TemplateResolutionException;
import dev.mars.stageflow.http.EndpointResponse;
import dev.mars.stageflow.workflow.execution.ExecutionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TemplateResolver token scopes, separators and JSON projection.
 */
class TemplateResolverTest {

    private TemplateResolver resolver;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-08-18T10:15:30Z"), ZoneOffset.UTC);
        resolver = new TemplateResolver(clock, name -> "HOST_VAR".equals(name) ? "from-host" : null);
        context = new ExecutionContext(Map.of("tenant", "acme", "tag", ""), Map.of("baseUrl", "https://api.test"));
        context.getGlobals().put("organizationAppId", "org-1");
        context.getContext().put("token", "abc");
    }

    @Test
    void testTemplateWithoutTokensIsReturnedUnchanged() {
        String template = "plain text with { braces } and }} stray";
        assertEquals(template, resolver.resolve(template, context));
        assertEquals(template, resolver.resolve(resolver.resolve(template, context), context));
    }

    @Test
    void testNullTemplateResolvesToEmpty() {
        assertEquals("", resolver.resolve(null, context));
    }

    @Test
    void testColonAndDotSeparatorsAreEquivalent() {
        assertEquals("org-1", resolver.resolve("{{global:organizationAppId}}", context));
        assertEquals("org-1", resolver.resolve("{{global.organizationAppId}}", context));
        assertEquals("acme/abc", resolver.resolve("{{ input.tenant }}/{{context:token}}", context));
    }

    @Test
    void testLookupsAreCaseInsensitive() {
        assertEquals("acme", resolver.resolve("{{input.TENANT}}", context));
    }

    @Test
    void testEnvironmentFallsBackToHostEnvironment() {
        assertEquals("https://api.test", resolver.resolve("{{env:baseUrl}}", context));
        assertEquals("from-host", resolver.resolve("{{env:HOST_VAR}}", context));
        assertThrows(TemplateResolutionException.class, () -> resolver.resolve("{{env:MISSING}}", context));
    }

    @Test
    void testMissingContextKeyResolvesToEmpty() {
        assertEquals("[]", resolver.resolve("[{{context.unknown}}]", context));
    }

    @Test
    void testMissingInputFails() {
        TemplateResolutionException exception = assertThrows(TemplateResolutionException.class,
                () -> resolver.resolve("{{input.absent}}", context));
        assertEquals("Input 'absent' was not provided.", exception.getMessage());
        assertEquals("input.absent", exception.getToken());
    }

    @Test
    void testUnknownRootFails() {
        assertThrows(TemplateResolutionException.class, () -> resolver.resolve("{{secret.value}}", context));
    }

    @Test
    void testStageOutputProjection() {
        context.putEndpointOutput("S", Map.of("dto", "{\"appId\":\"X1\",\"items\":[{\"name\":\"first\"}]}"));

        assertEquals("X1", resolver.resolve("{{stage:json(S.output.dto).appId}}", context));
        assertEquals("first", resolver.resolve("{{stage:json(S.output.dto).items.0.name}}", context));
        assertEquals("X1", resolver.resolve("{{json(stage:S.output.dto).appId}}", context));
    }

    @Test
    void testProjectionOfNonJsonOutputFails() {
        context.putEndpointOutput("S", Map.of("dto", "not json"));
        assertThrows(TemplateResolutionException.class,
                () -> resolver.resolve("{{stage:json(S.output.dto).appId}}", context));
    }

    @Test
    void testStageAndLegacyOutputRoots() {
        context.putEndpointOutput("create", Map.of("id", "42"));
        context.putWorkflowOutput("child", Map.of("result", "done"));
        context.putWorkflowResult("child", "Ok", "all good");

        assertEquals("42", resolver.resolve("{{stage:create.output.id}}", context));
        assertEquals("42", resolver.resolve("{{endpoint:create.output.id}}", context));
        assertEquals("done", resolver.resolve("{{stage:child.output.result}}", context));
        assertEquals("done", resolver.resolve("{{workflow:child.output.result}}", context));
        assertEquals("done", resolver.resolve("{{stage:child.workflow.output.result}}", context));
        assertEquals("Ok", resolver.resolve("{{stage:child.workflow.result.status}}", context));
        assertEquals("all good", resolver.resolve("{{stage:child.workflow.result.message}}", context));
    }

    @Test
    void testMalformedStageTokenFails() {
        assertThrows(TemplateResolutionException.class, () -> resolver.resolve("{{stage:create.id}}", context));
    }

    @Test
    void testResponseScope() {
        ResponseContext response = new ResponseContext(new EndpointResponse(201,
                "{\"data\":{\"id\":\"r-1\"}}", Map.of("Location", "/items/r-1")));

        assertEquals("201", resolver.resolve("{{response.status}}", context, response));
        assertEquals("/items/r-1", resolver.resolve("{{response.headers.location}}", context, response));
        assertEquals("r-1", resolver.resolve("{{response.data.id}}", context, response));
        assertEquals("{\"data\":{\"id\":\"r-1\"}}", resolver.resolve("{{response.body}}", context, response));
    }

    @Test
    void testResponseTokenWithoutResponseFails() {
        assertThrows(TemplateResolutionException.class, () -> resolver.resolve("{{response.status}}", context));
    }

    @Test
    void testSystemScope() {
        assertEquals("2025-08-18", resolver.resolve("{{system:date.utcnow}}", context));
        assertEquals("10:15:30", resolver.resolve("{{system:time.now}}", context));
        assertEquals("2025-08-18T10:15:30Z", resolver.resolve("{{system:datetime.utcnow}}", context));
        assertEquals(36, resolver.resolve("{{system:uuid.new}}", context).length());
        assertThrows(TemplateResolutionException.class, () -> resolver.resolve("{{system:date.tomorrow}}", context));
    }

    @Test
    void testReplacementTextIsNotReinterpreted() {
        context.getGlobals().put("price", "$1\\2");
        assertEquals("cost $1\\2", resolver.resolve("cost {{global.price}}", context));
    }

    @Test
    void testResolveAllKeepsOrder() {
        Map<String, String> resolved = resolver.resolveAll(
                new java.util.LinkedHashMap<>(Map.of("a", "{{input.tenant}}")), context, null);
        assertEquals(Map.of("a", "acme"), resolved);
    }

    @Test
    void testTokenHelpers() {
        assertEquals(java.util.List.of("input.a", "global:b"),
                TemplateResolver.extractTokens("x {{input.a}} y {{ global:b }}"));
        assertArrayEquals(new String[]{"stage", "S", "output", "k"}, TemplateResolver.splitToken("stage:S.output.k"));
        assertTrue(TemplateResolver.containsTokens("{{a.b}}"));
        assertFalse(TemplateResolver.containsTokens("none"));
        assertEquals("stage:S.output.dto", TemplateResolver.jsonProjectionSource("stage:json(S.output.dto).x").orElse(null));
    }
}
