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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.stageflow.core.exceptions.TemplateResolutionException;
import dev.mars.stageflow.workflow.execution.ExecutionContext;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {{root.path}}} and {@code {{root:path}}} tokens against the scopes of an
 * {@link ExecutionContext}. Both separators are accepted anywhere in a token.
 * <p>
 * Supported roots: {@code input}, {@code global}, {@code context}, {@code env}, {@code stage}
 * (alias {@code stages}), {@code endpoint}, {@code workflow}, {@code response} and {@code system}.
 * Stage output holding JSON can be projected with {@code stage:json(S.output.key).field.0.name}
 * or {@code json(stage:S.output.key).field}.
 * <p>
 * A missing {@code context} key resolves to an empty string; every other missing value is an error.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public class TemplateResolver {

    private static final Pattern TOKEN_PATTERN = Pattern.compile("\\{\\{\\s*(.+?)\\s*\\}\\}");
    private static final Pattern JSON_PROJECTION = Pattern.compile(
            "^(?:stages?\\s*[:.]\\s*)?json\\((.+?)\\)(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern STAGE_PREFIX = Pattern.compile("^stages?\\s*[:.]\\s*", Pattern.CASE_INSENSITIVE);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Clock clock;
    private final UnaryOperator<String> systemEnvironment;

    public TemplateResolver() {
        this(Clock.systemDefaultZone());
    }

    public TemplateResolver(Clock clock) {
        this(clock, System::getenv);
    }

    /**
     * @param clock source of {@code system:*} time values
     * @param systemEnvironment fallback for {@code env:*} names missing from the workflow environment
     */
    public TemplateResolver(Clock clock, UnaryOperator<String> systemEnvironment) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.systemEnvironment = Objects.requireNonNull(systemEnvironment, "System environment cannot be null");
    }

    public String resolve(String template, ExecutionContext context) {
        return resolve(template, context, null);
    }

    /**
     * Replaces every token in the template, left to right.
     *
     * @param template the template; {@code null} resolves to an empty string
     * @param context the invocation scopes
     * @param response the response in scope, or {@code null} outside endpoint output binding
     * @return the resolved string
     * @throws TemplateResolutionException if any token cannot be resolved
     */
    public String resolve(String template, ExecutionContext context, ResponseContext response) {
        if (template == null || template.isEmpty()) {
            return "";
        }

        Matcher matcher = TOKEN_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String value = resolveToken(matcher.group(1), context, response);
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Resolves every value of a binding map, keeping key order.
     */
    public Map<String, String> resolveAll(Map<String, String> templates, ExecutionContext context,
                                          ResponseContext response) {
        Map<String, String> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : templates.entrySet()) {
            resolved.put(entry.getKey(), resolve(entry.getValue(), context, response));
        }
        return resolved;
    }

    /**
     * Resolves a single token (the text between the braces).
     */
    public String resolveToken(String token, ExecutionContext context, ResponseContext response) {
        Objects.requireNonNull(context, "Execution context cannot be null");
        Optional<String> value = resolveOptional(token, context, response);
        if (value.isPresent()) {
            return value.get();
        }
        String[] segments = splitToken(token);
        if (segments.length > 0 && segments[0].equalsIgnoreCase("context")) {
            return "";
        }
        throw new TemplateResolutionException(token, describeMissing(token, segments));
    }

    /**
     * Resolves a token, reporting absent values as empty instead of failing.
     * Malformed tokens, unknown roots and unavailable scopes still throw.
     */
    public Optional<String> resolveOptional(String token, ExecutionContext context, ResponseContext response) {
        String trimmed = token.trim();
        Matcher projection = JSON_PROJECTION.matcher(trimmed);
        if (projection.matches()) {
            return resolveJsonProjection(trimmed, projection.group(1), projection.group(2), context);
        }

        String[] segments = splitToken(trimmed);
        if (segments.length == 0) {
            throw new TemplateResolutionException(token, "Invalid token '" + token + "'.");
        }

        String root = segments[0].toLowerCase(Locale.ROOT);
        switch (root) {
            case "input":
                return Optional.ofNullable(context.getInputs().get(requireName(segments, token, "Input")));
            case "global":
                return Optional.ofNullable(context.getGlobals().get(requireName(segments, token, "Global")));
            case "context":
                return Optional.ofNullable(context.getContext().get(requireName(segments, token, "Context")));
            case "env": {
                String name = requireName(segments, token, "Env");
                String value = context.getEnvironmentVariables().get(name);
                return value != null ? Optional.of(value) : Optional.ofNullable(systemEnvironment.apply(name));
            }
            case "stage":
            case "stages":
                return resolveStage(segments, context, token);
            case "endpoint":
                return resolveStageOutput(segments, context.getEndpointOutputs(), "endpoint", token);
            case "workflow":
                return resolveStageOutput(segments, context.getWorkflowOutputs(), "workflow", token);
            case "response":
                return resolveResponse(segments, response, token);
            case "system":
                return Optional.of(resolveSystem(segments, token));
            default:
                throw new TemplateResolutionException(token, "Unknown token root '" + segments[0] + "'.");
        }
    }

    /**
     * Splits a token on both {@code :} and {@code .}, trimming and dropping empty segments.
     */
    public static String[] splitToken(String token) {
        return Arrays.stream(token.replace(':', '.').split("\\."))
                .map(String::trim)
                .filter(segment -> !segment.isEmpty())
                .toArray(String[]::new);
    }

    public static List<String> extractTokens(String template) {
        List<String> tokens = new ArrayList<>();
        if (template == null || template.isBlank()) {
            return tokens;
        }
        Matcher matcher = TOKEN_PATTERN.matcher(template);
        while (matcher.find()) {
            tokens.add(matcher.group(1));
        }
        return tokens;
    }

    public static boolean containsTokens(String template) {
        return template != null && TOKEN_PATTERN.matcher(template).find();
    }

    /**
     * For a {@code json(...)} projection token, the stage token inside the parentheses.
     */
    public static Optional<String> jsonProjectionSource(String token) {
        Matcher projection = JSON_PROJECTION.matcher(token.trim());
        if (!projection.matches()) {
            return Optional.empty();
        }
        return Optional.of("stage:" + STAGE_PREFIX.matcher(projection.group(1).trim()).replaceFirst(""));
    }

    private Optional<String> resolveJsonProjection(String token, String inner, String remainder,
                                                   ExecutionContext context) {
        String source = jsonProjectionSource(token).orElseThrow();
        String[] sourceSegments = splitToken(source);
        if (sourceSegments.length < 4) {
            throw new TemplateResolutionException(token,
                    "Invalid stage json token '" + token + "'. Expected 'stage:json(<stage>.output.<key>)'.");
        }

        Optional<String> payload = resolveStage(sourceSegments, context, token);
        if (payload.isEmpty()) {
            return Optional.empty();
        }

        JsonNode root = JsonNodes.parse(payload.get()).orElseThrow(() -> new TemplateResolutionException(token,
                "Stage output '" + inner.trim() + "' is not valid JSON."));

        String path = remainder.startsWith(".") ? remainder.substring(1) : remainder;
        List<String> pathSegments = Arrays.stream(path.split("\\."))
                .map(String::trim)
                .filter(segment -> !segment.isEmpty())
                .toList();
        return JsonNodes.walk(root, pathSegments).map(JsonNodes::asText);
    }

    private Optional<String> resolveStage(String[] segments, ExecutionContext context, String token) {
        if (segments.length >= 3 && segments[2].equalsIgnoreCase("workflow")) {
            if (segments.length < 5) {
                throw invalidStageToken(token);
            }
            String stageName = segments[1];
            String key = segments[4];
            if (segments[3].equalsIgnoreCase("result")) {
                return lookup(context.getWorkflowResults(), stageName, key);
            }
            if (segments[3].equalsIgnoreCase("output")) {
                return lookup(context.getWorkflowOutputs(), stageName, key);
            }
            throw invalidStageToken(token);
        }

        if (segments.length < 4 || !segments[2].equalsIgnoreCase("output")) {
            throw invalidStageToken(token);
        }
        Optional<String> endpointValue = lookup(context.getEndpointOutputs(), segments[1], segments[3]);
        if (endpointValue.isPresent()) {
            return endpointValue;
        }
        return lookup(context.getWorkflowOutputs(), segments[1], segments[3]);
    }

    private static Optional<String> resolveStageOutput(String[] segments, Map<String, Map<String, String>> outputs,
                                                       String kind, String token) {
        if (segments.length < 4 || !segments[2].equalsIgnoreCase("output")) {
            throw new TemplateResolutionException(token,
                    "Invalid " + kind + " token '" + token + "'. Expected '" + kind + ":<name>.output.<key>'.");
        }
        return lookup(outputs, segments[1], segments[3]);
    }

    private static Optional<String> lookup(Map<String, Map<String, String>> scope, String stageName, String key) {
        Map<String, String> values = scope.get(stageName);
        return values == null ? Optional.empty() : Optional.ofNullable(values.get(key));
    }

    private static Optional<String> resolveResponse(String[] segments, ResponseContext response, String token) {
        if (response == null) {
            throw new TemplateResolutionException(token, "Response token '" + token + "' is not available here.");
        }
        if (segments.length < 2) {
            throw new TemplateResolutionException(token, "Response token requires a path.");
        }

        String field = segments[1];
        if (field.equalsIgnoreCase("status")) {
            return Optional.of(String.valueOf(response.getStatusCode()));
        }
        if (field.equalsIgnoreCase("body")) {
            return Optional.of(response.getBody());
        }
        if (field.equalsIgnoreCase("headers")) {
            if (segments.length < 3) {
                throw new TemplateResolutionException(token, "Response headers token requires a header name.");
            }
            return Optional.ofNullable(response.getHeaders().get(segments[2]));
        }

        JsonNode json = response.getJson().orElseThrow(() ->
                new TemplateResolutionException(token, "Response token '" + token + "' requires a JSON body."));
        return JsonNodes.walk(json, Arrays.asList(segments).subList(1, segments.length)).map(JsonNodes::asText);
    }

    private String resolveSystem(String[] segments, String token) {
        if (segments.length < 3) {
            throw invalidSystemToken(token);
        }
        String kind = segments[1].toLowerCase(Locale.ROOT);
        String which = segments[2].toLowerCase(Locale.ROOT);

        if (kind.equals("uuid")) {
            if (which.equals("new")) {
                return UUID.randomUUID().toString();
            }
            throw invalidSystemToken(token);
        }

        ZonedDateTime now;
        if (which.equals("now")) {
            now = ZonedDateTime.now(clock);
        } else if (which.equals("utcnow")) {
            now = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC));
        } else {
            throw invalidSystemToken(token);
        }

        return switch (kind) {
            case "datetime" -> now.toOffsetDateTime().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
            case "date" -> now.toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE);
            case "time" -> now.toLocalTime().format(TIME_FORMAT);
            default -> throw invalidSystemToken(token);
        };
    }

    private static String requireName(String[] segments, String token, String scope) {
        if (segments.length < 2) {
            throw new TemplateResolutionException(token, scope + " token requires a name.");
        }
        return segments[1];
    }

    private static String describeMissing(String token, String[] segments) {
        String root = segments.length > 0 ? segments[0].toLowerCase(Locale.ROOT) : "";
        String name = segments.length > 1 ? segments[1] : "";
        switch (root) {
            case "input":
                return "Input '" + name + "' was not provided.";
            case "global":
                return "Global variable '" + name + "' was not found.";
            case "env":
                return "Environment variable '" + name + "' was not found.";
            case "response":
                return "Response value '" + token.trim() + "' was not found.";
            default:
                return "Token '" + token.trim() + "' did not match any captured stage output.";
        }
    }

    private static TemplateResolutionException invalidStageToken(String token) {
        return new TemplateResolutionException(token,
                "Invalid stage token '" + token + "'. Expected 'stage:<name>.output.<key>' or " +
                "'stage:<name>.workflow.<output|result>.<key>'.");
    }

    private static TemplateResolutionException invalidSystemToken(String token) {
        return new TemplateResolutionException(token,
                "Invalid token '" + token + "'. Expected 'system:<datetime|date|time>.<now|utcnow>' or 'system:uuid.new'.");
    }
}
