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

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.stageflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.stageflow.workflow.template.JsonNodes;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Loads the raw JSON payloads of endpoint mocks, inline or from a file next to the workflow.
 */
public class MockPayloadService {

    private static final Pattern QUOTED_TOKEN = Pattern.compile("\"\\s*\\{\\{.+?\\}\\}\\s*\"");
    private static final Pattern BARE_TOKEN = Pattern.compile("\\{\\{.+?\\}\\}");

    public String loadRawPayload(String payload) throws WorkflowConfigurationException {
        if (payload == null || payload.isBlank()) {
            throw new WorkflowConfigurationException("Mock payload is required.");
        }
        return payload;
    }

    /**
     * @param payloadFile absolute, or relative to {@code workflowDirectory}
     */
    public String loadRawPayloadFromFile(String payloadFile, Path workflowDirectory)
            throws WorkflowConfigurationException {
        if (payloadFile == null || payloadFile.isBlank()) {
            throw new WorkflowConfigurationException("Mock payload file is required.");
        }

        Path path = resolvePayloadPath(payloadFile, workflowDirectory);
        if (!Files.isRegularFile(path)) {
            throw new WorkflowConfigurationException("Mock payload file was not found: " + path);
        }

        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WorkflowConfigurationException("Failed to read mock payload file " + path + ": " + e.getMessage(), e);
        }
    }

    public Path resolvePayloadPath(String payloadFile, Path workflowDirectory) {
        Path path = Path.of(payloadFile);
        if (path.isAbsolute() || workflowDirectory == null) {
            return path.normalize();
        }
        return workflowDirectory.resolve(path).toAbsolutePath().normalize();
    }

    /**
     * Replaces template tokens with JSON-safe placeholders so an unresolved payload can be syntax-checked.
     */
    public static String sanitizeJsonForValidation(String json) {
        String sanitized = QUOTED_TOKEN.matcher(json).replaceAll("\"__token__\"");
        return BARE_TOKEN.matcher(sanitized).replaceAll("0");
    }

    /**
     * @return the parser's error message, or empty if the text is valid JSON
     */
    public static Optional<String> findJsonError(String json) {
        try {
            JsonNodes.mapper().readTree(json == null ? "" : json);
            return json == null || json.isBlank() ? Optional.of("No content.") : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.of(e.getOriginalMessage());
        }
    }
}
