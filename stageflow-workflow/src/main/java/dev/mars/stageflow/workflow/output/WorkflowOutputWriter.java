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


package dev.mars.stageflow.workflow.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.stageflow.workflow.definition.WorkflowDefinition;
import dev.mars.stageflow.workflow.definition.WorkflowDocument;
import dev.mars.stageflow.workflow.template.JsonNodes;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Writes a workflow's end-stage outputs as pretty-printed JSON to
 * {@code <workflowDir>/<outputDirectory>/<name>.<id>.<unique>.workflow.output}.
 * <p>
 * With {@code outputJson} enabled, values that parse as a JSON object or array are embedded as JSON
 * rather than as strings.
 */
public class WorkflowOutputWriter {

    private static final Logger logger = Logger.getLogger(WorkflowOutputWriter.class.getName());

    public static final String DEFAULT_OUTPUT_DIRECTORY = "output";
    public static final String FILE_SUFFIX = ".workflow.output";

    private static final DateTimeFormatter UNIQUE_PREFIX = DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS")
            .withZone(ZoneOffset.UTC);

    private final String outputDirectory;
    private final Clock clock;

    public WorkflowOutputWriter() {
        this(DEFAULT_OUTPUT_DIRECTORY, Clock.systemUTC());
    }

    public WorkflowOutputWriter(String outputDirectory, Clock clock) {
        this.outputDirectory = outputDirectory == null || outputDirectory.isBlank()
                ? DEFAULT_OUTPUT_DIRECTORY : outputDirectory;
        this.clock = clock;
    }

    /**
     * Writes the outputs when the workflow has {@code output: true}.
     *
     * @return the written file, or empty when the workflow does not produce an output file
     */
    public Optional<Path> write(WorkflowDocument document, Map<String, String> outputs) throws IOException {
        WorkflowDefinition definition = document.getDefinition();
        if (!definition.isOutput()) {
            return Optional.empty();
        }

        Path directory = document.getDirectory().resolve(outputDirectory);
        Files.createDirectories(directory);

        String safeName = definition.getName().replace(' ', '-');
        String unique = UNIQUE_PREFIX.format(clock.instant()) + "-" + UUID.randomUUID().toString().substring(0, 8);
        Path file = directory.resolve(safeName + "." + definition.getId() + "." + unique + FILE_SUFFIX);

        boolean outputJson = definition.getEndStage().map(WorkflowDefinition.EndStage::isOutputJson).orElse(true);
        String json = JsonNodes.mapper().writerWithDefaultPrettyPrinter()
                .writeValueAsString(buildPayload(outputs, outputJson));
        Files.writeString(file, json);

        logger.fine("Workflow output for '" + definition.getName() + "' written to " + file);
        return Optional.of(file);
    }

    static ObjectNode buildPayload(Map<String, String> outputs, boolean outputJson) {
        ObjectNode payload = JsonNodes.mapper().createObjectNode();
        for (Map.Entry<String, String> entry : outputs.entrySet()) {
            Optional<JsonNode> parsed = outputJson ? parseJsonValue(entry.getValue()) : Optional.empty();
            if (parsed.isPresent()) {
                payload.set(entry.getKey(), parsed.get());
            } else {
                payload.put(entry.getKey(), entry.getValue());
            }
        }
        return payload;
    }

    private static Optional<JsonNode> parseJsonValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return Optional.empty();
        }
        return JsonNodes.parse(trimmed);
    }
}
