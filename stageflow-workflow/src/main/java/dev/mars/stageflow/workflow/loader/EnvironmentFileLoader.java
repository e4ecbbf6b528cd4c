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

import dev.mars.stageflow.core.exceptions.WorkflowConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Reads {@code KEY=VALUE} environment files. Blank lines and {@code #} comments are ignored,
 * an {@code export } prefix is accepted and surrounding quotes are stripped from values.
 * Keys are case-insensitive; a later entry replaces an earlier one.
 */
public class EnvironmentFileLoader {

    private static final Logger logger = Logger.getLogger(EnvironmentFileLoader.class.getName());

    private static final String EXPORT_PREFIX = "export ";

    public Map<String, String> load(Path envFile) throws WorkflowConfigurationException {
        if (envFile == null) {
            throw new WorkflowConfigurationException("Environment file path is required.");
        }
        if (!Files.isRegularFile(envFile)) {
            throw new WorkflowConfigurationException("Environment file was not found: " + envFile);
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(envFile);
        } catch (IOException e) {
            throw new WorkflowConfigurationException("Failed to read environment file: " + envFile, e);
        }

        Map<String, String> values = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.regionMatches(true, 0, EXPORT_PREFIX, 0, EXPORT_PREFIX.length())) {
                line = line.substring(EXPORT_PREFIX.length()).trim();
            }

            int separator = line.indexOf('=');
            String key = separator > 0 ? line.substring(0, separator).trim() : "";
            if (key.isEmpty()) {
                throw new WorkflowConfigurationException(String.format("Invalid env file entry at line %d.", i + 1));
            }
            values.put(key, unquote(line.substring(separator + 1).trim()));
        }

        logger.fine("Loaded " + values.size() + " environment variables from " + envFile);
        return Collections.unmodifiableMap(values);
    }

    static String unquote(String value) {
        if (value.length() < 2) {
            return value;
        }
        char first = value.charAt(0);
        char last = value.charAt(value.length() - 1);
        if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
