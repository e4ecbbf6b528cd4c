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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Reads {@code .wfvars} files that supply workflow inputs.
 * <p>
 * The format is a flat list of {@code key: value} lines. A line with an empty value opens a section:
 * {@code global:} for values shared by every environment, any other key for an environment section.
 * Inside an environment section {@code version: X} opens a version subsection and {@code version:}
 * with no value closes it again. Values are layered global, then environment, then environment and version.
 *
 * <pre>
 * global:
 *   tenant: acme
 * dev:
 *   baseUser: dev-user
 *   version: 3.11
 *   baseUser: dev-user-311
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 */
public class VarsFileLoader {

    private static final Logger logger = Logger.getLogger(VarsFileLoader.class.getName());

    public static final String VARS_FILE_EXTENSION = ".wfvars";

    private static final String GLOBAL_SECTION = "global";
    private static final String VERSION_KEY = "version";

    public Map<String, String> load(Path varsFile, String environment, String version)
            throws WorkflowConfigurationException {
        return loadWithDetails(varsFile, environment, version).getValues();
    }

    public VarsFileResolution loadWithDetails(Path varsFile, String environment, String version)
            throws WorkflowConfigurationException {
        if (varsFile == null) {
            throw new WorkflowConfigurationException("Vars file path is required.");
        }
        if (!Files.isRegularFile(varsFile)) {
            throw new WorkflowConfigurationException("Vars file was not found: " + varsFile);
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(varsFile);
        } catch (IOException e) {
            throw new WorkflowConfigurationException("Failed to read vars file: " + varsFile, e);
        }

        VarsFileResolution resolution = parse(lines).resolve(environment, version);
        logger.fine("Resolved " + resolution.getValues().size() + " variables from " + varsFile
                + " for environment " + environment);
        return resolution;
    }

    /**
     * Returns {@code <dir>/<workflow file name without extension>.wfvars} when that file exists.
     */
    public static Optional<Path> resolveAutoVarsFile(Path workflowFile) {
        if (workflowFile == null || workflowFile.getFileName() == null) {
            return Optional.empty();
        }
        String fileName = workflowFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        if (baseName.isBlank()) {
            return Optional.empty();
        }
        Path candidate = workflowFile.resolveSibling(baseName + VARS_FILE_EXTENSION);
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    private static Sections parse(List<String> lines) throws WorkflowConfigurationException {
        Sections sections = new Sections();
        String currentEnvironment = null;
        String currentVersion = null;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            int separator = line.indexOf(':');
            String key = separator > 0 ? line.substring(0, separator).trim() : "";
            if (key.isEmpty()) {
                throw new WorkflowConfigurationException(String.format("Invalid vars file entry at line %d.", i + 1));
            }
            String value = line.substring(separator + 1).trim();
            boolean inEnvironment = currentEnvironment != null && !GLOBAL_SECTION.equalsIgnoreCase(currentEnvironment);

            if (value.isEmpty()) {
                if (inEnvironment && VERSION_KEY.equalsIgnoreCase(key)) {
                    currentVersion = null;
                    continue;
                }
                currentEnvironment = key;
                currentVersion = null;
                if (!GLOBAL_SECTION.equalsIgnoreCase(key)) {
                    sections.environments.add(key);
                }
                continue;
            }

            if (inEnvironment && VERSION_KEY.equalsIgnoreCase(key)) {
                currentVersion = EnvironmentFileLoader.unquote(value);
                continue;
            }

            sections.target(currentEnvironment, currentVersion).put(key, EnvironmentFileLoader.unquote(value));
        }
        return sections;
    }

    private static Map<String, String> caseInsensitiveMap() {
        return new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    }

    private static final class Sections {
        private final Map<String, String> global = caseInsensitiveMap();
        private final Map<String, Map<String, String>> environmentValues = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, Map<String, Map<String, String>>> versionValues =
                new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Set<String> environments = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

        Map<String, String> target(String environment, String version) {
            if (environment == null || GLOBAL_SECTION.equalsIgnoreCase(environment)) {
                return global;
            }
            if (version != null && !version.isBlank()) {
                return versionValues.computeIfAbsent(environment, env -> new TreeMap<>(String.CASE_INSENSITIVE_ORDER))
                        .computeIfAbsent(version, v -> caseInsensitiveMap());
            }
            return environmentValues.computeIfAbsent(environment, env -> caseInsensitiveMap());
        }

        VarsFileResolution resolve(String environment, String version) throws WorkflowConfigurationException {
            Map<String, String> values = caseInsensitiveMap();
            Map<String, VarsFileResolution.Source> sources = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

            global.forEach((key, value) -> {
                values.put(key, value);
                sources.put(key, VarsFileResolution.Source.GLOBAL);
            });

            if (environment == null || environment.isBlank()) {
                return new VarsFileResolution(values, sources);
            }

            boolean hasEnvironment = environments.contains(environment);
            if (!hasEnvironment && !environments.isEmpty() && global.isEmpty()) {
                throw new WorkflowConfigurationException(String.format(
                        "Vars file does not define environment '%s' and has no global variables.", environment));
            }
            if (!hasEnvironment) {
                return new VarsFileResolution(values, sources);
            }

            environmentValues.getOrDefault(environment, Map.of()).forEach((key, value) -> {
                values.put(key, value);
                sources.put(key, VarsFileResolution.Source.forEnvironment(environment));
            });

            if (version != null && !version.isBlank()) {
                versionValues.getOrDefault(environment, Map.of()).getOrDefault(version, Map.of())
                        .forEach((key, value) -> {
                            values.put(key, value);
                            sources.put(key, VarsFileResolution.Source.forVersion(environment, version));
                        });
            }
            return new VarsFileResolution(values, sources);
        }
    }
}
