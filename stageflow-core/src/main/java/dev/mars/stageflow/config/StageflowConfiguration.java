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

package dev.mars.stageflow.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for the Stageflow engine.
 * Values are layered: built-in defaults, then the first readable properties file,
 * then {@code stageflow.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class StageflowConfiguration {
    private static final Logger logger = Logger.getLogger(StageflowConfiguration.class.getName());

    public static final String PLUGINS = "stageflow.plugins";
    public static final String HTTP_CONNECT_TIMEOUT_MS = "stageflow.http.connect.timeout.ms";
    public static final String HTTP_REQUEST_TIMEOUT_MS = "stageflow.http.request.timeout.ms";
    public static final String HTTP_USER_AGENT = "stageflow.http.user.agent";
    public static final String ENVIRONMENT = "stageflow.environment";
    public static final String OUTPUT_DIRECTORY = "stageflow.output.directory";
    public static final String METRICS_ENABLED = "stageflow.metrics.enabled";

    private static final String DEFAULT_PLUGINS = "http,workflow";
    private static final int DEFAULT_CONNECT_TIMEOUT_MS = 10000;
    private static final int DEFAULT_REQUEST_TIMEOUT_MS = 30000;
    private static final String DEFAULT_USER_AGENT = "Stageflow/1.0";
    private static final String DEFAULT_ENVIRONMENT = "local";
    private static final String DEFAULT_OUTPUT_DIRECTORY = "output";

    private final Properties properties;

    public StageflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public StageflowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Plugin configuration

    /**
     * Ordered plugin identifiers the stage plugin registry is assembled from.
     * Blank entries are kept so the registry can report them.
     */
    public List<String> getPlugins() {
        String value = getStringProperty(PLUGINS, DEFAULT_PLUGINS);
        List<String> plugins = new ArrayList<>();
        if (value.trim().isEmpty()) {
            return plugins;
        }
        for (String id : value.split(",")) {
            plugins.add(id.trim());
        }
        return plugins;
    }

    // HTTP transport configuration
    public int getHttpConnectTimeoutMs() {
        return getIntProperty(HTTP_CONNECT_TIMEOUT_MS, DEFAULT_CONNECT_TIMEOUT_MS);
    }

    public int getHttpRequestTimeoutMs() {
        return getIntProperty(HTTP_REQUEST_TIMEOUT_MS, DEFAULT_REQUEST_TIMEOUT_MS);
    }

    public String getHttpUserAgent() {
        return getStringProperty(HTTP_USER_AGENT, DEFAULT_USER_AGENT);
    }

    // Execution configuration
    public String getEnvironment() {
        return getStringProperty(ENVIRONMENT, DEFAULT_ENVIRONMENT);
    }

    public String getOutputDirectory() {
        return getStringProperty(OUTPUT_DIRECTORY, DEFAULT_OUTPUT_DIRECTORY);
    }

    // Monitoring configuration
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(PLUGINS, DEFAULT_PLUGINS);
        properties.setProperty(HTTP_CONNECT_TIMEOUT_MS, String.valueOf(DEFAULT_CONNECT_TIMEOUT_MS));
        properties.setProperty(HTTP_REQUEST_TIMEOUT_MS, String.valueOf(DEFAULT_REQUEST_TIMEOUT_MS));
        properties.setProperty(HTTP_USER_AGENT, DEFAULT_USER_AGENT);
        properties.setProperty(ENVIRONMENT, DEFAULT_ENVIRONMENT);
        properties.setProperty(OUTPUT_DIRECTORY, DEFAULT_OUTPUT_DIRECTORY);
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "stageflow.properties",
                "config/stageflow.properties",
                System.getProperty("user.home") + "/.stageflow/stageflow.properties",
                "/etc/stageflow/stageflow.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("stageflow.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("stageflow."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "StageflowConfiguration{" +
                "plugins=" + getPlugins() +
                ", environment='" + getEnvironment() + '\'' +
                ", requestTimeoutMs=" + getHttpRequestTimeoutMs() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
