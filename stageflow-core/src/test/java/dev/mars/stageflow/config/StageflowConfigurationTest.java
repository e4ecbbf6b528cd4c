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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StageflowConfiguration defaults, overrides and type conversion.
 */
class StageflowConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(StageflowConfiguration.ENVIRONMENT);
        System.clearProperty(StageflowConfiguration.HTTP_REQUEST_TIMEOUT_MS);
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testDefaultPlugins() {
        StageflowConfiguration config = new StageflowConfiguration(new Properties());
        assertEquals(List.of("http", "workflow"), config.getPlugins());
    }

    @Test
    void testDefaultHttpSettings() {
        StageflowConfiguration config = new StageflowConfiguration(new Properties());
        assertEquals(10000, config.getHttpConnectTimeoutMs());
        assertEquals(30000, config.getHttpRequestTimeoutMs());
        assertEquals("Stageflow/1.0", config.getHttpUserAgent());
    }

    @Test
    void testDefaultExecutionSettings() {
        StageflowConfiguration config = new StageflowConfiguration(new Properties());
        assertEquals("local", config.getEnvironment());
        assertEquals("output", config.getOutputDirectory());
        assertTrue(config.isMetricsEnabled());
    }

    // ========== Override Tests ==========

    @Test
    void testExplicitPropertiesOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty(StageflowConfiguration.PLUGINS, " workflow , http, custom ");
        properties.setProperty(StageflowConfiguration.ENVIRONMENT, "staging");
        properties.setProperty(StageflowConfiguration.METRICS_ENABLED, "false");

        StageflowConfiguration config = new StageflowConfiguration(properties);

        assertEquals(List.of("workflow", "http", "custom"), config.getPlugins());
        assertEquals("staging", config.getEnvironment());
        assertFalse(config.isMetricsEnabled());
    }

    @Test
    void testBlankPluginEntriesAreKept() {
        Properties properties = new Properties();
        properties.setProperty(StageflowConfiguration.PLUGINS, "http,,workflow");

        StageflowConfiguration config = new StageflowConfiguration(properties);

        assertEquals(List.of("http", "", "workflow"), config.getPlugins());
    }

    @Test
    void testEmptyPluginListYieldsNoPlugins() {
        Properties properties = new Properties();
        properties.setProperty(StageflowConfiguration.PLUGINS, "  ");

        assertTrue(new StageflowConfiguration(properties).getPlugins().isEmpty());
    }

    @Test
    void testSystemPropertyOverride() {
        System.setProperty(StageflowConfiguration.ENVIRONMENT, "system-env");
        System.setProperty(StageflowConfiguration.HTTP_REQUEST_TIMEOUT_MS, "1234");

        StageflowConfiguration config = new StageflowConfiguration();

        assertEquals("system-env", config.getEnvironment());
        assertEquals(1234, config.getHttpRequestTimeoutMs());
    }

    // ========== Type Conversion Tests ==========

    @Test
    void testInvalidIntegerFallsBackToDefault() {
        Properties properties = new Properties();
        properties.setProperty(StageflowConfiguration.HTTP_CONNECT_TIMEOUT_MS, "not-a-number");

        assertEquals(10000, new StageflowConfiguration(properties).getHttpConnectTimeoutMs());
    }

    @Test
    void testGenericPropertyAccess() {
        StageflowConfiguration config = new StageflowConfiguration(new Properties());
        assertNull(config.getProperty("stageflow.unknown"));
        assertEquals("fallback", config.getProperty("stageflow.unknown", "fallback"));

        config.setProperty("stageflow.unknown", "value");
        assertEquals("value", config.getProperty("stageflow.unknown"));
    }
}
