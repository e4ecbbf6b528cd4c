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


package dev.mars.stageflow.workflow.plugin;

import dev.mars.stageflow.workflow.plugin.http.HttpStagePlugin;
import dev.mars.stageflow.workflow.plugin.workflow.WorkflowStagePlugin;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The plugins shipped with the engine.
 */
public final class BuiltInStagePlugins {

    public static final String WORKFLOW_PLUGIN_ID = "workflow";
    public static final String HTTP_PLUGIN_ID = "http";

    /**
     * Plugins registered whether or not they are configured.
     */
    public static final List<String> REQUIRED_PLUGIN_IDS = List.of(WORKFLOW_PLUGIN_ID);

    private BuiltInStagePlugins() {
    }

    public static Map<String, StagePlugin> createCatalog(StageServices services) {
        Map<String, StagePlugin> catalog = new LinkedHashMap<>();
        catalog.put(WORKFLOW_PLUGIN_ID, new WorkflowStagePlugin(services));
        catalog.put(HTTP_PLUGIN_ID, new HttpStagePlugin(services));
        return catalog;
    }
}
