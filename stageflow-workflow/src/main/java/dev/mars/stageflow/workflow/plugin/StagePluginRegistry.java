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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable mapping from plugin ids and stage kinds to plugins. Instances are produced by
 * {@link StagePluginRegistryBuilder}, which guarantees ids and kinds are unique.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 */
public class StagePluginRegistry {

    private final List<StagePlugin> plugins;
    private final Map<String, StagePlugin> pluginsById = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final Map<String, StagePlugin> pluginsByKind = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    StagePluginRegistry(List<StagePlugin> plugins) {
        this.plugins = Collections.unmodifiableList(new ArrayList<>(plugins));
        for (StagePlugin plugin : plugins) {
            pluginsById.put(plugin.getId(), plugin);
            for (String kind : plugin.getStageKinds()) {
                pluginsByKind.put(kind, plugin);
            }
        }
    }

    public Optional<StagePlugin> findById(String pluginId) {
        return pluginId == null ? Optional.empty() : Optional.ofNullable(pluginsById.get(pluginId));
    }

    public Optional<StagePlugin> findByKind(String stageKind) {
        return stageKind == null ? Optional.empty() : Optional.ofNullable(pluginsByKind.get(stageKind));
    }

    public List<StagePlugin> getPlugins() {
        return plugins;
    }

    public Set<String> getStageKinds() {
        return Collections.unmodifiableSet(pluginsByKind.keySet());
    }

    @Override
    public String toString() {
        return "StagePluginRegistry{plugins=" + pluginsById.keySet() + ", kinds=" + pluginsByKind.keySet() + '}';
    }
}
