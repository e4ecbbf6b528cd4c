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

import dev.mars.stageflow.core.exceptions.WorkflowConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Assembles a {@link StagePluginRegistry} from a configured list of plugin ids.
 * <p>
 * Required built-ins are registered first. Each configured id is then looked up among the built-ins
 * and, failing that, in the table of external factories supplied by the host application.
 * Every problem is collected and reported together; no registry is produced when any is found.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 */
public class StagePluginRegistryBuilder {

    private static final Logger logger = Logger.getLogger(StagePluginRegistryBuilder.class.getName());

    private final Map<String, StagePlugin> builtInPlugins = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final List<String> requiredPluginIds;
    private final Map<String, Supplier<? extends StagePlugin>> externalFactories =
            new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public StagePluginRegistryBuilder(Map<String, StagePlugin> builtInPlugins, List<String> requiredPluginIds) {
        this(builtInPlugins, requiredPluginIds, Map.of());
    }

    public StagePluginRegistryBuilder(Map<String, StagePlugin> builtInPlugins, List<String> requiredPluginIds,
                                      Map<String, Supplier<? extends StagePlugin>> externalFactories) {
        this.builtInPlugins.putAll(Objects.requireNonNull(builtInPlugins, "Built-in plugins cannot be null"));
        this.requiredPluginIds = List.copyOf(Objects.requireNonNull(requiredPluginIds, "Required plugin ids cannot be null"));
        if (externalFactories != null) {
            this.externalFactories.putAll(externalFactories);
        }
    }

    /**
     * @param configuredIds plugin ids in registration order
     * @return the registry
     * @throws WorkflowConfigurationException listing every registration problem
     */
    public StagePluginRegistry build(List<String> configuredIds) throws WorkflowConfigurationException {
        List<String> errors = new ArrayList<>();
        Registration registration = new Registration(errors);

        for (String requiredId : requiredPluginIds) {
            StagePlugin plugin = builtInPlugins.get(requiredId);
            if (plugin == null) {
                errors.add(String.format("Required plugin '%s' is not available.", requiredId));
                continue;
            }
            registration.register(plugin);
        }

        List<String> ids = configuredIds != null ? configuredIds : Collections.emptyList();
        if (ids.isEmpty()) {
            errors.add("No plugins were configured.");
        }

        for (String rawId : ids) {
            String pluginId = rawId != null ? rawId.trim() : "";
            if (pluginId.isEmpty()) {
                errors.add("Plugin id cannot be empty.");
                continue;
            }

            StagePlugin builtIn = builtInPlugins.get(pluginId);
            if (builtIn != null) {
                if (!registration.isRegistered(pluginId)) {
                    registration.register(builtIn);
                }
                continue;
            }

            if (registration.isRegistered(pluginId)) {
                errors.add(String.format("Plugin '%s' is already registered.", pluginId));
                continue;
            }

            StagePlugin external = createExternal(pluginId, errors);
            if (external != null) {
                registration.register(external);
            }
        }

        long optionalCount = registration.plugins.stream()
                .filter(plugin -> requiredPluginIds.stream().noneMatch(id -> id.equalsIgnoreCase(plugin.getId())))
                .count();
        if (errors.isEmpty() && optionalCount == 0) {
            errors.add("No plugins were loaded besides the built-in workflow plugin.");
        }

        if (!errors.isEmpty()) {
            throw new WorkflowConfigurationException(errors);
        }

        logger.fine("Registered stage plugins: " + registration.ids);
        return new StagePluginRegistry(registration.plugins);
    }

    private StagePlugin createExternal(String pluginId, List<String> errors) {
        Supplier<? extends StagePlugin> factory = externalFactories.get(pluginId);
        if (factory == null) {
            errors.add(String.format("Plugin '%s' was not found.", pluginId));
            return null;
        }

        StagePlugin plugin;
        try {
            plugin = factory.get();
        } catch (RuntimeException e) {
            errors.add(String.format("Plugin '%s' failed to load: %s", pluginId, e.getMessage()));
            return null;
        }

        if (plugin == null || plugin.getId() == null || !plugin.getId().equalsIgnoreCase(pluginId)) {
            errors.add(String.format("Plugin '%s' did not provide a matching plugin id.", pluginId));
            return null;
        }
        return plugin;
    }

    private static final class Registration {
        private final List<String> errors;
        private final List<StagePlugin> plugins = new ArrayList<>();
        private final Set<String> ids = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, String> kindOwners = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        private Registration(List<String> errors) {
            this.errors = errors;
        }

        boolean isRegistered(String pluginId) {
            return ids.contains(pluginId);
        }

        void register(StagePlugin plugin) {
            if (ids.contains(plugin.getId())) {
                errors.add(String.format("Plugin '%s' is already registered.", plugin.getId()));
                return;
            }

            boolean valid = true;
            Set<String> kinds = plugin.getStageKinds() != null ? plugin.getStageKinds() : Set.of();
            for (String kind : kinds) {
                if (kind == null || kind.isBlank()) {
                    errors.add(String.format("Plugin '%s' defines an empty stage kind.", plugin.getId()));
                    valid = false;
                } else if (kindOwners.containsKey(kind)) {
                    errors.add(String.format("Stage kind '%s' is already handled by plugin '%s'.",
                            kind, kindOwners.get(kind)));
                    valid = false;
                }
            }
            if (!valid) {
                return;
            }

            ids.add(plugin.getId());
            for (String kind : kinds) {
                kindOwners.put(kind, plugin.getId());
            }
            plugins.add(plugin);
        }
    }
}
