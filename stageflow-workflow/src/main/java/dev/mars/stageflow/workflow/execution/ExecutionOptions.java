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


package dev.mars.stageflow.workflow.execution;

import dev.mars.stageflow.workflow.definition.ApiCatalogVersion;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-run settings shared by a root workflow and every workflow it nests.
 */
public final class ExecutionOptions {

    public enum ExecutionMode {
        /** Stages call their endpoints and run their child workflows. */
        NORMAL,
        /** Stages with a {@code mock} use it instead of calling out. */
        MOCKED
    }

    private final String environment;
    private final ApiCatalogVersion catalogVersion;
    private final ExecutionMode mode;
    private final boolean debug;
    private final boolean varsOverrideActive;

    private ExecutionOptions(Builder builder) {
        this.environment = Objects.requireNonNull(builder.environment, "Environment cannot be null");
        this.catalogVersion = builder.catalogVersion;
        this.mode = Objects.requireNonNull(builder.mode, "Execution mode cannot be null");
        this.debug = builder.debug;
        this.varsOverrideActive = builder.varsOverrideActive;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getEnvironment() {
        return environment;
    }

    public Optional<ApiCatalogVersion> getCatalogVersion() {
        return Optional.ofNullable(catalogVersion);
    }

    public ExecutionMode getMode() {
        return mode;
    }

    public boolean isMocked() {
        return mode == ExecutionMode.MOCKED;
    }

    public boolean isDebug() {
        return debug;
    }

    /**
     * Whether the caller supplied inputs that suppress child workflows' {@code .wfvars} files.
     */
    public boolean isVarsOverrideActive() {
        return varsOverrideActive;
    }

    @Override
    public String toString() {
        return "ExecutionOptions{" +
               "environment='" + environment + '\'' +
               ", catalogVersion=" + (catalogVersion != null ? catalogVersion.getVersion() : null) +
               ", mode=" + mode +
               ", debug=" + debug +
               ", varsOverrideActive=" + varsOverrideActive +
               '}';
    }

    public static class Builder {
        private String environment = "local";
        private ApiCatalogVersion catalogVersion;
        private ExecutionMode mode = ExecutionMode.NORMAL;
        private boolean debug;
        private boolean varsOverrideActive;

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder catalogVersion(ApiCatalogVersion catalogVersion) {
            this.catalogVersion = catalogVersion;
            return this;
        }

        public Builder mode(ExecutionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder mocked(boolean mocked) {
            this.mode = mocked ? ExecutionMode.MOCKED : ExecutionMode.NORMAL;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder varsOverrideActive(boolean varsOverrideActive) {
            this.varsOverrideActive = varsOverrideActive;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(this);
        }
    }
}
