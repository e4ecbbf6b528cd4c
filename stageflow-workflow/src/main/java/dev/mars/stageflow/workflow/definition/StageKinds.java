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

package dev.mars.stageflow.workflow.definition;

/**
 * Stage kind identifiers handled by the built-in plugins. Kinds are compared case-insensitively.
 */
public final class StageKinds {

    public static final String ENDPOINT = "Endpoint";
    public static final String HTTP = "Http";
    public static final String WORKFLOW = "Workflow";

    private StageKinds() {
    }

    public static boolean isWorkflow(String kind) {
        return WORKFLOW.equalsIgnoreCase(kind);
    }
}
