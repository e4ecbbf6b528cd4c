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

package dev.mars.stageflow.core.exceptions;

/**
 * Exception thrown when a template token cannot be resolved: unknown scope,
 * malformed projection, or a missing key with no empty-value fallback.
 */
public class TemplateResolutionException extends RuntimeException {

    private final String token;

    public TemplateResolutionException(String token, String message) {
        super(message);
        this.token = token;
    }

    public TemplateResolutionException(String token, String message, Throwable cause) {
        super(message, cause);
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
