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

package dev.mars.stageflow.workflow.template;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.stageflow.http.EndpointResponse;

import java.util.Map;
import java.util.Optional;

/**
 * The response visible to {@code response.*} tokens while an endpoint stage binds its output and message.
 */
public class ResponseContext {

    private final int statusCode;
    private final String body;
    private final Map<String, String> headers;
    private final JsonNode json;

    public ResponseContext(EndpointResponse response) {
        this.statusCode = response.getStatusCode();
        this.body = response.getBody();
        this.headers = response.getHeaders();
        this.json = JsonNodes.parse(body).orElse(null);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Optional<JsonNode> getJson() {
        return Optional.ofNullable(json);
    }
}
