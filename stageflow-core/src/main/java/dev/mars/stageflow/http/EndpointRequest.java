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

package dev.mars.stageflow.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A fully resolved HTTP request: every template has already been substituted.
 */
public class EndpointRequest {

    private final String method;
    private final String url;
    private final Map<String, String> headers;
    private final String body;
    private final String contentType;

    private EndpointRequest(Builder builder) {
        this.method = Objects.requireNonNull(builder.method, "Method cannot be null").toUpperCase();
        this.url = Objects.requireNonNull(builder.url, "URL cannot be null");
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
        this.contentType = builder.contentType;
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    /**
     * Request headers other than {@code Content-Type}, in declaration order.
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    public Optional<String> getBody() {
        return Optional.ofNullable(body);
    }

    public Optional<String> getContentType() {
        return Optional.ofNullable(contentType);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "EndpointRequest{" +
               "method='" + method + '\'' +
               ", url='" + url + '\'' +
               ", headers=" + headers.keySet() +
               ", hasBody=" + (body != null) +
               '}';
    }

    public static class Builder {
        private String method;
        private String url;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String body;
        private String contentType;

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public EndpointRequest build() {
            return new EndpointRequest(this);
        }
    }
}
