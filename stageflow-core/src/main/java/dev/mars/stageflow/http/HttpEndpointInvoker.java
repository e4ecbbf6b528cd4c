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

import dev.mars.stageflow.config.StageflowConfiguration;
import dev.mars.stageflow.core.exceptions.TransportException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EndpointInvoker} backed by the JDK {@link HttpClient}.
 * Connect and request timeouts come from {@link StageflowConfiguration}; a timeout surfaces
 * as a {@link TransportException} like any other network failure.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class HttpEndpointInvoker implements EndpointInvoker {
    private static final Logger logger = Logger.getLogger(HttpEndpointInvoker.class.getName());

    // HttpClient rejects these; the client manages them itself
    private static final Set<String> RESTRICTED_HEADERS = caseInsensitiveSet(
            "connection", "content-length", "expect", "host", "upgrade");

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final String userAgent;

    public HttpEndpointInvoker() {
        this(new StageflowConfiguration());
    }

    public HttpEndpointInvoker(StageflowConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(configuration.getHttpConnectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.requestTimeout = Duration.ofMillis(configuration.getHttpRequestTimeoutMs());
        this.userAgent = configuration.getHttpUserAgent();
    }

    public HttpEndpointInvoker(HttpClient httpClient, Duration requestTimeout, String userAgent) {
        this.httpClient = Objects.requireNonNull(httpClient, "HTTP client cannot be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "Request timeout cannot be null");
        this.userAgent = userAgent;
    }

    @Override
    public EndpointResponse invoke(EndpointRequest request) throws TransportException, InterruptedException {
        Objects.requireNonNull(request, "Request cannot be null");
        HttpRequest httpRequest = buildRequest(request);

        logger.fine("Sending " + request.getMethod() + " " + request.getUrl());
        try {
            HttpResponse<String> response = httpClient.send(httpRequest,
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            logger.fine("Received " + response.statusCode() + " from " + request.getUrl());
            return new EndpointResponse(response.statusCode(), response.body(), flattenHeaders(response.headers().map()));
        } catch (IOException e) {
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Transport failure for " + request.getUrl(), e);
            }
            throw new TransportException(request.getMethod(), request.getUrl(), describe(e), e);
        }
    }

    private HttpRequest buildRequest(EndpointRequest request) throws TransportException {
        URI uri;
        try {
            uri = URI.create(request.getUrl());
        } catch (IllegalArgumentException e) {
            throw new TransportException(request.getMethod(), request.getUrl(), "Invalid URL: " + e.getMessage(), e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(requestTimeout);
        if (userAgent != null && !userAgent.isBlank()) {
            builder.header("User-Agent", userAgent);
        }

        for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
            if (RESTRICTED_HEADERS.contains(header.getKey())) {
                logger.warning("Skipping restricted header '" + header.getKey() + "' for " + request.getUrl());
                continue;
            }
            builder.setHeader(header.getKey(), header.getValue());
        }

        request.getContentType().ifPresent(contentType -> builder.setHeader("Content-Type", contentType));

        HttpRequest.BodyPublisher publisher = request.getBody()
                .map(body -> HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .orElseGet(HttpRequest.BodyPublishers::noBody);
        try {
            builder.method(request.getMethod(), publisher);
        } catch (IllegalArgumentException e) {
            throw new TransportException(request.getMethod(), request.getUrl(), "Invalid request: " + e.getMessage(), e);
        }
        return builder.build();
    }

    private static Map<String, String> flattenHeaders(Map<String, List<String>> headers) {
        Map<String, String> flattened = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            flattened.put(entry.getKey(), String.join(",", entry.getValue()));
        }
        return flattened;
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static Set<String> caseInsensitiveSet(String... values) {
        Set<String> set = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        set.addAll(List.of(values));
        return set;
    }
}
