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
 * Exception thrown when an HTTP call cannot be completed: connection errors, timeouts,
 * unreadable responses. Always eligible for retry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class TransportException extends StageflowException {

    private final String method;
    private final String url;

    public TransportException(String method, String url, String message) {
        super(message);
        this.method = method;
        this.url = url;
    }

    public TransportException(String method, String url, String message, Throwable cause) {
        super(message, cause);
        this.method = method;
        this.url = url;
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public String getMessage() {
        return String.format("%s %s failed: %s", method, url, super.getMessage());
    }
}
