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

import dev.mars.stageflow.core.exceptions.TransportException;

/**
 * Transport boundary used by endpoint stages.
 * Any HTTP status is a normal return; only network-level problems raise.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface EndpointInvoker {

    /**
     * Sends the request and waits for the complete response.
     *
     * @param request the resolved request
     * @return the response, whatever its status
     * @throws TransportException on connection failure, timeout or unreadable response
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    EndpointResponse invoke(EndpointRequest request) throws TransportException, InterruptedException;
}
