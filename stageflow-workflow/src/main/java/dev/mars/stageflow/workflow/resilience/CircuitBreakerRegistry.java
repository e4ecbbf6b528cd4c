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

package dev.mars.stageflow.workflow.resilience;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Breakers of one workflow invocation, keyed case-insensitively by name.
 */
public class CircuitBreakerRegistry {

    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public CircuitBreakerRegistry() {
        this(Clock.systemUTC());
    }

    public CircuitBreakerRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public synchronized CircuitBreaker getOrCreate(String name) {
        return breakers.computeIfAbsent(name, key -> new CircuitBreaker(key, clock));
    }

    public synchronized int size() {
        return breakers.size();
    }
}
