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
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Closed / Open / HalfOpen state machine for one named breaker.
 * <ul>
 *   <li>Closed: consecutive failures are counted; reaching the threshold opens the breaker.</li>
 *   <li>Open: calls are rejected until {@code breakMs} has elapsed; the next call then moves to HalfOpen.</li>
 *   <li>HalfOpen: a failure reopens immediately; {@code closeOnSuccessAttempts} consecutive successes close it.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 */
public class CircuitBreaker {
    private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

    private final String name;
    private final Clock clock;
    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private Instant openUntil;

    public CircuitBreaker(String name, Clock clock) {
        this.name = Objects.requireNonNull(name, "Circuit breaker name cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Returns whether a call may proceed. An open breaker whose break has elapsed moves to HalfOpen.
     */
    public synchronized boolean tryAcquire() {
        if (state != CircuitState.OPEN) {
            return true;
        }
        if (!clock.instant().isBefore(openUntil)) {
            state = CircuitState.HALF_OPEN;
            consecutiveFailures = 0;
            consecutiveSuccesses = 0;
            openUntil = null;
            logger.fine("Circuit breaker '" + name + "' is half-open");
            return true;
        }
        return false;
    }

    /**
     * @return {@code true} if this success closed a half-open breaker
     */
    public synchronized boolean recordSuccess(CircuitBreakerPolicy policy) {
        consecutiveFailures = 0;
        if (state == CircuitState.HALF_OPEN) {
            consecutiveSuccesses++;
            if (consecutiveSuccesses >= policy.getCloseOnSuccessAttempts()) {
                state = CircuitState.CLOSED;
                consecutiveSuccesses = 0;
                logger.fine("Circuit breaker '" + name + "' closed");
                return true;
            }
            return false;
        }
        consecutiveSuccesses = 0;
        return false;
    }

    /**
     * @return {@code true} if this failure opened the breaker
     */
    public synchronized boolean recordFailure(CircuitBreakerPolicy policy) {
        consecutiveSuccesses = 0;
        if (state == CircuitState.HALF_OPEN) {
            open(policy);
            return true;
        }
        consecutiveFailures++;
        if (consecutiveFailures >= policy.getFailureThreshold()) {
            open(policy);
            return true;
        }
        return false;
    }

    public synchronized long remainingBreakMs() {
        if (state != CircuitState.OPEN) {
            return 0;
        }
        return Math.max(0, openUntil.toEpochMilli() - clock.millis());
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public String getName() {
        return name;
    }

    private void open(CircuitBreakerPolicy policy) {
        state = CircuitState.OPEN;
        consecutiveFailures = 0;
        openUntil = clock.instant().plusMillis(policy.getBreakMs());
        logger.fine("Circuit breaker '" + name + "' opened for " + policy.getBreakMs() + " ms");
    }

    @Override
    public synchronized String toString() {
        return "CircuitBreaker{name='" + name + "', state=" + state + ", consecutiveFailures=" + consecutiveFailures + '}';
    }

    public enum CircuitState {
        /** Calls pass through. */
        CLOSED,
        /** Calls are rejected without reaching the transport. */
        OPEN,
        /** Trial calls decide whether to close or reopen. */
        HALF_OPEN
    }
}
