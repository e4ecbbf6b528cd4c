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

import dev.mars.stageflow.core.exceptions.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedDeque;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the fixed-delay retry loop.
 */
class RetryExecutorTest {

    private List<Long> sleeps;
    private RetryExecutor retryExecutor;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        retryExecutor = new RetryExecutor(sleeps::add);
    }

    @Test
    void testSucceedsOnThirdAttemptWithTwoRetries() throws Exception {
        Deque<Integer> statuses = new ConcurrentLinkedDeque<>(List.of(503, 503, 200));
        RetryPolicy policy = new RetryPolicy(3, 10, Set.of(503), null);
        List<String> reasons = new ArrayList<>();

        RetryExecutor.RetryOutcome<Integer> outcome = retryExecutor.execute(statuses::pop, Integer::intValue, policy,
                (retry, max, delay, reason) -> reasons.add(retry + "/" + max + " " + reason));

        assertFalse(outcome.isFailure());
        assertEquals(200, outcome.getResult());
        assertEquals(2, outcome.getRetries());
        assertEquals(List.of(10L, 10L), sleeps);
        assertEquals(List.of("1/3 status 503", "2/3 status 503"), reasons);
    }

    @Test
    void testReturnsLastStatusWhenRetriesAreExhausted() throws Exception {
        RetryPolicy policy = new RetryPolicy(2, 5, Set.of(500), null);

        RetryExecutor.RetryOutcome<Integer> outcome =
                retryExecutor.execute(() -> 500, Integer::intValue, policy, null);

        assertFalse(outcome.isFailure());
        assertEquals(500, outcome.getResult());
        assertEquals(2, outcome.getRetries());
        assertEquals(2, sleeps.size());
    }

    @Test
    void testStatusOutsideRetrySetIsNotRetried() throws Exception {
        RetryPolicy policy = new RetryPolicy(3, 5, Set.of(503), null);

        RetryExecutor.RetryOutcome<Integer> outcome =
                retryExecutor.execute(() -> 400, Integer::intValue, policy, null);

        assertEquals(400, outcome.getResult());
        assertEquals(0, outcome.getRetries());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testTransportFailuresAreRetriedThenReported() throws Exception {
        RetryPolicy policy = new RetryPolicy(1, 5, Set.of(503), null);
        int[] calls = {0};

        RetryExecutor.RetryOutcome<Integer> outcome = retryExecutor.execute(() -> {
            calls[0]++;
            throw new TransportException("GET", "http://x", "connection refused");
        }, Integer::intValue, policy, null);

        assertTrue(outcome.isFailure());
        assertEquals(2, calls[0]);
        assertEquals(1, outcome.getRetries());
        assertEquals("GET http://x failed: connection refused", outcome.getFailure().getMessage());
    }

    @Test
    void testWithoutPolicyMakesSingleAttempt() throws Exception {
        RetryExecutor.RetryOutcome<Integer> outcome =
                retryExecutor.execute(() -> 503, Integer::intValue, null, null);

        assertEquals(503, outcome.getResult());
        assertEquals(0, outcome.getRetries());
    }

    @Test
    void testInterruptedDuringDelayStopsRetrying() {
        RetryExecutor interrupting = new RetryExecutor(millis -> {
            throw new InterruptedException("cancelled");
        });
        int[] calls = {0};
        RetryPolicy policy = new RetryPolicy(3, 5, Set.of(503), null);

        assertThrows(InterruptedException.class, () -> interrupting.execute(() -> {
            calls[0]++;
            return 503;
        }, Integer::intValue, policy, null));
        assertEquals(1, calls[0]);
    }

    @Test
    void testInterruptFlagPreventsFurtherAttempts() {
        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedException.class,
                    () -> retryExecutor.execute(() -> 200, Integer::intValue, null, null));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testPolicyRejectsNegativeValues() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, 5, Set.of(), null));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, -5, Set.of(), null));
    }
}
