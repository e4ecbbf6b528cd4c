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

import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Runs an attempt up to {@code 1 + maxRetries} times with a fixed delay. A transport failure is always
 * retried; a result is retried when its status is in the policy's retry set. When the retries run out
 * the last result or failure is returned rather than thrown, so the caller can account for it.
 * <p>
 * Interruption is honoured before every attempt and during every delay.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 */
public class RetryExecutor {

    private final Sleeper sleeper;

    public RetryExecutor() {
        this(Thread::sleep);
    }

    public RetryExecutor(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "Sleeper cannot be null");
    }

    /**
     * @param attempt the side-effecting call
     * @param statusOf extracts the status code from a result
     * @param policy the retry policy, or {@code null} for a single attempt
     * @param listener notified before each retry delay; may be {@code null}
     */
    public <T> RetryOutcome<T> execute(Attempt<T> attempt, ToIntFunction<T> statusOf,
                                       RetryPolicy policy, RetryListener listener) throws InterruptedException {
        Objects.requireNonNull(attempt, "Attempt cannot be null");
        Objects.requireNonNull(statusOf, "Status function cannot be null");
        int maxRetries = policy != null ? policy.getMaxRetries() : 0;
        int retries = 0;

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Retry loop interrupted before attempt " + (retries + 1));
            }

            T result;
            try {
                result = attempt.call();
            } catch (TransportException e) {
                if (retries < maxRetries) {
                    retries++;
                    notifyRetry(listener, retries, maxRetries, policy.getDelayMs(), e.getMessage());
                    sleeper.sleep(policy.getDelayMs());
                    continue;
                }
                return RetryOutcome.failure(e, retries);
            }

            int status = statusOf.applyAsInt(result);
            if (policy != null && policy.isRetryStatus(status) && retries < maxRetries) {
                retries++;
                notifyRetry(listener, retries, maxRetries, policy.getDelayMs(), "status " + status);
                sleeper.sleep(policy.getDelayMs());
                continue;
            }
            return RetryOutcome.success(result, retries);
        }
    }

    private static void notifyRetry(RetryListener listener, int retry, int maxRetries, long delayMs, String reason) {
        if (listener != null) {
            listener.onRetry(retry, maxRetries, delayMs, reason);
        }
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T call() throws TransportException, InterruptedException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    @FunctionalInterface
    public interface RetryListener {
        void onRetry(int retry, int maxRetries, long delayMs, String reason);
    }

    /**
     * Last result or transport failure, with the number of retries made.
     */
    public static final class RetryOutcome<T> {
        private final T result;
        private final TransportException failure;
        private final int retries;

        private RetryOutcome(T result, TransportException failure, int retries) {
            this.result = result;
            this.failure = failure;
            this.retries = retries;
        }

        static <T> RetryOutcome<T> success(T result, int retries) {
            return new RetryOutcome<>(result, null, retries);
        }

        static <T> RetryOutcome<T> failure(TransportException failure, int retries) {
            return new RetryOutcome<>(null, failure, retries);
        }

        public boolean isFailure() {
            return failure != null;
        }

        public T getResult() {
            return result;
        }

        public TransportException getFailure() {
            return failure;
        }

        public int getRetries() {
            return retries;
        }
    }
}
