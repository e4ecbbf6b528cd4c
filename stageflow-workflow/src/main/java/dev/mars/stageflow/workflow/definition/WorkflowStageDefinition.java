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

package dev.mars.stageflow.workflow.definition;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One stage of a workflow. Which fields apply depends on the stage kind:
 * endpoint stages use the HTTP fields and resilience policies, workflow stages use
 * {@code workflowRef} and {@code inputs}. Template strings are kept unresolved.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public class WorkflowStageDefinition {

    private final String name;
    private final String kind;
    private final String runIf;
    private final String apiRef;
    private final String endpoint;
    private final String httpVerb;
    private final Integer expectedStatus;
    private final Map<String, String> headers;
    private final Map<String, String> query;
    private final String body;
    private final String workflowRef;
    private final Map<String, String> inputs;
    private final Map<String, String> debug;
    private final String message;
    private final Map<String, String> output;
    private final Map<Integer, String> jumpOnStatus;
    private final Integer delaySeconds;
    private final String allowVersion;
    private final Map<String, String> set;
    private final Map<String, String> context;
    private final Mock mock;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;

    private WorkflowStageDefinition(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Stage name cannot be null");
        this.kind = Objects.requireNonNull(builder.kind, "Stage kind cannot be null");
        this.runIf = builder.runIf;
        this.apiRef = builder.apiRef;
        this.endpoint = builder.endpoint;
        this.httpVerb = builder.httpVerb;
        this.expectedStatus = builder.expectedStatus;
        this.headers = OrderedMaps.copyOf(builder.headers);
        this.query = OrderedMaps.copyOf(builder.query);
        this.body = builder.body;
        this.workflowRef = builder.workflowRef;
        this.inputs = OrderedMaps.copyOf(builder.inputs);
        this.debug = OrderedMaps.copyOf(builder.debug);
        this.message = builder.message;
        this.output = OrderedMaps.copyOf(builder.output);
        this.jumpOnStatus = OrderedMaps.copyOf(builder.jumpOnStatus);
        this.delaySeconds = builder.delaySeconds;
        this.allowVersion = builder.allowVersion;
        this.set = OrderedMaps.copyOf(builder.set);
        this.context = OrderedMaps.copyOf(builder.context);
        this.mock = builder.mock;
        this.retry = builder.retry;
        this.circuitBreaker = builder.circuitBreaker;
    }

    public String getName() {
        return name;
    }

    public String getKind() {
        return kind;
    }

    public Optional<String> getRunIf() {
        return Optional.ofNullable(runIf);
    }

    public Optional<String> getApiRef() {
        return Optional.ofNullable(apiRef);
    }

    public Optional<String> getEndpoint() {
        return Optional.ofNullable(endpoint);
    }

    public Optional<String> getHttpVerb() {
        return Optional.ofNullable(httpVerb);
    }

    public Optional<Integer> getExpectedStatus() {
        return Optional.ofNullable(expectedStatus);
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Map<String, String> getQuery() {
        return query;
    }

    public Optional<String> getBody() {
        return Optional.ofNullable(body);
    }

    public Optional<String> getWorkflowRef() {
        return Optional.ofNullable(workflowRef);
    }

    /**
     * Child input name to template expression. Empty when the stage declares no inputs.
     */
    public Map<String, String> getInputs() {
        return inputs;
    }

    public Map<String, String> getDebug() {
        return debug;
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    public Map<String, String> getOutput() {
        return output;
    }

    public Map<Integer, String> getJumpOnStatus() {
        return jumpOnStatus;
    }

    public Optional<Integer> getDelaySeconds() {
        return Optional.ofNullable(delaySeconds);
    }

    public Optional<String> getAllowVersion() {
        return Optional.ofNullable(allowVersion);
    }

    public Map<String, String> getSet() {
        return set;
    }

    public Map<String, String> getContext() {
        return context;
    }

    public Optional<Mock> getMock() {
        return Optional.ofNullable(mock);
    }

    public Optional<Retry> getRetry() {
        return Optional.ofNullable(retry);
    }

    public Optional<CircuitBreaker> getCircuitBreaker() {
        return Optional.ofNullable(circuitBreaker);
    }

    public static Builder builder(String name, String kind) {
        return new Builder(name, kind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowStageDefinition that = (WorkflowStageDefinition) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(kind, that.kind) &&
               Objects.equals(runIf, that.runIf) &&
               Objects.equals(apiRef, that.apiRef) &&
               Objects.equals(endpoint, that.endpoint) &&
               Objects.equals(httpVerb, that.httpVerb) &&
               Objects.equals(workflowRef, that.workflowRef) &&
               Objects.equals(output, that.output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, runIf, apiRef, endpoint, httpVerb, workflowRef, output);
    }

    @Override
    public String toString() {
        return "WorkflowStageDefinition{" +
               "name='" + name + '\'' +
               ", kind='" + kind + '\'' +
               (apiRef != null ? ", apiRef='" + apiRef + '\'' : "") +
               (endpoint != null ? ", endpoint='" + endpoint + '\'' : "") +
               (workflowRef != null ? ", workflowRef='" + workflowRef + '\'' : "") +
               '}';
    }

    /**
     * Synthetic response used when the workflow runs mocked.
     */
    public static class Mock {
        private final Integer status;
        private final String payload;
        private final String payloadFile;
        private final Map<String, String> output;

        public Mock(Integer status, String payload, String payloadFile, Map<String, String> output) {
            this.status = status;
            this.payload = payload;
            this.payloadFile = payloadFile;
            this.output = output != null ? OrderedMaps.copyOf(output) : null;
        }

        public Optional<Integer> getStatus() {
            return Optional.ofNullable(status);
        }

        public Optional<String> getPayload() {
            return Optional.ofNullable(payload);
        }

        public Optional<String> getPayloadFile() {
            return Optional.ofNullable(payloadFile);
        }

        /**
         * Output bindings for workflow stages; absent when the mock declares none.
         */
        public Optional<Map<String, String>> getOutput() {
            return Optional.ofNullable(output);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Mock that = (Mock) o;
            return Objects.equals(status, that.status) &&
                   Objects.equals(payload, that.payload) &&
                   Objects.equals(payloadFile, that.payloadFile) &&
                   Objects.equals(output, that.output);
        }

        @Override
        public int hashCode() {
            return Objects.hash(status, payload, payloadFile, output);
        }
    }

    /**
     * Stage-level retry settings. Inline values override the referenced named policy field by field.
     */
    public static class Retry {
        private final String ref;
        private final Integer maxRetries;
        private final Integer delayMs;
        private final List<Integer> httpStatus;
        private final String onExceptionMessage;

        public Retry(String ref, Integer maxRetries, Integer delayMs, List<Integer> httpStatus, String onExceptionMessage) {
            this.ref = ref;
            this.maxRetries = maxRetries;
            this.delayMs = delayMs;
            this.httpStatus = httpStatus != null ? List.copyOf(httpStatus) : List.of();
            this.onExceptionMessage = onExceptionMessage;
        }

        public Optional<String> getRef() {
            return Optional.ofNullable(ref);
        }

        public Optional<Integer> getMaxRetries() {
            return Optional.ofNullable(maxRetries);
        }

        public Optional<Integer> getDelayMs() {
            return Optional.ofNullable(delayMs);
        }

        /**
         * Statuses that trigger a retry. Transport failures are always retried.
         */
        public List<Integer> getHttpStatus() {
            return httpStatus;
        }

        public Optional<String> getOnExceptionMessage() {
            return Optional.ofNullable(onExceptionMessage);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Retry that = (Retry) o;
            return Objects.equals(ref, that.ref) &&
                   Objects.equals(maxRetries, that.maxRetries) &&
                   Objects.equals(delayMs, that.delayMs) &&
                   Objects.equals(httpStatus, that.httpStatus);
        }

        @Override
        public int hashCode() {
            return Objects.hash(ref, maxRetries, delayMs, httpStatus);
        }
    }

    /**
     * Stage-level circuit breaker settings; only valid together with {@link Retry}.
     */
    public static class CircuitBreaker {
        private final String ref;
        private final Integer failureThreshold;
        private final Integer breakMs;
        private final Integer closeOnSuccessAttempts;
        private final String onOpenMessage;
        private final String onBlockedMessage;

        public CircuitBreaker(String ref, Integer failureThreshold, Integer breakMs, Integer closeOnSuccessAttempts,
                              String onOpenMessage, String onBlockedMessage) {
            this.ref = ref;
            this.failureThreshold = failureThreshold;
            this.breakMs = breakMs;
            this.closeOnSuccessAttempts = closeOnSuccessAttempts;
            this.onOpenMessage = onOpenMessage;
            this.onBlockedMessage = onBlockedMessage;
        }

        public Optional<String> getRef() {
            return Optional.ofNullable(ref);
        }

        public Optional<Integer> getFailureThreshold() {
            return Optional.ofNullable(failureThreshold);
        }

        public Optional<Integer> getBreakMs() {
            return Optional.ofNullable(breakMs);
        }

        public Optional<Integer> getCloseOnSuccessAttempts() {
            return Optional.ofNullable(closeOnSuccessAttempts);
        }

        public Optional<String> getOnOpenMessage() {
            return Optional.ofNullable(onOpenMessage);
        }

        public Optional<String> getOnBlockedMessage() {
            return Optional.ofNullable(onBlockedMessage);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            CircuitBreaker that = (CircuitBreaker) o;
            return Objects.equals(ref, that.ref) &&
                   Objects.equals(failureThreshold, that.failureThreshold) &&
                   Objects.equals(breakMs, that.breakMs) &&
                   Objects.equals(closeOnSuccessAttempts, that.closeOnSuccessAttempts);
        }

        @Override
        public int hashCode() {
            return Objects.hash(ref, failureThreshold, breakMs, closeOnSuccessAttempts);
        }
    }

    public static class Builder {
        private final String name;
        private final String kind;
        private String runIf;
        private String apiRef;
        private String endpoint;
        private String httpVerb;
        private Integer expectedStatus;
        private Map<String, String> headers;
        private Map<String, String> query;
        private String body;
        private String workflowRef;
        private Map<String, String> inputs;
        private Map<String, String> debug;
        private String message;
        private Map<String, String> output;
        private Map<Integer, String> jumpOnStatus;
        private Integer delaySeconds;
        private String allowVersion;
        private Map<String, String> set;
        private Map<String, String> context;
        private Mock mock;
        private Retry retry;
        private CircuitBreaker circuitBreaker;

        private Builder(String name, String kind) {
            this.name = name;
            this.kind = kind;
        }

        public Builder runIf(String runIf) {
            this.runIf = runIf;
            return this;
        }

        public Builder apiRef(String apiRef) {
            this.apiRef = apiRef;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder httpVerb(String httpVerb) {
            this.httpVerb = httpVerb;
            return this;
        }

        public Builder expectedStatus(Integer expectedStatus) {
            this.expectedStatus = expectedStatus;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder query(Map<String, String> query) {
            this.query = query;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder workflowRef(String workflowRef) {
            this.workflowRef = workflowRef;
            return this;
        }

        public Builder inputs(Map<String, String> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder debug(Map<String, String> debug) {
            this.debug = debug;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder output(Map<String, String> output) {
            this.output = output;
            return this;
        }

        public Builder jumpOnStatus(Map<Integer, String> jumpOnStatus) {
            this.jumpOnStatus = jumpOnStatus;
            return this;
        }

        public Builder delaySeconds(Integer delaySeconds) {
            this.delaySeconds = delaySeconds;
            return this;
        }

        public Builder allowVersion(String allowVersion) {
            this.allowVersion = allowVersion;
            return this;
        }

        public Builder set(Map<String, String> set) {
            this.set = set;
            return this;
        }

        public Builder context(Map<String, String> context) {
            this.context = context;
            return this;
        }

        public Builder mock(Mock mock) {
            this.mock = mock;
            return this;
        }

        public Builder retry(Retry retry) {
            this.retry = retry;
            return this;
        }

        public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        public WorkflowStageDefinition build() {
            return new WorkflowStageDefinition(this);
        }
    }
}
