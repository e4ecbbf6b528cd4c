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


package dev.mars.stageflow.workflow.plugin;

import dev.mars.stageflow.http.EndpointInvoker;
import dev.mars.stageflow.http.HttpEndpointInvoker;
import dev.mars.stageflow.workflow.execution.StageMessageEmitter;
import dev.mars.stageflow.workflow.loader.VarsFileLoader;
import dev.mars.stageflow.workflow.loader.WorkflowLoader;
import dev.mars.stageflow.workflow.loader.YamlWorkflowLoader;
import dev.mars.stageflow.workflow.observability.WorkflowMetrics;
import dev.mars.stageflow.workflow.plugin.http.MockPayloadService;
import dev.mars.stageflow.workflow.resilience.RetryExecutor;
import dev.mars.stageflow.workflow.template.TemplateResolver;

import java.util.Optional;

/**
 * Collaborators shared by the built-in plugins. Unset collaborators fall back to the production defaults.
 */
public class StageServices {

    private final TemplateResolver templateResolver;
    private final StageMessageEmitter messageEmitter;
    private final EndpointInvoker endpointInvoker;
    private final MockPayloadService mockPayloadService;
    private final WorkflowLoader workflowLoader;
    private final VarsFileLoader varsFileLoader;
    private final RetryExecutor retryExecutor;
    private final WorkflowMetrics metrics;

    private StageServices(Builder builder) {
        this.templateResolver = builder.templateResolver != null ? builder.templateResolver : new TemplateResolver();
        this.messageEmitter = new StageMessageEmitter(templateResolver);
        this.endpointInvoker = builder.endpointInvoker != null ? builder.endpointInvoker : new HttpEndpointInvoker();
        this.mockPayloadService = builder.mockPayloadService != null ? builder.mockPayloadService : new MockPayloadService();
        this.workflowLoader = builder.workflowLoader != null ? builder.workflowLoader : new YamlWorkflowLoader();
        this.varsFileLoader = builder.varsFileLoader != null ? builder.varsFileLoader : new VarsFileLoader();
        this.retryExecutor = builder.retryExecutor != null ? builder.retryExecutor : new RetryExecutor();
        this.metrics = builder.metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    public TemplateResolver getTemplateResolver() {
        return templateResolver;
    }

    public StageMessageEmitter getMessageEmitter() {
        return messageEmitter;
    }

    public EndpointInvoker getEndpointInvoker() {
        return endpointInvoker;
    }

    public MockPayloadService getMockPayloadService() {
        return mockPayloadService;
    }

    public WorkflowLoader getWorkflowLoader() {
        return workflowLoader;
    }

    public VarsFileLoader getVarsFileLoader() {
        return varsFileLoader;
    }

    public RetryExecutor getRetryExecutor() {
        return retryExecutor;
    }

    /**
     * Metrics sink, absent when metrics are disabled.
     */
    public Optional<WorkflowMetrics> getMetrics() {
        return Optional.ofNullable(metrics);
    }

    public static class Builder {
        private TemplateResolver templateResolver;
        private EndpointInvoker endpointInvoker;
        private MockPayloadService mockPayloadService;
        private WorkflowLoader workflowLoader;
        private VarsFileLoader varsFileLoader;
        private RetryExecutor retryExecutor;
        private WorkflowMetrics metrics;

        public Builder templateResolver(TemplateResolver templateResolver) {
            this.templateResolver = templateResolver;
            return this;
        }

        public Builder endpointInvoker(EndpointInvoker endpointInvoker) {
            this.endpointInvoker = endpointInvoker;
            return this;
        }

        public Builder mockPayloadService(MockPayloadService mockPayloadService) {
            this.mockPayloadService = mockPayloadService;
            return this;
        }

        public Builder workflowLoader(WorkflowLoader workflowLoader) {
            this.workflowLoader = workflowLoader;
            return this;
        }

        public Builder varsFileLoader(VarsFileLoader varsFileLoader) {
            this.varsFileLoader = varsFileLoader;
            return this;
        }

        public Builder retryExecutor(RetryExecutor retryExecutor) {
            this.retryExecutor = retryExecutor;
            return this;
        }

        public Builder metrics(WorkflowMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public StageServices build() {
            return new StageServices(this);
        }
    }
}
