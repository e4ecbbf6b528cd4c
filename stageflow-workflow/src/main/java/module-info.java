module dev.mars.stageflow.workflow {
    requires java.logging;
    requires transitive dev.mars.stageflow.core;

    // Third-party libraries used in main sources
    requires org.yaml.snakeyaml;
    requires com.fasterxml.jackson.core;
    requires com.fasterxml.jackson.databind;
    requires io.opentelemetry.api;

    exports dev.mars.stageflow.workflow.definition;
    exports dev.mars.stageflow.workflow.execution;
    exports dev.mars.stageflow.workflow.loader;
    exports dev.mars.stageflow.workflow.observability;
    exports dev.mars.stageflow.workflow.output;
    exports dev.mars.stageflow.workflow.plugin;
    exports dev.mars.stageflow.workflow.plugin.http;
    exports dev.mars.stageflow.workflow.plugin.workflow;
    exports dev.mars.stageflow.workflow.resilience;
    exports dev.mars.stageflow.workflow.template;
    exports dev.mars.stageflow.workflow.validation;
}
