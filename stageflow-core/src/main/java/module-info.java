module dev.mars.stageflow.core {
    requires java.logging;
    requires java.net.http;
    requires jdk.httpserver;  // For transport tests using an embedded HTTP server

    exports dev.mars.stageflow.config;
    exports dev.mars.stageflow.core.exceptions;
    exports dev.mars.stageflow.http;
}
