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


package dev.mars.stageflow.workflow.execution;

/**
 * Shared formatting of execution log lines: {@code [workflow]#stage}, indented one space per nesting level.
 */
public final class ExecutionLogFormat {

    private ExecutionLogFormat() {
    }

    public static String workflowTag(String workflowName) {
        return "[" + workflowName + "]";
    }

    public static String stageTag(String workflowName, String stageName) {
        return workflowTag(workflowName) + "#" + stageName;
    }

    public static String indent(int indentLevel) {
        return indentLevel <= 0 ? "" : " ".repeat(indentLevel);
    }

    public static String indent(ExecutionContext context) {
        return indent(context.getIndentLevel());
    }
}
