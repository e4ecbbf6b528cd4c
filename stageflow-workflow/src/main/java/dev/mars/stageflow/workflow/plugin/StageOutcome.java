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

import java.util.Optional;

/**
 * Result of executing a stage: an optional jump target plus call metadata.
 */
public final class StageOutcome {

    private static final StageOutcome PROCEED = new StageOutcome(null, null, 0);

    private final String jumpTarget;
    private final Integer statusCode;
    private final int retries;

    private StageOutcome(String jumpTarget, Integer statusCode, int retries) {
        this.jumpTarget = jumpTarget;
        this.statusCode = statusCode;
        this.retries = retries;
    }

    public static StageOutcome proceed() {
        return PROCEED;
    }

    public static StageOutcome completed(int statusCode, int retries) {
        return new StageOutcome(null, statusCode, retries);
    }

    public static StageOutcome jumpTo(String jumpTarget, int statusCode, int retries) {
        return new StageOutcome(jumpTarget, statusCode, retries);
    }

    public Optional<String> getJumpTarget() {
        return Optional.ofNullable(jumpTarget).filter(target -> !target.isBlank());
    }

    public Optional<Integer> getStatusCode() {
        return Optional.ofNullable(statusCode);
    }

    public int getRetries() {
        return retries;
    }

    @Override
    public String toString() {
        return "StageOutcome{" +
               "jumpTarget='" + jumpTarget + '\'' +
               ", statusCode=" + statusCode +
               ", retries=" + retries +
               '}';
    }
}
