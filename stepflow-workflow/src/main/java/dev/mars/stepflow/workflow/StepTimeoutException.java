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


package dev.mars.stepflow.workflow;

import dev.mars.stepflow.core.exceptions.StepflowException;

import java.time.Duration;

/**
 * A single attempt exceeded its step's timeout. The step may still be retried.
 */
public class StepTimeoutException extends StepflowException {

    private final String stepId;
    private final Duration timeout;

    public StepTimeoutException(String stepId, Duration timeout) {
        super("Step '" + stepId + "' timed out after " + timeout.toMillis() + "ms");
        this.stepId = stepId;
        this.timeout = timeout;
    }

    public String getStepId() {
        return stepId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
