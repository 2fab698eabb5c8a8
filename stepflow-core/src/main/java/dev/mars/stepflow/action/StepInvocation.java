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


package dev.mars.stepflow.action;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything an action receives for one attempt of one step.
 * The parameter and context maps are read-only snapshots.
 */
public final class StepInvocation {

    private final String workflowId;
    private final String stepId;
    private final int attempt;
    private final Map<String, Object> parameters;
    private final Map<String, Object> context;

    public StepInvocation(String workflowId, String stepId, int attempt,
                          Map<String, Object> parameters, Map<String, Object> context) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.stepId = Objects.requireNonNull(stepId, "Step ID cannot be null");
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt cannot be negative: " + attempt);
        }
        this.attempt = attempt;
        this.parameters = readOnlyCopy(parameters);
        this.context = readOnlyCopy(context);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getStepId() {
        return stepId;
    }

    /**
     * Zero-based attempt number; 0 is the first attempt.
     */
    public int getAttempt() {
        return attempt;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public Optional<Object> getContextValue(String key) {
        return Optional.ofNullable(context.get(key));
    }

    /**
     * Output of an upstream step, looked up by its step id.
     */
    public <T> T getOutput(String stepId, Class<T> type) {
        Object value = context.get(stepId);
        return value == null ? null : type.cast(value);
    }

    // Null values allowed, so no Map.copyOf
    private static Map<String, Object> readOnlyCopy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new HashMap<>(source));
    }

    @Override
    public String toString() {
        return "StepInvocation{" +
               "workflowId='" + workflowId + '\'' +
               ", stepId='" + stepId + '\'' +
               ", attempt=" + attempt +
               '}';
    }
}
