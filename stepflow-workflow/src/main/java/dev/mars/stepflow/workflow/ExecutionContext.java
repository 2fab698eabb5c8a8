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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared key-value store for one workflow execution.
 * <p>
 * Seeded from the caller's initial variables; each successful step's output is added under
 * the step id. Only the coordinator writes to it. Steps see the snapshot taken when they were
 * dispatched. Null values are permitted.
 */
public class ExecutionContext {

    private final String workflowId;
    private final Map<String, Object> variables;

    public ExecutionContext(String workflowId, Map<String, ?> initialVariables) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.variables = new HashMap<>();
        if (initialVariables != null) {
            this.variables.putAll(initialVariables);
        }
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public synchronized Optional<Object> get(String key) {
        return Optional.ofNullable(variables.get(key));
    }

    public synchronized boolean contains(String key) {
        return variables.containsKey(key);
    }

    public synchronized int size() {
        return variables.size();
    }

    /**
     * Read-only copy of the current contents.
     */
    public synchronized Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new HashMap<>(variables));
    }

    /**
     * Records a step output under the step id, replacing any seeded value with the same key.
     */
    synchronized void mergeOutput(String stepId, Object output) {
        variables.put(Objects.requireNonNull(stepId, "Step ID cannot be null"), output);
    }

    @Override
    public String toString() {
        return "ExecutionContext{" +
               "workflowId='" + workflowId + '\'' +
               ", keys=" + snapshot().keySet() +
               '}';
    }
}
