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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Accumulates step results for one workflow execution and decides its terminal state.
 * <p>
 * Mutated only by the coordinator thread. Every change publishes a new immutable
 * {@link WorkflowResult} that any thread may read through {@link #snapshot()}. Once a
 * terminal state is set, further changes are ignored.
 */
public class ResultAggregator {
    private static final Logger logger = LoggerFactory.getLogger(ResultAggregator.class);

    private final String workflowId;
    private final String workflowName;
    private final Map<String, String> metadata;
    private final Instant submittedAt;

    private final Map<String, StepResult> stepResults = new LinkedHashMap<>();
    private final Set<String> skippedSteps = new LinkedHashSet<>();
    private volatile WorkflowState state = WorkflowState.PENDING;
    private String errorMessage;
    private Instant startedAt;
    private Instant endedAt;

    private volatile WorkflowResult snapshot;

    public ResultAggregator(String workflowId, WorkflowDefinition definition, Instant submittedAt) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        this.workflowName = definition.getName();
        this.submittedAt = Objects.requireNonNull(submittedAt, "Submission time cannot be null");

        Map<String, String> meta = new LinkedHashMap<>(definition.getMetadata());
        meta.put("workflow.version", definition.getVersion());
        definition.getDescription().ifPresent(description -> meta.put("workflow.description", description));
        this.metadata = meta;

        publish();
    }

    public void markRunning() {
        if (state != WorkflowState.PENDING) {
            throw new IllegalStateException("Workflow " + workflowId + " is already " + state);
        }
        state = WorkflowState.RUNNING;
        startedAt = Instant.now();
        publish();
    }

    public void recordStepResult(StepResult result) {
        Objects.requireNonNull(result, "Step result cannot be null");
        if (state.isTerminal()) {
            logger.debug("Ignoring late result for step {} of finished workflow {}", result.getStepId(), workflowId);
            return;
        }
        stepResults.put(result.getStepId(), result);
        publish();
    }

    public void markSkipped(Collection<String> stepIds) {
        if (state.isTerminal() || stepIds.isEmpty()) {
            return;
        }
        for (String stepId : stepIds) {
            if (!stepResults.containsKey(stepId)) {
                skippedSteps.add(stepId);
            }
        }
        publish();
    }

    /**
     * True if any recorded step made at least one attempt.
     */
    public boolean hasAttemptedSteps() {
        return stepResults.values().stream().anyMatch(StepResult::wasAttempted);
    }

    /**
     * Decides the terminal state once every step has a verdict and freezes the result.
     * <ul>
     *   <li>no failed and no skipped steps: COMPLETED</li>
     *   <li>failed steps but none completed: FAILED</li>
     *   <li>anything else: PARTIAL_FAILURE</li>
     * </ul>
     */
    public WorkflowResult finalizeResult() {
        boolean anyFailed = stepResults.values().stream().anyMatch(result -> !result.isSuccessful());
        boolean anyCompleted = stepResults.values().stream().anyMatch(StepResult::isSuccessful);

        WorkflowState finalState;
        String error = null;
        if (!anyFailed && skippedSteps.isEmpty()) {
            finalState = WorkflowState.COMPLETED;
        } else if (anyFailed && !anyCompleted) {
            finalState = WorkflowState.FAILED;
            error = describeFailures();
        } else {
            finalState = WorkflowState.PARTIAL_FAILURE;
            error = describeFailures();
        }
        return terminate(finalState, error);
    }

    /**
     * Sets a terminal state directly, as the abort, deadlock and cancel paths do.
     */
    public WorkflowResult terminate(WorkflowState terminalState, String error) {
        Objects.requireNonNull(terminalState, "State cannot be null");
        if (!terminalState.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminalState);
        }
        if (state.isTerminal()) {
            return snapshot;
        }
        state = terminalState;
        errorMessage = error;
        if (startedAt == null) {
            startedAt = Instant.now();
        }
        endedAt = Instant.now();
        publish();
        return snapshot;
    }

    public WorkflowResult snapshot() {
        return snapshot;
    }

    public WorkflowState getState() {
        return state;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    private String describeFailures() {
        Set<String> failed = new LinkedHashSet<>();
        stepResults.forEach((stepId, result) -> {
            if (!result.isSuccessful()) {
                failed.add(stepId);
            }
        });
        StringBuilder message = new StringBuilder();
        message.append(failed.size()).append(" step(s) failed: ").append(failed);
        if (!skippedSteps.isEmpty()) {
            message.append("; skipped: ").append(skippedSteps);
        }
        return message.toString();
    }

    private void publish() {
        snapshot = new WorkflowResult(workflowId, workflowName, state, stepResults, skippedSteps, errorMessage,
                metadata, submittedAt, startedAt, endedAt);
    }
}
