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

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Point-in-time view of one workflow execution.
 * <p>
 * Instances are immutable. While a workflow runs, {@link ResultAggregator} publishes a new
 * snapshot after each change; the snapshot published when the workflow reaches a terminal
 * state is final.
 *
 * @since 1.0
 */
public final class WorkflowResult {

    private final String workflowId;
    private final String workflowName;
    private final WorkflowState state;
    private final Map<String, StepResult> stepResults;
    private final Map<String, StepResult> completedSteps;
    private final Set<String> failedSteps;
    private final Set<String> skippedSteps;
    private final String errorMessage;
    private final Map<String, String> metadata;
    private final Instant submittedAt;
    private final Instant startedAt;
    private final Instant endedAt;

    WorkflowResult(String workflowId, String workflowName, WorkflowState state,
                   Map<String, StepResult> stepResults, Set<String> skippedSteps, String errorMessage,
                   Map<String, String> metadata, Instant submittedAt, Instant startedAt, Instant endedAt) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.workflowName = Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        this.state = Objects.requireNonNull(state, "State cannot be null");
        this.submittedAt = Objects.requireNonNull(submittedAt, "Submission time cannot be null");
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.errorMessage = errorMessage;
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();

        Map<String, StepResult> all = new LinkedHashMap<>(stepResults);
        Map<String, StepResult> completed = new LinkedHashMap<>();
        Set<String> failed = new LinkedHashSet<>();
        all.forEach((stepId, result) -> {
            if (result.isSuccessful()) {
                completed.put(stepId, result);
            } else {
                failed.add(stepId);
            }
        });
        this.stepResults = Collections.unmodifiableMap(all);
        this.completedSteps = Collections.unmodifiableMap(completed);
        this.failedSteps = Collections.unmodifiableSet(failed);
        this.skippedSteps = Collections.unmodifiableSet(new LinkedHashSet<>(skippedSteps));
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public WorkflowState getState() {
        return state;
    }

    /**
     * Results of successful steps, keyed by step id.
     */
    public Map<String, StepResult> getCompletedSteps() {
        return completedSteps;
    }

    public Set<String> getFailedSteps() {
        return failedSteps;
    }

    /**
     * Steps never attempted, either because the workflow was aborted or cancelled, or because
     * a dependency failed.
     */
    public Set<String> getSkippedSteps() {
        return skippedSteps;
    }

    /**
     * Every recorded step result, successful or not, in completion order.
     */
    public Map<String, StepResult> getStepResults() {
        return stepResults;
    }

    public Optional<StepResult> getStepResult(String stepId) {
        return Optional.ofNullable(stepResults.get(stepId));
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getEndedAt() {
        return Optional.ofNullable(endedAt);
    }

    public Optional<Duration> getDuration() {
        return startedAt != null && endedAt != null
                ? Optional.of(Duration.between(startedAt, endedAt))
                : Optional.empty();
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public boolean isSuccessful() {
        return state.isSuccessful();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowResult that = (WorkflowResult) o;
        return Objects.equals(workflowId, that.workflowId) &&
               state == that.state &&
               Objects.equals(stepResults, that.stepResults) &&
               Objects.equals(skippedSteps, that.skippedSteps) &&
               Objects.equals(endedAt, that.endedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workflowId, state, stepResults, skippedSteps, endedAt);
    }

    @Override
    public String toString() {
        return "WorkflowResult{" +
               "workflowId='" + workflowId + '\'' +
               ", workflowName='" + workflowName + '\'' +
               ", state=" + state +
               ", completed=" + completedSteps.keySet() +
               ", failed=" + failedSteps +
               ", skipped=" + skippedSteps +
               '}';
    }
}
