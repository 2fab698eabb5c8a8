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
import java.util.Objects;
import java.util.Optional;

/**
 * The immutable outcome of one step, created once its final attempt is known.
 *
 * @since 1.0
 */
public final class StepResult {

    private final String stepId;
    private final StepState state;
    private final Object output;
    private final String errorMessage;
    private final Throwable cause;
    private final int attempts;
    private final Instant startedAt;
    private final Instant endedAt;

    private StepResult(String stepId, StepState state, Object output, String errorMessage, Throwable cause,
                       int attempts, Instant startedAt, Instant endedAt) {
        this.stepId = Objects.requireNonNull(stepId, "Step ID cannot be null");
        this.state = Objects.requireNonNull(state, "State cannot be null");
        this.output = output;
        this.errorMessage = errorMessage;
        this.cause = cause;
        if (attempts < 0) {
            throw new IllegalArgumentException("Attempts cannot be negative: " + attempts);
        }
        this.attempts = attempts;
        this.startedAt = Objects.requireNonNull(startedAt, "Start time cannot be null");
        this.endedAt = Objects.requireNonNull(endedAt, "End time cannot be null");
    }

    public static StepResult completed(String stepId, Object output, int attempts, Instant startedAt, Instant endedAt) {
        return new StepResult(stepId, StepState.COMPLETED, output, null, null, attempts, startedAt, endedAt);
    }

    public static StepResult failed(String stepId, Throwable cause, int attempts, Instant startedAt, Instant endedAt) {
        Objects.requireNonNull(cause, "Failure cause cannot be null");
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new StepResult(stepId, StepState.FAILED, null, message, cause, attempts, startedAt, endedAt);
    }

    public String getStepId() {
        return stepId;
    }

    public StepState getState() {
        return state;
    }

    public Object getOutput() {
        return output;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    /**
     * Number of attempts actually started. Zero means the step was cancelled before its first attempt.
     */
    public int getAttempts() {
        return attempts;
    }

    public boolean wasAttempted() {
        return attempts > 0;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public Duration getDuration() {
        return Duration.between(startedAt, endedAt);
    }

    public boolean isSuccessful() {
        return state == StepState.COMPLETED;
    }

    public boolean isCancelled() {
        return cause instanceof StepCancelledException;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepResult that = (StepResult) o;
        return attempts == that.attempts &&
               Objects.equals(stepId, that.stepId) &&
               state == that.state &&
               Objects.equals(output, that.output) &&
               Objects.equals(errorMessage, that.errorMessage) &&
               Objects.equals(startedAt, that.startedAt) &&
               Objects.equals(endedAt, that.endedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepId, state, output, errorMessage, attempts, startedAt, endedAt);
    }

    @Override
    public String toString() {
        return "StepResult{" +
               "stepId='" + stepId + '\'' +
               ", state=" + state +
               ", attempts=" + attempts +
               (errorMessage != null ? ", error='" + errorMessage + '\'' : "") +
               ", duration=" + getDuration().toMillis() + "ms" +
               '}';
    }
}
