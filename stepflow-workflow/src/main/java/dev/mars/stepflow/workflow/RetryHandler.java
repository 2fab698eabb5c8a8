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

import dev.mars.stepflow.core.exceptions.NonRetryableStepException;
import dev.mars.stepflow.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a step to its final outcome: up to {@code maxRetries + 1} attempts with exponential
 * backoff between them, stopping early on success, on a non-retryable failure, or when the
 * workflow is halted.
 */
public class RetryHandler {
    private static final Logger logger = LoggerFactory.getLogger(RetryHandler.class);

    private final String workflowName;
    private final StepExecutor stepExecutor;
    private final CancellationController controller;
    private final boolean jitter;
    private final WorkflowMetrics metrics;

    public RetryHandler(String workflowName, StepExecutor stepExecutor, CancellationController controller,
                        boolean jitter, WorkflowMetrics metrics) {
        this.workflowName = Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        this.stepExecutor = Objects.requireNonNull(stepExecutor, "Step executor cannot be null");
        this.controller = Objects.requireNonNull(controller, "Cancellation controller cannot be null");
        this.jitter = jitter;
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
    }

    public StepResult run(WorkflowStep step, Map<String, Object> contextSnapshot) {
        StepResult result = attemptUntilDone(step, contextSnapshot);
        if (result.wasAttempted()) {
            metrics.recordStepFinished(workflowName, step.getActionRef(), result);
        }
        return result;
    }

    private StepResult attemptUntilDone(WorkflowStep step, Map<String, Object> contextSnapshot) {
        String stepId = step.getStepId();
        int maxRetries = step.getMaxRetries();
        Duration timeout = step.getTimeout().orElse(null);
        BackoffPolicy backoff = BackoffPolicy.forStep(step, jitter);
        Instant startedAt = Instant.now();

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (controller.isHalted()) {
                return StepResult.failed(stepId, new StepCancelledException(stepId), attempt, startedAt, Instant.now());
            }

            metrics.recordStepAttempt(workflowName, step.getActionRef(), attempt);
            AttemptOutcome outcome = stepExecutor.executeAttempt(step, contextSnapshot, attempt, timeout);
            if (outcome.isSuccess()) {
                logger.debug("Step {} succeeded on attempt {}", stepId, attempt + 1);
                return StepResult.completed(stepId, outcome.getOutput(), attempt + 1, startedAt, Instant.now());
            }

            Throwable failure = outcome.getFailure().orElseThrow();
            if (!isRetryable(failure) || attempt == maxRetries) {
                if (!(failure instanceof StepCancelledException)) {
                    logger.warn("Step {} failed after {} attempt(s): {}", stepId, attempt + 1, failure.getMessage());
                }
                return StepResult.failed(stepId, failure, attempt + 1, startedAt, Instant.now());
            }

            Duration delay = backoff.delayFor(attempt);
            logger.warn("Attempt {} of step {} failed: {}. Retrying in {}ms",
                    attempt + 1, stepId, failure.getMessage(), delay.toMillis());
            try {
                if (controller.awaitHalt(delay)) {
                    return StepResult.failed(stepId, new StepCancelledException(stepId), attempt + 1,
                            startedAt, Instant.now());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return StepResult.failed(stepId, new StepCancelledException(stepId), attempt + 1,
                        startedAt, Instant.now());
            }
        }

        // Unreachable: the last attempt always returns
        throw new IllegalStateException("Retry loop for step " + stepId + " ended without a result");
    }

    static boolean isRetryable(Throwable failure) {
        return !(failure instanceof NonRetryableStepException)
                && !(failure instanceof StepCancelledException);
    }
}
