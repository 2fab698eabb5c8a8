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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Drives one workflow execution from start to terminal state.
 * <p>
 * The coordinator repeatedly dispatches ready steps to the step pool, waits for their results
 * on a completion queue and updates the graph, the context and the aggregator. It is the only
 * writer of all three. A step is dispatched only after taking one of {@code maxParallelSteps}
 * permits; ready steps left without a permit wait, in definition order, until a running step
 * returns its permit. No thread is created for a step that is still waiting.
 * <p>
 * A failure with {@code continueOnError == false} aborts: the controller is halted and every
 * unresolved step is skipped without waiting for in-flight tasks. A cancel request waits for
 * in-flight tasks to report before the workflow ends CANCELLED.
 */
public class ExecutionCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private final String workflowId;
    private final WorkflowDefinition definition;
    private final DependencyGraph graph;
    private final ExecutionContext context;
    private final ResultAggregator aggregator;
    private final CancellationController controller;
    private final RetryHandler retryHandler;
    private final ExecutorService stepPool;

    private final Semaphore parallelism;
    private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
    private final Map<String, StepTask> tasks = new HashMap<>();

    public ExecutionCoordinator(String workflowId, WorkflowDefinition definition, DependencyGraph graph,
                                ExecutionContext context, ResultAggregator aggregator,
                                CancellationController controller, RetryHandler retryHandler,
                                ExecutorService stepPool) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.definition = Objects.requireNonNull(definition, "Workflow definition cannot be null");
        this.graph = Objects.requireNonNull(graph, "Dependency graph cannot be null");
        this.context = Objects.requireNonNull(context, "Execution context cannot be null");
        this.aggregator = Objects.requireNonNull(aggregator, "Result aggregator cannot be null");
        this.controller = Objects.requireNonNull(controller, "Cancellation controller cannot be null");
        this.retryHandler = Objects.requireNonNull(retryHandler, "Retry handler cannot be null");
        this.stepPool = Objects.requireNonNull(stepPool, "Step pool cannot be null");
        this.parallelism = new Semaphore(definition.getMaxParallelSteps());

        controller.onHalt(() -> completions.offer(Completion.WAKE_UP));
    }

    /**
     * Runs the workflow on the calling thread and returns its final result. Never throws.
     */
    public WorkflowResult run() {
        aggregator.markRunning();
        logger.info("Workflow {} ({}) started with {} step(s)", workflowId, definition.getName(),
                definition.getStepCount());
        if (logger.isDebugEnabled()) {
            try {
                logger.debug("Execution order for workflow {}: {}", workflowId, graph.topologicalOrder().stream()
                        .map(WorkflowStep::getStepId)
                        .collect(Collectors.toList()));
            } catch (CycleDetectedException e) {
                logger.debug("Workflow {} has no execution order: {}", workflowId, e.getMessage());
            }
        }

        try {
            coordinate();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Coordinator for workflow {} was interrupted", workflowId);
            controller.halt();
            aggregator.markSkipped(graph.unresolvedSteps());
            aggregator.terminate(WorkflowState.CANCELLED, "Workflow interrupted before completion");
        } catch (RuntimeException e) {
            logger.error("Unexpected error coordinating workflow {}", workflowId, e);
            controller.halt();
            aggregator.markSkipped(graph.unresolvedSteps());
            aggregator.terminate(WorkflowState.FAILED, "Internal error: " + e.getMessage());
        }

        WorkflowResult result = aggregator.snapshot();
        logger.info("Workflow {} ({}) finished: {}", workflowId, definition.getName(), result.getState());
        return result;
    }

    private void coordinate() throws InterruptedException {
        while (true) {
            if (controller.isCancelRequested()) {
                cancelExecution(List.of());
                return;
            }

            List<WorkflowStep> ready = graph.readySteps();
            if (ready.isEmpty() && !graph.hasInFlight()) {
                if (graph.hasPendingWork()) {
                    deadlock();
                } else {
                    aggregator.finalizeResult();
                }
                return;
            }

            for (WorkflowStep step : ready) {
                if (!parallelism.tryAcquire()) {
                    break;
                }
                dispatch(step);
            }

            List<StepResult> results = awaitResults();
            if (controller.isCancelRequested()) {
                cancelExecution(results);
                return;
            }

            StepResult firstFailure = null;
            for (StepResult result : results) {
                if (!apply(result) && firstFailure == null) {
                    firstFailure = result;
                }
            }
            if (firstFailure != null && !definition.isContinueOnError()) {
                abort(firstFailure);
                return;
            }
        }
    }

    private void dispatch(WorkflowStep step) {
        String stepId = step.getStepId();
        graph.markInFlight(stepId);
        Map<String, Object> snapshot = context.snapshot();
        Instant dispatchedAt = Instant.now();
        AtomicBoolean claimed = new AtomicBoolean(false);

        StepTask task = new StepTask(
                () -> {
                    if (claimed.compareAndSet(false, true)) {
                        report(runStep(step, snapshot, dispatchedAt));
                    }
                },
                claimed,
                () -> report(notStarted(stepId, dispatchedAt)));

        tasks.put(stepId, task);
        controller.register(task);
        logger.debug("Dispatching step {} of workflow {}", stepId, workflowId);
        stepPool.execute(task);
    }

    private StepResult runStep(WorkflowStep step, Map<String, Object> snapshot, Instant dispatchedAt) {
        String stepId = step.getStepId();
        try {
            return retryHandler.run(step, snapshot);
        } catch (RuntimeException e) {
            logger.error("Unexpected error running step {} of workflow {}", stepId, workflowId, e);
            return StepResult.failed(stepId, e, 1, dispatchedAt, Instant.now());
        }
    }

    // The permit goes back before the result is queued, so the woken coordinator can reuse it
    private void report(StepResult result) {
        parallelism.release();
        completions.offer(new Completion(result));
    }

    private List<StepResult> awaitResults() throws InterruptedException {
        List<Completion> drained = new ArrayList<>();
        drained.add(completions.take());
        completions.drainTo(drained);

        List<StepResult> results = new ArrayList<>();
        for (Completion completion : drained) {
            if (completion.result != null) {
                results.add(completion.result);
            }
        }
        return results;
    }

    /**
     * Records a result in graph, context and aggregator.
     *
     * @return true if the step completed
     */
    private boolean apply(StepResult result) {
        String stepId = result.getStepId();
        forget(stepId);
        aggregator.recordStepResult(result);
        if (result.isSuccessful()) {
            graph.markCompleted(stepId);
            context.mergeOutput(stepId, result.getOutput());
            return true;
        }
        graph.markFailed(stepId);
        return false;
    }

    private void abort(StepResult failure) {
        controller.halt();
        List<String> unresolved = graph.unresolvedSteps();
        aggregator.markSkipped(unresolved);
        String reason = failure.getErrorMessage().orElse("unknown error");
        logger.warn("Aborting workflow {}: step {} failed ({}); skipping {}", workflowId, failure.getStepId(),
                reason, unresolved);
        aggregator.terminate(WorkflowState.FAILED,
                "Aborted after step '" + failure.getStepId() + "' failed: " + reason + "; skipped " + unresolved);
    }

    private void deadlock() {
        List<String> blocked = graph.unresolvedSteps();
        aggregator.markSkipped(blocked);
        WorkflowState state = aggregator.hasAttemptedSteps()
                ? WorkflowState.PARTIAL_FAILURE
                : WorkflowState.DEADLOCKED;
        logger.warn("Workflow {} cannot make progress; blocked steps {} (failed: {})", workflowId, blocked,
                graph.getFailed());
        aggregator.terminate(state,
                "Steps " + blocked + " blocked by failed dependencies " + graph.getFailed());
    }

    private void cancelExecution(List<StepResult> alreadyReceived) throws InterruptedException {
        logger.info("Cancelling workflow {}; waiting for {} in-flight step(s)", workflowId, graph.getInFlight().size());
        for (StepResult result : alreadyReceived) {
            applyWhileCancelling(result);
        }
        while (graph.hasInFlight()) {
            for (StepResult result : awaitResults()) {
                applyWhileCancelling(result);
            }
        }

        List<String> unresolved = graph.unresolvedSteps();
        aggregator.markSkipped(unresolved);
        aggregator.terminate(WorkflowState.CANCELLED, "Workflow cancelled; skipped " + unresolved);
    }

    private void applyWhileCancelling(StepResult result) {
        if (result.wasAttempted()) {
            apply(result);
        } else {
            forget(result.getStepId());
            graph.release(result.getStepId());
        }
    }

    private void forget(String stepId) {
        StepTask task = tasks.remove(stepId);
        if (task != null) {
            controller.unregister(task);
        }
    }

    private static StepResult notStarted(String stepId, Instant dispatchedAt) {
        return StepResult.failed(stepId, new StepCancelledException(stepId), 0, dispatchedAt, Instant.now());
    }

    public String getWorkflowId() {
        return workflowId;
    }

    /**
     * Step task whose result is reported exactly once: by the task body when it starts, or by
     * {@link #done()} when the task is cancelled before it ever ran.
     */
    private static final class StepTask extends FutureTask<Void> {
        private final AtomicBoolean claimed;
        private final Runnable onCancelledBeforeStart;

        StepTask(Runnable body, AtomicBoolean claimed, Runnable onCancelledBeforeStart) {
            super(body, null);
            this.claimed = claimed;
            this.onCancelledBeforeStart = onCancelledBeforeStart;
        }

        @Override
        protected void done() {
            if (isCancelled() && claimed.compareAndSet(false, true)) {
                onCancelledBeforeStart.run();
            }
        }
    }

    private static final class Completion {
        static final Completion WAKE_UP = new Completion(null);

        final StepResult result;

        Completion(StepResult result) {
            this.result = result;
        }
    }
}
