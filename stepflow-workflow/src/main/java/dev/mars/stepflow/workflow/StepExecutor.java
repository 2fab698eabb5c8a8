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

import dev.mars.stepflow.action.ActionResolver;
import dev.mars.stepflow.action.StepInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one attempt of one step: invokes the step's action on the action pool and waits for it,
 * bounded by the step timeout when one is set.
 * <p>
 * Every failure is returned as an {@link AttemptOutcome}; nothing thrown by the action escapes.
 * A timeout, or an interrupt while the workflow is being aborted, cancels the action and ends the
 * attempt at once. An interrupt caused by a workflow cancel is passed on to the action, and the
 * attempt keeps waiting so that an action finishing anyway still reports its own outcome. A second
 * interrupt stops that wait.
 */
public class StepExecutor {
    private static final Logger logger = LoggerFactory.getLogger(StepExecutor.class);

    private final String workflowId;
    private final ActionResolver actionResolver;
    private final ExecutorService actionPool;
    private final CancellationController controller;

    public StepExecutor(String workflowId, ActionResolver actionResolver, ExecutorService actionPool,
                        CancellationController controller) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.actionResolver = Objects.requireNonNull(actionResolver, "Action resolver cannot be null");
        this.actionPool = Objects.requireNonNull(actionPool, "Action pool cannot be null");
        this.controller = Objects.requireNonNull(controller, "Cancellation controller cannot be null");
    }

    /**
     * @param step             the step to run
     * @param contextSnapshot  read-only context taken when the step was dispatched
     * @param attempt          zero-based attempt number
     * @param timeout          per-attempt limit, or {@code null} to wait indefinitely
     */
    public AttemptOutcome executeAttempt(WorkflowStep step, Map<String, Object> contextSnapshot,
                                         int attempt, Duration timeout) {
        String stepId = step.getStepId();
        StepInvocation invocation = new StepInvocation(workflowId, stepId, attempt,
                step.getParameters(), contextSnapshot);
        ActionCall call = new ActionCall(() -> actionResolver.invoke(step.getActionRef(), invocation));

        Future<Object> future;
        try {
            future = actionPool.submit(call);
        } catch (RejectedExecutionException e) {
            logger.warn("Action pool rejected step {} of workflow {}", stepId, workflowId);
            return AttemptOutcome.failure(e);
        }

        logger.debug("Attempt {} of step {} started (workflow {})", attempt + 1, stepId, workflowId);
        long deadline = timeout != null ? System.nanoTime() + timeout.toNanos() : 0L;
        boolean cancelForwarded = false;
        while (true) {
            try {
                Object output = timeout != null
                        ? future.get(deadline - System.nanoTime(), TimeUnit.NANOSECONDS)
                        : future.get();
                return AttemptOutcome.success(output);
            } catch (TimeoutException e) {
                future.cancel(true);
                logger.debug("Step {} timed out after {}ms", stepId, timeout.toMillis());
                return AttemptOutcome.failure(new StepTimeoutException(stepId, timeout));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cancelForwarded && cause instanceof InterruptedException) {
                    return AttemptOutcome.failure(new StepCancelledException(stepId));
                }
                return AttemptOutcome.failure(cause);
            } catch (CancellationException e) {
                return AttemptOutcome.failure(new StepCancelledException(stepId));
            } catch (InterruptedException e) {
                if (!cancelForwarded && controller.isCancelRequested()) {
                    cancelForwarded = true;
                    call.interrupt();
                    logger.debug("Step {} of workflow {} cancelled; waiting for its action to return",
                            stepId, workflowId);
                    continue;
                }
                future.cancel(true);
                Thread.currentThread().interrupt();
                return AttemptOutcome.failure(new StepCancelledException(stepId));
            }
        }
    }

    public String getWorkflowId() {
        return workflowId;
    }

    /**
     * Action invocation that can be interrupted without cancelling its future, so the value it
     * returns afterwards is still delivered.
     */
    private static final class ActionCall implements Callable<Object> {
        private final Callable<Object> action;
        private Thread runner;
        private boolean interruptRequested;

        ActionCall(Callable<Object> action) {
            this.action = action;
        }

        @Override
        public Object call() throws Exception {
            synchronized (this) {
                runner = Thread.currentThread();
                if (interruptRequested) {
                    runner.interrupt();
                }
            }
            try {
                return action.call();
            } finally {
                synchronized (this) {
                    runner = null;
                    // A forwarded interrupt must not reach the pool thread's next task
                    Thread.interrupted();
                }
            }
        }

        synchronized void interrupt() {
            interruptRequested = true;
            if (runner != null) {
                runner.interrupt();
            }
        }
    }
}
