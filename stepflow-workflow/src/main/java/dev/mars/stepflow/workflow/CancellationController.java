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

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Carries cancellation and abort into a running workflow.
 * <p>
 * Once halted, no new attempt starts: registered step tasks are interrupted, backoff waits in
 * {@link #awaitHalt(Duration)} return early and {@link #onHalt(Runnable) listeners} run.
 * A cancel request always halts; an abort halts without marking the workflow cancelled.
 * Both transitions happen at most once.
 */
public class CancellationController {
    private static final Logger logger = LoggerFactory.getLogger(CancellationController.class);

    private final String workflowId;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final AtomicBoolean halted = new AtomicBoolean(false);
    private final CountDownLatch haltLatch = new CountDownLatch(1);
    private final Set<Future<?>> tasks = ConcurrentHashMap.newKeySet();
    private final List<Runnable> haltListeners = new CopyOnWriteArrayList<>();

    public CancellationController(String workflowId) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
    }

    /**
     * Requests cancellation and halts.
     *
     * @return true for the call that actually requested cancellation, false for any later call
     */
    public boolean requestCancel() {
        if (!cancelRequested.compareAndSet(false, true)) {
            return false;
        }
        logger.info("Cancellation requested for workflow {}", workflowId);
        halt();
        return true;
    }

    /**
     * Stops new attempts and interrupts registered tasks. Safe to call more than once.
     */
    public void halt() {
        if (!halted.compareAndSet(false, true)) {
            return;
        }
        logger.debug("Halting workflow {} ({} task(s) in flight)", workflowId, tasks.size());
        haltLatch.countDown();
        for (Future<?> task : tasks) {
            task.cancel(true);
        }
        for (Runnable listener : haltListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                logger.warn("Halt listener failed for workflow {}: {}", workflowId, e.getMessage(), e);
            }
        }
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public boolean isHalted() {
        return halted.get();
    }

    /**
     * Sleeps for the given delay unless halted first.
     *
     * @return true if the controller was halted before the delay elapsed
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public boolean awaitHalt(Duration delay) throws InterruptedException {
        if (delay.isZero() || delay.isNegative()) {
            return isHalted();
        }
        long nanos;
        try {
            nanos = delay.toNanos();
        } catch (ArithmeticException e) {
            nanos = Long.MAX_VALUE;
        }
        return haltLatch.await(nanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Tracks a step task so that halting interrupts it. A task registered after the halt is
     * cancelled at once.
     */
    public void register(Future<?> task) {
        Objects.requireNonNull(task, "Task cannot be null");
        tasks.add(task);
        if (isHalted()) {
            task.cancel(true);
        }
    }

    public void unregister(Future<?> task) {
        tasks.remove(task);
    }

    /**
     * Adds a listener run once on halt. A listener added after the halt runs immediately.
     */
    public void onHalt(Runnable listener) {
        Objects.requireNonNull(listener, "Listener cannot be null");
        haltListeners.add(listener);
        if (isHalted()) {
            listener.run();
        }
    }

    public String getWorkflowId() {
        return workflowId;
    }

    @Override
    public String toString() {
        return "CancellationController{" +
               "workflowId='" + workflowId + '\'' +
               ", cancelRequested=" + cancelRequested.get() +
               ", halted=" + halted.get() +
               '}';
    }
}
