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
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * {@link WorkflowEngine} that runs each workflow as a DAG of steps on in-process thread pools.
 * <p>
 * At most {@code maxConcurrentWorkflows} workflows run at a time; later submissions wait in
 * {@link WorkflowState#PENDING}. Each running workflow has its own coordinator thread, while
 * step tasks and action invocations share two cached pools. Terminal results are retained
 * up to {@code retainedResults}; older ones are evicted first.
 *
 * @since 1.0
 */
public class DagWorkflowEngine implements WorkflowEngine {
    private static final Logger logger = LoggerFactory.getLogger(DagWorkflowEngine.class);

    private final ActionResolver actionResolver;
    private final StepflowConfiguration configuration;
    private final WorkflowMetrics metrics;
    private final ExecutorService coordinatorPool;
    private final ExecutorService stepPool;
    private final ExecutorService actionPool;
    private final Map<String, Execution> executions = new ConcurrentHashMap<>();
    private final Queue<String> finishedOrder = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public DagWorkflowEngine(ActionResolver actionResolver) {
        this(actionResolver, new StepflowConfiguration());
    }

    public DagWorkflowEngine(ActionResolver actionResolver, StepflowConfiguration configuration) {
        this(actionResolver, configuration,
                configuration.isMetricsEnabled() ? new WorkflowMetrics() : WorkflowMetrics.noop());
    }

    /**
     * @param metrics metrics owned by this engine from now on; closed by {@link #shutdown(Duration)}
     */
    public DagWorkflowEngine(ActionResolver actionResolver, StepflowConfiguration configuration,
                             WorkflowMetrics metrics) {
        this.actionResolver = Objects.requireNonNull(actionResolver, "Action resolver cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");

        int maxConcurrentWorkflows = configuration.getMaxConcurrentWorkflows();
        this.coordinatorPool = Executors.newFixedThreadPool(maxConcurrentWorkflows,
                namedDaemonThreads("stepflow-coordinator-"));
        this.stepPool = Executors.newCachedThreadPool(namedDaemonThreads("stepflow-step-"));
        this.actionPool = Executors.newCachedThreadPool(namedDaemonThreads("stepflow-action-"));

        logger.info("DagWorkflowEngine initialized with {} max concurrent workflows", maxConcurrentWorkflows);
    }

    @Override
    public String submit(WorkflowDefinition definition, Map<String, ?> initialContext)
            throws WorkflowValidationException {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        if (shutdown.get()) {
            throw new IllegalStateException("Workflow engine is shut down");
        }

        DependencyGraph graph = new DependencyGraph(definition);
        graph.validate();

        String workflowId = UUID.randomUUID().toString();
        CancellationController controller = new CancellationController(workflowId);
        ResultAggregator aggregator = new ResultAggregator(workflowId, definition, Instant.now());
        StepExecutor stepExecutor = new StepExecutor(workflowId, actionResolver, actionPool, controller);
        RetryHandler retryHandler = new RetryHandler(definition.getName(), stepExecutor, controller,
                configuration.isRetryJitterEnabled(), metrics);
        ExecutionCoordinator coordinator = new ExecutionCoordinator(workflowId, definition, graph,
                new ExecutionContext(workflowId, initialContext), aggregator, controller, retryHandler, stepPool);

        Execution execution = new Execution(workflowId, definition, controller, aggregator);
        executions.put(workflowId, execution);
        metrics.recordWorkflowSubmitted(definition.getName());
        logger.info("Workflow {} ({}) submitted", workflowId, definition.getName());

        try {
            execution.task = coordinatorPool.submit(() -> complete(execution, coordinator.run()));
        } catch (RejectedExecutionException e) {
            logger.warn("Workflow {} rejected: engine is shutting down", workflowId);
            complete(execution, cancelBeforeStart(execution, "Workflow rejected: engine is shutting down"));
        }
        return workflowId;
    }

    @Override
    public WorkflowResult awaitResult(String workflowId) throws WorkflowNotFoundException, InterruptedException {
        try {
            return lookup(workflowId).resultFuture.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Workflow " + workflowId + " completed abnormally", e.getCause());
        }
    }

    @Override
    public WorkflowResult awaitResult(String workflowId, Duration timeout)
            throws WorkflowNotFoundException, InterruptedException, TimeoutException {
        Objects.requireNonNull(timeout, "Timeout cannot be null");
        try {
            return lookup(workflowId).resultFuture.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Workflow " + workflowId + " completed abnormally", e.getCause());
        }
    }

    @Override
    public CompletableFuture<WorkflowResult> resultFuture(String workflowId) throws WorkflowNotFoundException {
        return lookup(workflowId).resultFuture.copy();
    }

    @Override
    public CompletableFuture<WorkflowResult> execute(WorkflowDefinition definition, Map<String, ?> initialContext) {
        try {
            return resultFuture(submit(definition, initialContext));
        } catch (WorkflowValidationException | WorkflowNotFoundException | IllegalStateException e) {
            logger.warn("Workflow {} not executed: {}", definition.getName(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public boolean cancel(String workflowId) {
        Execution execution = executions.get(workflowId);
        // The aggregator turns terminal before the result future completes
        if (execution == null || execution.aggregator.isTerminal() || execution.resultFuture.isDone()) {
            return false;
        }
        if (!execution.controller.requestCancel()) {
            return false;
        }

        // A workflow still queued never runs its coordinator, so finish it here
        Future<?> task = execution.task;
        if (task != null && task.cancel(false)) {
            complete(execution, cancelBeforeStart(execution, "Workflow cancelled before it started"));
        }
        return true;
    }

    @Override
    public Optional<WorkflowResult> getStatus(String workflowId) {
        return Optional.ofNullable(executions.get(workflowId))
                .map(execution -> execution.aggregator.snapshot());
    }

    @Override
    public List<WorkflowResult> listWorkflows(WorkflowState state, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative: " + limit);
        }
        return executions.values().stream()
                .map(execution -> execution.aggregator.snapshot())
                .filter(result -> state == null || result.getState() == state)
                .sorted(Comparator.comparing(WorkflowResult::getSubmittedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public int getActiveWorkflowCount() {
        return (int) executions.values().stream()
                .filter(execution -> execution.aggregator.snapshot().getState().isActive())
                .count();
    }

    /**
     * Shuts down using the configured {@code stepflow.engine.shutdown.timeout.seconds}.
     */
    public boolean shutdown() {
        return shutdown(configuration.getShutdownTimeout());
    }

    @Override
    public boolean shutdown(Duration timeout) {
        if (shutdown.getAndSet(true)) {
            return true;
        }

        logger.info("Shutting down workflow engine ({} active workflow(s))", getActiveWorkflowCount());
        executions.keySet().forEach(this::cancel);
        coordinatorPool.shutdown();

        try {
            boolean terminated = coordinatorPool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!terminated) {
                logger.warn("Workflow engine shutdown timed out, forcing shutdown");
                coordinatorPool.shutdownNow();
            }
            stepPool.shutdownNow();
            actionPool.shutdownNow();
            if (terminated) {
                logger.info("Workflow engine shutdown completed");
            }
            return terminated;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            coordinatorPool.shutdownNow();
            stepPool.shutdownNow();
            actionPool.shutdownNow();
            return false;
        } finally {
            metrics.close();
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public StepflowConfiguration getConfiguration() {
        return configuration;
    }

    private Execution lookup(String workflowId) throws WorkflowNotFoundException {
        Execution execution = workflowId != null ? executions.get(workflowId) : null;
        if (execution == null) {
            throw new WorkflowNotFoundException(workflowId);
        }
        return execution;
    }

    private WorkflowResult cancelBeforeStart(Execution execution, String reason) {
        execution.aggregator.markSkipped(execution.definition.getSteps().stream()
                .map(WorkflowStep::getStepId)
                .collect(Collectors.toList()));
        return execution.aggregator.terminate(WorkflowState.CANCELLED, reason);
    }

    private void complete(Execution execution, WorkflowResult result) {
        if (!execution.finished.compareAndSet(false, true)) {
            return;
        }
        metrics.recordWorkflowFinished(execution.definition.getName(), result.getState(),
                result.getDuration().orElse(null));
        finishedOrder.add(execution.workflowId);
        evictFinished();
        execution.resultFuture.complete(result);
    }

    private void evictFinished() {
        int retained = configuration.getRetainedResults();
        while (finishedOrder.size() > retained) {
            String evicted = finishedOrder.poll();
            if (evicted == null) {
                break;
            }
            executions.remove(evicted);
            logger.debug("Evicted result of workflow {}", evicted);
        }
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class Execution {
        final String workflowId;
        final WorkflowDefinition definition;
        final CancellationController controller;
        final ResultAggregator aggregator;
        final CompletableFuture<WorkflowResult> resultFuture = new CompletableFuture<>();
        final AtomicBoolean finished = new AtomicBoolean(false);
        volatile Future<?> task;

        Execution(String workflowId, WorkflowDefinition definition, CancellationController controller,
                  ResultAggregator aggregator) {
            this.workflowId = workflowId;
            this.definition = definition;
            this.controller = controller;
            this.aggregator = aggregator;
        }
    }
}
