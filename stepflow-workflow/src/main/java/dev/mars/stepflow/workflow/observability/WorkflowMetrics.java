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


package dev.mars.stepflow.workflow.observability;

import dev.mars.stepflow.workflow.StepResult;
import dev.mars.stepflow.workflow.WorkflowState;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.ObservableLongGauge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the workflow engine.
 * <p>
 * One instance per engine:
 * <ul>
 *   <li>stepflow.workflow.active (gauge) - submitted workflows not yet finished</li>
 *   <li>stepflow.workflow.total (counter) - workflows submitted</li>
 *   <li>stepflow.workflow.completed (counter) - workflows finished COMPLETED</li>
 *   <li>stepflow.workflow.failed (counter) - workflows finished FAILED, PARTIAL_FAILURE or DEADLOCKED, by state</li>
 *   <li>stepflow.workflow.cancelled (counter) - workflows finished CANCELLED</li>
 *   <li>stepflow.workflow.duration.seconds (histogram) - workflow run time</li>
 *   <li>stepflow.step.attempts (counter) - step attempts started</li>
 *   <li>stepflow.step.retries (counter) - attempts that were retries</li>
 *   <li>stepflow.step.failed (counter) - steps that ended FAILED</li>
 *   <li>stepflow.step.duration.seconds (histogram) - step run time across all attempts</li>
 * </ul>
 * The gauge callback stays registered with the meter until {@link #close()}.
 */
public class WorkflowMetrics implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "stepflow-workflow";

    private final LongCounter workflowsTotal;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsCancelled;
    private final LongCounter stepAttempts;
    private final LongCounter stepRetries;
    private final LongCounter stepsFailed;

    private final DoubleHistogram workflowDuration;
    private final DoubleHistogram stepDuration;

    // Gauge (backed by AtomicLong)
    private final AtomicLong activeWorkflows = new AtomicLong(0);
    private final ObservableLongGauge activeWorkflowsGauge;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> STATE_KEY = AttributeKey.stringKey("state");
    private static final AttributeKey<String> ACTION_KEY = AttributeKey.stringKey("step.action");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    public WorkflowMetrics() {
        this(GlobalOpenTelemetry.get());
    }

    public WorkflowMetrics(OpenTelemetry openTelemetry) {
        Objects.requireNonNull(openTelemetry, "OpenTelemetry cannot be null");
        Meter meter = openTelemetry.getMeter(METER_NAME);

        workflowsTotal = meter.counterBuilder("stepflow.workflow.total")
                .setDescription("Total number of workflows submitted")
                .setUnit("1")
                .build();

        workflowsCompleted = meter.counterBuilder("stepflow.workflow.completed")
                .setDescription("Number of workflows that completed successfully")
                .setUnit("1")
                .build();

        workflowsFailed = meter.counterBuilder("stepflow.workflow.failed")
                .setDescription("Number of workflows that ended with failed steps")
                .setUnit("1")
                .build();

        workflowsCancelled = meter.counterBuilder("stepflow.workflow.cancelled")
                .setDescription("Number of cancelled workflows")
                .setUnit("1")
                .build();

        stepAttempts = meter.counterBuilder("stepflow.step.attempts")
                .setDescription("Number of step attempts started")
                .setUnit("1")
                .build();

        stepRetries = meter.counterBuilder("stepflow.step.retries")
                .setDescription("Number of step attempts that were retries")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("stepflow.step.failed")
                .setDescription("Number of steps that failed")
                .setUnit("1")
                .build();

        workflowDuration = meter.histogramBuilder("stepflow.workflow.duration.seconds")
                .setDescription("Workflow duration in seconds")
                .setUnit("s")
                .build();

        stepDuration = meter.histogramBuilder("stepflow.step.duration.seconds")
                .setDescription("Step duration in seconds, all attempts included")
                .setUnit("s")
                .build();

        activeWorkflowsGauge = meter.gaugeBuilder("stepflow.workflow.active")
                .setDescription("Number of submitted workflows that have not finished")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.debug("WorkflowMetrics initialized");
    }

    /**
     * Metrics that record nothing, for engines with metrics disabled.
     */
    public static WorkflowMetrics noop() {
        return new WorkflowMetrics(OpenTelemetry.noop());
    }

    public void recordWorkflowSubmitted(String workflowName) {
        workflowsTotal.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
        activeWorkflows.incrementAndGet();
    }

    /**
     * Record a workflow reaching a terminal state.
     */
    public void recordWorkflowFinished(String workflowName, WorkflowState state, Duration duration) {
        activeWorkflows.decrementAndGet();

        Attributes attrs = Attributes.of(WORKFLOW_NAME_KEY, workflowName);
        switch (state) {
            case COMPLETED:
                workflowsCompleted.add(1, attrs);
                break;
            case CANCELLED:
                workflowsCancelled.add(1, attrs);
                break;
            default:
                workflowsFailed.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName, STATE_KEY, state.name()));
                break;
        }
        if (duration != null) {
            workflowDuration.record(duration.toMillis() / 1000.0, attrs);
        }
    }

    public void recordStepAttempt(String workflowName, String actionRef, int attempt) {
        Attributes attrs = Attributes.of(WORKFLOW_NAME_KEY, workflowName, ACTION_KEY, actionRef);
        stepAttempts.add(1, attrs);
        if (attempt > 0) {
            stepRetries.add(1, attrs);
        }
    }

    /**
     * Record the final outcome of a step.
     */
    public void recordStepFinished(String workflowName, String actionRef, StepResult result) {
        Attributes attrs = Attributes.of(WORKFLOW_NAME_KEY, workflowName, ACTION_KEY, actionRef);
        stepDuration.record(result.getDuration().toMillis() / 1000.0, attrs);

        if (!result.isSuccessful()) {
            String reason = result.getCause()
                    .map(cause -> cause.getClass().getSimpleName())
                    .orElse("unknown");
            stepsFailed.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName, ACTION_KEY, actionRef,
                    FAILURE_REASON_KEY, reason));
        }
    }

    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }

    /**
     * Unregisters the active-workflow gauge. Counters and histograms stay usable.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            activeWorkflowsGauge.close();
            logger.debug("WorkflowMetrics closed");
        }
    }
}
