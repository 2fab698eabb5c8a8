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

import dev.mars.stepflow.action.ActionRegistry;
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.workflow.DagWorkflowEngine;
import dev.mars.stepflow.workflow.StepResult;
import dev.mars.stepflow.workflow.WorkflowDefinition;
import dev.mars.stepflow.workflow.WorkflowResult;
import dev.mars.stepflow.workflow.WorkflowState;
import dev.mars.stepflow.workflow.WorkflowStep;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("WorkflowMetrics Tests")
class WorkflowMetricsTest {

    private InMemoryMetricReader metricReader;
    private OpenTelemetrySdk openTelemetry;
    private WorkflowMetrics metrics;

    @BeforeEach
    void setUp() {
        metricReader = InMemoryMetricReader.create();
        openTelemetry = OpenTelemetrySdk.builder()
                .setMeterProvider(SdkMeterProvider.builder()
                        .registerMetricReader(metricReader)
                        .build())
                .build();
        metrics = new WorkflowMetrics(openTelemetry);
    }

    @AfterEach
    void tearDown() {
        openTelemetry.close();
    }

    @Test
    @DisplayName("Should track submitted, finished and active workflows")
    void testWorkflowLifecycle() {
        metrics.recordWorkflowSubmitted("etl");
        metrics.recordWorkflowSubmitted("etl");
        metrics.recordWorkflowSubmitted("etl");
        assertThat(metrics.getActiveWorkflows()).isEqualTo(3);

        metrics.recordWorkflowFinished("etl", WorkflowState.COMPLETED, Duration.ofMillis(1500));
        metrics.recordWorkflowFinished("etl", WorkflowState.PARTIAL_FAILURE, Duration.ofMillis(200));

        assertThat(metrics.getActiveWorkflows()).isEqualTo(1);
        assertThat(sum("stepflow.workflow.total")).isEqualTo(3);
        assertThat(sum("stepflow.workflow.completed")).isEqualTo(1);
        assertThat(sum("stepflow.workflow.failed")).isEqualTo(1);
        assertThat(failedPoint().getAttributes().get(AttributeKey.stringKey("state"))).isEqualTo("PARTIAL_FAILURE");
        assertThat(metric("stepflow.workflow.cancelled")).isEmpty();
        assertThat(metric("stepflow.workflow.duration.seconds"))
                .hasValueSatisfying(m -> assertThat(m.getHistogramData().getPoints().iterator().next().getCount())
                        .isEqualTo(2));
        assertThat(metric("stepflow.workflow.active"))
                .hasValueSatisfying(m -> assertThat(m.getLongGaugeData().getPoints().iterator().next().getValue())
                        .isEqualTo(1));
    }

    @Test
    @DisplayName("Should count attempts, retries and failed steps")
    void testStepMetrics() {
        metrics.recordStepAttempt("etl", "load", 0);
        metrics.recordStepAttempt("etl", "load", 1);
        metrics.recordStepAttempt("etl", "load", 2);
        Instant now = Instant.now();
        metrics.recordStepFinished("etl", "load",
                StepResult.failed("load", new IllegalStateException("down"), 3, now, now.plusMillis(30)));

        assertThat(sum("stepflow.step.attempts")).isEqualTo(3);
        assertThat(sum("stepflow.step.retries")).isEqualTo(2);
        assertThat(sum("stepflow.step.failed")).isEqualTo(1);
        assertThat(metric("stepflow.step.duration.seconds")).isPresent();
    }

    @Test
    @DisplayName("Engine should record workflow and step metrics")
    void testEngineRecordsMetrics() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ActionRegistry registry = new ActionRegistry()
                .register("flaky", invocation -> {
                    if (calls.incrementAndGet() == 1) {
                        throw new IllegalStateException("first attempt fails");
                    }
                    return "ok";
                })
                .register("noop", invocation -> null);

        DagWorkflowEngine engine = new DagWorkflowEngine(registry, new StepflowConfiguration(new Properties()), metrics);
        try {
            WorkflowDefinition definition = WorkflowDefinition.builder("metered")
                    .step(WorkflowStep.builder("first")
                            .action("flaky")
                            .maxRetries(1)
                            .retryDelays(Duration.ofMillis(5), Duration.ofMillis(5))
                            .build())
                    .step(WorkflowStep.builder("second").action("noop").dependsOn("first").build())
                    .build();

            String id = engine.submit(definition, Map.of());
            WorkflowResult result = engine.awaitResult(id, Duration.ofSeconds(10));

            assertThat(result.getState()).isEqualTo(WorkflowState.COMPLETED);
            assertThat(sum("stepflow.workflow.total")).isEqualTo(1);
            assertThat(sum("stepflow.workflow.completed")).isEqualTo(1);
            assertThat(sum("stepflow.step.attempts")).isEqualTo(3);
            assertThat(sum("stepflow.step.retries")).isEqualTo(1);
            assertThat(metrics.getActiveWorkflows()).isZero();
        } finally {
            engine.shutdown(Duration.ofSeconds(5));
        }
    }

    @Test
    @DisplayName("Engines sharing one OpenTelemetry should stop reporting the active gauge after shutdown")
    void testGaugeRemovedOnShutdown() throws Exception {
        ActionRegistry registry = new ActionRegistry().register("noop", invocation -> null);
        WorkflowDefinition definition = WorkflowDefinition.builder("short")
                .step(WorkflowStep.builder("only").action("noop").build())
                .build();

        for (int i = 0; i < 3; i++) {
            DagWorkflowEngine engine = new DagWorkflowEngine(registry, new StepflowConfiguration(new Properties()),
                    new WorkflowMetrics(openTelemetry));
            String id = engine.submit(definition, Map.of());
            assertThat(engine.awaitResult(id, Duration.ofSeconds(10)).getState()).isEqualTo(WorkflowState.COMPLETED);
            assertThat(gaugePoints()).isPositive();
            engine.shutdown(Duration.ofSeconds(5));
        }

        assertThat(sum("stepflow.workflow.completed")).isEqualTo(3);
        assertThat(gaugePoints()).isZero();
    }

    @Test
    @DisplayName("Closing twice should be harmless and keep counters working")
    void testCloseIsIdempotent() {
        metrics.close();
        metrics.close();

        metrics.recordWorkflowSubmitted("etl");

        assertThat(sum("stepflow.workflow.total")).isEqualTo(1);
        assertThat(gaugePoints()).isZero();
    }

    @Test
    @DisplayName("No-op metrics should still track the active count")
    void testNoop() {
        WorkflowMetrics noop = WorkflowMetrics.noop();

        noop.recordWorkflowSubmitted("etl");
        noop.recordStepAttempt("etl", "load", 1);

        assertThat(noop.getActiveWorkflows()).isEqualTo(1);
    }

    private Optional<MetricData> metric(String name) {
        return metricReader.collectAllMetrics().stream()
                .filter(m -> m.getName().equals(name))
                .findFirst();
    }

    private long sum(String name) {
        return metric(name)
                .map(m -> m.getLongSumData().getPoints().stream().mapToLong(LongPointData::getValue).sum())
                .orElse(0L);
    }

    private int gaugePoints() {
        return metric("stepflow.workflow.active")
                .map(m -> m.getLongGaugeData().getPoints().size())
                .orElse(0);
    }

    private LongPointData failedPoint() {
        return metric("stepflow.workflow.failed")
                .map(m -> m.getLongSumData().getPoints().iterator().next())
                .orElseThrow();
    }
}
