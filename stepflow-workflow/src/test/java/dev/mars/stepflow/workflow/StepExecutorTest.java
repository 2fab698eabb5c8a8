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
import dev.mars.stepflow.core.exceptions.ActionNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("StepExecutor Tests")
class StepExecutorTest {

    @Mock
    private ActionResolver actionResolver;

    private ExecutorService actionPool;
    private CancellationController controller;
    private StepExecutor executor;

    @BeforeEach
    void setUp() {
        actionPool = Executors.newCachedThreadPool();
        controller = new CancellationController("wf-1");
        executor = new StepExecutor("wf-1", actionResolver, actionPool, controller);
    }

    @AfterEach
    void tearDown() {
        actionPool.shutdownNow();
    }

    @Test
    @DisplayName("Should return the action output on success")
    void testSuccess() throws Exception {
        when(actionResolver.invoke(eq("fetch"), any())).thenReturn("payload");
        WorkflowStep step = WorkflowStep.builder("download")
                .action("fetch")
                .parameter("url", "http://example.test/data")
                .build();

        AttemptOutcome outcome = executor.executeAttempt(step, Map.of("seed", 42), 1, null);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getOutput()).isEqualTo("payload");

        ArgumentCaptor<StepInvocation> captor = ArgumentCaptor.forClass(StepInvocation.class);
        verify(actionResolver).invoke(eq("fetch"), captor.capture());
        StepInvocation invocation = captor.getValue();
        assertThat(invocation.getWorkflowId()).isEqualTo("wf-1");
        assertThat(invocation.getStepId()).isEqualTo("download");
        assertThat(invocation.getAttempt()).isEqualTo(1);
        assertThat(invocation.getParameters()).containsEntry("url", "http://example.test/data");
        assertThat(invocation.getContext()).containsEntry("seed", 42);
    }

    @Test
    @DisplayName("Should convert an action exception into a failed outcome")
    void testActionException() throws Exception {
        IOException failure = new IOException("disk full");
        when(actionResolver.invoke(eq("write"), any())).thenThrow(failure);

        AttemptOutcome outcome = executor.executeAttempt(step("write"), Map.of(), 0, null);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getFailure()).containsSame(failure);
    }

    @Test
    @DisplayName("Should convert an Error thrown by the action into a failed outcome")
    void testActionError() throws Exception {
        when(actionResolver.invoke(eq("explode"), any())).thenThrow(new AssertionError("boom"));

        AttemptOutcome outcome = executor.executeAttempt(step("explode"), Map.of(), 0, null);

        assertThat(outcome.getFailure()).hasValueSatisfying(cause ->
                assertThat(cause).isInstanceOf(AssertionError.class).hasMessage("boom"));
    }

    @Test
    @DisplayName("Should pass unknown actions through as non-retryable failures")
    void testUnknownAction() throws Exception {
        when(actionResolver.invoke(eq("missing"), any())).thenThrow(new ActionNotFoundException("missing"));

        AttemptOutcome outcome = executor.executeAttempt(step("missing"), Map.of(), 0, null);

        assertThat(outcome.getFailure()).hasValueSatisfying(cause ->
                assertThat(cause).isInstanceOf(ActionNotFoundException.class));
        assertThat(RetryHandler.isRetryable(outcome.getFailure().orElseThrow())).isFalse();
    }

    @Test
    @DisplayName("Should time out a slow action and interrupt it")
    void testTimeout() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        when(actionResolver.invoke(eq("slow"), any())).thenAnswer(invocation -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "too late";
        });

        long start = System.nanoTime();
        AttemptOutcome outcome = executor.executeAttempt(step("slow"), Map.of(), 0, Duration.ofMillis(100));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(outcome.getFailure()).hasValueSatisfying(cause -> {
            assertThat(cause).isInstanceOf(StepTimeoutException.class);
            assertThat(((StepTimeoutException) cause).getTimeout()).isEqualTo(Duration.ofMillis(100));
        });
        assertThat(elapsedMs).isLessThan(5_000);
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Should cancel the action at once when interrupted without a cancel request")
    void testCallerInterrupted() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch actionInterrupted = new CountDownLatch(1);
        when(actionResolver.invoke(eq("block"), any())).thenAnswer(invocation -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                actionInterrupted.countDown();
                throw e;
            }
            return null;
        });

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            CompletableFuture<AttemptOutcome> outcome = new CompletableFuture<>();
            var task = caller.submit(() -> outcome.complete(
                    executor.executeAttempt(step("block"), Map.of(), 0, null)));

            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            task.cancel(true);

            assertThat(outcome.get(5, TimeUnit.SECONDS).getFailure()).hasValueSatisfying(cause ->
                    assertThat(cause).isInstanceOf(StepCancelledException.class));
            assertThat(actionInterrupted.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            caller.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should keep the result of an action that finishes after the workflow is cancelled")
    void testActionFinishesAfterCancel() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        when(actionResolver.invoke(eq("spin"), any())).thenAnswer(invocation -> {
            started.countDown();
            long end = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(300);
            while (System.nanoTime() < end) {
                Thread.onSpinWait();
            }
            return "spun";
        });

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            CompletableFuture<AttemptOutcome> outcome = new CompletableFuture<>();
            var task = caller.submit(() -> outcome.complete(
                    executor.executeAttempt(step("spin"), Map.of(), 0, null)));

            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            controller.requestCancel();
            task.cancel(true);

            AttemptOutcome result = outcome.get(5, TimeUnit.SECONDS);
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getOutput()).isEqualTo("spun");
        } finally {
            caller.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should report cancellation when an action stops on the forwarded interrupt")
    void testActionStopsOnCancel() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch actionInterrupted = new CountDownLatch(1);
        when(actionResolver.invoke(eq("block"), any())).thenAnswer(invocation -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                actionInterrupted.countDown();
                throw e;
            }
            return null;
        });

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            CompletableFuture<AttemptOutcome> outcome = new CompletableFuture<>();
            var task = caller.submit(() -> outcome.complete(
                    executor.executeAttempt(step("block"), Map.of(), 0, null)));

            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            controller.requestCancel();
            task.cancel(true);

            assertThat(actionInterrupted.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(outcome.get(5, TimeUnit.SECONDS).getFailure()).hasValueSatisfying(cause ->
                    assertThat(cause).isInstanceOf(StepCancelledException.class));
        } finally {
            caller.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should stop waiting for a cancelled action on a second interrupt")
    void testSecondInterruptStopsWaiting() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean release = new AtomicBoolean(false);
        when(actionResolver.invoke(eq("stuck"), any())).thenAnswer(invocation -> {
            started.countDown();
            while (!release.get()) {
                Thread.onSpinWait();
            }
            return "released";
        });

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            AtomicReference<Thread> callerThread = new AtomicReference<>();
            CompletableFuture<AttemptOutcome> outcome = new CompletableFuture<>();
            caller.submit(() -> {
                callerThread.set(Thread.currentThread());
                outcome.complete(executor.executeAttempt(step("stuck"), Map.of(), 0, null));
            });

            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            controller.requestCancel();
            callerThread.get().interrupt();

            await().during(200, TimeUnit.MILLISECONDS).atMost(2, TimeUnit.SECONDS)
                    .until(() -> !outcome.isDone());

            callerThread.get().interrupt();
            assertThat(outcome.get(5, TimeUnit.SECONDS).getFailure()).hasValueSatisfying(cause ->
                    assertThat(cause).isInstanceOf(StepCancelledException.class));
        } finally {
            release.set(true);
            caller.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should fail the attempt when the action pool rejects it")
    void testRejectedByPool() {
        actionPool.shutdown();

        AttemptOutcome outcome = executor.executeAttempt(step("any"), Map.of(), 0, null);

        assertThat(outcome.isSuccess()).isFalse();
        verifyNoInteractions(actionResolver);
    }

    private static WorkflowStep step(String action) {
        return WorkflowStep.builder(action + "-step").action(action).build();
    }
}
