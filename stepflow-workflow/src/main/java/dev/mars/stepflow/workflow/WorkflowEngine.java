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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * Submission and query API for workflow executions.
 * <p>
 * Step failures never surface as exceptions from this interface; they are reported through
 * the state of the {@link WorkflowResult}.
 */
public interface WorkflowEngine {

    /**
     * Validates a workflow definition and schedules it for execution.
     *
     * @param definition     the workflow to run
     * @param initialContext variables visible to every step; may be null
     * @return the id of the new execution
     * @throws WorkflowValidationException if the definition has a cycle or a dangling dependency
     * @throws IllegalStateException if the engine has been shut down
     */
    String submit(WorkflowDefinition definition, Map<String, ?> initialContext) throws WorkflowValidationException;

    /**
     * Blocks until the execution reaches a terminal state.
     *
     * @param workflowId the execution id returned by {@link #submit}
     * @return the final result
     * @throws WorkflowNotFoundException if the id is unknown
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    WorkflowResult awaitResult(String workflowId) throws WorkflowNotFoundException, InterruptedException;

    /**
     * Blocks until the execution reaches a terminal state or the timeout elapses.
     *
     * @throws TimeoutException if the execution is still running when the timeout elapses
     */
    WorkflowResult awaitResult(String workflowId, Duration timeout)
            throws WorkflowNotFoundException, InterruptedException, TimeoutException;

    /**
     * A future completed with the final result. Cancelling the returned future does not
     * cancel the workflow; use {@link #cancel(String)}.
     *
     * @throws WorkflowNotFoundException if the id is unknown
     */
    CompletableFuture<WorkflowResult> resultFuture(String workflowId) throws WorkflowNotFoundException;

    /**
     * Submits a workflow and returns a future of its final result. Validation failures
     * complete the future exceptionally.
     *
     * @param definition     the workflow to run
     * @param initialContext variables visible to every step; may be null
     * @return future containing the workflow result
     */
    CompletableFuture<WorkflowResult> execute(WorkflowDefinition definition, Map<String, ?> initialContext);

    /**
     * Requests cancellation. Steps already running are interrupted and reported; no new step starts.
     *
     * @param workflowId the execution id
     * @return true if this call requested cancellation; false if the id is unknown, the execution
     *         has finished, or cancellation was already requested
     */
    boolean cancel(String workflowId);

    /**
     * Current snapshot of an execution.
     *
     * @param workflowId the execution id
     * @return the snapshot, or empty if the id is unknown
     */
    Optional<WorkflowResult> getStatus(String workflowId);

    /**
     * Snapshots of known executions, most recently submitted first.
     *
     * @param state only include executions in this state; null for all
     * @param limit maximum number of results
     */
    List<WorkflowResult> listWorkflows(WorkflowState state, int limit);

    /**
     * Number of executions that are pending or running.
     */
    int getActiveWorkflowCount();

    /**
     * Cancels active executions, stops accepting submissions and releases engine threads.
     *
     * @param timeout how long to wait for running executions to finish
     * @return true if every execution finished within the timeout
     */
    boolean shutdown(Duration timeout);
}
