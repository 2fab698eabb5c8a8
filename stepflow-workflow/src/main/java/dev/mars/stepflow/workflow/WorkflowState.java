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

/**
 * Enumeration of workflow execution states.
 */
public enum WorkflowState {

    /**
     * Workflow has been accepted and is waiting for a coordinator thread.
     */
    PENDING,

    /**
     * Workflow is currently running.
     */
    RUNNING,

    /**
     * Every step completed successfully.
     */
    COMPLETED,

    /**
     * The workflow was aborted after a step failure, or no step succeeded.
     */
    FAILED,

    /**
     * Some steps failed or were skipped while others completed.
     */
    PARTIAL_FAILURE,

    /**
     * Pending steps remained but none could ever become ready, and no step was attempted.
     */
    DEADLOCKED,

    /**
     * Workflow execution was cancelled.
     */
    CANCELLED;

    /**
     * Checks if the state represents a terminal state.
     */
    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    /**
     * Checks if the state represents an active state.
     */
    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }

    /**
     * Checks if the state represents a successful completion.
     */
    public boolean isSuccessful() {
        return this == COMPLETED;
    }
}
