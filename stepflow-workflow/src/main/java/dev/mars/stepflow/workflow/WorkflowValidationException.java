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

import dev.mars.stepflow.core.exceptions.StepflowException;

/**
 * Exception thrown when a workflow definition is rejected before execution.
 *
 * @since 1.0
 */
public class WorkflowValidationException extends StepflowException {

    private final String workflowName;

    public WorkflowValidationException(String workflowName, String message) {
        super(message);
        this.workflowName = workflowName;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    @Override
    public String getMessage() {
        if (workflowName == null) {
            return super.getMessage();
        }
        return "Workflow '" + workflowName + "': " + super.getMessage();
    }
}
