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
 * A step depends on a step id that is not part of the same workflow.
 */
public class DanglingDependencyException extends WorkflowValidationException {

    private final String stepId;
    private final String missingDependency;

    public DanglingDependencyException(String workflowName, String stepId, String missingDependency) {
        super(workflowName, "Step '" + stepId + "' depends on unknown step '" + missingDependency + "'");
        this.stepId = stepId;
        this.missingDependency = missingDependency;
    }

    public String getStepId() {
        return stepId;
    }

    public String getMissingDependency() {
        return missingDependency;
    }
}
