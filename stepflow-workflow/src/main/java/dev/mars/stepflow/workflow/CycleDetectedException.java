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

import java.util.List;

/**
 * The dependency relation of a workflow contains a cycle. A step depending on itself counts.
 */
public class CycleDetectedException extends WorkflowValidationException {

    private final List<String> stepIds;

    public CycleDetectedException(String workflowName, List<String> stepIds) {
        super(workflowName, "Circular dependency detected among steps: " + stepIds);
        this.stepIds = List.copyOf(stepIds);
    }

    /**
     * Steps that could not be ordered: every member of a cycle plus anything downstream of one.
     */
    public List<String> getStepIds() {
        return stepIds;
    }
}
