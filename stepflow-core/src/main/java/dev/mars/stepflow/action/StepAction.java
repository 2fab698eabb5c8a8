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


package dev.mars.stepflow.action;

/**
 * A unit of work executed by a workflow step.
 * <p>
 * Actions should respond to thread interruption: the engine interrupts an action
 * when its attempt times out or when the workflow is cancelled.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface StepAction {

    Object execute(StepInvocation invocation) throws Exception;
}
