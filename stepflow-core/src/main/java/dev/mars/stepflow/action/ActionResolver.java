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
 * Resolves a step's action reference to executable code and invokes it.
 * <p>
 * The engine depends only on this interface. Implementations must be safe for
 * concurrent use and must not change their mappings while a workflow is running.
 *
 * @since 1.0
 */
public interface ActionResolver {

    /**
     * Invokes the action registered under {@code actionRef}.
     *
     * @param actionRef  the opaque action reference declared by the step
     * @param invocation the step id, attempt number, parameters and context snapshot
     * @return the action output, may be null
     * @throws dev.mars.stepflow.core.exceptions.ActionNotFoundException if nothing is registered under the reference
     * @throws Exception any failure raised by the action itself
     */
    Object invoke(String actionRef, StepInvocation invocation) throws Exception;
}
