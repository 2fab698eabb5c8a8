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

import dev.mars.stepflow.core.exceptions.ActionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-based {@link ActionResolver}. Each engine gets its own registry instance;
 * there is no process-wide registry.
 *
 * <pre>{@code
 * ActionRegistry registry = new ActionRegistry()
 *         .register("fetch", invocation -> http.get(invocation.getParameters().get("url")))
 *         .register("store", invocation -> repository.save(invocation.getOutput("fetch", String.class)));
 * }</pre>
 *
 * @since 1.0
 */
public class ActionRegistry implements ActionResolver {

    private static final Logger logger = LoggerFactory.getLogger(ActionRegistry.class);

    private final Map<String, StepAction> actions = new ConcurrentHashMap<>();

    /**
     * Registers an action, replacing any action already registered under the same name.
     *
     * @return this registry, for chaining
     */
    public ActionRegistry register(String name, StepAction action) {
        Objects.requireNonNull(name, "Action name cannot be null");
        Objects.requireNonNull(action, "Action cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Action name cannot be blank");
        }
        StepAction previous = actions.put(name, action);
        if (previous != null) {
            logger.warn("Action '{}' was already registered and has been replaced", name);
        } else {
            logger.debug("Registered action '{}'", name);
        }
        return this;
    }

    public boolean unregister(String name) {
        return actions.remove(name) != null;
    }

    public boolean contains(String name) {
        return actions.containsKey(name);
    }

    public Set<String> getActionNames() {
        return Set.copyOf(actions.keySet());
    }

    @Override
    public Object invoke(String actionRef, StepInvocation invocation) throws Exception {
        StepAction action = actionRef == null ? null : actions.get(actionRef);
        if (action == null) {
            throw new ActionNotFoundException(actionRef);
        }
        return action.execute(invocation);
    }

    @Override
    public String toString() {
        return "ActionRegistry{actions=" + actions.keySet() + '}';
    }
}
