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
import dev.mars.stepflow.core.exceptions.NonRetryableStepException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ActionRegistry Tests")
class ActionRegistryTest {

    private ActionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ActionRegistry();
    }

    @Test
    @DisplayName("Should invoke registered action with the invocation")
    void testInvokeRegisteredAction() throws Exception {
        registry.register("greet", invocation ->
                "hello " + invocation.getParameters().get("name") + " from " + invocation.getStepId());

        StepInvocation invocation = new StepInvocation("wf-1", "say-hello", 0,
                Map.of("name", "world"), Map.of());

        assertThat(registry.invoke("greet", invocation)).isEqualTo("hello world from say-hello");
    }

    @Test
    @DisplayName("Should fail with ActionNotFoundException for unknown action")
    void testUnknownAction() {
        StepInvocation invocation = new StepInvocation("wf-1", "step", 0, Map.of(), Map.of());

        assertThatThrownBy(() -> registry.invoke("missing", invocation))
                .isInstanceOf(ActionNotFoundException.class)
                .isInstanceOf(NonRetryableStepException.class)
                .hasMessageContaining("missing");
    }

    @Test
    @DisplayName("Should treat null action reference as unknown")
    void testNullActionRef() {
        StepInvocation invocation = new StepInvocation("wf-1", "step", 0, Map.of(), Map.of());

        assertThatThrownBy(() -> registry.invoke(null, invocation))
                .isInstanceOf(ActionNotFoundException.class);
    }

    @Test
    @DisplayName("Should replace and unregister actions")
    void testReplaceAndUnregister() throws Exception {
        registry.register("op", invocation -> 1);
        registry.register("op", invocation -> 2);

        StepInvocation invocation = new StepInvocation("wf-1", "step", 0, Map.of(), Map.of());
        assertThat(registry.invoke("op", invocation)).isEqualTo(2);
        assertThat(registry.getActionNames()).containsExactly("op");

        assertThat(registry.unregister("op")).isTrue();
        assertThat(registry.unregister("op")).isFalse();
        assertThat(registry.contains("op")).isFalse();
    }

    @Test
    @DisplayName("Should reject blank names and null actions")
    void testRejectsInvalidRegistration() {
        assertThatThrownBy(() -> registry.register(" ", invocation -> null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register("op", null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Invocation exposes read-only snapshots that tolerate null values")
    void testInvocationSnapshots() {
        Map<String, Object> context = new HashMap<>();
        context.put("upstream", "payload");
        context.put("empty", null);

        StepInvocation invocation = new StepInvocation("wf-1", "step", 2, null, context);
        context.put("late", "ignored");

        assertThat(invocation.getAttempt()).isEqualTo(2);
        assertThat(invocation.getParameters()).isEmpty();
        assertThat(invocation.getContext()).containsOnlyKeys("upstream", "empty");
        assertThat(invocation.getOutput("upstream", String.class)).isEqualTo("payload");
        assertThat(invocation.getContextValue("empty")).isEmpty();
        assertThatThrownBy(() -> invocation.getContext().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Invocation rejects negative attempt numbers")
    void testInvocationRejectsNegativeAttempt() {
        assertThatThrownBy(() -> new StepInvocation("wf-1", "step", -1, Map.of(), Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
