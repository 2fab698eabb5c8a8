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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    @Test
    void testEmptyGraph() throws WorkflowValidationException {
        DependencyGraph graph = new DependencyGraph(WorkflowDefinition.builder("empty").build());

        graph.validate();
        assertTrue(graph.topologicalOrder().isEmpty());
        assertTrue(graph.readySteps().isEmpty());
        assertFalse(graph.hasPendingWork());
        assertFalse(graph.hasCycles());
    }

    @Test
    void testLinearDependency() throws WorkflowValidationException {
        DependencyGraph graph = graphOf(
                step("step3", "step2"),
                step("step1"),
                step("step2", "step1"));

        graph.validate();
        assertEquals(List.of("step1", "step2", "step3"), ids(graph.topologicalOrder()));
    }

    @Test
    void testParallelSteps() throws WorkflowValidationException {
        DependencyGraph graph = graphOf(
                step("step1"),
                step("step2"),
                step("step3", "step1", "step2"));

        List<String> order = ids(graph.topologicalOrder());
        assertEquals(3, order.size());
        assertEquals("step3", order.get(2));
        assertEquals(Set.of("step1", "step2"), Set.copyOf(order.subList(0, 2)));
    }

    @Test
    void testComplexDependencyGraph() throws WorkflowValidationException {
        // step1 -> step3 -> step5
        // step2 -> step3 -> step5
        // step4 -> step5
        DependencyGraph graph = graphOf(
                step("step1"),
                step("step2"),
                step("step3", "step1", "step2"),
                step("step4"),
                step("step5", "step3", "step4"));

        List<String> order = ids(graph.topologicalOrder());
        assertTrue(order.indexOf("step1") < order.indexOf("step3"));
        assertTrue(order.indexOf("step2") < order.indexOf("step3"));
        assertTrue(order.indexOf("step3") < order.indexOf("step5"));
        assertTrue(order.indexOf("step4") < order.indexOf("step5"));
        assertEquals(Set.of("step3"), graph.getDependents("step1"));
    }

    @Test
    void testTwoStepCycleIsRejected() {
        DependencyGraph graph = graphOf(
                step("A", "B"),
                step("B", "A"));

        CycleDetectedException e = assertThrows(CycleDetectedException.class, graph::validate);
        assertEquals(List.of("A", "B"), e.getStepIds());
        assertTrue(graph.hasCycles());
    }

    @Test
    void testSelfDependencyIsACycle() {
        DependencyGraph graph = graphOf(step("loop", "loop"));

        CycleDetectedException e = assertThrows(CycleDetectedException.class, graph::validate);
        assertEquals(List.of("loop"), e.getStepIds());
    }

    @Test
    void testCycleReportsOnlyUnorderableSteps() {
        DependencyGraph graph = graphOf(
                step("root"),
                step("x", "root", "z"),
                step("y", "x"),
                step("z", "y"));

        CycleDetectedException e = assertThrows(CycleDetectedException.class, graph::topologicalOrder);
        assertEquals(List.of("x", "y", "z"), e.getStepIds());
    }

    @Test
    void testDanglingDependencyIsRejected() {
        DependencyGraph graph = graphOf(
                step("A"),
                step("B", "A", "missing"));

        DanglingDependencyException e = assertThrows(DanglingDependencyException.class, graph::validate);
        assertEquals("B", e.getStepId());
        assertEquals("missing", e.getMissingDependency());
    }

    @Test
    void testDanglingDependencyCheckedBeforeCycles() {
        DependencyGraph graph = graphOf(
                step("A", "B"),
                step("B", "A", "ghost"));

        assertThrows(DanglingDependencyException.class, graph::validate);
    }

    @Test
    void testReadyStepsFollowRuntimeState() {
        DependencyGraph graph = graphOf(
                step("A"),
                step("B"),
                step("C", "A", "B"));

        assertEquals(List.of("A", "B"), ids(graph.readySteps()));

        graph.markInFlight("A");
        assertEquals(List.of("B"), ids(graph.readySteps()));

        graph.markCompleted("A");
        assertEquals(List.of("B"), ids(graph.readySteps()));

        graph.markInFlight("B");
        graph.markCompleted("B");
        assertEquals(List.of("C"), ids(graph.readySteps()));
        assertTrue(graph.hasPendingWork());

        graph.markInFlight("C");
        assertTrue(graph.hasPendingWork(), "in-flight steps are still pending");
        graph.markCompleted("C");
        assertFalse(graph.hasPendingWork());
        assertTrue(graph.unresolvedSteps().isEmpty());
    }

    @Test
    void testFailedDependencyBlocksDependents() {
        DependencyGraph graph = graphOf(
                step("A"),
                step("B"),
                step("C", "A"));

        graph.markInFlight("A");
        graph.markFailed("A");
        graph.markInFlight("B");
        graph.markCompleted("B");

        assertTrue(graph.readySteps().isEmpty());
        assertTrue(graph.hasPendingWork());
        assertEquals(List.of("C"), graph.unresolvedSteps());
    }

    @Test
    void testExplicitStateVariants() {
        DependencyGraph graph = graphOf(
                step("A"),
                step("B", "A"));

        assertEquals(List.of("B"), ids(graph.readySteps(Set.of("A"), Set.of(), Set.of())));
        assertTrue(graph.readySteps(Set.of("A"), Set.of(), Set.of("B")).isEmpty());
        assertFalse(graph.hasPendingWork(Set.of("A"), Set.of("B"), Set.of()));
        assertTrue(graph.hasPendingWork(Set.of("A"), Set.of(), Set.of("B")));
    }

    @Test
    void testReleaseReturnsStepToReady() {
        DependencyGraph graph = graphOf(step("A"));

        graph.markInFlight("A");
        assertTrue(graph.hasInFlight());
        graph.release("A");

        assertFalse(graph.hasInFlight());
        assertEquals(List.of("A"), ids(graph.readySteps()));
    }

    @Test
    void testInvalidTransitions() {
        DependencyGraph graph = graphOf(step("A"));

        assertThrows(IllegalArgumentException.class, () -> graph.markInFlight("unknown"));
        graph.markInFlight("A");
        assertThrows(IllegalStateException.class, () -> graph.markInFlight("A"));
        graph.markCompleted("A");
        assertThrows(IllegalStateException.class, () -> graph.markInFlight("A"));
    }

    private static WorkflowStep step(String id, String... dependencies) {
        return WorkflowStep.builder(id)
                .action("noop")
                .dependsOn(dependencies)
                .build();
    }

    private static DependencyGraph graphOf(WorkflowStep... steps) {
        WorkflowDefinition.Builder builder = WorkflowDefinition.builder("graph-test");
        for (WorkflowStep step : steps) {
            builder.step(step);
        }
        return new DependencyGraph(builder.build());
    }

    private static List<String> ids(List<WorkflowStep> steps) {
        return steps.stream().map(WorkflowStep::getStepId).collect(Collectors.toList());
    }
}
