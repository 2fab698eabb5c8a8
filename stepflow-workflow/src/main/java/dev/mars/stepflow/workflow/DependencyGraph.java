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

import java.util.*;

/**
 * The steps of one workflow and their dependency edges, together with the runtime state of
 * one execution: which steps are completed, failed or in flight.
 * <p>
 * A graph is built per execution and is not thread-safe; only the coordinator touches it.
 */
public class DependencyGraph {

    private final String workflowName;
    private final Map<String, WorkflowStep> steps;
    private final Map<String, Set<String>> dependencies;
    private final Map<String, Set<String>> dependents;

    private final Set<String> completed = new HashSet<>();
    private final Set<String> failed = new HashSet<>();
    private final Set<String> inFlight = new HashSet<>();

    public DependencyGraph(WorkflowDefinition definition) {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        this.workflowName = definition.getName();
        this.steps = new LinkedHashMap<>();
        this.dependencies = new LinkedHashMap<>();
        this.dependents = new HashMap<>();

        for (WorkflowStep step : definition.getSteps()) {
            steps.put(step.getStepId(), step);
            dependencies.put(step.getStepId(), step.getDependencies());
            dependents.putIfAbsent(step.getStepId(), new LinkedHashSet<>());
        }
        for (WorkflowStep step : definition.getSteps()) {
            for (String dependency : step.getDependencies()) {
                dependents.computeIfAbsent(dependency, k -> new LinkedHashSet<>()).add(step.getStepId());
            }
        }
    }

    /**
     * Checks that every dependency names a step of this workflow and that the graph is acyclic.
     *
     * @throws DanglingDependencyException for the first unknown dependency found
     * @throws CycleDetectedException if some steps can never be ordered
     */
    public void validate() throws WorkflowValidationException {
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            for (String dependency : entry.getValue()) {
                if (!steps.containsKey(dependency)) {
                    throw new DanglingDependencyException(workflowName, entry.getKey(), dependency);
                }
            }
        }
        topologicalOrder();
    }

    /**
     * Orders the steps so that every step follows all of its dependencies (Kahn's algorithm).
     * Ties are broken by declaration order.
     *
     * @throws CycleDetectedException if circular dependencies are detected
     */
    public List<WorkflowStep> topologicalOrder() throws CycleDetectedException {
        Map<String, Integer> inDegree = calculateInDegree();
        Queue<String> queue = new ArrayDeque<>();
        List<WorkflowStep> result = new ArrayList<>();

        // Find all nodes with no incoming edges
        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.offer(entry.getKey());
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            result.add(steps.get(current));

            for (String dependent : getDependents(current)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.offer(dependent);
                }
            }
        }

        if (result.size() != steps.size()) {
            List<String> unordered = new ArrayList<>();
            for (String stepId : steps.keySet()) {
                if (inDegree.get(stepId) > 0) {
                    unordered.add(stepId);
                }
            }
            throw new CycleDetectedException(workflowName, unordered);
        }

        return result;
    }

    public boolean hasCycles() {
        try {
            topologicalOrder();
            return false;
        } catch (CycleDetectedException e) {
            return true;
        }
    }

    /**
     * Steps that can be dispatched now, given this graph's own runtime state.
     */
    public List<WorkflowStep> readySteps() {
        return readySteps(completed, failed, inFlight);
    }

    /**
     * Steps whose dependencies are all in {@code completed} and which are themselves neither
     * completed, failed nor in flight, in declaration order.
     */
    public List<WorkflowStep> readySteps(Set<String> completed, Set<String> failed, Set<String> inFlight) {
        List<WorkflowStep> ready = new ArrayList<>();
        for (WorkflowStep step : steps.values()) {
            String stepId = step.getStepId();
            if (completed.contains(stepId) || failed.contains(stepId) || inFlight.contains(stepId)) {
                continue;
            }
            if (completed.containsAll(dependencies.get(stepId))) {
                ready.add(step);
            }
        }
        return ready;
    }

    public boolean hasPendingWork() {
        return hasPendingWork(completed, failed, inFlight);
    }

    /**
     * True if any step is in neither {@code completed} nor {@code failed}. In-flight steps count as pending.
     */
    public boolean hasPendingWork(Set<String> completed, Set<String> failed, Set<String> inFlight) {
        for (String stepId : steps.keySet()) {
            if (!completed.contains(stepId) && !failed.contains(stepId)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Steps without a verdict yet, in declaration order. Includes in-flight steps.
     */
    public List<String> unresolvedSteps() {
        List<String> unresolved = new ArrayList<>();
        for (String stepId : steps.keySet()) {
            if (!completed.contains(stepId) && !failed.contains(stepId)) {
                unresolved.add(stepId);
            }
        }
        return unresolved;
    }

    public void markInFlight(String stepId) {
        requireKnown(stepId);
        if (completed.contains(stepId) || failed.contains(stepId)) {
            throw new IllegalStateException("Step '" + stepId + "' has already been resolved");
        }
        if (!inFlight.add(stepId)) {
            throw new IllegalStateException("Step '" + stepId + "' is already in flight");
        }
    }

    public void markCompleted(String stepId) {
        requireKnown(stepId);
        inFlight.remove(stepId);
        failed.remove(stepId);
        completed.add(stepId);
    }

    public void markFailed(String stepId) {
        requireKnown(stepId);
        inFlight.remove(stepId);
        completed.remove(stepId);
        failed.add(stepId);
    }

    /**
     * Drops a step from the in-flight set without recording a verdict for it.
     */
    public void release(String stepId) {
        inFlight.remove(stepId);
    }

    public Set<String> getCompleted() {
        return Collections.unmodifiableSet(completed);
    }

    public Set<String> getFailed() {
        return Collections.unmodifiableSet(failed);
    }

    public Set<String> getInFlight() {
        return Collections.unmodifiableSet(inFlight);
    }

    public boolean hasInFlight() {
        return !inFlight.isEmpty();
    }

    public Map<String, WorkflowStep> getSteps() {
        return Collections.unmodifiableMap(steps);
    }

    public Optional<WorkflowStep> getStep(String stepId) {
        return Optional.ofNullable(steps.get(stepId));
    }

    public Set<String> getDependencies(String stepId) {
        return dependencies.getOrDefault(stepId, Set.of());
    }

    public Set<String> getDependents(String stepId) {
        return Collections.unmodifiableSet(dependents.getOrDefault(stepId, Set.of()));
    }

    private Map<String, Integer> calculateInDegree() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            int known = 0;
            for (String dependency : entry.getValue()) {
                if (steps.containsKey(dependency)) {
                    known++;
                }
            }
            inDegree.put(entry.getKey(), known);
        }
        return inDegree;
    }

    private void requireKnown(String stepId) {
        if (!steps.containsKey(stepId)) {
            throw new IllegalArgumentException("Unknown step: " + stepId);
        }
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
               "steps=" + steps.keySet() +
               ", dependencies=" + dependencies +
               ", completed=" + completed +
               ", failed=" + failed +
               ", inFlight=" + inFlight +
               '}';
    }
}
