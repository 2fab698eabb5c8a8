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

import dev.mars.stepflow.config.StepflowConfiguration;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named, immutable collection of steps plus the workflow-level execution policy.
 * <p>
 * The builder checks local well-formedness (unique step ids, sane limits). Graph-level
 * checks, missing dependencies and cycles, happen when the workflow is submitted.
 *
 * @since 1.0
 */
public final class WorkflowDefinition {

    static final int DEFAULT_MAX_PARALLEL_STEPS = 5;
    static final String DEFAULT_VERSION = "1.0.0";

    private final String name;
    private final String description;
    private final String version;
    private final Map<String, String> metadata;
    private final List<WorkflowStep> steps;
    private final Map<String, WorkflowStep> stepsById;
    private final boolean continueOnError;
    private final int maxParallelSteps;

    private WorkflowDefinition(Builder builder, Map<String, WorkflowStep> stepsById) {
        this.name = builder.name;
        this.description = builder.description;
        this.version = builder.version;
        this.metadata = Map.copyOf(builder.metadata);
        this.steps = List.copyOf(builder.steps);
        this.stepsById = Collections.unmodifiableMap(stepsById);
        this.continueOnError = builder.continueOnError;
        this.maxParallelSteps = builder.maxParallelSteps;
    }

    public String getName() {
        return name;
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public String getVersion() {
        return version;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    /**
     * Steps in declaration order.
     */
    public List<WorkflowStep> getSteps() {
        return steps;
    }

    public Optional<WorkflowStep> getStep(String stepId) {
        return Optional.ofNullable(stepsById.get(stepId));
    }

    public int getStepCount() {
        return steps.size();
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public int getMaxParallelSteps() {
        return maxParallelSteps;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Creates a builder whose execution policy starts from the configured defaults.
     */
    public static Builder builder(String name, StepflowConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        return new Builder(name)
                .continueOnError(configuration.isContinueOnError())
                .maxParallelSteps(configuration.getMaxParallelSteps());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return continueOnError == that.continueOnError &&
               maxParallelSteps == that.maxParallelSteps &&
               Objects.equals(name, that.name) &&
               Objects.equals(description, that.description) &&
               Objects.equals(version, that.version) &&
               Objects.equals(metadata, that.metadata) &&
               Objects.equals(steps, that.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, version, metadata, steps, continueOnError, maxParallelSteps);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "name='" + name + '\'' +
               ", version='" + version + '\'' +
               ", steps=" + stepsById.keySet() +
               ", continueOnError=" + continueOnError +
               ", maxParallelSteps=" + maxParallelSteps +
               '}';
    }

    /**
     * Builder for WorkflowDefinition.
     */
    public static class Builder {
        private final String name;
        private String description;
        private String version = DEFAULT_VERSION;
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private final List<WorkflowStep> steps = new ArrayList<>();
        private boolean continueOnError = false;
        private int maxParallelSteps = DEFAULT_MAX_PARALLEL_STEPS;

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder metadata(String key, String value) {
            metadata.put(Objects.requireNonNull(key, "Metadata key cannot be null"),
                    Objects.requireNonNull(value, "Metadata value cannot be null"));
            return this;
        }

        public Builder step(WorkflowStep step) {
            steps.add(Objects.requireNonNull(step, "Step cannot be null"));
            return this;
        }

        public Builder steps(Collection<WorkflowStep> steps) {
            steps.forEach(this::step);
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder maxParallelSteps(int maxParallelSteps) {
            this.maxParallelSteps = maxParallelSteps;
            return this;
        }

        public WorkflowDefinition build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Workflow name cannot be null or blank");
            }
            if (maxParallelSteps < 1) {
                throw new IllegalArgumentException("Workflow '" + name + "' max parallel steps must be at least 1: "
                        + maxParallelSteps);
            }
            Objects.requireNonNull(version, "Version cannot be null");

            Map<String, WorkflowStep> stepsById = new LinkedHashMap<>();
            for (WorkflowStep step : steps) {
                if (stepsById.putIfAbsent(step.getStepId(), step) != null) {
                    throw new IllegalArgumentException("Workflow '" + name + "' declares step '"
                            + step.getStepId() + "' more than once");
                }
            }
            return new WorkflowDefinition(this, stepsById);
        }
    }
}
