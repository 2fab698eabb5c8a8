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

import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable unit of work within a workflow: an action reference, the steps it
 * depends on, and its retry and timeout policy.
 *
 * @since 1.0
 */
public final class WorkflowStep {

    static final int DEFAULT_MAX_RETRIES = 3;
    static final Duration DEFAULT_RETRY_BASE_DELAY = Duration.ofSeconds(1);
    static final Duration DEFAULT_RETRY_MAX_DELAY = Duration.ofSeconds(30);

    private final String stepId;
    private final String name;
    private final String actionRef;
    private final Set<String> dependencies;
    private final int maxRetries;
    private final Duration retryBaseDelay;
    private final Duration retryMaxDelay;
    private final Duration timeout;
    private final Map<String, Object> parameters;

    private WorkflowStep(Builder builder) {
        this.stepId = builder.stepId;
        this.name = builder.name != null ? builder.name : builder.stepId;
        this.actionRef = builder.actionRef;
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(builder.dependencies));
        this.maxRetries = builder.maxRetries;
        this.retryBaseDelay = builder.retryBaseDelay;
        this.retryMaxDelay = builder.retryMaxDelay;
        this.timeout = builder.timeout;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
    }

    public String getStepId() {
        return stepId;
    }

    public String getName() {
        return name;
    }

    public String getActionRef() {
        return actionRef;
    }

    public Set<String> getDependencies() {
        return dependencies;
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration getRetryMaxDelay() {
        return retryMaxDelay;
    }

    /**
     * Per-attempt timeout. Empty means an attempt may run indefinitely.
     */
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public static Builder builder(String stepId) {
        return new Builder(stepId);
    }

    /**
     * Creates a builder whose retry and timeout settings start from the configured defaults.
     */
    public static Builder builder(String stepId, StepflowConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        return new Builder(stepId)
                .maxRetries(configuration.getMaxRetries())
                .retryBaseDelay(configuration.getRetryBaseDelay())
                .retryMaxDelay(configuration.getRetryMaxDelay())
                .timeout(configuration.getStepTimeout().orElse(null));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowStep that = (WorkflowStep) o;
        return maxRetries == that.maxRetries &&
               Objects.equals(stepId, that.stepId) &&
               Objects.equals(name, that.name) &&
               Objects.equals(actionRef, that.actionRef) &&
               Objects.equals(dependencies, that.dependencies) &&
               Objects.equals(retryBaseDelay, that.retryBaseDelay) &&
               Objects.equals(retryMaxDelay, that.retryMaxDelay) &&
               Objects.equals(timeout, that.timeout) &&
               Objects.equals(parameters, that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepId, name, actionRef, dependencies, maxRetries,
                retryBaseDelay, retryMaxDelay, timeout, parameters);
    }

    @Override
    public String toString() {
        return "WorkflowStep{" +
               "stepId='" + stepId + '\'' +
               ", actionRef='" + actionRef + '\'' +
               ", dependencies=" + dependencies +
               ", maxRetries=" + maxRetries +
               ", timeout=" + timeout +
               '}';
    }

    /**
     * Builder for WorkflowStep.
     */
    public static class Builder {
        private final String stepId;
        private String name;
        private String actionRef;
        private final Set<String> dependencies = new LinkedHashSet<>();
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration retryBaseDelay = DEFAULT_RETRY_BASE_DELAY;
        private Duration retryMaxDelay = DEFAULT_RETRY_MAX_DELAY;
        private Duration timeout;
        private final Map<String, Object> parameters = new LinkedHashMap<>();

        private Builder(String stepId) {
            this.stepId = stepId;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder action(String actionRef) {
            this.actionRef = actionRef;
            return this;
        }

        public Builder dependsOn(String... stepIds) {
            return dependsOn(Arrays.asList(stepIds));
        }

        public Builder dependsOn(Collection<String> stepIds) {
            for (String id : stepIds) {
                dependencies.add(Objects.requireNonNull(id, "Dependency ID cannot be null"));
            }
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryBaseDelay(Duration retryBaseDelay) {
            this.retryBaseDelay = retryBaseDelay;
            return this;
        }

        public Builder retryMaxDelay(Duration retryMaxDelay) {
            this.retryMaxDelay = retryMaxDelay;
            return this;
        }

        /**
         * Sets both backoff bounds at once.
         */
        public Builder retryDelays(Duration base, Duration max) {
            this.retryBaseDelay = base;
            this.retryMaxDelay = max;
            return this;
        }

        /**
         * Per-attempt timeout; {@code null} removes it.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder parameter(String key, Object value) {
            parameters.put(Objects.requireNonNull(key, "Parameter name cannot be null"), value);
            return this;
        }

        public Builder parameters(Map<String, ?> values) {
            values.forEach(this::parameter);
            return this;
        }

        public WorkflowStep build() {
            if (stepId == null || stepId.isBlank()) {
                throw new IllegalArgumentException("Step ID cannot be null or blank");
            }
            if (actionRef == null || actionRef.isBlank()) {
                throw new IllegalArgumentException("Step '" + stepId + "' must declare an action");
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Step '" + stepId + "' max retries cannot be negative: " + maxRetries);
            }
            Objects.requireNonNull(retryBaseDelay, "Retry base delay cannot be null");
            Objects.requireNonNull(retryMaxDelay, "Retry max delay cannot be null");
            if (retryBaseDelay.isNegative()) {
                throw new IllegalArgumentException("Step '" + stepId + "' retry base delay cannot be negative");
            }
            if (retryMaxDelay.compareTo(retryBaseDelay) < 0) {
                throw new IllegalArgumentException("Step '" + stepId + "' retry max delay " + retryMaxDelay +
                        " is shorter than base delay " + retryBaseDelay);
            }
            if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
                throw new IllegalArgumentException("Step '" + stepId + "' timeout must be positive: " + timeout);
            }
            return new WorkflowStep(this);
        }
    }
}
