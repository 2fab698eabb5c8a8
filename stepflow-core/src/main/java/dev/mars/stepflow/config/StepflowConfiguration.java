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

package dev.mars.stepflow.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration management for the Stepflow engine.
 * <p>
 * Values are resolved in this order, later sources overriding earlier ones:
 * built-in defaults, the first readable {@code stepflow.properties} file (working
 * directory, {@code config/}, {@code ~/.stepflow/}, {@code /etc/stepflow/}, then the
 * classpath), and finally system properties starting with {@code stepflow.}.
 *
 * @since 1.0
 */
public class StepflowConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(StepflowConfiguration.class);

    public static final String MAX_CONCURRENT_WORKFLOWS = "stepflow.engine.max.concurrent.workflows";
    public static final String RETAINED_RESULTS = "stepflow.engine.retained.results";
    public static final String SHUTDOWN_TIMEOUT_SECONDS = "stepflow.engine.shutdown.timeout.seconds";
    public static final String MAX_PARALLEL_STEPS = "stepflow.workflow.max.parallel.steps";
    public static final String CONTINUE_ON_ERROR = "stepflow.workflow.continue.on.error";
    public static final String MAX_RETRIES = "stepflow.step.max.retries";
    public static final String RETRY_BASE_DELAY_MS = "stepflow.step.retry.base.delay.ms";
    public static final String RETRY_MAX_DELAY_MS = "stepflow.step.retry.max.delay.ms";
    public static final String RETRY_JITTER = "stepflow.step.retry.jitter";
    public static final String STEP_TIMEOUT_MS = "stepflow.step.timeout.ms";
    public static final String METRICS_ENABLED = "stepflow.monitoring.metrics.enabled";

    // Default configuration values
    private static final int DEFAULT_MAX_CONCURRENT_WORKFLOWS = 10;
    private static final int DEFAULT_RETAINED_RESULTS = 1000;
    private static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final int DEFAULT_MAX_PARALLEL_STEPS = 5;
    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final long DEFAULT_RETRY_BASE_DELAY_MS = 1000;
    private static final long DEFAULT_RETRY_MAX_DELAY_MS = 30000;
    private static final long DEFAULT_STEP_TIMEOUT_MS = 0; // no timeout

    private final Properties properties;

    public StepflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public StepflowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Engine configuration
    public int getMaxConcurrentWorkflows() {
        return getPositiveIntProperty(MAX_CONCURRENT_WORKFLOWS, DEFAULT_MAX_CONCURRENT_WORKFLOWS);
    }

    public int getRetainedResults() {
        return getPositiveIntProperty(RETAINED_RESULTS, DEFAULT_RETAINED_RESULTS);
    }

    public Duration getShutdownTimeout() {
        return Duration.ofSeconds(getLongProperty(SHUTDOWN_TIMEOUT_SECONDS, DEFAULT_SHUTDOWN_TIMEOUT_SECONDS));
    }

    // Workflow defaults
    public int getMaxParallelSteps() {
        return getPositiveIntProperty(MAX_PARALLEL_STEPS, DEFAULT_MAX_PARALLEL_STEPS);
    }

    public boolean isContinueOnError() {
        return getBooleanProperty(CONTINUE_ON_ERROR, false);
    }

    // Step defaults
    public int getMaxRetries() {
        int value = getIntProperty(MAX_RETRIES, DEFAULT_MAX_RETRIES);
        if (value < 0) {
            logger.warn("Negative value for property {}: {}. Using default: {}", MAX_RETRIES, value, DEFAULT_MAX_RETRIES);
            return DEFAULT_MAX_RETRIES;
        }
        return value;
    }

    public Duration getRetryBaseDelay() {
        return Duration.ofMillis(Math.max(0, getLongProperty(RETRY_BASE_DELAY_MS, DEFAULT_RETRY_BASE_DELAY_MS)));
    }

    /**
     * The backoff ceiling. Never shorter than {@link #getRetryBaseDelay()}.
     */
    public Duration getRetryMaxDelay() {
        Duration max = Duration.ofMillis(Math.max(0, getLongProperty(RETRY_MAX_DELAY_MS, DEFAULT_RETRY_MAX_DELAY_MS)));
        Duration base = getRetryBaseDelay();
        return max.compareTo(base) < 0 ? base : max;
    }

    public boolean isRetryJitterEnabled() {
        return getBooleanProperty(RETRY_JITTER, false);
    }

    /**
     * Default per-attempt timeout; empty when {@code stepflow.step.timeout.ms} is zero or negative.
     */
    public Optional<Duration> getStepTimeout() {
        long millis = getLongProperty(STEP_TIMEOUT_MS, DEFAULT_STEP_TIMEOUT_MS);
        return millis > 0 ? Optional.of(Duration.ofMillis(millis)) : Optional.empty();
    }

    // Monitoring configuration
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private int getPositiveIntProperty(String key, int defaultValue) {
        int value = getIntProperty(key, defaultValue);
        if (value < 1) {
            logger.warn("Non-positive value for property {}: {}. Using default: {}", key, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(MAX_CONCURRENT_WORKFLOWS, String.valueOf(DEFAULT_MAX_CONCURRENT_WORKFLOWS));
        properties.setProperty(RETAINED_RESULTS, String.valueOf(DEFAULT_RETAINED_RESULTS));
        properties.setProperty(SHUTDOWN_TIMEOUT_SECONDS, String.valueOf(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS));
        properties.setProperty(MAX_PARALLEL_STEPS, String.valueOf(DEFAULT_MAX_PARALLEL_STEPS));
        properties.setProperty(CONTINUE_ON_ERROR, "false");
        properties.setProperty(MAX_RETRIES, String.valueOf(DEFAULT_MAX_RETRIES));
        properties.setProperty(RETRY_BASE_DELAY_MS, String.valueOf(DEFAULT_RETRY_BASE_DELAY_MS));
        properties.setProperty(RETRY_MAX_DELAY_MS, String.valueOf(DEFAULT_RETRY_MAX_DELAY_MS));
        properties.setProperty(RETRY_JITTER, "false");
        properties.setProperty(STEP_TIMEOUT_MS, String.valueOf(DEFAULT_STEP_TIMEOUT_MS));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "stepflow.properties",
                "config/stepflow.properties",
                System.getProperty("user.home") + "/.stepflow/stepflow.properties",
                "/etc/stepflow/stepflow.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("stepflow.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("stepflow."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "StepflowConfiguration{" +
                "maxConcurrentWorkflows=" + getMaxConcurrentWorkflows() +
                ", maxParallelSteps=" + getMaxParallelSteps() +
                ", maxRetries=" + getMaxRetries() +
                ", retryBaseDelay=" + getRetryBaseDelay() +
                ", retryMaxDelay=" + getRetryMaxDelay() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
