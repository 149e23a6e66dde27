package io.pipewright.core;

import io.pipewright.core.backend.mock.StubResponseRegistry;
import io.pipewright.core.visibility.VisibilityPolicy;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Properties;

/// Configuration options for a Pipewright environment.
///
/// ### Default Values
/// - `buildMode`: `ADVISORY`
/// - `visibilityPolicy`: `FILTERED`
/// - `threadPoolSize`: `0` (cached pool; a positive value selects a fixed pool)
/// - `agentTimeout`: none
/// - `stubScenario`: `"default"`
///
/// ### Property Keys
/// | Key | Example |
/// |---|---|
/// | `pipewright.build.mode` | `strict` |
/// | `pipewright.visibility.policy` | `annotate` |
/// | `pipewright.thread.pool.size` | `8` |
/// | `pipewright.agent.timeout` | `PT30S` or `30000` (milliseconds) |
/// | `pipewright.stub.scenario` | `low_score` |
///
/// @implNote **Not thread-safe**. Configure before passing to {@link PipewrightFactory};
/// do not modify after environment creation.
///
/// @see PipewrightFactory#createEnvironment(PipewrightConfig)
public class PipewrightConfig {

    public static final String BUILD_MODE = "pipewright.build.mode";
    public static final String VISIBILITY_POLICY = "pipewright.visibility.policy";
    public static final String THREAD_POOL_SIZE = "pipewright.thread.pool.size";
    public static final String AGENT_TIMEOUT = "pipewright.agent.timeout";
    public static final String STUB_SCENARIO = StubResponseRegistry.SCENARIO_PROPERTY;

    private BuildMode buildMode = BuildMode.ADVISORY;
    private VisibilityPolicy visibilityPolicy = VisibilityPolicy.FILTERED;
    private int threadPoolSize = 0;
    private Duration agentTimeout;
    private String stubScenario = StubResponseRegistry.DEFAULT_SCENARIO;

    public PipewrightConfig() {}

    public BuildMode getBuildMode() {
        return buildMode;
    }

    public void setBuildMode(BuildMode buildMode) {
        this.buildMode = buildMode;
    }

    public VisibilityPolicy getVisibilityPolicy() {
        return visibilityPolicy;
    }

    public void setVisibilityPolicy(VisibilityPolicy visibilityPolicy) {
        this.visibilityPolicy = visibilityPolicy;
    }

    /// Returns the worker pool size for concurrent steps.
    ///
    /// @return fixed pool size, or `0` or less for a cached pool
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    /// Returns the deadline applied to every agent call.
    ///
    /// @return deadline, or null for none
    public Duration getAgentTimeout() {
        return agentTimeout;
    }

    public void setAgentTimeout(Duration agentTimeout) {
        this.agentTimeout = agentTimeout;
    }

    public String getStubScenario() {
        return stubScenario;
    }

    public void setStubScenario(String stubScenario) {
        this.stubScenario = stubScenario;
    }

    /// Applies every recognized `pipewright.*` key found in the properties.
    ///
    /// Unrecognized keys are ignored; keys absent from `properties` keep their current value.
    ///
    /// @param properties source properties, not null
    /// @return this config, never null
    /// @throws IllegalArgumentException if a recognized key has an invalid value
    public PipewrightConfig apply(Properties properties) {
        String mode = properties.getProperty(BUILD_MODE);
        if (mode != null) {
            buildMode = BuildMode.parse(mode);
        }
        String policy = properties.getProperty(VISIBILITY_POLICY);
        if (policy != null) {
            visibilityPolicy = parsePolicy(policy);
        }
        String poolSize = properties.getProperty(THREAD_POOL_SIZE);
        if (poolSize != null) {
            threadPoolSize = parseInt(THREAD_POOL_SIZE, poolSize);
        }
        String timeout = properties.getProperty(AGENT_TIMEOUT);
        if (timeout != null) {
            agentTimeout = timeout.isBlank() ? null : parseDuration(timeout);
        }
        String scenario = properties.getProperty(STUB_SCENARIO);
        if (scenario != null && !scenario.isBlank()) {
            stubScenario = scenario.trim();
        }
        return this;
    }

    /// Creates a config from defaults overlaid with the given properties.
    ///
    /// @param properties source properties, not null
    /// @return new config, never null
    /// @throws IllegalArgumentException if a recognized key has an invalid value
    public static PipewrightConfig fromProperties(Properties properties) {
        return new PipewrightConfig().apply(properties);
    }

    private static VisibilityPolicy parsePolicy(String value) {
        try {
            return VisibilityPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown visibility policy: " + value + ". Available: filtered, transparent, annotate",
                    e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static Duration parseDuration(String value) {
        String trimmed = value.trim();
        Duration duration;
        try {
            duration = trimmed.chars().allMatch(Character::isDigit)
                    ? Duration.ofMillis(Long.parseLong(trimmed))
                    : Duration.parse(trimmed);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration for " + AGENT_TIMEOUT + ": " + value, e);
        }
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(AGENT_TIMEOUT + " must be positive, got " + value);
        }
        return duration;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link PipewrightConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final PipewrightConfig config = new PipewrightConfig();

        public Builder buildMode(BuildMode buildMode) {
            config.buildMode = buildMode;
            return this;
        }

        public Builder visibilityPolicy(VisibilityPolicy visibilityPolicy) {
            config.visibilityPolicy = visibilityPolicy;
            return this;
        }

        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder agentTimeout(Duration agentTimeout) {
            config.agentTimeout = agentTimeout;
            return this;
        }

        public Builder stubScenario(String stubScenario) {
            config.stubScenario = stubScenario;
            return this;
        }

        public PipewrightConfig build() {
            return config;
        }
    }
}
