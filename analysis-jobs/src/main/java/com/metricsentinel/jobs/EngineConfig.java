package com.metricsentinel.jobs;

import com.metricsentinel.core.error.ConfigurationException;

import java.time.Duration;
import java.util.Map;
import java.util.function.Function;

/**
 * Typed, immutable runtime settings for the analysis engine.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so a
 * container or shell environment can tune timeouts and parallelism without a
 * config file. Detection tuning lives in {@code analysis.yml}, see
 * {@link com.metricsentinel.core.config.ConfigLoader}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfig {

    public static final String ENV_QUERY_TIMEOUT_MS = "QUERY_TIMEOUT_MS";
    public static final String ENV_MAX_WORKERS = "MAX_WORKERS";
    public static final String ENV_POLL_INITIAL_BACKOFF_MS = "POLL_INITIAL_BACKOFF_MS";
    public static final String ENV_POLL_MAX_BACKOFF_MS = "POLL_MAX_BACKOFF_MS";

    private final Duration queryTimeout;
    private final int maxWorkers;
    private final Duration pollInitialBackoff;
    private final Duration pollMaxBackoff;

    private EngineConfig(Builder b) {
        this.queryTimeout = b.queryTimeout;
        this.maxWorkers = b.maxWorkers;
        this.pollInitialBackoff = b.pollInitialBackoff;
        this.pollMaxBackoff = b.pollMaxBackoff;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build an {@link EngineConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws ConfigurationException if a value cannot be parsed or is out of
     *                                range
     */
    public static EngineConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Build an {@link EngineConfig} from the given variables.
     */
    public static EngineConfig fromEnvironment(Map<String, String> variables) {
        return fromEnvironment(variables::get);
    }

    private static EngineConfig fromEnvironment(Function<String, String> lookup) {
        try {
            return new Builder()
                    .queryTimeout(Duration.ofMillis(parseLong(lookup, ENV_QUERY_TIMEOUT_MS, "30000")))
                    .maxWorkers(Integer.parseInt(env(lookup, ENV_MAX_WORKERS, "8")))
                    .pollInitialBackoff(Duration.ofMillis(parseLong(lookup, ENV_POLL_INITIAL_BACKOFF_MS, "250")))
                    .pollMaxBackoff(Duration.ofMillis(parseLong(lookup, ENV_POLL_MAX_BACKOFF_MS, "5000")))
                    .build();
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid engine configuration: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public Duration getPollInitialBackoff() {
        return pollInitialBackoff;
    }

    public Duration getPollMaxBackoff() {
        return pollMaxBackoff;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EngineConfig}.
     *
     * <p>
     * {@link #build()} checks that durations are positive, that
     * {@code maxWorkers >= 1}, and that the initial poll backoff does not
     * exceed the maximum.
     * </p>
     */
    public static class Builder {
        private Duration queryTimeout = Duration.ofSeconds(30);
        private int maxWorkers = AbstractAnalysisJob.DEFAULT_MAX_WORKERS;
        private Duration pollInitialBackoff = Duration.ofMillis(250);
        private Duration pollMaxBackoff = Duration.ofSeconds(5);

        public Builder queryTimeout(Duration v) {
            this.queryTimeout = v;
            return this;
        }

        public Builder maxWorkers(int v) {
            this.maxWorkers = v;
            return this;
        }

        public Builder pollInitialBackoff(Duration v) {
            this.pollInitialBackoff = v;
            return this;
        }

        public Builder pollMaxBackoff(Duration v) {
            this.pollMaxBackoff = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link EngineConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public EngineConfig build() {
            requirePositive(queryTimeout, "queryTimeout");
            requirePositive(pollInitialBackoff, "pollInitialBackoff");
            requirePositive(pollMaxBackoff, "pollMaxBackoff");
            if (maxWorkers < 1) {
                throw new IllegalArgumentException("maxWorkers must be >= 1, got: " + maxWorkers);
            }
            if (pollInitialBackoff.compareTo(pollMaxBackoff) > 0) {
                throw new IllegalArgumentException("pollInitialBackoff (" + pollInitialBackoff
                        + ") must not exceed pollMaxBackoff (" + pollMaxBackoff + ")");
            }
            return new EngineConfig(this);
        }

        private static void requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Function<String, String> lookup, String name, String defaultValue) {
        String value = lookup.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static long parseLong(Function<String, String> lookup, String name, String defaultValue) {
        return Long.parseLong(env(lookup, name, defaultValue));
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "queryTimeout=" + queryTimeout +
                ", maxWorkers=" + maxWorkers +
                ", pollInitialBackoff=" + pollInitialBackoff +
                ", pollMaxBackoff=" + pollMaxBackoff +
                '}';
    }
}
