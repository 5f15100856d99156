package com.telemetrylens.service;

import com.telemetrylens.core.config.AnalysisRulesLoader;
import com.telemetrylens.core.model.Intervals;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the Telemetry Lens service.
 *
 * <p>
 * Values are resolved from environment variables, with defaults for
 * anything unset.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Fan-out
    // ---------------------------------------------------------------
    private final int concurrency;
    private final long fetchTimeoutMs;

    // ---------------------------------------------------------------
    // Request defaults
    // ---------------------------------------------------------------
    private final int defaultMaxResults;
    private final Duration defaultInterval;
    private final Duration analysisWindow;

    // ---------------------------------------------------------------
    // Sources and rules
    // ---------------------------------------------------------------
    private final String seriesDir;
    private final String rulesPath;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private ServiceConfig(Builder b) {
        this.concurrency = b.concurrency;
        this.fetchTimeoutMs = b.fetchTimeoutMs;
        this.defaultMaxResults = b.defaultMaxResults;
        this.defaultInterval = b.defaultInterval;
        this.analysisWindow = b.analysisWindow;
        this.seriesDir = b.seriesDir;
        this.rulesPath = b.rulesPath;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link ServiceConfig} from the given variables.
     */
    static ServiceConfig fromEnvironment(Map<String, String> env) {
        try {
            return new Builder()
                    .concurrency(Integer.parseInt(env(env, "ANALYSIS_CONCURRENCY", "4")))
                    .fetchTimeoutMs(Long.parseLong(env(env, "FETCH_TIMEOUT_MS", "30000")))
                    .defaultMaxResults(Integer.parseInt(env(env, "DEFAULT_MAX_RESULTS", "20")))
                    .defaultInterval(Intervals.parse(env(env, "DEFAULT_INTERVAL", "5m")))
                    .analysisWindow(Intervals.parse(env(env, "ANALYSIS_WINDOW", "1h")))
                    .seriesDir(env(env, "SERIES_DIR", "./series"))
                    .rulesPath(env(env, AnalysisRulesLoader.ENV_RULES_PATH, ""))
                    .healthPort(Integer.parseInt(env(env, "HEALTH_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /** Maximum number of rules analysed at the same time. */
    public int getConcurrency() {
        return concurrency;
    }

    public long getFetchTimeoutMs() {
        return fetchTimeoutMs;
    }

    public int getDefaultMaxResults() {
        return defaultMaxResults;
    }

    public Duration getDefaultInterval() {
        return defaultInterval;
    }

    /** Length of the range checked for anomalies, ending now. */
    public Duration getAnalysisWindow() {
        return analysisWindow;
    }

    public String getSeriesDir() {
        return seriesDir;
    }

    public String getRulesPath() {
        return rulesPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (concurrency &gt; 0, timeout &gt; 0, port in [1, 65535],
     * positive durations, non-blank series directory).
     * </p>
     */
    public static class Builder {
        private int concurrency = 4;
        private long fetchTimeoutMs = 30_000;
        private int defaultMaxResults = 20;
        private Duration defaultInterval = Duration.ofMinutes(5);
        private Duration analysisWindow = Duration.ofHours(1);
        private String seriesDir = "./series";
        private String rulesPath = "";
        private int healthPort = 8080;

        public Builder concurrency(int v) {
            this.concurrency = v;
            return this;
        }

        public Builder fetchTimeoutMs(long v) {
            this.fetchTimeoutMs = v;
            return this;
        }

        public Builder defaultMaxResults(int v) {
            this.defaultMaxResults = v;
            return this;
        }

        public Builder defaultInterval(Duration v) {
            this.defaultInterval = v;
            return this;
        }

        public Builder analysisWindow(Duration v) {
            this.analysisWindow = v;
            return this;
        }

        public Builder seriesDir(String v) {
            this.seriesDir = v;
            return this;
        }

        public Builder rulesPath(String v) {
            this.rulesPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            requireNonBlank(seriesDir, "seriesDir");
            requirePositive(defaultInterval, "defaultInterval");
            requirePositive(analysisWindow, "analysisWindow");

            if (concurrency < 1) {
                throw new IllegalArgumentException("concurrency must be >= 1, got: " + concurrency);
            }
            if (fetchTimeoutMs < 1) {
                throw new IllegalArgumentException("fetchTimeoutMs must be >= 1, got: " + fetchTimeoutMs);
            }
            if (defaultMaxResults < 1) {
                throw new IllegalArgumentException(
                        "defaultMaxResults must be >= 1, got: " + defaultMaxResults);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (rulesPath == null) {
                rulesPath = "";
            }

            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " must not be null");
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "concurrency=" + concurrency +
                ", fetchTimeoutMs=" + fetchTimeoutMs +
                ", defaultMaxResults=" + defaultMaxResults +
                ", defaultInterval=" + defaultInterval +
                ", analysisWindow=" + analysisWindow +
                ", seriesDir='" + seriesDir + '\'' +
                ", rulesPath='" + rulesPath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
