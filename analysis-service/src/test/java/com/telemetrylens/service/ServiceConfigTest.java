package com.telemetrylens.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("Should fall back to defaults when no variables are set")
    void shouldUseDefaults() {
        ServiceConfig config = ServiceConfig.fromEnvironment(Map.of());

        assertThat(config.getConcurrency()).isEqualTo(4);
        assertThat(config.getFetchTimeoutMs()).isEqualTo(30_000);
        assertThat(config.getDefaultMaxResults()).isEqualTo(20);
        assertThat(config.getDefaultInterval()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.getAnalysisWindow()).isEqualTo(Duration.ofHours(1));
        assertThat(config.getSeriesDir()).isEqualTo("./series");
        assertThat(config.getRulesPath()).isEmpty();
        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Should read every setting from the environment")
    void shouldReadVariables() {
        ServiceConfig config = ServiceConfig.fromEnvironment(Map.of(
                "ANALYSIS_CONCURRENCY", "8",
                "FETCH_TIMEOUT_MS", "500",
                "DEFAULT_MAX_RESULTS", "5",
                "DEFAULT_INTERVAL", "1m",
                "ANALYSIS_WINDOW", "2h",
                "SERIES_DIR", "/data/series",
                "ANALYSIS_RULES_PATH", "/etc/lens/rules.yml",
                "HEALTH_PORT", "9090"));

        assertThat(config.getConcurrency()).isEqualTo(8);
        assertThat(config.getFetchTimeoutMs()).isEqualTo(500);
        assertThat(config.getDefaultMaxResults()).isEqualTo(5);
        assertThat(config.getDefaultInterval()).isEqualTo(Duration.ofMinutes(1));
        assertThat(config.getAnalysisWindow()).isEqualTo(Duration.ofHours(2));
        assertThat(config.getSeriesDir()).isEqualTo("/data/series");
        assertThat(config.getRulesPath()).isEqualTo("/etc/lens/rules.yml");
        assertThat(config.getHealthPort()).isEqualTo(9090);
    }

    @Test
    @DisplayName("Should treat blank variables as unset")
    void shouldIgnoreBlankVariables() {
        assertThat(ServiceConfig.fromEnvironment(Map.of("ANALYSIS_CONCURRENCY", "  ")).getConcurrency())
                .isEqualTo(4);
    }

    @Test
    @DisplayName("Should throw IllegalStateException for non-numeric values")
    void shouldRejectNonNumeric() {
        assertThatThrownBy(() -> ServiceConfig.fromEnvironment(Map.of("FETCH_TIMEOUT_MS", "soon")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("numeric");
    }

    @Test
    @DisplayName("Should reject a malformed interval")
    void shouldRejectBadInterval() {
        assertThatThrownBy(() -> ServiceConfig.fromEnvironment(Map.of("DEFAULT_INTERVAL", "5 minutes")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject out-of-range values in the builder")
    void shouldValidateRanges() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().concurrency(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("concurrency");
        assertThatThrownBy(() -> new ServiceConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> new ServiceConfig.Builder().seriesDir(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("seriesDir");
        assertThatThrownBy(() -> new ServiceConfig.Builder().analysisWindow(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("analysisWindow");
    }
}
