package com.telemetrylens.core.config;

import com.telemetrylens.core.error.InvalidParameterException;
import com.telemetrylens.core.model.AnalysisRule;
import com.telemetrylens.core.model.MetricKind;
import com.telemetrylens.core.model.ThresholdKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisRulesLoader}.
 */
class AnalysisRulesLoaderTest {

    @Test
    @DisplayName("Should load test rules from classpath")
    void shouldLoadFromClasspath() {
        AnalysisRulesConfig config = AnalysisRulesLoader.fromClasspath("test-analysis-rules.yml");

        assertThat(config.getRules()).hasSize(5);
        assertThat(config.getRules()).extracting(AnalysisRule::getType)
                .containsExactly("metric", "metric", "frequency", "pattern", "cardinality");

        AnalysisRule latency = config.getRules().get(0);
        assertThat(latency.getName()).isEqualTo("test_latency");
        assertThat(latency.metricKind()).isEqualTo(MetricKind.HISTOGRAM);
        assertThat(latency.thresholdKind()).isEqualTo(ThresholdKind.PERCENTILE);
        assertThat(latency.getThresholdValue()).isEqualTo(99.0);
        assertThat(latency.lookbackDuration()).isEqualTo(Duration.ofHours(6));

        AnalysisRule requests = config.getRules().get(1);
        assertThat(requests.thresholdKind()).isEqualTo(ThresholdKind.RATE_OF_CHANGE);
        assertThat(requests.getMaxResults()).isEqualTo(20);

        assertThat(config.getRules().get(3).getSpikeMultiplier()).isEqualTo(4.0);
        assertThat(config.getRules().get(4).seasonalPeriodDuration()).isEqualTo(Duration.ofDays(1));
    }

    @Test
    @DisplayName("Should report every invalid rule in one exception")
    void shouldReportAllInvalidRules() {
        assertThatThrownBy(() -> AnalysisRulesLoader.fromClasspath("invalid-analysis-rules.yml"))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("'fixed' requires a value")
                .hasMessageContaining("only valid for counter metrics");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> AnalysisRulesLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load rules from a file path and fall back to the classpath default")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("rules.yml");
        Files.writeString(file, """
                rules:
                  - name: cpu
                    type: metric
                    target: system.cpu.usage
                    threshold: mad
                """);

        AnalysisRulesConfig config = AnalysisRulesLoader.load(file.toString());

        assertThat(config.getRules()).singleElement()
                .satisfies(rule -> assertThat(rule.thresholdKind()).isEqualTo(ThresholdKind.MAD));
        assertThatThrownBy(() -> AnalysisRulesLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject duplicate rule names")
    void shouldRejectDuplicateNames(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("dup.yml");
        Files.writeString(file, """
                rules:
                  - name: same
                    type: frequency
                  - name: same
                    type: frequency
                """);

        assertThatThrownBy(() -> AnalysisRulesLoader.fromFile(file.toString()))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("Duplicate rule name: 'same'");
    }

    @Test
    @DisplayName("Should return an empty configuration for a file without rules")
    void shouldAcceptEmptyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "rules: []\n");

        assertThat(AnalysisRulesLoader.fromFile(file.toString()).getRules()).isEmpty();
    }
}
