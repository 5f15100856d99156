package com.telemetrylens.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetrylens.core.error.ErrorKind;
import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.model.AnalysisRule;
import com.telemetrylens.core.model.Anomaly;
import com.telemetrylens.core.model.AnomalyDirection;
import com.telemetrylens.core.model.ThresholdKind;
import com.telemetrylens.core.model.ThresholdSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReportWriter}.
 */
class ReportWriterTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final ReportWriter writer = new ReportWriter();
    private final ObjectMapper reader = new ObjectMapper();

    @Test
    @DisplayName("Should round doubles to two decimals, half up")
    void shouldRoundDoubles() throws Exception {
        Anomaly anomaly = Anomaly.builder()
                .series("latency")
                .timestamp(T0)
                .observedValue(12.345)
                .expectedValue(1.005)
                .deviationScore(3.14159)
                .thresholdKind(ThresholdKind.ZSCORE)
                .threshold(10)
                .direction(AnomalyDirection.SPIKE)
                .build();

        JsonNode json = reader.readTree(writer.write(anomaly));

        assertThat(json.get("observedValue").asDouble()).isEqualTo(12.35);
        assertThat(json.get("expectedValue").asDouble()).isEqualTo(1.01);
        assertThat(json.get("deviationScore").asDouble()).isEqualTo(3.14);
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(json.get("thresholdKind").asText()).isEqualTo("zscore");
        assertThat(json.has("context")).isFalse();
    }

    @Test
    @DisplayName("Should write an infinite threshold as a string")
    void shouldWriteInfinityAsString() throws Exception {
        ThresholdSpec spec = new ThresholdSpec(ThresholdKind.ZSCORE, Double.POSITIVE_INFINITY,
                "mean + 3 stddev (none, baseline has no spread)");

        JsonNode json = reader.readTree(writer.write(spec));

        assertThat(json.get("value").isTextual()).isTrue();
        assertThat(json.get("value").asText()).isEqualTo("Infinity");
    }

    @Test
    @DisplayName("Should render a failed rule with status and detail but no report")
    void shouldRenderFailedRule() throws Exception {
        AnalysisRule rule = new AnalysisRule();
        rule.setName("disk_usage");
        RuleOutcome outcome = new RuleOutcome(rule,
                Outcome.failure(ErrorKind.SOURCE_UNAVAILABLE, "No series file for 'disk'"));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writer.write(List.of(outcome), out);
        JsonNode json = reader.readTree(out.toString(StandardCharsets.UTF_8)).get(0);

        assertThat(json.get("rule").asText()).isEqualTo("disk_usage");
        assertThat(json.get("status").asText()).isEqualTo("source_unavailable");
        assertThat(json.get("detail").asText()).contains("disk");
        assertThat(json.has("report")).isFalse();
    }

    @Test
    @DisplayName("Should round half up rather than to even")
    void shouldRoundHalfUp() {
        assertThat(ReportWriter.round(2.675)).isEqualTo(2.68);
        assertThat(ReportWriter.round(-1.005)).isEqualTo(-1.01);
        assertThat(ReportWriter.round(7)).isEqualTo(7.0);
    }
}
