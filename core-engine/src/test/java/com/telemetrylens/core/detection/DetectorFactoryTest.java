package com.telemetrylens.core.detection;

import com.telemetrylens.core.error.InvalidParameterException;
import com.telemetrylens.core.model.AnalysisRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    @Test
    @DisplayName("Should create the detector matching each rule type")
    void shouldCreateDetectorPerType() {
        assertThat(DetectorFactory.create(rule("metric"))).isInstanceOf(MetricAnomalyDetector.class);
        assertThat(DetectorFactory.create(rule("frequency"))).isInstanceOf(FrequencyDetector.class);
        assertThat(DetectorFactory.create(rule("PATTERN"))).isInstanceOf(PatternDetector.class);
        assertThat(DetectorFactory.create(rule("cardinality"))).isInstanceOf(CardinalityDetector.class);
    }

    @Test
    @DisplayName("Should create one detector per rule, keeping rule names")
    void shouldCreateAll() {
        List<SeriesDetector> detectors = DetectorFactory.createAll(List.of(rule("metric"), rule("pattern")), null);

        assertThat(detectors).extracting(SeriesDetector::getRuleName)
                .containsExactly("metric_rule", "pattern_rule");
    }

    @Test
    @DisplayName("Should throw for unknown rule type")
    void shouldThrowForUnknownType() {
        assertThatThrownBy(() -> DetectorFactory.create(rule("forecast")))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("Unknown rule type");
    }

    @Test
    @DisplayName("Should throw for null rule")
    void shouldThrowForNullRule() {
        assertThatThrownBy(() -> DetectorFactory.create(null))
                .isInstanceOf(NullPointerException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnalysisRule rule(String type) {
        AnalysisRule rule = new AnalysisRule();
        rule.setName(type.toLowerCase() + "_rule");
        rule.setType(type);
        rule.setTarget("http.requests");
        rule.setPattern("timeout");
        return rule;
    }
}
