package com.telemetrylens.core.analysis;

import com.telemetrylens.core.model.SeasonalPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SeasonalityAnalyzer}.
 */
class SeasonalityAnalyzerTest {

    @Test
    @DisplayName("Should find the period of a sine wave and its multiples")
    void shouldFindSinePeriod() {
        double[] values = new double[70];
        for (int i = 0; i < values.length; i++) {
            values[i] = Math.sin(2 * Math.PI * i / 7);
        }

        List<SeasonalPattern> patterns = SeasonalityAnalyzer.detect(values);

        assertThat(patterns).extracting(SeasonalPattern::getLag).containsExactly(7, 14, 21);
        // overlap of 63 out of 70 points
        assertThat(patterns.get(0).getAutocorrelation()).isEqualTo(0.9, within(1e-6));
    }

    @Test
    @DisplayName("Should find nothing in a constant series")
    void shouldIgnoreConstantSeries() {
        assertThat(SeasonalityAnalyzer.detect(new double[] {3, 3, 3, 3, 3, 3})).isEmpty();
        assertThat(SeasonalityAnalyzer.autocorrelation(new double[] {3, 3, 3})).containsExactly(1.0);
    }

    @Test
    @DisplayName("Should compute lags up to half the series length")
    void shouldBoundLags() {
        double[] acf = SeasonalityAnalyzer.autocorrelation(new double[] {1, 2, 3, 4, 5, 6, 7, 8, 9});

        assertThat(acf).hasSize(5);
        assertThat(acf[0]).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should only report positive peaks of an alternating series")
    void shouldReportEvenLagsOfAlternatingSeries() {
        double[] values = new double[40];
        for (int i = 0; i < values.length; i++) {
            values[i] = i % 2 == 0 ? 1 : -1;
        }

        List<SeasonalPattern> patterns = SeasonalityAnalyzer.detect(values);

        assertThat(patterns).isNotEmpty()
                .allSatisfy(p -> {
                    assertThat(p.getLag() % 2).isZero();
                    assertThat(p.getAutocorrelation()).isGreaterThan(SeasonalityAnalyzer.MIN_AUTOCORRELATION);
                });
        assertThat(patterns).hasSizeLessThanOrEqualTo(SeasonalityAnalyzer.MAX_PATTERNS);
    }
}
