package com.telemetrylens.core.stats;

import com.telemetrylens.core.error.InvalidParameterException;
import com.telemetrylens.core.model.BaselineStats;
import com.telemetrylens.core.model.MetricKind;
import com.telemetrylens.core.model.ThresholdKind;
import com.telemetrylens.core.model.ThresholdSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ThresholdPolicy}.
 */
class ThresholdPolicyTest {

    private static final BaselineStats MEAN_10_SD_1 = stats(9, 11);
    private static final BaselineStats ONE_TO_HUNDRED = stats(IntStream.rangeClosed(1, 100).asDoubleStream().toArray());

    @Test
    @DisplayName("Should place the zscore threshold k stddevs above the mean")
    void shouldDeriveZscore() {
        ThresholdSpec spec = ThresholdPolicy.derive(MEAN_10_SD_1, ThresholdKind.ZSCORE, null);

        assertThat(spec.getValue()).isEqualTo(13.0, within(1e-9));
        assertThat(spec.getDescription()).isEqualTo("mean + 3 stddev (13.00)");
        assertThat(ThresholdPolicy.derive(MEAN_10_SD_1, ThresholdKind.ZSCORE, 2.5).getValue())
                .isEqualTo(12.5, within(1e-9));
    }

    @Test
    @DisplayName("Should look up the percentile threshold in the baseline")
    void shouldDerivePercentile() {
        assertThat(ThresholdPolicy.derive(ONE_TO_HUNDRED, ThresholdKind.PERCENTILE, null).getValue()).isEqualTo(100.0);
        assertThat(ThresholdPolicy.derive(ONE_TO_HUNDRED, ThresholdKind.PERCENTILE, 90.0).getValue()).isEqualTo(91.0);
        assertThat(ThresholdPolicy.derive(ONE_TO_HUNDRED, ThresholdKind.PERCENTILE, 90.0).getDescription())
                .isEqualTo("90th percentile (91.00)");
    }

    @Test
    @DisplayName("Should scale MAD around the median")
    void shouldDeriveMad() {
        ThresholdSpec spec = ThresholdPolicy.derive(stats(1, 2, 3, 4, 100), ThresholdKind.MAD, null);

        assertThat(spec.getValue()).isEqualTo(3 + 3 * 1.4826, within(1e-9));
    }

    @Test
    @DisplayName("Should place the IQR threshold above the third quartile")
    void shouldDeriveIqr() {
        assertThat(ThresholdPolicy.derive(ONE_TO_HUNDRED, ThresholdKind.IQR, null).getValue())
                .isEqualTo(76 + 1.5 * 50, within(1e-9));
    }

    @Test
    @DisplayName("Should use the fixed value as is and require one")
    void shouldHandleFixed() {
        assertThat(ThresholdPolicy.derive(MEAN_10_SD_1, ThresholdKind.FIXED, 50.0).getValue()).isEqualTo(50.0);
        assertThat(ThresholdPolicy.derive(MEAN_10_SD_1, ThresholdKind.FIXED, 50.0).getDescription())
                .isEqualTo("fixed value (50.00)");
        assertThatThrownBy(() -> ThresholdPolicy.derive(MEAN_10_SD_1, ThresholdKind.FIXED, null))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("requires a value");
    }

    @Test
    @DisplayName("Should return an unreachable threshold for spread-based kinds over a constant baseline")
    void shouldNeverFlagOverConstantBaseline() {
        BaselineStats constant = stats(5, 5, 5, 5);

        for (double k : new double[] {0.1, 1, 3, 100}) {
            assertThat(ThresholdPolicy.derive(constant, ThresholdKind.ZSCORE, k).getValue())
                    .isEqualTo(Double.POSITIVE_INFINITY);
        }
        assertThat(ThresholdPolicy.derive(constant, ThresholdKind.MAD, null).getValue())
                .isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(ThresholdPolicy.derive(constant, ThresholdKind.RATE_OF_CHANGE, null).getDescription())
                .contains("no spread");
    }

    @Test
    @DisplayName("Should mirror the boundary below the baseline when two-sided")
    void shouldDeriveTwoSided() {
        ThresholdSpec spec = ThresholdPolicy.deriveTwoSided(MEAN_10_SD_1, ThresholdKind.ZSCORE, null);

        assertThat(spec.isTwoSided()).isTrue();
        assertThat(spec.getValue()).isEqualTo(13.0, within(1e-9));
        assertThat(spec.getLowerValue()).isEqualTo(7.0, within(1e-9));
        assertThat(ThresholdPolicy.deriveTwoSided(MEAN_10_SD_1, ThresholdKind.FIXED, 20.0).isTwoSided()).isFalse();
    }

    @Test
    @DisplayName("Should validate kind and metric combinations")
    void shouldValidateCombinations() {
        assertThatThrownBy(() -> ThresholdPolicy.validate(ThresholdKind.RATE_OF_CHANGE, null, MetricKind.GAUGE))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> ThresholdPolicy.validate(ThresholdKind.ZSCORE, -1.0, MetricKind.GAUGE))
                .hasMessageContaining("must be > 0");
        assertThatCode(() -> ThresholdPolicy.validate(ThresholdKind.RATE_OF_CHANGE, 2.0, MetricKind.COUNTER))
                .doesNotThrowAnyException();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static BaselineStats stats(double... values) {
        return BaselineEstimator.estimate(values).getValue();
    }
}
