package com.telemetrylens.core.analysis;

import com.telemetrylens.core.error.InvalidParameterException;
import com.telemetrylens.core.model.SmoothingMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Smoother}.
 */
class SmootherTest {

    private static final double[] RAMP = {1, 2, 3, 4, 5};

    @Test
    @DisplayName("Should average over a centred window clipped at the ends")
    void shouldApplySimpleMovingAverage() {
        assertThat(Smoother.smooth(RAMP, SmoothingMethod.SMA, 3))
                .containsExactly(new double[] {1.5, 2, 3, 4, 4.5}, within(1e-9));
    }

    @Test
    @DisplayName("Should apply exponential smoothing seeded with the first value")
    void shouldApplyExponentialMovingAverage() {
        assertThat(Smoother.smooth(RAMP, SmoothingMethod.EMA, 3))
                .containsExactly(new double[] {1, 1.5, 2.25, 3.125, 4.0625}, within(1e-9));
    }

    @Test
    @DisplayName("Should return a copy when the series is shorter than the window")
    void shouldSkipShortSeries() {
        double[] smoothed = Smoother.smooth(RAMP, SmoothingMethod.SMA, 10);

        assertThat(smoothed).containsExactly(RAMP).isNotSameAs(RAMP);
    }

    @Test
    @DisplayName("Should reject a window below one")
    void shouldRejectZeroWindow() {
        assertThatThrownBy(() -> Smoother.smooth(RAMP, SmoothingMethod.EMA, 0))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("window");
    }
}
