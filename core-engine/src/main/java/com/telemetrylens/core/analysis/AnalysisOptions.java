package com.telemetrylens.core.analysis;

import com.telemetrylens.core.error.InvalidParameterException;
import com.telemetrylens.core.model.AnalysisType;
import com.telemetrylens.core.model.GapFillPolicy;
import com.telemetrylens.core.model.SmoothingMethod;

import java.util.Objects;

/**
 * Options of {@link SeriesAnalyzer}.
 *
 * @since 1.0.0
 */
public final class AnalysisOptions {

    public static final int DEFAULT_MAX_OUTLIERS = 10;
    public static final double OUTLIER_ZSCORE = 3.0;

    private final AnalysisType type;
    private final GapFillPolicy gapFill;
    private final SmoothingMethod smoothing;
    private final int smoothingWindow;
    private final int maxOutliers;

    private AnalysisOptions(Builder b) {
        this.type = Objects.requireNonNull(b.type, "Analysis type must not be null");
        this.gapFill = Objects.requireNonNull(b.gapFill, "Gap fill policy must not be null");
        this.smoothing = Objects.requireNonNull(b.smoothing, "Smoothing method must not be null");
        if (b.smoothingWindow < 1) {
            throw new InvalidParameterException("Smoothing window must be >= 1, got: " + b.smoothingWindow);
        }
        if (b.maxOutliers <= 0) {
            throw new InvalidParameterException("maxOutliers must be > 0, got: " + b.maxOutliers);
        }
        this.smoothingWindow = b.smoothingWindow;
        this.maxOutliers = b.maxOutliers;
    }

    public static AnalysisOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AnalysisType type = AnalysisType.FULL;
        private GapFillPolicy gapFill = GapFillPolicy.DROP;
        private SmoothingMethod smoothing = SmoothingMethod.NONE;
        private int smoothingWindow = Smoother.DEFAULT_WINDOW;
        private int maxOutliers = DEFAULT_MAX_OUTLIERS;

        public Builder type(AnalysisType type) {
            this.type = type;
            return this;
        }

        public Builder gapFill(GapFillPolicy gapFill) {
            this.gapFill = gapFill;
            return this;
        }

        public Builder smoothing(SmoothingMethod smoothing) {
            this.smoothing = smoothing;
            return this;
        }

        public Builder smoothingWindow(int smoothingWindow) {
            this.smoothingWindow = smoothingWindow;
            return this;
        }

        public Builder maxOutliers(int maxOutliers) {
            this.maxOutliers = maxOutliers;
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }
    }

    public AnalysisType getType() {
        return type;
    }

    public GapFillPolicy getGapFill() {
        return gapFill;
    }

    public SmoothingMethod getSmoothing() {
        return smoothing;
    }

    public int getSmoothingWindow() {
        return smoothingWindow;
    }

    public int getMaxOutliers() {
        return maxOutliers;
    }
}
