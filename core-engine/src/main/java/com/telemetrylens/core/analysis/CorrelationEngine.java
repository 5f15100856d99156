package com.telemetrylens.core.analysis;

import com.telemetrylens.core.error.InvalidParameterException;
import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.model.CorrelationPair;
import com.telemetrylens.core.model.CorrelationReport;
import com.telemetrylens.core.model.LeadLagRelation;
import com.telemetrylens.core.model.TimeSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Pairwise Pearson correlation across aligned series.
 *
 * <p>
 * Series are aligned with {@link SeriesAligner#innerJoin(Map)}. Pairs are
 * formed in the order the series were supplied, filtered by
 * {@link CorrelationOptions} and sorted by {@code |r|} descending.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationEngine.class);

    /** Smallest {@code |r|} at which a lagged relation is reported. */
    public static final double MIN_LEAD_LAG_CORRELATION = 0.5;

    public static final int MAX_LAG = 20;

    private CorrelationEngine() {
        // utility class, not instantiable
    }

    /**
     * @param series  two or more named series, in reporting order
     * @param options filters; must not be {@code null}
     * @return the report, or insufficient data when fewer than 2 timestamps
     *         are shared by all series
     * @throws InvalidParameterException with fewer than 2 series
     */
    public static Outcome<CorrelationReport> correlate(Map<String, List<TimeSeriesPoint>> series,
            CorrelationOptions options) {
        Objects.requireNonNull(series, "Series map must not be null");
        Objects.requireNonNull(options, "Correlation options must not be null");
        if (series.size() < 2) {
            throw new InvalidParameterException("Correlation needs at least 2 series, got " + series.size());
        }

        AlignedSeries aligned = SeriesAligner.innerJoin(series);
        List<String> names = aligned.getNames();
        if (aligned.size() < 2) {
            return Outcome.insufficientData("Only " + aligned.size()
                    + " timestamp(s) shared by all series " + names);
        }

        List<CorrelationPair> pairs = new ArrayList<>();
        List<LeadLagRelation> leadLag = new ArrayList<>();
        int evaluated = 0;
        for (int i = 0; i < names.size(); i++) {
            for (int j = i + 1; j < names.size(); j++) {
                evaluated++;
                double[] a = aligned.valuesOf(names.get(i));
                double[] b = aligned.valuesOf(names.get(j));
                double r = pearson(a, b);
                if (Math.abs(r) < options.getMinCorrelation()) {
                    continue;
                }
                if (r < 0 && !options.isIncludeAntiCorrelations()) {
                    continue;
                }
                pairs.add(new CorrelationPair(names.get(i), names.get(j), r, aligned.size()));
                if (options.isIncludeLeadLag()) {
                    leadLag(names.get(i), a, names.get(j), b).ifPresent(leadLag::add);
                }
            }
        }
        pairs.sort(Comparator.comparingDouble((CorrelationPair p) -> Math.abs(p.getCoefficient())).reversed());

        LOG.info("Correlated {} series over {} aligned point(s): {} of {} pair(s) reported",
                names.size(), aligned.size(), pairs.size(), evaluated);
        return Outcome.ok(new CorrelationReport(names, aligned.size(), evaluated, pairs, leadLag));
    }

    /**
     * Pearson correlation of two equal-length arrays.
     *
     * @return {@code r} in {@code [-1, 1]}, or {@code 0} when either array
     *         has no variance or fewer than 2 values
     */
    public static double pearson(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Arrays differ in length: " + x.length + " vs " + y.length);
        }
        int n = x.length;
        if (n < 2) {
            return 0;
        }
        double meanX = Arrays.stream(x).average().orElse(0);
        double meanY = Arrays.stream(y).average().orElse(0);
        double sxy = 0;
        double sxx = 0;
        double syy = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        if (sxx == 0 || syy == 0) {
            return 0;
        }
        double r = sxy / Math.sqrt(sxx * syy);
        return Math.max(-1.0, Math.min(1.0, r));
    }

    /**
     * Find the lag at which {@code a} and {@code b} correlate best.
     *
     * <p>
     * Lags {@code -L..L} with {@code L = min(20, floor(n/4))} are tried; at a
     * positive lag {@code a[i]} is paired with {@code b[i + lag]}, i.e.
     * {@code a} leads. Ties keep the smaller absolute lag.
     * </p>
     *
     * @return the best non-zero lag when {@code |r| >= 0.5}
     */
    public static Optional<LeadLagRelation> leadLag(String nameA, double[] a, String nameB, double[] b) {
        int n = Math.min(a.length, b.length);
        int maxLag = Math.min(MAX_LAG, n / 4);
        int bestLag = 0;
        double bestR = 0;
        for (int step = 0; step <= maxLag; step++) {
            for (int lag : step == 0 ? new int[] {0} : new int[] {step, -step}) {
                double r = laggedPearson(a, b, n, lag);
                if (Math.abs(r) > Math.abs(bestR)) {
                    bestR = r;
                    bestLag = lag;
                }
            }
        }
        if (bestLag == 0 || Math.abs(bestR) < MIN_LEAD_LAG_CORRELATION) {
            return Optional.empty();
        }
        return Optional.of(new LeadLagRelation(nameA, nameB, bestLag, bestR));
    }

    private static double laggedPearson(double[] a, double[] b, int n, int lag) {
        int overlap = n - Math.abs(lag);
        double[] x = new double[overlap];
        double[] y = new double[overlap];
        for (int i = 0; i < overlap; i++) {
            x[i] = lag >= 0 ? a[i] : a[i - lag];
            y[i] = lag >= 0 ? b[i + lag] : b[i];
        }
        return pearson(x, y);
    }
}
