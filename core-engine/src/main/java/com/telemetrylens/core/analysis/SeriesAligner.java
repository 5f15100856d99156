package com.telemetrylens.core.analysis;

import com.telemetrylens.core.model.TimeSeriesPoint;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Inner join of series on exact bucket timestamps.
 *
 * <p>
 * Only timestamps present with a non-missing value in <em>every</em> series
 * are kept. Buckets whose boundaries drift between series never match, so
 * callers must fetch every series with the same interval and range.
 * </p>
 */
public final class SeriesAligner {

    private SeriesAligner() {
        // utility class, not instantiable
    }

    /**
     * @param series named series in the order they should be reported
     */
    public static AlignedSeries innerJoin(Map<String, List<TimeSeriesPoint>> series) {
        Objects.requireNonNull(series, "Series map must not be null");

        Map<String, Map<Instant, Double>> indexed = new LinkedHashMap<>();
        TreeSet<Instant> common = null;
        for (Map.Entry<String, List<TimeSeriesPoint>> entry : series.entrySet()) {
            Map<Instant, Double> byTime = new HashMap<>();
            for (TimeSeriesPoint p : entry.getValue()) {
                if (!p.isMissing()) {
                    byTime.put(p.getTimestamp(), p.getValue());
                }
            }
            indexed.put(entry.getKey(), byTime);
            if (common == null) {
                common = new TreeSet<>(byTime.keySet());
            } else {
                common.retainAll(byTime.keySet());
            }
        }

        List<Instant> timestamps = common != null ? new ArrayList<>(common) : List.of();
        Map<String, double[]> values = new LinkedHashMap<>();
        for (Map.Entry<String, Map<Instant, Double>> entry : indexed.entrySet()) {
            double[] aligned = new double[timestamps.size()];
            for (int i = 0; i < timestamps.size(); i++) {
                aligned[i] = entry.getValue().get(timestamps.get(i));
            }
            values.put(entry.getKey(), aligned);
        }
        return new AlignedSeries(timestamps, values);
    }
}
