package com.telemetrylens.core.analysis;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Several series reduced to the timestamps they all share, in timestamp
 * order. Series keep the order they were supplied in.
 */
public final class AlignedSeries {

    private final List<Instant> timestamps;
    private final Map<String, double[]> values;

    AlignedSeries(List<Instant> timestamps, Map<String, double[]> values) {
        this.timestamps = Collections.unmodifiableList(new ArrayList<>(timestamps));
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public List<Instant> getTimestamps() {
        return timestamps;
    }

    public int size() {
        return timestamps.size();
    }

    public List<String> getNames() {
        return List.copyOf(values.keySet());
    }

    /**
     * @return a copy of the aligned values of {@code name}
     */
    public double[] valuesOf(String name) {
        double[] v = values.get(name);
        if (v == null) {
            throw new IllegalArgumentException("Unknown series: " + name);
        }
        return v.clone();
    }
}
