package com.telemetrylens.core.detection;

import com.telemetrylens.core.model.Anomaly;

import java.util.List;

/**
 * Ranked anomalies kept after truncation, plus the untruncated count.
 */
public final class ScoringResult {

    private final List<Anomaly> anomalies;
    private final int totalFlagged;

    ScoringResult(List<Anomaly> anomalies, int totalFlagged) {
        this.anomalies = List.copyOf(anomalies);
        this.totalFlagged = totalFlagged;
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    public int getTotalFlagged() {
        return totalFlagged;
    }
}
