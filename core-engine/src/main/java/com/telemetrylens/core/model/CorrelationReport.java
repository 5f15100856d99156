package com.telemetrylens.core.model;

import java.util.List;

/**
 * Pairwise correlations among a set of aligned series.
 *
 * @since 1.0.0
 */
public final class CorrelationReport {

    private final List<String> series;
    private final int alignedPoints;
    private final int pairsEvaluated;
    private final List<CorrelationPair> pairs;
    private final List<LeadLagRelation> leadLag;

    public CorrelationReport(List<String> series, int alignedPoints, int pairsEvaluated,
            List<CorrelationPair> pairs, List<LeadLagRelation> leadLag) {
        this.series = List.copyOf(series);
        this.alignedPoints = alignedPoints;
        this.pairsEvaluated = pairsEvaluated;
        this.pairs = List.copyOf(pairs);
        this.leadLag = leadLag != null ? List.copyOf(leadLag) : List.of();
    }

    public List<String> getSeries() {
        return series;
    }

    /** Timestamps present and non-null in every series. */
    public int getAlignedPoints() {
        return alignedPoints;
    }

    public int getPairsEvaluated() {
        return pairsEvaluated;
    }

    /** Pairs passing the filters, strongest first. */
    public List<CorrelationPair> getPairs() {
        return pairs;
    }

    public long countByStrength(CorrelationStrength strength) {
        return pairs.stream().filter(p -> p.getStrength() == strength).count();
    }

    public List<LeadLagRelation> getLeadLag() {
        return leadLag;
    }

    @Override
    public String toString() {
        return "CorrelationReport{series=" + series + ", aligned=" + alignedPoints
                + ", pairs=" + pairs.size() + '/' + pairsEvaluated + '}';
    }
}
