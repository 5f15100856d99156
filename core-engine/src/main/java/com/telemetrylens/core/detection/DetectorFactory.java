package com.telemetrylens.core.detection;

import com.telemetrylens.core.model.AnalysisRule;
import com.telemetrylens.core.source.EnrichmentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link SeriesDetector} instances from
 * {@link AnalysisRule} configurations.
 *
 * <p>
 * This is the single point of extension when adding new rule types:
 * register the new type string here and create the corresponding detector.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Validate the rule and create its detector.
     *
     * @param rule       the rule configuration; must not be {@code null}
     * @param enrichment optional anomaly decoration; may be {@code null}
     * @return an appropriate {@link SeriesDetector} instance
     * @throws com.telemetrylens.core.error.InvalidParameterException if the
     *         rule is invalid or of an unknown type
     */
    public static SeriesDetector create(AnalysisRule rule, EnrichmentSource enrichment) {
        Objects.requireNonNull(rule, "AnalysisRule must not be null");
        rule.validate();

        return switch (rule.getType()) {
            case AnalysisRule.TYPE_METRIC -> new MetricAnomalyDetector(rule, enrichment);
            case AnalysisRule.TYPE_FREQUENCY -> new FrequencyDetector(rule, enrichment);
            case AnalysisRule.TYPE_PATTERN -> new PatternDetector(rule, enrichment);
            case AnalysisRule.TYPE_CARDINALITY -> new CardinalityDetector(rule, enrichment);
            // unreachable after validate()
            default -> throw new IllegalStateException("Unhandled rule type: " + rule.getType());
        };
    }

    public static SeriesDetector create(AnalysisRule rule) {
        return create(rule, null);
    }

    /**
     * Create detectors for every rule in the supplied list.
     *
     * @return unmodifiable list of detectors (one per rule)
     */
    public static List<SeriesDetector> createAll(List<AnalysisRule> rules, EnrichmentSource enrichment) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        LOG.info("Creating {} detector(s) from configuration", rules.size());
        List<SeriesDetector> detectors = rules.stream()
                .map(rule -> create(rule, enrichment))
                .toList();
        return Collections.unmodifiableList(detectors);
    }
}
