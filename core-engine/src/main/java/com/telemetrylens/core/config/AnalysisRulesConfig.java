package com.telemetrylens.core.config;

import com.telemetrylens.core.error.InvalidParameterException;
import com.telemetrylens.core.model.AnalysisRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the analysis rules YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - name: checkout_latency
 *     type: metric
 *     target: http.server.duration
 *     metricKind: histogram
 *     threshold: percentile
 *     thresholdValue: 99
 *     interval: 5m
 *     lookback: 24h
 * </pre>
 *
 * @since 1.0.0
 */
public class AnalysisRulesConfig {

    private List<AnalysisRule> rules = new ArrayList<>();

    /**
     * @return unmodifiable list of analysis rules
     */
    public List<AnalysisRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by SnakeYAML during deserialization).
     */
    public void setRules(List<AnalysisRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * Validate every rule and check that rule names are unique.
     * Collects all errors and throws a single exception.
     *
     * @throws InvalidParameterException if one or more rules are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < rules.size(); i++) {
            AnalysisRule rule = Objects.requireNonNull(rules.get(i),
                    "Rule at index " + i + " is null");
            try {
                rule.validate();
            } catch (InvalidParameterException e) {
                errors.add(e.getMessage());
            }
            if (rule.getName() != null && !names.add(rule.getName())) {
                errors.add("Duplicate rule name: '" + rule.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidParameterException(
                    "Analysis rules validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "AnalysisRulesConfig{rules=" + rules + '}';
    }
}
