package com.telemetrylens.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.model.AnalysisRule;
import com.telemetrylens.core.model.DetectionReport;

import java.util.Objects;

/**
 * The result of analysing one rule: a report, or the reason there is none.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "rule", "status", "detail", "report" })
public final class RuleOutcome {

    private final AnalysisRule rule;
    private final Outcome<DetectionReport> outcome;

    public RuleOutcome(AnalysisRule rule, Outcome<DetectionReport> outcome) {
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
        this.outcome = Objects.requireNonNull(outcome, "outcome must not be null");
    }

    @JsonIgnore
    public AnalysisRule getAnalysisRule() {
        return rule;
    }

    @JsonIgnore
    public Outcome<DetectionReport> getOutcome() {
        return outcome;
    }

    public String getRule() {
        return rule.getName();
    }

    /**
     * @return {@code ok} or the lower-case error kind
     */
    public String getStatus() {
        return AnalysisMetrics.outcomeTag(outcome);
    }

    public String getDetail() {
        return outcome.isOk() ? null : outcome.getDetail();
    }

    public DetectionReport getReport() {
        return outcome.orElse(null);
    }

    @JsonIgnore
    public boolean isOk() {
        return outcome.isOk();
    }

    @Override
    public String toString() {
        return "RuleOutcome{rule='" + rule.getName() + "', outcome=" + outcome + '}';
    }
}
