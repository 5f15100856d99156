package com.telemetrylens.service;

import com.telemetrylens.core.error.ErrorKind;
import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.model.DetectionReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.Objects;

/**
 * Micrometer meters for the analysis service.
 *
 * <p>
 * The registry decides where the values end up (Prometheus, logging,
 * in-memory for tests); this class only defines the meters.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code telemetry_lens.analyses}: counter of finished rule analyses,
 * tagged {@code outcome=ok|insufficient_data|source_unavailable|invalid_parameter}</li>
 * <li>{@code telemetry_lens.anomalies}: counter of reported anomalies</li>
 * <li>{@code telemetry_lens.analysis.duration}: timer of fetch plus
 * detection per rule</li>
 * </ul>
 */
public class AnalysisMetrics {

    static final String ANALYSES = "telemetry_lens.analyses";
    static final String ANOMALIES = "telemetry_lens.anomalies";
    static final String DURATION = "telemetry_lens.analysis.duration";
    static final String OK = "ok";

    private final MeterRegistry registry;
    private final Counter anomalies;
    private final Timer duration;

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");
        this.anomalies = Counter.builder(ANOMALIES)
                .description("Anomalies reported across all rules")
                .register(registry);
        this.duration = Timer.builder(DURATION)
                .description("Fetch and detection time per rule")
                .register(registry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopTimer(Timer.Sample sample) {
        sample.stop(duration);
    }

    /**
     * Count one finished analysis and, when it succeeded, its anomalies.
     */
    public void recordOutcome(Outcome<DetectionReport> outcome) {
        registry.counter(ANALYSES, "outcome", outcomeTag(outcome)).increment();
        if (outcome.isOk()) {
            anomalies.increment(outcome.getValue().getAnomalies().size());
        }
    }

    static String outcomeTag(Outcome<?> outcome) {
        return outcome.isOk() ? OK : tagOf(outcome.getErrorKind());
    }

    static String tagOf(ErrorKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
