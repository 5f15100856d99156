package com.telemetrylens.service;

import com.telemetrylens.core.analysis.AnalysisOptions;
import com.telemetrylens.core.analysis.CorrelationEngine;
import com.telemetrylens.core.analysis.CorrelationOptions;
import com.telemetrylens.core.analysis.SeriesAnalyzer;
import com.telemetrylens.core.detection.DetectionPipeline;
import com.telemetrylens.core.error.ErrorKind;
import com.telemetrylens.core.error.InvalidParameterException;
import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.error.SourceUnavailableException;
import com.telemetrylens.core.model.AnalysisRule;
import com.telemetrylens.core.model.AnalysisType;
import com.telemetrylens.core.model.CorrelationReport;
import com.telemetrylens.core.model.DetectionReport;
import com.telemetrylens.core.model.SeriesAnalysisReport;
import com.telemetrylens.core.model.TimeRange;
import com.telemetrylens.core.model.TimeSeriesPoint;
import com.telemetrylens.core.source.Aggregation;
import com.telemetrylens.core.source.EnrichmentSource;
import com.telemetrylens.core.source.SeriesFetch;
import com.telemetrylens.core.source.SeriesQuery;
import com.telemetrylens.core.source.SeriesSource;
import com.telemetrylens.core.source.SeriesTarget;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs analyses against a {@link SeriesSource}.
 *
 * <h3>Rule fan-out</h3>
 * <p>
 * {@link #analyzeAll(List, TimeRange)} runs every rule's
 * {@link DetectionPipeline} on a worker thread. At most
 * {@link ServiceConfig#getConcurrency()} rules are in flight at once, on a
 * pool of that many workers, and
 * each fetch is bounded by {@link ServiceConfig#getFetchTimeoutMs()}. A
 * source failure or timeout of one rule is recorded as that rule's
 * {@code source_unavailable} outcome; the other rules are unaffected.
 * </p>
 *
 * <h3>Single requests</h3>
 * <p>
 * {@link #analyzeSeries} and {@link #analyzeCorrelations} propagate a
 * {@link SourceUnavailableException} to the caller.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisService.class);

    private final SeriesSource source;
    private final DetectionPipeline pipeline;
    private final ServiceConfig config;
    private final AnalysisMetrics metrics;
    private final Semaphore permits;
    private final ExecutorService workers;

    public AnalysisService(SeriesSource source, EnrichmentSource enrichment, ServiceConfig config,
            AnalysisMetrics metrics) {
        Objects.requireNonNull(source, "Series source must not be null");
        this.config = Objects.requireNonNull(config, "Service config must not be null");
        this.metrics = Objects.requireNonNull(metrics, "Analysis metrics must not be null");
        this.source = timeBounded(source, config.getFetchTimeoutMs());
        this.pipeline = new DetectionPipeline(this.source, enrichment);
        this.permits = new Semaphore(config.getConcurrency());
        this.workers = Executors.newFixedThreadPool(config.getConcurrency(), new WorkerThreadFactory());
    }

    /**
     * Analyse every rule over the same range.
     *
     * @param rules analysis rules; each is validated before any work starts
     * @param range range to check for anomalies; each rule's lookback is
     *              fetched in front of it
     * @return one outcome per rule, in rule order
     * @throws com.telemetrylens.core.error.InvalidParameterException if a
     *         rule is invalid
     */
    public List<RuleOutcome> analyzeAll(List<AnalysisRule> rules, TimeRange range) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        Objects.requireNonNull(range, "Time range must not be null");
        rules.forEach(AnalysisRule::validate);

        LOG.info("Analysing {} rule(s) over {} with concurrency {}", rules.size(), range, config.getConcurrency());
        List<CompletableFuture<RuleOutcome>> futures = rules.stream()
                .map(rule -> CompletableFuture.supplyAsync(() -> analyze(rule, range), workers))
                .toList();
        List<RuleOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();

        long failed = outcomes.stream().filter(o -> !o.isOk()).count();
        LOG.info("Finished {} rule(s): {} with a report, {} without", outcomes.size(),
                outcomes.size() - failed, failed);
        return outcomes;
    }

    /**
     * Summary, trend, seasonality, change points and outliers of one field.
     *
     * @param interval bucket width; {@code null} for the configured default
     * @param type     sections to compute; {@code null} for {@code FULL}
     * @throws SourceUnavailableException if the series cannot be fetched
     */
    public Outcome<SeriesAnalysisReport> analyzeSeries(String field, TimeRange range, Duration interval,
            AnalysisType type) {
        SeriesQuery query = fieldQuery(field, range, interval);
        AnalysisOptions options = AnalysisOptions.builder()
                .type(type != null ? type : AnalysisType.FULL)
                .maxOutliers(config.getDefaultMaxResults())
                .build();
        List<TimeSeriesPoint> points = SeriesFetch.await(boundedFetch(query));
        return SeriesAnalyzer.analyze(field, points, options);
    }

    /**
     * Fetch every field concurrently and correlate them pairwise. Fetches
     * share the rule permits, so at most
     * {@link ServiceConfig#getConcurrency()} are in flight.
     *
     * @param fields   two or more distinct field names, in reporting order
     * @param interval bucket width; {@code null} for the configured default
     * @throws SourceUnavailableException if any series cannot be fetched
     */
    public Outcome<CorrelationReport> analyzeCorrelations(List<String> fields, TimeRange range, Duration interval,
            CorrelationOptions options) {
        Objects.requireNonNull(fields, "Fields must not be null");
        Set<String> distinct = new LinkedHashSet<>(fields);
        if (distinct.size() < 2) {
            throw new InvalidParameterException("Correlation needs at least 2 distinct fields, got " + distinct);
        }
        Map<String, CompletableFuture<List<TimeSeriesPoint>>> pending = new LinkedHashMap<>();
        for (String field : distinct) {
            pending.put(field, boundedFetch(fieldQuery(field, range, interval)));
        }

        Map<String, List<TimeSeriesPoint>> series = new LinkedHashMap<>();
        pending.forEach((field, future) -> series.put(field, SeriesFetch.await(future)));
        return CorrelationEngine.correlate(series, options != null ? options : CorrelationOptions.defaults());
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.getFetchTimeoutMs(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private RuleOutcome analyze(AnalysisRule rule, TimeRange range) {
        acquirePermit();
        Timer.Sample sample = metrics.startTimer();
        try {
            Outcome<DetectionReport> outcome = runPipeline(rule, range);
            metrics.recordOutcome(outcome);
            return new RuleOutcome(rule, outcome);
        } finally {
            metrics.stopTimer(sample);
            permits.release();
        }
    }

    private Outcome<DetectionReport> runPipeline(AnalysisRule rule, TimeRange range) {
        try {
            return pipeline.run(rule, range).join();
        } catch (CompletionException e) {
            if (SeriesFetch.unwrap(e) instanceof SourceUnavailableException sue) {
                LOG.error("Rule [{}]: {}", rule.getName(), sue.getMessage());
                return Outcome.failure(ErrorKind.SOURCE_UNAVAILABLE, sue.getMessage());
            }
            throw e;
        }
    }

    /**
     * Start a fetch once a permit is free; the permit is held until the
     * fetch completes.
     */
    private CompletableFuture<List<TimeSeriesPoint>> boundedFetch(SeriesQuery query) {
        acquirePermit();
        CompletableFuture<List<TimeSeriesPoint>> future;
        try {
            future = SeriesFetch.fetch(source, query);
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
        return future.whenComplete((points, error) -> permits.release());
    }

    private void acquirePermit() {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        }
    }

    private SeriesQuery fieldQuery(String field, TimeRange range, Duration interval) {
        return SeriesQuery.builder()
                .target(SeriesTarget.field(field))
                .aggregation(Aggregation.AVG)
                .interval(interval != null ? interval : config.getDefaultInterval())
                .range(range)
                .build();
    }

    /**
     * Decorate the source so every fetch fails with a
     * {@link SourceUnavailableException} after the configured timeout.
     */
    private static SeriesSource timeBounded(SeriesSource delegate, long timeoutMs) {
        return query -> delegate.fetchBucketed(query)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(error -> {
                    Throwable cause = SeriesFetch.unwrap(error);
                    if (cause instanceof TimeoutException) {
                        throw new SourceUnavailableException("Fetch of " + query.getTarget().label()
                                + " timed out after " + timeoutMs + " ms", cause);
                    }
                    throw cause instanceof RuntimeException re ? re : new CompletionException(cause);
                });
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "analysis-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
