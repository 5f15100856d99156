package com.telemetrylens.service;

import com.telemetrylens.core.config.AnalysisRulesConfig;
import com.telemetrylens.core.config.AnalysisRulesLoader;
import com.telemetrylens.core.model.AnalysisRule;
import com.telemetrylens.core.model.TimeRange;
import com.telemetrylens.core.source.EnrichmentSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Main entry point for the Telemetry Lens analysis service.
 *
 * <h3>Run</h3>
 *
 * <pre>
 *   ServiceConfig (environment)
 *     → analysis rules (YAML)
 *     → FileSeriesSource (SERIES_DIR)
 *     → AnalysisService.analyzeAll over [now - ANALYSIS_WINDOW, now)
 *     → JSON report on stdout
 * </pre>
 *
 * <p>
 * The health server answers while the run is in progress and is
 * stopped on exit.
 * </p>
 *
 * @since 1.0.0
 */
public final class TelemetryLensService {

    private static final Logger LOG = LoggerFactory.getLogger(TelemetryLensService.class);

    private TelemetryLensService() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Telemetry Lens with config: {}", config);

        // 2. Start health server with shutdown hook
        HealthServer healthServer = new HealthServer();
        healthServer.start(config.getHealthPort());
        Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

        // 3. Load analysis rules
        List<AnalysisRule> rules = loadRules(config).getRules();
        if (rules.isEmpty()) {
            throw new IllegalStateException(
                    "No analysis rules defined. Provide rules via "
                            + AnalysisRulesLoader.ENV_RULES_PATH
                            + " or a classpath " + AnalysisRulesLoader.DEFAULT_RESOURCE + " file.");
        }
        LOG.info("Loaded {} analysis rule(s)", rules.size());
        healthServer.markReady();

        // 4. Run every rule and print the report
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        Instant now = Instant.now();
        TimeRange range = TimeRange.of(now.minus(config.getAnalysisWindow()), now);
        try (AnalysisService service = new AnalysisService(new FileSeriesSource(Path.of(config.getSeriesDir())),
                EnrichmentSource.NONE, config, new AnalysisMetrics(registry))) {
            List<RuleOutcome> outcomes = service.analyzeAll(rules, range);
            new ReportWriter().write(outcomes, System.out);
            System.out.println();
        } finally {
            LOG.info("Metrics: {}", registry.getMetersAsString());
            healthServer.stop();
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnalysisRulesConfig loadRules(ServiceConfig config) {
        String rulesPath = config.getRulesPath();
        if (rulesPath != null && !rulesPath.isBlank()) {
            return AnalysisRulesLoader.fromFile(rulesPath);
        }
        return AnalysisRulesLoader.load();
    }
}
