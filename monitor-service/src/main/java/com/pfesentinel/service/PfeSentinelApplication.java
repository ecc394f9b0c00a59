package com.pfesentinel.service;

import com.pfesentinel.core.config.ConfigLoader;
import com.pfesentinel.core.config.DetectionConfig;
import com.pfesentinel.core.engine.AnalysisEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Main entry point for the PFE Sentinel monitor service.
 *
 * <h3>Flow</h3>
 *
 * <pre>
 *   POST /analyze (JSON series + parameters)
 *     → AnalyzePayload → AnalysisRequest + InMemorySeriesSource
 *     → AnalysisEngine (rules, isolation forest, ranking)
 *     → AnalysisReport → JSON
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link MonitorConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public final class PfeSentinelApplication {

    private static final Logger LOG = LoggerFactory.getLogger(PfeSentinelApplication.class);

    private PfeSentinelApplication() {
        // entry-point class
    }

    public static void main(String[] args) {
        // 1. Load configuration
        MonitorConfig config = MonitorConfig.fromEnvironment();
        LOG.info("Starting PFE Sentinel with config: {}", config);

        // 2. Load detection settings
        DetectionConfig detectionConfig = loadDetectionConfig(config);
        LOG.info("Loaded detection config: {}", detectionConfig);

        // 3. Start HTTP server with shutdown hook
        MonitorServer server = new MonitorServer(createAnalyzeHandler(config, detectionConfig, Clock.systemUTC()));
        server.start(config.getHttpPort());
        if (!server.isRunning()) {
            throw new IllegalStateException("Monitor server failed to start on port " + config.getHttpPort());
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "monitor-shutdown"));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static AnalyzeHandler createAnalyzeHandler(MonitorConfig config, DetectionConfig detectionConfig,
            Clock clock) {
        return new AnalyzeHandler(new JsonCodec(),
                source -> new AnalysisEngine(source, detectionConfig, clock, config.getMlWorkers()),
                config.getDefaultLookbackHours());
    }

    private static DetectionConfig loadDetectionConfig(MonitorConfig config) {
        String path = config.getDetectionConfigPath();
        if (path != null && !path.isBlank()) {
            return ConfigLoader.fromFile(path);
        }
        return ConfigLoader.load();
    }
}
