package com.cutlinesight.service;

import com.cutlinesight.core.analytics.AnalyticsEngine;
import com.cutlinesight.core.config.AnalyticsConfig;
import com.cutlinesight.core.config.AnalyticsConfigLoader;
import com.cutlinesight.core.ingest.EventValidator;
import com.cutlinesight.core.ingest.SessionAcquirer;
import com.cutlinesight.core.ingest.SyntheticEventGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Cutline Sight dashboard service.
 *
 * <h3>Startup</h3>
 *
 * <pre>
 *   ServiceConfig (env)
 *     → AnalyticsConfig (YAML)
 *     → HttpEventFeed → SessionAcquirer (synthetic fallback)
 *     → AnalyticsEngine
 *     → DashboardServer
 * </pre>
 *
 * <p>
 * The first acquisition starts right after the server is up; readiness
 * reports {@code ACQUIRING} until it completes. The process runs until it
 * receives a shutdown signal.
 * </p>
 *
 * @since 1.0.0
 */
public final class CutlineSightService {

    private static final Logger LOG = LoggerFactory.getLogger(CutlineSightService.class);

    private CutlineSightService() {
        // entry-point class
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Cutline Sight with config: {}", config);
        AnalyticsConfig analytics = loadAnalytics(config);

        // 2. Wire ingestion and analytics
        HttpEventFeed feed = HttpEventFeed.fromConfig(config);
        SessionAcquirer acquirer = new SessionAcquirer(
                feed,
                new EventValidator(analytics.getIngest()),
                new SyntheticEventGenerator(analytics),
                config.getSessionId());
        AnalyticsEngine engine = new AnalyticsEngine(analytics);

        // 3. Start the HTTP server with a shutdown hook
        DashboardServer server = new DashboardServer(
                acquirer, engine, analytics.getDisplay().defaultThreshold(), Clock.systemDefaultZone());
        server.start(config.getHttpPort());

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            shutdown.countDown();
        }, "dashboard-shutdown"));

        // 4. Acquire the first session
        acquirer.acquire();

        shutdown.await();
    }

    private static AnalyticsConfig loadAnalytics(ServiceConfig config) {
        String path = config.getAnalyticsConfigPath();
        if (path != null && !path.isBlank()) {
            return AnalyticsConfigLoader.fromFile(path);
        }
        return AnalyticsConfigLoader.load();
    }
}
