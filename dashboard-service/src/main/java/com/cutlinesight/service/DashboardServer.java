package com.cutlinesight.service;

import com.cutlinesight.core.analytics.AnalyticsEngine;
import com.cutlinesight.core.analytics.DashboardSnapshot;
import com.cutlinesight.core.export.CsvExporter;
import com.cutlinesight.core.filter.ConfidenceThreshold;
import com.cutlinesight.core.filter.FilterParameters;
import com.cutlinesight.core.ingest.SessionAcquirer;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HTTP front end of the dashboard.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: always {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness}: {@code 200} once a session is installed,
 * {@code 503 {"status":"ACQUIRING"}} before</li>
 * <li>{@code GET /api/dashboard}: the {@link DashboardSnapshot} as JSON</li>
 * <li>{@code GET /api/events.csv}: the display list as a CSV download</li>
 * <li>{@code POST /api/refresh}: starts a new acquisition, {@code 202}</li>
 * </ul>
 *
 * <p>
 * Both data endpoints accept {@code range}, {@code from}, {@code to},
 * {@code confidence}, {@code size} and {@code chartSize} query parameters.
 * They read the same snapshot, so the CSV always matches the table.
 * </p>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} with one daemon worker thread.
 * </p>
 *
 * @since 1.0.0
 */
public class DashboardServer {

    private static final Logger LOG = LoggerFactory.getLogger(DashboardServer.class);

    private static final byte[] UP_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] ACQUIRING_RESPONSE = "{\"status\":\"ACQUIRING\"}".getBytes(StandardCharsets.UTF_8);

    private static final String JSON = "application/json";
    private static final String CSV = "text/csv; charset=utf-8";

    private final SessionAcquirer acquirer;
    private final AnalyticsEngine engine;
    private final ConfidenceThreshold defaultThreshold;
    private final Clock clock;
    private final SnapshotJsonWriter jsonWriter = new SnapshotJsonWriter();
    private final CsvExporter csvExporter = new CsvExporter();

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public DashboardServer(SessionAcquirer acquirer,
            AnalyticsEngine engine,
            ConfidenceThreshold defaultThreshold,
            Clock clock) {
        this.acquirer = Objects.requireNonNull(acquirer, "SessionAcquirer must not be null");
        this.engine = Objects.requireNonNull(engine, "AnalyticsEngine must not be null");
        this.defaultThreshold = Objects.requireNonNull(defaultThreshold, "defaultThreshold must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Start the server.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws UncheckedIOException     if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("HTTP port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind dashboard server on port " + port, e);
        }
        server.createContext("/health", route("GET", this::handleHealth));
        server.createContext("/readiness", route("GET", this::handleReadiness));
        server.createContext("/api/dashboard", route("GET", this::handleDashboard));
        server.createContext("/api/events.csv", route("GET", this::handleCsv));
        server.createContext("/api/refresh", route("POST", this::handleRefresh));

        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "dashboard-server");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.start();
        running.set(true);
        LOG.info("Dashboard server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdown();
            LOG.info("Dashboard server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port; meaningful only after {@link #start(int)}
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleHealth(HttpExchange exchange) throws IOException {
        send(exchange, 200, JSON, UP_RESPONSE);
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (acquirer.current().isPresent()) {
            send(exchange, 200, JSON, UP_RESPONSE);
        } else {
            send(exchange, 503, JSON, ACQUIRING_RESPONSE);
        }
    }

    private void handleDashboard(HttpExchange exchange) throws IOException {
        DashboardSnapshot snapshot = snapshotFor(exchange);
        send(exchange, 200, JSON, jsonWriter.write(snapshot));
    }

    private void handleCsv(HttpExchange exchange) throws IOException {
        DashboardSnapshot snapshot = snapshotFor(exchange);
        String fileName = CsvExporter.fileName(LocalDate.now(clock));
        exchange.getResponseHeaders().set("Content-Disposition", "attachment; filename=\"" + fileName + "\"");
        send(exchange, 200, CSV, csvExporter.export(snapshot.getEvents()).getBytes(StandardCharsets.UTF_8));
    }

    private void handleRefresh(HttpExchange exchange) throws IOException {
        acquirer.acquire();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ACQUIRING");
        body.put("requestId", acquirer.latestRequestId());
        body.put("requestedAt", Instant.now(clock));
        send(exchange, 202, JSON, jsonWriter.write(body));
    }

    private DashboardSnapshot snapshotFor(HttpExchange exchange) {
        FilterParameters params = parameters(exchange.getRequestURI().getRawQuery(), defaultThreshold);
        return engine.snapshot(acquirer.current(), params);
    }

    // ---------------------------------------------------------------
    // Request helpers
    // ---------------------------------------------------------------

    /**
     * @param rawQuery         undecoded query string; may be {@code null}
     * @param defaultThreshold threshold used when {@code confidence} is absent
     * @return the view parameters named by the query
     */
    static FilterParameters parameters(String rawQuery, ConfidenceThreshold defaultThreshold) {
        Map<String, String> query = parseQuery(rawQuery);
        return FilterParameters.builder(defaultThreshold)
                .timeRange(query.get("range"))
                .from(query.get("from"))
                .to(query.get("to"))
                .confidence(query.get("confidence"))
                .category(query.get("size"))
                .chartCategory(query.get("chartSize"))
                .build();
    }

    /**
     * First value wins for repeated keys.
     */
    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            params.putIfAbsent(key, value);
        }
        return params;
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }

    private static HttpHandler route(String method, HttpHandler handler) {
        return exchange -> {
            try {
                if (!exchange.getRequestURI().getPath().equals(exchange.getHttpContext().getPath())) {
                    send(exchange, 404, JSON, error("not found"));
                } else if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Allow", method);
                    send(exchange, 405, JSON, error("method not allowed"));
                } else {
                    handler.handle(exchange);
                }
            } catch (RuntimeException e) {
                LOG.error("Request {} {} failed: {}", exchange.getRequestMethod(),
                        exchange.getRequestURI(), e.getMessage(), e);
                send(exchange, 500, JSON, error("internal error"));
            } finally {
                exchange.close();
            }
        };
    }

    private static byte[] error(String message) {
        return ("{\"error\":\"" + message + "\"}").getBytes(StandardCharsets.UTF_8);
    }

    private static void send(HttpExchange exchange, int status, String contentType, byte[] body)
            throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
        if (body.length > 0) {
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        }
    }
}
