package com.pfesentinel.service;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP front end of the monitor service.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: Returns {@code 200 OK} with body
 * {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness}: Same; Kubernetes readiness probe target</li>
 * <li>{@code POST /analyze}: Runs one analysis, see {@link AnalyzeHandler}</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorServer {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final int HTTP_THREADS = 4;

    private final HttpHandler analyzeHandler;
    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public MonitorServer(HttpHandler analyzeHandler) {
        this.analyzeHandler = Objects.requireNonNull(analyzeHandler, "analyzeHandler must not be null");
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; 0 picks an ephemeral port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "HTTP port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", MonitorServer::handleHealthCheck);
            server.createContext("/readiness", MonitorServer::handleHealthCheck);
            server.createContext("/analyze", analyzeHandler);

            AtomicInteger counter = new AtomicInteger();
            executor = Executors.newFixedThreadPool(HTTP_THREADS, r -> {
                Thread t = new Thread(r, "monitor-http-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            server.start();
            running.set(true);
            LOG.info("Monitor server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start monitor server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Monitor server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or -1 when not running
     */
    public int getPort() {
        return server != null && running.get() ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handler (shared between /health and /readiness)
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, HEALTH_RESPONSE.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(HEALTH_RESPONSE);
        }
    }
}
