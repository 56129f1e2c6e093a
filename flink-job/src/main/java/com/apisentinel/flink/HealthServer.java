package com.apisentinel.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server that exposes health and readiness endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – {@code 200} with {@code {"status":"UP", ...}} while
 * the process is alive</li>
 * <li>{@code GET /readiness} – {@code 200} once {@link #markReady()} was
 * called (pipeline submitted), {@code 503} before</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}; the body is written with Jackson.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean ready = new AtomicBoolean(false);
    private final String jobName;
    private final Instant startedAt = Instant.now();

    private HttpServer server;
    private ExecutorService executor;

    public HealthServer(String jobName) {
        this.jobName = jobName;
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; must be in range [0, 65535], 0 picks a
     *             free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", exchange -> respond(exchange, 200, status("UP")));
            server.createContext("/readiness", exchange -> {
                boolean isReady = ready.get();
                respond(exchange, isReady ? 200 : 503, status(isReady ? "READY" : "STARTING"));
            });

            executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Report the job as ready to serve.
     */
    public void markReady() {
        ready.set(true);
    }

    /**
     * Stop the health server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdown();
            LOG.info("Health server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return bound port, or {@code -1} if not running
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Map<String, Object> status(String status) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("job", jobName);
        body.put("startedAt", startedAt.toString());
        body.put("uptimeSeconds", Instant.now().getEpochSecond() - startedAt.getEpochSecond());
        return body;
    }

    private void respond(HttpExchange exchange, int code, Map<String, Object> body) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
