package com.pulsesentinel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pulsesentinel.core.config.JsonSupport;
import com.pulsesentinel.core.engine.SystemStatus;
import com.pulsesentinel.core.health.ServiceHealth;
import com.pulsesentinel.core.model.HealthStatus;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server that exposes health and readiness endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} - {@code 200 OK} with the system status, the
 * latest service checks and a per-status summary</li>
 * <li>{@code GET /readiness} - {@code 200} with {@code {"status":"UP"}}
 * while the engine runs, {@code 503} with {@code {"status":"DOWN"}}
 * otherwise</li>
 * </ul>
 *
 * <p>
 * Served by the JDK built-in {@link HttpServer} on a single daemon thread.
 * An exception from the status source answers {@code 500}.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final ObjectMapper MAPPER = JsonSupport.mapper();
    private static final byte[] UP = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] DOWN = "{\"status\":\"DOWN\"}".getBytes(StandardCharsets.UTF_8);

    private final Supplier<SystemStatus> status;
    private final BooleanSupplier ready;

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param status source of the current system status
     * @param ready  whether the engine is accepting work
     */
    public HealthServer(Supplier<SystemStatus> status, BooleanSupplier ready) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.ready = Objects.requireNonNull(ready, "ready must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", this::handleHealth);
            server.createContext("/readiness", this::handleReadiness);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
            throw new IllegalStateException("Failed to start health server on port " + port, e);
        }
    }

    /**
     * Stop the health server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
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
     * @return the bound port, or -1 if not started
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleHealth(HttpExchange exchange) throws IOException {
        try {
            respond(exchange, 200, MAPPER.writeValueAsBytes(healthDocument(status.get())));
        } catch (RuntimeException e) {
            LOG.error("Health endpoint failed", e);
            ObjectNode error = MAPPER.createObjectNode()
                    .put("status", HealthStatus.UNHEALTHY.id())
                    .put("error", String.valueOf(e.getMessage()));
            respond(exchange, 500, MAPPER.writeValueAsBytes(error));
        }
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        boolean up = ready.getAsBoolean();
        respond(exchange, up ? 200 : 503, up ? UP : DOWN);
    }

    static ObjectNode healthDocument(SystemStatus system) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("status", system.getStatus().id());
        root.put("timestamp", system.getTimestamp().toString());

        ObjectNode checks = root.putObject("checks");
        Map<HealthStatus, Integer> counts = new EnumMap<>(HealthStatus.class);
        for (ServiceHealth h : system.getChecks().values()) {
            ObjectNode check = checks.putObject(h.getService());
            check.put("status", h.getStatus().id());
            check.put("core", h.isCore());
            check.put("response_time", h.getResponseTimeMs());
            check.put("last_check", h.getLastCheck().toString());
            if (h.getErrorMessage() != null) {
                check.put("error", h.getErrorMessage());
            }
            check.set("details", MAPPER.valueToTree(h.getDetails()));
            counts.merge(h.getStatus(), 1, Integer::sum);
        }

        ObjectNode summary = root.putObject("summary");
        summary.put("total_checks", system.getChecks().size());
        for (HealthStatus s : HealthStatus.values()) {
            summary.put(s.id(), counts.getOrDefault(s, 0));
        }
        root.put("active_alerts", system.getActiveAlerts());
        root.put("critical_alerts", system.getCriticalAlerts());
        return root;
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
