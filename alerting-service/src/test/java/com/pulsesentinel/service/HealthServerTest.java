package com.pulsesentinel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.pulsesentinel.core.config.JsonSupport;
import com.pulsesentinel.core.engine.SystemStatus;
import com.pulsesentinel.core.health.ServiceHealth;
import com.pulsesentinel.core.model.HealthStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HealthServer}.
 */
class HealthServerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final AtomicReference<Supplier<SystemStatus>> status = new AtomicReference<>();
    private final AtomicBoolean ready = new AtomicBoolean(true);
    private final HttpClient client = HttpClient.newHttpClient();
    private HealthServer server;

    @BeforeEach
    void setUp() {
        status.set(HealthServerTest::degradedSystem);
        server = new HealthServer(() -> status.get().get(), ready::get);
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Should bind a free port when started on port 0")
    void shouldBindFreePort() {
        assertThat(server.isRunning()).isTrue();
        assertThat(server.getPort()).isPositive();
    }

    @Test
    @DisplayName("Should serve the system status with checks and summary")
    void shouldServeHealthDocument() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).hasValue("application/json");
        JsonNode body = JsonSupport.mapper().readTree(response.body());
        assertThat(body.path("status").asText()).isEqualTo("degraded");
        assertThat(body.path("checks").path("database").path("status").asText()).isEqualTo("healthy");
        assertThat(body.path("checks").path("external_api").path("error").asText()).isEqualTo("HTTP 502");
        assertThat(body.path("summary").path("total_checks").asInt()).isEqualTo(2);
        assertThat(body.path("summary").path("healthy").asInt()).isEqualTo(1);
        assertThat(body.path("summary").path("unhealthy").asInt()).isEqualTo(1);
        assertThat(body.path("active_alerts").asInt()).isEqualTo(3);
        assertThat(body.path("critical_alerts").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should answer 500 when the status source fails")
    void shouldAnswer500OnFailure() throws Exception {
        status.set(() -> {
            throw new IllegalStateException("engine gone");
        });

        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(500);
        JsonNode body = JsonSupport.mapper().readTree(response.body());
        assertThat(body.path("status").asText()).isEqualTo("unhealthy");
        assertThat(body.path("error").asText()).isEqualTo("engine gone");
    }

    @Test
    @DisplayName("Should report readiness from the engine state")
    void shouldReportReadiness() throws Exception {
        HttpResponse<String> up = get("/readiness");
        ready.set(false);
        HttpResponse<String> down = get("/readiness");

        assertThat(up.statusCode()).isEqualTo(200);
        assertThat(up.body()).isEqualTo("{\"status\":\"UP\"}");
        assertThat(down.statusCode()).isEqualTo(503);
        assertThat(down.body()).isEqualTo("{\"status\":\"DOWN\"}");
    }

    @Test
    @DisplayName("Should count zero for statuses with no checks")
    void shouldCountMissingStatusesAsZero() {
        SystemStatus empty = new SystemStatus(HealthStatus.HEALTHY, Map.of(), 0, 0, NOW);

        JsonNode doc = HealthServer.healthDocument(empty);

        assertThat(doc.path("summary").path("total_checks").asInt()).isZero();
        assertThat(doc.path("summary").path("degraded").asInt()).isZero();
        assertThat(doc.path("timestamp").asText()).isEqualTo("2024-03-01T12:00:00Z");
    }

    @Test
    @DisplayName("Should reject a port outside the TCP range")
    void shouldRejectBadPort() {
        HealthServer other = new HealthServer(HealthServerTest::degradedSystem, () -> true);

        assertThatThrownBy(() -> other.start(70_000))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(other.getPort()).isEqualTo(-1);
    }

    @Test
    @DisplayName("Should treat a second stop as a no-op")
    void shouldStopOnce() {
        server.stop();
        server.stop();

        assertThat(server.isRunning()).isFalse();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(
                URI.create("http://127.0.0.1:" + server.getPort() + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static SystemStatus degradedSystem() {
        Map<String, ServiceHealth> checks = new LinkedHashMap<>();
        checks.put("database", new ServiceHealth("database", HealthStatus.HEALTHY, true, 12, NOW,
                null, Map.of("status_code", 200)));
        checks.put("external_api", new ServiceHealth("external_api", HealthStatus.UNHEALTHY, false, 40, NOW,
                "HTTP 502", Map.of()));
        return new SystemStatus(HealthStatus.DEGRADED, checks, 3, 1, NOW);
    }
}
