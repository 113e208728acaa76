package com.pulsesentinel.core.model;

import com.pulsesentinel.core.config.JsonSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Alert} and its lifecycle transitions.
 */
class AlertTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    @DisplayName("Should default to active status")
    void shouldDefaultToActive() {
        Alert alert = alert();

        assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACTIVE);
        assertThat(alert.isOpen()).isTrue();
    }

    @Test
    @DisplayName("Should move active to acknowledged to resolved")
    void shouldFollowLifecycle() {
        Alert acked = alert().acknowledge("alice", T0.plusSeconds(60));
        Alert resolved = acked.resolve(T0.plusSeconds(120));

        assertThat(acked.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(acked.getAcknowledgedBy()).isEqualTo("alice");
        assertThat(resolved.getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(resolved.getResolvedAt()).isEqualTo(T0.plusSeconds(120));
        assertThat(resolved.getAcknowledgedAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(resolved.isOpen()).isFalse();
    }

    @Test
    @DisplayName("Should refuse transitions out of resolved")
    void shouldRefuseTransitionsOutOfResolved() {
        Alert resolved = alert().resolve(T0);

        assertThatThrownBy(() -> resolved.acknowledge("bob", T0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("resolved");
        assertThatThrownBy(() -> resolved.resolve(T0))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should require id, rule id, severity and trigger time")
    void shouldRequireMandatoryFields() {
        assertThatThrownBy(() -> Alert.builder().ruleId("r").severity(Severity.LOW).triggeredAt(T0).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("id");
    }

    @Test
    @DisplayName("Should serialise with snake_case keys and lowercase enums")
    void shouldSerialiseToJson() throws Exception {
        Alert alert = alert().acknowledge("alice", T0);

        String json = JsonSupport.mapper().writeValueAsString(alert);
        Alert back = JsonSupport.mapper().readValue(json, Alert.class);

        assertThat(json).contains("\"rule_id\":\"cpu-high\"")
                .contains("\"status\":\"acknowledged\"")
                .contains("\"severity\":\"high\"")
                .contains("\"triggered_at\":\"2024-05-01T10:00:00Z\"");
        assertThat(back).isEqualTo(alert);
        assertThat(back.getMetadata()).containsEntry("metric", "cpu_usage");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Alert alert() {
        return Alert.builder()
                .id("alert_1")
                .ruleId("cpu-high")
                .ruleName("CPU Usage High")
                .severity(Severity.HIGH)
                .triggeredAt(T0)
                .metricValue(92)
                .threshold(80)
                .metadata(Map.of("metric", "cpu_usage"))
                .build();
    }
}
