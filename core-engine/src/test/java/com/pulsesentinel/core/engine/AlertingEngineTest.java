package com.pulsesentinel.core.engine;

import com.pulsesentinel.core.config.AlertingConfig;
import com.pulsesentinel.core.model.Alert;
import com.pulsesentinel.core.model.AlertRule;
import com.pulsesentinel.core.model.AlertStatus;
import com.pulsesentinel.core.model.AuditAction;
import com.pulsesentinel.core.model.AuditEntry;
import com.pulsesentinel.core.model.Channel;
import com.pulsesentinel.core.model.ChannelType;
import com.pulsesentinel.core.model.HealthStatus;
import com.pulsesentinel.core.model.MetricSnapshot;
import com.pulsesentinel.core.model.Template;
import com.pulsesentinel.core.store.InMemoryStateStore;
import com.pulsesentinel.core.store.PersistenceException;
import com.pulsesentinel.core.store.StateStore;
import com.pulsesentinel.core.store.StoreKey;
import com.pulsesentinel.core.testing.Fixtures;
import com.pulsesentinel.core.testing.MutableClock;
import com.pulsesentinel.core.testing.RecordingSender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertingEngine}.
 */
class AlertingEngineTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private MutableClock clock;
    private InMemoryStateStore store;
    private RecordingSender webhookSender;
    private AtomicReference<Double> cpu;
    private AlertingEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:00:00Z");
        store = new InMemoryStateStore();
        webhookSender = new RecordingSender(ChannelType.WEBHOOK);
        cpu = new AtomicReference<>(20.0);
        engine = newEngine(store);
    }

    @AfterEach
    void tearDown() {
        engine.stop();
    }

    @Test
    @DisplayName("Should trigger, notify and persist an alert when a collected metric breaches a rule")
    void shouldRunEndToEnd() {
        engine.start();
        cpu.set(95.0);

        MetricSnapshot snapshot = engine.collectNow();

        assertThat(snapshot.getValue(MetricSnapshot.CPU_USAGE)).contains(95.0);
        assertThat(engine.awaitPendingDispatches(WAIT)).isTrue();
        List<Alert> active = engine.getAlerts(AlertStatus.ACTIVE);
        assertThat(active).hasSize(1);
        assertThat(webhookSender.deliveredChannelIds()).containsExactly("ops");
        assertThat(engine.getAuditLog().query(10, active.get(0).getId()))
                .extracting(AuditEntry::getAction).containsExactly(AuditAction.SENT);
        assertThat(store.rawDocument(StoreKey.ALERTS)).hasValueSatisfying(
                json -> assertThat(json).contains(active.get(0).getId()));
        assertThat(engine.getMetrics(10)).containsExactly(snapshot);
    }

    @Test
    @DisplayName("Should evaluate an externally supplied snapshot")
    void shouldEvaluateExternalSnapshot() {
        engine.start();

        List<Alert> alerts = engine.evaluate(MetricSnapshot.builder(clock.instant())
                .value(MetricSnapshot.CPU_USAGE, 99).build());

        assertThat(alerts).hasSize(1);
        assertThat(engine.awaitPendingDispatches(WAIT)).isTrue();
        assertThat(webhookSender.deliveries()).hasSize(1);
    }

    @Test
    @DisplayName("Should persist acknowledgement and resolution")
    void shouldPersistLifecycleChanges() {
        engine.start();
        cpu.set(95.0);
        engine.collectNow();
        Alert alert = engine.getAlerts(null).get(0);

        engine.acknowledge(alert.getId(), "alice");
        assertThat(store.rawDocument(StoreKey.ALERTS).orElseThrow()).contains("\"acknowledged_by\":\"alice\"");

        engine.resolve(alert.getId());
        assertThat(engine.getAlerts(AlertStatus.RESOLVED)).extracting(Alert::getId).containsExactly(alert.getId());
        assertThat(engine.acknowledge("unknown", "alice")).isEmpty();
    }

    @Test
    @DisplayName("Should derive system status from health checks and active alerts")
    void shouldDeriveSystemStatus() {
        engine.start();
        assertThat(engine.getSystemStatus().getStatus()).isEqualTo(HealthStatus.HEALTHY);

        cpu.set(95.0);
        engine.collectNow();
        SystemStatus status = engine.getSystemStatus();

        assertThat(status.getStatus()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(status.getActiveAlerts()).isEqualTo(1);
        assertThat(status.getCriticalAlerts()).isEqualTo(1);

        engine.acknowledge(engine.getAlerts(null).get(0).getId(), "alice");
        assertThat(engine.getSystemStatus().getStatus()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    @DisplayName("Should prefer stored collections over the seed on start")
    void shouldRestoreFromStore() {
        Channel stored = Fixtures.channel("stored", ChannelType.EMAIL, Map.of("to_emails", "x@example.com"));
        store.save(StoreKey.CHANNELS, List.of(stored));

        engine.start();

        assertThat(engine.getChannelRegistry().list()).extracting(Channel::getId).containsExactly("stored");
        assertThat(engine.getRuleEngine().getRules()).extracting(AlertRule::getId).containsExactly("cpu-critical");
    }

    @Test
    @DisplayName("Should keep a rule cooling down across a restart on the same store")
    void shouldKeepCooldownAcrossRestart() {
        engine.start();
        cpu.set(95.0);
        engine.collectNow();
        assertThat(engine.awaitPendingDispatches(WAIT)).isTrue();
        engine.stop();

        clock.advance(Duration.ofMinutes(1));
        engine = newEngine(store);
        engine.start();
        engine.collectNow();

        assertThat(engine.getAlerts(null)).hasSize(1);
        assertThat(engine.getRuleEngine().lastTriggeredAt("cpu-critical"))
                .hasValue(engine.getAlerts(null).get(0).getTriggeredAt());

        clock.advance(Duration.ofMinutes(4));
        engine.collectNow();
        assertThat(engine.getAlerts(null)).hasSize(2);
    }

    @Test
    @DisplayName("Should not re-escalate an alert right after a restart")
    void shouldKeepEscalationWindowAcrossRestart() {
        engine.start();
        AlertingConfig escalation = new AlertingConfig();
        escalation.setEscalationRules(List.of(Fixtures.escalation("critical-unacked", 10, "critical")));
        engine.importConfiguration(escalation);
        cpu.set(95.0);
        engine.collectNow();
        assertThat(engine.awaitPendingDispatches(WAIT)).isTrue();

        clock.advance(Duration.ofMinutes(11));
        assertThat(engine.getEscalationManager().scan()).hasSize(1);
        engine.stop();

        clock.advance(Duration.ofMinutes(1));
        engine = newEngine(store);
        engine.start();
        assertThat(engine.getEscalationManager().scan()).isEmpty();

        clock.advance(Duration.ofMinutes(9));
        assertThat(engine.getEscalationManager().scan()).hasSize(1);
    }

    @Test
    @DisplayName("Should fail to start when stored state cannot be read")
    void shouldFailOnUnreadableStore() {
        engine.stop();
        engine = newEngine(new StateStore() {
            @Override
            public <T> Optional<List<T>> load(StoreKey<T> key) {
                throw new PersistenceException("disk on fire");
            }

            @Override
            public <T> void save(StoreKey<T> key, List<T> items) {
            }
        });

        assertThatThrownBy(engine::start)
                .isInstanceOf(IllegalStateException.class)
                .hasRootCauseMessage("disk on fire");
    }

    @Test
    @DisplayName("Should round-trip every collection through a JSON export")
    void shouldRoundTripExport() {
        engine.start();
        cpu.set(95.0);
        engine.collectNow();
        engine.awaitPendingDispatches(WAIT);

        String json = engine.exportConfigurationJson();

        AlertingEngine other = newEngine(new InMemoryStateStore());
        try {
            other.importConfigurationJson(json);
            AlertingConfig imported = other.exportConfiguration();
            AlertingConfig original = engine.exportConfiguration();

            assertThat(imported.getAlertRules()).isEqualTo(original.getAlertRules());
            assertThat(imported.getChannels()).isEqualTo(original.getChannels());
            assertThat(imported.getTemplates()).isEqualTo(original.getTemplates());
            assertThat(imported.getAlerts()).isEqualTo(original.getAlerts());
            assertThat(imported.getAuditLog()).extracting(AuditEntry::getId)
                    .containsExactlyElementsOf(original.getAuditLog().stream().map(AuditEntry::getId).toList());
            assertThat(imported.getMetrics()).isEqualTo(original.getMetrics());
        } finally {
            other.stop();
        }
        assertThat(json).contains("\"exported_at\"");
    }

    @Test
    @DisplayName("Should leave collections absent from an import untouched")
    void shouldImportPartially() {
        engine.start();
        AlertingConfig partial = new AlertingConfig();
        partial.setAlertRules(List.of(Fixtures.rule("mem", MetricSnapshot.MEMORY_USAGE, "gt", 90, "high", 5)));

        engine.importConfiguration(partial);

        assertThat(engine.getRuleEngine().getRules()).extracting(AlertRule::getId).containsExactly("mem");
        assertThat(engine.getChannelRegistry().list()).extracting(Channel::getId).containsExactly("ops");
        assertThat(store.rawDocument(StoreKey.ALERT_RULES).orElseThrow()).contains("\"mem\"");
    }

    @Test
    @DisplayName("Should reject a malformed import document")
    void shouldRejectMalformedImport() {
        assertThatThrownBy(() -> engine.importConfigurationJson("{not json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should stop idempotently and refuse further collection")
    void shouldStopIdempotently() {
        engine.start();

        engine.stop();
        engine.stop();

        assertThat(engine.getState()).isEqualTo(AlertingEngine.State.STOPPED);
        assertThatThrownBy(engine::collectNow).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(engine::start).isInstanceOf(IllegalStateException.class);
        assertThat(store.rawDocument(StoreKey.CHANNELS)).isPresent();
    }

    @Test
    @DisplayName("Should reject non-positive intervals at build time")
    void shouldValidateBuilder() {
        assertThatThrownBy(() -> AlertingEngine.builder()
                .metricsInterval(Duration.ZERO)
                .dispatchThreads(0)
                .build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("metricsInterval must be > 0")
                .hasMessageContaining("dispatchThreads must be > 0");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AlertingEngine newEngine(StateStore stateStore) {
        return AlertingEngine.builder()
                .clock(clock)
                .stateStore(stateStore)
                .seed(seed())
                .sender(webhookSender)
                .metricProbe(MetricSnapshot.CPU_USAGE, cpu::get)
                .metricsInterval(Duration.ofHours(1))
                .healthInterval(Duration.ofHours(1))
                .escalationInterval(Duration.ofHours(1))
                .dispatchTimeout(Duration.ofSeconds(2))
                .shutdownGrace(Duration.ofSeconds(2))
                .build();
    }

    private static AlertingConfig seed() {
        AlertingConfig config = new AlertingConfig();
        config.setAlertRules(List.of(
                Fixtures.rule("cpu-critical", MetricSnapshot.CPU_USAGE, "gt", 90, "critical", 5, "ops")));
        config.setChannels(List.of(
                Fixtures.channel("ops", ChannelType.WEBHOOK, Map.of("url", "http://ops.local/hook"))));
        config.setTemplates(List.of(
                Fixtures.template(Template.ALERT_TRIGGERED, "[{{severity}}] {{rule_name}}", "{{message}}")));
        return config;
    }
}
