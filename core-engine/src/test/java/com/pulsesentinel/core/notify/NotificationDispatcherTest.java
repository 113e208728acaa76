package com.pulsesentinel.core.notify;

import com.pulsesentinel.core.audit.AuditLog;
import com.pulsesentinel.core.model.Alert;
import com.pulsesentinel.core.model.AuditAction;
import com.pulsesentinel.core.model.AuditEntry;
import com.pulsesentinel.core.model.Channel;
import com.pulsesentinel.core.model.ChannelType;
import com.pulsesentinel.core.model.Severity;
import com.pulsesentinel.core.model.Template;
import com.pulsesentinel.core.testing.Fixtures;
import com.pulsesentinel.core.testing.MutableClock;
import com.pulsesentinel.core.testing.RecordingSender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link NotificationDispatcher}.
 */
class NotificationDispatcherTest {

    private static final Duration CHANNEL_TIMEOUT = Duration.ofMillis(300);

    private MutableClock clock;
    private ChannelRegistry channels;
    private TemplateRegistry templates;
    private AuditLog auditLog;
    private RecordingSender webhookSender;
    private RecordingSender emailSender;
    private ExecutorService executor;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:00:00Z");
        channels = new ChannelRegistry(clock);
        templates = new TemplateRegistry();
        auditLog = new AuditLog(clock);
        webhookSender = new RecordingSender(ChannelType.WEBHOOK);
        emailSender = new RecordingSender(ChannelType.EMAIL);
        executor = Executors.newCachedThreadPool();

        templates.save(Fixtures.template(Template.ALERT_TRIGGERED, "[{{severity}}] {{rule_name}}", "{{message}}"));
        templates.save(Fixtures.template(Template.ALERT_ESCALATED, "Escalated: {{rule_name}}",
                "Open for {{duration}} minutes"));
        channels.save(Fixtures.channel("hook-a", ChannelType.WEBHOOK, Map.of("url", "http://a")));
        channels.save(Fixtures.channel("hook-b", ChannelType.WEBHOOK, Map.of("url", "http://b")));
        channels.save(Fixtures.channel("mail", ChannelType.EMAIL, Map.of("to_emails", "ops@example.com")));

        dispatcher = new NotificationDispatcher(channels, templates, new TemplateRenderer(ZoneOffset.UTC),
                List.of(webhookSender, emailSender), auditLog, executor, CHANNEL_TIMEOUT, clock);
    }

    @AfterEach
    void tearDown() {
        webhookSender.releaseHanging();
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should isolate a failing channel from the others")
    void shouldIsolateFailingChannel() {
        webhookSender.failFor("hook-b");
        Alert alert = alert();

        List<DeliveryResult> results = dispatcher.dispatch(alert, targets("hook-a", "hook-b", "mail"));

        assertThat(results).extracting(DeliveryResult::getChannelId).containsExactly("hook-a", "hook-b", "mail");
        assertThat(results).extracting(DeliveryResult::isSuccess).containsExactly(true, false, true);
        assertThat(results.get(1).getError()).isEqualTo("boom from hook-b");
        assertThat(webhookSender.deliveredChannelIds()).containsExactly("hook-a");
        assertThat(emailSender.deliveredChannelIds()).containsExactly("mail");
    }

    @Test
    @DisplayName("Should write one audit entry per channel attempt")
    void shouldAuditEveryAttempt() {
        webhookSender.failFor("hook-b");
        Alert alert = alert();

        dispatcher.dispatch(alert, targets("hook-a", "hook-b"));

        List<AuditEntry> audit = auditLog.query(10, alert.getId());
        assertThat(audit).hasSize(2);
        AuditEntry sent = audit.stream().filter(e -> e.getAction() == AuditAction.SENT).findFirst().orElseThrow();
        AuditEntry failed = audit.stream().filter(e -> e.getAction() == AuditAction.FAILED).findFirst().orElseThrow();
        assertThat(sent.getChannelId()).isEqualTo("hook-a");
        assertThat(sent.getDetails()).containsEntry("template", Template.ALERT_TRIGGERED)
                .containsEntry("channel_type", "webhook");
        assertThat(failed.getChannelId()).isEqualTo("hook-b");
        assertThat(failed.getDetails()).containsEntry("error", "boom from hook-b");
    }

    @Test
    @DisplayName("Should stamp last-used only on successful channels")
    void shouldMarkUsedOnSuccess() {
        webhookSender.failFor("hook-b");

        dispatcher.dispatch(alert(), targets("hook-a", "hook-b"));

        assertThat(channels.get("hook-a").orElseThrow().getLastUsed()).isEqualTo(clock.instant());
        assertThat(channels.get("hook-b").orElseThrow().getLastUsed()).isNull();
    }

    @Test
    @DisplayName("Should time out a hanging channel without delaying the others")
    void shouldTimeOutHangingChannel() {
        webhookSender.hangFor("hook-b");

        long start = System.nanoTime();
        List<DeliveryResult> results = dispatcher.dispatch(alert(), targets("hook-a", "hook-b", "mail"));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(results.get(0).isSuccess()).isTrue();
        assertThat(results.get(1).isSuccess()).isFalse();
        assertThat(results.get(1).getError()).isEqualTo("Timed out after 300 ms");
        assertThat(results.get(2).isSuccess()).isTrue();
        assertThat(elapsedMs).isLessThan(5_000);
    }

    @Test
    @DisplayName("Should render the template into the delivered message")
    void shouldRenderTemplate() {
        dispatcher.dispatch(alert(), targets("hook-a"));

        RecordingSender.Delivery delivery = webhookSender.deliveries().get(0);
        assertThat(delivery.notification.getMessage().getSubject()).isEqualTo("[high] CPU Usage High");
        assertThat(delivery.notification.getMessage().getBody()).startsWith("CPU Usage High: cpu_usage is 92.5");
    }

    @Test
    @DisplayName("Should pass extra variables and recipients through to senders")
    void shouldPassExtras() {
        dispatcher.dispatch(alert(), targets("mail"), Template.ALERT_ESCALATED,
                Map.of("duration", "12"), List.of("manager@example.com"));

        RecordingSender.Delivery delivery = emailSender.deliveries().get(0);
        assertThat(delivery.notification.getMessage().getBody()).isEqualTo("Open for 12 minutes");
        assertThat(delivery.notification.getExtraRecipients()).containsExactly("manager@example.com");
    }

    @Test
    @DisplayName("Should fail channels for missing templates, unsupported types and non-applicable templates")
    void shouldFailMisconfiguredDeliveries() {
        channels.save(Fixtures.channel("pager", ChannelType.SMS, Map.of("to_numbers", "+100")));
        Template emailOnly = Fixtures.template("email-only", "s", "b");
        emailOnly.setChannelTypes(List.of("email"));
        templates.save(emailOnly);

        DeliveryResult missing = dispatcher.dispatch(alert(), targets("hook-a"), "nope", Map.of(), List.of()).get(0);
        DeliveryResult unsupported = dispatcher.dispatch(alert(), targets("pager")).get(0);
        List<DeliveryResult> restricted = dispatcher.dispatch(alert(), targets("hook-a", "mail"), "email-only",
                Map.of(), List.of());

        assertThat(missing.getError()).isEqualTo("Template not found: nope");
        assertThat(unsupported.getError()).contains("Unsupported channel type");
        assertThat(restricted.get(0).getError()).contains("does not apply to webhook");
        assertThat(restricted.get(1).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("Should return no results for an empty target list")
    void shouldHandleNoTargets() {
        assertThat(dispatcher.dispatch(alert(), List.of())).isEmpty();
        assertThat(auditLog.size()).isZero();
    }

    @Test
    @DisplayName("Should report failures instead of throwing once the executor is shut down")
    void shouldReportShutdown() {
        executor.shutdown();

        List<DeliveryResult> results = dispatcher.dispatch(alert(), targets("hook-a"));

        assertThat(results.get(0).getError()).isEqualTo("Dispatcher is shut down");
    }

    @Test
    @DisplayName("Should test a disabled channel and record the outcome")
    void shouldTestChannel() {
        Channel disabled = channels.get("hook-a").orElseThrow();
        disabled.setEnabled(false);
        channels.save(disabled);

        DeliveryResult result = dispatcher.testChannel("hook-a");

        assertThat(result.isSuccess()).isTrue();
        assertThat(channels.get("hook-a").orElseThrow().getTestStatus()).isEqualTo(Channel.TEST_SUCCESS);
        Alert testAlert = webhookSender.deliveries().get(0).notification.getAlert();
        assertThat(testAlert.getRuleName()).isEqualTo("Test Alert");
        assertThat(testAlert.getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    @DisplayName("Should mark a channel failed when its test delivery fails")
    void shouldMarkFailedTest() {
        webhookSender.failFor("hook-b");

        DeliveryResult result = dispatcher.testChannel("hook-b");

        assertThat(result.isSuccess()).isFalse();
        assertThat(channels.get("hook-b").orElseThrow().getTestStatus()).isEqualTo(Channel.TEST_FAILED);
        assertThatThrownBy(() -> dispatcher.testChannel("missing"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Alert alert() {
        return Fixtures.alert("alert_" + System.nanoTime(), Severity.HIGH, clock.instant());
    }

    private List<Channel> targets(String... ids) {
        return List.of(ids).stream().map(id -> channels.get(id).orElseThrow()).toList();
    }
}
