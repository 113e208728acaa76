package com.pulsesentinel.core.notify;

import com.pulsesentinel.core.model.Alert;
import com.pulsesentinel.core.model.Severity;
import com.pulsesentinel.core.model.Template;
import com.pulsesentinel.core.testing.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TemplateRenderer}.
 */
class TemplateRendererTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:15:30Z");

    private TemplateRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new TemplateRenderer(ZoneOffset.UTC);
    }

    @Test
    @DisplayName("Should substitute placeholders, tolerating inner whitespace")
    void shouldSubstitutePlaceholders() {
        String out = renderer.render("{{severity}} alert: {{ rule_name }}", Map.of(
                "severity", "high", "rule_name", "CPU Usage High"));

        assertThat(out).isEqualTo("high alert: CPU Usage High");
    }

    @Test
    @DisplayName("Should leave unknown placeholders verbatim")
    void shouldLeaveUnknownPlaceholders() {
        assertThat(renderer.render("Hello {{nobody}}!", Map.of())).isEqualTo("Hello {{nobody}}!");
    }

    @Test
    @DisplayName("Should not interpret replacement values as regex groups")
    void shouldQuoteReplacementValues() {
        assertThat(renderer.render("cost {{price}}", Map.of("price", "$5 \\o/"))).isEqualTo("cost $5 \\o/");
    }

    @Test
    @DisplayName("Should render null text as empty")
    void shouldRenderNullAsEmpty() {
        assertThat(renderer.render((String) null, Map.of())).isEmpty();
    }

    @Test
    @DisplayName("Should expose alert fields and metadata as variables")
    void shouldBuildVariablesFromAlert() {
        Alert alert = Fixtures.alert("alert_1", Severity.CRITICAL, T0, "ops", "mail")
                .acknowledge("alice", T0.plusSeconds(60));

        Map<String, String> vars = renderer.variablesFor(alert);

        assertThat(vars)
                .containsEntry("alert_id", "alert_1")
                .containsEntry("id", "alert_1")
                .containsEntry("rule_name", "CPU Usage High")
                .containsEntry("severity", "critical")
                .containsEntry("status", "acknowledged")
                .containsEntry("metric_value", "92.5")
                .containsEntry("threshold", "80")
                .containsEntry("triggered_at", "01/05/2024 10:15:30")
                .containsEntry("acknowledged_by", "alice")
                .containsEntry("acknowledged_at", "01/05/2024 10:16:30")
                .containsEntry("metric", "cpu_usage")
                .containsEntry("channels", "ops, mail")
                .doesNotContainKey("resolved_at");
    }

    @Test
    @DisplayName("Should render both subject and body of a template")
    void shouldRenderTemplate() {
        Template template = Fixtures.template("t", "[{{severity}}] {{rule_name}}", "{{message}} at {{triggered_at}}");
        Alert alert = Fixtures.alert("alert_1", Severity.HIGH, T0);

        RenderedMessage message = renderer.render(template, renderer.variablesFor(alert));

        assertThat(message.getSubject()).isEqualTo("[high] CPU Usage High");
        assertThat(message.getBody())
                .isEqualTo("CPU Usage High: cpu_usage is 92.5 (threshold: 80) at 01/05/2024 10:15:30");
    }
}
