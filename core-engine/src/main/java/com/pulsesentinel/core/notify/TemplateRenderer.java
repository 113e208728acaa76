package com.pulsesentinel.core.notify;

import com.pulsesentinel.core.model.Alert;
import com.pulsesentinel.core.model.Template;
import com.pulsesentinel.core.rules.AlertRuleEngine;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Substitutes {@code {{variable}}} placeholders in template text.
 *
 * <p>
 * Whitespace inside the braces is ignored. A placeholder without a value is
 * left in the output verbatim; rendering never fails because of one.
 * </p>
 *
 * @since 1.0.0
 */
public class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.]+)\\s*\\}\\}");

    /** Human-readable timestamp format used for {@code triggered_at} and friends. */
    public static final String TIMESTAMP_PATTERN = "dd/MM/yyyy HH:mm:ss";

    private final DateTimeFormatter timestampFormat;

    public TemplateRenderer(ZoneId zone) {
        this.timestampFormat = DateTimeFormatter.ofPattern(TIMESTAMP_PATTERN)
                .withZone(Objects.requireNonNull(zone, "zone must not be null"));
    }

    public RenderedMessage render(Template template, Map<String, String> variables) {
        Objects.requireNonNull(template, "template must not be null");
        return new RenderedMessage(
                render(template.getSubject(), variables),
                render(template.getBody(), variables));
    }

    /**
     * @param text      template text, {@code null} renders as empty
     * @param variables values by placeholder name
     * @return the substituted text
     */
    public String render(String text, Map<String, String> variables) {
        if (text == null) {
            return "";
        }
        Matcher m = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (m.find()) {
            String value = variables.get(m.group(1));
            m.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : m.group()));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Build the variables an alert exposes to templates. Metadata entries
     * (metric, operator, ...) are included unless they clash with a core field.
     */
    public Map<String, String> variablesFor(Alert alert) {
        Map<String, String> vars = new LinkedHashMap<>();
        alert.getMetadata().forEach((k, v) -> vars.put(k, stringify(v)));

        vars.put("id", alert.getId());
        vars.put("alert_id", alert.getId());
        vars.put("rule_id", alert.getRuleId());
        putIfPresent(vars, "rule_name", alert.getRuleName());
        putIfPresent(vars, "message", alert.getMessage());
        vars.put("severity", alert.getSeverity().id());
        vars.put("status", alert.getStatus().id());
        vars.put("metric_value", AlertRuleEngine.format(alert.getMetricValue()));
        vars.put("threshold", AlertRuleEngine.format(alert.getThreshold()));
        vars.put("triggered_at", formatTimestamp(alert.getTriggeredAt()));
        putIfPresent(vars, "acknowledged_by", alert.getAcknowledgedBy());
        if (alert.getAcknowledgedAt() != null) {
            vars.put("acknowledged_at", formatTimestamp(alert.getAcknowledgedAt()));
        }
        if (alert.getResolvedAt() != null) {
            vars.put("resolved_at", formatTimestamp(alert.getResolvedAt()));
        }
        return vars;
    }

    public String formatTimestamp(Instant instant) {
        return timestampFormat.format(instant);
    }

    private static void putIfPresent(Map<String, String> vars, String key, String value) {
        if (value != null) {
            vars.put(key, value);
        }
    }

    private static String stringify(Object value) {
        if (value instanceof Collection<?> c) {
            return c.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
        if (value instanceof Double d) {
            return AlertRuleEngine.format(d);
        }
        return String.valueOf(value);
    }
}
