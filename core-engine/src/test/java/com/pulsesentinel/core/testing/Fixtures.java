package com.pulsesentinel.core.testing;

import com.pulsesentinel.core.model.Alert;
import com.pulsesentinel.core.model.AlertRule;
import com.pulsesentinel.core.model.Channel;
import com.pulsesentinel.core.model.ChannelType;
import com.pulsesentinel.core.model.EscalationRule;
import com.pulsesentinel.core.model.Severity;
import com.pulsesentinel.core.model.Template;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for commonly used test objects.
 */
public final class Fixtures {

    private Fixtures() {
        // utility class, not instantiable
    }

    public static AlertRule rule(String id, String metric, String operator, double threshold,
            String severity, long cooldownMinutes, String... channels) {
        AlertRule rule = new AlertRule();
        rule.setId(id);
        rule.setName(id + " rule");
        rule.setMetric(metric);
        rule.setOperator(operator);
        rule.setThreshold(threshold);
        rule.setSeverity(severity);
        rule.setCooldownMinutes(cooldownMinutes);
        rule.setChannels(List.of(channels));
        return rule;
    }

    public static Channel channel(String id, ChannelType type, Map<String, Object> config) {
        Channel channel = new Channel();
        channel.setId(id);
        channel.setName(id + " channel");
        channel.setType(type);
        channel.setEnabled(true);
        channel.setConfig(new LinkedHashMap<>(config));
        return channel;
    }

    public static Template template(String id, String subject, String body) {
        Template template = new Template();
        template.setId(id);
        template.setName(id);
        template.setSubject(subject);
        template.setBody(body);
        return template;
    }

    public static EscalationRule escalation(String id, long durationMinutes, String... severities) {
        EscalationRule rule = new EscalationRule();
        rule.setId(id);
        rule.setName(id);
        rule.getConditions().setSeverities(List.of(severities));
        rule.getConditions().setDurationMinutes(durationMinutes);
        return rule;
    }

    public static Alert alert(String id, Severity severity, Instant triggeredAt, String... channels) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("metric", "cpu_usage");
        metadata.put("operator", "gt");
        metadata.put("channels", List.of(channels));
        return Alert.builder()
                .id(id)
                .ruleId("cpu-high")
                .ruleName("CPU Usage High")
                .message("CPU Usage High: cpu_usage is 92.5 (threshold: 80)")
                .severity(severity)
                .triggeredAt(triggeredAt)
                .metricValue(92.5)
                .threshold(80)
                .metadata(metadata)
                .build();
    }
}
