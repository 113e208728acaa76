package com.pulsesentinel.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.pulsesentinel.core.model.Alert;
import com.pulsesentinel.core.model.AlertRule;
import com.pulsesentinel.core.model.AuditEntry;
import com.pulsesentinel.core.model.Channel;
import com.pulsesentinel.core.model.EscalationRule;
import com.pulsesentinel.core.model.MetricSnapshot;
import com.pulsesentinel.core.model.Template;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The full persisted configuration and state set of the engine.
 *
 * <p>
 * Two uses: the YAML seed file (usually only {@code alert_rules},
 * {@code channels}, {@code templates} and {@code escalation_rules}), and the
 * result of {@code exportConfiguration()}. A collection left {@code null}
 * means "not present"; {@code importConfiguration()} keeps the current
 * value for it.
 * </p>
 *
 * <pre>
 * alert_rules:
 *   - id: cpu-high
 *     metric: cpu_usage
 *     ...
 * channels:
 *   - id: slack-alerts
 *     type: slack
 *     ...
 * </pre>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertingConfig {

    private List<AlertRule> alertRules;
    private List<Channel> channels;
    private List<Template> templates;
    private List<EscalationRule> escalationRules;
    private List<AuditEntry> auditLog;
    private List<MetricSnapshot> metrics;
    private List<Alert> alerts;
    private Instant exportedAt;

    /**
     * Validate every rule, channel, template and escalation rule present.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more entries are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (alertRules != null) {
            Set<String> ids = new HashSet<>();
            for (int i = 0; i < alertRules.size(); i++) {
                AlertRule rule = Objects.requireNonNull(alertRules.get(i),
                        "Alert rule at index " + i + " is null");
                try {
                    rule.validate();
                } catch (IllegalStateException e) {
                    errors.add(e.getMessage());
                }
                if (rule.getId() != null && !ids.add(rule.getId())) {
                    errors.add("Duplicate alert rule id: '" + rule.getId() + "'");
                }
            }
        }
        if (channels != null) {
            for (Channel channel : channels) {
                if (channel.getId() == null || channel.getId().isBlank()) {
                    errors.add("Channel 'id' is required");
                }
                if (channel.getType() == null) {
                    errors.add("Channel '" + channel.getId() + "' requires 'type'");
                }
            }
        }
        if (templates != null) {
            for (Template template : templates) {
                if (template.getId() == null || template.getId().isBlank()) {
                    errors.add("Template 'id' is required");
                }
            }
        }
        if (escalationRules != null) {
            for (EscalationRule rule : escalationRules) {
                try {
                    rule.validate();
                } catch (IllegalStateException e) {
                    errors.add(e.getMessage());
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Alerting configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public List<AlertRule> getAlertRules() {
        return alertRules;
    }

    public void setAlertRules(List<AlertRule> alertRules) {
        this.alertRules = alertRules;
    }

    public List<Channel> getChannels() {
        return channels;
    }

    public void setChannels(List<Channel> channels) {
        this.channels = channels;
    }

    public List<Template> getTemplates() {
        return templates;
    }

    public void setTemplates(List<Template> templates) {
        this.templates = templates;
    }

    public List<EscalationRule> getEscalationRules() {
        return escalationRules;
    }

    public void setEscalationRules(List<EscalationRule> escalationRules) {
        this.escalationRules = escalationRules;
    }

    public List<AuditEntry> getAuditLog() {
        return auditLog;
    }

    public void setAuditLog(List<AuditEntry> auditLog) {
        this.auditLog = auditLog;
    }

    public List<MetricSnapshot> getMetrics() {
        return metrics;
    }

    public void setMetrics(List<MetricSnapshot> metrics) {
        this.metrics = metrics;
    }

    public List<Alert> getAlerts() {
        return alerts;
    }

    public void setAlerts(List<Alert> alerts) {
        this.alerts = alerts;
    }

    public Instant getExportedAt() {
        return exportedAt;
    }

    public void setExportedAt(Instant exportedAt) {
        this.exportedAt = exportedAt;
    }

    @Override
    public String toString() {
        return "AlertingConfig{" +
                "alertRules=" + size(alertRules) +
                ", channels=" + size(channels) +
                ", templates=" + size(templates) +
                ", escalationRules=" + size(escalationRules) +
                ", auditLog=" + size(auditLog) +
                ", metrics=" + size(metrics) +
                ", alerts=" + size(alerts) +
                '}';
    }

    private static String size(List<?> list) {
        return list == null ? "-" : String.valueOf(list.size());
    }
}
