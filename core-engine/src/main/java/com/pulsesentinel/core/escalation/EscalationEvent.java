package com.pulsesentinel.core.escalation;

import com.pulsesentinel.core.notify.DeliveryResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One escalation of one alert under one escalation rule.
 */
public final class EscalationEvent {

    private final String alertId;
    private final String ruleId;
    private final String ruleName;
    private final Instant escalatedAt;
    private final Duration unacknowledgedFor;
    private final List<DeliveryResult> deliveries;
    private final boolean autoResolved;

    public EscalationEvent(String alertId, String ruleId, String ruleName, Instant escalatedAt,
            Duration unacknowledgedFor, List<DeliveryResult> deliveries, boolean autoResolved) {
        this.alertId = Objects.requireNonNull(alertId, "alertId must not be null");
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId must not be null");
        this.ruleName = ruleName;
        this.escalatedAt = Objects.requireNonNull(escalatedAt, "escalatedAt must not be null");
        this.unacknowledgedFor = Objects.requireNonNull(unacknowledgedFor, "unacknowledgedFor must not be null");
        this.deliveries = List.copyOf(deliveries);
        this.autoResolved = autoResolved;
    }

    public String getAlertId() {
        return alertId;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getRuleName() {
        return ruleName;
    }

    public Instant getEscalatedAt() {
        return escalatedAt;
    }

    /** Age of the alert when it was escalated. */
    public Duration getUnacknowledgedFor() {
        return unacknowledgedFor;
    }

    public List<DeliveryResult> getDeliveries() {
        return deliveries;
    }

    public boolean isAutoResolved() {
        return autoResolved;
    }

    @Override
    public String toString() {
        return "EscalationEvent{" +
                "alertId='" + alertId + '\'' +
                ", ruleId='" + ruleId + '\'' +
                ", unacknowledgedFor=" + unacknowledgedFor +
                ", deliveries=" + deliveries.size() +
                ", autoResolved=" + autoResolved +
                '}';
    }
}
