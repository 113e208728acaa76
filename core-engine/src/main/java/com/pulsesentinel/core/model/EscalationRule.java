package com.pulsesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Secondary notification policy for alerts left unattended.
 *
 * <pre>
 * - id: critical-unacked
 *   name: Critical alerts unacknowledged for 10 minutes
 *   enabled: true
 *   conditions:
 *     severities: [critical]
 *     duration_minutes: 10
 *     no_acknowledgment: true
 *   actions:
 *     channel_ids: [sms-admin]
 *     escalate_to: ["+33123456789"]
 *     auto_resolve: false
 * </pre>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EscalationRule {

    private String id;
    private String name;
    private boolean enabled = true;
    private Conditions conditions = new Conditions();
    private Actions actions = new Actions();

    public EscalationRule() {
    }

    public EscalationRule(EscalationRule other) {
        Objects.requireNonNull(other, "EscalationRule must not be null");
        this.id = other.id;
        this.name = other.name;
        this.enabled = other.enabled;
        this.conditions = new Conditions(other.conditions);
        this.actions = new Actions(other.actions);
    }

    /**
     * @throws IllegalStateException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (id == null || id.isBlank()) {
            errors.add("Escalation rule 'id' is required");
        }
        if (conditions.durationMinutes <= 0) {
            errors.add("Escalation rule '" + id + "' requires 'duration_minutes' > 0");
        }
        if (conditions.severities.isEmpty()) {
            errors.add("Escalation rule '" + id + "' requires at least one severity");
        }
        for (String s : conditions.severities) {
            try {
                Severity.fromId(s);
            } catch (IllegalArgumentException e) {
                errors.add("Escalation rule '" + id + "': " + e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid EscalationRule: " + String.join("; ", errors));
        }
    }

    /**
     * @param severity alert severity
     * @return {@code true} if this rule covers {@code severity}
     */
    public boolean matches(Severity severity) {
        return conditions.severities.stream().anyMatch(s -> s.equalsIgnoreCase(severity.id()));
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Conditions getConditions() {
        return conditions;
    }

    public void setConditions(Conditions conditions) {
        this.conditions = conditions != null ? conditions : new Conditions();
    }

    public Actions getActions() {
        return actions;
    }

    public void setActions(Actions actions) {
        this.actions = actions != null ? actions : new Actions();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EscalationRule that))
            return false;
        return Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && enabled == that.enabled
                && Objects.equals(conditions, that.conditions)
                && Objects.equals(actions, that.actions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, enabled);
    }

    @Override
    public String toString() {
        return "EscalationRule{id='" + id + "', severities=" + conditions.severities
                + ", durationMinutes=" + conditions.durationMinutes + '}';
    }

    // ---------------------------------------------------------------
    // Nested types
    // ---------------------------------------------------------------

    /**
     * When an alert qualifies for escalation.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Conditions {
        private List<String> severities = new ArrayList<>();
        private long durationMinutes;

        /** When {@code false}, acknowledged but unresolved alerts escalate too. */
        private boolean noAcknowledgment = true;

        public Conditions() {
        }

        Conditions(Conditions other) {
            this.severities = new ArrayList<>(other.severities);
            this.durationMinutes = other.durationMinutes;
            this.noAcknowledgment = other.noAcknowledgment;
        }

        @JsonIgnore
        public Duration getDuration() {
            return Duration.ofMinutes(durationMinutes);
        }

        public List<String> getSeverities() {
            return severities;
        }

        public void setSeverities(List<String> severities) {
            this.severities = severities != null ? new ArrayList<>(severities) : new ArrayList<>();
        }

        public long getDurationMinutes() {
            return durationMinutes;
        }

        public void setDurationMinutes(long durationMinutes) {
            this.durationMinutes = durationMinutes;
        }

        public boolean isNoAcknowledgment() {
            return noAcknowledgment;
        }

        public void setNoAcknowledgment(boolean noAcknowledgment) {
            this.noAcknowledgment = noAcknowledgment;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Conditions that))
                return false;
            return durationMinutes == that.durationMinutes
                    && noAcknowledgment == that.noAcknowledgment
                    && Objects.equals(severities, that.severities);
        }

        @Override
        public int hashCode() {
            return Objects.hash(severities, durationMinutes, noAcknowledgment);
        }
    }

    /**
     * What happens on escalation.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Actions {
        private List<String> channelIds = new ArrayList<>();

        /** Extra recipients (addresses, numbers) for email and sms channels. */
        private List<String> escalateTo = new ArrayList<>();

        private boolean autoResolve;

        public Actions() {
        }

        Actions(Actions other) {
            this.channelIds = new ArrayList<>(other.channelIds);
            this.escalateTo = new ArrayList<>(other.escalateTo);
            this.autoResolve = other.autoResolve;
        }

        public List<String> getChannelIds() {
            return channelIds;
        }

        public void setChannelIds(List<String> channelIds) {
            this.channelIds = channelIds != null ? new ArrayList<>(channelIds) : new ArrayList<>();
        }

        public List<String> getEscalateTo() {
            return escalateTo;
        }

        public void setEscalateTo(List<String> escalateTo) {
            this.escalateTo = escalateTo != null ? new ArrayList<>(escalateTo) : new ArrayList<>();
        }

        public boolean isAutoResolve() {
            return autoResolve;
        }

        public void setAutoResolve(boolean autoResolve) {
            this.autoResolve = autoResolve;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Actions that))
                return false;
            return autoResolve == that.autoResolve
                    && Objects.equals(channelIds, that.channelIds)
                    && Objects.equals(escalateTo, that.escalateTo);
        }

        @Override
        public int hashCode() {
            return Objects.hash(channelIds, escalateTo, autoResolve);
        }
    }
}
