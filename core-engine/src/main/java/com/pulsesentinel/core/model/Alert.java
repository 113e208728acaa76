package com.pulsesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A materialised rule breach with its own lifecycle.
 *
 * <p>
 * Instances are immutable. Lifecycle changes produce a new instance through
 * {@link #acknowledge(String, Instant)} and {@link #resolve(Instant)}; only
 * {@code AlertStore} performs them.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code ruleId}, {@code severity} and
 * {@code triggeredAt} are required; omitting any of them throws a
 * {@link NullPointerException} at build time. Status defaults to
 * {@link AlertStatus#ACTIVE}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = Alert.Builder.class)
public final class Alert {

    private final String id;
    private final String ruleId;
    private final String ruleName;
    private final String message;
    private final Severity severity;
    private final AlertStatus status;
    private final Instant triggeredAt;
    private final Instant acknowledgedAt;
    private final String acknowledgedBy;
    private final Instant resolvedAt;
    private final double metricValue;
    private final double threshold;

    /** Free-form context: metric, operator, target channels. */
    private final Map<String, Object> metadata;

    private Alert(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.ruleId = Objects.requireNonNull(builder.ruleId, "ruleId must not be null");
        this.ruleName = builder.ruleName;
        this.message = builder.message;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.status = builder.status != null ? builder.status : AlertStatus.ACTIVE;
        this.triggeredAt = Objects.requireNonNull(builder.triggeredAt, "triggeredAt must not be null");
        this.acknowledgedAt = builder.acknowledgedAt;
        this.acknowledgedBy = builder.acknowledgedBy;
        this.resolvedAt = builder.resolvedAt;
        this.metricValue = builder.metricValue;
        this.threshold = builder.threshold;
        this.metadata = builder.metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata))
                : Collections.emptyMap();
    }

    // ---------------------------------------------------------------
    // Lifecycle transitions
    // ---------------------------------------------------------------

    /**
     * @param actor who acknowledged the alert
     * @param at    acknowledgement time
     * @return acknowledged copy of this alert
     * @throws IllegalStateException if this alert is not {@code ACTIVE}
     */
    public Alert acknowledge(String actor, Instant at) {
        requireTransition(AlertStatus.ACKNOWLEDGED);
        return toBuilder()
                .status(AlertStatus.ACKNOWLEDGED)
                .acknowledgedBy(actor)
                .acknowledgedAt(at)
                .build();
    }

    /**
     * @param at resolution time
     * @return resolved copy of this alert
     * @throws IllegalStateException if this alert is already {@code RESOLVED}
     */
    public Alert resolve(Instant at) {
        requireTransition(AlertStatus.RESOLVED);
        return toBuilder()
                .status(AlertStatus.RESOLVED)
                .resolvedAt(at)
                .build();
    }

    private void requireTransition(AlertStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Alert " + id + " cannot move from " + status.id() + " to " + target.id());
        }
    }

    @JsonIgnore
    public boolean isOpen() {
        return status != AlertStatus.RESOLVED;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .ruleId(ruleId)
                .ruleName(ruleName)
                .message(message)
                .severity(severity)
                .status(status)
                .triggeredAt(triggeredAt)
                .acknowledgedAt(acknowledgedAt)
                .acknowledgedBy(acknowledgedBy)
                .resolvedAt(resolvedAt)
                .metricValue(metricValue)
                .threshold(threshold)
                .metadata(metadata);
    }

    /**
     * Fluent builder for {@link Alert} instances, also used by Jackson.
     */
    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder {
        private String id;
        private String ruleId;
        private String ruleName;
        private String message;
        private Severity severity;
        private AlertStatus status;
        private Instant triggeredAt;
        private Instant acknowledgedAt;
        private String acknowledgedBy;
        private Instant resolvedAt;
        private double metricValue;
        private double threshold;
        private Map<String, Object> metadata;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder triggeredAt(Instant triggeredAt) {
            this.triggeredAt = triggeredAt;
            return this;
        }

        public Builder acknowledgedAt(Instant acknowledgedAt) {
            this.acknowledgedAt = acknowledgedAt;
            return this;
        }

        public Builder acknowledgedBy(String acknowledgedBy) {
            this.acknowledgedBy = acknowledgedBy;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder metricValue(double metricValue) {
            this.metricValue = metricValue;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException if a required field is missing
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getMessage() {
        return message;
    }

    public Severity getSeverity() {
        return severity;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public Instant getTriggeredAt() {
        return triggeredAt;
    }

    public Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public String getAcknowledgedBy() {
        return acknowledgedBy;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public double getMetricValue() {
        return metricValue;
    }

    public double getThreshold() {
        return threshold;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return id.equals(alert.id)
                && status == alert.status
                && Objects.equals(acknowledgedAt, alert.acknowledgedAt)
                && Objects.equals(resolvedAt, alert.resolvedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", ruleId='" + ruleId + '\'' +
                ", severity=" + severity.id() +
                ", status=" + status.id() +
                ", triggeredAt=" + triggeredAt +
                ", message='" + message + '\'' +
                '}';
    }
}
