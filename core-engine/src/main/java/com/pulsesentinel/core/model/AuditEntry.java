package com.pulsesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of a dispatch or lifecycle action.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = AuditEntry.Builder.class)
public final class AuditEntry {

    private final String id;
    private final Instant timestamp;
    private final AuditAction action;
    private final String alertId;
    private final String channelId;
    private final String userId;
    private final Map<String, Object> details;

    private AuditEntry(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.action = Objects.requireNonNull(builder.action, "action must not be null");
        this.alertId = builder.alertId;
        this.channelId = builder.channelId;
        this.userId = builder.userId;
        this.details = builder.details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.details))
                : Collections.emptyMap();
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder {
        private String id;
        private Instant timestamp;
        private AuditAction action;
        private String alertId;
        private String channelId;
        private String userId;
        private Map<String, Object> details;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder alertId(String alertId) {
            this.alertId = alertId;
            return this;
        }

        public Builder channelId(String channelId) {
            this.channelId = channelId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(this);
        }
    }

    public String getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public AuditAction getAction() {
        return action;
    }

    public String getAlertId() {
        return alertId;
    }

    public String getChannelId() {
        return channelId;
    }

    public String getUserId() {
        return userId;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AuditEntry that))
            return false;
        return id.equals(that.id)
                && timestamp.equals(that.timestamp)
                && action == that.action
                && Objects.equals(alertId, that.alertId)
                && Objects.equals(channelId, that.channelId)
                && Objects.equals(userId, that.userId)
                && details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, timestamp, action);
    }

    @Override
    public String toString() {
        return "AuditEntry{" + action.id() + " alert=" + alertId
                + (channelId != null ? " channel=" + channelId : "")
                + " at " + timestamp + '}';
    }
}
