package com.pulsesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Notification transport families.
 */
public enum ChannelType {

    EMAIL,
    SMS,
    WEBHOOK,
    SLACK,
    TEAMS,
    DISCORD;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param value identifier such as {@code "slack"}, case-insensitive
     * @return the channel type
     * @throws IllegalArgumentException if {@code value} is unknown or {@code null}
     */
    @JsonCreator
    public static ChannelType fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Channel type must not be null");
        }
        for (ChannelType t : values()) {
            if (t.id().equalsIgnoreCase(value.trim())) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown channel type: '" + value
                + "'. Supported: email, sms, webhook, slack, teams, discord");
    }
}
