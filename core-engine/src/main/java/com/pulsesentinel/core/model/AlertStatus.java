package com.pulsesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of an {@link Alert}.
 *
 * <p>
 * Legal transitions: {@code ACTIVE -> ACKNOWLEDGED -> RESOLVED} and
 * {@code ACTIVE -> RESOLVED}. {@code RESOLVED} is terminal.
 * </p>
 */
public enum AlertStatus {

    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED;

    /**
     * @param target the requested next state
     * @return {@code true} if moving from this state to {@code target} is legal
     */
    public boolean canTransitionTo(AlertStatus target) {
        return switch (this) {
            case ACTIVE -> target == ACKNOWLEDGED || target == RESOLVED;
            case ACKNOWLEDGED -> target == RESOLVED;
            case RESOLVED -> false;
        };
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertStatus fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Alert status must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
