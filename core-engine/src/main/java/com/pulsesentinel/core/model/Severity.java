package com.pulsesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Alert severity, ordered from least to most urgent.
 *
 * <p>
 * Each level carries the hex colour used by chat-style channels
 * (Slack attachments, Teams theme colour, Discord embeds).
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW("#0080FF"),
    MEDIUM("#FFD700"),
    HIGH("#FF8C00"),
    CRITICAL("#FF0000");

    private final String color;

    Severity(String color) {
        this.color = color;
    }

    /**
     * @return hex colour, e.g. {@code #FF0000}
     */
    public String getColor() {
        return color;
    }

    /**
     * @return the colour as a decimal RGB integer
     */
    public int getColorValue() {
        return Integer.parseInt(color.substring(1), 16);
    }

    /**
     * @return lowercase wire identifier, e.g. {@code critical}
     */
    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a wire identifier (case-insensitive).
     *
     * @param value identifier such as {@code "high"}
     * @return the severity
     * @throws IllegalArgumentException if {@code value} is unknown or {@code null}
     */
    @JsonCreator
    public static Severity fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Severity must not be null");
        }
        for (Severity s : values()) {
            if (s.id().equalsIgnoreCase(value.trim())) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown severity: '" + value
                + "'. Supported: low, medium, high, critical");
    }
}
