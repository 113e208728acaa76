package com.pulsesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of action recorded in the audit log.
 */
public enum AuditAction {

    SENT,
    FAILED,
    ESCALATED,
    RESOLVED,
    ACKNOWLEDGED;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AuditAction fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Audit action must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
