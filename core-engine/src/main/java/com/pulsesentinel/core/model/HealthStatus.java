package com.pulsesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Health of a probed dependency, or of the system as a whole.
 * Declared from best to worst so {@code ordinal()} can be used to combine.
 */
public enum HealthStatus {

    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the worse of the two statuses
     */
    public HealthStatus worst(HealthStatus other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
