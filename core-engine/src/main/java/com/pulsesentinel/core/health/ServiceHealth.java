package com.pulsesentinel.core.health;

import com.pulsesentinel.core.model.HealthStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a single service probe.
 *
 * @since 1.0.0
 */
public final class ServiceHealth {

    private final String service;
    private final HealthStatus status;
    private final boolean core;
    private final long responseTimeMs;
    private final Instant lastCheck;
    private final String errorMessage;
    private final Map<String, Object> details;

    public ServiceHealth(String service, HealthStatus status, boolean core, long responseTimeMs,
            Instant lastCheck, String errorMessage, Map<String, Object> details) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.core = core;
        this.responseTimeMs = responseTimeMs;
        this.lastCheck = Objects.requireNonNull(lastCheck, "lastCheck must not be null");
        this.errorMessage = errorMessage;
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Collections.emptyMap();
    }

    public String getService() {
        return service;
    }

    public HealthStatus getStatus() {
        return status;
    }

    /** Core services (database, internal API) make the system unhealthy when down. */
    public boolean isCore() {
        return core;
    }

    public long getResponseTimeMs() {
        return responseTimeMs;
    }

    public Instant getLastCheck() {
        return lastCheck;
    }

    /**
     * @return failure message, or {@code null} when the probe succeeded
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "ServiceHealth{" +
                "service='" + service + '\'' +
                ", status=" + status.id() +
                ", responseTimeMs=" + responseTimeMs +
                (errorMessage != null ? ", error='" + errorMessage + '\'' : "") +
                '}';
    }
}
