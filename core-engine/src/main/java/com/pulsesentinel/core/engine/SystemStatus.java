package com.pulsesentinel.core.engine;

import com.pulsesentinel.core.health.ServiceHealth;
import com.pulsesentinel.core.model.HealthStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Overall health: the latest service checks combined with open alerts.
 */
public final class SystemStatus {

    private final HealthStatus status;
    private final Map<String, ServiceHealth> checks;
    private final int activeAlerts;
    private final int criticalAlerts;
    private final Instant timestamp;

    public SystemStatus(HealthStatus status, Map<String, ServiceHealth> checks, int activeAlerts,
            int criticalAlerts, Instant timestamp) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
        this.activeAlerts = activeAlerts;
        this.criticalAlerts = criticalAlerts;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public HealthStatus getStatus() {
        return status;
    }

    public Map<String, ServiceHealth> getChecks() {
        return checks;
    }

    public int getActiveAlerts() {
        return activeAlerts;
    }

    public int getCriticalAlerts() {
        return criticalAlerts;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "SystemStatus{status=" + status.id() + ", activeAlerts=" + activeAlerts
                + ", criticalAlerts=" + criticalAlerts + ", checks=" + checks.keySet() + '}';
    }
}
