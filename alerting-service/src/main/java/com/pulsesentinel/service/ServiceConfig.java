package com.pulsesentinel.service;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Optional;
import java.util.function.Function;

/**
 * Typed, immutable configuration for the alerting service process.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configurable through container env vars or a shell
 * environment. Optional endpoints (health probes, stats, relays) stay unset
 * when their variable is absent; the matching probe or channel type is then
 * simply not wired.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Schedules
    // ---------------------------------------------------------------
    private final long metricsIntervalMs;
    private final long healthIntervalMs;
    private final long escalationIntervalMs;

    // ---------------------------------------------------------------
    // Dispatch / shutdown
    // ---------------------------------------------------------------
    private final long dispatchTimeoutMs;
    private final long shutdownGraceMs;

    // ---------------------------------------------------------------
    // Storage / HTTP
    // ---------------------------------------------------------------
    private final String storeDir;
    private final int healthPort;

    // ---------------------------------------------------------------
    // Probed endpoints
    // ---------------------------------------------------------------
    private final String databaseHealthUrl;
    private final String internalApiUrl;
    private final String externalApiUrl;
    private final String statsUrl;
    private final long probeTimeoutMs;

    // ---------------------------------------------------------------
    // Message relays
    // ---------------------------------------------------------------
    private final String emailRelayUrl;
    private final String smsRelayUrl;

    private final ZoneId displayZone;

    private ServiceConfig(Builder b) {
        this.metricsIntervalMs = b.metricsIntervalMs;
        this.healthIntervalMs = b.healthIntervalMs;
        this.escalationIntervalMs = b.escalationIntervalMs;
        this.dispatchTimeoutMs = b.dispatchTimeoutMs;
        this.shutdownGraceMs = b.shutdownGraceMs;
        this.storeDir = b.storeDir;
        this.healthPort = b.healthPort;
        this.databaseHealthUrl = blankToNull(b.databaseHealthUrl);
        this.internalApiUrl = blankToNull(b.internalApiUrl);
        this.externalApiUrl = blankToNull(b.externalApiUrl);
        this.statsUrl = blankToNull(b.statsUrl);
        this.probeTimeoutMs = b.probeTimeoutMs;
        this.emailRelayUrl = blankToNull(b.emailRelayUrl);
        this.smsRelayUrl = blankToNull(b.smsRelayUrl);
        this.displayZone = b.displayZone;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * @param lookup variable name to value, {@code null} when unset
     */
    static ServiceConfig fromEnvironment(Function<String, String> lookup) {
        try {
            return new Builder()
                    .metricsIntervalMs(Long.parseLong(env(lookup, "METRICS_INTERVAL_MS", "30000")))
                    .healthIntervalMs(Long.parseLong(env(lookup, "HEALTH_INTERVAL_MS", "60000")))
                    .escalationIntervalMs(Long.parseLong(env(lookup, "ESCALATION_INTERVAL_MS", "60000")))
                    .dispatchTimeoutMs(Long.parseLong(env(lookup, "DISPATCH_TIMEOUT_MS", "10000")))
                    .shutdownGraceMs(Long.parseLong(env(lookup, "SHUTDOWN_GRACE_MS", "5000")))
                    .storeDir(env(lookup, "STORE_DIR", "./data"))
                    .healthPort(Integer.parseInt(env(lookup, "HEALTH_PORT", "8080")))
                    .databaseHealthUrl(env(lookup, "DATABASE_HEALTH_URL", ""))
                    .internalApiUrl(env(lookup, "INTERNAL_API_URL", ""))
                    .externalApiUrl(env(lookup, "EXTERNAL_API_URL", ""))
                    .statsUrl(env(lookup, "STATS_URL", ""))
                    .probeTimeoutMs(Long.parseLong(env(lookup, "PROBE_TIMEOUT_MS", "5000")))
                    .emailRelayUrl(env(lookup, "EMAIL_RELAY_URL", ""))
                    .smsRelayUrl(env(lookup, "SMS_RELAY_URL", ""))
                    .displayZone(ZoneId.of(env(lookup, "DISPLAY_ZONE", "UTC")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        } catch (DateTimeException e) {
            throw new IllegalStateException("Invalid DISPLAY_ZONE: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Duration getMetricsInterval() {
        return Duration.ofMillis(metricsIntervalMs);
    }

    public Duration getHealthInterval() {
        return Duration.ofMillis(healthIntervalMs);
    }

    public Duration getEscalationInterval() {
        return Duration.ofMillis(escalationIntervalMs);
    }

    public Duration getDispatchTimeout() {
        return Duration.ofMillis(dispatchTimeoutMs);
    }

    public Duration getShutdownGrace() {
        return Duration.ofMillis(shutdownGraceMs);
    }

    public String getStoreDir() {
        return storeDir;
    }

    public int getHealthPort() {
        return healthPort;
    }

    public Optional<String> getDatabaseHealthUrl() {
        return Optional.ofNullable(databaseHealthUrl);
    }

    public Optional<String> getInternalApiUrl() {
        return Optional.ofNullable(internalApiUrl);
    }

    public Optional<String> getExternalApiUrl() {
        return Optional.ofNullable(externalApiUrl);
    }

    public Optional<String> getStatsUrl() {
        return Optional.ofNullable(statsUrl);
    }

    public Duration getProbeTimeout() {
        return Duration.ofMillis(probeTimeoutMs);
    }

    public Optional<String> getEmailRelayUrl() {
        return Optional.ofNullable(emailRelayUrl);
    }

    public Optional<String> getSmsRelayUrl() {
        return Optional.ofNullable(smsRelayUrl);
    }

    public ZoneId getDisplayZone() {
        return displayZone;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that intervals and timeouts are
     * positive, the port is in [1, 65535] and the store directory is not blank.
     * </p>
     */
    public static class Builder {
        private long metricsIntervalMs = 30_000;
        private long healthIntervalMs = 60_000;
        private long escalationIntervalMs = 60_000;
        private long dispatchTimeoutMs = 10_000;
        private long shutdownGraceMs = 5_000;
        private String storeDir = "./data";
        private int healthPort = 8080;
        private String databaseHealthUrl;
        private String internalApiUrl;
        private String externalApiUrl;
        private String statsUrl;
        private long probeTimeoutMs = 5_000;
        private String emailRelayUrl;
        private String smsRelayUrl;
        private ZoneId displayZone = ZoneId.of("UTC");

        public Builder metricsIntervalMs(long v) {
            this.metricsIntervalMs = v;
            return this;
        }

        public Builder healthIntervalMs(long v) {
            this.healthIntervalMs = v;
            return this;
        }

        public Builder escalationIntervalMs(long v) {
            this.escalationIntervalMs = v;
            return this;
        }

        public Builder dispatchTimeoutMs(long v) {
            this.dispatchTimeoutMs = v;
            return this;
        }

        public Builder shutdownGraceMs(long v) {
            this.shutdownGraceMs = v;
            return this;
        }

        public Builder storeDir(String v) {
            this.storeDir = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder databaseHealthUrl(String v) {
            this.databaseHealthUrl = v;
            return this;
        }

        public Builder internalApiUrl(String v) {
            this.internalApiUrl = v;
            return this;
        }

        public Builder externalApiUrl(String v) {
            this.externalApiUrl = v;
            return this;
        }

        public Builder statsUrl(String v) {
            this.statsUrl = v;
            return this;
        }

        public Builder probeTimeoutMs(long v) {
            this.probeTimeoutMs = v;
            return this;
        }

        public Builder emailRelayUrl(String v) {
            this.emailRelayUrl = v;
            return this;
        }

        public Builder smsRelayUrl(String v) {
            this.smsRelayUrl = v;
            return this;
        }

        public Builder displayZone(ZoneId v) {
            this.displayZone = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            requirePositive(metricsIntervalMs, "metricsIntervalMs");
            requirePositive(healthIntervalMs, "healthIntervalMs");
            requirePositive(escalationIntervalMs, "escalationIntervalMs");
            requirePositive(dispatchTimeoutMs, "dispatchTimeoutMs");
            requirePositive(shutdownGraceMs, "shutdownGraceMs");
            requirePositive(probeTimeoutMs, "probeTimeoutMs");
            if (storeDir == null || storeDir.isBlank()) {
                throw new IllegalArgumentException("storeDir must not be null or blank");
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (displayZone == null) {
                throw new IllegalArgumentException("displayZone must not be null");
            }
            return new ServiceConfig(this);
        }

        private static void requirePositive(long value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Function<String, String> lookup, String name, String defaultValue) {
        String value = lookup.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "metricsIntervalMs=" + metricsIntervalMs +
                ", healthIntervalMs=" + healthIntervalMs +
                ", escalationIntervalMs=" + escalationIntervalMs +
                ", dispatchTimeoutMs=" + dispatchTimeoutMs +
                ", shutdownGraceMs=" + shutdownGraceMs +
                ", storeDir='" + storeDir + '\'' +
                ", healthPort=" + healthPort +
                ", databaseHealthUrl=" + databaseHealthUrl +
                ", internalApiUrl=" + internalApiUrl +
                ", externalApiUrl=" + externalApiUrl +
                ", statsUrl=" + statsUrl +
                ", probeTimeoutMs=" + probeTimeoutMs +
                ", emailRelayUrl=" + emailRelayUrl +
                ", smsRelayUrl=" + smsRelayUrl +
                ", displayZone=" + displayZone +
                '}';
    }
}
