package com.pulsesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One timestamped sample of every tracked metric.
 *
 * <p>
 * Metric values are held in a {@link Map} keyed by metric name so rules can
 * reference arbitrary metrics without a rigid schema. On the wire the values
 * are flattened next to the timestamp:
 * </p>
 *
 * <pre>
 * {"timestamp":"2024-01-01T00:00:00Z","cpu_usage":42.5,"memory_usage":61.0,...}
 * </pre>
 *
 * <h3>Immutability</h3>
 * <p>
 * Instances are immutable once built. Fields whose probe failed during
 * collection are listed in {@link #getDegradedFields()}; their value is the
 * collector's sentinel, not a real measurement.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MetricSnapshot {

    public static final String CPU_USAGE = "cpu_usage";
    public static final String MEMORY_USAGE = "memory_usage";
    public static final String RESPONSE_TIME = "response_time";
    public static final String ERROR_RATE = "error_rate";
    public static final String ACTIVE_USERS = "active_users";
    public static final String DB_CONNECTIONS = "db_connections";
    public static final String API_CALLS = "api_calls";

    private final Instant timestamp;

    private final Map<String, Double> values = new LinkedHashMap<>();

    private final Set<String> degradedFields = new LinkedHashSet<>();

    @JsonCreator
    private MetricSnapshot(@JsonProperty("timestamp") Instant timestamp) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    private MetricSnapshot(Builder builder) {
        this(builder.timestamp);
        this.values.putAll(builder.values);
        this.degradedFields.addAll(builder.degradedFields);
    }

    public static Builder builder(Instant timestamp) {
        return new Builder(timestamp);
    }

    // ---------------------------------------------------------------
    // Jackson dynamic-property support
    // ---------------------------------------------------------------

    @JsonAnySetter
    private void putValue(String key, Object raw) {
        if (raw instanceof Number n) {
            values.put(key, n.doubleValue());
        }
    }

    @JsonAnyGetter
    public Map<String, Double> getValues() {
        return Collections.unmodifiableMap(values);
    }

    @JsonProperty("degraded_fields")
    private void setDegradedFields(Set<String> fields) {
        if (fields != null) {
            degradedFields.addAll(fields);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Retrieve a metric value by name.
     *
     * @param metric metric name, e.g. {@link #CPU_USAGE}
     * @return the value, or empty if the metric was not sampled
     */
    public Optional<Double> getValue(String metric) {
        return Optional.ofNullable(values.get(metric));
    }

    @JsonProperty("degraded_fields")
    public Set<String> getDegradedFields() {
        return Collections.unmodifiableSet(degradedFields);
    }

    public boolean isDegraded(String metric) {
        return degradedFields.contains(metric);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Mutable accumulator used by the collector while probes run.
     */
    public static final class Builder {
        private final Instant timestamp;
        private final Map<String, Double> values = new LinkedHashMap<>();
        private final Set<String> degradedFields = new LinkedHashSet<>();

        private Builder(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        }

        public Builder value(String metric, double value) {
            values.put(Objects.requireNonNull(metric, "metric must not be null"), value);
            return this;
        }

        /**
         * Record a sentinel value for a metric whose probe failed.
         */
        public Builder degraded(String metric, double sentinel) {
            value(metric, sentinel);
            degradedFields.add(metric);
            return this;
        }

        public Optional<Double> peek(String metric) {
            return Optional.ofNullable(values.get(metric));
        }

        public int degradedCount() {
            return degradedFields.size();
        }

        public MetricSnapshot build() {
            return new MetricSnapshot(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSnapshot that))
            return false;
        return timestamp.equals(that.timestamp) && values.equals(that.values)
                && degradedFields.equals(that.degradedFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, values, degradedFields);
    }

    @Override
    public String toString() {
        return "MetricSnapshot{timestamp=" + timestamp + ", values=" + values
                + (degradedFields.isEmpty() ? "" : ", degraded=" + degradedFields) + '}';
    }
}
