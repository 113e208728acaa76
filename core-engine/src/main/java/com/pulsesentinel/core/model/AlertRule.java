package com.pulsesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A named threshold condition over one metric.
 *
 * <p>
 * Rules are authored by operators (YAML seed file, configuration import or
 * the rule CRUD calls) so they may arrive malformed. {@code operator} and
 * {@code severity} are therefore kept as raw strings and parsed on demand;
 * call {@link #validate()} to check a rule before trusting it.
 * </p>
 *
 * <pre>
 * - id: cpu-high
 *   name: CPU Usage High
 *   metric: cpu_usage
 *   operator: gt
 *   threshold: 80
 *   severity: high
 *   cooldown_minutes: 5
 *   channels: [browser, email-admin]
 * </pre>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertRule {

    private String id;

    private String name;

    /** Snapshot field the rule watches, e.g. {@code cpu_usage}. */
    private String metric;

    /** One of gt, gte, lt, lte, eq. */
    private String operator;

    /** Required; a rule without one is malformed. */
    private Double threshold;

    /** One of low, medium, high, critical. */
    private String severity;

    private boolean enabled = true;

    /** Minimum time between two triggers of this rule. */
    private long cooldownMinutes;

    /** Target channel ids. */
    private List<String> channels = new ArrayList<>();

    private Instant createdAt;

    private Instant updatedAt;

    public AlertRule() {
    }

    /**
     * Copy constructor.
     *
     * @param other rule to copy; must not be {@code null}
     */
    public AlertRule(AlertRule other) {
        Objects.requireNonNull(other, "AlertRule must not be null");
        this.id = other.id;
        this.name = other.name;
        this.metric = other.metric;
        this.operator = other.operator;
        this.threshold = other.threshold;
        this.severity = other.severity;
        this.enabled = other.enabled;
        this.cooldownMinutes = other.cooldownMinutes;
        this.channels = new ArrayList<>(other.channels);
        this.createdAt = other.createdAt;
        this.updatedAt = other.updatedAt;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that every field needed for evaluation is present and legal.
     *
     * @throws IllegalStateException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (id == null || id.isBlank()) {
            errors.add("Rule 'id' is required");
        }
        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (metric == null || metric.isBlank()) {
            errors.add("Rule '" + id + "' requires 'metric'");
        }
        try {
            ComparisonOperator.fromId(operator);
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + id + "': " + e.getMessage());
        }
        try {
            Severity.fromId(severity);
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + id + "': " + e.getMessage());
        }
        if (threshold == null) {
            errors.add("Rule '" + id + "' requires 'threshold'");
        } else if (Double.isNaN(threshold) || Double.isInfinite(threshold)) {
            errors.add("Rule '" + id + "' requires a finite 'threshold'");
        }
        if (cooldownMinutes < 0) {
            errors.add("Rule '" + id + "' requires 'cooldownMinutes' >= 0");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid AlertRule: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Typed views
    // ---------------------------------------------------------------

    /**
     * @throws IllegalArgumentException if the operator string is not recognised
     */
    @JsonIgnore
    public ComparisonOperator getComparisonOperator() {
        return ComparisonOperator.fromId(operator);
    }

    /**
     * @throws IllegalArgumentException if the severity string is not recognised
     */
    @JsonIgnore
    public Severity getSeverityLevel() {
        return Severity.fromId(severity);
    }

    @JsonIgnore
    public Duration getCooldown() {
        return Duration.ofMinutes(cooldownMinutes);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public String getOperator() {
        return operator;
    }

    /**
     * Set the operator, normalised to lowercase.
     */
    public void setOperator(String operator) {
        this.operator = operator != null ? operator.toLowerCase(Locale.ROOT) : null;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public String getSeverity() {
        return severity;
    }

    /**
     * Set the severity, normalised to lowercase.
     */
    public void setSeverity(String severity) {
        this.severity = severity != null ? severity.toLowerCase(Locale.ROOT) : null;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getCooldownMinutes() {
        return cooldownMinutes;
    }

    public void setCooldownMinutes(long cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }

    public List<String> getChannels() {
        return channels;
    }

    public void setChannels(List<String> channels) {
        this.channels = channels != null ? new ArrayList<>(channels) : new ArrayList<>();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRule that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", metric='" + metric + '\'' +
                ", operator='" + operator + '\'' +
                ", threshold=" + threshold +
                ", severity='" + severity + '\'' +
                ", enabled=" + enabled +
                ", cooldownMinutes=" + cooldownMinutes +
                '}';
    }
}
