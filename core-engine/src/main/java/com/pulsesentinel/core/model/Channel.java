package com.pulsesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A notification target.
 *
 * <p>
 * {@code config} is type-specific. Keys read by the built-in senders:
 * </p>
 * <ul>
 * <li>{@code webhook}: {@code url}, optional {@code headers} map</li>
 * <li>{@code slack}: {@code webhook_url}, {@code channel}, {@code username},
 * {@code icon_emoji}</li>
 * <li>{@code teams} / {@code discord}: {@code webhook_url}</li>
 * <li>{@code email}: {@code to_emails}</li>
 * <li>{@code sms}: {@code to_numbers}</li>
 * </ul>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Channel {

    public static final String TEST_SUCCESS = "success";
    public static final String TEST_FAILED = "failed";
    public static final String TEST_PENDING = "pending";

    private String id;
    private String name;
    private ChannelType type;
    private boolean enabled;
    private Map<String, Object> config = new LinkedHashMap<>();
    private String testStatus;
    private Instant lastUsed;

    public Channel() {
    }

    public Channel(Channel other) {
        Objects.requireNonNull(other, "Channel must not be null");
        this.id = other.id;
        this.name = other.name;
        this.type = other.type;
        this.enabled = other.enabled;
        this.config = new LinkedHashMap<>(other.config);
        this.testStatus = other.testStatus;
        this.lastUsed = other.lastUsed;
    }

    // ---------------------------------------------------------------
    // Config helpers
    // ---------------------------------------------------------------

    /**
     * @param key config key
     * @return the value as a string, or empty if absent or blank
     */
    public Optional<String> configString(String key) {
        Object raw = config.get(key);
        if (raw == null) {
            return Optional.empty();
        }
        String s = raw.toString();
        return s.isBlank() ? Optional.empty() : Optional.of(s);
    }

    /**
     * Read a list-valued config entry. A single string is treated as a
     * comma-separated list.
     *
     * @param key config key
     * @return list of non-blank entries, possibly empty
     */
    public List<String> configList(String key) {
        Object raw = config.get(key);
        List<String> out = new ArrayList<>();
        if (raw instanceof Collection<?> c) {
            for (Object o : c) {
                if (o != null && !o.toString().isBlank()) {
                    out.add(o.toString().trim());
                }
            }
        } else if (raw instanceof String s) {
            for (String part : s.split(",")) {
                if (!part.isBlank()) {
                    out.add(part.trim());
                }
            }
        }
        return out;
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

    public ChannelType getType() {
        return type;
    }

    public void setType(ChannelType type) {
        this.type = type;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public void setConfig(Map<String, Object> config) {
        this.config = config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>();
    }

    public String getTestStatus() {
        return testStatus;
    }

    public void setTestStatus(String testStatus) {
        this.testStatus = testStatus;
    }

    public Instant getLastUsed() {
        return lastUsed;
    }

    public void setLastUsed(Instant lastUsed) {
        this.lastUsed = lastUsed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Channel that))
            return false;
        return Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && type == that.type
                && enabled == that.enabled
                && Objects.equals(config, that.config)
                && Objects.equals(testStatus, that.testStatus)
                && Objects.equals(lastUsed, that.lastUsed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, enabled);
    }

    @Override
    public String toString() {
        // config may hold credentials, keep it out of logs
        return "Channel{id='" + id + "', name='" + name + "', type=" + type
                + ", enabled=" + enabled + '}';
    }
}
