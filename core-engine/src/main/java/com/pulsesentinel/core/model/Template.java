package com.pulsesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Notification template with {@code {{variable}}} placeholders in subject
 * and body.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Template {

    public static final String ALERT_TRIGGERED = "alert-triggered";
    public static final String ALERT_ESCALATED = "alert-escalated";
    public static final String SYSTEM_HEALTH = "system-health";

    private String id;
    private String name;
    private String subject;
    private String body;

    /** Variables the template expects; informational. */
    private List<String> variables = new ArrayList<>();

    /** Channel type ids this template applies to; empty means all. */
    private List<String> channelTypes = new ArrayList<>();

    public Template() {
    }

    public Template(Template other) {
        Objects.requireNonNull(other, "Template must not be null");
        this.id = other.id;
        this.name = other.name;
        this.subject = other.subject;
        this.body = other.body;
        this.variables = new ArrayList<>(other.variables);
        this.channelTypes = new ArrayList<>(other.channelTypes);
    }

    /**
     * @param type channel type
     * @return {@code true} if this template may be rendered for {@code type}
     */
    public boolean appliesTo(ChannelType type) {
        return channelTypes.isEmpty()
                || channelTypes.stream().anyMatch(t -> t.equalsIgnoreCase(type.id()));
    }

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

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public List<String> getVariables() {
        return variables;
    }

    public void setVariables(List<String> variables) {
        this.variables = variables != null ? new ArrayList<>(variables) : new ArrayList<>();
    }

    public List<String> getChannelTypes() {
        return channelTypes;
    }

    public void setChannelTypes(List<String> channelTypes) {
        this.channelTypes = channelTypes != null ? new ArrayList<>(channelTypes) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Template that))
            return false;
        return Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && Objects.equals(subject, that.subject)
                && Objects.equals(body, that.body)
                && Objects.equals(variables, that.variables)
                && Objects.equals(channelTypes, that.channelTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, subject, body);
    }

    @Override
    public String toString() {
        return "Template{id='" + id + "', name='" + name + "'}";
    }
}
