package com.pulsesentinel.core.notify;

import java.util.Objects;

/**
 * Subject and body produced from a template, shared by every channel of one dispatch.
 */
public final class RenderedMessage {

    private final String subject;
    private final String body;

    public RenderedMessage(String subject, String body) {
        this.subject = Objects.requireNonNull(subject, "subject must not be null");
        this.body = Objects.requireNonNull(body, "body must not be null");
    }

    public String getSubject() {
        return subject;
    }

    public String getBody() {
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RenderedMessage that))
            return false;
        return subject.equals(that.subject) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, body);
    }

    @Override
    public String toString() {
        return "RenderedMessage{subject='" + subject + "'}";
    }
}
