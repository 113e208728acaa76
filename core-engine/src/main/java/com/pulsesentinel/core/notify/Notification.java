package com.pulsesentinel.core.notify;

import com.pulsesentinel.core.model.Alert;

import java.util.List;
import java.util.Objects;

/**
 * What a {@link ChannelSender} delivers: the alert, its rendered message and
 * any recipients added on top of the channel's own (escalation targets).
 */
public final class Notification {

    private final Alert alert;
    private final RenderedMessage message;
    private final List<String> extraRecipients;

    public Notification(Alert alert, RenderedMessage message, List<String> extraRecipients) {
        this.alert = Objects.requireNonNull(alert, "alert must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.extraRecipients = extraRecipients != null ? List.copyOf(extraRecipients) : List.of();
    }

    public Alert getAlert() {
        return alert;
    }

    public RenderedMessage getMessage() {
        return message;
    }

    public List<String> getExtraRecipients() {
        return extraRecipients;
    }
}
