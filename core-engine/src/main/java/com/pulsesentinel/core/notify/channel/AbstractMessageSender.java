package com.pulsesentinel.core.notify.channel;

import com.pulsesentinel.core.model.Channel;
import com.pulsesentinel.core.notify.ChannelDeliveryException;
import com.pulsesentinel.core.notify.ChannelSender;
import com.pulsesentinel.core.notify.MessageTransport;
import com.pulsesentinel.core.notify.Notification;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Base class for channels that hand {@code (recipients, subject, body)} to a
 * {@link MessageTransport}. Recipients are the channel's configured list plus
 * any extra recipients carried by the notification, without duplicates.
 */
public abstract class AbstractMessageSender implements ChannelSender {

    private final MessageTransport transport;

    protected AbstractMessageSender(MessageTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
    }

    protected abstract String recipientsKey();

    protected String body(Notification notification) {
        return notification.getMessage().getBody();
    }

    @Override
    public void deliver(Channel channel, Notification notification) throws ChannelDeliveryException {
        Set<String> recipients = new LinkedHashSet<>(channel.configList(recipientsKey()));
        recipients.addAll(notification.getExtraRecipients());
        if (recipients.isEmpty()) {
            throw new ChannelDeliveryException(
                    "Channel '" + channel.getId() + "' has no recipients in '" + recipientsKey() + "'");
        }
        transport.send(List.copyOf(recipients), notification.getMessage().getSubject(), body(notification));
    }
}
