package com.pulsesentinel.core.notify.channel;

import com.pulsesentinel.core.model.ChannelType;
import com.pulsesentinel.core.notify.MessageTransport;
import com.pulsesentinel.core.notify.Notification;

/**
 * SMS through an external relay. Config key: {@code to_numbers}. SMS has no
 * subject line, so the subject is prepended to the body.
 */
public class SmsSender extends AbstractMessageSender {

    public SmsSender(MessageTransport transport) {
        super(transport);
    }

    @Override
    public ChannelType type() {
        return ChannelType.SMS;
    }

    @Override
    protected String recipientsKey() {
        return "to_numbers";
    }

    @Override
    protected String body(Notification notification) {
        return notification.getMessage().getSubject() + "\n\n" + notification.getMessage().getBody();
    }
}
