package com.pulsesentinel.core.notify.channel;

import com.pulsesentinel.core.model.ChannelType;
import com.pulsesentinel.core.notify.MessageTransport;

/**
 * Email through an external relay. Config key: {@code to_emails}.
 */
public class EmailSender extends AbstractMessageSender {

    public EmailSender(MessageTransport transport) {
        super(transport);
    }

    @Override
    public ChannelType type() {
        return ChannelType.EMAIL;
    }

    @Override
    protected String recipientsKey() {
        return "to_emails";
    }
}
