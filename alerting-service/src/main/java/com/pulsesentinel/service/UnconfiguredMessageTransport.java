package com.pulsesentinel.service;

import com.pulsesentinel.core.notify.ChannelDeliveryException;
import com.pulsesentinel.core.notify.MessageTransport;

import java.util.List;

/**
 * Used when no relay URL is configured for a message channel type; every
 * send fails with a clear reason.
 */
class UnconfiguredMessageTransport implements MessageTransport {

    private final String variable;

    UnconfiguredMessageTransport(String variable) {
        this.variable = variable;
    }

    @Override
    public void send(List<String> recipients, String subject, String body) throws ChannelDeliveryException {
        throw new ChannelDeliveryException("No relay configured; set " + variable);
    }
}
