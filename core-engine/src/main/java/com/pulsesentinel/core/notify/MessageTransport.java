package com.pulsesentinel.core.notify;

import java.util.List;

/**
 * Hands a plain message to an external email or SMS provider.
 */
public interface MessageTransport {

    void send(List<String> recipients, String subject, String body) throws ChannelDeliveryException;
}
