package com.pulsesentinel.core.notify;

import com.pulsesentinel.core.model.Channel;
import com.pulsesentinel.core.model.ChannelType;

/**
 * Delivers a notification through one kind of channel. Each implementation
 * owns its payload shape.
 */
public interface ChannelSender {

    ChannelType type();

    /**
     * @param channel      channel configuration
     * @param notification what to send
     * @throws ChannelDeliveryException if the channel is misconfigured or the transport fails
     */
    void deliver(Channel channel, Notification notification) throws ChannelDeliveryException;
}
