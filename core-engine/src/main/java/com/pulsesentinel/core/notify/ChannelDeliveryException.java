package com.pulsesentinel.core.notify;

/**
 * A notification could not be delivered through a channel.
 */
public class ChannelDeliveryException extends Exception {

    private static final long serialVersionUID = 1L;

    public ChannelDeliveryException(String message) {
        super(message);
    }

    public ChannelDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
