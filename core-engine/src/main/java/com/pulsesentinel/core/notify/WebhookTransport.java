package com.pulsesentinel.core.notify;

import java.util.Map;

/**
 * Outbound HTTP POST of a JSON document. Retry and backoff, if any, belong
 * to the implementation.
 */
public interface WebhookTransport {

    void post(String url, Map<String, String> headers, String jsonBody) throws ChannelDeliveryException;
}
