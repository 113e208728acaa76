package com.pulsesentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pulsesentinel.core.config.JsonSupport;
import com.pulsesentinel.core.notify.ChannelDeliveryException;
import com.pulsesentinel.core.notify.MessageTransport;
import com.pulsesentinel.core.notify.WebhookTransport;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link MessageTransport} that posts {@code {recipients, subject, body}} to
 * an HTTP relay which forwards to the actual email or SMS provider.
 */
public class HttpRelayMessageTransport implements MessageTransport {

    private static final ObjectMapper MAPPER = JsonSupport.mapper();

    private final WebhookTransport http;
    private final String relayUrl;

    public HttpRelayMessageTransport(WebhookTransport http, String relayUrl) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.relayUrl = Objects.requireNonNull(relayUrl, "relayUrl must not be null");
    }

    @Override
    public void send(List<String> recipients, String subject, String body) throws ChannelDeliveryException {
        ObjectNode payload = MAPPER.createObjectNode();
        recipients.forEach(payload.putArray("recipients")::add);
        payload.put("subject", subject);
        payload.put("body", body);
        try {
            http.post(relayUrl, Map.of(), MAPPER.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new ChannelDeliveryException("Failed to serialise relay payload", e);
        }
    }
}
