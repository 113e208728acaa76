package com.pulsesentinel.core.notify.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pulsesentinel.core.config.JsonSupport;
import com.pulsesentinel.core.model.Alert;
import com.pulsesentinel.core.model.Channel;
import com.pulsesentinel.core.notify.ChannelDeliveryException;
import com.pulsesentinel.core.notify.ChannelSender;
import com.pulsesentinel.core.notify.Notification;
import com.pulsesentinel.core.notify.WebhookTransport;
import com.pulsesentinel.core.rules.AlertRuleEngine;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for channels that POST a JSON document to a URL taken from the
 * channel configuration. Subclasses only shape the payload.
 */
public abstract class AbstractWebhookSender implements ChannelSender {

    protected static final ObjectMapper MAPPER = JsonSupport.mapper();

    private final WebhookTransport transport;
    protected final Clock clock;

    protected AbstractWebhookSender(WebhookTransport transport, Clock clock) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @return config key holding the target URL
     */
    protected abstract String urlKey();

    protected abstract ObjectNode payload(Channel channel, Notification notification);

    @Override
    public void deliver(Channel channel, Notification notification) throws ChannelDeliveryException {
        String url = channel.configString(urlKey())
                .orElseThrow(() -> new ChannelDeliveryException(
                        "Channel '" + channel.getId() + "' has no '" + urlKey() + "' configured"));
        String body;
        try {
            body = MAPPER.writeValueAsString(payload(channel, notification));
        } catch (JsonProcessingException e) {
            throw new ChannelDeliveryException("Failed to serialise " + type().id() + " payload", e);
        }
        transport.post(url, headers(channel), body);
    }

    /**
     * Extra HTTP headers from the {@code headers} config map, if any.
     */
    protected Map<String, String> headers(Channel channel) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (channel.getConfig().get("headers") instanceof Map<?, ?> raw) {
            raw.forEach((k, v) -> {
                if (k != null && v != null) {
                    headers.put(k.toString(), v.toString());
                }
            });
        }
        return headers;
    }

    /**
     * @return e.g. {@code "92.5 (threshold: 80)"}
     */
    protected static String valueVersusThreshold(Alert alert) {
        return AlertRuleEngine.format(alert.getMetricValue())
                + " (threshold: " + AlertRuleEngine.format(alert.getThreshold()) + ")";
    }
}
