package com.pulsesentinel.core.notify.channel;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pulsesentinel.core.model.Alert;
import com.pulsesentinel.core.model.Channel;
import com.pulsesentinel.core.model.ChannelType;
import com.pulsesentinel.core.notify.Notification;
import com.pulsesentinel.core.notify.WebhookTransport;

import java.time.Clock;

/**
 * Generic JSON webhook.
 *
 * <pre>
 * {"alert_id":..,"severity":..,"rule_name":..,"message":..,"triggered_at":..,
 *  "subject":..,"body":..,"timestamp":..}
 * </pre>
 */
public class WebhookSender extends AbstractWebhookSender {

    public WebhookSender(WebhookTransport transport, Clock clock) {
        super(transport, clock);
    }

    @Override
    public ChannelType type() {
        return ChannelType.WEBHOOK;
    }

    @Override
    protected String urlKey() {
        return "url";
    }

    @Override
    protected ObjectNode payload(Channel channel, Notification notification) {
        Alert alert = notification.getAlert();
        ObjectNode root = MAPPER.createObjectNode();
        root.put("alert_id", alert.getId());
        root.put("severity", alert.getSeverity().id());
        root.put("rule_name", alert.getRuleName());
        root.put("message", alert.getMessage());
        root.put("triggered_at", alert.getTriggeredAt().toString());
        root.put("subject", notification.getMessage().getSubject());
        root.put("body", notification.getMessage().getBody());
        root.put("timestamp", clock.instant().toString());
        return root;
    }
}
