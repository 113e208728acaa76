package com.pulsesentinel.core.notify.channel;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pulsesentinel.core.model.Alert;
import com.pulsesentinel.core.model.Channel;
import com.pulsesentinel.core.model.ChannelType;
import com.pulsesentinel.core.notify.Notification;
import com.pulsesentinel.core.notify.WebhookTransport;

import java.time.Clock;

/**
 * Slack incoming webhook with one coloured attachment.
 *
 * <p>
 * Config keys: {@code webhook_url} (required), {@code channel},
 * {@code username}, and either {@code icon_emoji} or {@code icon_url}.
 * </p>
 */
public class SlackSender extends AbstractWebhookSender {

    public SlackSender(WebhookTransport transport, Clock clock) {
        super(transport, clock);
    }

    @Override
    public ChannelType type() {
        return ChannelType.SLACK;
    }

    @Override
    protected String urlKey() {
        return "webhook_url";
    }

    @Override
    protected ObjectNode payload(Channel channel, Notification notification) {
        Alert alert = notification.getAlert();
        ObjectNode root = MAPPER.createObjectNode();
        channel.configString("channel").ifPresent(v -> root.put("channel", v));
        channel.configString("username").ifPresent(v -> root.put("username", v));
        channel.configString("icon_emoji").ifPresent(v -> root.put("icon_emoji", v));
        channel.configString("icon_url").ifPresent(v -> root.put("icon_url", v));

        ObjectNode attachment = root.putArray("attachments").addObject();
        attachment.put("color", alert.getSeverity().getColor());
        attachment.put("title", notification.getMessage().getSubject());
        attachment.put("text", notification.getMessage().getBody());

        ArrayNode fields = attachment.putArray("fields");
        fields.addObject()
                .put("title", "Severity")
                .put("value", alert.getSeverity().id())
                .put("short", true);
        fields.addObject()
                .put("title", "Metric")
                .put("value", valueVersusThreshold(alert))
                .put("short", true);

        attachment.put("ts", alert.getTriggeredAt().getEpochSecond());
        return root;
    }
}
