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
 * Discord webhook with a single embed. Embed colours are decimal RGB.
 */
public class DiscordSender extends AbstractWebhookSender {

    public DiscordSender(WebhookTransport transport, Clock clock) {
        super(transport, clock);
    }

    @Override
    public ChannelType type() {
        return ChannelType.DISCORD;
    }

    @Override
    protected String urlKey() {
        return "webhook_url";
    }

    @Override
    protected ObjectNode payload(Channel channel, Notification notification) {
        Alert alert = notification.getAlert();
        ObjectNode root = MAPPER.createObjectNode();
        channel.configString("username").ifPresent(v -> root.put("username", v));
        root.put("content", notification.getMessage().getSubject());

        ObjectNode embed = root.putArray("embeds").addObject();
        embed.put("title", notification.getMessage().getSubject());
        embed.put("description", notification.getMessage().getBody());
        embed.put("color", alert.getSeverity().getColorValue());

        ArrayNode fields = embed.putArray("fields");
        fields.addObject()
                .put("name", "Severity")
                .put("value", alert.getSeverity().id())
                .put("inline", true);
        fields.addObject()
                .put("name", "Metric")
                .put("value", valueVersusThreshold(alert))
                .put("inline", true);

        embed.put("timestamp", alert.getTriggeredAt().toString());
        return root;
    }
}
