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
 * Microsoft Teams connector MessageCard.
 */
public class TeamsSender extends AbstractWebhookSender {

    static final String ACTIVITY_SUBTITLE = "Pulse Sentinel monitoring";

    public TeamsSender(WebhookTransport transport, Clock clock) {
        super(transport, clock);
    }

    @Override
    public ChannelType type() {
        return ChannelType.TEAMS;
    }

    @Override
    protected String urlKey() {
        return "webhook_url";
    }

    @Override
    protected ObjectNode payload(Channel channel, Notification notification) {
        Alert alert = notification.getAlert();
        String subject = notification.getMessage().getSubject();

        ObjectNode root = MAPPER.createObjectNode();
        root.put("@type", "MessageCard");
        root.put("@context", "http://schema.org/extensions");
        root.put("themeColor", alert.getSeverity().getColor());
        root.put("summary", subject);

        ObjectNode section = root.putArray("sections").addObject();
        section.put("activityTitle", subject);
        section.put("activitySubtitle", ACTIVITY_SUBTITLE);
        section.put("text", notification.getMessage().getBody());

        ArrayNode facts = section.putArray("facts");
        facts.addObject().put("name", "Severity").put("value", alert.getSeverity().id());
        facts.addObject().put("name", "Rule").put("value", alert.getRuleName());
        facts.addObject().put("name", "Value").put("value", valueVersusThreshold(alert));
        return root;
    }
}
