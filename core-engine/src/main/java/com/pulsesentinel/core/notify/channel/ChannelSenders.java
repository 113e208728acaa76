package com.pulsesentinel.core.notify.channel;

import com.pulsesentinel.core.notify.ChannelSender;
import com.pulsesentinel.core.notify.MessageTransport;
import com.pulsesentinel.core.notify.WebhookTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Factory for the full set of built-in {@link ChannelSender}s.
 */
public final class ChannelSenders {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelSenders.class);

    private ChannelSenders() {
        // utility class, not instantiable
    }

    /**
     * @param webhook shared by webhook, Slack, Teams and Discord channels
     * @param email   email relay
     * @param sms     SMS relay
     * @param clock   time source for payload timestamps
     * @return one sender per channel type
     */
    public static List<ChannelSender> standard(WebhookTransport webhook, MessageTransport email,
            MessageTransport sms, Clock clock) {
        List<ChannelSender> senders = List.of(
                new WebhookSender(webhook, clock),
                new SlackSender(webhook, clock),
                new TeamsSender(webhook, clock),
                new DiscordSender(webhook, clock),
                new EmailSender(email),
                new SmsSender(sms));
        LOG.info("Created {} channel sender(s)", senders.size());
        return senders;
    }
}
