/**
 * One {@link com.pulsesentinel.core.notify.ChannelSender} per channel type.
 *
 * <p>
 * Webhook-style channels (generic webhook, Slack, Teams, Discord) build a
 * Jackson tree and POST it through a
 * {@link com.pulsesentinel.core.notify.WebhookTransport}; email and SMS hand
 * plain text to a {@link com.pulsesentinel.core.notify.MessageTransport}.
 * </p>
 */
package com.pulsesentinel.core.notify.channel;
