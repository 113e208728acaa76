/**
 * Template rendering and multi-channel notification fan-out.
 *
 * <p>
 * {@link com.pulsesentinel.core.notify.NotificationDispatcher} is the entry
 * point; channel payloads live in {@code notify.channel}, and the network side
 * is abstracted behind {@link com.pulsesentinel.core.notify.WebhookTransport}
 * and {@link com.pulsesentinel.core.notify.MessageTransport}.
 * </p>
 */
package com.pulsesentinel.core.notify;
