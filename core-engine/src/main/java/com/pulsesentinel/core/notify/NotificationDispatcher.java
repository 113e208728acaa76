package com.pulsesentinel.core.notify;

import com.pulsesentinel.core.audit.AuditLog;
import com.pulsesentinel.core.model.Alert;
import com.pulsesentinel.core.model.AuditAction;
import com.pulsesentinel.core.model.Channel;
import com.pulsesentinel.core.model.ChannelType;
import com.pulsesentinel.core.model.Severity;
import com.pulsesentinel.core.model.Template;
import com.pulsesentinel.core.support.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Renders an alert through a template and fans it out to channels.
 *
 * <h3>Fan-out</h3>
 * <p>
 * Every channel is delivered on its own task of the supplied executor. The
 * caller waits until all tasks finish or the per-channel timeout elapses,
 * whichever comes first; a channel still running at that point is cancelled
 * and reported as timed out. One channel's failure never affects another.
 * </p>
 *
 * <h3>Auditing</h3>
 * <p>
 * After all outcomes are known, exactly one {@link AuditAction#SENT} or
 * {@link AuditAction#FAILED} entry is written per channel, and successful
 * channels have their last-used time updated. The dispatcher itself never
 * retries; retry belongs to the transports.
 * </p>
 *
 * @since 1.0.0
 */
public class NotificationDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final ChannelRegistry channels;
    private final TemplateRegistry templates;
    private final TemplateRenderer renderer;
    private final Map<ChannelType, ChannelSender> senders = new EnumMap<>(ChannelType.class);
    private final AuditLog auditLog;
    private final ExecutorService executor;
    private final Duration channelTimeout;
    private final Clock clock;

    public NotificationDispatcher(ChannelRegistry channels, TemplateRegistry templates, TemplateRenderer renderer,
            List<ChannelSender> senders, AuditLog auditLog, ExecutorService executor,
            Duration channelTimeout, Clock clock) {
        this.channels = Objects.requireNonNull(channels, "channels must not be null");
        this.templates = Objects.requireNonNull(templates, "templates must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.channelTimeout = Objects.requireNonNull(channelTimeout, "channelTimeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        for (ChannelSender sender : senders) {
            this.senders.put(sender.type(), sender);
        }
    }

    // ---------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------

    /**
     * Deliver an alert with the {@code alert-triggered} template.
     *
     * @param alert    alert to announce
     * @param targets  channels to deliver to; every channel given is attempted
     * @return one result per channel, in the order given
     */
    public List<DeliveryResult> dispatch(Alert alert, List<Channel> targets) {
        return dispatch(alert, targets, Template.ALERT_TRIGGERED, Map.of(), List.of());
    }

    /**
     * @param alert           alert to announce
     * @param targets         channels to deliver to
     * @param templateId      template to render
     * @param extraVariables  values added to (and overriding) the alert's own variables
     * @param extraRecipients recipients added to email and SMS channels
     * @return one result per channel, in the order given
     */
    public List<DeliveryResult> dispatch(Alert alert, List<Channel> targets, String templateId,
            Map<String, String> extraVariables, List<String> extraRecipients) {
        Objects.requireNonNull(alert, "alert must not be null");
        if (targets.isEmpty()) {
            LOG.debug("Alert {} has no target channels", alert.getId());
            return List.of();
        }

        Optional<Template> template = templates.get(templateId);
        Map<String, String> variables = new LinkedHashMap<>(renderer.variablesFor(alert));
        variables.putAll(extraVariables);

        List<Future<DeliveryResult>> futures = new ArrayList<>(targets.size());
        List<Instant> submittedAt = new ArrayList<>(targets.size());
        for (Channel channel : targets) {
            submittedAt.add(clock.instant());
            try {
                futures.add(executor.submit(
                        () -> deliver(channel, alert, template, templateId, variables, extraRecipients)));
            } catch (RejectedExecutionException e) {
                futures.add(null);
            }
        }

        List<DeliveryResult> results = new ArrayList<>(targets.size());
        long deadline = System.nanoTime() + channelTimeout.toNanos();
        for (int i = 0; i < targets.size(); i++) {
            results.add(await(targets.get(i), futures.get(i), submittedAt.get(i), deadline));
        }

        record(alert, results, templateId);
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        LOG.info("Alert {} dispatched to {} channel(s), {} failed", alert.getId(), results.size(), failed);
        return results;
    }

    private DeliveryResult deliver(Channel channel, Alert alert, Optional<Template> template, String templateId,
            Map<String, String> variables, List<String> extraRecipients) {
        Instant attemptedAt = clock.instant();
        long start = System.nanoTime();
        try {
            ChannelSender sender = senders.get(channel.getType());
            if (sender == null) {
                throw new ChannelDeliveryException("Unsupported channel type: " + channel.getType());
            }
            Template t = template.orElseThrow(
                    () -> new ChannelDeliveryException("Template not found: " + templateId));
            if (!t.appliesTo(channel.getType())) {
                throw new ChannelDeliveryException(
                        "Template '" + templateId + "' does not apply to " + channel.getType().id() + " channels");
            }
            RenderedMessage message = renderer.render(t, variables);
            sender.deliver(channel, new Notification(alert, message, extraRecipients));
            return DeliveryResult.success(channel, attemptedAt, elapsedMs(start));
        } catch (ChannelDeliveryException e) {
            LOG.warn("Delivery of alert {} to channel [{}] failed: {}", alert.getId(), channel.getId(), e.getMessage());
            return DeliveryResult.failure(channel, e.getMessage(), attemptedAt, elapsedMs(start));
        } catch (RuntimeException e) {
            LOG.error("Unexpected error delivering alert {} to channel [{}]", alert.getId(), channel.getId(), e);
            return DeliveryResult.failure(channel, String.valueOf(e.getMessage()), attemptedAt, elapsedMs(start));
        }
    }

    private DeliveryResult await(Channel channel, Future<DeliveryResult> future, Instant submittedAt, long deadline) {
        if (future == null) {
            return DeliveryResult.failure(channel, "Dispatcher is shut down", submittedAt, 0);
        }
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Delivery to channel [{}] timed out after {} ms", channel.getId(), channelTimeout.toMillis());
            return DeliveryResult.failure(channel, "Timed out after " + channelTimeout.toMillis() + " ms",
                    submittedAt, channelTimeout.toMillis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return DeliveryResult.failure(channel, String.valueOf(cause.getMessage()), submittedAt, 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return DeliveryResult.failure(channel, "Interrupted", submittedAt, 0);
        }
    }

    private void record(Alert alert, List<DeliveryResult> results, String templateId) {
        for (DeliveryResult r : results) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("channel_name", r.getChannelName());
            details.put("channel_type", r.getChannelType() != null ? r.getChannelType().id() : null);
            details.put("template", templateId);
            details.put("duration_ms", r.getDurationMs());
            if (r.isSuccess()) {
                channels.markUsed(r.getChannelId());
                auditLog.record(AuditAction.SENT, alert.getId(), r.getChannelId(), null, details);
            } else {
                details.put("error", r.getError());
                auditLog.record(AuditAction.FAILED, alert.getId(), r.getChannelId(), null, details);
            }
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    // ---------------------------------------------------------------
    // Channel test
    // ---------------------------------------------------------------

    /**
     * Send a synthetic medium-severity alert through one channel, enabled or
     * not, and record the outcome as the channel's test status.
     *
     * @throws IllegalArgumentException if the channel does not exist
     */
    public DeliveryResult testChannel(String channelId) {
        Channel channel = channels.get(channelId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown channel: " + channelId));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("metric", "test_metric");
        metadata.put("operator", "gt");
        Alert testAlert = Alert.builder()
                .id(Ids.next("test"))
                .ruleId("test")
                .ruleName("Test Alert")
                .message("Test notification for channel " + channel.getName())
                .severity(Severity.MEDIUM)
                .triggeredAt(clock.instant())
                .metricValue(75)
                .threshold(80)
                .metadata(metadata)
                .build();

        DeliveryResult result = dispatch(testAlert, List.of(channel)).get(0);
        channels.markTested(channelId, result.isSuccess());
        LOG.info("Channel [{}] test {}", channelId, result.isSuccess() ? "succeeded" : "failed: " + result.getError());
        return result;
    }
}
