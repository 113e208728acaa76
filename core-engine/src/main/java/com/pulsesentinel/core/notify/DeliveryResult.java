package com.pulsesentinel.core.notify;

import com.pulsesentinel.core.model.Channel;
import com.pulsesentinel.core.model.ChannelType;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of delivering one alert through one channel.
 */
public final class DeliveryResult {

    private final String channelId;
    private final String channelName;
    private final ChannelType channelType;
    private final boolean success;
    private final String error;
    private final Instant attemptedAt;
    private final long durationMs;

    private DeliveryResult(Channel channel, boolean success, String error, Instant attemptedAt, long durationMs) {
        this.channelId = channel.getId();
        this.channelName = channel.getName();
        this.channelType = channel.getType();
        this.success = success;
        this.error = error;
        this.attemptedAt = Objects.requireNonNull(attemptedAt, "attemptedAt must not be null");
        this.durationMs = durationMs;
    }

    public static DeliveryResult success(Channel channel, Instant attemptedAt, long durationMs) {
        return new DeliveryResult(channel, true, null, attemptedAt, durationMs);
    }

    public static DeliveryResult failure(Channel channel, String error, Instant attemptedAt, long durationMs) {
        return new DeliveryResult(channel, false, Objects.requireNonNull(error, "error must not be null"),
                attemptedAt, durationMs);
    }

    public String getChannelId() {
        return channelId;
    }

    public String getChannelName() {
        return channelName;
    }

    public ChannelType getChannelType() {
        return channelType;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return failure message, or {@code null} on success
     */
    public String getError() {
        return error;
    }

    public Instant getAttemptedAt() {
        return attemptedAt;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public String toString() {
        return "DeliveryResult{" +
                "channelId='" + channelId + '\'' +
                ", success=" + success +
                (error != null ? ", error='" + error + '\'' : "") +
                ", durationMs=" + durationMs +
                '}';
    }
}
