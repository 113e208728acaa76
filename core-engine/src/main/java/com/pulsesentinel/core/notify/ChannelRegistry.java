package com.pulsesentinel.core.notify;

import com.pulsesentinel.core.model.Channel;
import com.pulsesentinel.core.support.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configured notification channels.
 *
 * <p>
 * Holds the only mutable copy of each channel; usage and test bookkeeping go
 * through {@link #markUsed(String)} and {@link #markTested(String, boolean)}
 * so concurrent dispatches cannot lose updates. Callers always receive copies.
 * </p>
 */
public class ChannelRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelRegistry.class);

    private final Clock clock;
    private final Map<String, Channel> channels = new LinkedHashMap<>();

    public ChannelRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Insert or replace a channel. A missing id is generated.
     *
     * @throws IllegalArgumentException if the channel has no type
     */
    public synchronized Channel save(Channel channel) {
        Channel copy = new Channel(Objects.requireNonNull(channel, "channel must not be null"));
        if (copy.getType() == null) {
            throw new IllegalArgumentException("Channel type is required");
        }
        if (copy.getId() == null || copy.getId().isBlank()) {
            copy.setId(Ids.next("channel"));
        }
        if (copy.getTestStatus() == null) {
            copy.setTestStatus(Channel.TEST_PENDING);
        }
        channels.put(copy.getId(), copy);
        LOG.info("Saved channel {}", copy);
        return new Channel(copy);
    }

    public synchronized boolean remove(String id) {
        return channels.remove(id) != null;
    }

    public synchronized Optional<Channel> get(String id) {
        return Optional.ofNullable(channels.get(id)).map(Channel::new);
    }

    public synchronized List<Channel> list() {
        return channels.values().stream().map(Channel::new).toList();
    }

    /**
     * Look up channels for delivery. Unknown and disabled ids are skipped.
     *
     * @param ids channel ids in the desired order
     * @return enabled channels, as copies
     */
    public synchronized List<Channel> resolve(Collection<String> ids) {
        List<Channel> out = new ArrayList<>();
        for (String id : ids) {
            Channel c = channels.get(id);
            if (c == null) {
                LOG.warn("Unknown channel [{}] - skipping", id);
            } else if (!c.isEnabled()) {
                LOG.debug("Channel [{}] is disabled - skipping", id);
            } else {
                out.add(new Channel(c));
            }
        }
        return out;
    }

    public synchronized void markUsed(String id) {
        Channel c = channels.get(id);
        if (c != null) {
            c.setLastUsed(clock.instant());
        }
    }

    public synchronized void markTested(String id, boolean success) {
        Channel c = channels.get(id);
        if (c != null) {
            c.setTestStatus(success ? Channel.TEST_SUCCESS : Channel.TEST_FAILED);
        }
    }

    public synchronized void replaceAll(Collection<Channel> replacement) {
        channels.clear();
        for (Channel c : replacement) {
            if (c.getId() != null && !c.getId().isBlank()) {
                channels.put(c.getId(), new Channel(c));
            }
        }
        LOG.info("Channel set replaced with {} channel(s)", channels.size());
    }
}
