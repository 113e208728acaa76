package com.pulsesentinel.core.audit;

import com.pulsesentinel.core.model.AuditAction;
import com.pulsesentinel.core.model.AuditEntry;
import com.pulsesentinel.core.support.BoundedHistory;
import com.pulsesentinel.core.support.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only, bounded sink for dispatch and lifecycle actions.
 *
 * <p>
 * Entries are immutable and never modified after {@link #record(AuditEntry)}.
 * When the log holds {@link #DEFAULT_CAPACITY} entries the oldest is dropped.
 * Queries return the newest entries first.
 * </p>
 *
 * @since 1.0.0
 */
public class AuditLog {

    private static final Logger LOG = LoggerFactory.getLogger(AuditLog.class);

    public static final int DEFAULT_CAPACITY = 1000;

    public static final int DEFAULT_QUERY_LIMIT = 100;

    private final BoundedHistory<AuditEntry> entries;
    private final Clock clock;

    public AuditLog(Clock clock) {
        this(clock, DEFAULT_CAPACITY);
    }

    public AuditLog(Clock clock, int capacity) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.entries = new BoundedHistory<>(capacity);
    }

    /**
     * Append an entry.
     *
     * @param entry the entry; must not be {@code null}
     */
    public void record(AuditEntry entry) {
        entries.append(entry);
        LOG.debug("Audit: {}", entry);
    }

    /**
     * Build, timestamp and append an entry.
     *
     * @return the recorded entry
     */
    public AuditEntry record(AuditAction action, String alertId, String channelId,
            String userId, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.builder()
                .id(Ids.next("audit"))
                .timestamp(clock.instant())
                .action(action)
                .alertId(alertId)
                .channelId(channelId)
                .userId(userId)
                .details(details)
                .build();
        record(entry);
        return entry;
    }

    /**
     * @param limit   maximum number of entries to return
     * @param alertId restrict to one alert, or {@code null} for all
     * @return matching entries, newest first
     */
    public List<AuditEntry> query(int limit, String alertId) {
        if (alertId == null) {
            return entries.newestFirst(limit);
        }
        List<AuditEntry> out = new ArrayList<>();
        for (AuditEntry entry : entries.newestFirst(entries.size())) {
            if (out.size() >= limit) {
                break;
            }
            if (alertId.equals(entry.getAlertId())) {
                out.add(entry);
            }
        }
        return out;
    }

    public List<AuditEntry> query(int limit) {
        return query(limit, null);
    }

    /**
     * @return every retained entry, oldest first
     */
    public List<AuditEntry> snapshot() {
        return entries.toList();
    }

    /**
     * Replace the whole log, e.g. on configuration import or restore.
     *
     * @param restored entries, oldest first
     */
    public void restore(Collection<AuditEntry> restored) {
        entries.replaceAll(restored);
        LOG.info("Audit log restored with {} entr(ies)", entries.size());
    }

    public int size() {
        return entries.size();
    }
}
