package com.pulsesentinel.core.alert;

import com.pulsesentinel.core.audit.AuditLog;
import com.pulsesentinel.core.model.Alert;
import com.pulsesentinel.core.model.AlertStatus;
import com.pulsesentinel.core.model.AuditAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Owns every {@link Alert} and its lifecycle.
 *
 * <h3>State machine</h3>
 * <pre>
 *   (trigger) ──► ACTIVE ──acknowledge──► ACKNOWLEDGED ──resolve──► RESOLVED
 *                   └────────────────resolve──────────────────────────┘
 * </pre>
 * <p>
 * Acknowledging anything other than an active alert is a no-op. Resolving a
 * resolved alert is a no-op. Every real transition is written to the
 * {@link AuditLog}.
 * </p>
 *
 * <h3>Retention</h3>
 * <p>
 * Once more than {@code capacity} alerts are held, resolved alerts are
 * evicted oldest first, then acknowledged ones. Active alerts are never
 * evicted; the store grows past its cap instead and logs a warning.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * All mutations are serialised on the store's monitor, so a concurrent
 * acknowledge and rule trigger cannot lose updates. Listeners are notified
 * after the lock is released.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertStore {

    private static final Logger LOG = LoggerFactory.getLogger(AlertStore.class);

    public static final int DEFAULT_CAPACITY = 500;

    private final AuditLog auditLog;
    private final Clock clock;
    private final int capacity;

    /** Insertion order is trigger order. */
    private final LinkedHashMap<String, Alert> alerts = new LinkedHashMap<>();

    private final List<AlertListener> listeners = new CopyOnWriteArrayList<>();

    public AlertStore(AuditLog auditLog, Clock clock) {
        this(auditLog, clock, DEFAULT_CAPACITY);
    }

    public AlertStore(AuditLog auditLog, Clock clock, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.capacity = capacity;
    }

    public void addListener(AlertListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    /**
     * Store a newly triggered alert.
     *
     * @throws IllegalArgumentException if the alert is not active or its id is already known
     */
    public Alert add(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        if (alert.getStatus() != AlertStatus.ACTIVE) {
            throw new IllegalArgumentException("New alert must be active: " + alert);
        }
        synchronized (this) {
            if (alerts.containsKey(alert.getId())) {
                throw new IllegalArgumentException("Duplicate alert id: " + alert.getId());
            }
            alerts.put(alert.getId(), alert);
            evictOverflow();
        }
        LOG.info("Alert triggered: {}", alert);
        notifyListeners(l -> l.onTriggered(alert));
        return alert;
    }

    /**
     * Acknowledge an active alert.
     *
     * @param id    alert id
     * @param actor who acknowledges; required
     * @return the alert after the call (unchanged when it was not active),
     *         or empty if no such alert exists
     * @throws IllegalArgumentException if {@code actor} is blank
     */
    public Optional<Alert> acknowledge(String id, String actor) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor is required to acknowledge an alert");
        }
        Alert updated;
        synchronized (this) {
            Alert current = alerts.get(id);
            if (current == null) {
                return Optional.empty();
            }
            if (current.getStatus() != AlertStatus.ACTIVE) {
                LOG.debug("Acknowledge ignored for {} alert {}", current.getStatus().id(), id);
                return Optional.of(current);
            }
            updated = current.acknowledge(actor, clock.instant());
            alerts.put(id, updated);
            auditLog.record(AuditAction.ACKNOWLEDGED, id, null, actor,
                    Map.of("rule_id", updated.getRuleId()));
        }
        LOG.info("Alert {} acknowledged by {}", id, actor);
        notifyListeners(l -> l.onAcknowledged(updated));
        return Optional.of(updated);
    }

    /**
     * Resolve an alert. Idempotent.
     *
     * @return the resolved alert, or empty if no such alert exists
     */
    public Optional<Alert> resolve(String id) {
        Alert updated;
        synchronized (this) {
            Alert current = alerts.get(id);
            if (current == null) {
                return Optional.empty();
            }
            if (current.getStatus() == AlertStatus.RESOLVED) {
                return Optional.of(current);
            }
            updated = current.resolve(clock.instant());
            alerts.put(id, updated);
            auditLog.record(AuditAction.RESOLVED, id, null, null,
                    Map.of("rule_id", updated.getRuleId(), "previous_status", current.getStatus().id()));
        }
        LOG.info("Alert {} resolved", id);
        notifyListeners(l -> l.onResolved(updated));
        return Optional.of(updated);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public synchronized Optional<Alert> get(String id) {
        return Optional.ofNullable(alerts.get(id));
    }

    /**
     * @param statusFilter only alerts in this status, or {@code null} for all
     * @return matching alerts, newest first
     */
    public synchronized List<Alert> list(AlertStatus statusFilter) {
        List<Alert> out = new ArrayList<>();
        for (Alert alert : alerts.values()) {
            if (statusFilter == null || alert.getStatus() == statusFilter) {
                out.add(alert);
            }
        }
        Collections.reverse(out);
        return out;
    }

    /**
     * @return alerts that are not yet resolved, oldest first
     */
    public synchronized List<Alert> open() {
        return alerts.values().stream().filter(Alert::isOpen).toList();
    }

    /**
     * @return every held alert, oldest first
     */
    public synchronized List<Alert> snapshot() {
        return new ArrayList<>(alerts.values());
    }

    /**
     * Replace the held alerts without notifying listeners.
     *
     * @param restored alerts, oldest first
     */
    public synchronized void restore(Collection<Alert> restored) {
        alerts.clear();
        for (Alert alert : restored) {
            alerts.put(alert.getId(), alert);
        }
        evictOverflow();
        LOG.info("Alert store restored with {} alert(s)", alerts.size());
    }

    public synchronized int size() {
        return alerts.size();
    }

    public int capacity() {
        return capacity;
    }

    // ---------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------

    private void evictOverflow() {
        while (alerts.size() > capacity) {
            if (!evictOldest(AlertStatus.RESOLVED) && !evictOldest(AlertStatus.ACKNOWLEDGED)) {
                LOG.warn("Alert store holds {} alert(s), above capacity {}, all active - nothing evicted",
                        alerts.size(), capacity);
                return;
            }
        }
    }

    private boolean evictOldest(AlertStatus status) {
        Iterator<Alert> it = alerts.values().iterator();
        while (it.hasNext()) {
            Alert alert = it.next();
            if (alert.getStatus() == status) {
                it.remove();
                LOG.debug("Evicted {} alert {}", status.id(), alert.getId());
                return true;
            }
        }
        return false;
    }

    private void notifyListeners(Consumer<AlertListener> call) {
        for (AlertListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                LOG.error("Alert listener failed - continuing with next listener", e);
            }
        }
    }
}
