package com.pulsesentinel.core.escalation;

import com.pulsesentinel.core.alert.AlertStore;
import com.pulsesentinel.core.audit.AuditLog;
import com.pulsesentinel.core.model.Alert;
import com.pulsesentinel.core.model.AlertStatus;
import com.pulsesentinel.core.model.AuditAction;
import com.pulsesentinel.core.model.AuditEntry;
import com.pulsesentinel.core.model.Channel;
import com.pulsesentinel.core.model.EscalationRule;
import com.pulsesentinel.core.model.Template;
import com.pulsesentinel.core.notify.ChannelRegistry;
import com.pulsesentinel.core.notify.DeliveryResult;
import com.pulsesentinel.core.notify.NotificationDispatcher;
import com.pulsesentinel.core.support.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Re-notifies about alerts left unattended.
 *
 * <h3>Scan</h3>
 * <p>
 * Each {@link #scan()} visits every open alert against every enabled
 * {@link EscalationRule}. An alert qualifies when its severity is in the
 * rule's set, it has been open for at least the rule's duration and, when the
 * rule requires no acknowledgment, it is still {@code ACTIVE}.
 * </p>
 * <p>
 * A qualifying (alert, rule) pair escalates at most once per rule duration:
 * the last escalation time is tracked per pair and dropped once the alert is
 * resolved.
 * </p>
 *
 * <h3>Escalating</h3>
 * <p>
 * The alert is rendered with the {@code alert-escalated} template (with an
 * extra {@code duration} variable, in minutes) and dispatched to the rule's
 * channels, or to the alert's own channels when the rule names none. The
 * rule's {@code escalate_to} targets become extra email/SMS recipients. An
 * {@link AuditAction#ESCALATED} entry is recorded, then the alert is resolved
 * if the rule says so.
 * </p>
 *
 * @since 1.0.0
 */
public class EscalationManager {

    private static final Logger LOG = LoggerFactory.getLogger(EscalationManager.class);

    private final AlertStore alertStore;
    private final NotificationDispatcher dispatcher;
    private final ChannelRegistry channels;
    private final AuditLog auditLog;
    private final Clock clock;

    private final Map<String, EscalationRule> rules = new LinkedHashMap<>();

    /** alert id to (rule id to last escalation). */
    private final Map<String, Map<String, Instant>> lastEscalated = new HashMap<>();

    public EscalationManager(AlertStore alertStore, NotificationDispatcher dispatcher, ChannelRegistry channels,
            AuditLog auditLog, Clock clock) {
        this.alertStore = Objects.requireNonNull(alertStore, "alertStore must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.channels = Objects.requireNonNull(channels, "channels must not be null");
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Scan
    // ---------------------------------------------------------------

    public synchronized List<EscalationEvent> scan() {
        Instant now = clock.instant();
        List<EscalationRule> active = activeRules();
        List<Alert> open = alertStore.open();
        forgetClosed(open);

        List<EscalationEvent> events = new ArrayList<>();
        if (active.isEmpty()) {
            return events;
        }
        for (Alert candidate : open) {
            for (EscalationRule rule : active) {
                // re-read: an earlier rule may have auto-resolved it
                Optional<Alert> current = alertStore.get(candidate.getId());
                if (current.isEmpty() || !current.get().isOpen()) {
                    break;
                }
                Alert alert = current.get();
                if (qualifies(alert, rule, now)) {
                    events.add(escalate(alert, rule, now));
                }
            }
        }
        if (!events.isEmpty()) {
            LOG.info("Escalation scan at {} produced {} escalation(s)", now, events.size());
        }
        return events;
    }

    private List<EscalationRule> activeRules() {
        List<EscalationRule> out = new ArrayList<>();
        for (EscalationRule rule : rules.values()) {
            if (!rule.isEnabled()) {
                continue;
            }
            try {
                rule.validate();
                out.add(rule);
            } catch (IllegalStateException e) {
                LOG.warn("Skipping malformed escalation rule [{}]: {}", rule.getId(), e.getMessage());
            }
        }
        return out;
    }

    private boolean qualifies(Alert alert, EscalationRule rule, Instant now) {
        if (!rule.matches(alert.getSeverity())) {
            return false;
        }
        if (rule.getConditions().isNoAcknowledgment() && alert.getStatus() != AlertStatus.ACTIVE) {
            return false;
        }
        Duration window = rule.getConditions().getDuration();
        if (Duration.between(alert.getTriggeredAt(), now).compareTo(window) < 0) {
            return false;
        }
        Instant last = lastEscalated.getOrDefault(alert.getId(), Map.of()).get(rule.getId());
        if (last != null && now.isBefore(last.plus(window))) {
            LOG.debug("Alert {} already escalated by rule [{}] at {}", alert.getId(), rule.getId(), last);
            return false;
        }
        return true;
    }

    private EscalationEvent escalate(Alert alert, EscalationRule rule, Instant now) {
        Duration age = Duration.between(alert.getTriggeredAt(), now);
        lastEscalated.computeIfAbsent(alert.getId(), k -> new HashMap<>()).put(rule.getId(), now);

        List<String> channelIds = rule.getActions().getChannelIds();
        if (channelIds.isEmpty()) {
            channelIds = alertChannels(alert);
        }
        List<Channel> targets = channels.resolve(channelIds);
        List<DeliveryResult> deliveries = dispatcher.dispatch(alert, targets, Template.ALERT_ESCALATED,
                Map.of("duration", Long.toString(age.toMinutes())), rule.getActions().getEscalateTo());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("escalation_rule_id", rule.getId());
        details.put("escalation_rule_name", rule.getName());
        details.put("unacknowledged_minutes", age.toMinutes());
        details.put("channels", targets.stream().map(Channel::getId).toList());
        details.put("escalate_to", List.copyOf(rule.getActions().getEscalateTo()));
        auditLog.record(AuditAction.ESCALATED, alert.getId(), null, null, details);
        LOG.info("Alert {} escalated by rule [{}] after {} minute(s)", alert.getId(), rule.getId(), age.toMinutes());

        boolean resolved = false;
        if (rule.getActions().isAutoResolve()) {
            resolved = alertStore.resolve(alert.getId()).isPresent();
            if (resolved) {
                LOG.info("Alert {} auto-resolved by escalation rule [{}]", alert.getId(), rule.getId());
            }
        }
        return new EscalationEvent(alert.getId(), rule.getId(), rule.getName(), now, age, deliveries, resolved);
    }

    private static List<String> alertChannels(Alert alert) {
        List<String> ids = new ArrayList<>();
        if (alert.getMetadata().get("channels") instanceof Collection<?> c) {
            c.forEach(o -> ids.add(String.valueOf(o)));
        }
        return ids;
    }

    /**
     * Rebuild the per-window escalation state from {@link AuditAction#ESCALATED}
     * audit entries of alerts that are still open.
     */
    public synchronized void restoreEscalations(Collection<AuditEntry> entries) {
        Set<String> openIds = new HashSet<>();
        alertStore.open().forEach(a -> openIds.add(a.getId()));
        int restored = 0;
        for (AuditEntry entry : entries) {
            if (entry.getAction() != AuditAction.ESCALATED || !openIds.contains(entry.getAlertId())) {
                continue;
            }
            Object ruleId = entry.getDetails().get("escalation_rule_id");
            if (ruleId == null) {
                continue;
            }
            lastEscalated.computeIfAbsent(entry.getAlertId(), k -> new HashMap<>())
                    .merge(String.valueOf(ruleId), entry.getTimestamp(), (a, b) -> a.isAfter(b) ? a : b);
            restored++;
        }
        LOG.debug("Restored {} escalation mark(s) from the audit log", restored);
    }

    private void forgetClosed(List<Alert> open) {
        Set<String> openIds = new HashSet<>();
        open.forEach(a -> openIds.add(a.getId()));
        lastEscalated.keySet().retainAll(openIds);
    }

    // ---------------------------------------------------------------
    // Rule management
    // ---------------------------------------------------------------

    /**
     * Add a rule. A missing id is generated.
     *
     * @throws IllegalStateException    if the rule is invalid
     * @throws IllegalArgumentException if a rule with the same id exists
     */
    public synchronized EscalationRule addRule(EscalationRule rule) {
        EscalationRule copy = new EscalationRule(Objects.requireNonNull(rule, "rule must not be null"));
        if (copy.getId() == null || copy.getId().isBlank()) {
            copy.setId(Ids.next("escalation"));
        }
        if (rules.containsKey(copy.getId())) {
            throw new IllegalArgumentException("Escalation rule already exists: " + copy.getId());
        }
        copy.validate();
        rules.put(copy.getId(), copy);
        LOG.info("Added escalation rule {}", copy);
        return new EscalationRule(copy);
    }

    /**
     * @return the updated rule, or empty if no rule has this id
     * @throws IllegalStateException if the replacement is invalid
     */
    public synchronized Optional<EscalationRule> updateRule(String id, EscalationRule replacement) {
        if (!rules.containsKey(id)) {
            return Optional.empty();
        }
        EscalationRule copy = new EscalationRule(Objects.requireNonNull(replacement, "replacement must not be null"));
        copy.setId(id);
        copy.validate();
        rules.put(id, copy);
        LOG.info("Updated escalation rule {}", copy);
        return Optional.of(new EscalationRule(copy));
    }

    public synchronized boolean removeRule(String id) {
        lastEscalated.values().forEach(m -> m.remove(id));
        return rules.remove(id) != null;
    }

    public synchronized List<EscalationRule> getRules() {
        return rules.values().stream().map(EscalationRule::new).toList();
    }

    public synchronized void replaceRules(Collection<EscalationRule> replacement) {
        rules.clear();
        for (EscalationRule rule : replacement) {
            if (rule.getId() != null && !rule.getId().isBlank()) {
                rules.put(rule.getId(), new EscalationRule(rule));
            }
        }
        LOG.info("Escalation rule set replaced with {} rule(s)", rules.size());
    }
}
