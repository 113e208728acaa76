package com.pulsesentinel.core.rules;

import com.pulsesentinel.core.alert.AlertStore;
import com.pulsesentinel.core.model.Alert;
import com.pulsesentinel.core.model.AlertRule;
import com.pulsesentinel.core.model.ComparisonOperator;
import com.pulsesentinel.core.model.MetricSnapshot;
import com.pulsesentinel.core.support.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Evaluates enabled {@link AlertRule}s against a {@link MetricSnapshot}.
 *
 * <h3>Evaluation</h3>
 * <p>
 * Rules are visited in ascending id order. For each enabled rule the watched
 * metric is compared against the threshold; on a breach the rule fires unless
 * it already fired less than its cooldown ago. The cooldown is measured from
 * the rule's own last trigger and is not reset when the metric dips back
 * below the threshold.
 * </p>
 * <p>
 * A rule that fails {@link AlertRule#validate()} is logged and skipped; the
 * remaining rules are still evaluated. A rule watching a metric absent from
 * the snapshot is skipped silently.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * Evaluation and rule edits are serialised on this engine's monitor.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertRuleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AlertRuleEngine.class);

    private final AlertStore alertStore;
    private final Clock clock;

    private final TreeMap<String, AlertRule> rules = new TreeMap<>();
    private final Map<String, Instant> lastTriggered = new HashMap<>();

    public AlertRuleEngine(AlertStore alertStore, Clock clock) {
        this.alertStore = Objects.requireNonNull(alertStore, "alertStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * @param snapshot metrics to evaluate
     * @return alerts triggered by this call, in rule-id order
     */
    public synchronized List<Alert> evaluate(MetricSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Instant now = clock.instant();
        List<Alert> triggered = new ArrayList<>();

        for (AlertRule rule : rules.values()) {
            if (!rule.isEnabled()) {
                continue;
            }
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                LOG.warn("Skipping malformed rule [{}]: {}", rule.getId(), e.getMessage());
                continue;
            }

            Optional<Double> value = snapshot.getValue(rule.getMetric());
            if (value.isEmpty()) {
                LOG.debug("Rule [{}] watches metric '{}' which is absent from the snapshot",
                        rule.getId(), rule.getMetric());
                continue;
            }
            ComparisonOperator operator = rule.getComparisonOperator();
            if (!operator.test(value.get(), rule.getThreshold())) {
                continue;
            }

            Instant last = lastTriggered.get(rule.getId());
            if (last != null && now.isBefore(last.plus(rule.getCooldown()))) {
                LOG.debug("Rule [{}] breached but still cooling down since {}", rule.getId(), last);
                continue;
            }

            try {
                Alert alert = alertStore.add(buildAlert(rule, value.get(), now));
                lastTriggered.put(rule.getId(), now);
                triggered.add(alert);
            } catch (RuntimeException e) {
                LOG.error("Rule [{}] fired but the alert could not be stored - continuing with next rule",
                        rule.getId(), e);
            }
        }

        if (!triggered.isEmpty()) {
            LOG.info("Evaluation at {} triggered {} alert(s)", snapshot.getTimestamp(), triggered.size());
        }
        return triggered;
    }

    private static Alert buildAlert(AlertRule rule, double value, Instant now) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("metric", rule.getMetric());
        metadata.put("operator", rule.getOperator());
        metadata.put("channels", List.copyOf(rule.getChannels()));

        return Alert.builder()
                .id(Ids.next("alert"))
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .message(rule.getName() + ": " + rule.getMetric() + " is " + format(value)
                        + " (threshold: " + format(rule.getThreshold()) + ")")
                .severity(rule.getSeverityLevel())
                .triggeredAt(now)
                .metricValue(value)
                .threshold(rule.getThreshold())
                .metadata(metadata)
                .build();
    }

    /**
     * Render a number without a trailing {@code .0}: 85 stays "85", 85.5 stays "85.5".
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    // ---------------------------------------------------------------
    // Rule management
    // ---------------------------------------------------------------

    /**
     * Add a rule. A missing id is generated.
     *
     * @return a copy of the stored rule
     * @throws IllegalStateException    if the rule is invalid
     * @throws IllegalArgumentException if a rule with the same id exists
     */
    public synchronized AlertRule addRule(AlertRule rule) {
        AlertRule copy = new AlertRule(Objects.requireNonNull(rule, "rule must not be null"));
        if (copy.getId() == null || copy.getId().isBlank()) {
            copy.setId(Ids.next("rule"));
        }
        if (rules.containsKey(copy.getId())) {
            throw new IllegalArgumentException("Rule already exists: " + copy.getId());
        }
        copy.validate();
        Instant now = clock.instant();
        copy.setCreatedAt(now);
        copy.setUpdatedAt(now);
        rules.put(copy.getId(), copy);
        LOG.info("Added rule {}", copy);
        return new AlertRule(copy);
    }

    /**
     * Replace an existing rule's definition, keeping its id, creation time and
     * cooldown state.
     *
     * @return the updated rule, or empty if no rule has this id
     * @throws IllegalStateException if the replacement is invalid
     */
    public synchronized Optional<AlertRule> updateRule(String id, AlertRule replacement) {
        AlertRule existing = rules.get(id);
        if (existing == null) {
            return Optional.empty();
        }
        AlertRule copy = new AlertRule(Objects.requireNonNull(replacement, "replacement must not be null"));
        copy.setId(id);
        copy.validate();
        copy.setCreatedAt(existing.getCreatedAt());
        copy.setUpdatedAt(clock.instant());
        rules.put(id, copy);
        LOG.info("Updated rule {}", copy);
        return Optional.of(new AlertRule(copy));
    }

    public synchronized boolean removeRule(String id) {
        lastTriggered.remove(id);
        boolean removed = rules.remove(id) != null;
        if (removed) {
            LOG.info("Removed rule [{}]", id);
        }
        return removed;
    }

    public synchronized Optional<AlertRule> getRule(String id) {
        return Optional.ofNullable(rules.get(id)).map(AlertRule::new);
    }

    /**
     * @return copies of all rules, sorted by id
     */
    public synchronized List<AlertRule> getRules() {
        return rules.values().stream().map(AlertRule::new).toList();
    }

    /**
     * Replace the full rule set. Rules are stored as given, even malformed
     * ones, which are then skipped during evaluation. Cooldown state is kept
     * for rule ids that survive the replacement.
     */
    public synchronized void replaceRules(Collection<AlertRule> replacement) {
        rules.clear();
        for (AlertRule rule : replacement) {
            if (rule.getId() == null || rule.getId().isBlank()) {
                LOG.warn("Dropping rule without id: {}", rule);
                continue;
            }
            rules.put(rule.getId(), new AlertRule(rule));
        }
        lastTriggered.keySet().retainAll(rules.keySet());
        LOG.info("Rule set replaced with {} rule(s)", rules.size());
    }

    /**
     * Rebuild cooldown state from stored alerts: each known rule's last
     * trigger becomes the latest {@code triggeredAt} among its alerts, unless
     * a later trigger is already tracked.
     */
    public synchronized void restoreCooldowns(Collection<Alert> alerts) {
        for (Alert alert : alerts) {
            if (rules.containsKey(alert.getRuleId())) {
                lastTriggered.merge(alert.getRuleId(), alert.getTriggeredAt(),
                        (a, b) -> a.isAfter(b) ? a : b);
            }
        }
        LOG.debug("Cooldown state restored for {} rule(s)", lastTriggered.size());
    }

    public synchronized Optional<Instant> lastTriggeredAt(String ruleId) {
        return Optional.ofNullable(lastTriggered.get(ruleId));
    }
}
