package com.pulsesentinel.core.store;

import com.pulsesentinel.core.model.Alert;
import com.pulsesentinel.core.model.AlertRule;
import com.pulsesentinel.core.model.AuditEntry;
import com.pulsesentinel.core.model.Channel;
import com.pulsesentinel.core.model.EscalationRule;
import com.pulsesentinel.core.model.MetricSnapshot;
import com.pulsesentinel.core.model.Template;

import java.util.List;
import java.util.Objects;

/**
 * Typed name of one persisted collection.
 *
 * @param <T> element type of the collection
 */
public final class StoreKey<T> {

    public static final StoreKey<Channel> CHANNELS = new StoreKey<>("channels", Channel.class);
    public static final StoreKey<Template> TEMPLATES = new StoreKey<>("templates", Template.class);
    public static final StoreKey<EscalationRule> ESCALATION_RULES =
            new StoreKey<>("escalation_rules", EscalationRule.class);
    public static final StoreKey<AuditEntry> AUDIT_LOG = new StoreKey<>("audit_log", AuditEntry.class);
    public static final StoreKey<MetricSnapshot> METRICS = new StoreKey<>("metrics", MetricSnapshot.class);
    public static final StoreKey<Alert> ALERTS = new StoreKey<>("alerts", Alert.class);
    public static final StoreKey<AlertRule> ALERT_RULES = new StoreKey<>("alert_rules", AlertRule.class);

    /** Every key, in the order collections are restored. */
    public static final List<StoreKey<?>> ALL = List.of(
            CHANNELS, TEMPLATES, ESCALATION_RULES, AUDIT_LOG, METRICS, ALERTS, ALERT_RULES);

    private final String name;
    private final Class<T> elementType;

    private StoreKey(String name, Class<T> elementType) {
        this.name = Objects.requireNonNull(name);
        this.elementType = Objects.requireNonNull(elementType);
    }

    public String name() {
        return name;
    }

    public Class<T> elementType() {
        return elementType;
    }

    @Override
    public String toString() {
        return name;
    }
}
