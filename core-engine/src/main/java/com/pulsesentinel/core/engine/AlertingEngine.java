package com.pulsesentinel.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.pulsesentinel.core.alert.AlertListener;
import com.pulsesentinel.core.alert.AlertStore;
import com.pulsesentinel.core.audit.AuditLog;
import com.pulsesentinel.core.config.AlertingConfig;
import com.pulsesentinel.core.config.JsonSupport;
import com.pulsesentinel.core.escalation.EscalationManager;
import com.pulsesentinel.core.health.HealthChecker;
import com.pulsesentinel.core.health.ServiceHealth;
import com.pulsesentinel.core.health.ServiceProbe;
import com.pulsesentinel.core.metrics.MetricProbe;
import com.pulsesentinel.core.metrics.MetricsCollector;
import com.pulsesentinel.core.model.Alert;
import com.pulsesentinel.core.model.AlertStatus;
import com.pulsesentinel.core.model.Channel;
import com.pulsesentinel.core.model.HealthStatus;
import com.pulsesentinel.core.model.MetricSnapshot;
import com.pulsesentinel.core.model.Severity;
import com.pulsesentinel.core.notify.ChannelRegistry;
import com.pulsesentinel.core.notify.ChannelSender;
import com.pulsesentinel.core.notify.DeliveryResult;
import com.pulsesentinel.core.notify.NotificationDispatcher;
import com.pulsesentinel.core.notify.TemplateRegistry;
import com.pulsesentinel.core.notify.TemplateRenderer;
import com.pulsesentinel.core.rules.AlertRuleEngine;
import com.pulsesentinel.core.store.InMemoryStateStore;
import com.pulsesentinel.core.store.PersistenceException;
import com.pulsesentinel.core.store.StateStore;
import com.pulsesentinel.core.store.StoreKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Wires every alerting component together and drives them on a schedule.
 *
 * <h3>Scheduling</h3>
 * <ul>
 * <li><b>metrics tick</b> - collects a snapshot; the rule engine is
 * subscribed to the collector, so evaluation runs synchronously on the
 * same snapshot right after collection.</li>
 * <li><b>health tick</b> - runs the service probes, independent of the
 * metrics tick.</li>
 * <li><b>escalation tick</b> - scans open alerts for escalation.</li>
 * </ul>
 * <p>
 * Notification fan-out for a newly triggered alert is handed to a separate
 * dispatch pool, so a slow channel never delays the next metrics tick. Ticks
 * never throw: failures are logged and the next tick runs as scheduled.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@code NEW → RUNNING → STOPPED}. {@link #start()} restores persisted state
 * (falling back to the seed configuration for collections never saved) and
 * schedules the ticks. {@link #stop()} cancels the ticks, gives in-flight
 * dispatches a grace period, abandons them, and saves state. A stopped
 * engine cannot be restarted.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertingEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertingEngine.class);

    /** Lifecycle state. */
    public enum State {
        NEW, RUNNING, STOPPED
    }

    private final Clock clock;
    private final StateStore store;
    private final AlertingConfig seed;

    private final Duration metricsInterval;
    private final Duration healthInterval;
    private final Duration escalationInterval;
    private final Duration shutdownGrace;

    private final AuditLog auditLog;
    private final MetricsCollector metricsCollector;
    private final HealthChecker healthChecker;
    private final AlertStore alertStore;
    private final AlertRuleEngine ruleEngine;
    private final ChannelRegistry channelRegistry;
    private final TemplateRegistry templateRegistry;
    private final NotificationDispatcher dispatcher;
    private final EscalationManager escalationManager;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService dispatchPool;
    private final ExecutorService deliveryPool;

    private final List<ScheduledFuture<?>> tickers = new ArrayList<>();
    private final Set<Future<?>> pendingDispatches = ConcurrentHashMap.newKeySet();
    private final Object persistLock = new Object();

    private volatile State state = State.NEW;

    private AlertingEngine(Builder builder) {
        this.clock = builder.clock;
        this.store = builder.store;
        this.seed = builder.seed;
        this.metricsInterval = builder.metricsInterval;
        this.healthInterval = builder.healthInterval;
        this.escalationInterval = builder.escalationInterval;
        this.shutdownGrace = builder.shutdownGrace;

        this.scheduler = Executors.newScheduledThreadPool(3, namedThreads("pulse-ticker"));
        this.dispatchPool = Executors.newFixedThreadPool(builder.dispatchThreads, namedThreads("pulse-dispatch"));
        this.deliveryPool = Executors.newCachedThreadPool(namedThreads("pulse-delivery"));

        this.auditLog = new AuditLog(clock);
        this.metricsCollector = new MetricsCollector(clock);
        this.healthChecker = new HealthChecker(clock, deliveryPool);
        this.alertStore = new AlertStore(auditLog, clock);
        this.ruleEngine = new AlertRuleEngine(alertStore, clock);
        this.channelRegistry = new ChannelRegistry(clock);
        this.templateRegistry = new TemplateRegistry();
        this.dispatcher = new NotificationDispatcher(channelRegistry, templateRegistry,
                new TemplateRenderer(builder.zone), builder.senders, auditLog, deliveryPool,
                builder.dispatchTimeout, clock);
        this.escalationManager = new EscalationManager(alertStore, dispatcher, channelRegistry, auditLog, clock);

        builder.metricProbes.forEach(r -> r.apply(metricsCollector));
        builder.serviceChecks.forEach(r -> r.apply(healthChecker));

        metricsCollector.subscribe(ruleEngine::evaluate);
        alertStore.addListener(new AlertListener() {
            @Override
            public void onTriggered(Alert alert) {
                scheduleDispatch(alert);
            }
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Restore state and start the periodic ticks.
     *
     * @throws IllegalStateException if the engine was already started, or if
     *                               state cannot be restored or the ticks
     *                               cannot be scheduled
     */
    public synchronized void start() {
        if (state != State.NEW) {
            throw new IllegalStateException("Engine cannot be started from state " + state);
        }
        try {
            restore();
        } catch (PersistenceException e) {
            throw new IllegalStateException("Failed to restore alerting state", e);
        }
        try {
            tickers.add(scheduler.scheduleAtFixedRate(this::metricsTick,
                    metricsInterval.toMillis(), metricsInterval.toMillis(), TimeUnit.MILLISECONDS));
            tickers.add(scheduler.scheduleAtFixedRate(this::healthTick,
                    0, healthInterval.toMillis(), TimeUnit.MILLISECONDS));
            tickers.add(scheduler.scheduleAtFixedRate(this::escalationTick,
                    escalationInterval.toMillis(), escalationInterval.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException | IllegalArgumentException e) {
            tickers.forEach(t -> t.cancel(false));
            throw new IllegalStateException("Failed to schedule alerting ticks", e);
        }
        state = State.RUNNING;
        LOG.info("Alerting engine started: metrics every {} ms, health every {} ms, escalation every {} ms",
                metricsInterval.toMillis(), healthInterval.toMillis(), escalationInterval.toMillis());
    }

    /**
     * Stop the ticks, let in-flight dispatches finish within the grace
     * period, then persist state. Idempotent.
     */
    public synchronized void stop() {
        if (state == State.STOPPED) {
            return;
        }
        boolean wasRunning = state == State.RUNNING;
        state = State.STOPPED;
        tickers.forEach(t -> t.cancel(false));
        scheduler.shutdown();

        dispatchPool.shutdown();
        awaitOrAbandon(dispatchPool, "dispatch");
        deliveryPool.shutdown();
        awaitOrAbandon(deliveryPool, "delivery");
        scheduler.shutdownNow();

        if (wasRunning) {
            try {
                saveState();
            } catch (PersistenceException e) {
                LOG.error("Failed to persist alerting state on shutdown", e);
            }
        }
        LOG.info("Alerting engine stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public State getState() {
        return state;
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    private void awaitOrAbandon(ExecutorService pool, String name) {
        try {
            if (!pool.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = pool.shutdownNow();
                LOG.warn("Abandoned in-flight {} work after {} ms grace ({} queued task(s) dropped)",
                        name, shutdownGrace.toMillis(), dropped.size());
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------------------------------------------------------------
    // Ticks
    // ---------------------------------------------------------------

    private void metricsTick() {
        if (state != State.RUNNING) {
            return;
        }
        try {
            metricsCollector.collect();
            persistQuietly();
        } catch (RuntimeException e) {
            LOG.error("Metrics tick failed - will retry on next tick", e);
        }
    }

    private void healthTick() {
        if (state != State.RUNNING) {
            return;
        }
        try {
            healthChecker.checkHealth();
        } catch (RuntimeException e) {
            LOG.error("Health tick failed - will retry on next tick", e);
        }
    }

    private void escalationTick() {
        if (state != State.RUNNING) {
            return;
        }
        try {
            if (!escalationManager.scan().isEmpty()) {
                persistQuietly();
            }
        } catch (RuntimeException e) {
            LOG.error("Escalation tick failed - will retry on next tick", e);
        }
    }

    private void scheduleDispatch(Alert alert) {
        try {
            Future<?> future = dispatchPool.submit(() -> dispatchTriggered(alert));
            pendingDispatches.add(future);
            if (future.isDone()) {
                pendingDispatches.remove(future);
            }
        } catch (RejectedExecutionException e) {
            LOG.warn("Engine is stopping - alert {} will not be dispatched", alert.getId());
        }
    }

    private void dispatchTriggered(Alert alert) {
        try {
            List<Channel> targets = channelRegistry.resolve(channelIdsOf(alert));
            dispatcher.dispatch(alert, targets);
            persistQuietly();
        } catch (RuntimeException e) {
            LOG.error("Dispatch of alert {} failed", alert.getId(), e);
        } finally {
            pendingDispatches.removeIf(Future::isDone);
        }
    }

    private static List<String> channelIdsOf(Alert alert) {
        List<String> ids = new ArrayList<>();
        if (alert.getMetadata().get("channels") instanceof Collection<?> c) {
            c.forEach(o -> ids.add(String.valueOf(o)));
        }
        return ids;
    }

    // ---------------------------------------------------------------
    // Collaborator calls
    // ---------------------------------------------------------------

    /**
     * Collect and evaluate a snapshot now, outside the tick cadence.
     *
     * @throws IllegalStateException if the engine is stopped
     */
    public MetricSnapshot collectNow() {
        requireNotStopped();
        MetricSnapshot snapshot = metricsCollector.collectNow();
        persistQuietly();
        return snapshot;
    }

    /**
     * Evaluate rules against an externally supplied snapshot. Notification
     * of triggered alerts happens asynchronously.
     *
     * @return newly triggered alerts
     * @throws IllegalStateException if the engine is stopped
     */
    public List<Alert> evaluate(MetricSnapshot snapshot) {
        requireNotStopped();
        return ruleEngine.evaluate(snapshot);
    }

    /**
     * @return the alert after the call, or empty if unknown
     * @throws IllegalArgumentException if {@code actor} is blank
     * @throws PersistenceException     if the change cannot be saved
     */
    public Optional<Alert> acknowledge(String alertId, String actor) {
        Optional<Alert> result = alertStore.acknowledge(alertId, actor);
        result.ifPresent(a -> saveState());
        return result;
    }

    /**
     * @return the resolved alert, or empty if unknown
     * @throws PersistenceException if the change cannot be saved
     */
    public Optional<Alert> resolve(String alertId) {
        Optional<Alert> result = alertStore.resolve(alertId);
        result.ifPresent(a -> saveState());
        return result;
    }

    /**
     * Deliver an alert to the given channels now and wait for the outcomes.
     */
    public List<DeliveryResult> dispatch(Alert alert, List<Channel> channels) {
        List<DeliveryResult> results = dispatcher.dispatch(alert, channels);
        persistQuietly();
        return results;
    }

    /**
     * @throws IllegalArgumentException if the channel does not exist
     */
    public DeliveryResult testChannel(String channelId) {
        DeliveryResult result = dispatcher.testChannel(channelId);
        persistQuietly();
        return result;
    }

    /**
     * Wait for asynchronous dispatches of triggered alerts.
     *
     * @return {@code true} if all finished within {@code timeout}
     */
    public boolean awaitPendingDispatches(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Future<?> future : List.copyOf(pendingDispatches)) {
            try {
                future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                LOG.debug("Dispatch task failed", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (CancellationException e) {
                LOG.debug("Dispatch task cancelled");
            }
            pendingDispatches.remove(future);
        }
        return true;
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @param status only alerts in this status, or {@code null} for all
     * @return alerts, newest first
     */
    public List<Alert> getAlerts(AlertStatus status) {
        return alertStore.list(status);
    }

    /**
     * @return up to {@code limit} most recent snapshots, oldest first
     */
    public List<MetricSnapshot> getMetrics(int limit) {
        return metricsCollector.getHistory(limit);
    }

    /**
     * Combine the latest health results with open alerts: an active critical
     * alert makes the system unhealthy, an active high alert degraded.
     */
    public SystemStatus getSystemStatus() {
        Map<String, ServiceHealth> checks = healthChecker.lastResults();
        HealthStatus status = HealthChecker.deriveStatus(checks.values());

        List<Alert> active = alertStore.list(AlertStatus.ACTIVE);
        int critical = 0;
        for (Alert alert : active) {
            if (alert.getSeverity() == Severity.CRITICAL) {
                critical++;
                status = status.worst(HealthStatus.UNHEALTHY);
            } else if (alert.getSeverity() == Severity.HIGH) {
                status = status.worst(HealthStatus.DEGRADED);
            }
        }
        return new SystemStatus(status, checks, active.size(), critical, clock.instant());
    }

    // ---------------------------------------------------------------
    // Persistence, export / import
    // ---------------------------------------------------------------

    /**
     * @return every persisted collection plus the export time
     */
    public AlertingConfig exportConfiguration() {
        AlertingConfig config = new AlertingConfig();
        config.setAlertRules(ruleEngine.getRules());
        config.setChannels(channelRegistry.list());
        config.setTemplates(templateRegistry.list());
        config.setEscalationRules(escalationManager.getRules());
        config.setAuditLog(auditLog.snapshot());
        config.setMetrics(metricsCollector.snapshot());
        config.setAlerts(alertStore.snapshot());
        config.setExportedAt(clock.instant());
        return config;
    }

    public String exportConfigurationJson() {
        try {
            return JsonSupport.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(exportConfiguration());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise configuration export", e);
        }
    }

    /**
     * Replace every collection present in {@code config}; absent collections
     * are left untouched. Rules are accepted as given; malformed ones are
     * skipped at evaluation time.
     *
     * @throws PersistenceException if the imported state cannot be saved
     */
    public void importConfiguration(AlertingConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        apply(config);
        LOG.info("Imported configuration: {}", config);
        saveState();
    }

    /**
     * @throws IllegalArgumentException if the document is not a valid export
     */
    public void importConfigurationJson(String json) {
        AlertingConfig config;
        try {
            config = JsonSupport.mapper().readValue(json, AlertingConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed configuration document: " + e.getOriginalMessage(), e);
        }
        importConfiguration(config);
    }

    private void apply(AlertingConfig config) {
        if (config.getAlertRules() != null) {
            ruleEngine.replaceRules(config.getAlertRules());
        }
        if (config.getChannels() != null) {
            channelRegistry.replaceAll(config.getChannels());
        }
        if (config.getTemplates() != null) {
            templateRegistry.replaceAll(config.getTemplates());
        }
        if (config.getEscalationRules() != null) {
            escalationManager.replaceRules(config.getEscalationRules());
        }
        if (config.getAuditLog() != null) {
            auditLog.restore(config.getAuditLog());
        }
        if (config.getMetrics() != null) {
            metricsCollector.restore(config.getMetrics());
        }
        if (config.getAlerts() != null) {
            alertStore.restore(config.getAlerts());
        }
        ruleEngine.restoreCooldowns(alertStore.snapshot());
        escalationManager.restoreEscalations(auditLog.snapshot());
    }

    private void restore() {
        AlertingConfig restored = new AlertingConfig();
        restored.setAlertRules(load(StoreKey.ALERT_RULES, seed::getAlertRules));
        restored.setChannels(load(StoreKey.CHANNELS, seed::getChannels));
        restored.setTemplates(load(StoreKey.TEMPLATES, seed::getTemplates));
        restored.setEscalationRules(load(StoreKey.ESCALATION_RULES, seed::getEscalationRules));
        restored.setAuditLog(load(StoreKey.AUDIT_LOG, seed::getAuditLog));
        restored.setMetrics(load(StoreKey.METRICS, seed::getMetrics));
        restored.setAlerts(load(StoreKey.ALERTS, seed::getAlerts));
        apply(restored);
        LOG.info("Alerting state restored: {}", restored);
    }

    private <T> List<T> load(StoreKey<T> key, Supplier<List<T>> fallback) {
        return store.load(key).orElseGet(() -> {
            LOG.debug("No stored '{}' collection - using seed", key);
            return fallback.get();
        });
    }

    /**
     * Write every collection to the store.
     *
     * @throws PersistenceException if any write fails
     */
    public void saveState() {
        synchronized (persistLock) {
            store.save(StoreKey.ALERT_RULES, ruleEngine.getRules());
            store.save(StoreKey.CHANNELS, channelRegistry.list());
            store.save(StoreKey.TEMPLATES, templateRegistry.list());
            store.save(StoreKey.ESCALATION_RULES, escalationManager.getRules());
            store.save(StoreKey.AUDIT_LOG, auditLog.snapshot());
            store.save(StoreKey.METRICS, metricsCollector.snapshot());
            store.save(StoreKey.ALERTS, alertStore.snapshot());
        }
    }

    private void persistQuietly() {
        try {
            saveState();
        } catch (PersistenceException e) {
            LOG.error("Failed to persist alerting state - will retry on next change", e);
        }
    }

    private void requireNotStopped() {
        if (state == State.STOPPED) {
            throw new IllegalStateException("Alerting engine is stopped");
        }
    }

    // ---------------------------------------------------------------
    // Components
    // ---------------------------------------------------------------

    public AuditLog getAuditLog() {
        return auditLog;
    }

    public MetricsCollector getMetricsCollector() {
        return metricsCollector;
    }

    public HealthChecker getHealthChecker() {
        return healthChecker;
    }

    public AlertStore getAlertStore() {
        return alertStore;
    }

    public AlertRuleEngine getRuleEngine() {
        return ruleEngine;
    }

    public ChannelRegistry getChannelRegistry() {
        return channelRegistry;
    }

    public TemplateRegistry getTemplateRegistry() {
        return templateRegistry;
    }

    public NotificationDispatcher getDispatcher() {
        return dispatcher;
    }

    public EscalationManager getEscalationManager() {
        return escalationManager;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AlertingEngine}. Every setting has a default
     * except probes, service checks and senders, which are empty.
     */
    public static final class Builder {
        private Clock clock = Clock.systemUTC();
        private StateStore store = new InMemoryStateStore();
        private AlertingConfig seed = new AlertingConfig();
        private ZoneId zone = ZoneOffset.UTC;
        private final List<ChannelSender> senders = new ArrayList<>();
        private final List<MetricRegistration> metricProbes = new ArrayList<>();
        private final List<ServiceRegistration> serviceChecks = new ArrayList<>();
        private Duration metricsInterval = Duration.ofSeconds(30);
        private Duration healthInterval = Duration.ofSeconds(60);
        private Duration escalationInterval = Duration.ofSeconds(60);
        private Duration dispatchTimeout = Duration.ofSeconds(10);
        private Duration shutdownGrace = Duration.ofSeconds(5);
        private int dispatchThreads = 2;

        private Builder() {
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder stateStore(StateStore store) {
            this.store = store;
            return this;
        }

        /**
         * Collections used for anything the state store has never saved.
         */
        public Builder seed(AlertingConfig seed) {
            this.seed = seed;
            return this;
        }

        /** Zone used to format timestamps in notification templates. */
        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder sender(ChannelSender sender) {
            this.senders.add(Objects.requireNonNull(sender, "sender must not be null"));
            return this;
        }

        public Builder senders(Collection<? extends ChannelSender> senders) {
            senders.forEach(this::sender);
            return this;
        }

        public Builder metricProbe(String metric, MetricProbe probe) {
            metricProbes.add(c -> c.register(metric, probe));
            return this;
        }

        public Builder metricProbe(String metric, MetricProbe probe, double degradedValue) {
            metricProbes.add(c -> c.register(metric, probe, degradedValue));
            return this;
        }

        public Builder serviceCheck(String service, boolean core, Duration timeout, ServiceProbe probe) {
            serviceChecks.add(h -> h.register(service, core, timeout, probe));
            return this;
        }

        public Builder metricsInterval(Duration metricsInterval) {
            this.metricsInterval = metricsInterval;
            return this;
        }

        public Builder healthInterval(Duration healthInterval) {
            this.healthInterval = healthInterval;
            return this;
        }

        public Builder escalationInterval(Duration escalationInterval) {
            this.escalationInterval = escalationInterval;
            return this;
        }

        /** Per-channel bound on a single delivery. */
        public Builder dispatchTimeout(Duration dispatchTimeout) {
            this.dispatchTimeout = dispatchTimeout;
            return this;
        }

        /** How long {@link #stop()} waits for in-flight dispatches. */
        public Builder shutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
            return this;
        }

        public Builder dispatchThreads(int dispatchThreads) {
            this.dispatchThreads = dispatchThreads;
            return this;
        }

        /**
         * @throws IllegalStateException if any setting is missing or not positive
         */
        public AlertingEngine build() {
            List<String> errors = new ArrayList<>();
            if (clock == null) {
                errors.add("clock is required");
            }
            if (store == null) {
                errors.add("stateStore is required");
            }
            if (seed == null) {
                errors.add("seed is required");
            }
            if (zone == null) {
                errors.add("zone is required");
            }
            requirePositive(errors, "metricsInterval", metricsInterval);
            requirePositive(errors, "healthInterval", healthInterval);
            requirePositive(errors, "escalationInterval", escalationInterval);
            requirePositive(errors, "dispatchTimeout", dispatchTimeout);
            requirePositive(errors, "shutdownGrace", shutdownGrace);
            if (dispatchThreads <= 0) {
                errors.add("dispatchThreads must be > 0");
            }
            if (!errors.isEmpty()) {
                throw new IllegalStateException("Invalid AlertingEngine configuration: " + String.join("; ", errors));
            }
            return new AlertingEngine(this);
        }

        private static void requirePositive(List<String> errors, String name, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                errors.add(name + " must be > 0");
            }
        }
    }

    @FunctionalInterface
    private interface MetricRegistration {
        void apply(MetricsCollector collector);
    }

    @FunctionalInterface
    private interface ServiceRegistration {
        void apply(HealthChecker checker);
    }
}
