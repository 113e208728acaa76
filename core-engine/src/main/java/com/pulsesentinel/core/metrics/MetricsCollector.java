package com.pulsesentinel.core.metrics;

import com.pulsesentinel.core.model.MetricSnapshot;
import com.pulsesentinel.core.support.BoundedHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Samples every registered metric into a {@link MetricSnapshot}.
 *
 * <h3>Partial failure</h3>
 * <p>
 * Each probe is sampled independently. A probe that throws (or returns a
 * non-finite value) contributes its sentinel value instead, is listed in
 * {@link MetricSnapshot#getDegradedFields()}, and adds
 * {@value #FAILED_PROBE_ERROR_PENALTY} to {@code error_rate}.
 * {@link #collect()} never throws because of a probe.
 * </p>
 *
 * <h3>Error rate</h3>
 * <p>
 * Unless an explicit {@code error_rate} probe is registered, the error rate is
 * the percentage of the last {@value #ERROR_RATE_WINDOW} snapshots whose
 * {@code response_time} exceeded {@value #SLOW_RESPONSE_MS} ms.
 * </p>
 *
 * <h3>Publication</h3>
 * <p>
 * The snapshot is appended to a bounded history (oldest evicted first) and
 * then handed to every subscriber in registration order. Collection is
 * serialised, so subscribers see snapshots one at a time and in order.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricsCollector {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsCollector.class);

    public static final int DEFAULT_HISTORY_CAPACITY = 1000;

    static final double FAILED_PROBE_ERROR_PENALTY = 10.0;
    static final int ERROR_RATE_WINDOW = 10;
    static final double SLOW_RESPONSE_MS = 3000.0;

    /** Sentinel used for a failed response-time probe. */
    public static final double DEGRADED_RESPONSE_TIME_MS = 5000.0;

    private final Clock clock;
    private final BoundedHistory<MetricSnapshot> history;
    private final Map<String, Registration> probes = new LinkedHashMap<>();
    private final List<Consumer<MetricSnapshot>> subscribers = new CopyOnWriteArrayList<>();

    public MetricsCollector(Clock clock) {
        this(clock, DEFAULT_HISTORY_CAPACITY);
    }

    public MetricsCollector(Clock clock, int historyCapacity) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.history = new BoundedHistory<>(historyCapacity);
    }

    // ---------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------

    /**
     * Register a probe with the default sentinel ({@value #DEGRADED_RESPONSE_TIME_MS}
     * for {@code response_time}, {@code 0} otherwise).
     */
    public synchronized void register(String metric, MetricProbe probe) {
        register(metric, probe,
                MetricSnapshot.RESPONSE_TIME.equals(metric) ? DEGRADED_RESPONSE_TIME_MS : 0.0);
    }

    /**
     * @param metric        snapshot field name
     * @param probe         sampler
     * @param degradedValue value recorded when the probe fails
     */
    public synchronized void register(String metric, MetricProbe probe, double degradedValue) {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(probe, "probe must not be null");
        probes.put(metric, new Registration(probe, degradedValue));
        LOG.debug("Registered metric probe [{}]", metric);
    }

    public void subscribe(Consumer<MetricSnapshot> subscriber) {
        subscribers.add(Objects.requireNonNull(subscriber, "subscriber must not be null"));
    }

    // ---------------------------------------------------------------
    // Collection
    // ---------------------------------------------------------------

    /**
     * Sample all metrics, append the snapshot to history and publish it.
     *
     * @return the new snapshot
     */
    public synchronized MetricSnapshot collect() {
        Instant now = clock.instant();
        MetricSnapshot.Builder builder = MetricSnapshot.builder(now);

        for (Map.Entry<String, Registration> e : probes.entrySet()) {
            String metric = e.getKey();
            Registration reg = e.getValue();
            try {
                double value = reg.probe.sample();
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    throw new IllegalStateException("probe returned non-finite value " + value);
                }
                builder.value(metric, value);
            } catch (Exception ex) {
                LOG.warn("Metric probe [{}] failed - recording sentinel {}: {}",
                        metric, reg.degradedValue, ex.getMessage());
                builder.degraded(metric, reg.degradedValue);
            }
        }

        if (!probes.containsKey(MetricSnapshot.ERROR_RATE)) {
            builder.value(MetricSnapshot.ERROR_RATE, derivedErrorRate());
        }
        int failures = builder.degradedCount();
        if (failures > 0) {
            double base = builder.peek(MetricSnapshot.ERROR_RATE).orElse(0.0);
            builder.value(MetricSnapshot.ERROR_RATE, base + failures * FAILED_PROBE_ERROR_PENALTY);
        }

        MetricSnapshot snapshot = builder.build();
        history.append(snapshot);
        LOG.debug("Collected {}", snapshot);
        publish(snapshot);
        return snapshot;
    }

    /**
     * On-demand sampling outside the ticker cadence.
     *
     * @return the new snapshot
     */
    public MetricSnapshot collectNow() {
        LOG.info("On-demand metrics collection requested");
        return collect();
    }

    private void publish(MetricSnapshot snapshot) {
        for (Consumer<MetricSnapshot> subscriber : subscribers) {
            try {
                subscriber.accept(snapshot);
            } catch (RuntimeException e) {
                LOG.error("Snapshot subscriber failed - continuing with next subscriber", e);
            }
        }
    }

    private double derivedErrorRate() {
        List<MetricSnapshot> recent = history.tail(ERROR_RATE_WINDOW);
        if (recent.isEmpty()) {
            return 0.0;
        }
        long slow = recent.stream()
                .map(s -> s.getValue(MetricSnapshot.RESPONSE_TIME))
                .filter(v -> v.isPresent() && v.get() > SLOW_RESPONSE_MS)
                .count();
        return (slow * 100.0) / recent.size();
    }

    // ---------------------------------------------------------------
    // History
    // ---------------------------------------------------------------

    public Optional<MetricSnapshot> latest() {
        return history.latest();
    }

    /**
     * @param limit maximum number of snapshots
     * @return the most recent snapshots, oldest first
     */
    public List<MetricSnapshot> getHistory(int limit) {
        return history.tail(limit);
    }

    /**
     * @return every retained snapshot, oldest first
     */
    public List<MetricSnapshot> snapshot() {
        return history.toList();
    }

    public void restore(Collection<MetricSnapshot> snapshots) {
        history.replaceAll(snapshots);
        LOG.info("Metric history restored with {} snapshot(s)", history.size());
    }

    public synchronized List<String> registeredMetrics() {
        return new ArrayList<>(probes.keySet());
    }

    private static final class Registration {
        private final MetricProbe probe;
        private final double degradedValue;

        private Registration(MetricProbe probe, double degradedValue) {
            this.probe = probe;
            this.degradedValue = degradedValue;
        }
    }
}
