package com.pulsesentinel.core.metrics;

import com.pulsesentinel.core.model.MetricSnapshot;
import com.pulsesentinel.core.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MetricsCollector}.
 */
class MetricsCollectorTest {

    private MutableClock clock;
    private MetricsCollector collector;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:00:00Z");
        collector = new MetricsCollector(clock, 5);
    }

    @Test
    @DisplayName("Should sample every registered probe into one snapshot")
    void shouldSampleAllProbes() {
        collector.register(MetricSnapshot.CPU_USAGE, () -> 42.5);
        collector.register(MetricSnapshot.MEMORY_USAGE, () -> 61.0);

        MetricSnapshot snapshot = collector.collect();

        assertThat(snapshot.getTimestamp()).isEqualTo(clock.instant());
        assertThat(snapshot.getValue(MetricSnapshot.CPU_USAGE)).contains(42.5);
        assertThat(snapshot.getValue(MetricSnapshot.MEMORY_USAGE)).contains(61.0);
        assertThat(snapshot.getValue(MetricSnapshot.ERROR_RATE)).contains(0.0);
        assertThat(snapshot.getDegradedFields()).isEmpty();
    }

    @Test
    @DisplayName("Should record sentinels for failed probes and raise the error rate")
    void shouldDegradeFailedProbes() {
        collector.register(MetricSnapshot.CPU_USAGE, () -> 10.0);
        collector.register(MetricSnapshot.RESPONSE_TIME, () -> {
            throw new IllegalStateException("connection refused");
        });
        collector.register(MetricSnapshot.ACTIVE_USERS, () -> Double.NaN);

        MetricSnapshot snapshot = collector.collect();

        assertThat(snapshot.getValue(MetricSnapshot.CPU_USAGE)).contains(10.0);
        assertThat(snapshot.getValue(MetricSnapshot.RESPONSE_TIME))
                .contains(MetricsCollector.DEGRADED_RESPONSE_TIME_MS);
        assertThat(snapshot.getValue(MetricSnapshot.ACTIVE_USERS)).contains(0.0);
        assertThat(snapshot.getDegradedFields())
                .containsExactlyInAnyOrder(MetricSnapshot.RESPONSE_TIME, MetricSnapshot.ACTIVE_USERS);
        assertThat(snapshot.getValue(MetricSnapshot.ERROR_RATE))
                .contains(2 * MetricsCollector.FAILED_PROBE_ERROR_PENALTY);
    }

    @Test
    @DisplayName("Should derive error rate from slow responses in recent history")
    void shouldDeriveErrorRateFromHistory() {
        double[] responses = {100, 4000, 200, 3500};
        int[] i = {0};
        collector.register(MetricSnapshot.RESPONSE_TIME, () -> responses[i[0]++ % responses.length]);

        collector.collect();
        collector.collect();
        collector.collect();
        collector.collect();
        MetricSnapshot fifth = collector.collect();

        // 2 of the previous 4 snapshots were slower than 3000 ms
        assertThat(fifth.getValue(MetricSnapshot.ERROR_RATE)).contains(50.0);
    }

    @Test
    @DisplayName("Should prefer an explicit error_rate probe over the derived value")
    void shouldUseExplicitErrorRateProbe() {
        collector.register(MetricSnapshot.ERROR_RATE, () -> 3.5);

        assertThat(collector.collect().getValue(MetricSnapshot.ERROR_RATE)).contains(3.5);
    }

    @Test
    @DisplayName("Should publish to subscribers in order and survive a failing subscriber")
    void shouldPublishToSubscribers() {
        List<String> seen = new ArrayList<>();
        AtomicReference<MetricSnapshot> last = new AtomicReference<>();
        collector.subscribe(s -> seen.add("first"));
        collector.subscribe(s -> {
            throw new IllegalStateException("subscriber bug");
        });
        collector.subscribe(s -> {
            seen.add("third");
            last.set(s);
        });

        MetricSnapshot snapshot = collector.collect();

        assertThat(seen).containsExactly("first", "third");
        assertThat(last.get()).isSameAs(snapshot);
    }

    @Test
    @DisplayName("Should keep a bounded history, oldest first")
    void shouldBoundHistory() {
        collector.register(MetricSnapshot.CPU_USAGE, () -> 1.0);
        for (int n = 0; n < 7; n++) {
            collector.collect();
            clock.advance(Duration.ofSeconds(30));
        }

        List<MetricSnapshot> history = collector.getHistory(100);
        assertThat(history).hasSize(5);
        assertThat(history.get(0).getTimestamp()).isBefore(history.get(4).getTimestamp());
        assertThat(collector.getHistory(2)).containsExactly(history.get(3), history.get(4));
        assertThat(collector.latest()).contains(history.get(4));
    }

    @Test
    @DisplayName("Should restore history without publishing it")
    void shouldRestoreHistory() {
        List<MetricSnapshot> published = new ArrayList<>();
        collector.subscribe(published::add);
        MetricSnapshot old = MetricSnapshot.builder(clock.instant()).value(MetricSnapshot.CPU_USAGE, 5).build();

        collector.restore(List.of(old));

        assertThat(collector.snapshot()).containsExactly(old);
        assertThat(published).isEmpty();
    }
}
