package com.pulsesentinel.core.health;

import com.pulsesentinel.core.model.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Probes every registered service concurrently, each under its own timeout.
 *
 * <p>
 * A probe that throws or exceeds its timeout is reported as
 * {@link HealthStatus#UNHEALTHY} when the service is core and
 * {@link HealthStatus#DEGRADED} otherwise. Failures are captured in
 * {@link ServiceHealth#getErrorMessage()} and never re-raised.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthChecker {

    private static final Logger LOG = LoggerFactory.getLogger(HealthChecker.class);

    private final Clock clock;
    private final Executor executor;
    private final Map<String, Registration> services = new LinkedHashMap<>();
    private volatile Map<String, ServiceHealth> lastResults = Collections.emptyMap();

    /**
     * @param clock    time source for {@code lastCheck}
     * @param executor runs the probes; must allow as many concurrent tasks as
     *                 there are services for probes to be truly independent
     */
    public HealthChecker(Clock clock, Executor executor) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public synchronized void register(String service, boolean core, Duration timeout, ServiceProbe probe) {
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(probe, "probe must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0 for service " + service);
        }
        services.put(service, new Registration(core, timeout, probe));
    }

    /**
     * Run all probes and wait for every one of them to finish or time out.
     *
     * @return results keyed by service name, in registration order
     */
    public Map<String, ServiceHealth> checkHealth() {
        Map<String, Registration> snapshot;
        synchronized (this) {
            snapshot = new LinkedHashMap<>(services);
        }

        Map<String, CompletableFuture<ServiceHealth>> futures = new LinkedHashMap<>();
        snapshot.forEach((name, reg) -> futures.put(name, probeAsync(name, reg)));

        Map<String, ServiceHealth> results = new LinkedHashMap<>();
        futures.forEach((name, future) -> results.put(name, future.join()));

        lastResults = Collections.unmodifiableMap(results);
        HealthStatus overall = deriveStatus(results.values());
        if (overall == HealthStatus.HEALTHY) {
            LOG.debug("Health check complete: {}", overall.id());
        } else {
            LOG.warn("Health check complete: {} {}", overall.id(), results.values());
        }
        return lastResults;
    }

    private CompletableFuture<ServiceHealth> probeAsync(String name, Registration reg) {
        long startNanos = System.nanoTime();
        CompletableFuture<Map<String, Object>> outcome = new CompletableFuture<>();
        // cancelled on timeout
        FutureTask<Void> task = new FutureTask<>(() -> {
            try {
                outcome.complete(reg.probe.check());
            } catch (Exception e) {
                outcome.completeExceptionally(e);
            }
        }, null);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            outcome.completeExceptionally(e);
        }
        return outcome
                .orTimeout(reg.timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((details, error) -> {
                    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
                    Instant now = clock.instant();
                    if (error == null) {
                        return new ServiceHealth(name, HealthStatus.HEALTHY, reg.core, elapsedMs,
                                now, null, details);
                    }
                    Throwable cause = unwrap(error);
                    if (cause instanceof TimeoutException) {
                        task.cancel(true);
                    }
                    String message = describe(cause, reg.timeout);
                    LOG.warn("Service [{}] probe failed: {}", name, message);
                    HealthStatus status = reg.core ? HealthStatus.UNHEALTHY : HealthStatus.DEGRADED;
                    return new ServiceHealth(name, status, reg.core, elapsedMs, now, message, null);
                });
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static String describe(Throwable t, Duration timeout) {
        if (t instanceof TimeoutException) {
            return "timed out after " + timeout.toMillis() + " ms";
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    /**
     * @return results of the most recent {@link #checkHealth()}, empty before the first run
     */
    public Map<String, ServiceHealth> lastResults() {
        return lastResults;
    }

    /**
     * Combine individual results: any unhealthy service makes the whole
     * unhealthy, otherwise any degraded service makes it degraded.
     */
    public static HealthStatus deriveStatus(Collection<ServiceHealth> results) {
        HealthStatus status = HealthStatus.HEALTHY;
        for (ServiceHealth h : results) {
            status = status.worst(h.getStatus());
        }
        return status;
    }

    private static final class Registration {
        private final boolean core;
        private final Duration timeout;
        private final ServiceProbe probe;

        private Registration(boolean core, Duration timeout, ServiceProbe probe) {
            this.core = core;
            this.timeout = timeout;
            this.probe = probe;
        }
    }
}
