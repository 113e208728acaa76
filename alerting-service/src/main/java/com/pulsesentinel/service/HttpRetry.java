package com.pulsesentinel.service;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * Resilience4j retry policies for outbound HTTP calls.
 *
 * <p>
 * Bounded exponential backoff: 3 attempts, 500 ms then 1 s between them.
 * Connection failures and {@link RetryableStatusException} (5xx, 429) are
 * retried; anything else fails on the first attempt.
 * </p>
 */
public final class HttpRetry {

    private static final Logger LOG = LoggerFactory.getLogger(HttpRetry.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofMillis(500);
    public static final double BACKOFF_MULTIPLIER = 2.0;

    private HttpRetry() {
        // utility class, not instantiable
    }

    /**
     * @return a registry whose default config is the standard HTTP policy
     */
    public static RetryRegistry registry() {
        return registry(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_INTERVAL);
    }

    public static RetryRegistry registry(int maxAttempts, Duration initialInterval) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialInterval, BACKOFF_MULTIPLIER))
                .retryOnException(HttpRetry::isRetryable)
                .build();
        return RetryRegistry.of(config);
    }

    /**
     * @param registry registry to take the config from
     * @param name     retry instance name, e.g. {@code webhook}
     * @return a retry that logs each attempt
     */
    public static Retry retry(RetryRegistry registry, String name) {
        Retry retry = registry.retry(name);
        retry.getEventPublisher()
                .onRetry(e -> LOG.warn("Retrying {} call (attempt {}) after {}: {}", name,
                        e.getNumberOfRetryAttempts(), e.getWaitInterval(),
                        e.getLastThrowable() != null ? e.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }

    /**
     * Per-request timeout that lets every attempt and the backoff between
     * them fit inside one dispatch timeout.
     */
    public static Duration requestTimeout(Duration dispatchTimeout) {
        return requestTimeout(dispatchTimeout, DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_INTERVAL);
    }

    static Duration requestTimeout(Duration dispatchTimeout, int maxAttempts, Duration initialInterval) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        double backoffMs = 0;
        double wait = initialInterval.toMillis();
        for (int i = 1; i < maxAttempts; i++) {
            backoffMs += wait;
            wait *= BACKOFF_MULTIPLIER;
        }
        long budgetMs = dispatchTimeout.toMillis() - (long) backoffMs;
        if (budgetMs < maxAttempts) {
            budgetMs = dispatchTimeout.toMillis();
        }
        return Duration.ofMillis(Math.max(1, budgetMs / maxAttempts));
    }

    static boolean isRetryable(Throwable t) {
        return t instanceof IOException || t instanceof RetryableStatusException;
    }

    /**
     * A response status worth retrying.
     */
    static final class RetryableStatusException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        RetryableStatusException(String message) {
            super(message);
        }
    }
}
