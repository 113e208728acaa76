package com.pulsesentinel.core.metrics;

/**
 * Samples the current value of one metric.
 *
 * <p>
 * Implementations may block briefly (an HTTP round trip) and may throw; the
 * collector turns any exception into a degraded value for that metric.
 * </p>
 */
@FunctionalInterface
public interface MetricProbe {

    /**
     * @return the current value; must be finite
     * @throws Exception if the value cannot be obtained
     */
    double sample() throws Exception;
}
