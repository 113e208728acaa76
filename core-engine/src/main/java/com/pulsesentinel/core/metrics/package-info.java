/**
 * Periodic metric sampling.
 *
 * <p>
 * {@link com.pulsesentinel.core.metrics.MetricsCollector} knows nothing about
 * where values come from; each metric is a
 * {@link com.pulsesentinel.core.metrics.MetricProbe} registered by the
 * hosting process.
 * </p>
 */
package com.pulsesentinel.core.metrics;
