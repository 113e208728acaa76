package com.pulsesentinel.service;

import com.pulsesentinel.core.metrics.MetricProbe;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;

/**
 * CPU and memory usage of the host process, as percentages.
 */
public final class JvmMetricProbes {

    private JvmMetricProbes() {
        // utility class, not instantiable
    }

    /**
     * System CPU load in [0, 100]. Fails when the platform does not expose it.
     */
    public static MetricProbe cpuUsage() {
        return () -> {
            OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
            if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
                double load = sunOs.getCpuLoad();
                if (load < 0) {
                    throw new IllegalStateException("CPU load not yet available");
                }
                return load * 100.0;
            }
            double average = os.getSystemLoadAverage();
            if (average < 0) {
                throw new IllegalStateException("CPU load not supported on this platform");
            }
            return Math.min(100.0, average / os.getAvailableProcessors() * 100.0);
        };
    }

    /**
     * Heap used relative to the maximum (or committed, when unbounded) heap.
     */
    public static MetricProbe memoryUsage() {
        return () -> {
            MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
            long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
            return heap.getUsed() * 100.0 / max;
        };
    }
}
