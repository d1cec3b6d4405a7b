package com.fleetsentinel.core.config;

import java.time.Duration;
import java.util.List;

/**
 * Resource limits for one detection cycle.
 *
 * @since 1.0.0
 */
public class CycleSettings {

    /** Containers evaluated in parallel; training is the CPU-heavy step. */
    private int maxConcurrency = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);

    /** Upper bound for one metric read; a timeout counts as insufficient data. */
    private long metricReadTimeoutMillis = 5_000;

    /** How far back the statistical detectors read samples. */
    private long lookbackMinutes = 60;

    void validate(List<String> errors) {
        if (maxConcurrency < 1) {
            errors.add("cycle.maxConcurrency must be >= 1, got: " + maxConcurrency);
        }
        if (metricReadTimeoutMillis < 1) {
            errors.add("cycle.metricReadTimeoutMillis must be >= 1, got: " + metricReadTimeoutMillis);
        }
        if (lookbackMinutes < 1) {
            errors.add("cycle.lookbackMinutes must be >= 1, got: " + lookbackMinutes);
        }
    }

    public Duration metricReadTimeout() {
        return Duration.ofMillis(metricReadTimeoutMillis);
    }

    public Duration lookback() {
        return Duration.ofMinutes(lookbackMinutes);
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public long getMetricReadTimeoutMillis() {
        return metricReadTimeoutMillis;
    }

    public void setMetricReadTimeoutMillis(long metricReadTimeoutMillis) {
        this.metricReadTimeoutMillis = metricReadTimeoutMillis;
    }

    public long getLookbackMinutes() {
        return lookbackMinutes;
    }

    public void setLookbackMinutes(long lookbackMinutes) {
        this.lookbackMinutes = lookbackMinutes;
    }

    @Override
    public String toString() {
        return "CycleSettings{" +
                "maxConcurrency=" + maxConcurrency +
                ", metricReadTimeoutMillis=" + metricReadTimeoutMillis +
                ", lookbackMinutes=" + lookbackMinutes +
                '}';
    }
}
