package com.fleetsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single metric observation for one container.
 *
 * <p>
 * Immutable. Samples are supplied by the time-series store in ascending
 * timestamp order per (container, metric).
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSample {

    private final String containerId;
    private final MetricType metricType;
    private final double value;
    private final Instant timestamp;

    /**
     * @param containerId owning container; must not be {@code null}
     * @param metricType  metric kind; must not be {@code null}
     * @param value       observed value (may be non-finite if the source is
     *                    corrupt; detectors filter those out)
     * @param timestamp   observation time; must not be {@code null}
     */
    public MetricSample(String containerId, MetricType metricType, double value, Instant timestamp) {
        this.containerId = Objects.requireNonNull(containerId, "containerId must not be null");
        this.metricType = Objects.requireNonNull(metricType, "metricType must not be null");
        this.value = value;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public String getContainerId() {
        return containerId;
    }

    public MetricType getMetricType() {
        return metricType;
    }

    public double getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return {@code true} if the value is neither NaN nor infinite
     */
    public boolean isFinite() {
        return Double.isFinite(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSample that))
            return false;
        return Double.compare(value, that.value) == 0
                && containerId.equals(that.containerId)
                && metricType == that.metricType
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(containerId, metricType, value, timestamp);
    }

    @Override
    public String toString() {
        return "MetricSample{" +
                "containerId='" + containerId + '\'' +
                ", metricType=" + metricType +
                ", value=" + value +
                ", timestamp=" + timestamp +
                '}';
    }
}
