package com.fleetsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one detector evaluation for one (container, metric).
 *
 * <p>
 * Each detection method contributes its own subclass carrying the payload
 * that only makes sense for that method:
 * </p>
 * <ul>
 * <li>{@link StatisticalDetection}: window mean, standard deviation and
 * z-score</li>
 * <li>{@link IsolationForestDetection}: raw anomaly score and the
 * contamination cutoff</li>
 * </ul>
 *
 * <p>
 * This base class is the common projection downstream consumers work with:
 * identity, current value, deviation score, anomalous flag, threshold and
 * method. {@link #isAnomalous()} is true iff the deviation score crosses the
 * method's threshold.
 * </p>
 *
 * <p>
 * Detections are transient; they are the basis for an {@link Insight} and are
 * never persisted by the engine.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AnomalyDetection {

    private final String containerId;
    private final String containerName;
    private final MetricType metricType;
    private final double currentValue;
    private final double deviationScore;
    private final boolean anomalous;
    private final double threshold;
    private final Instant timestamp;
    private final DetectionMethod method;

    protected AnomalyDetection(String containerId,
            String containerName,
            MetricType metricType,
            double currentValue,
            double deviationScore,
            boolean anomalous,
            double threshold,
            Instant timestamp,
            DetectionMethod method) {
        this.containerId = Objects.requireNonNull(containerId, "containerId must not be null");
        this.containerName = containerName != null ? containerName : containerId;
        this.metricType = Objects.requireNonNull(metricType, "metricType must not be null");
        this.currentValue = currentValue;
        this.deviationScore = deviationScore;
        this.anomalous = anomalous;
        this.threshold = threshold;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.method = Objects.requireNonNull(method, "method must not be null");
    }

    public String getContainerId() {
        return containerId;
    }

    public String getContainerName() {
        return containerName;
    }

    public MetricType getMetricType() {
        return metricType;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    /**
     * The method's deviation signal: the z-score for statistical methods, the
     * raw anomaly score for the Isolation Forest.
     *
     * @return deviation score
     */
    public double getDeviationScore() {
        return deviationScore;
    }

    public boolean isAnomalous() {
        return anomalous;
    }

    /**
     * The threshold the deviation score was compared against: the (possibly
     * widened) z threshold or band multiplier, or the forest cutoff.
     *
     * @return threshold
     */
    public double getThreshold() {
        return threshold;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public DetectionMethod getMethod() {
        return method;
    }

    /**
     * @return window mean; 0 where the method has no window statistics
     */
    public abstract double getMean();

    /**
     * @return window standard deviation; 0 where the method has no window
     *         statistics
     */
    public abstract double getStdDev();

    /**
     * Severity an insight built from this detection should start from.
     *
     * @return severity hint for anomalous detections
     */
    public abstract InsightSeverity severityHint();

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyDetection that))
            return false;
        return getClass() == that.getClass()
                && Double.compare(currentValue, that.currentValue) == 0
                && Double.compare(deviationScore, that.deviationScore) == 0
                && containerId.equals(that.containerId)
                && metricType == that.metricType
                && timestamp.equals(that.timestamp)
                && method == that.method;
    }

    @Override
    public int hashCode() {
        return Objects.hash(containerId, metricType, currentValue, deviationScore, timestamp, method);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "containerId='" + containerId + '\'' +
                ", metricType=" + metricType +
                ", currentValue=" + currentValue +
                ", deviationScore=" + deviationScore +
                ", anomalous=" + anomalous +
                ", threshold=" + threshold +
                ", method=" + method +
                ", timestamp=" + timestamp +
                '}';
    }
}
