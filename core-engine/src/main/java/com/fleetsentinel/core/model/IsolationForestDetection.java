package com.fleetsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Detection produced by the Isolation Forest detector.
 *
 * <p>
 * The deviation score carries the raw anomaly score in [0, 1] and the
 * threshold carries the cutoff derived from the model's contamination
 * fraction. Window mean and standard deviation do not exist for this method
 * and are reported as zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class IsolationForestDetection extends AnomalyDetection {

    /** Anomaly score above which an anomaly is reported as critical. */
    public static final double CRITICAL_ANOMALY_SCORE = 0.7;

    private final double cpuValue;
    private final double memoryValue;

    private IsolationForestDetection(Builder b) {
        super(b.containerId, b.containerName, b.metricType,
                b.metricType == MetricType.CPU ? b.cpuValue : b.memoryValue,
                b.anomalyScore, b.anomalyScore > b.cutoff, b.cutoff, b.timestamp,
                DetectionMethod.ISOLATION_FOREST);
        this.cpuValue = b.cpuValue;
        this.memoryValue = b.memoryValue;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public double getMean() {
        return 0;
    }

    @Override
    public double getStdDev() {
        return 0;
    }

    public double getAnomalyScore() {
        return getDeviationScore();
    }

    public double getCutoff() {
        return getThreshold();
    }

    public double getCpuValue() {
        return cpuValue;
    }

    public double getMemoryValue() {
        return memoryValue;
    }

    @Override
    public InsightSeverity severityHint() {
        return getAnomalyScore() > CRITICAL_ANOMALY_SCORE
                ? InsightSeverity.CRITICAL
                : InsightSeverity.WARNING;
    }

    /**
     * Fluent builder for {@link IsolationForestDetection}.
     *
     * <p>
     * The anomalous flag is derived: {@code anomalyScore > cutoff}.
     * </p>
     */
    public static class Builder {
        private String containerId;
        private String containerName;
        private MetricType metricType = MetricType.CPU;
        private double cpuValue;
        private double memoryValue;
        private double anomalyScore;
        private double cutoff;
        private Instant timestamp;

        public Builder containerId(String containerId) {
            this.containerId = containerId;
            return this;
        }

        public Builder containerName(String containerName) {
            this.containerName = containerName;
            return this;
        }

        public Builder metricType(MetricType metricType) {
            this.metricType = metricType;
            return this;
        }

        public Builder cpuValue(double cpuValue) {
            this.cpuValue = cpuValue;
            return this;
        }

        public Builder memoryValue(double memoryValue) {
            this.memoryValue = memoryValue;
            return this;
        }

        public Builder anomalyScore(double anomalyScore) {
            this.anomalyScore = anomalyScore;
            return this;
        }

        public Builder cutoff(double cutoff) {
            this.cutoff = cutoff;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public IsolationForestDetection build() {
            Objects.requireNonNull(metricType, "metricType must not be null");
            return new IsolationForestDetection(this);
        }
    }
}
