package com.fleetsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Detection produced by one of the window-statistics strategies
 * ({@code zscore}, {@code bollinger}, {@code adaptive}).
 *
 * <p>
 * The deviation score is the z-score of the current value against the
 * trailing window. It is ±infinite only when the window standard deviation
 * is exactly zero and the value differs from the mean.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code containerId}, {@code metricType},
 * {@code timestamp} and {@code method} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class StatisticalDetection extends AnomalyDetection {

    /** |z| above which an anomaly is reported as critical. */
    public static final double CRITICAL_Z_SCORE = 4.0;

    private final double mean;
    private final double stdDev;
    private final int sampleCount;

    private StatisticalDetection(Builder b) {
        super(b.containerId, b.containerName, b.metricType, b.currentValue, b.zScore,
                b.anomalous, b.threshold, b.timestamp, b.method);
        if (!b.method.isStatistical()) {
            throw new IllegalArgumentException("Not a statistical method: " + b.method);
        }
        this.mean = b.mean;
        this.stdDev = b.stdDev;
        this.sampleCount = b.sampleCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public double getMean() {
        return mean;
    }

    @Override
    public double getStdDev() {
        return stdDev;
    }

    /**
     * @return same as {@link #getDeviationScore()}
     */
    public double getZScore() {
        return getDeviationScore();
    }

    /**
     * @return number of finite window values behind the statistics
     */
    public int getSampleCount() {
        return sampleCount;
    }

    @Override
    public InsightSeverity severityHint() {
        return Math.abs(getDeviationScore()) > CRITICAL_Z_SCORE
                ? InsightSeverity.CRITICAL
                : InsightSeverity.WARNING;
    }

    /**
     * Fluent builder for {@link StatisticalDetection}.
     */
    public static class Builder {
        private String containerId;
        private String containerName;
        private MetricType metricType;
        private double currentValue;
        private double mean;
        private double stdDev;
        private double zScore;
        private boolean anomalous;
        private double threshold;
        private int sampleCount;
        private Instant timestamp;
        private DetectionMethod method = DetectionMethod.ZSCORE;

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

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder mean(double mean) {
            this.mean = mean;
            return this;
        }

        public Builder stdDev(double stdDev) {
            this.stdDev = stdDev;
            return this;
        }

        public Builder zScore(double zScore) {
            this.zScore = zScore;
            return this;
        }

        public Builder anomalous(boolean anomalous) {
            this.anomalous = anomalous;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder sampleCount(int sampleCount) {
            this.sampleCount = sampleCount;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder method(DetectionMethod method) {
            this.method = method;
            return this;
        }

        /**
         * @return a new {@link StatisticalDetection}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if the method is not statistical
         */
        public StatisticalDetection build() {
            Objects.requireNonNull(method, "method must not be null");
            return new StatisticalDetection(this);
        }
    }
}
