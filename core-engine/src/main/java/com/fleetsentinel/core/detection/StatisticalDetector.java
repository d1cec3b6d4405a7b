package com.fleetsentinel.core.detection;

import com.fleetsentinel.core.config.StatisticalSettings;
import com.fleetsentinel.core.model.DetectionMethod;
import com.fleetsentinel.core.model.MetricSample;
import com.fleetsentinel.core.model.MetricType;
import com.fleetsentinel.core.model.StatisticalDetection;
import com.fleetsentinel.core.stats.WindowStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for the window-statistics detectors.
 *
 * <p>
 * The last sample of the series is the value under test. Its baseline is the
 * up-to {@code windowSize} samples immediately before it, so the current
 * value never influences its own evaluation. Non-finite window values are
 * dropped; if fewer than {@code minSamples} remain, or the current value
 * itself is not finite, there is no detection.
 * </p>
 *
 * <p>
 * Subclasses only decide the effective threshold and whether a value
 * crosses it. Instances are stateless and safe to share between threads.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class StatisticalDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalDetector.class);

    private final double threshold;
    private final int windowSize;
    private final int minSamples;

    /**
     * @param settings validated statistical settings
     * @throws NullPointerException if {@code settings} is {@code null}
     */
    protected StatisticalDetector(StatisticalSettings settings) {
        Objects.requireNonNull(settings, "StatisticalSettings must not be null");
        this.threshold = settings.getThreshold();
        this.windowSize = settings.getWindowSize();
        this.minSamples = settings.getMinSamples();
    }

    /**
     * Evaluate the most recent sample of a series against its trailing window.
     *
     * @param containerId   container the series belongs to
     * @param containerName display name; the id is used when {@code null}
     * @param metricType    metric of the series
     * @param samples       samples in ascending time order
     * @return the detection, or empty when there is not enough usable data
     */
    public Optional<StatisticalDetection> evaluate(String containerId, String containerName,
                                                   MetricType metricType, List<MetricSample> samples) {
        Objects.requireNonNull(containerId, "containerId must not be null");
        Objects.requireNonNull(metricType, "metricType must not be null");
        if (samples == null || samples.size() < 2) {
            LOG.debug("Container [{}] {}: no window to evaluate against", containerId, metricType);
            return Optional.empty();
        }

        MetricSample current = samples.get(samples.size() - 1);
        if (!current.isFinite()) {
            LOG.debug("Container [{}] {}: current value {} is not finite, skipping",
                    containerId, metricType, current.getValue());
            return Optional.empty();
        }

        double[] window = windowValues(samples);
        WindowStatistics stats = WindowStatistics.of(window);
        if (stats.getCount() < minSamples) {
            LOG.debug("Container [{}] {}: {} usable sample(s), need {}",
                    containerId, metricType, stats.getCount(), minSamples);
            return Optional.empty();
        }

        double value = current.getValue();
        double score = stats.deviationScore(value);
        double effectiveThreshold = effectiveThreshold(window, threshold);
        boolean anomalous = crosses(value, score, stats, effectiveThreshold);

        if (anomalous) {
            LOG.debug("Container [{}] {} flagged by {}: value={} mean={} stdDev={} score={} threshold={}",
                    containerId, metricType, getMethod(), value, stats.getMean(), stats.getStdDev(),
                    score, effectiveThreshold);
        }

        return Optional.of(StatisticalDetection.builder()
                .containerId(containerId)
                .containerName(containerName)
                .metricType(metricType)
                .currentValue(value)
                .mean(stats.getMean())
                .stdDev(stats.getStdDev())
                .zScore(score)
                .anomalous(anomalous)
                .threshold(effectiveThreshold)
                .sampleCount(stats.getCount())
                .timestamp(current.getTimestamp())
                .method(getMethod())
                .build());
    }

    /**
     * @return the method this detector implements
     */
    public abstract DetectionMethod getMethod();

    /**
     * Threshold actually applied to the current window. Defaults to the
     * configured one.
     *
     * @param window     finite and non-finite window values, oldest first
     * @param configured configured threshold
     * @return effective threshold
     */
    protected double effectiveThreshold(double[] window, double configured) {
        return configured;
    }

    /**
     * @param value     value under test
     * @param score     standardised deviation of {@code value}
     * @param stats     window statistics
     * @param threshold effective threshold
     * @return {@code true} if the value is anomalous
     */
    protected abstract boolean crosses(double value, double score, WindowStatistics stats, double threshold);

    public double getThreshold() {
        return threshold;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getMinSamples() {
        return minSamples;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private double[] windowValues(List<MetricSample> samples) {
        int end = samples.size() - 1;
        int start = Math.max(0, end - windowSize);
        double[] window = new double[end - start];
        for (int i = start; i < end; i++) {
            window[i - start] = samples.get(i).getValue();
        }
        return window;
    }
}
