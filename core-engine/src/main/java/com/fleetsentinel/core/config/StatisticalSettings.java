package com.fleetsentinel.core.config;

import com.fleetsentinel.core.model.DetectionMethod;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Settings for the window-statistics detectors.
 *
 * <pre>
 * statistical:
 *   method: zscore        # zscore | bollinger | adaptive
 *   threshold: 3.0        # |z| limit or band multiplier
 *   windowSize: 30        # trailing samples forming the baseline
 *   minSamples: 10        # below this: no detection
 *   cooldownMinutes: 15   # per container/metric flag suppression
 * </pre>
 *
 * @since 1.0.0
 */
public class StatisticalSettings {

    private String method = DetectionMethod.ZSCORE.getWireName();
    private double threshold = 3.0;
    private int windowSize = 30;
    private int minSamples = 10;
    private long cooldownMinutes = 15;

    void validate(List<String> errors) {
        DetectionMethod resolved = null;
        try {
            resolved = detectionMethod();
        } catch (IllegalArgumentException e) {
            errors.add("statistical.method: " + e.getMessage());
        }
        if (resolved == DetectionMethod.ISOLATION_FOREST) {
            errors.add("statistical.method must be zscore, bollinger or adaptive; "
                    + "the Isolation Forest is configured under 'isolationForest'");
        }
        if (!(threshold > 0) || !Double.isFinite(threshold)) {
            errors.add("statistical.threshold must be > 0, got: " + threshold);
        }
        if (windowSize < 2) {
            errors.add("statistical.windowSize must be >= 2, got: " + windowSize);
        }
        if (minSamples < 2) {
            errors.add("statistical.minSamples must be >= 2, got: " + minSamples);
        }
        if (minSamples > windowSize) {
            errors.add("statistical.minSamples (" + minSamples
                    + ") must not exceed statistical.windowSize (" + windowSize + ")");
        }
        if (cooldownMinutes < 0) {
            errors.add("statistical.cooldownMinutes must be >= 0, got: " + cooldownMinutes);
        }
    }

    /**
     * @return the configured method as an enum
     * @throws IllegalArgumentException if the method name is unknown
     */
    public DetectionMethod detectionMethod() {
        return DetectionMethod.fromWireName(method);
    }

    public Duration cooldown() {
        return Duration.ofMinutes(cooldownMinutes);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method != null ? method.trim().toLowerCase(Locale.ROOT) : null;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public long getCooldownMinutes() {
        return cooldownMinutes;
    }

    public void setCooldownMinutes(long cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }

    @Override
    public String toString() {
        return "StatisticalSettings{" +
                "method='" + method + '\'' +
                ", threshold=" + threshold +
                ", windowSize=" + windowSize +
                ", minSamples=" + minSamples +
                ", cooldownMinutes=" + cooldownMinutes +
                '}';
    }
}
