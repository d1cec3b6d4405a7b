package com.fleetsentinel.core.detection;

import com.fleetsentinel.core.config.StatisticalSettings;
import com.fleetsentinel.core.correlation.MetricCorrelator;
import com.fleetsentinel.core.model.DetectionMethod;
import com.fleetsentinel.core.stats.WindowStatistics;

/**
 * Z-score detection with a threshold that widens on trending windows.
 *
 * <p>
 * The trend strength {@code r} is the absolute Pearson correlation between
 * sample position and value. A steadily growing series (a container warming
 * up, a cache filling) has a large spread around its mean without anything
 * being wrong, so when {@code r >= }{@value #TREND_CORRELATION_THRESHOLD} the
 * threshold becomes {@code threshold * (1 + r)}. Windows without a clear
 * trend use the plain threshold.
 * </p>
 *
 * @since 1.0.0
 */
public class AdaptiveDetector extends StatisticalDetector {

    /** Minimum |r| for a window to count as trending. */
    public static final double TREND_CORRELATION_THRESHOLD = 0.7;

    public AdaptiveDetector(StatisticalSettings settings) {
        super(settings);
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.ADAPTIVE;
    }

    @Override
    protected double effectiveThreshold(double[] window, double configured) {
        double r = Math.abs(trendStrength(window));
        return r >= TREND_CORRELATION_THRESHOLD ? configured * (1 + r) : configured;
    }

    @Override
    protected boolean crosses(double value, double score, WindowStatistics stats, double threshold) {
        return Math.abs(score) > threshold;
    }

    /**
     * @param window window values, oldest first
     * @return Pearson correlation between position and value, 0 if undefined
     */
    static double trendStrength(double[] window) {
        double[] positions = new double[window.length];
        for (int i = 0; i < window.length; i++) {
            positions[i] = i;
        }
        return MetricCorrelator.pearsonCorrelation(positions, window);
    }
}
