package com.fleetsentinel.core.detection;

import com.fleetsentinel.core.config.StatisticalSettings;
import com.fleetsentinel.core.model.DetectionMethod;
import com.fleetsentinel.core.stats.WindowStatistics;

/**
 * Flags a value outside the band {@code mean ± threshold·stdDev}.
 *
 * <p>
 * A value exactly on a band edge is inside the band. With a flat window the
 * band collapses to the mean and any other value lies outside it.
 * </p>
 *
 * @since 1.0.0
 */
public class BollingerBandDetector extends StatisticalDetector {

    public BollingerBandDetector(StatisticalSettings settings) {
        super(settings);
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.BOLLINGER;
    }

    @Override
    protected boolean crosses(double value, double score, WindowStatistics stats, double threshold) {
        double width = threshold * stats.getStdDev();
        double upper = stats.getMean() + width;
        double lower = stats.getMean() - width;
        return value > upper || value < lower;
    }
}
