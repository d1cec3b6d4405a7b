package com.fleetsentinel.core.detection;

import com.fleetsentinel.core.config.StatisticalSettings;
import com.fleetsentinel.core.model.DetectionMethod;
import com.fleetsentinel.core.stats.WindowStatistics;

/**
 * Flags a value whose absolute z-score exceeds the threshold.
 *
 * @since 1.0.0
 */
public class ZScoreDetector extends StatisticalDetector {

    public ZScoreDetector(StatisticalSettings settings) {
        super(settings);
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.ZSCORE;
    }

    @Override
    protected boolean crosses(double value, double score, WindowStatistics stats, double threshold) {
        return Math.abs(score) > threshold;
    }
}
