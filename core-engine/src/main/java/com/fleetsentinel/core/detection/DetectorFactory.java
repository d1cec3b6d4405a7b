package com.fleetsentinel.core.detection;

import com.fleetsentinel.core.config.StatisticalSettings;
import com.fleetsentinel.core.model.DetectionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Factory that creates {@link StatisticalDetector} instances from a
 * {@link DetectionMethod}.
 *
 * <p>
 * This is the single point of extension when adding a statistical method:
 * register it here and create the corresponding detector.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
    }

    /**
     * Create the detector for the method named in {@code settings}.
     *
     * @param settings validated statistical settings
     * @return detector for the configured method
     * @throws IllegalArgumentException if the method is unknown or not statistical
     */
    public static StatisticalDetector create(StatisticalSettings settings) {
        Objects.requireNonNull(settings, "StatisticalSettings must not be null");
        return create(settings.detectionMethod(), settings);
    }

    /**
     * Create a detector for the given method.
     *
     * @param method   detection method; must not be {@code null}
     * @param settings threshold and window settings; must not be {@code null}
     * @return an appropriate {@link StatisticalDetector}
     * @throws IllegalArgumentException if {@code method} is
     *                                  {@link DetectionMethod#ISOLATION_FOREST}
     */
    public static StatisticalDetector create(DetectionMethod method, StatisticalSettings settings) {
        Objects.requireNonNull(method, "DetectionMethod must not be null");
        Objects.requireNonNull(settings, "StatisticalSettings must not be null");

        StatisticalDetector detector = switch (method) {
            case ZSCORE -> new ZScoreDetector(settings);
            case BOLLINGER -> new BollingerBandDetector(settings);
            case ADAPTIVE -> new AdaptiveDetector(settings);
            case ISOLATION_FOREST -> throw new IllegalArgumentException(
                    "'" + method + "' is not a statistical method. Supported methods: zscore, bollinger, adaptive");
        };
        LOG.info("Created {} detector (threshold={}, windowSize={}, minSamples={})",
                method, detector.getThreshold(), detector.getWindowSize(), detector.getMinSamples());
        return detector;
    }
}
