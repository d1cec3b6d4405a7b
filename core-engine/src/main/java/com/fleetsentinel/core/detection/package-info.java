/**
 * Window-statistics anomaly detectors.
 *
 * <p>
 * Three strategies share the evaluation template in
 * {@link com.fleetsentinel.core.detection.StatisticalDetector}:
 * </p>
 * <ul>
 * <li>{@link com.fleetsentinel.core.detection.ZScoreDetector}: |z| above the
 * threshold</li>
 * <li>{@link com.fleetsentinel.core.detection.BollingerBandDetector}: outside
 * {@code mean ± threshold·σ}</li>
 * <li>{@link com.fleetsentinel.core.detection.AdaptiveDetector}: z-score with a
 * threshold widened on trending windows</li>
 * </ul>
 *
 * <p>
 * Detectors are created through
 * {@link com.fleetsentinel.core.detection.DetectorFactory}. Repeated flags are
 * rate-limited by {@link com.fleetsentinel.core.detection.CooldownTracker}.
 * </p>
 *
 * @since 1.0.0
 */
package com.fleetsentinel.core.detection;
