package com.fleetsentinel.core.correlation;

import com.fleetsentinel.core.model.CorrelationResult;
import com.fleetsentinel.core.model.CorrelationStrength;
import com.fleetsentinel.core.model.FailurePattern;
import com.fleetsentinel.core.model.MetricType;
import com.fleetsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Combines a container's per-metric deviation scores into one correlated
 * signal.
 *
 * <p>
 * Every function here is stateless and total: undersized or degenerate input
 * degrades to a neutral value (0 correlation, 0 composite score, no pattern,
 * {@link CorrelationStrength#WEAK}, {@link Severity#LOW}) instead of
 * throwing. The class is safe to call from any number of threads.
 * </p>
 *
 * <h3>Pattern ladder</h3>
 * <p>
 * A score is <i>elevated</i> when it is at or above
 * {@value #ELEVATED_SCORE_THRESHOLD}. Memory counts as elevated when either
 * {@code memory} or {@code memory_bytes} is.
 * </p>
 * <ol>
 * <li>CPU and memory elevated → {@link FailurePattern#RESOURCE_EXHAUSTION}</li>
 * <li>memory elevated only → {@link FailurePattern#MEMORY_LEAK}</li>
 * <li>CPU elevated only → {@link FailurePattern#CPU_SPIKE}</li>
 * <li>otherwise no pattern</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class MetricCorrelator {

    private static final Logger LOG = LoggerFactory.getLogger(MetricCorrelator.class);

    /** Minimum paired points for a meaningful correlation coefficient. */
    public static final int MIN_CORRELATION_POINTS = 3;

    /** Score at or above which a metric counts as elevated for pattern matching. */
    public static final double ELEVATED_SCORE_THRESHOLD = 2.5;

    public static final double VERY_STRONG_CORRELATION = 0.9;
    public static final double STRONG_CORRELATION = 0.7;
    public static final double MODERATE_CORRELATION = 0.4;

    public static final double CRITICAL_COMPOSITE_SCORE = 5.0;
    public static final double HIGH_COMPOSITE_SCORE = 3.5;
    public static final double MEDIUM_COMPOSITE_SCORE = 2.0;

    private MetricCorrelator() {
    }

    // ---------------------------------------------------------------
    // Correlation coefficient
    // ---------------------------------------------------------------

    /**
     * Pearson correlation coefficient of two equal-length series.
     *
     * <p>
     * Pairs where either member is non-finite are skipped.
     * </p>
     *
     * @param x first series
     * @param y second series
     * @return coefficient in [-1, 1]; 0 when the lengths differ, fewer than
     *         {@value #MIN_CORRELATION_POINTS} finite pairs remain, or either
     *         series has zero variance
     */
    public static double pearsonCorrelation(double[] x, double[] y) {
        if (x == null || y == null || x.length != y.length) {
            return 0.0;
        }

        int n = 0;
        double sumX = 0;
        double sumY = 0;
        for (int i = 0; i < x.length; i++) {
            if (Double.isFinite(x[i]) && Double.isFinite(y[i])) {
                sumX += x[i];
                sumY += y[i];
                n++;
            }
        }
        if (n < MIN_CORRELATION_POINTS) {
            return 0.0;
        }

        double meanX = sumX / n;
        double meanY = sumY / n;
        double covariance = 0;
        double varianceX = 0;
        double varianceY = 0;
        for (int i = 0; i < x.length; i++) {
            if (Double.isFinite(x[i]) && Double.isFinite(y[i])) {
                double dx = x[i] - meanX;
                double dy = y[i] - meanY;
                covariance += dx * dy;
                varianceX += dx * dx;
                varianceY += dy * dy;
            }
        }

        double denominator = Math.sqrt(varianceX * varianceY);
        if (denominator == 0 || !Double.isFinite(denominator)) {
            return 0.0;
        }
        double r = covariance / denominator;
        // clamp rounding drift
        return Math.max(-1.0, Math.min(1.0, r));
    }

    // ---------------------------------------------------------------
    // Composite score
    // ---------------------------------------------------------------

    /**
     * Root-mean-square of the supplied deviation scores, rounded to two
     * decimals.
     *
     * <p>
     * NaN entries are ignored. A single score is returned unchanged; an
     * infinite score makes the composite infinite.
     * </p>
     *
     * @param scores per-metric deviation scores
     * @return composite score; 0 for empty input
     */
    public static double compositeScore(Collection<Double> scores) {
        if (scores == null || scores.isEmpty()) {
            return 0.0;
        }

        int n = 0;
        double last = 0;
        double sumSquares = 0;
        for (Double score : scores) {
            if (score == null || score.isNaN()) {
                continue;
            }
            last = score;
            sumSquares += score * score;
            n++;
        }

        if (n == 0) {
            return 0.0;
        }
        if (n == 1) {
            return last;
        }

        double rms = Math.sqrt(sumSquares / n);
        if (!Double.isFinite(rms)) {
            return rms;
        }
        return Math.round(rms * 100.0) / 100.0;
    }

    // ---------------------------------------------------------------
    // Pattern identification
    // ---------------------------------------------------------------

    /**
     * Match the (CPU, memory) score pair against the pattern ladder.
     *
     * @param cpuScore    CPU deviation score, or {@code null} if absent
     * @param memoryScore memory deviation score, or {@code null} if absent
     * @return the matching pattern, or empty when neither metric is elevated
     */
    public static Optional<FailurePattern> identifyPattern(Double cpuScore, Double memoryScore) {
        boolean cpuHigh = isElevated(cpuScore);
        boolean memoryHigh = isElevated(memoryScore);

        if (cpuHigh && memoryHigh) {
            return Optional.of(FailurePattern.RESOURCE_EXHAUSTION);
        }
        if (memoryHigh) {
            return Optional.of(FailurePattern.MEMORY_LEAK);
        }
        if (cpuHigh) {
            return Optional.of(FailurePattern.CPU_SPIKE);
        }
        return Optional.empty();
    }

    /**
     * Pattern identification over a per-metric score map. Memory is the
     * larger of the {@code memory} and {@code memory_bytes} scores.
     *
     * @param scores deviation score per metric
     * @return the matching pattern, or empty
     */
    public static Optional<FailurePattern> identifyPattern(Map<MetricType, Double> scores) {
        if (scores == null || scores.isEmpty()) {
            return Optional.empty();
        }
        Double memory = scores.get(MetricType.MEMORY);
        Double memoryBytes = scores.get(MetricType.MEMORY_BYTES);
        Double memoryScore;
        if (memory == null) {
            memoryScore = memoryBytes;
        } else if (memoryBytes == null) {
            memoryScore = memory;
        } else {
            memoryScore = Math.max(memory, memoryBytes);
        }
        return identifyPattern(scores.get(MetricType.CPU), memoryScore);
    }

    private static boolean isElevated(Double score) {
        return score != null && !score.isNaN() && score >= ELEVATED_SCORE_THRESHOLD;
    }

    // ---------------------------------------------------------------
    // Bucketing
    // ---------------------------------------------------------------

    /**
     * @param coefficient correlation coefficient
     * @return strength bucket of {@code |coefficient|}
     */
    public static CorrelationStrength correlationStrength(double coefficient) {
        double abs = Math.abs(coefficient);
        if (Double.isNaN(abs)) {
            return CorrelationStrength.WEAK;
        }
        if (abs >= VERY_STRONG_CORRELATION) {
            return CorrelationStrength.VERY_STRONG;
        }
        if (abs >= STRONG_CORRELATION) {
            return CorrelationStrength.STRONG;
        }
        if (abs >= MODERATE_CORRELATION) {
            return CorrelationStrength.MODERATE;
        }
        return CorrelationStrength.WEAK;
    }

    /**
     * @param compositeScore composite deviation score
     * @return severity bucket; boundaries are inclusive at the lower edge
     */
    public static Severity scoreSeverity(double compositeScore) {
        if (Double.isNaN(compositeScore)) {
            return Severity.LOW;
        }
        if (compositeScore >= CRITICAL_COMPOSITE_SCORE) {
            return Severity.CRITICAL;
        }
        if (compositeScore >= HIGH_COMPOSITE_SCORE) {
            return Severity.HIGH;
        }
        if (compositeScore >= MEDIUM_COMPOSITE_SCORE) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    // ---------------------------------------------------------------
    // Assembly
    // ---------------------------------------------------------------

    /**
     * Build the correlation result for one container and cycle.
     *
     * @param containerId            owning container; must not be {@code null}
     * @param scores                 deviation score per metric
     * @param correlationCoefficient CPU/memory coefficient for this cycle
     * @return correlation result
     */
    public static CorrelationResult correlate(String containerId,
            Map<MetricType, Double> scores,
            double correlationCoefficient) {
        Objects.requireNonNull(containerId, "containerId must not be null");
        Map<MetricType, Double> safeScores = scores != null ? scores : Map.of();

        double composite = compositeScore(safeScores.values());
        FailurePattern pattern = identifyPattern(safeScores).orElse(null);
        Severity severity = scoreSeverity(composite);
        double coefficient = Double.isFinite(correlationCoefficient) ? correlationCoefficient : 0.0;

        LOG.debug("Correlated container [{}]: composite={} pattern={} severity={}",
                containerId, composite, pattern, severity);

        return new CorrelationResult(containerId, safeScores, composite, pattern, severity,
                coefficient, correlationStrength(coefficient));
    }
}
