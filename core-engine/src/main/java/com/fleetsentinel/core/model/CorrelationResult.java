package com.fleetsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlated view of one container's per-metric deviation scores for one
 * detection cycle.
 *
 * <p>
 * Immutable. The composite score, pattern and severity are deterministic
 * functions of {@link #getMetricScores()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationResult {

    private final String containerId;
    private final Map<MetricType, Double> metricScores;
    private final double compositeScore;
    private final FailurePattern pattern;
    private final Severity severity;
    private final double correlationCoefficient;
    private final CorrelationStrength correlationStrength;

    /**
     * @param containerId            owning container
     * @param metricScores           deviation score per metric (copied)
     * @param compositeScore         RMS of the scores
     * @param pattern                identified pattern, or {@code null}
     * @param severity               severity bucket of the composite score
     * @param correlationCoefficient CPU/memory Pearson coefficient
     * @param correlationStrength    bucket of the coefficient
     */
    public CorrelationResult(String containerId,
            Map<MetricType, Double> metricScores,
            double compositeScore,
            FailurePattern pattern,
            Severity severity,
            double correlationCoefficient,
            CorrelationStrength correlationStrength) {
        this.containerId = Objects.requireNonNull(containerId, "containerId must not be null");
        Objects.requireNonNull(metricScores, "metricScores must not be null");
        this.metricScores = metricScores.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(metricScores));
        this.compositeScore = compositeScore;
        this.pattern = pattern;
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.correlationCoefficient = correlationCoefficient;
        this.correlationStrength = Objects.requireNonNull(correlationStrength,
                "correlationStrength must not be null");
    }

    public String getContainerId() {
        return containerId;
    }

    public Map<MetricType, Double> getMetricScores() {
        return metricScores;
    }

    public double getCompositeScore() {
        return compositeScore;
    }

    @JsonIgnore
    public Optional<FailurePattern> getPattern() {
        return Optional.ofNullable(pattern);
    }

    /**
     * @return the pattern label, or {@code null} when no pattern matched
     */
    @JsonProperty("pattern")
    public String getPatternLabel() {
        return pattern != null ? pattern.getLabel() : null;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getCorrelationCoefficient() {
        return correlationCoefficient;
    }

    public CorrelationStrength getCorrelationStrength() {
        return correlationStrength;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CorrelationResult that))
            return false;
        return Double.compare(compositeScore, that.compositeScore) == 0
                && Double.compare(correlationCoefficient, that.correlationCoefficient) == 0
                && containerId.equals(that.containerId)
                && metricScores.equals(that.metricScores)
                && pattern == that.pattern
                && severity == that.severity
                && correlationStrength == that.correlationStrength;
    }

    @Override
    public int hashCode() {
        return Objects.hash(containerId, metricScores, compositeScore, pattern, severity,
                correlationCoefficient, correlationStrength);
    }

    @Override
    public String toString() {
        return "CorrelationResult{" +
                "containerId='" + containerId + '\'' +
                ", metricScores=" + metricScores +
                ", compositeScore=" + compositeScore +
                ", pattern=" + pattern +
                ", severity=" + severity +
                ", correlationStrength=" + correlationStrength +
                '}';
    }
}
