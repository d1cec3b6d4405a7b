package com.fleetsentinel.core.config;

import java.time.Duration;
import java.util.List;

/**
 * Settings for grouping insights into incidents.
 *
 * @since 1.0.0
 */
public class IncidentSettings {

    /** Minimum similarity for an insight to join an active incident. */
    private double similarityThreshold = 0.3;

    /** How long after its last activity an incident still attracts insights. */
    private long correlationWindowMinutes = 30;

    void validate(List<String> errors) {
        if (!(similarityThreshold > 0 && similarityThreshold <= 1)) {
            errors.add("incidents.similarityThreshold must be in (0, 1], got: " + similarityThreshold);
        }
        if (correlationWindowMinutes < 1) {
            errors.add("incidents.correlationWindowMinutes must be >= 1, got: " + correlationWindowMinutes);
        }
    }

    public Duration correlationWindow() {
        return Duration.ofMinutes(correlationWindowMinutes);
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public long getCorrelationWindowMinutes() {
        return correlationWindowMinutes;
    }

    public void setCorrelationWindowMinutes(long correlationWindowMinutes) {
        this.correlationWindowMinutes = correlationWindowMinutes;
    }

    @Override
    public String toString() {
        return "IncidentSettings{" +
                "similarityThreshold=" + similarityThreshold +
                ", correlationWindowMinutes=" + correlationWindowMinutes +
                '}';
    }
}
