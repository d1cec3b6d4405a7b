package com.fleetsentinel.core.model;

/**
 * Confidence that the insights grouped in an {@link Incident} share one
 * cause.
 *
 * @since 1.0.0
 */
public enum ConfidenceLevel {

    LOW,
    MEDIUM,
    HIGH;

    /**
     * @return the next level up, saturating at {@link #HIGH}
     */
    public ConfidenceLevel raise() {
        return this == LOW ? MEDIUM : HIGH;
    }

    /**
     * @param other level to compare with; {@code null} counts as lowest
     * @return the higher of the two levels
     */
    public ConfidenceLevel max(ConfidenceLevel other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
