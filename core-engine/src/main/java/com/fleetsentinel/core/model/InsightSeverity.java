package com.fleetsentinel.core.model;

/**
 * Severity of an {@link Insight} or {@link Incident}, as shown to operators.
 *
 * @since 1.0.0
 */
public enum InsightSeverity {

    INFO(0),
    WARNING(1),
    CRITICAL(2);

    private final int rank;

    InsightSeverity(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    /**
     * @param other severity to compare with; {@code null} counts as lowest
     * @return the more severe of {@code this} and {@code other}
     */
    public InsightSeverity max(InsightSeverity other) {
        return other != null && other.rank > rank ? other : this;
    }
}
