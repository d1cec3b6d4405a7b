package com.fleetsentinel.core.model;

/**
 * Bucketed strength of a correlation coefficient.
 *
 * @since 1.0.0
 */
public enum CorrelationStrength {
    VERY_STRONG,
    STRONG,
    MODERATE,
    WEAK
}
