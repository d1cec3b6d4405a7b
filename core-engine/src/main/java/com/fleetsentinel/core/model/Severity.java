package com.fleetsentinel.core.model;

/**
 * Severity bucket of a correlated anomaly, derived from its composite score.
 *
 * @since 1.0.0
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
