package com.fleetsentinel.core.model;

/**
 * Lifecycle state of an {@link Incident}. Resolution is always an explicit
 * caller action.
 *
 * @since 1.0.0
 */
public enum IncidentStatus {
    ACTIVE,
    RESOLVED
}
