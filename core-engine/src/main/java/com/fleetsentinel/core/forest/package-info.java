/**
 * Isolation Forest anomaly detection on paired CPU and memory readings.
 *
 * <p>
 * {@link com.fleetsentinel.core.forest.IsolationForest} is the algorithm,
 * {@link com.fleetsentinel.core.forest.IsolationForestDetector} owns the
 * per-container model lifecycle on top of a
 * {@link com.fleetsentinel.core.forest.ModelCache}.
 * </p>
 *
 * @since 1.0.0
 */
package com.fleetsentinel.core.forest;
