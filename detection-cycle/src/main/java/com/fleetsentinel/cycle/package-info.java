/**
 * Detection cycle across a container fleet.
 *
 * <p>
 * {@link com.fleetsentinel.cycle.AnomalyEngine} wires the core detectors,
 * cooldown and incident grouper into a
 * {@link com.fleetsentinel.cycle.DetectionCycle}, records
 * {@link com.fleetsentinel.cycle.CycleMetrics} and returns a
 * {@link com.fleetsentinel.cycle.CycleReport} that
 * {@link com.fleetsentinel.cycle.CycleReportJson} can export.
 * </p>
 *
 * @since 1.0.0
 */
package com.fleetsentinel.cycle;
