/**
 * Domain model classes for Fleet Sentinel.
 *
 * <p>
 * This package contains the values shared between the detectors, the
 * correlator, the incident grouper and the detection cycle:
 * </p>
 * <ul>
 * <li>{@link com.fleetsentinel.core.model.MetricSample}: one timestamped
 * reading of one container metric</li>
 * <li>{@link com.fleetsentinel.core.model.AnomalyDetection}: a detector's
 * verdict, either a
 * {@link com.fleetsentinel.core.model.StatisticalDetection} or an
 * {@link com.fleetsentinel.core.model.IsolationForestDetection}</li>
 * <li>{@link com.fleetsentinel.core.model.CorrelationResult}: the cross-metric
 * view of one container</li>
 * <li>{@link com.fleetsentinel.core.model.Insight} and
 * {@link com.fleetsentinel.core.model.Incident}: what operators see</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.fleetsentinel.core.model;
