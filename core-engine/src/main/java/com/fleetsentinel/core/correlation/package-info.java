/**
 * Cross-metric correlation: Pearson coefficient, composite score, failure
 * pattern ladder and severity bucketing.
 *
 * <p>
 * All functions live in
 * {@link com.fleetsentinel.core.correlation.MetricCorrelator} and hold no
 * state.
 * </p>
 *
 * @since 1.0.0
 */
package com.fleetsentinel.core.correlation;
