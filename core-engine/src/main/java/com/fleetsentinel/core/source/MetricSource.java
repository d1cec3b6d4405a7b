package com.fleetsentinel.core.source;

import com.fleetsentinel.core.model.MetricSample;
import com.fleetsentinel.core.model.MetricType;

import java.time.Instant;
import java.util.List;

/**
 * Read access to stored container metrics.
 *
 * <p>
 * The engine never writes metrics. Implementations wrap whatever time-series
 * store the deployment uses.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface MetricSource {

    /**
     * Read the samples of one container metric in {@code [from, to]}.
     *
     * @param containerId container to read
     * @param metricType  metric to read
     * @param from        inclusive lower bound
     * @param to          inclusive upper bound
     * @return samples in ascending time order; empty if none are stored
     * @throws MetricReadException if the store cannot be read
     */
    List<MetricSample> read(String containerId, MetricType metricType, Instant from, Instant to)
            throws MetricReadException;
}
