package com.fleetsentinel.core.source;

import com.fleetsentinel.core.model.MetricSample;
import com.fleetsentinel.core.model.MetricType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds every read of a delegate {@link MetricSource} by a timeout.
 *
 * <p>
 * Reads run on the supplied executor. A read that does not finish in time is
 * cancelled and reported as an empty series, which callers already treat as
 * insufficient data. An interrupted caller gets an empty series too, with its
 * interrupt flag restored. Any failure of the delegate surfaces as a
 * {@link MetricReadException}.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeLimitedMetricSource implements MetricSource {

    private static final Logger LOG = LoggerFactory.getLogger(TimeLimitedMetricSource.class);

    private final MetricSource delegate;
    private final ExecutorService executor;
    private final Duration timeout;

    /**
     * @param delegate source performing the actual reads
     * @param executor executor that runs the reads; owned by the caller
     * @param timeout  maximum time a read may take
     */
    public TimeLimitedMetricSource(MetricSource delegate, ExecutorService executor, Duration timeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
    }

    @Override
    public List<MetricSample> read(String containerId, MetricType metricType, Instant from, Instant to)
            throws MetricReadException {
        Future<List<MetricSample>> future;
        try {
            future = executor.submit(() -> delegate.read(containerId, metricType, from, to));
        } catch (RejectedExecutionException e) {
            throw new MetricReadException("Read of " + metricType + " for container "
                    + containerId + " was rejected", e);
        }

        try {
            List<MetricSample> samples = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return samples != null ? samples : List.of();
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Read of {} for container [{}] timed out after {} ms, treating as no data",
                    metricType, containerId, timeout.toMillis());
            return List.of();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            LOG.debug("Read of {} for container [{}] interrupted", metricType, containerId);
            return List.of();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof MetricReadException that) {
                throw that;
            }
            throw new MetricReadException("Read of " + metricType + " for container "
                    + containerId + " failed: " + cause, cause);
        }
    }
}
