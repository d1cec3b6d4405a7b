package com.fleetsentinel.cycle;

import com.fleetsentinel.core.model.MetricSample;
import com.fleetsentinel.core.model.MetricType;
import com.fleetsentinel.core.source.MetricReadException;
import com.fleetsentinel.core.source.MetricSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * In-memory metric store for cycle tests: one sample per minute, CPU and
 * memory sharing timestamps.
 */
final class FleetFixture implements MetricSource {

    static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    static final int SAMPLES = 60;

    private final Map<String, Map<MetricType, List<MetricSample>>> series = new HashMap<>();
    private final Set<String> broken = new HashSet<>();
    private final Set<String> unreadable = new HashSet<>();

    /**
     * Gaussian CPU around 20 (sd 2) and memory around 30 (sd 3), ending in
     * the given latest values.
     */
    FleetFixture container(String containerId, long seed, double latestCpu, double latestMemory) {
        Random random = new Random(seed);
        double[] cpu = new double[SAMPLES];
        double[] memory = new double[SAMPLES];
        for (int i = 0; i < SAMPLES - 1; i++) {
            cpu[i] = 20 + 2 * random.nextGaussian();
            memory[i] = 30 + 3 * random.nextGaussian();
        }
        cpu[SAMPLES - 1] = latestCpu;
        memory[SAMPLES - 1] = latestMemory;

        Map<MetricType, List<MetricSample>> byMetric = new EnumMap<>(MetricType.class);
        byMetric.put(MetricType.CPU, samples(containerId, MetricType.CPU, cpu));
        byMetric.put(MetricType.MEMORY, samples(containerId, MetricType.MEMORY, memory));
        series.put(containerId, byMetric);
        return this;
    }

    /** Reads for this container throw an unchecked exception. */
    FleetFixture broken(String containerId) {
        broken.add(containerId);
        return this;
    }

    /** Reads for this container fail with a read exception. */
    FleetFixture unreadable(String containerId) {
        unreadable.add(containerId);
        return this;
    }

    @Override
    public List<MetricSample> read(String containerId, MetricType metricType, Instant from, Instant to)
            throws MetricReadException {
        if (broken.contains(containerId)) {
            throw new IllegalStateException("corrupt series for " + containerId);
        }
        if (unreadable.contains(containerId)) {
            throw new MetricReadException("store unavailable");
        }
        Map<MetricType, List<MetricSample>> byMetric = series.get(containerId);
        if (byMetric == null) {
            return List.of();
        }
        return byMetric.getOrDefault(metricType, List.of());
    }

    private static List<MetricSample> samples(String containerId, MetricType metric, double[] values) {
        List<MetricSample> samples = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            Instant ts = NOW.minus(Duration.ofMinutes(values.length - 1 - i));
            samples.add(new MetricSample(containerId, metric, values[i], ts));
        }
        return samples;
    }
}
