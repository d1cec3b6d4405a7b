package com.fleetsentinel.cycle;

import com.fleetsentinel.core.model.DetectionMethod;
import com.fleetsentinel.core.model.InsightSeverity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Micrometer meters for the detection cycle.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code fleet_sentinel.cycles} - completed cycles</li>
 *   <li>{@code fleet_sentinel.detections} - detector verdicts, tagged by {@code method}</li>
 *   <li>{@code fleet_sentinel.anomalies} - anomalous verdicts, tagged by {@code method}</li>
 *   <li>{@code fleet_sentinel.flags.suppressed} - anomalies held back by the cooldown</li>
 *   <li>{@code fleet_sentinel.insights} - insights created, tagged by {@code severity}</li>
 *   <li>{@code fleet_sentinel.incidents.created} - incidents opened</li>
 *   <li>{@code fleet_sentinel.containers.failed} - container evaluations that threw</li>
 *   <li>{@code fleet_sentinel.cycle.duration} - wall time of a cycle</li>
 * </ul>
 *
 * <p>
 * The registry, and therefore the export format, is chosen by the caller.
 * </p>
 *
 * @since 1.0.0
 */
public class CycleMetrics {

    static final String PREFIX = "fleet_sentinel.";

    private final MeterRegistry registry;
    private final Counter cycles;
    private final Counter suppressed;
    private final Counter incidentsCreated;
    private final Counter failedContainers;
    private final Timer cycleDuration;

    public CycleMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");
        this.cycles = Counter.builder(PREFIX + "cycles")
                .description("Completed detection cycles")
                .register(registry);
        this.suppressed = Counter.builder(PREFIX + "flags.suppressed")
                .description("Anomalies held back by the cooldown")
                .register(registry);
        this.incidentsCreated = Counter.builder(PREFIX + "incidents.created")
                .description("Incidents opened")
                .register(registry);
        this.failedContainers = Counter.builder(PREFIX + "containers.failed")
                .description("Container evaluations that failed")
                .register(registry);
        this.cycleDuration = Timer.builder(PREFIX + "cycle.duration")
                .description("Wall time of a detection cycle")
                .register(registry);
    }

    public void recordDetection(DetectionMethod method, boolean anomalous) {
        Counter.builder(PREFIX + "detections")
                .tag("method", method.getWireName())
                .register(registry)
                .increment();
        if (anomalous) {
            Counter.builder(PREFIX + "anomalies")
                    .tag("method", method.getWireName())
                    .register(registry)
                    .increment();
        }
    }

    public void recordInsight(InsightSeverity severity) {
        Counter.builder(PREFIX + "insights")
                .tag("severity", severity.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordSuppressed(int count) {
        if (count > 0) {
            suppressed.increment(count);
        }
    }

    public void recordIncidentsCreated(int count) {
        if (count > 0) {
            incidentsCreated.increment(count);
        }
    }

    public void recordFailedContainer() {
        failedContainers.increment();
    }

    public void recordCycle(Duration duration) {
        cycles.increment();
        cycleDuration.record(duration);
    }
}
