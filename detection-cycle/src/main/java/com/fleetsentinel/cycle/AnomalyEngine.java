package com.fleetsentinel.cycle;

import com.fleetsentinel.core.config.CycleSettings;
import com.fleetsentinel.core.config.EngineConfig;
import com.fleetsentinel.core.config.EngineConfigLoader;
import com.fleetsentinel.core.detection.CooldownTracker;
import com.fleetsentinel.core.detection.DetectorFactory;
import com.fleetsentinel.core.detection.StatisticalDetector;
import com.fleetsentinel.core.forest.IsolationForestDetector;
import com.fleetsentinel.core.forest.ModelCache;
import com.fleetsentinel.core.incident.IncidentGrouper;
import com.fleetsentinel.core.source.MetricSource;
import com.fleetsentinel.core.source.TimeLimitedMetricSource;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Assembles the engine from an {@link EngineConfig} and runs detection
 * cycles.
 *
 * <h3>Threads</h3>
 * <p>
 * Two pools are owned here and shut down by {@link #close()}: a fixed pool
 * of {@code maxConcurrency} threads evaluating containers, and a separate
 * pool for metric reads so a container task waiting on its read never
 * starves the read of a thread.
 * </p>
 *
 * <h3>Usage</h3>
 * <pre>
 * try (AnomalyEngine engine = AnomalyEngine.create(EngineConfigLoader.load(), source, registry)) {
 *     CycleReport report = engine.runCycle(targets);
 * }
 * </pre>
 *
 * @since 1.0.0
 */
public class AnomalyEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyEngine.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final EngineConfig config;
    private final ExecutorService cyclePool;
    private final ExecutorService readPool;
    private final CooldownTracker cooldown;
    private final IsolationForestDetector forestDetector;
    private final IncidentGrouper grouper;
    private final DetectionCycle cycle;

    private AnomalyEngine(EngineConfig config, MetricSource source, MeterRegistry registry,
                          Clock clock, Supplier<Random> randomSupplier) {
        this.config = config;
        CycleSettings cycleSettings = config.getCycle();

        this.cyclePool = Executors.newFixedThreadPool(cycleSettings.getMaxConcurrency(),
                namedThreads("fleet-sentinel-cycle"));
        this.readPool = Executors.newCachedThreadPool(namedThreads("fleet-sentinel-read"));
        MetricSource timeLimited = new TimeLimitedMetricSource(source, readPool, cycleSettings.metricReadTimeout());

        StatisticalDetector statisticalDetector = DetectorFactory.create(config.getStatistical());
        this.forestDetector = config.getIsolationForest().isEnabled()
                ? new IsolationForestDetector(config.getIsolationForest(), timeLimited, new ModelCache(),
                clock, randomSupplier)
                : null;
        this.cooldown = new CooldownTracker(config.getStatistical().cooldown(), clock);
        Supplier<String> ids = () -> UUID.randomUUID().toString();
        this.grouper = new IncidentGrouper(config.getIncidents(), clock, ids);

        this.cycle = DetectionCycle.builder()
                .statisticalDetector(statisticalDetector)
                .forestDetector(forestDetector)
                .source(timeLimited)
                .insightFactory(new InsightFactory(cooldown, clock, ids))
                .grouper(grouper)
                .metrics(new CycleMetrics(registry))
                .executor(cyclePool)
                .settings(cycleSettings)
                .clock(clock)
                .build();

        LOG.info("Anomaly engine started: method={}, isolationForest={}, maxConcurrency={}",
                config.getStatistical().getMethod(), config.getIsolationForest().isEnabled(),
                cycleSettings.getMaxConcurrency());
    }

    /**
     * @param config   configuration; validated here
     * @param source   metric store
     * @param registry meter registry for cycle metrics
     * @return a running engine
     * @throws IllegalStateException if the configuration is invalid
     */
    public static AnomalyEngine create(EngineConfig config, MetricSource source, MeterRegistry registry) {
        return create(config, source, registry, Clock.systemUTC(), Random::new);
    }

    /**
     * Variant with injectable time and randomness.
     */
    public static AnomalyEngine create(EngineConfig config, MetricSource source, MeterRegistry registry,
                                       Clock clock, Supplier<Random> randomSupplier) {
        Objects.requireNonNull(config, "EngineConfig must not be null");
        Objects.requireNonNull(source, "MetricSource must not be null");
        Objects.requireNonNull(registry, "MeterRegistry must not be null");
        Objects.requireNonNull(clock, "Clock must not be null");
        Objects.requireNonNull(randomSupplier, "Random supplier must not be null");
        config.validate();
        return new AnomalyEngine(config, source, registry, clock, randomSupplier);
    }

    /**
     * Build an engine from the configuration found by
     * {@link EngineConfigLoader#load()}.
     */
    public static AnomalyEngine fromDefaultConfig(MetricSource source, MeterRegistry registry) {
        return create(EngineConfigLoader.load(), source, registry);
    }

    public CycleReport runCycle(List<ContainerTarget> targets) {
        int swept = cooldown.sweepExpired();
        if (swept > 0) {
            LOG.debug("Swept {} expired cooldown entr(ies)", swept);
        }
        return cycle.run(targets);
    }

    public IncidentGrouper getIncidentGrouper() {
        return grouper;
    }

    /** @return the Isolation Forest detector, or empty when it is disabled */
    public Optional<IsolationForestDetector> getForestDetector() {
        return Optional.ofNullable(forestDetector);
    }

    public CooldownTracker getCooldownTracker() {
        return cooldown;
    }

    public EngineConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        LOG.info("Shutting down anomaly engine");
        shutdown(cyclePool);
        shutdown(readPool);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Pool did not terminate within {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
