package com.fleetsentinel.core.forest;

import com.fleetsentinel.core.config.ForestSettings;
import com.fleetsentinel.core.model.IsolationForestDetection;
import com.fleetsentinel.core.model.MetricSample;
import com.fleetsentinel.core.model.MetricType;
import com.fleetsentinel.core.source.MetricReadException;
import com.fleetsentinel.core.source.MetricSource;
import com.fleetsentinel.core.stats.SeriesAlignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Multivariate anomaly detection on {@code (cpu, memory)} points.
 *
 * <h3>Model lifecycle</h3>
 * <p>
 * One model per container is trained on the trailing training window of
 * time-aligned CPU and memory samples and cached until it is older than the
 * retrain interval. Retraining happens lazily on the next detection. Any
 * obstacle to training (too few pairs, a failed read, a failed fit) leaves
 * the container without a model: nothing is thrown, the detection is simply
 * skipped. A stale model is never kept past a failed retrain.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * The {@link ModelCache} is the only mutable state. Trained models are
 * immutable and swapped in whole.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForestDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForestDetector.class);

    private final ForestSettings settings;
    private final MetricSource source;
    private final ModelCache cache;
    private final Clock clock;
    private final Supplier<Random> randomSupplier;

    /**
     * @param settings       validated forest settings
     * @param source         metric store used for training data
     * @param cache          model cache owned by this detector
     * @param clock          time source for model age and training window
     * @param randomSupplier fresh randomness for each training run
     */
    public IsolationForestDetector(ForestSettings settings, MetricSource source, ModelCache cache,
                                   Clock clock, Supplier<Random> randomSupplier) {
        this.settings = Objects.requireNonNull(settings, "ForestSettings must not be null");
        this.source = Objects.requireNonNull(source, "MetricSource must not be null");
        this.cache = Objects.requireNonNull(cache, "ModelCache must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.randomSupplier = Objects.requireNonNull(randomSupplier, "Random supplier must not be null");
    }

    public IsolationForestDetector(ForestSettings settings, MetricSource source) {
        this(settings, source, new ModelCache(), Clock.systemUTC(), Random::new);
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Return the cached model for a container, training a new one when none
     * is cached or the cached one has reached the retrain interval.
     *
     * @param containerId container to model
     * @return the model, or empty if none could be trained
     */
    public Optional<IsolationForestModel> getOrTrainModel(String containerId) {
        Objects.requireNonNull(containerId, "containerId must not be null");
        Instant now = clock.instant();

        Optional<IsolationForestModel> cached = cache.get(containerId);
        if (cached.isPresent() && !cached.get().isStale(now, settings.retrainInterval())) {
            return cached;
        }

        Optional<IsolationForestModel> trained = train(containerId, now);
        if (trained.isPresent()) {
            cache.put(trained.get());
        } else if (cached.isPresent()) {
            if (cache.invalidate(containerId, cached.get())) {
                LOG.info("Dropped stale Isolation Forest model for container [{}] trained at {}",
                        containerId, cached.get().getTrainedAt());
            }
        }
        return trained;
    }

    /**
     * Score one {@code (cpu, memory)} point against the container's model.
     *
     * @param containerId   container the point belongs to
     * @param containerName display name; the id is used when {@code null}
     * @param metricType    metric the detection is reported under
     * @param cpuValue      CPU percentage at {@code timestamp}
     * @param memoryValue   memory percentage at {@code timestamp}
     * @param timestamp     time of the point
     * @return the detection, or empty if there is no model or the point is
     *         not finite
     */
    public Optional<IsolationForestDetection> detect(String containerId, String containerName,
                                                     MetricType metricType, double cpuValue,
                                                     double memoryValue, Instant timestamp) {
        Objects.requireNonNull(metricType, "metricType must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (!Double.isFinite(cpuValue) || !Double.isFinite(memoryValue)) {
            LOG.debug("Container [{}]: non-finite point ({}, {}), skipping Isolation Forest",
                    containerId, cpuValue, memoryValue);
            return Optional.empty();
        }

        Optional<IsolationForestModel> model = getOrTrainModel(containerId);
        if (model.isEmpty()) {
            return Optional.empty();
        }

        IsolationForest forest = model.get().getForest();
        double score = forest.anomalyScore(new double[]{cpuValue, memoryValue});
        IsolationForestDetection detection = IsolationForestDetection.builder()
                .containerId(containerId)
                .containerName(containerName)
                .metricType(metricType)
                .cpuValue(cpuValue)
                .memoryValue(memoryValue)
                .anomalyScore(score)
                .cutoff(forest.getCutoff())
                .timestamp(timestamp)
                .build();

        if (detection.isAnomalous()) {
            LOG.debug("Container [{}] flagged by isolation-forest: cpu={} memory={} score={} cutoff={}",
                    containerId, cpuValue, memoryValue, score, forest.getCutoff());
        }
        return Optional.of(detection);
    }

    /**
     * Drop every cached model.
     */
    public void clearCache() {
        cache.clear();
        LOG.info("Isolation Forest model cache cleared");
    }

    public ModelCache getCache() {
        return cache;
    }

    public ForestSettings getSettings() {
        return settings;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<IsolationForestModel> train(String containerId, Instant now) {
        Instant from = now.minus(settings.trainingWindow());
        List<MetricSample> cpu;
        List<MetricSample> memory;
        try {
            cpu = source.read(containerId, MetricType.CPU, from, now);
            memory = source.read(containerId, MetricType.MEMORY, from, now);
        } catch (MetricReadException e) {
            LOG.warn("Cannot read training data for container [{}]: {}", containerId, e.getMessage());
            return Optional.empty();
        }

        List<double[]> points = new ArrayList<>(SeriesAlignment.alignBySecond(cpu, memory).values());
        if (points.size() < settings.getMinTrainingSamples()) {
            LOG.debug("Container [{}]: {} aligned training pair(s), need {}",
                    containerId, points.size(), settings.getMinTrainingSamples());
            return Optional.empty();
        }

        try {
            IsolationForest forest = IsolationForest.train(points, settings.getTreeCount(),
                    settings.getSampleSize(), settings.getContamination(), randomSupplier.get());
            IsolationForestModel model = new IsolationForestModel(containerId, forest, now, points.size());
            LOG.info("Trained Isolation Forest for container [{}] on {} pair(s), cutoff={}",
                    containerId, points.size(), forest.getCutoff());
            return Optional.of(model);
        } catch (RuntimeException e) {
            LOG.warn("Isolation Forest training failed for container [{}]", containerId, e);
            return Optional.empty();
        }
    }
}
