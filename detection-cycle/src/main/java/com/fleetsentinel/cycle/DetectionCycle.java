package com.fleetsentinel.cycle;

import com.fleetsentinel.core.config.CycleSettings;
import com.fleetsentinel.core.correlation.MetricCorrelator;
import com.fleetsentinel.core.detection.StatisticalDetector;
import com.fleetsentinel.core.forest.IsolationForestDetector;
import com.fleetsentinel.core.incident.GroupingOutcome;
import com.fleetsentinel.core.incident.IncidentGrouper;
import com.fleetsentinel.core.model.AnomalyDetection;
import com.fleetsentinel.core.model.CorrelationResult;
import com.fleetsentinel.core.model.Insight;
import com.fleetsentinel.core.model.IsolationForestDetection;
import com.fleetsentinel.core.model.MetricSample;
import com.fleetsentinel.core.model.MetricType;
import com.fleetsentinel.core.model.StatisticalDetection;
import com.fleetsentinel.core.source.MetricReadException;
import com.fleetsentinel.core.source.MetricSource;
import com.fleetsentinel.core.stats.SeriesAlignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * One pass of anomaly detection over a fleet of containers.
 *
 * <h3>Per container</h3>
 * <ol>
 * <li>Read the lookback window of every metric.</li>
 * <li>Run the statistical detector on each series.</li>
 * <li>Run the Isolation Forest on the latest time-aligned CPU/memory point,
 * when enabled.</li>
 * <li>Correlate the magnitudes of the elevated statistical scores into a
 * composite score, pattern and severity.</li>
 * <li>Turn flagged detections into insights.</li>
 * </ol>
 *
 * <p>
 * Containers are evaluated in parallel on the supplied executor. The
 * statistical and Isolation Forest steps are isolated from each other, and a
 * container whose evaluation throws is reported as failed without affecting
 * the others. Insights of all containers are grouped into incidents once
 * every container has finished.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionCycle {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionCycle.class);

    /** Metrics whose deviation magnitude is at most this stay out of the correlation. */
    static final double CONTRIBUTING_SCORE = 1.0;

    private static final MetricType[] STATISTICAL_METRICS = {
            MetricType.CPU, MetricType.MEMORY, MetricType.MEMORY_BYTES
    };

    private final StatisticalDetector statisticalDetector;
    private final IsolationForestDetector forestDetector;
    private final MetricSource source;
    private final InsightFactory insightFactory;
    private final IncidentGrouper grouper;
    private final CycleMetrics metrics;
    private final ExecutorService executor;
    private final Duration lookback;
    private final Clock clock;

    private DetectionCycle(Builder b) {
        this.statisticalDetector = Objects.requireNonNull(b.statisticalDetector, "statisticalDetector must not be null");
        this.forestDetector = b.forestDetector;
        this.source = Objects.requireNonNull(b.source, "source must not be null");
        this.insightFactory = Objects.requireNonNull(b.insightFactory, "insightFactory must not be null");
        this.grouper = Objects.requireNonNull(b.grouper, "grouper must not be null");
        this.metrics = Objects.requireNonNull(b.metrics, "metrics must not be null");
        this.executor = Objects.requireNonNull(b.executor, "executor must not be null");
        this.lookback = Objects.requireNonNull(b.settings, "settings must not be null").lookback();
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Evaluate every target and group the resulting insights.
     *
     * @param targets containers to evaluate
     * @return what the cycle produced
     */
    public CycleReport run(List<ContainerTarget> targets) {
        Objects.requireNonNull(targets, "targets must not be null");
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();

        List<Future<ContainerOutcome>> futures = new ArrayList<>(targets.size());
        for (ContainerTarget target : targets) {
            futures.add(executor.submit(() -> evaluate(target)));
        }

        List<String> failed = new ArrayList<>();
        List<AnomalyDetection> detections = new ArrayList<>();
        List<CorrelationResult> correlations = new ArrayList<>();
        List<Insight> insights = new ArrayList<>();
        int suppressed = 0;

        for (int i = 0; i < futures.size(); i++) {
            ContainerTarget target = targets.get(i);
            try {
                ContainerOutcome outcome = futures.get(i).get();
                detections.addAll(outcome.detections);
                if (outcome.correlation != null) {
                    correlations.add(outcome.correlation);
                }
                insights.addAll(outcome.insights);
                suppressed += outcome.suppressed;
            } catch (ExecutionException e) {
                LOG.error("Evaluation of container [{}] failed, continuing with next container",
                        target.getContainerId(), e.getCause());
                failed.add(target.getContainerId());
                metrics.recordFailedContainer();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Detection cycle interrupted, {} container(s) not evaluated", futures.size() - i);
                for (int j = i; j < futures.size(); j++) {
                    futures.get(j).cancel(true);
                    failed.add(targets.get(j).getContainerId());
                }
                break;
            }
        }

        GroupingOutcome grouping = grouper.group(insights);
        metrics.recordSuppressed(suppressed);
        metrics.recordIncidentsCreated(grouping.getIncidentsCreated());
        for (Insight insight : insights) {
            metrics.recordInsight(insight.getSeverity());
        }
        metrics.recordCycle(Duration.ofNanos(System.nanoTime() - startNanos));

        CycleReport report = new CycleReport(startedAt, clock.instant(), targets.size(), failed,
                detections, correlations, insights, suppressed, grouping);
        LOG.info("Detection cycle finished: {} container(s), {} anomal(ies), {} insight(s), "
                        + "{} suppressed, {} incident(s) opened, {} failed",
                targets.size(), report.anomalyCount(), insights.size(), suppressed,
                grouping.getIncidentsCreated(), failed.size());
        return report;
    }

    // ---------------------------------------------------------------
    // Per-container evaluation
    // ---------------------------------------------------------------

    ContainerOutcome evaluate(ContainerTarget target) {
        String containerId = target.getContainerId();
        Instant to = clock.instant();
        Instant from = to.minus(lookback);

        Map<MetricType, List<MetricSample>> series = new EnumMap<>(MetricType.class);
        for (MetricType metric : STATISTICAL_METRICS) {
            series.put(metric, read(containerId, metric, from, to));
        }

        List<StatisticalDetection> statistical = new ArrayList<>();
        try {
            for (MetricType metric : STATISTICAL_METRICS) {
                Optional<StatisticalDetection> detection = statisticalDetector.evaluate(
                        containerId, target.getContainerName(), metric, series.get(metric));
                detection.ifPresent(d -> {
                    statistical.add(d);
                    metrics.recordDetection(d.getMethod(), d.isAnomalous());
                });
            }
        } catch (RuntimeException e) {
            LOG.error("Statistical detection failed for container [{}], continuing with Isolation Forest",
                    containerId, e);
        }

        NavigableMap<Instant, double[]> aligned =
                SeriesAlignment.alignBySecond(series.get(MetricType.CPU), series.get(MetricType.MEMORY));

        IsolationForestDetection forest = null;
        if (forestDetector != null && !aligned.isEmpty()) {
            try {
                Map.Entry<Instant, double[]> latest = aligned.lastEntry();
                forest = forestDetector.detect(containerId, target.getContainerName(), MetricType.CPU,
                        latest.getValue()[0], latest.getValue()[1], latest.getKey()).orElse(null);
                if (forest != null) {
                    metrics.recordDetection(forest.getMethod(), forest.isAnomalous());
                }
            } catch (RuntimeException e) {
                LOG.error("Isolation Forest detection failed for container [{}], continuing", containerId, e);
            }
        }

        CorrelationResult correlation = correlate(containerId, statistical, aligned);
        InsightFactory.Result built = insightFactory.create(target, statistical, forest, correlation);

        List<AnomalyDetection> detections = new ArrayList<>(statistical);
        if (forest != null) {
            detections.add(forest);
        }
        return new ContainerOutcome(detections, correlation, built.getInsights(), built.getSuppressed());
    }

    private List<MetricSample> read(String containerId, MetricType metric, Instant from, Instant to) {
        try {
            List<MetricSample> samples = source.read(containerId, metric, from, to);
            return samples != null ? samples : List.of();
        } catch (MetricReadException e) {
            LOG.warn("Cannot read {} for container [{}]: {}", metric, containerId, e.getMessage());
            return List.of();
        }
    }

    private static CorrelationResult correlate(String containerId, List<StatisticalDetection> statistical,
                                               NavigableMap<Instant, double[]> aligned) {
        Map<MetricType, Double> scores = new EnumMap<>(MetricType.class);
        for (StatisticalDetection d : statistical) {
            double magnitude = Math.abs(d.getDeviationScore());
            if (magnitude > CONTRIBUTING_SCORE) {
                scores.put(d.getMetricType(), magnitude);
            }
        }
        if (scores.isEmpty()) {
            return null;
        }

        double[] cpu = new double[aligned.size()];
        double[] memory = new double[aligned.size()];
        int i = 0;
        for (double[] pair : aligned.values()) {
            cpu[i] = pair[0];
            memory[i] = pair[1];
            i++;
        }
        return MetricCorrelator.correlate(containerId, scores, MetricCorrelator.pearsonCorrelation(cpu, memory));
    }

    /**
     * What one container contributed to the cycle.
     */
    static final class ContainerOutcome {
        private final List<AnomalyDetection> detections;
        private final CorrelationResult correlation;
        private final List<Insight> insights;
        private final int suppressed;

        ContainerOutcome(List<AnomalyDetection> detections, CorrelationResult correlation,
                         List<Insight> insights, int suppressed) {
            this.detections = detections;
            this.correlation = correlation;
            this.insights = insights;
            this.suppressed = suppressed;
        }
    }

    /**
     * Fluent builder for {@link DetectionCycle}. The Isolation Forest
     * detector is optional; without it only statistical detection runs.
     */
    public static class Builder {
        private StatisticalDetector statisticalDetector;
        private IsolationForestDetector forestDetector;
        private MetricSource source;
        private InsightFactory insightFactory;
        private IncidentGrouper grouper;
        private CycleMetrics metrics;
        private ExecutorService executor;
        private CycleSettings settings;
        private Clock clock;

        public Builder statisticalDetector(StatisticalDetector statisticalDetector) {
            this.statisticalDetector = statisticalDetector;
            return this;
        }

        public Builder forestDetector(IsolationForestDetector forestDetector) {
            this.forestDetector = forestDetector;
            return this;
        }

        public Builder source(MetricSource source) {
            this.source = source;
            return this;
        }

        public Builder insightFactory(InsightFactory insightFactory) {
            this.insightFactory = insightFactory;
            return this;
        }

        public Builder grouper(IncidentGrouper grouper) {
            this.grouper = grouper;
            return this;
        }

        public Builder metrics(CycleMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /** Executor the containers are evaluated on; owned by the caller. */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder settings(CycleSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @return a new {@link DetectionCycle}
         * @throws NullPointerException if a required collaborator is missing
         */
        public DetectionCycle build() {
            return new DetectionCycle(this);
        }
    }
}
