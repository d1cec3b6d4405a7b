package com.fleetsentinel.cycle;

import com.fleetsentinel.core.detection.CooldownTracker;
import com.fleetsentinel.core.model.CorrelationResult;
import com.fleetsentinel.core.model.CorrelationStrength;
import com.fleetsentinel.core.model.DetectionMethod;
import com.fleetsentinel.core.model.Insight;
import com.fleetsentinel.core.model.InsightSeverity;
import com.fleetsentinel.core.model.IsolationForestDetection;
import com.fleetsentinel.core.model.MetricType;
import com.fleetsentinel.core.model.Severity;
import com.fleetsentinel.core.model.StatisticalDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Turns one container's flagged detections into {@link Insight}s.
 *
 * <h3>Rules</h3>
 * <ul>
 * <li>Only anomalous detections produce insights, and only when the cooldown
 * for their container and metric is free.</li>
 * <li>A critical correlation severity raises every insight of the container
 * to critical.</li>
 * <li>The Isolation Forest contributes at most one insight per container, and
 * none when a statistical detector already flagged the container.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class InsightFactory {

    private static final Logger LOG = LoggerFactory.getLogger(InsightFactory.class);

    /** Cooldown key suffix separating forest flags from statistical ones. */
    static final String FOREST_COOLDOWN_SUFFIX = DetectionMethod.ISOLATION_FOREST.getWireName();

    private final CooldownTracker cooldown;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public InsightFactory(CooldownTracker cooldown, Clock clock, Supplier<String> idGenerator) {
        this.cooldown = Objects.requireNonNull(cooldown, "CooldownTracker must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
    }

    /**
     * @param target      container the detections belong to
     * @param statistical statistical detections of this cycle, any verdict
     * @param forest      Isolation Forest detection of this cycle, may be {@code null}
     * @param correlation cross-metric view of this cycle, may be {@code null}
     * @return insights and the number of flags held back by the cooldown
     */
    public Result create(ContainerTarget target, List<StatisticalDetection> statistical,
                         IsolationForestDetection forest, CorrelationResult correlation) {
        Objects.requireNonNull(target, "target must not be null");
        List<Insight> insights = new ArrayList<>();
        int suppressed = 0;
        boolean statisticallyFlagged = false;

        for (StatisticalDetection detection : statistical) {
            if (!detection.isAnomalous()) {
                continue;
            }
            statisticallyFlagged = true;
            if (!cooldown.tryAcquire(CooldownTracker.key(target.getContainerId(), detection.getMetricType()))) {
                suppressed++;
                continue;
            }
            insights.add(fromStatistical(target, detection, correlation));
        }

        if (forest != null && forest.isAnomalous()) {
            if (statisticallyFlagged) {
                LOG.debug("Container [{}] already flagged statistically, no Isolation Forest insight",
                        target.getContainerId());
            } else if (cooldown.tryAcquire(CooldownTracker.key(target.getContainerId(),
                    forest.getMetricType(), FOREST_COOLDOWN_SUFFIX))) {
                insights.add(fromForest(target, forest, correlation));
            } else {
                suppressed++;
            }
        }
        return new Result(insights, suppressed);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Insight fromStatistical(ContainerTarget target, StatisticalDetection d, CorrelationResult correlation) {
        MetricType metric = d.getMetricType();
        String description = String.format(Locale.ROOT,
                "Current %s: %s (mean: %s, z-score: %.2f, method: %s). "
                        + "This is %.1f standard deviations from the moving average.",
                metric, formatValue(metric, d.getCurrentValue()), formatValue(metric, d.getMean()),
                d.getZScore(), d.getMethod(), Math.abs(d.getZScore()));
        String action = isMemory(metric)
                ? "Investigate memory usage patterns and check container configuration"
                : "Investigate CPU usage patterns and check for process anomalies";
        return baseInsight(target, d.severityHint(), correlation)
                .title("Anomalous " + metric + " usage on \"" + target.getContainerName() + "\"")
                .description(description)
                .suggestedAction(action)
                .metricType(metric)
                .method(d.getMethod())
                .build();
    }

    private Insight fromForest(ContainerTarget target, IsolationForestDetection d, CorrelationResult correlation) {
        MetricType metric = d.getMetricType();
        String description = String.format(Locale.ROOT,
                "Isolation Forest anomaly score: %.2f (cpu: %.1f%%, memory: %.1f%%, method: %s). "
                        + "Multivariate analysis detected unusual resource usage pattern.",
                d.getAnomalyScore(), d.getCpuValue(), d.getMemoryValue(), d.getMethod());
        String action = isMemory(metric)
                ? "Check for memory leaks or increase memory limit"
                : "Check for runaway processes or increase CPU allocation";
        return baseInsight(target, d.severityHint(), correlation)
                .title("Anomalous " + metric + " usage on \"" + target.getContainerName() + "\" (ML-detected)")
                .description(description)
                .suggestedAction(action)
                .metricType(metric)
                .method(DetectionMethod.ISOLATION_FOREST)
                .build();
    }

    private Insight.Builder baseInsight(ContainerTarget target, InsightSeverity hint, CorrelationResult correlation) {
        InsightSeverity severity = hint;
        Insight.Builder builder = Insight.builder()
                .id(idGenerator.get())
                .category(Insight.CATEGORY_ANOMALY)
                .containerId(target.getContainerId())
                .containerName(target.getContainerName())
                .endpointId(target.getEndpointId())
                .endpointName(target.getEndpointName())
                .createdAt(clock.instant());
        if (correlation != null) {
            if (correlation.getSeverity() == Severity.CRITICAL) {
                severity = InsightSeverity.CRITICAL;
            }
            builder.pattern(correlation.getPattern().orElse(null))
                    .compositeScore(correlation.getCompositeScore())
                    .correlationStrength(correlation.getCorrelationStrength());
        } else {
            builder.correlationStrength(CorrelationStrength.WEAK);
        }
        return builder.severity(severity);
    }

    private static boolean isMemory(MetricType metric) {
        return metric == MetricType.MEMORY || metric == MetricType.MEMORY_BYTES;
    }

    private static String formatValue(MetricType metric, double value) {
        return metric == MetricType.MEMORY_BYTES
                ? String.format(Locale.ROOT, "%.0f bytes", value)
                : String.format(Locale.ROOT, "%.1f%%", value);
    }

    /**
     * Insights built for one container.
     */
    public static final class Result {

        private final List<Insight> insights;
        private final int suppressed;

        Result(List<Insight> insights, int suppressed) {
            this.insights = List.copyOf(insights);
            this.suppressed = suppressed;
        }

        public List<Insight> getInsights() {
            return insights;
        }

        /** @return anomalous detections held back by the cooldown */
        public int getSuppressed() {
            return suppressed;
        }
    }
}
