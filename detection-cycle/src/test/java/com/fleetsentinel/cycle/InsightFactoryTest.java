package com.fleetsentinel.cycle;

import com.fleetsentinel.core.detection.CooldownTracker;
import com.fleetsentinel.core.model.CorrelationResult;
import com.fleetsentinel.core.model.CorrelationStrength;
import com.fleetsentinel.core.model.DetectionMethod;
import com.fleetsentinel.core.model.FailurePattern;
import com.fleetsentinel.core.model.Insight;
import com.fleetsentinel.core.model.InsightSeverity;
import com.fleetsentinel.core.model.IsolationForestDetection;
import com.fleetsentinel.core.model.MetricType;
import com.fleetsentinel.core.model.Severity;
import com.fleetsentinel.core.model.StatisticalDetection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InsightFactory}.
 */
class InsightFactoryTest {

    private static final ContainerTarget TARGET = new ContainerTarget("c1", "api", 3, "edge");

    private MutableClock clock;
    private CooldownTracker cooldown;
    private InsightFactory factory;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(FleetFixture.NOW);
        cooldown = new CooldownTracker(Duration.ofMinutes(15), clock);
        AtomicInteger ids = new AtomicInteger();
        factory = new InsightFactory(cooldown, clock, () -> "ins-" + ids.incrementAndGet());
    }

    @Test
    @DisplayName("Should describe a statistical flag in operator terms")
    void shouldBuildStatisticalInsight() {
        InsightFactory.Result result = factory.create(TARGET,
                List.of(statistical(MetricType.CPU, 45.0, 3.5, true)), null, null);

        assertThat(result.getSuppressed()).isZero();
        Insight insight = result.getInsights().get(0);
        assertThat(insight.getId()).isEqualTo("ins-1");
        assertThat(insight.getTitle()).isEqualTo("Anomalous cpu usage on \"api\"");
        assertThat(insight.getDescription()).isEqualTo("Current cpu: 45.0% (mean: 20.0%, z-score: 3.50, "
                + "method: zscore). This is 3.5 standard deviations from the moving average.");
        assertThat(insight.getSuggestedAction())
                .isEqualTo("Investigate CPU usage patterns and check for process anomalies");
        assertThat(insight.getSeverity()).isEqualTo(InsightSeverity.WARNING);
        assertThat(insight.getCategory()).isEqualTo(Insight.CATEGORY_ANOMALY);
        assertThat(insight.getEndpointId()).isEqualTo(3);
        assertThat(insight.getCorrelationStrength()).isEqualTo(CorrelationStrength.WEAK);
        assertThat(insight.getCreatedAt()).isEqualTo(FleetFixture.NOW);
        assertThat(insight.isAcknowledged()).isFalse();
    }

    @Test
    @DisplayName("Should ignore detections that are not anomalous")
    void shouldIgnoreNormalDetections() {
        InsightFactory.Result result = factory.create(TARGET,
                List.of(statistical(MetricType.MEMORY, 31.0, 0.4, false)), null, null);

        assertThat(result.getInsights()).isEmpty();
        assertThat(cooldown.size()).isZero();
    }

    @Test
    @DisplayName("Should raise every insight to critical on a critical correlation")
    void shouldRaiseToCriticalCorrelation() {
        CorrelationResult correlation = new CorrelationResult("c1",
                Map.of(MetricType.MEMORY, 3.0, MetricType.MEMORY_BYTES, 8.0), 6.05,
                FailurePattern.MEMORY_LEAK, Severity.CRITICAL, 0.92, CorrelationStrength.VERY_STRONG);

        InsightFactory.Result result = factory.create(TARGET, List.of(
                statistical(MetricType.MEMORY, 45.0, 3.0, true),
                statistical(MetricType.MEMORY_BYTES, 2.0e9, 8.0, true)), null, correlation);

        assertThat(result.getInsights()).hasSize(2).allSatisfy(i -> {
            assertThat(i.getSeverity()).isEqualTo(InsightSeverity.CRITICAL);
            assertThat(i.getPattern()).contains(FailurePattern.MEMORY_LEAK);
            assertThat(i.getCompositeScore()).isEqualTo(6.05);
            assertThat(i.getCorrelationStrength()).isEqualTo(CorrelationStrength.VERY_STRONG);
            assertThat(i.getSuggestedAction())
                    .isEqualTo("Investigate memory usage patterns and check container configuration");
        });
        assertThat(result.getInsights().get(1).getDescription()).startsWith("Current memory_bytes: 2000000000 bytes");
    }

    @Test
    @DisplayName("Should count flags held back by the cooldown")
    void shouldSuppressWithinCooldown() {
        List<StatisticalDetection> flags = List.of(statistical(MetricType.CPU, 45.0, 5.0, true));

        assertThat(factory.create(TARGET, flags, null, null).getInsights()).hasSize(1);

        InsightFactory.Result again = factory.create(TARGET, flags, null, null);
        assertThat(again.getInsights()).isEmpty();
        assertThat(again.getSuppressed()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(15));
        assertThat(factory.create(TARGET, flags, null, null).getInsights()).hasSize(1);
    }

    @Test
    @DisplayName("Should add a machine-learning insight when no statistical detector flagged the container")
    void shouldBuildForestInsight() {
        InsightFactory.Result result = factory.create(TARGET,
                List.of(statistical(MetricType.CPU, 24.0, 1.2, false)), forest(0.74, 0.6), null);

        Insight insight = result.getInsights().get(0);
        assertThat(insight.getTitle()).isEqualTo("Anomalous cpu usage on \"api\" (ML-detected)");
        assertThat(insight.getMethod()).isEqualTo(DetectionMethod.ISOLATION_FOREST);
        assertThat(insight.getSeverity()).isEqualTo(InsightSeverity.CRITICAL);
        assertThat(insight.getSuggestedAction())
                .isEqualTo("Check for runaway processes or increase CPU allocation");
        assertThat(insight.getDescription()).startsWith("Isolation Forest anomaly score: 0.74");
    }

    @Test
    @DisplayName("Should not add a machine-learning insight to a statistically flagged container")
    void shouldPreferStatisticalFlag() {
        InsightFactory.Result result = factory.create(TARGET,
                List.of(statistical(MetricType.CPU, 45.0, 5.0, true)), forest(0.8, 0.6), null);

        assertThat(result.getInsights()).singleElement()
                .satisfies(i -> assertThat(i.getMethod()).isEqualTo(DetectionMethod.ZSCORE));
    }

    @Test
    @DisplayName("Should keep separate cooldowns for statistical and machine-learning flags")
    void shouldSeparateForestCooldown() {
        factory.create(TARGET, List.of(statistical(MetricType.CPU, 45.0, 5.0, true)), null, null);

        InsightFactory.Result result = factory.create(TARGET, List.of(), forest(0.65, 0.6), null);

        assertThat(result.getInsights()).singleElement()
                .satisfies(i -> assertThat(i.getSeverity()).isEqualTo(InsightSeverity.WARNING));
        assertThat(factory.create(TARGET, List.of(), forest(0.65, 0.6), null).getSuppressed()).isEqualTo(1);
    }

    private static StatisticalDetection statistical(MetricType metric, double value, double z, boolean anomalous) {
        return StatisticalDetection.builder()
                .containerId("c1")
                .containerName("api")
                .metricType(metric)
                .currentValue(value)
                .mean(metric == MetricType.MEMORY_BYTES ? 1.0e9 : 20.0)
                .stdDev(metric == MetricType.MEMORY_BYTES ? 1.25e8 : 7.0)
                .zScore(z)
                .anomalous(anomalous)
                .threshold(3.0)
                .sampleCount(30)
                .timestamp(FleetFixture.NOW)
                .method(DetectionMethod.ZSCORE)
                .build();
    }

    private static IsolationForestDetection forest(double score, double cutoff) {
        return IsolationForestDetection.builder()
                .containerId("c1")
                .containerName("api")
                .metricType(MetricType.CPU)
                .cpuValue(55.0)
                .memoryValue(40.0)
                .anomalyScore(score)
                .cutoff(cutoff)
                .timestamp(FleetFixture.NOW)
                .build();
    }
}
