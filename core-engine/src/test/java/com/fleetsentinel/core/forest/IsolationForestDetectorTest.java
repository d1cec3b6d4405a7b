package com.fleetsentinel.core.forest;

import com.fleetsentinel.core.MutableClock;
import com.fleetsentinel.core.config.ForestSettings;
import com.fleetsentinel.core.model.DetectionMethod;
import com.fleetsentinel.core.model.IsolationForestDetection;
import com.fleetsentinel.core.model.MetricSample;
import com.fleetsentinel.core.model.MetricType;
import com.fleetsentinel.core.source.MetricReadException;
import com.fleetsentinel.core.source.MetricSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link IsolationForestDetector}.
 */
class IsolationForestDetectorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private MutableClock clock;
    private ForestSettings settings;
    private AtomicInteger reads;
    private AtomicBoolean failReads;
    private int pairs;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        settings = new ForestSettings();
        settings.setTreeCount(50);
        reads = new AtomicInteger();
        failReads = new AtomicBoolean(false);
        pairs = 120;
    }

    /** CPU ~ N(20, 2) and memory ~ N(30, 3), one pair per minute before the current time. */
    private final MetricSource source = (containerId, metricType, from, to) -> {
        reads.incrementAndGet();
        if (failReads.get()) {
            throw new MetricReadException("store unavailable");
        }
        Random random = new Random(42);
        List<MetricSample> samples = new ArrayList<>();
        for (int i = pairs; i > 0; i--) {
            double cpu = 20 + random.nextGaussian() * 2;
            double memory = 30 + random.nextGaussian() * 3;
            double value = metricType == MetricType.CPU ? cpu : memory;
            // memory lands a few hundred milliseconds after cpu
            Instant ts = to.minus(Duration.ofMinutes(i))
                    .plusMillis(metricType == MetricType.CPU ? 50 : 450);
            samples.add(new MetricSample(containerId, metricType, value, ts));
        }
        return samples;
    };

    private IsolationForestDetector detector() {
        return new IsolationForestDetector(settings, source, new ModelCache(), clock, () -> new Random(7));
    }

    @Test
    @DisplayName("Should not train a model below the minimum number of pairs")
    void shouldNotTrainWithTooFewPairs() {
        pairs = 49;
        IsolationForestDetector detector = detector();

        assertThat(detector.getOrTrainModel("c1")).isEmpty();
        assertThat(detector.detect("c1", "web", MetricType.CPU, 95, 92, NOW)).isEmpty();
        assertThat(detector.getCache().size()).isZero();
    }

    @Test
    @DisplayName("Should train on time-aligned pairs and reuse the cached model")
    void shouldTrainAndCache() {
        IsolationForestDetector detector = detector();

        IsolationForestModel first = detector.getOrTrainModel("c1").orElseThrow();
        int readsAfterTraining = reads.get();
        IsolationForestModel second = detector.getOrTrainModel("c1").orElseThrow();

        assertThat(first.getTrainingSize()).isEqualTo(120);
        assertThat(first.getTrainedAt()).isEqualTo(NOW);
        assertThat(second).isSameAs(first);
        assertThat(reads.get()).isEqualTo(readsAfterTraining);
    }

    @Test
    @DisplayName("Should retrain once the model reaches the retrain interval")
    void shouldRetrainStaleModel() {
        IsolationForestDetector detector = detector();
        IsolationForestModel first = detector.getOrTrainModel("c1").orElseThrow();

        clock.advance(Duration.ofHours(5).plusMinutes(59));
        assertThat(detector.getOrTrainModel("c1").orElseThrow()).isSameAs(first);

        clock.advance(Duration.ofMinutes(1));
        IsolationForestModel retrained = detector.getOrTrainModel("c1").orElseThrow();
        assertThat(retrained).isNotSameAs(first);
        assertThat(retrained.getTrainedAt()).isEqualTo(NOW.plus(Duration.ofHours(6)));
    }

    @Test
    @DisplayName("Should yield no model when the store cannot be read")
    void shouldDegradeOnReadFailure() {
        failReads.set(true);
        IsolationForestDetector detector = detector();

        assertThat(detector.getOrTrainModel("c1")).isEmpty();
    }

    @Test
    @DisplayName("Should drop a stale model when retraining fails")
    void shouldDropStaleModelOnFailedRetrain() {
        IsolationForestDetector detector = detector();
        detector.getOrTrainModel("c1").orElseThrow();

        clock.advance(Duration.ofHours(6));
        failReads.set(true);

        assertThat(detector.getOrTrainModel("c1")).isEmpty();
        assertThat(detector.getCache().get("c1")).isEmpty();
    }

    @Test
    @DisplayName("Should flag an outlying point with score above the cutoff")
    void shouldDetectOutlier() {
        IsolationForestDetector detector = detector();

        IsolationForestDetection outlier = detector.detect("c1", "web", MetricType.CPU, 95, 92, NOW).orElseThrow();
        IsolationForestDetection normal = detector.detect("c1", "web", MetricType.CPU, 20, 30, NOW).orElseThrow();

        assertThat(outlier.isAnomalous()).isTrue();
        assertThat(outlier.getAnomalyScore()).isGreaterThan(outlier.getCutoff());
        assertThat(outlier.getAnomalyScore()).isGreaterThan(normal.getAnomalyScore());
        assertThat(outlier.getThreshold()).isEqualTo(outlier.getCutoff());
        assertThat(outlier.getDeviationScore()).isEqualTo(outlier.getAnomalyScore());
        assertThat(outlier.getMean()).isZero();
        assertThat(outlier.getStdDev()).isZero();
        assertThat(outlier.getMethod()).isEqualTo(DetectionMethod.ISOLATION_FOREST);
        assertThat(outlier.getCurrentValue()).isEqualTo(95);
        assertThat(outlier.getCpuValue()).isEqualTo(95);
        assertThat(outlier.getMemoryValue()).isEqualTo(92);
    }

    @Test
    @DisplayName("Should report the memory value when detecting under the memory metric")
    void shouldReportMetricValue() {
        Optional<IsolationForestDetection> detection =
                detector().detect("c1", "web", MetricType.MEMORY, 95, 92, NOW);

        assertThat(detection).isPresent();
        assertThat(detection.get().getCurrentValue()).isEqualTo(92);
    }

    @Test
    @DisplayName("Should skip a non-finite point without training")
    void shouldSkipNonFinitePoint() {
        IsolationForestDetector detector = detector();

        assertThat(detector.detect("c1", "web", MetricType.CPU, Double.NaN, 30, NOW)).isEmpty();
        assertThat(reads.get()).isZero();
    }

    @Test
    @DisplayName("Should empty the cache on clearCache")
    void shouldClearCache() {
        IsolationForestDetector detector = detector();
        detector.getOrTrainModel("c1");
        detector.getOrTrainModel("c2");
        assertThat(detector.getCache().size()).isEqualTo(2);

        detector.clearCache();

        assertThat(detector.getCache().size()).isZero();
    }
}
