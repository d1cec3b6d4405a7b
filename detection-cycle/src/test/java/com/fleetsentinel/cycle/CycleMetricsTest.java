package com.fleetsentinel.cycle;

import com.fleetsentinel.core.model.DetectionMethod;
import com.fleetsentinel.core.model.InsightSeverity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CycleMetrics}.
 */
class CycleMetricsTest {

    private SimpleMeterRegistry registry;
    private CycleMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CycleMetrics(registry);
    }

    @Test
    @DisplayName("Should tag detections and anomalies by method")
    void shouldTagDetectionsByMethod() {
        metrics.recordDetection(DetectionMethod.ZSCORE, true);
        metrics.recordDetection(DetectionMethod.ZSCORE, false);
        metrics.recordDetection(DetectionMethod.ISOLATION_FOREST, false);

        assertThat(registry.get("fleet_sentinel.detections").tag("method", "zscore").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("fleet_sentinel.anomalies").tag("method", "zscore").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("fleet_sentinel.anomalies").tag("method", "isolation-forest").counter())
                .isNull();
    }

    @Test
    @DisplayName("Should tag insights by lowercase severity")
    void shouldTagInsightsBySeverity() {
        metrics.recordInsight(InsightSeverity.CRITICAL);
        metrics.recordInsight(InsightSeverity.CRITICAL);
        metrics.recordInsight(InsightSeverity.WARNING);

        assertThat(registry.get("fleet_sentinel.insights").tag("severity", "critical").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("fleet_sentinel.insights").tag("severity", "warning").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should accumulate cycle counters and the duration timer")
    void shouldRecordCycle() {
        metrics.recordSuppressed(0);
        metrics.recordSuppressed(3);
        metrics.recordIncidentsCreated(2);
        metrics.recordFailedContainer();
        metrics.recordCycle(Duration.ofMillis(250));

        assertThat(registry.get("fleet_sentinel.flags.suppressed").counter().count()).isEqualTo(3.0);
        assertThat(registry.get("fleet_sentinel.incidents.created").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("fleet_sentinel.containers.failed").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("fleet_sentinel.cycles").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("fleet_sentinel.cycle.duration").timer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(250.0);
    }
}
