package com.fleetsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the small behaviours carried by the model types.
 */
class ModelTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    @DisplayName("Should resolve metric types and methods by wire name, ignoring case")
    void shouldResolveWireNames() {
        assertThat(MetricType.fromWireName(" Memory_Bytes ")).isEqualTo(MetricType.MEMORY_BYTES);
        assertThat(DetectionMethod.fromWireName("ISOLATION-FOREST")).isEqualTo(DetectionMethod.ISOLATION_FOREST);
        assertThat(DetectionMethod.ISOLATION_FOREST.isStatistical()).isFalse();

        assertThatThrownBy(() -> MetricType.fromWireName("disk"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown metric type");
        assertThatThrownBy(() -> DetectionMethod.fromWireName(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown detection method");
    }

    @Test
    @DisplayName("Should order severities and confidence levels")
    void shouldOrderLevels() {
        assertThat(InsightSeverity.WARNING.max(InsightSeverity.CRITICAL)).isEqualTo(InsightSeverity.CRITICAL);
        assertThat(InsightSeverity.CRITICAL.max(null)).isEqualTo(InsightSeverity.CRITICAL);
        assertThat(ConfidenceLevel.LOW.raise()).isEqualTo(ConfidenceLevel.MEDIUM);
        assertThat(ConfidenceLevel.HIGH.raise()).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(ConfidenceLevel.MEDIUM.max(ConfidenceLevel.LOW)).isEqualTo(ConfidenceLevel.MEDIUM);
    }

    @Test
    @DisplayName("Should count the root cause and related insights")
    void shouldCountInsights() {
        Incident incident = Incident.builder()
                .id("inc-1")
                .title("Cascade anomaly affecting a, b")
                .severity(InsightSeverity.WARNING)
                .status(IncidentStatus.ACTIVE)
                .rootCauseInsightId("i1")
                .relatedInsightIds(List.of("i2", "i3"))
                .createdAt(NOW)
                .build();

        assertThat(incident.getInsightCount()).isEqualTo(3);
        assertThat(incident.getCorrelationType()).isEqualTo(Incident.UNCLASSIFIED);
        assertThat(incident.getUpdatedAt()).isEqualTo(NOW);
        assertThat(incident.isActive()).isTrue();
    }

    @Test
    @DisplayName("Should derive the forest verdict from score and cutoff")
    void shouldDeriveForestVerdict() {
        IsolationForestDetection detection = IsolationForestDetection.builder()
                .containerId("c1")
                .metricType(MetricType.MEMORY)
                .cpuValue(10.0)
                .memoryValue(88.0)
                .anomalyScore(0.62)
                .cutoff(0.62)
                .timestamp(NOW)
                .build();

        assertThat(detection.isAnomalous()).isFalse();
        assertThat(detection.getCurrentValue()).isEqualTo(88.0);
        assertThat(detection.getMean()).isZero();
        assertThat(detection.getContainerName()).isEqualTo("c1");
    }

    @Test
    @DisplayName("Should refuse a statistical detection with the forest method")
    void shouldRejectForestMethodOnStatisticalDetection() {
        assertThatThrownBy(() -> StatisticalDetection.builder()
                .containerId("c1")
                .metricType(MetricType.CPU)
                .timestamp(NOW)
                .method(DetectionMethod.ISOLATION_FOREST)
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
