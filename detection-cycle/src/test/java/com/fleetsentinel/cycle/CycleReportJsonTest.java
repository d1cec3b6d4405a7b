package com.fleetsentinel.cycle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetsentinel.core.incident.GroupingOutcome;
import com.fleetsentinel.core.model.CorrelationStrength;
import com.fleetsentinel.core.model.DetectionMethod;
import com.fleetsentinel.core.model.FailurePattern;
import com.fleetsentinel.core.model.Insight;
import com.fleetsentinel.core.model.InsightSeverity;
import com.fleetsentinel.core.model.MetricType;
import com.fleetsentinel.core.model.StatisticalDetection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CycleReportJson}.
 */
class CycleReportJsonTest {

    private static final Instant NOW = FleetFixture.NOW;

    private final Insight insight = Insight.builder()
            .id("ins-1")
            .severity(InsightSeverity.CRITICAL)
            .title("Anomalous memory usage on \"db\"")
            .containerId("db-1")
            .containerName("db")
            .metricType(MetricType.MEMORY_BYTES)
            .method(DetectionMethod.ZSCORE)
            .pattern(FailurePattern.MEMORY_LEAK)
            .compositeScore(6.2)
            .correlationStrength(CorrelationStrength.VERY_STRONG)
            .createdAt(NOW)
            .build();

    @Test
    @DisplayName("Should write insights with snake_case names, ISO timestamps and wire names")
    void shouldWriteInsight() throws IOException {
        JsonNode json = CycleReportJson.mapper().readTree(CycleReportJson.serialize(insight));

        assertThat(json.get("container_id").asText()).isEqualTo("db-1");
        assertThat(json.get("created_at").asText()).isEqualTo("2024-05-01T12:00:00Z");
        assertThat(json.get("metric_type").asText()).isEqualTo("memory_bytes");
        assertThat(json.get("method").asText()).isEqualTo("zscore");
        assertThat(json.get("pattern").asText()).isEqualTo("Memory Leak");
        assertThat(json.get("composite_score").asDouble()).isEqualTo(6.2);
        assertThat(json.get("acknowledged").asBoolean()).isFalse();
    }

    @Test
    @DisplayName("Should write a whole cycle report")
    void shouldWriteReport() throws IOException {
        StatisticalDetection detection = StatisticalDetection.builder()
                .containerId("db-1")
                .metricType(MetricType.MEMORY_BYTES)
                .currentValue(2.0e9)
                .mean(1.0e9)
                .stdDev(1.0e8)
                .zScore(10.0)
                .anomalous(true)
                .threshold(3.0)
                .sampleCount(30)
                .timestamp(NOW)
                .method(DetectionMethod.ZSCORE)
                .build();
        CycleReport report = new CycleReport(NOW, NOW.plusMillis(40), 1, List.of(), List.of(detection),
                List.of(), List.of(insight), 0, GroupingOutcome.empty());

        String text = CycleReportJson.toJson(report);
        JsonNode json = CycleReportJson.mapper().readTree(text);

        assertThat(json.get("containers_evaluated").asInt()).isEqualTo(1);
        assertThat(json.get("started_at").asText()).isEqualTo("2024-05-01T12:00:00Z");
        assertThat(json.get("detections").get(0).get("anomalous").asBoolean()).isTrue();
        assertThat(json.get("detections").get(0).get("container_name").asText()).isEqualTo("db-1");
        assertThat(json.get("insights").get(0).get("id").asText()).isEqualTo("ins-1");
        assertThat(json.get("incidents").isArray()).isTrue();
        assertThat(json.get("incidents").size()).isZero();
    }

    @Test
    @DisplayName("Should return an empty payload when a value cannot be serialized")
    void shouldReturnEmptyOnFailure() {
        assertThat(CycleReportJson.serialize(new Object())).isEmpty();
    }
}
