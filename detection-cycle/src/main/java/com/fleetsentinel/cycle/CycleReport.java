package com.fleetsentinel.cycle;

import com.fleetsentinel.core.incident.GroupingOutcome;
import com.fleetsentinel.core.model.AnomalyDetection;
import com.fleetsentinel.core.model.CorrelationResult;
import com.fleetsentinel.core.model.Incident;
import com.fleetsentinel.core.model.Insight;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything one detection cycle produced.
 *
 * <p>
 * The engine does not persist any of it; callers that store insights or
 * incidents take them from here.
 * </p>
 *
 * @since 1.0.0
 */
public final class CycleReport {

    private final Instant startedAt;
    private final Instant finishedAt;
    private final int containersEvaluated;
    private final List<String> failedContainers;
    private final List<AnomalyDetection> detections;
    private final List<CorrelationResult> correlations;
    private final List<Insight> insights;
    private final int suppressedFlags;
    private final GroupingOutcome grouping;

    CycleReport(Instant startedAt, Instant finishedAt, int containersEvaluated, List<String> failedContainers,
                List<AnomalyDetection> detections, List<CorrelationResult> correlations,
                List<Insight> insights, int suppressedFlags, GroupingOutcome grouping) {
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
        this.finishedAt = Objects.requireNonNull(finishedAt, "finishedAt must not be null");
        this.containersEvaluated = containersEvaluated;
        this.failedContainers = List.copyOf(failedContainers);
        this.detections = List.copyOf(detections);
        this.correlations = List.copyOf(correlations);
        this.insights = List.copyOf(insights);
        this.suppressedFlags = suppressedFlags;
        this.grouping = Objects.requireNonNull(grouping, "grouping must not be null");
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public int getContainersEvaluated() {
        return containersEvaluated;
    }

    /** @return ids of containers whose evaluation threw */
    public List<String> getFailedContainers() {
        return failedContainers;
    }

    /** @return every verdict of every detector, anomalous or not */
    public List<AnomalyDetection> getDetections() {
        return detections;
    }

    public List<CorrelationResult> getCorrelations() {
        return correlations;
    }

    public List<Insight> getInsights() {
        return insights;
    }

    public int getSuppressedFlags() {
        return suppressedFlags;
    }

    public GroupingOutcome getGrouping() {
        return grouping;
    }

    /** @return incidents opened or extended by this cycle */
    public List<Incident> getIncidents() {
        return grouping.getAffectedIncidents();
    }

    public long anomalyCount() {
        return detections.stream().filter(AnomalyDetection::isAnomalous).count();
    }

    @Override
    public String toString() {
        return "CycleReport{" +
                "startedAt=" + startedAt +
                ", containersEvaluated=" + containersEvaluated +
                ", failedContainers=" + failedContainers.size() +
                ", detections=" + detections.size() +
                ", insights=" + insights.size() +
                ", suppressedFlags=" + suppressedFlags +
                ", grouping=" + grouping +
                '}';
    }
}
