package com.fleetsentinel.core.incident;

import com.fleetsentinel.core.model.ConfidenceLevel;
import com.fleetsentinel.core.model.CorrelationStrength;
import com.fleetsentinel.core.model.FailurePattern;
import com.fleetsentinel.core.model.Incident;
import com.fleetsentinel.core.model.IncidentStatus;
import com.fleetsentinel.core.model.Insight;
import com.fleetsentinel.core.model.InsightSeverity;
import com.fleetsentinel.core.model.MetricType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Live, mutable state of one incident. Only touched under the grouper's
 * write lock; everything outside the grouper sees {@link Incident} snapshots.
 */
final class IncidentState {

    /** Incidents with at least this many insights gain one confidence level. */
    static final int CONFIDENCE_RAISE_SIZE = 3;

    private final String id;
    private final Insight rootCause;
    private final Instant createdAt;
    private final List<Insight> insights = new ArrayList<>();
    /** container id to display name, in order of first appearance. */
    private final Map<String, String> containers = new LinkedHashMap<>();
    private final Set<FailurePattern> patterns = EnumSet.noneOf(FailurePattern.class);
    private final Set<MetricType> metricTypes = EnumSet.noneOf(MetricType.class);

    private InsightSeverity severity;
    private ConfidenceLevel baseConfidence;
    private Instant lastActivity;
    private Instant updatedAt;
    private IncidentStatus status = IncidentStatus.ACTIVE;
    private Instant resolvedAt;

    IncidentState(String id, Insight rootCause, Instant now) {
        this.id = id;
        this.rootCause = rootCause;
        this.createdAt = now;
        this.updatedAt = now;
        this.severity = rootCause.getSeverity();
        this.baseConfidence = confidenceOf(rootCause);
        this.lastActivity = rootCause.getCreatedAt();
        track(rootCause);
    }

    void attach(Insight insight, Instant now) {
        track(insight);
        severity = severity.max(insight.getSeverity());
        baseConfidence = baseConfidence.max(confidenceOf(insight));
        if (insight.getCreatedAt().isAfter(lastActivity)) {
            lastActivity = insight.getCreatedAt();
        }
        updatedAt = now;
    }

    void resolve(Instant now) {
        status = IncidentStatus.RESOLVED;
        resolvedAt = now;
        updatedAt = now;
    }

    /**
     * HIGH for strongly correlated or critical insights, MEDIUM for
     * moderately correlated or warning insights, LOW otherwise.
     */
    static ConfidenceLevel confidenceOf(Insight insight) {
        CorrelationStrength strength = insight.getCorrelationStrength();
        if (strength == CorrelationStrength.STRONG || strength == CorrelationStrength.VERY_STRONG
                || insight.getSeverity() == InsightSeverity.CRITICAL) {
            return ConfidenceLevel.HIGH;
        }
        if (strength == CorrelationStrength.MODERATE || insight.getSeverity() == InsightSeverity.WARNING) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }

    ConfidenceLevel confidence() {
        return insights.size() >= CONFIDENCE_RAISE_SIZE ? baseConfidence.raise() : baseConfidence;
    }

    String correlationType() {
        return rootCause.getPattern().map(FailurePattern::getLabel).orElse(Incident.UNCLASSIFIED);
    }

    Incident snapshot() {
        List<String> related = new ArrayList<>(insights.size() - 1);
        for (Insight insight : insights) {
            if (!insight.getId().equals(rootCause.getId())) {
                related.add(insight.getId());
            }
        }
        return Incident.builder()
                .id(id)
                .title(IncidentNarrative.title(this))
                .severity(severity)
                .status(status)
                .rootCauseInsightId(rootCause.getId())
                .relatedInsightIds(related)
                .affectedContainers(new ArrayList<>(containers.values()))
                .endpointId(rootCause.getEndpointId())
                .endpointName(rootCause.getEndpointName())
                .correlationType(correlationType())
                .correlationConfidence(confidence())
                .summary(IncidentNarrative.summary(this))
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .resolvedAt(resolvedAt)
                .build();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    String getId() {
        return id;
    }

    Insight getRootCause() {
        return rootCause;
    }

    List<Insight> getInsights() {
        return insights;
    }

    boolean hasContainer(String containerId) {
        return containers.containsKey(containerId);
    }

    Map<String, String> getContainers() {
        return containers;
    }

    Set<FailurePattern> getPatterns() {
        return patterns;
    }

    Set<MetricType> getMetricTypes() {
        return metricTypes;
    }

    Integer getEndpointId() {
        return rootCause.getEndpointId();
    }

    String getEndpointName() {
        return rootCause.getEndpointName();
    }

    Instant getLastActivity() {
        return lastActivity;
    }

    Instant getResolvedAt() {
        return resolvedAt;
    }

    boolean isActive() {
        return status == IncidentStatus.ACTIVE;
    }

    private void track(Insight insight) {
        insights.add(insight);
        if (insight.getContainerId() != null) {
            containers.putIfAbsent(insight.getContainerId(),
                    insight.getContainerName() != null ? insight.getContainerName() : insight.getContainerId());
        }
        insight.getPattern().ifPresent(patterns::add);
        if (insight.getMetricType() != null) {
            metricTypes.add(insight.getMetricType());
        }
    }
}
