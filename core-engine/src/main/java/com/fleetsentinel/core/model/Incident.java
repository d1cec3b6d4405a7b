package com.fleetsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Durable grouping of related {@link Insight}s believed to share one
 * underlying cause.
 *
 * <p>
 * Instances are immutable snapshots. The incident grouper owns the live
 * state and publishes a fresh snapshot each time an insight is attached or
 * the incident is resolved.
 * </p>
 *
 * <p>
 * {@link #getInsightCount()} is derived: the number of related insights plus
 * one when a root-cause insight is set.
 * </p>
 *
 * @since 1.0.0
 */
public final class Incident {

    /** Correlation type used when no failure pattern was identified. */
    public static final String UNCLASSIFIED = "unclassified";

    private final String id;
    private final String title;
    private final InsightSeverity severity;
    private final IncidentStatus status;
    private final String rootCauseInsightId;
    private final List<String> relatedInsightIds;
    private final List<String> affectedContainers;
    private final Integer endpointId;
    private final String endpointName;
    private final String correlationType;
    private final ConfidenceLevel correlationConfidence;
    private final String summary;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant resolvedAt;

    private Incident(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.title = Objects.requireNonNull(b.title, "title must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.status = Objects.requireNonNull(b.status, "status must not be null");
        this.rootCauseInsightId = b.rootCauseInsightId;
        this.relatedInsightIds = b.relatedInsightIds != null
                ? List.copyOf(b.relatedInsightIds)
                : Collections.emptyList();
        this.affectedContainers = b.affectedContainers != null
                ? List.copyOf(b.affectedContainers)
                : Collections.emptyList();
        this.endpointId = b.endpointId;
        this.endpointName = b.endpointName;
        this.correlationType = b.correlationType != null ? b.correlationType : UNCLASSIFIED;
        this.correlationConfidence = b.correlationConfidence != null
                ? b.correlationConfidence
                : ConfidenceLevel.LOW;
        this.summary = b.summary;
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt must not be null");
        this.updatedAt = b.updatedAt != null ? b.updatedAt : b.createdAt;
        this.resolvedAt = b.resolvedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public InsightSeverity getSeverity() {
        return severity;
    }

    public IncidentStatus getStatus() {
        return status;
    }

    public String getRootCauseInsightId() {
        return rootCauseInsightId;
    }

    public List<String> getRelatedInsightIds() {
        return relatedInsightIds;
    }

    public List<String> getAffectedContainers() {
        return affectedContainers;
    }

    public Integer getEndpointId() {
        return endpointId;
    }

    public String getEndpointName() {
        return endpointName;
    }

    public String getCorrelationType() {
        return correlationType;
    }

    public ConfidenceLevel getCorrelationConfidence() {
        return correlationConfidence;
    }

    @JsonProperty("insight_count")
    public int getInsightCount() {
        return relatedInsightIds.size() + (rootCauseInsightId != null ? 1 : 0);
    }

    public String getSummary() {
        return summary;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public boolean isActive() {
        return status == IncidentStatus.ACTIVE;
    }

    /**
     * Fluent builder for {@link Incident}.
     */
    public static class Builder {
        private String id;
        private String title;
        private InsightSeverity severity;
        private IncidentStatus status = IncidentStatus.ACTIVE;
        private String rootCauseInsightId;
        private List<String> relatedInsightIds;
        private List<String> affectedContainers;
        private Integer endpointId;
        private String endpointName;
        private String correlationType;
        private ConfidenceLevel correlationConfidence;
        private String summary;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant resolvedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder severity(InsightSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder status(IncidentStatus status) {
            this.status = status;
            return this;
        }

        public Builder rootCauseInsightId(String rootCauseInsightId) {
            this.rootCauseInsightId = rootCauseInsightId;
            return this;
        }

        public Builder relatedInsightIds(List<String> relatedInsightIds) {
            this.relatedInsightIds = relatedInsightIds;
            return this;
        }

        public Builder affectedContainers(List<String> affectedContainers) {
            this.affectedContainers = affectedContainers;
            return this;
        }

        public Builder endpointId(Integer endpointId) {
            this.endpointId = endpointId;
            return this;
        }

        public Builder endpointName(String endpointName) {
            this.endpointName = endpointName;
            return this;
        }

        public Builder correlationType(String correlationType) {
            this.correlationType = correlationType;
            return this;
        }

        public Builder correlationConfidence(ConfidenceLevel correlationConfidence) {
            this.correlationConfidence = correlationConfidence;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Incident build() {
            return new Incident(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Incident that))
            return false;
        return id.equals(that.id)
                && status == that.status
                && Objects.equals(updatedAt, that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status, updatedAt);
    }

    @Override
    public String toString() {
        return "Incident{" +
                "id='" + id + '\'' +
                ", title='" + title + '\'' +
                ", severity=" + severity +
                ", status=" + status +
                ", correlationType='" + correlationType + '\'' +
                ", correlationConfidence=" + correlationConfidence +
                ", insightCount=" + getInsightCount() +
                '}';
    }
}
