package com.fleetsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Operator-facing finding built from a flagged {@link AnomalyDetection} and
 * the container's {@link CorrelationResult}.
 *
 * <p>
 * Insights are immutable; once handed to the caller they are the caller's
 * to persist and acknowledge.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code severity}, {@code title} and
 * {@code createdAt} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class Insight {

    /** Category for insights raised by anomaly detection. */
    public static final String CATEGORY_ANOMALY = "anomaly";

    private final String id;
    private final InsightSeverity severity;
    private final String category;
    private final String title;
    private final String description;
    private final String suggestedAction;
    private final String containerId;
    private final String containerName;
    private final Integer endpointId;
    private final String endpointName;
    private final MetricType metricType;
    private final DetectionMethod method;
    private final FailurePattern pattern;
    private final double compositeScore;
    private final CorrelationStrength correlationStrength;
    private final Instant createdAt;
    private final boolean acknowledged;

    private Insight(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.category = b.category != null ? b.category : CATEGORY_ANOMALY;
        this.title = Objects.requireNonNull(b.title, "title must not be null");
        this.description = b.description;
        this.suggestedAction = b.suggestedAction;
        this.containerId = b.containerId;
        this.containerName = b.containerName;
        this.endpointId = b.endpointId;
        this.endpointName = b.endpointName;
        this.metricType = b.metricType;
        this.method = b.method;
        this.pattern = b.pattern;
        this.compositeScore = b.compositeScore;
        this.correlationStrength = b.correlationStrength != null
                ? b.correlationStrength
                : CorrelationStrength.WEAK;
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt must not be null");
        this.acknowledged = b.acknowledged;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public InsightSeverity getSeverity() {
        return severity;
    }

    public String getCategory() {
        return category;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getSuggestedAction() {
        return suggestedAction;
    }

    public String getContainerId() {
        return containerId;
    }

    public String getContainerName() {
        return containerName;
    }

    public Integer getEndpointId() {
        return endpointId;
    }

    public String getEndpointName() {
        return endpointName;
    }

    public MetricType getMetricType() {
        return metricType;
    }

    public DetectionMethod getMethod() {
        return method;
    }

    @JsonIgnore
    public Optional<FailurePattern> getPattern() {
        return Optional.ofNullable(pattern);
    }

    @JsonProperty("pattern")
    public String getPatternLabel() {
        return pattern != null ? pattern.getLabel() : null;
    }

    public double getCompositeScore() {
        return compositeScore;
    }

    public CorrelationStrength getCorrelationStrength() {
        return correlationStrength;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isAcknowledged() {
        return acknowledged;
    }

    /**
     * Fluent builder for {@link Insight}.
     */
    public static class Builder {
        private String id;
        private InsightSeverity severity;
        private String category;
        private String title;
        private String description;
        private String suggestedAction;
        private String containerId;
        private String containerName;
        private Integer endpointId;
        private String endpointName;
        private MetricType metricType;
        private DetectionMethod method;
        private FailurePattern pattern;
        private double compositeScore;
        private CorrelationStrength correlationStrength;
        private Instant createdAt;
        private boolean acknowledged;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder severity(InsightSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder suggestedAction(String suggestedAction) {
            this.suggestedAction = suggestedAction;
            return this;
        }

        public Builder containerId(String containerId) {
            this.containerId = containerId;
            return this;
        }

        public Builder containerName(String containerName) {
            this.containerName = containerName;
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

        public Builder metricType(MetricType metricType) {
            this.metricType = metricType;
            return this;
        }

        public Builder method(DetectionMethod method) {
            this.method = method;
            return this;
        }

        public Builder pattern(FailurePattern pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder compositeScore(double compositeScore) {
            this.compositeScore = compositeScore;
            return this;
        }

        public Builder correlationStrength(CorrelationStrength correlationStrength) {
            this.correlationStrength = correlationStrength;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder acknowledged(boolean acknowledged) {
            this.acknowledged = acknowledged;
            return this;
        }

        /**
         * @return a new {@link Insight}
         * @throws NullPointerException if a required field is missing
         */
        public Insight build() {
            return new Insight(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Insight that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Insight{" +
                "id='" + id + '\'' +
                ", severity=" + severity +
                ", title='" + title + '\'' +
                ", containerId='" + containerId + '\'' +
                ", pattern=" + pattern +
                ", createdAt=" + createdAt +
                '}';
    }
}
