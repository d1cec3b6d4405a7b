package com.fleetsentinel.core.incident;

import com.fleetsentinel.core.model.FailurePattern;
import com.fleetsentinel.core.model.Insight;

import java.time.Duration;
import java.util.Optional;

/**
 * Similarity between an insight and an active incident, in [0, 1].
 *
 * <p>
 * An insight scores 0 when it is further than the correlation window from the
 * incident's last activity, or when it shares neither a container nor an
 * endpoint with the incident. Incidents therefore never span endpoints.
 * Otherwise the score adds up:
 * </p>
 * <table>
 * <caption>Similarity weights</caption>
 * <tr><th>Signal</th><th>Weight</th></tr>
 * <tr><td>same container</td><td>{@value #SAME_CONTAINER}</td></tr>
 * <tr><td>else same endpoint</td><td>{@value #SAME_ENDPOINT}</td></tr>
 * <tr><td>same failure pattern</td><td>{@value #SAME_PATTERN}</td></tr>
 * <tr><td>else related pattern</td><td>{@value #RELATED_PATTERN}</td></tr>
 * <tr><td>shared metric</td><td>{@value #SHARED_METRIC}</td></tr>
 * <tr><td>temporal proximity</td><td>up to {@value #TEMPORAL}, linear in age</td></tr>
 * </table>
 *
 * <p>
 * The sum is capped at 1.
 * </p>
 *
 * @since 1.0.0
 */
public final class IncidentSimilarity {

    public static final double SAME_CONTAINER = 0.4;
    public static final double SAME_ENDPOINT = 0.2;
    public static final double SAME_PATTERN = 0.3;
    public static final double RELATED_PATTERN = 0.15;
    public static final double SHARED_METRIC = 0.1;
    public static final double TEMPORAL = 0.2;

    private IncidentSimilarity() {
    }

    static double score(Insight insight, IncidentState incident, Duration window) {
        long ageMillis = Math.abs(Duration.between(incident.getLastActivity(), insight.getCreatedAt()).toMillis());
        long windowMillis = window.toMillis();
        if (windowMillis <= 0 || ageMillis > windowMillis) {
            return 0.0;
        }

        double score;
        if (insight.getContainerId() != null && incident.hasContainer(insight.getContainerId())) {
            score = SAME_CONTAINER;
        } else if (insight.getEndpointId() != null && insight.getEndpointId().equals(incident.getEndpointId())) {
            score = SAME_ENDPOINT;
        } else {
            return 0.0;
        }

        Optional<FailurePattern> pattern = insight.getPattern();
        if (pattern.isPresent()) {
            if (incident.getPatterns().contains(pattern.get())) {
                score += SAME_PATTERN;
            } else if (incident.getPatterns().stream().anyMatch(pattern.get()::isRelatedTo)) {
                score += RELATED_PATTERN;
            }
        }

        if (insight.getMetricType() != null && incident.getMetricTypes().contains(insight.getMetricType())) {
            score += SHARED_METRIC;
        }

        score += TEMPORAL * (1.0 - (double) ageMillis / windowMillis);
        return Math.min(1.0, score);
    }
}
