package com.fleetsentinel.core.incident;

import com.fleetsentinel.core.model.Incident;
import com.fleetsentinel.core.model.Insight;
import com.fleetsentinel.core.model.InsightSeverity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Rule-based titles and summaries for incidents.
 */
final class IncidentNarrative {

    /** Above this many containers a cascade title shows a count instead of names. */
    static final int MAX_NAMED_CONTAINERS = 3;

    private IncidentNarrative() {
    }

    static String title(IncidentState incident) {
        List<Insight> insights = incident.getInsights();
        Collection<String> names = incident.getContainers().values();

        if (insights.size() == 1) {
            return incident.getRootCause().getTitle();
        }
        if (names.size() == 1) {
            return "Multiple anomalies on \"" + names.iterator().next() + "\"";
        }
        if (names.size() > 1) {
            if (names.size() <= MAX_NAMED_CONTAINERS) {
                return "Cascade anomaly affecting " + String.join(", ", names);
            }
            String endpoint = incident.getEndpointName();
            return "Cascade anomaly affecting " + names.size() + " containers"
                    + (endpoint != null ? " on " + endpoint : "");
        }
        String endpoint = incident.getEndpointName() != null ? incident.getEndpointName() : "unknown endpoint";
        return "Correlated anomalies on " + endpoint + " (" + insights.size() + " alerts)";
    }

    static String summary(IncidentState incident) {
        List<Insight> insights = incident.getInsights();
        List<String> parts = new ArrayList<>();

        if (insights.size() == 1) {
            parts.add("Anomaly detected: " + incident.getRootCause().getTitle() + ".");
        } else if (incident.getContainers().size() > 1) {
            parts.add("Cascade detected: " + incident.getContainers().size()
                    + " containers showing anomalous behavior simultaneously.");
            parts.add("Likely root cause: " + incident.getRootCause().getTitle() + ".");
        } else {
            parts.add(insights.size() + " related anomalies detected within the correlation window.");
        }

        String type = incident.correlationType();
        if (!Incident.UNCLASSIFIED.equals(type)) {
            parts.add("Pattern: " + type + ".");
        }

        long critical = insights.stream().filter(i -> i.getSeverity() == InsightSeverity.CRITICAL).count();
        long warning = insights.stream().filter(i -> i.getSeverity() == InsightSeverity.WARNING).count();
        if (critical > 0 || warning > 0) {
            parts.add("Severity breakdown: " + critical + " critical, " + warning + " warning.");
        }
        return String.join(" ", parts);
    }
}
