package com.fleetsentinel.core.incident;

import com.fleetsentinel.core.model.Incident;

import java.util.List;

/**
 * Result of grouping one batch of insights.
 *
 * @since 1.0.0
 */
public final class GroupingOutcome {

    private static final GroupingOutcome EMPTY = new GroupingOutcome(0, 0, 0, List.of());

    private final int incidentsCreated;
    private final int insightsAttached;
    private final int insightsSkipped;
    private final List<Incident> affectedIncidents;

    GroupingOutcome(int incidentsCreated, int insightsAttached, int insightsSkipped,
                    List<Incident> affectedIncidents) {
        this.incidentsCreated = incidentsCreated;
        this.insightsAttached = insightsAttached;
        this.insightsSkipped = insightsSkipped;
        this.affectedIncidents = List.copyOf(affectedIncidents);
    }

    public static GroupingOutcome empty() {
        return EMPTY;
    }

    /** @return incidents opened by this batch */
    public int getIncidentsCreated() {
        return incidentsCreated;
    }

    /** @return insights that joined an incident instead of opening one */
    public int getInsightsAttached() {
        return insightsAttached;
    }

    /** @return insights ignored because they were already grouped */
    public int getInsightsSkipped() {
        return insightsSkipped;
    }

    /** @return snapshots of every incident created or changed, in first-touch order */
    public List<Incident> getAffectedIncidents() {
        return affectedIncidents;
    }

    @Override
    public String toString() {
        return "GroupingOutcome{" +
                "incidentsCreated=" + incidentsCreated +
                ", insightsAttached=" + insightsAttached +
                ", insightsSkipped=" + insightsSkipped +
                ", affectedIncidents=" + affectedIncidents.size() +
                '}';
    }
}
