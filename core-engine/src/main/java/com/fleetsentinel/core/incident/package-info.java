/**
 * Grouping of insights into incidents.
 *
 * <p>
 * {@link com.fleetsentinel.core.incident.IncidentGrouper} keeps the live
 * incidents and attaches each new insight to the most similar one, as scored
 * by {@link com.fleetsentinel.core.incident.IncidentSimilarity}.
 * </p>
 *
 * @since 1.0.0
 */
package com.fleetsentinel.core.incident;
