package com.fleetsentinel.core.incident;

import com.fleetsentinel.core.config.IncidentSettings;
import com.fleetsentinel.core.model.Incident;
import com.fleetsentinel.core.model.Insight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Clusters insights into incidents.
 *
 * <h3>Grouping</h3>
 * <p>
 * A batch is processed most severe first, then oldest first, so the first
 * insight to open an incident is its most plausible root cause. Each insight
 * is scored against every active incident with {@link IncidentSimilarity};
 * it joins the best-scoring one when that score reaches the similarity
 * threshold and opens a new incident otherwise. An insight that is already
 * part of an active incident is skipped, so re-submitting a batch is
 * harmless.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * Incidents stay active until {@link #resolve(String)} is called. Nothing
 * here resolves an incident on its own.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Writers ({@link #group}, {@link #resolve}) are serialised by a write lock;
 * readers get immutable snapshots.
 * </p>
 *
 * @since 1.0.0
 */
public class IncidentGrouper {

    private static final Logger LOG = LoggerFactory.getLogger(IncidentGrouper.class);

    /** Critical first, then oldest first. */
    static final Comparator<Insight> ROOT_CAUSE_ORDER = Comparator
            .comparing((Insight i) -> i.getSeverity().getRank(), Comparator.reverseOrder())
            .thenComparing(Insight::getCreatedAt);

    private final double similarityThreshold;
    private final Duration correlationWindow;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, IncidentState> active = new LinkedHashMap<>();
    private final Map<String, IncidentState> resolved = new HashMap<>();
    /** insight id to active incident id. */
    private final Map<String, String> insightIndex = new HashMap<>();

    /**
     * @param settings    validated incident settings
     * @param clock       time source for created/updated/resolved stamps
     * @param idGenerator incident id source
     */
    public IncidentGrouper(IncidentSettings settings, Clock clock, Supplier<String> idGenerator) {
        Objects.requireNonNull(settings, "IncidentSettings must not be null");
        this.similarityThreshold = settings.getSimilarityThreshold();
        this.correlationWindow = settings.correlationWindow();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
    }

    public IncidentGrouper(IncidentSettings settings) {
        this(settings, Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    // ---------------------------------------------------------------
    // Writers
    // ---------------------------------------------------------------

    /**
     * Group one batch of insights.
     *
     * @param insights insights produced by one detection cycle; {@code null}
     *                 entries are ignored
     * @return counts and snapshots of the incidents touched
     */
    public GroupingOutcome group(Collection<Insight> insights) {
        if (insights == null || insights.isEmpty()) {
            return GroupingOutcome.empty();
        }

        List<Insight> ordered = new ArrayList<>(insights.size());
        for (Insight insight : insights) {
            if (insight != null) {
                ordered.add(insight);
            }
        }
        ordered.sort(ROOT_CAUSE_ORDER);

        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            Map<String, IncidentState> touched = new LinkedHashMap<>();
            int created = 0;
            int attached = 0;
            int skipped = 0;

            for (Insight insight : ordered) {
                if (insightIndex.containsKey(insight.getId())) {
                    LOG.debug("Insight [{}] already grouped into incident [{}]",
                            insight.getId(), insightIndex.get(insight.getId()));
                    skipped++;
                    continue;
                }

                Optional<IncidentState> match = bestMatch(insight);
                IncidentState incident;
                if (match.isPresent()) {
                    incident = match.get();
                    incident.attach(insight, now);
                    attached++;
                } else {
                    incident = new IncidentState(idGenerator.get(), insight, now);
                    active.put(incident.getId(), incident);
                    created++;
                    LOG.info("Opened incident [{}] with root cause [{}]: {}",
                            incident.getId(), insight.getId(), insight.getTitle());
                }
                insightIndex.put(insight.getId(), incident.getId());
                touched.put(incident.getId(), incident);
            }

            List<Incident> snapshots = new ArrayList<>(touched.size());
            for (IncidentState state : touched.values()) {
                snapshots.add(state.snapshot());
            }
            GroupingOutcome outcome = new GroupingOutcome(created, attached, skipped, snapshots);
            LOG.info("Grouped {} insight(s): {} incident(s) opened, {} insight(s) attached, {} active",
                    ordered.size(), created, attached, active.size());
            return outcome;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Mark an incident resolved and remove it from the active set.
     *
     * @param incidentId incident to resolve
     * @return the resolved snapshot, or empty if no active incident has that id
     */
    public Optional<Incident> resolve(String incidentId) {
        Objects.requireNonNull(incidentId, "incidentId must not be null");
        lock.writeLock().lock();
        try {
            IncidentState incident = active.remove(incidentId);
            if (incident == null) {
                return Optional.empty();
            }
            incident.resolve(clock.instant());
            for (Insight insight : incident.getInsights()) {
                insightIndex.remove(insight.getId());
            }
            resolved.put(incidentId, incident);
            LOG.info("Resolved incident [{}] ({} insight(s))", incidentId, incident.getInsights().size());
            return Optional.of(incident.snapshot());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Forget resolved incidents resolved before {@code cutoff}.
     *
     * @param cutoff resolution time limit
     * @return number of incidents forgotten
     */
    public int evictResolvedBefore(Instant cutoff) {
        lock.writeLock().lock();
        try {
            int before = resolved.size();
            resolved.values().removeIf(i -> i.getResolvedAt().isBefore(cutoff));
            return before - resolved.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------
    // Readers
    // ---------------------------------------------------------------

    /**
     * @return snapshots of all active incidents, oldest first
     */
    public List<Incident> getActiveIncidents() {
        lock.readLock().lock();
        try {
            List<Incident> snapshots = new ArrayList<>(active.size());
            for (IncidentState state : active.values()) {
                snapshots.add(state.snapshot());
            }
            return snapshots;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param incidentId incident to look up, active or resolved
     * @return a snapshot, or empty if unknown
     */
    public Optional<Incident> getIncident(String incidentId) {
        lock.readLock().lock();
        try {
            IncidentState state = active.get(incidentId);
            if (state == null) {
                state = resolved.get(incidentId);
            }
            return state != null ? Optional.of(state.snapshot()) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public Duration getCorrelationWindow() {
        return correlationWindow;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<IncidentState> bestMatch(Insight insight) {
        IncidentState best = null;
        double bestScore = 0.0;
        for (IncidentState candidate : active.values()) {
            double score = IncidentSimilarity.score(insight, candidate, correlationWindow);
            if (score >= similarityThreshold && score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        if (best != null) {
            LOG.debug("Insight [{}] matches incident [{}] with similarity {}",
                    insight.getId(), best.getId(), bestScore);
        }
        return Optional.ofNullable(best);
    }
}
