package com.fleetsentinel.core.stats;

import com.fleetsentinel.core.model.MetricSample;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Pairs two metric series of the same container by timestamp.
 *
 * <p>
 * CPU and memory are sampled together but stored as separate rows whose
 * timestamps can differ by a few milliseconds, so samples are matched on
 * their timestamp truncated to the second. When a series holds several
 * samples in the same second the latest one wins. Pairs with a non-finite
 * member are dropped.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesAlignment {

    private SeriesAlignment() {
    }

    /**
     * @param first  first series, ascending
     * @param second second series, ascending
     * @return {@code [firstValue, secondValue]} pairs keyed and ordered by
     *         second; unmodifiable
     */
    public static NavigableMap<Instant, double[]> alignBySecond(List<MetricSample> first,
                                                                List<MetricSample> second) {
        if (first == null || second == null || first.isEmpty() || second.isEmpty()) {
            return Collections.emptyNavigableMap();
        }

        Map<Instant, Double> firstBySecond = new HashMap<>();
        for (MetricSample s : first) {
            if (s.isFinite()) {
                firstBySecond.put(truncate(s.getTimestamp()), s.getValue());
            }
        }

        NavigableMap<Instant, double[]> pairs = new TreeMap<>();
        for (MetricSample s : second) {
            if (!s.isFinite()) {
                continue;
            }
            Instant key = truncate(s.getTimestamp());
            Double match = firstBySecond.get(key);
            if (match != null) {
                pairs.put(key, new double[]{match, s.getValue()});
            }
        }
        return Collections.unmodifiableNavigableMap(pairs);
    }

    private static Instant truncate(Instant timestamp) {
        return timestamp.truncatedTo(ChronoUnit.SECONDS);
    }
}
