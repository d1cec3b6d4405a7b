package com.fleetsentinel.core.detection;

import com.fleetsentinel.core.model.MetricType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Suppresses repeated anomaly flags for the same container and metric.
 *
 * <p>
 * {@link #tryAcquire(String)} succeeds at most once per key per cooldown
 * period. Keys are usually built with {@link #key(String, MetricType)}; a
 * suffix separates independent flag sources on the same metric. A zero
 * cooldown disables suppression.
 * </p>
 *
 * <p>
 * Check-and-stamp is a single atomic {@link ConcurrentHashMap#compute}, so
 * two threads racing on one key cannot both acquire it. The tracker only
 * gates flags; it never changes a detection's anomalous verdict.
 * </p>
 *
 * @since 1.0.0
 */
public class CooldownTracker {

    private static final Logger LOG = LoggerFactory.getLogger(CooldownTracker.class);

    private final Duration cooldown;
    private final Clock clock;
    private final Map<String, Instant> lastFlagged = new ConcurrentHashMap<>();

    /**
     * @param cooldown suppression period; zero disables suppression
     * @param clock    time source
     * @throws IllegalArgumentException if {@code cooldown} is negative
     */
    public CooldownTracker(Duration cooldown, Clock clock) {
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative, got: " + cooldown);
        }
    }

    public static String key(String containerId, MetricType metricType) {
        return containerId + ":" + metricType.getWireName();
    }

    public static String key(String containerId, MetricType metricType, String suffix) {
        return key(containerId, metricType) + ":" + suffix;
    }

    /**
     * Claim the flag for {@code key}.
     *
     * @param key cooldown key
     * @return {@code true} if no flag fired for the key within the cooldown;
     *         the key is stamped with the current time in that case
     */
    public boolean tryAcquire(String key) {
        Objects.requireNonNull(key, "key must not be null");
        if (cooldown.isZero()) {
            return true;
        }

        Instant now = clock.instant();
        AtomicBoolean acquired = new AtomicBoolean(false);
        lastFlagged.compute(key, (k, last) -> {
            if (last == null || !now.isBefore(last.plus(cooldown))) {
                acquired.set(true);
                return now;
            }
            return last;
        });

        if (!acquired.get()) {
            LOG.debug("Flag for [{}] suppressed by cooldown", key);
        }
        return acquired.get();
    }

    /**
     * Remove keys whose cooldown has elapsed.
     *
     * @return number of keys removed
     */
    public int sweepExpired() {
        Instant cutoff = clock.instant().minus(cooldown);
        int before = lastFlagged.size();
        lastFlagged.entrySet().removeIf(e -> !e.getValue().isAfter(cutoff));
        return Math.max(0, before - lastFlagged.size());
    }

    public void reset() {
        lastFlagged.clear();
    }

    public int size() {
        return lastFlagged.size();
    }

    public Duration getCooldown() {
        return cooldown;
    }
}
