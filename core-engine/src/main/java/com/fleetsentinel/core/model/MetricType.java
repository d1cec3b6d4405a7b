package com.fleetsentinel.core.model;

import java.util.Locale;

/**
 * Container metrics the engine understands.
 *
 * <p>
 * Each constant carries the wire name used by the time-series store and by
 * the JSON export.
 * </p>
 *
 * @since 1.0.0
 */
public enum MetricType {

    /** CPU utilisation, percent of the container's limit. */
    CPU("cpu"),

    /** Memory utilisation, percent of the container's limit. */
    MEMORY("memory"),

    /** Resident memory in bytes. */
    MEMORY_BYTES("memory_bytes");

    private final String wireName;

    MetricType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resolve a metric type from its wire name (case-insensitive).
     *
     * @param name wire name such as {@code cpu} or {@code memory_bytes}
     * @return the matching metric type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static MetricType fromWireName(String name) {
        if (name != null) {
            String normalised = name.trim().toLowerCase(Locale.ROOT);
            for (MetricType type : values()) {
                if (type.wireName.equals(normalised)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown metric type: '" + name
                + "'. Supported: cpu, memory, memory_bytes");
    }

    @Override
    public String toString() {
        return wireName;
    }
}
