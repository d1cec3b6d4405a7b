package com.fleetsentinel.core.model;

import java.util.Locale;

/**
 * Anomaly detection strategies.
 *
 * <ul>
 * <li>{@code zscore}: flag when |z| exceeds the threshold</li>
 * <li>{@code bollinger}: flag when the value leaves mean ± k·σ</li>
 * <li>{@code adaptive}: z-score whose threshold widens on trending windows</li>
 * <li>{@code isolation-forest}: multivariate CPU/memory Isolation Forest</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum DetectionMethod {

    ZSCORE("zscore"),
    BOLLINGER("bollinger"),
    ADAPTIVE("adaptive"),
    ISOLATION_FOREST("isolation-forest");

    private final String wireName;

    DetectionMethod(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * @return {@code true} for the window-statistics strategies
     */
    public boolean isStatistical() {
        return this != ISOLATION_FOREST;
    }

    /**
     * Resolve a method from its wire name (case-insensitive).
     *
     * @param name wire name
     * @return the matching method
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DetectionMethod fromWireName(String name) {
        if (name != null) {
            String normalised = name.trim().toLowerCase(Locale.ROOT);
            for (DetectionMethod method : values()) {
                if (method.wireName.equals(normalised)) {
                    return method;
                }
            }
        }
        throw new IllegalArgumentException("Unknown detection method: '" + name
                + "'. Supported: zscore, bollinger, adaptive, isolation-forest");
    }

    @Override
    public String toString() {
        return wireName;
    }
}
