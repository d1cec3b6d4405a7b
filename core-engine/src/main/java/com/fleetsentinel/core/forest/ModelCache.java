package com.fleetsentinel.core.forest;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-container cache of trained models.
 *
 * <p>
 * Models are immutable and {@link #put} replaces the entry wholesale, so a
 * reader sees either the old model or the new one, never a half-built one.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelCache {

    private final Map<String, IsolationForestModel> models = new ConcurrentHashMap<>();

    public Optional<IsolationForestModel> get(String containerId) {
        return Optional.ofNullable(models.get(containerId));
    }

    public void put(IsolationForestModel model) {
        Objects.requireNonNull(model, "model must not be null");
        models.put(model.getContainerId(), model);
    }

    /**
     * Remove the container's model if it is still {@code expected}.
     *
     * @return {@code false} when the entry was replaced or removed meanwhile
     */
    public boolean invalidate(String containerId, IsolationForestModel expected) {
        return models.remove(containerId, expected);
    }

    public void clear() {
        models.clear();
    }

    public int size() {
        return models.size();
    }
}
