package com.fleetsentinel.core.forest;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A trained forest bound to the container it was trained for.
 *
 * @since 1.0.0
 */
public final class IsolationForestModel {

    private final String containerId;
    private final IsolationForest forest;
    private final Instant trainedAt;
    private final int trainingSize;

    public IsolationForestModel(String containerId, IsolationForest forest, Instant trainedAt, int trainingSize) {
        this.containerId = Objects.requireNonNull(containerId, "containerId must not be null");
        this.forest = Objects.requireNonNull(forest, "forest must not be null");
        this.trainedAt = Objects.requireNonNull(trainedAt, "trainedAt must not be null");
        this.trainingSize = trainingSize;
    }

    /**
     * @param now    current time
     * @param maxAge retrain interval
     * @return {@code true} if the model is at least {@code maxAge} old
     */
    public boolean isStale(Instant now, Duration maxAge) {
        return !now.isBefore(trainedAt.plus(maxAge));
    }

    public String getContainerId() {
        return containerId;
    }

    public IsolationForest getForest() {
        return forest;
    }

    public Instant getTrainedAt() {
        return trainedAt;
    }

    public int getTrainingSize() {
        return trainingSize;
    }

    @Override
    public String toString() {
        return "IsolationForestModel{" +
                "containerId='" + containerId + '\'' +
                ", trainedAt=" + trainedAt +
                ", trainingSize=" + trainingSize +
                ", cutoff=" + forest.getCutoff() +
                '}';
    }
}
