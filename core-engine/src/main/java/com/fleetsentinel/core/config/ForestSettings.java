package com.fleetsentinel.core.config;

import java.time.Duration;
import java.util.List;

/**
 * Settings for the Isolation Forest detector.
 *
 * <pre>
 * isolationForest:
 *   enabled: true
 *   treeCount: 100
 *   sampleSize: 256
 *   contamination: 0.1
 *   retrainIntervalHours: 6
 *   minTrainingSamples: 50
 *   trainingWindowDays: 7
 * </pre>
 *
 * @since 1.0.0
 */
public class ForestSettings {

    private boolean enabled = true;
    private int treeCount = 100;
    private int sampleSize = 256;
    private double contamination = 0.1;
    private long retrainIntervalHours = 6;
    private int minTrainingSamples = 50;
    private long trainingWindowDays = 7;

    void validate(List<String> errors) {
        if (treeCount < 1) {
            errors.add("isolationForest.treeCount must be >= 1, got: " + treeCount);
        }
        if (sampleSize < 2) {
            errors.add("isolationForest.sampleSize must be >= 2, got: " + sampleSize);
        }
        if (!(contamination > 0 && contamination < 0.5)) {
            errors.add("isolationForest.contamination must be in (0, 0.5), got: " + contamination);
        }
        if (retrainIntervalHours < 1) {
            errors.add("isolationForest.retrainIntervalHours must be >= 1, got: " + retrainIntervalHours);
        }
        if (minTrainingSamples < 2) {
            errors.add("isolationForest.minTrainingSamples must be >= 2, got: " + minTrainingSamples);
        }
        if (trainingWindowDays < 1) {
            errors.add("isolationForest.trainingWindowDays must be >= 1, got: " + trainingWindowDays);
        }
    }

    public Duration retrainInterval() {
        return Duration.ofHours(retrainIntervalHours);
    }

    public Duration trainingWindow() {
        return Duration.ofDays(trainingWindowDays);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getTreeCount() {
        return treeCount;
    }

    public void setTreeCount(int treeCount) {
        this.treeCount = treeCount;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public long getRetrainIntervalHours() {
        return retrainIntervalHours;
    }

    public void setRetrainIntervalHours(long retrainIntervalHours) {
        this.retrainIntervalHours = retrainIntervalHours;
    }

    public int getMinTrainingSamples() {
        return minTrainingSamples;
    }

    public void setMinTrainingSamples(int minTrainingSamples) {
        this.minTrainingSamples = minTrainingSamples;
    }

    public long getTrainingWindowDays() {
        return trainingWindowDays;
    }

    public void setTrainingWindowDays(long trainingWindowDays) {
        this.trainingWindowDays = trainingWindowDays;
    }

    @Override
    public String toString() {
        return "ForestSettings{" +
                "enabled=" + enabled +
                ", treeCount=" + treeCount +
                ", sampleSize=" + sampleSize +
                ", contamination=" + contamination +
                ", retrainIntervalHours=" + retrainIntervalHours +
                ", minTrainingSamples=" + minTrainingSamples +
                ", trainingWindowDays=" + trainingWindowDays +
                '}';
    }
}
