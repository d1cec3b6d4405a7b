package com.fleetsentinel.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every section and key is optional):
 * </p>
 *
 * <pre>
 * statistical:
 *   method: zscore
 *   threshold: 3.0
 * isolationForest:
 *   enabled: true
 *   treeCount: 100
 * incidents:
 *   similarityThreshold: 0.3
 * cycle:
 *   maxConcurrency: 4
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading. Detectors assume a validated
 * configuration and do not check it again.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig {

    private StatisticalSettings statistical = new StatisticalSettings();
    private ForestSettings isolationForest = new ForestSettings();
    private IncidentSettings incidents = new IncidentSettings();
    private CycleSettings cycle = new CycleSettings();

    /**
     * Validate every section.
     *
     * <p>
     * Collects all errors and throws a single exception if any value is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        statistical.validate(errors);
        isolationForest.validate(errors);
        incidents.validate(errors);
        cycle.validate(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public StatisticalSettings getStatistical() {
        return statistical;
    }

    public void setStatistical(StatisticalSettings statistical) {
        this.statistical = statistical != null ? statistical : new StatisticalSettings();
    }

    public ForestSettings getIsolationForest() {
        return isolationForest;
    }

    public void setIsolationForest(ForestSettings isolationForest) {
        this.isolationForest = isolationForest != null ? isolationForest : new ForestSettings();
    }

    public IncidentSettings getIncidents() {
        return incidents;
    }

    public void setIncidents(IncidentSettings incidents) {
        this.incidents = incidents != null ? incidents : new IncidentSettings();
    }

    public CycleSettings getCycle() {
        return cycle;
    }

    public void setCycle(CycleSettings cycle) {
        this.cycle = cycle != null ? cycle : new CycleSettings();
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "statistical=" + statistical +
                ", isolationForest=" + isolationForest +
                ", incidents=" + incidents +
                ", cycle=" + cycle +
                '}';
    }
}
