package com.fleetsentinel.core.model;

/**
 * Named failure patterns recognised from a container's (CPU, memory) score
 * pair.
 *
 * @since 1.0.0
 */
public enum FailurePattern {

    RESOURCE_EXHAUSTION("Resource Exhaustion",
            "Both CPU and memory are elevated, suggesting a resource-intensive workload "
                    + "or memory leak with CPU thrashing"),

    MEMORY_LEAK("Memory Leak",
            "Memory usage is elevated while CPU remains normal, suggesting gradual memory accumulation"),

    CPU_SPIKE("CPU Spike",
            "CPU usage is elevated while memory remains stable, suggesting a compute-intensive "
                    + "operation or busy loop");

    private final String label;
    private final String description;

    FailurePattern(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    /**
     * CPU- or memory-driven patterns are related to resource exhaustion,
     * which combines both.
     *
     * @param other pattern to compare with
     * @return {@code true} if the patterns differ but share a resource
     */
    public boolean isRelatedTo(FailurePattern other) {
        if (other == null || other == this) {
            return false;
        }
        return this == RESOURCE_EXHAUSTION || other == RESOURCE_EXHAUSTION;
    }

    @Override
    public String toString() {
        return label;
    }
}
