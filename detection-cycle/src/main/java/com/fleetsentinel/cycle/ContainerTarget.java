package com.fleetsentinel.cycle;

import java.util.Objects;

/**
 * A container to evaluate in a detection cycle, with the endpoint it runs on.
 *
 * @since 1.0.0
 */
public final class ContainerTarget {

    private final String containerId;
    private final String containerName;
    private final Integer endpointId;
    private final String endpointName;

    /**
     * @param containerId   container id; must not be {@code null}
     * @param containerName display name; the id is used when {@code null}
     * @param endpointId    endpoint id, may be {@code null}
     * @param endpointName  endpoint name, may be {@code null}
     */
    public ContainerTarget(String containerId, String containerName, Integer endpointId, String endpointName) {
        this.containerId = Objects.requireNonNull(containerId, "containerId must not be null");
        this.containerName = containerName != null ? containerName : containerId;
        this.endpointId = endpointId;
        this.endpointName = endpointName;
    }

    public static ContainerTarget of(String containerId, String containerName) {
        return new ContainerTarget(containerId, containerName, null, null);
    }

    public String getContainerId() {
        return containerId;
    }

    public String getContainerName() {
        return containerName;
    }

    public Integer getEndpointId() {
        return endpointId;
    }

    public String getEndpointName() {
        return endpointName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContainerTarget that)) {
            return false;
        }
        return containerId.equals(that.containerId)
                && containerName.equals(that.containerName)
                && Objects.equals(endpointId, that.endpointId)
                && Objects.equals(endpointName, that.endpointName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(containerId, containerName, endpointId, endpointName);
    }

    @Override
    public String toString() {
        return "ContainerTarget{" +
                "containerId='" + containerId + '\'' +
                ", containerName='" + containerName + '\'' +
                ", endpointId=" + endpointId +
                ", endpointName='" + endpointName + '\'' +
                '}';
    }
}
