package org.tanzu.openstackmcp.analysis;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Aggregate compute capacity of a set of hypervisors.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CapacitySummary {

    private final CapacityMetric vcpus;
    private final CapacityMetric memoryMb;
    private final CapacityMetric localStorageGb;

    public CapacitySummary(CapacityMetric vcpus, CapacityMetric memoryMb, CapacityMetric localStorageGb) {
        this.vcpus = vcpus;
        this.memoryMb = memoryMb;
        this.localStorageGb = localStorageGb;
    }

    public CapacityMetric getVcpus() { return vcpus; }
    public CapacityMetric getMemoryMb() { return memoryMb; }
    public CapacityMetric getLocalStorageGb() { return localStorageGb; }
}
