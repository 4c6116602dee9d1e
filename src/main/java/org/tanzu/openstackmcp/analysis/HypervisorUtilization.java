package org.tanzu.openstackmcp.analysis;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Utilization of a single hypervisor host.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HypervisorUtilization {

    private final String hypervisor;
    private final String status;
    private final long runningVms;
    private final CapacityMetric cpu;
    private final CapacityMetric memoryMb;
    private final CapacityMetric diskGb;
    private final boolean highUtilization;

    public HypervisorUtilization(String hypervisor, String status, long runningVms, CapacityMetric cpu,
                                 CapacityMetric memoryMb, CapacityMetric diskGb, boolean highUtilization) {
        this.hypervisor = hypervisor;
        this.status = status;
        this.runningVms = runningVms;
        this.cpu = cpu;
        this.memoryMb = memoryMb;
        this.diskGb = diskGb;
        this.highUtilization = highUtilization;
    }

    public String getHypervisor() { return hypervisor; }
    public String getStatus() { return status; }
    public long getRunningVms() { return runningVms; }
    public CapacityMetric getCpu() { return cpu; }
    public CapacityMetric getMemoryMb() { return memoryMb; }
    public CapacityMetric getDiskGb() { return diskGb; }
    public boolean isHighUtilization() { return highUtilization; }
}
