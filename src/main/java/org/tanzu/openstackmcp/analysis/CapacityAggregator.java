package org.tanzu.openstackmcp.analysis;

import org.springframework.stereotype.Component;
import org.tanzu.openstackmcp.inventory.HypervisorRecord;
import org.tanzu.openstackmcp.inventory.ResourceRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Sums hypervisor capacity and computes utilization.
 */
@Component
public class CapacityAggregator {

    /** vCPU usage ratio above which a single host counts as highly utilized */
    static final double HIGH_UTILIZATION_RATIO = 0.8;

    public CapacitySummary aggregate(Collection<HypervisorRecord> hypervisors) {
        long totalVcpus = 0;
        long usedVcpus = 0;
        long totalMemory = 0;
        long usedMemory = 0;
        long totalDisk = 0;
        long usedDisk = 0;
        for (HypervisorRecord hypervisor : hypervisors) {
            totalVcpus += hypervisor.getVcpus();
            usedVcpus += hypervisor.getVcpusUsed();
            totalMemory += hypervisor.getMemoryMb();
            usedMemory += hypervisor.getMemoryMbUsed();
            totalDisk += hypervisor.getLocalGb();
            usedDisk += hypervisor.getLocalGbUsed();
        }
        return new CapacitySummary(
            CapacityMetric.of(totalVcpus, usedVcpus),
            CapacityMetric.of(totalMemory, usedMemory),
            CapacityMetric.of(totalDisk, usedDisk)
        );
    }

    public HypervisorUtilization utilizationOf(HypervisorRecord hypervisor) {
        return new HypervisorUtilization(
            hypervisor.getHypervisorHostname(),
            hypervisor.getStatus(),
            hypervisor.getRunningVms(),
            CapacityMetric.of(hypervisor.getVcpus(), hypervisor.getVcpusUsed()),
            CapacityMetric.of(hypervisor.getMemoryMb(), hypervisor.getMemoryMbUsed()),
            CapacityMetric.of(hypervisor.getLocalGb(), hypervisor.getLocalGbUsed()),
            isHighUtilization(hypervisor)
        );
    }

    /**
     * A host with no reported vCPUs is measured against one vCPU, so any usage flags it.
     */
    public boolean isHighUtilization(HypervisorRecord hypervisor) {
        double ratio = (double) hypervisor.getVcpusUsed() / Math.max(hypervisor.getVcpus(), 1);
        return ratio > HIGH_UTILIZATION_RATIO;
    }

    /**
     * Hosts are listed by hostname, or by id when the hostname is missing.
     */
    public List<String> highUtilizationHosts(Collection<HypervisorRecord> hypervisors) {
        List<String> hosts = new ArrayList<>();
        for (HypervisorRecord hypervisor : hypervisors) {
            if (isHighUtilization(hypervisor)) {
                hosts.add(ResourceRecord.displayName(hypervisor));
            }
        }
        return hosts;
    }
}
