package org.tanzu.openstackmcp.inventory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A Nova hypervisor with its capacity counters. Counters missing from the service
 * response are zero.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HypervisorRecord implements ResourceRecord {
    private final String id;
    private final String hypervisorHostname;
    private final String serviceHost;
    private final String state;
    private final String status;
    private final long vcpus;
    private final long vcpusUsed;
    private final long memoryMb;
    private final long memoryMbUsed;
    private final long localGb;
    private final long localGbUsed;
    private final long freeRamMb;
    private final long freeDiskGb;
    private final long runningVms;
    private final String hypervisorType;
    private final Long hypervisorVersion;

    public HypervisorRecord(String id, String hypervisorHostname, String serviceHost, String state, String status,
                            long vcpus, long vcpusUsed, long memoryMb, long memoryMbUsed,
                            long localGb, long localGbUsed, long freeRamMb, long freeDiskGb,
                            long runningVms, String hypervisorType, Long hypervisorVersion) {
        this.id = id;
        this.hypervisorHostname = hypervisorHostname;
        this.serviceHost = serviceHost;
        this.state = state;
        this.status = status;
        this.vcpus = vcpus;
        this.vcpusUsed = vcpusUsed;
        this.memoryMb = memoryMb;
        this.memoryMbUsed = memoryMbUsed;
        this.localGb = localGb;
        this.localGbUsed = localGbUsed;
        this.freeRamMb = freeRamMb;
        this.freeDiskGb = freeDiskGb;
        this.runningVms = runningVms;
        this.hypervisorType = hypervisorType;
        this.hypervisorVersion = hypervisorVersion;
    }

    @Override
    public String getId() { return id; }
    @Override
    @JsonIgnore
    public String getName() { return hypervisorHostname; }
    public String getHypervisorHostname() { return hypervisorHostname; }
    /** Host name of the nova-compute service, which is what servers report as their host. */
    public String getServiceHost() { return serviceHost; }
    /** up or down */
    public String getState() { return state; }
    /** enabled or disabled */
    public String getStatus() { return status; }
    public long getVcpus() { return vcpus; }
    public long getVcpusUsed() { return vcpusUsed; }
    public long getMemoryMb() { return memoryMb; }
    public long getMemoryMbUsed() { return memoryMbUsed; }
    public long getLocalGb() { return localGb; }
    public long getLocalGbUsed() { return localGbUsed; }
    public long getFreeRamMb() { return freeRamMb; }
    public long getFreeDiskGb() { return freeDiskGb; }
    public long getRunningVms() { return runningVms; }
    public String getHypervisorType() { return hypervisorType; }
    public Long getHypervisorVersion() { return hypervisorVersion; }

    @Override
    public String toString() {
        return "HypervisorRecord{id='" + id + "', hostname='" + hypervisorHostname + "', status='" + status +
               "', vcpus=" + vcpusUsed + "/" + vcpus + ", memoryMb=" + memoryMbUsed + "/" + memoryMb + "}";
    }
}
