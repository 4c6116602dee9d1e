package org.tanzu.openstackmcp.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Placement and sizing of one server.
 *
 * {@code resource_allocation} and {@code host_analysis} serialize as empty objects when
 * the flavor or the hosting hypervisor could not be resolved.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ServerAnalysis {

    private final ServerInfo serverInfo;
    private final ResourceAllocation resourceAllocation;
    private final HostAnalysis hostAnalysis;
    private final ResourceHealth healthStatus;

    public ServerAnalysis(ServerInfo serverInfo, ResourceAllocation resourceAllocation,
                          HostAnalysis hostAnalysis, ResourceHealth healthStatus) {
        this.serverInfo = serverInfo;
        this.resourceAllocation = resourceAllocation;
        this.hostAnalysis = hostAnalysis;
        this.healthStatus = healthStatus;
    }

    public ServerInfo getServerInfo() { return serverInfo; }
    public ResourceAllocation getResourceAllocation() { return resourceAllocation; }
    public HostAnalysis getHostAnalysis() { return hostAnalysis; }
    public ResourceHealth getHealthStatus() { return healthStatus; }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ServerInfo {
        private final String id;
        private final String name;
        private final String status;
        private final String host;
        private final String created;

        public ServerInfo(String id, String name, String status, String host, String created) {
            this.id = id;
            this.name = name;
            this.status = status;
            this.host = host;
            this.created = created;
        }

        public String getId() { return id; }
        public String getName() { return name; }
        public String getStatus() { return status; }
        public String getHost() { return host; }
        public String getCreated() { return created; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ResourceAllocation {
        static final ResourceAllocation UNRESOLVED = new ResourceAllocation(null, null, null, null);

        private final Long vcpus;
        private final Long ramMb;
        private final Long diskGb;
        private final Long ephemeralGb;

        public ResourceAllocation(Long vcpus, Long ramMb, Long diskGb, Long ephemeralGb) {
            this.vcpus = vcpus;
            this.ramMb = ramMb;
            this.diskGb = diskGb;
            this.ephemeralGb = ephemeralGb;
        }

        public Long getVcpus() { return vcpus; }
        public Long getRamMb() { return ramMb; }
        public Long getDiskGb() { return diskGb; }
        public Long getEphemeralGb() { return ephemeralGb; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class HostAnalysis {
        static final HostAnalysis UNRESOLVED = new HostAnalysis(null, null, null, null, null, null, null, null);

        private final String hypervisor;
        private final String hypervisorStatus;
        private final String hypervisorState;
        private final Long totalVcpus;
        private final Long usedVcpus;
        private final Long totalMemoryMb;
        private final Long usedMemoryMb;
        private final Long runningVms;

        public HostAnalysis(String hypervisor, String hypervisorStatus, String hypervisorState,
                            Long totalVcpus, Long usedVcpus, Long totalMemoryMb, Long usedMemoryMb, Long runningVms) {
            this.hypervisor = hypervisor;
            this.hypervisorStatus = hypervisorStatus;
            this.hypervisorState = hypervisorState;
            this.totalVcpus = totalVcpus;
            this.usedVcpus = usedVcpus;
            this.totalMemoryMb = totalMemoryMb;
            this.usedMemoryMb = usedMemoryMb;
            this.runningVms = runningVms;
        }

        public String getHypervisor() { return hypervisor; }
        public String getHypervisorStatus() { return hypervisorStatus; }
        public String getHypervisorState() { return hypervisorState; }
        public Long getTotalVcpus() { return totalVcpus; }
        public Long getUsedVcpus() { return usedVcpus; }
        public Long getTotalMemoryMb() { return totalMemoryMb; }
        public Long getUsedMemoryMb() { return usedMemoryMb; }
        public Long getRunningVms() { return runningVms; }
    }
}
