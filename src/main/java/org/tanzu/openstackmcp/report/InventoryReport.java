package org.tanzu.openstackmcp.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.tanzu.openstackmcp.analysis.CapacitySummary;
import org.tanzu.openstackmcp.analysis.Recommendation;
import org.tanzu.openstackmcp.inventory.Diagnostic;
import org.tanzu.openstackmcp.inventory.FlavorRecord;
import org.tanzu.openstackmcp.inventory.HypervisorRecord;
import org.tanzu.openstackmcp.inventory.NetworkRecord;
import org.tanzu.openstackmcp.inventory.RouterRecord;
import org.tanzu.openstackmcp.inventory.ServerRecord;
import org.tanzu.openstackmcp.inventory.SubnetRecord;
import org.tanzu.openstackmcp.inventory.VolumeRecord;
import org.tanzu.openstackmcp.inventory.VolumeTypeRecord;

import java.util.List;
import java.util.Map;

/**
 * Inventory of the whole cloud with utilization figures and recommendations.
 *
 * The {@code *_details} listings are null, and therefore absent from the JSON, unless
 * the report was generated in detailed format. A report that failed as a whole carries
 * only {@code error} and {@code timestamp}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"metadata", "summary", "compute", "storage", "networking", "resource_utilization", "recommendations"})
public class InventoryReport {

    private final Metadata metadata;
    private final Summary summary;
    private final Compute compute;
    private final Storage storage;
    private final Networking networking;
    private final ResourceUtilization resourceUtilization;
    private final List<Recommendation> recommendations;
    private final String error;
    private final String timestamp;

    public InventoryReport(Metadata metadata, Summary summary, Compute compute, Storage storage,
                           Networking networking, ResourceUtilization resourceUtilization,
                           List<Recommendation> recommendations) {
        this.metadata = metadata;
        this.summary = summary;
        this.compute = compute;
        this.storage = storage;
        this.networking = networking;
        this.resourceUtilization = resourceUtilization;
        this.recommendations = recommendations;
        this.error = null;
        this.timestamp = null;
    }

    private InventoryReport(String error, String timestamp) {
        this.metadata = null;
        this.summary = null;
        this.compute = null;
        this.storage = null;
        this.networking = null;
        this.resourceUtilization = null;
        this.recommendations = null;
        this.error = error;
        this.timestamp = timestamp;
    }

    public static InventoryReport failed(String error, String timestamp) {
        return new InventoryReport(error, timestamp);
    }

    public Metadata getMetadata() { return metadata; }
    public Summary getSummary() { return summary; }
    public Compute getCompute() { return compute; }
    public Storage getStorage() { return storage; }
    public Networking getNetworking() { return networking; }
    public ResourceUtilization getResourceUtilization() { return resourceUtilization; }
    public List<Recommendation> getRecommendations() { return recommendations; }
    public String getError() { return error; }
    public String getTimestamp() { return timestamp; }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Metadata {
        private final String generatedAt;
        private final ReportFormat format;
        private final List<String> openstackServices;
        private final List<Diagnostic> diagnostics;

        public Metadata(String generatedAt, ReportFormat format, List<String> openstackServices, List<Diagnostic> diagnostics) {
            this.generatedAt = generatedAt;
            this.format = format;
            this.openstackServices = openstackServices;
            this.diagnostics = diagnostics;
        }

        public String getGeneratedAt() { return generatedAt; }
        public ReportFormat getFormat() { return format; }
        public List<String> getOpenstackServices() { return openstackServices; }
        public List<Diagnostic> getDiagnostics() { return diagnostics; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Summary {
        private final Map<String, Integer> totalResources;
        private final Map<String, Integer> serverStatusBreakdown;
        private final Map<String, Integer> hypervisorStatusBreakdown;

        public Summary(Map<String, Integer> totalResources, Map<String, Integer> serverStatusBreakdown,
                       Map<String, Integer> hypervisorStatusBreakdown) {
            this.totalResources = totalResources;
            this.serverStatusBreakdown = serverStatusBreakdown;
            this.hypervisorStatusBreakdown = hypervisorStatusBreakdown;
        }

        public Map<String, Integer> getTotalResources() { return totalResources; }
        public Map<String, Integer> getServerStatusBreakdown() { return serverStatusBreakdown; }
        public Map<String, Integer> getHypervisorStatusBreakdown() { return hypervisorStatusBreakdown; }
    }

    // ============ COMPUTE ============

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Compute {
        private final ServerCounts servers;
        private final HypervisorCounts hypervisors;
        private final FlavorCounts flavors;
        private final List<ServerRecord> serverDetails;
        private final List<HypervisorRecord> hypervisorDetails;
        private final List<FlavorRecord> flavorDetails;

        public Compute(ServerCounts servers, HypervisorCounts hypervisors, FlavorCounts flavors,
                       List<ServerRecord> serverDetails, List<HypervisorRecord> hypervisorDetails,
                       List<FlavorRecord> flavorDetails) {
            this.servers = servers;
            this.hypervisors = hypervisors;
            this.flavors = flavors;
            this.serverDetails = serverDetails;
            this.hypervisorDetails = hypervisorDetails;
            this.flavorDetails = flavorDetails;
        }

        public ServerCounts getServers() { return servers; }
        public HypervisorCounts getHypervisors() { return hypervisors; }
        public FlavorCounts getFlavors() { return flavors; }
        public List<ServerRecord> getServerDetails() { return serverDetails; }
        public List<HypervisorRecord> getHypervisorDetails() { return hypervisorDetails; }
        public List<FlavorRecord> getFlavorDetails() { return flavorDetails; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ServerCounts {
        private final int total;
        private final Map<String, Integer> byStatus;
        private final int activeServers;
        private final List<ServerRecord> errorServers;

        public ServerCounts(int total, Map<String, Integer> byStatus, int activeServers, List<ServerRecord> errorServers) {
            this.total = total;
            this.byStatus = byStatus;
            this.activeServers = activeServers;
            this.errorServers = errorServers;
        }

        public int getTotal() { return total; }
        public Map<String, Integer> getByStatus() { return byStatus; }
        public int getActiveServers() { return activeServers; }
        public List<ServerRecord> getErrorServers() { return errorServers; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class HypervisorCounts {
        private final int total;
        private final int enabled;
        private final CapacitySummary capacity;

        public HypervisorCounts(int total, int enabled, CapacitySummary capacity) {
            this.total = total;
            this.enabled = enabled;
            this.capacity = capacity;
        }

        public int getTotal() { return total; }
        public int getEnabled() { return enabled; }
        public CapacitySummary getCapacity() { return capacity; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class FlavorCounts {
        private final int total;
        private final int publicFlavors;
        private final FlavorSpecs resourceSpecs;

        public FlavorCounts(int total, int publicFlavors, FlavorSpecs resourceSpecs) {
            this.total = total;
            this.publicFlavors = publicFlavors;
            this.resourceSpecs = resourceSpecs;
        }

        public int getTotal() { return total; }
        public int getPublicFlavors() { return publicFlavors; }
        public FlavorSpecs getResourceSpecs() { return resourceSpecs; }
    }

    /**
     * Size range of the flavor catalogue; all zero when there are no flavors.
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class FlavorSpecs {
        private final long smallestVcpu;
        private final long largestVcpu;
        private final long smallestRamMb;
        private final long largestRamMb;

        public FlavorSpecs(long smallestVcpu, long largestVcpu, long smallestRamMb, long largestRamMb) {
            this.smallestVcpu = smallestVcpu;
            this.largestVcpu = largestVcpu;
            this.smallestRamMb = smallestRamMb;
            this.largestRamMb = largestRamMb;
        }

        public long getSmallestVcpu() { return smallestVcpu; }
        public long getLargestVcpu() { return largestVcpu; }
        public long getSmallestRamMb() { return smallestRamMb; }
        public long getLargestRamMb() { return largestRamMb; }
    }

    // ============ STORAGE ============

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Storage {
        private final VolumeCounts volumes;
        private final VolumeTypeCounts volumeTypes;
        private final List<VolumeRecord> volumeDetails;
        private final List<VolumeTypeRecord> volumeTypeDetails;

        public Storage(VolumeCounts volumes, VolumeTypeCounts volumeTypes,
                       List<VolumeRecord> volumeDetails, List<VolumeTypeRecord> volumeTypeDetails) {
            this.volumes = volumes;
            this.volumeTypes = volumeTypes;
            this.volumeDetails = volumeDetails;
            this.volumeTypeDetails = volumeTypeDetails;
        }

        public VolumeCounts getVolumes() { return volumes; }
        public VolumeTypeCounts getVolumeTypes() { return volumeTypes; }
        public List<VolumeRecord> getVolumeDetails() { return volumeDetails; }
        public List<VolumeTypeRecord> getVolumeTypeDetails() { return volumeTypeDetails; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class VolumeCounts {
        private final int total;
        private final long totalSizeGb;
        private final Map<String, Integer> byStatus;
        private final int available;
        private final int inUse;
        private final double attachmentRate;

        public VolumeCounts(int total, long totalSizeGb, Map<String, Integer> byStatus,
                            int available, int inUse, double attachmentRate) {
            this.total = total;
            this.totalSizeGb = totalSizeGb;
            this.byStatus = byStatus;
            this.available = available;
            this.inUse = inUse;
            this.attachmentRate = attachmentRate;
        }

        public int getTotal() { return total; }
        public long getTotalSizeGb() { return totalSizeGb; }
        public Map<String, Integer> getByStatus() { return byStatus; }
        public int getAvailable() { return available; }
        public int getInUse() { return inUse; }
        public double getAttachmentRate() { return attachmentRate; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class VolumeTypeCounts {
        private final int total;
        private final int publicTypes;

        public VolumeTypeCounts(int total, int publicTypes) {
            this.total = total;
            this.publicTypes = publicTypes;
        }

        public int getTotal() { return total; }
        public int getPublicTypes() { return publicTypes; }
    }

    // ============ NETWORKING ============

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Networking {
        private final NetworkCounts networks;
        private final SubnetCounts subnets;
        private final RouterCounts routers;
        private final List<NetworkRecord> networkDetails;
        private final List<SubnetRecord> subnetDetails;
        private final List<RouterRecord> routerDetails;

        public Networking(NetworkCounts networks, SubnetCounts subnets, RouterCounts routers,
                          List<NetworkRecord> networkDetails, List<SubnetRecord> subnetDetails,
                          List<RouterRecord> routerDetails) {
            this.networks = networks;
            this.subnets = subnets;
            this.routers = routers;
            this.networkDetails = networkDetails;
            this.subnetDetails = subnetDetails;
            this.routerDetails = routerDetails;
        }

        public NetworkCounts getNetworks() { return networks; }
        public SubnetCounts getSubnets() { return subnets; }
        public RouterCounts getRouters() { return routers; }
        public List<NetworkRecord> getNetworkDetails() { return networkDetails; }
        public List<SubnetRecord> getSubnetDetails() { return subnetDetails; }
        public List<RouterRecord> getRouterDetails() { return routerDetails; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class NetworkCounts {
        private final int total;
        private final int external;
        private final int internal;
        private final int shared;
        private final Map<String, Integer> byStatus;

        public NetworkCounts(int total, int external, int internal, int shared, Map<String, Integer> byStatus) {
            this.total = total;
            this.external = external;
            this.internal = internal;
            this.shared = shared;
            this.byStatus = byStatus;
        }

        public int getTotal() { return total; }
        public int getExternal() { return external; }
        public int getInternal() { return internal; }
        public int getShared() { return shared; }
        public Map<String, Integer> getByStatus() { return byStatus; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class SubnetCounts {
        private final int total;
        private final int ipv4;
        private final int ipv6;
        private final int dhcpEnabled;

        public SubnetCounts(int total, int ipv4, int ipv6, int dhcpEnabled) {
            this.total = total;
            this.ipv4 = ipv4;
            this.ipv6 = ipv6;
            this.dhcpEnabled = dhcpEnabled;
        }

        public int getTotal() { return total; }
        public int getIpv4() { return ipv4; }
        public int getIpv6() { return ipv6; }
        public int getDhcpEnabled() { return dhcpEnabled; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class RouterCounts {
        private final int total;
        private final int active;
        private final int withExternalGateway;

        public RouterCounts(int total, int active, int withExternalGateway) {
            this.total = total;
            this.active = active;
            this.withExternalGateway = withExternalGateway;
        }

        public int getTotal() { return total; }
        public int getActive() { return active; }
        public int getWithExternalGateway() { return withExternalGateway; }
    }

    // ============ UTILIZATION ============

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ResourceUtilization {
        private final ComputeUtilization computeUtilization;
        private final List<String> highUtilizationHypervisors;
        private final Map<String, Long> serversPerHypervisor;

        public ResourceUtilization(ComputeUtilization computeUtilization, List<String> highUtilizationHypervisors,
                                   Map<String, Long> serversPerHypervisor) {
            this.computeUtilization = computeUtilization;
            this.highUtilizationHypervisors = highUtilizationHypervisors;
            this.serversPerHypervisor = serversPerHypervisor;
        }

        public ComputeUtilization getComputeUtilization() { return computeUtilization; }
        public List<String> getHighUtilizationHypervisors() { return highUtilizationHypervisors; }
        public Map<String, Long> getServersPerHypervisor() { return serversPerHypervisor; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ComputeUtilization {
        private final double cpuPercent;
        private final double memoryPercent;
        private final double diskPercent;

        public ComputeUtilization(double cpuPercent, double memoryPercent, double diskPercent) {
            this.cpuPercent = cpuPercent;
            this.memoryPercent = memoryPercent;
            this.diskPercent = diskPercent;
        }

        public double getCpuPercent() { return cpuPercent; }
        public double getMemoryPercent() { return memoryPercent; }
        public double getDiskPercent() { return diskPercent; }
    }
}
