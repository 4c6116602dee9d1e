package org.tanzu.openstackmcp.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.openstackmcp.analysis.CapacityAggregator;
import org.tanzu.openstackmcp.analysis.CapacityMetric;
import org.tanzu.openstackmcp.analysis.CapacitySummary;
import org.tanzu.openstackmcp.analysis.HypervisorUtilization;
import org.tanzu.openstackmcp.analysis.Recommendation;
import org.tanzu.openstackmcp.analysis.RecommendationEngine;
import org.tanzu.openstackmcp.inventory.FlavorRecord;
import org.tanzu.openstackmcp.inventory.HypervisorRecord;
import org.tanzu.openstackmcp.inventory.InventoryCollector;
import org.tanzu.openstackmcp.inventory.InventorySnapshot;
import org.tanzu.openstackmcp.inventory.NetworkRecord;
import org.tanzu.openstackmcp.inventory.ResourceRecord;
import org.tanzu.openstackmcp.inventory.RouterRecord;
import org.tanzu.openstackmcp.inventory.ServerRecord;
import org.tanzu.openstackmcp.inventory.StatusTabulator;
import org.tanzu.openstackmcp.inventory.SubnetRecord;
import org.tanzu.openstackmcp.inventory.VolumeRecord;
import org.tanzu.openstackmcp.inventory.VolumeTypeRecord;
import org.tanzu.openstackmcp.openstack.ResourceKind;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the aggregate documents: the inventory report, the infrastructure summary
 * and the resource utilization view.
 *
 * Each {@code generate*} method collects a fresh snapshot and assembles it. Sections
 * whose collection could not be fetched come out empty and the failure is listed under
 * {@code diagnostics}. Any other fault yields an error document with its own timestamp,
 * so callers always receive a parseable result.
 */
@Component
public class InventoryReportAssembler {

    private static final Logger logger = LoggerFactory.getLogger(InventoryReportAssembler.class);

    static final List<String> OPENSTACK_SERVICES = List.of("nova", "cinder", "neutron", "keystone");

    private static final Set<ResourceKind> SUMMARY_KINDS =
        EnumSet.of(ResourceKind.SERVERS, ResourceKind.HYPERVISORS, ResourceKind.VOLUMES, ResourceKind.NETWORKS);

    private final InventoryCollector collector;
    private final CapacityAggregator capacityAggregator;
    private final StatusTabulator statusTabulator;
    private final RecommendationEngine recommendationEngine;
    private final Clock clock;

    public InventoryReportAssembler(InventoryCollector collector,
                                    CapacityAggregator capacityAggregator,
                                    StatusTabulator statusTabulator,
                                    RecommendationEngine recommendationEngine,
                                    Clock clock) {
        this.collector = collector;
        this.capacityAggregator = capacityAggregator;
        this.statusTabulator = statusTabulator;
        this.recommendationEngine = recommendationEngine;
        this.clock = clock;
    }

    public InventoryReport generateInventoryReport(ReportFormat format) {
        try {
            InventorySnapshot snapshot = collector.collect(EnumSet.allOf(ResourceKind.class));
            return assembleInventoryReport(snapshot, format);
        } catch (RuntimeException e) {
            logger.error("Failed to generate inventory report: {}", e.getMessage(), e);
            return InventoryReport.failed("Failed to generate inventory report: " + e.getMessage(), now());
        }
    }

    public InfrastructureSummary generateInfrastructureSummary() {
        try {
            return assembleInfrastructureSummary(collector.collect(SUMMARY_KINDS));
        } catch (RuntimeException e) {
            logger.error("Failed to get infrastructure summary: {}", e.getMessage(), e);
            return InfrastructureSummary.failed(now(), "Failed to get infrastructure summary: " + e.getMessage());
        }
    }

    public UtilizationReport generateUtilizationReport() {
        try {
            return assembleUtilizationReport(collector.collect(EnumSet.of(ResourceKind.HYPERVISORS)));
        } catch (RuntimeException e) {
            logger.error("Failed to get resource utilization: {}", e.getMessage(), e);
            return UtilizationReport.failed(now(), "Failed to get resource utilization: " + e.getMessage());
        }
    }

    InventoryReport assembleInventoryReport(InventorySnapshot snapshot, ReportFormat format) {
        List<ServerRecord> servers = snapshot.getServers();
        List<HypervisorRecord> hypervisors = snapshot.getHypervisors();
        List<FlavorRecord> flavors = snapshot.getFlavors();
        List<VolumeRecord> volumes = snapshot.getVolumes();
        List<VolumeTypeRecord> volumeTypes = snapshot.getVolumeTypes();
        List<NetworkRecord> networks = snapshot.getNetworks();
        List<SubnetRecord> subnets = snapshot.getSubnets();
        List<RouterRecord> routers = snapshot.getRouters();
        boolean detailed = format.isDetailed();

        Map<String, Integer> serverStatus = statusTabulator.tabulate(servers, ServerRecord::getStatus);
        Map<String, Integer> hypervisorStatus = statusTabulator.tabulate(hypervisors, HypervisorRecord::getStatus);

        Map<String, Integer> totals = new LinkedHashMap<>();
        totals.put("servers", servers.size());
        totals.put("hypervisors", hypervisors.size());
        totals.put("flavors", flavors.size());
        totals.put("images", snapshot.getImages().size());
        totals.put("volumes", volumes.size());
        totals.put("networks", networks.size());
        totals.put("subnets", subnets.size());
        totals.put("routers", routers.size());
        InventoryReport.Summary summary = new InventoryReport.Summary(totals, serverStatus, hypervisorStatus);

        CapacitySummary capacity = capacityAggregator.aggregate(hypervisors);

        // ============ COMPUTE ============
        List<ServerRecord> errorServers = new ArrayList<>();
        int activeServers = 0;
        for (ServerRecord server : servers) {
            if ("ACTIVE".equals(server.getStatus())) {
                activeServers++;
            } else if ("ERROR".equals(server.getStatus())) {
                errorServers.add(server);
            }
        }
        InventoryReport.Compute compute = new InventoryReport.Compute(
            new InventoryReport.ServerCounts(servers.size(), serverStatus, activeServers, errorServers),
            new InventoryReport.HypervisorCounts(hypervisors.size(), countEnabled(hypervisors), capacity),
            new InventoryReport.FlavorCounts(flavors.size(), (int) flavors.stream().filter(FlavorRecord::isPublic).count(),
                flavorSpecs(flavors)),
            detailed ? servers : null,
            detailed ? hypervisors : null,
            detailed ? flavors : null);

        // ============ STORAGE ============
        long totalSizeGb = 0;
        int availableVolumes = 0;
        int inUseVolumes = 0;
        for (VolumeRecord volume : volumes) {
            totalSizeGb += volume.getSize();
            if ("available".equals(volume.getStatus())) {
                availableVolumes++;
            } else if ("in-use".equals(volume.getStatus())) {
                inUseVolumes++;
            }
        }
        InventoryReport.Storage storage = new InventoryReport.Storage(
            new InventoryReport.VolumeCounts(volumes.size(), totalSizeGb,
                statusTabulator.tabulate(volumes, VolumeRecord::getStatus),
                availableVolumes, inUseVolumes, CapacityMetric.percent(inUseVolumes, volumes.size())),
            new InventoryReport.VolumeTypeCounts(volumeTypes.size(),
                (int) volumeTypes.stream().filter(VolumeTypeRecord::isPublic).count()),
            detailed ? volumes : null,
            detailed ? volumeTypes : null);

        // ============ NETWORKING ============
        int externalNetworks = (int) networks.stream().filter(NetworkRecord::isExternal).count();
        InventoryReport.Networking networking = new InventoryReport.Networking(
            new InventoryReport.NetworkCounts(networks.size(), externalNetworks, networks.size() - externalNetworks,
                (int) networks.stream().filter(NetworkRecord::isShared).count(),
                statusTabulator.tabulate(networks, NetworkRecord::getStatus)),
            new InventoryReport.SubnetCounts(subnets.size(),
                (int) subnets.stream().filter(s -> Integer.valueOf(4).equals(s.getIpVersion())).count(),
                (int) subnets.stream().filter(s -> Integer.valueOf(6).equals(s.getIpVersion())).count(),
                (int) subnets.stream().filter(SubnetRecord::isEnableDhcp).count()),
            new InventoryReport.RouterCounts(routers.size(),
                (int) routers.stream().filter(r -> "ACTIVE".equals(r.getStatus())).count(),
                (int) routers.stream().filter(RouterRecord::hasExternalGateway).count()),
            detailed ? networks : null,
            detailed ? subnets : null,
            detailed ? routers : null);

        // ============ UTILIZATION ============
        Map<String, Long> serversPerHypervisor = new LinkedHashMap<>();
        for (HypervisorRecord hypervisor : hypervisors) {
            serversPerHypervisor.put(hostKey(hypervisor), hypervisor.getRunningVms());
        }
        InventoryReport.ResourceUtilization utilization = new InventoryReport.ResourceUtilization(
            new InventoryReport.ComputeUtilization(
                capacity.getVcpus().getUtilizationPercent(),
                capacity.getMemoryMb().getUtilizationPercent(),
                capacity.getLocalStorageGb().getUtilizationPercent()),
            capacityAggregator.highUtilizationHosts(hypervisors),
            serversPerHypervisor);

        List<Recommendation> recommendations = recommendationEngine.evaluate(capacity, servers, hypervisors, flavors);

        InventoryReport.Metadata metadata = new InventoryReport.Metadata(now(), format, OPENSTACK_SERVICES,
            snapshot.getDiagnostics());

        logger.info("Assembled {} inventory report: {} servers, {} hypervisors, {} recommendations, {} diagnostics",
                   format.value(), servers.size(), hypervisors.size(), recommendations.size(), snapshot.getDiagnostics().size());
        return new InventoryReport(metadata, summary, compute, storage, networking, utilization, recommendations);
    }

    InfrastructureSummary assembleInfrastructureSummary(InventorySnapshot snapshot) {
        List<ServerRecord> servers = snapshot.getServers();
        List<HypervisorRecord> hypervisors = snapshot.getHypervisors();
        List<VolumeRecord> volumes = snapshot.getVolumes();
        List<NetworkRecord> networks = snapshot.getNetworks();

        CapacitySummary capacity = capacityAggregator.aggregate(hypervisors);
        long totalSizeGb = volumes.stream().mapToLong(VolumeRecord::getSize).sum();

        return new InfrastructureSummary(
            now(),
            new InfrastructureSummary.Compute(
                new InfrastructureSummary.Servers(servers.size(), statusTabulator.tabulate(servers, ServerRecord::getStatus)),
                new InfrastructureSummary.Hypervisors(hypervisors.size(), capacity.getVcpus(), capacity.getMemoryMb())),
            new InfrastructureSummary.Storage(new InfrastructureSummary.Volumes(volumes.size(), totalSizeGb)),
            new InfrastructureSummary.Network(new InfrastructureSummary.Networks(networks.size(),
                (int) networks.stream().filter(NetworkRecord::isExternal).count())),
            snapshot.getDiagnostics());
    }

    UtilizationReport assembleUtilizationReport(InventorySnapshot snapshot) {
        List<HypervisorRecord> hypervisors = snapshot.getHypervisors();
        List<HypervisorUtilization> utilization = new ArrayList<>(hypervisors.size());
        long totalVms = 0;
        for (HypervisorRecord hypervisor : hypervisors) {
            utilization.add(capacityAggregator.utilizationOf(hypervisor));
            totalVms += hypervisor.getRunningVms();
        }
        return new UtilizationReport(
            now(),
            utilization,
            new UtilizationReport.Summary(hypervisors.size(), countEnabled(hypervisors), totalVms),
            snapshot.getDiagnostics());
    }

    private static int countEnabled(List<HypervisorRecord> hypervisors) {
        return (int) hypervisors.stream().filter(h -> "enabled".equals(h.getStatus())).count();
    }

    private static InventoryReport.FlavorSpecs flavorSpecs(List<FlavorRecord> flavors) {
        if (flavors.isEmpty()) {
            return new InventoryReport.FlavorSpecs(0, 0, 0, 0);
        }
        long smallestVcpu = Long.MAX_VALUE;
        long largestVcpu = Long.MIN_VALUE;
        long smallestRam = Long.MAX_VALUE;
        long largestRam = Long.MIN_VALUE;
        for (FlavorRecord flavor : flavors) {
            smallestVcpu = Math.min(smallestVcpu, flavor.getVcpus());
            largestVcpu = Math.max(largestVcpu, flavor.getVcpus());
            smallestRam = Math.min(smallestRam, flavor.getRam());
            largestRam = Math.max(largestRam, flavor.getRam());
        }
        return new InventoryReport.FlavorSpecs(smallestVcpu, largestVcpu, smallestRam, largestRam);
    }

    /**
     * JSON object keys cannot be null; a hypervisor without a hostname is keyed by its id.
     */
    private static String hostKey(HypervisorRecord hypervisor) {
        return ResourceRecord.displayName(hypervisor);
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
