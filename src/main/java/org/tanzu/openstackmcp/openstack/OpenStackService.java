package org.tanzu.openstackmcp.openstack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;
import org.tanzu.openstackmcp.analysis.ServerAnalysis;
import org.tanzu.openstackmcp.analysis.ServerResourceAnalyzer;
import org.tanzu.openstackmcp.analysis.ServiceHealthProber;
import org.tanzu.openstackmcp.analysis.ServiceHealthReport;
import org.tanzu.openstackmcp.inventory.FetchResult;
import org.tanzu.openstackmcp.inventory.FlavorDetails;
import org.tanzu.openstackmcp.inventory.FlavorRecord;
import org.tanzu.openstackmcp.inventory.HypervisorRecord;
import org.tanzu.openstackmcp.inventory.ImageDetails;
import org.tanzu.openstackmcp.inventory.ImageRecord;
import org.tanzu.openstackmcp.inventory.InventoryCollector;
import org.tanzu.openstackmcp.inventory.LookupResult;
import org.tanzu.openstackmcp.inventory.NetworkRecord;
import org.tanzu.openstackmcp.inventory.ResourceNormalizer;
import org.tanzu.openstackmcp.inventory.RouterRecord;
import org.tanzu.openstackmcp.inventory.ServerDetails;
import org.tanzu.openstackmcp.inventory.ServerRecord;
import org.tanzu.openstackmcp.inventory.SubnetRecord;
import org.tanzu.openstackmcp.inventory.VolumeRecord;
import org.tanzu.openstackmcp.inventory.VolumeTypeRecord;
import org.tanzu.openstackmcp.report.InfrastructureSummary;
import org.tanzu.openstackmcp.report.InventoryReport;
import org.tanzu.openstackmcp.report.InventoryReportAssembler;
import org.tanzu.openstackmcp.report.ReportFormat;
import org.tanzu.openstackmcp.report.UtilizationReport;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Service class that exposes OpenStack inventory and health operations as MCP tools.
 *
 * Every operation is read-only. Listing tools never fail because a service is down:
 * they return an empty listing with a diagnostic instead. Detail tools answer with a
 * found, not_found or unavailable result. The aggregate tools return an error document
 * rather than throwing. Only a missing required argument is reported as a tool error,
 * and that happens before anything is sent to the cloud.
 *
 * The tools are registered with the MCP server through
 * {@link org.springframework.ai.support.ToolCallbacks} in the application class.
 */
@Service
public class OpenStackService {

    private static final Logger logger = LoggerFactory.getLogger(OpenStackService.class);

    private final InventoryCollector collector;
    private final ResourceNormalizer normalizer;
    private final ServerResourceAnalyzer serverResourceAnalyzer;
    private final ServiceHealthProber serviceHealthProber;
    private final InventoryReportAssembler reportAssembler;
    private final Clock clock;

    public OpenStackService(InventoryCollector collector,
                            ResourceNormalizer normalizer,
                            ServerResourceAnalyzer serverResourceAnalyzer,
                            ServiceHealthProber serviceHealthProber,
                            InventoryReportAssembler reportAssembler,
                            Clock clock) {
        this.collector = collector;
        this.normalizer = normalizer;
        this.serverResourceAnalyzer = serverResourceAnalyzer;
        this.serviceHealthProber = serviceHealthProber;
        this.reportAssembler = reportAssembler;
        this.clock = clock;
        logger.info("OpenStackService initialized");
    }

    // ============ COMPUTE ============

    @Tool(name = "list_servers",
          description = "List all virtual machines/servers in the OpenStack environment with their current status, IDs, and basic configuration")
    public FetchResult<ServerRecord> listServers() {
        logger.info("=== MCP TOOL CALLED: list_servers() ===");
        return collector.fetch(ResourceKind.SERVERS, normalizer::toServer);
    }

    @Tool(name = "get_server_details",
          description = "Get detailed information about a specific virtual machine/server including status, host, resources, and configuration")
    public LookupResult<ServerDetails> getServerDetails(
            @ToolParam(description = "The ID of the server to get details for") String server_id) {
        logger.info("=== MCP TOOL CALLED: get_server_details({}) ===", server_id);
        requireId("server_id", server_id);
        return collector.lookup(ResourceKind.SERVERS, server_id, normalizer::toServerDetails);
    }

    @Tool(name = "list_hypervisors",
          description = "List all hypervisor hosts in OpenStack with their resource usage, capacity, and status details")
    public FetchResult<HypervisorRecord> listHypervisors() {
        logger.info("=== MCP TOOL CALLED: list_hypervisors() ===");
        return collector.fetch(ResourceKind.HYPERVISORS, normalizer::toHypervisor);
    }

    @Tool(name = "list_flavors",
          description = "List all compute flavors (instance types) with their vCPU, RAM, disk and visibility")
    public FetchResult<FlavorRecord> listFlavors() {
        logger.info("=== MCP TOOL CALLED: list_flavors() ===");
        return collector.fetch(ResourceKind.FLAVORS, normalizer::toFlavor);
    }

    @Tool(name = "get_flavor_details",
          description = "Get detailed information about a specific flavor including its extra specs")
    public LookupResult<FlavorDetails> getFlavorDetails(
            @ToolParam(description = "The ID of the flavor to get details for") String flavor_id) {
        logger.info("=== MCP TOOL CALLED: get_flavor_details({}) ===", flavor_id);
        requireId("flavor_id", flavor_id);
        return collector.lookup(ResourceKind.FLAVORS, flavor_id, normalizer::toFlavorDetails);
    }

    @Tool(name = "list_images",
          description = "List all virtual machine images available in OpenStack with their status and properties")
    public FetchResult<ImageRecord> listImages() {
        logger.info("=== MCP TOOL CALLED: list_images() ===");
        return collector.fetch(ResourceKind.IMAGES, normalizer::toImage);
    }

    @Tool(name = "get_image_details",
          description = "Get detailed information about a specific image including its metadata")
    public LookupResult<ImageDetails> getImageDetails(
            @ToolParam(description = "The ID of the image to get details for") String image_id) {
        logger.info("=== MCP TOOL CALLED: get_image_details({}) ===", image_id);
        requireId("image_id", image_id);
        return collector.lookup(ResourceKind.IMAGES, image_id, normalizer::toImageDetails);
    }

    // ============ STORAGE ============

    @Tool(name = "list_volumes",
          description = "List all storage volumes in OpenStack with their status, size, and attachment information")
    public FetchResult<VolumeRecord> listVolumes() {
        logger.info("=== MCP TOOL CALLED: list_volumes() ===");
        return collector.fetch(ResourceKind.VOLUMES, normalizer::toVolume);
    }

    @Tool(name = "list_volume_types",
          description = "List all volume types available in the block storage service")
    public FetchResult<VolumeTypeRecord> listVolumeTypes() {
        logger.info("=== MCP TOOL CALLED: list_volume_types() ===");
        return collector.fetch(ResourceKind.VOLUME_TYPES, normalizer::toVolumeType);
    }

    // ============ NETWORKING ============

    @Tool(name = "list_networks",
          description = "List all networks in OpenStack with their status, type, and configuration details")
    public FetchResult<NetworkRecord> listNetworks() {
        logger.info("=== MCP TOOL CALLED: list_networks() ===");
        return collector.fetch(ResourceKind.NETWORKS, normalizer::toNetwork);
    }

    @Tool(name = "list_subnets",
          description = "List all subnets with their CIDR, IP version, gateway and DHCP settings")
    public FetchResult<SubnetRecord> listSubnets() {
        logger.info("=== MCP TOOL CALLED: list_subnets() ===");
        return collector.fetch(ResourceKind.SUBNETS, normalizer::toSubnet);
    }

    @Tool(name = "list_routers",
          description = "List all routers in OpenStack with their status and gateway configuration")
    public FetchResult<RouterRecord> listRouters() {
        logger.info("=== MCP TOOL CALLED: list_routers() ===");
        return collector.fetch(ResourceKind.ROUTERS, normalizer::toRouter);
    }

    // ============ ANALYSIS ============

    /**
     * Resolves the server, then its flavor and hosting hypervisor. A flavor or hypervisor
     * that cannot be resolved leaves its section of the analysis empty.
     */
    @Tool(name = "analyze_server_resources",
          description = "Analyze server resource allocation, hypervisor placement, and health status for troubleshooting and optimization")
    public LookupResult<ServerAnalysis> analyzeServerResources(
            @ToolParam(description = "The ID of the server to analyze") String server_id) {
        logger.info("=== MCP TOOL CALLED: analyze_server_resources({}) ===", server_id);
        requireId("server_id", server_id);

        LookupResult<ServerRecord> server = collector.lookup(ResourceKind.SERVERS, server_id, normalizer::toServer);
        if (!server.isFound()) {
            return server.getStatus() == LookupResult.Status.NOT_FOUND
                ? LookupResult.notFound(ResourceKind.SERVERS, server_id)
                : LookupResult.unavailable(ResourceKind.SERVERS, server_id, server.getMessage());
        }
        ServerRecord record = server.getResource();

        FlavorRecord flavor = null;
        if (record.getFlavorId() != null) {
            LookupResult<FlavorRecord> flavorLookup = collector.lookup(ResourceKind.FLAVORS, record.getFlavorId(), normalizer::toFlavor);
            flavor = flavorLookup.getResource();
        }

        List<HypervisorRecord> hypervisors = Collections.emptyList();
        if (record.getHost() != null) {
            FetchResult<HypervisorRecord> fetched = collector.fetch(ResourceKind.HYPERVISORS, normalizer::toHypervisor);
            hypervisors = fetched.getRecords();
        }

        ServerAnalysis analysis = serverResourceAnalyzer.analyze(record, flavor, hypervisors);
        logger.info("Server {} analyzed: health={}", server_id, analysis.getHealthStatus().value());
        return LookupResult.found(ResourceKind.SERVERS, server_id, analysis);
    }

    @Tool(name = "get_infrastructure_summary",
          description = "Get a comprehensive summary of the OpenStack infrastructure including resource utilization and health status")
    public InfrastructureSummary getInfrastructureSummary() {
        logger.info("=== MCP TOOL CALLED: get_infrastructure_summary() ===");
        return reportAssembler.generateInfrastructureSummary();
    }

    @Tool(name = "get_resource_utilization",
          description = "Get per-hypervisor CPU, memory and disk utilization with totals across all hypervisors")
    public UtilizationReport getResourceUtilization() {
        logger.info("=== MCP TOOL CALLED: get_resource_utilization() ===");
        return reportAssembler.generateUtilizationReport();
    }

    @Tool(name = "check_service_health",
          description = "Check the health status of OpenStack services and identify any issues or errors")
    public ServiceHealthReport checkServiceHealth() {
        logger.info("=== MCP TOOL CALLED: check_service_health() ===");
        try {
            return serviceHealthProber.probeAll();
        } catch (RuntimeException e) {
            logger.error("Failed to check service health: {}", e.getMessage(), e);
            return ServiceHealthReport.failed(Instant.now(clock).toString(), "Failed to check service health: " + e.getMessage());
        }
    }

    @Tool(name = "generate_inventory_report",
          description = "Generate a comprehensive inventory report of all OpenStack resources including compute, storage, networking, utilization metrics, and optimization recommendations")
    public InventoryReport generateInventoryReport(
            @ToolParam(description = "Report format: 'summary' for aggregate counts only, 'detailed' to include every resource (default: detailed)",
                       required = false) String format) {
        logger.info("=== MCP TOOL CALLED: generate_inventory_report({}) ===", format);
        return reportAssembler.generateInventoryReport(ReportFormat.from(format));
    }

    private static void requireId(String argument, String value) {
        if (value == null || value.trim().isEmpty()) {
            logger.warn("Rejected tool call: missing required argument '{}'", argument);
            throw new ValidationException("Missing required argument '" + argument + "'");
        }
    }
}
