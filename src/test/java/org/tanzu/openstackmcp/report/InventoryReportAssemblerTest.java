package org.tanzu.openstackmcp.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tanzu.openstackmcp.analysis.CapacityAggregator;
import org.tanzu.openstackmcp.analysis.RecommendationEngine;
import org.tanzu.openstackmcp.inventory.FetchResult;
import org.tanzu.openstackmcp.inventory.InventoryCollector;
import org.tanzu.openstackmcp.inventory.InventorySnapshot;
import org.tanzu.openstackmcp.inventory.StatusTabulator;
import org.tanzu.openstackmcp.openstack.ResourceKind;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.when;
import static org.tanzu.openstackmcp.InventoryFixtures.flavor;
import static org.tanzu.openstackmcp.InventoryFixtures.hypervisor;
import static org.tanzu.openstackmcp.InventoryFixtures.network;
import static org.tanzu.openstackmcp.InventoryFixtures.router;
import static org.tanzu.openstackmcp.InventoryFixtures.server;
import static org.tanzu.openstackmcp.InventoryFixtures.subnet;
import static org.tanzu.openstackmcp.InventoryFixtures.volume;
import static org.tanzu.openstackmcp.InventoryFixtures.volumeType;

@ExtendWith(MockitoExtension.class)
class InventoryReportAssemblerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private InventoryCollector collector;

    private InventoryReportAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new InventoryReportAssembler(collector, new CapacityAggregator(), new StatusTabulator(),
            new RecommendationEngine(), CLOCK);
    }

    private static InventorySnapshot populatedSnapshot() {
        return InventorySnapshot.builder()
            .servers(FetchResult.success(ResourceKind.SERVERS, List.of(
                server("s1", "web-1", "ACTIVE", "f1", 1),
                server("s2", "web-2", "ACTIVE", "f1", 1),
                server("s3", "db-1", "ERROR", "f2", 0))))
            .hypervisors(FetchResult.success(ResourceKind.HYPERVISORS, List.of(
                hypervisor("compute-1", "enabled", 16, 14, 32768, 16384),
                hypervisor("compute-2", "disabled", 16, 2, 32768, 8192))))
            .flavors(FetchResult.success(ResourceKind.FLAVORS, List.of(
                flavor("f1", "m1.small", true),
                flavor("f2", "m1.large", true),
                flavor("f3", "m1.unused", true))))
            .volumes(FetchResult.success(ResourceKind.VOLUMES, List.of(
                volume("v1", "in-use", 10),
                volume("v2", "available", 20),
                volume("v3", "in-use", 30))))
            .volumeTypes(FetchResult.success(ResourceKind.VOLUME_TYPES, List.of(
                volumeType("t1", true), volumeType("t2", false))))
            .networks(FetchResult.success(ResourceKind.NETWORKS, List.of(
                network("n1", true, true), network("n2", false, false))))
            .subnets(FetchResult.success(ResourceKind.SUBNETS, List.of(
                subnet("sn1", 4, true), subnet("sn2", 6, false))))
            .routers(FetchResult.success(ResourceKind.ROUTERS, List.of(
                router("r1", "ACTIVE", "n1"), router("r2", "DOWN", null))))
            .images(FetchResult.failure(ResourceKind.IMAGES, "nova returned 503 Service Unavailable for images"))
            .build();
    }

    @Nested
    @DisplayName("Inventory report")
    class InventoryReportTests {

        @Test
        @DisplayName("Should aggregate counts across every section")
        void shouldAggregateCounts() {
            // when
            JsonNode report = objectMapper.valueToTree(
                assembler.assembleInventoryReport(populatedSnapshot(), ReportFormat.DETAILED));

            // then
            JsonNode totals = report.path("summary").path("total_resources");
            assertThat(totals.path("servers").asInt()).isEqualTo(3);
            assertThat(totals.path("images").asInt()).isZero();
            assertThat(report.path("summary").path("server_status_breakdown").path("ACTIVE").asInt()).isEqualTo(2);

            JsonNode compute = report.path("compute");
            assertThat(compute.path("servers").path("active_servers").asInt()).isEqualTo(2);
            assertThat(compute.path("servers").path("error_servers")).hasSize(1);
            assertThat(compute.path("hypervisors").path("enabled").asInt()).isEqualTo(1);
            assertThat(compute.path("hypervisors").path("capacity").path("vcpus").path("total").asLong()).isEqualTo(32);
            assertThat(compute.path("flavors").path("public_flavors").asInt()).isEqualTo(3);

            JsonNode volumes = report.path("storage").path("volumes");
            assertThat(volumes.path("total_size_gb").asLong()).isEqualTo(60);
            assertThat(volumes.path("in_use").asInt()).isEqualTo(2);
            assertThat(volumes.path("attachment_rate").asDouble()).isEqualTo(66.67);
            assertThat(report.path("storage").path("volume_types").path("public_types").asInt()).isEqualTo(1);

            JsonNode networking = report.path("networking");
            assertThat(networking.path("networks").path("external").asInt()).isEqualTo(1);
            assertThat(networking.path("networks").path("internal").asInt()).isEqualTo(1);
            assertThat(networking.path("subnets").path("ipv4").asInt()).isEqualTo(1);
            assertThat(networking.path("subnets").path("dhcp_enabled").asInt()).isEqualTo(1);
            assertThat(networking.path("routers").path("with_external_gateway").asInt()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should include per-resource detail lists only in the detailed format")
        void shouldIncludeDetailsOnlyWhenDetailed() {
            JsonNode detailed = objectMapper.valueToTree(
                assembler.assembleInventoryReport(populatedSnapshot(), ReportFormat.DETAILED));
            JsonNode summary = objectMapper.valueToTree(
                assembler.assembleInventoryReport(populatedSnapshot(), ReportFormat.SUMMARY));

            assertThat(detailed.path("compute").path("server_details")).hasSize(3);
            assertThat(detailed.path("networking").has("router_details")).isTrue();
            assertThat(summary.path("compute").has("server_details")).isFalse();
            assertThat(summary.path("storage").has("volume_details")).isFalse();
            assertThat(summary.path("networking").has("network_details")).isFalse();
            assertThat(summary.path("metadata").path("format").asText()).isEqualTo("summary");
        }

        @Test
        @DisplayName("Should surface failed collections as diagnostics")
        void shouldListDiagnostics() {
            InventoryReport report = assembler.assembleInventoryReport(populatedSnapshot(), ReportFormat.SUMMARY);

            assertThat(report.getMetadata().getDiagnostics()).singleElement()
                .satisfies(diagnostic -> assertThat(diagnostic.getResource()).isEqualTo("images"));
            assertThat(report.getMetadata().getGeneratedAt()).isEqualTo("2024-05-01T12:00:00Z");
            assertThat(report.getMetadata().getOpenstackServices()).containsExactly("nova", "cinder", "neutron", "keystone");
        }

        @Test
        @DisplayName("Should report utilization and recommendations")
        void shouldReportUtilizationAndRecommendations() {
            JsonNode report = objectMapper.valueToTree(
                assembler.assembleInventoryReport(populatedSnapshot(), ReportFormat.SUMMARY));

            JsonNode utilization = report.path("resource_utilization");
            assertThat(utilization.path("compute_utilization").path("cpu_percent").asDouble()).isEqualTo(50.0);
            assertThat(utilization.path("high_utilization_hypervisors").get(0).asText()).isEqualTo("compute-1");
            assertThat(utilization.path("servers_per_hypervisor").path("compute-1").asLong()).isEqualTo(7);

            JsonNode recommendations = report.path("recommendations");
            assertThat(recommendations).hasSize(3);
            assertThat(recommendations.get(0).path("affected_servers").get(0).asText()).isEqualTo("db-1");
            assertThat(recommendations.get(1).path("affected_hypervisors").get(0).asText()).isEqualTo("compute-2");
            assertThat(recommendations.get(2).path("unused_flavors").get(0).asText()).isEqualTo("m1.unused");
        }

        @Test
        @DisplayName("Should produce a valid report from an empty cloud")
        void shouldHandleEmptySnapshot() {
            InventoryReport report = assembler.assembleInventoryReport(InventorySnapshot.empty(), ReportFormat.DETAILED);

            assertThat(report.getError()).isNull();
            assertThat(report.getSummary().getTotalResources()).containsEntry("servers", 0);
            assertThat(report.getResourceUtilization().getComputeUtilization().getCpuPercent()).isZero();
            assertThat(report.getRecommendations()).isEmpty();
            assertThat(report.getMetadata().getDiagnostics()).isEmpty();
        }

        @Test
        @DisplayName("Should return an error document when collection fails unexpectedly")
        void shouldReturnErrorDocument() {
            when(collector.collect(anySet())).thenThrow(new IllegalStateException("Failed to normalize servers: boom"));

            JsonNode report = objectMapper.valueToTree(assembler.generateInventoryReport(ReportFormat.DETAILED));

            assertThat(report.path("error").asText())
                .isEqualTo("Failed to generate inventory report: Failed to normalize servers: boom");
            assertThat(report.path("timestamp").asText()).isEqualTo("2024-05-01T12:00:00Z");
            assertThat(report.has("metadata")).isFalse();
        }
    }

    @Test
    @DisplayName("Should summarize the infrastructure")
    void shouldSummarizeInfrastructure() {
        JsonNode summary = objectMapper.valueToTree(assembler.assembleInfrastructureSummary(populatedSnapshot()));

        assertThat(summary.path("compute").path("servers").path("total").asInt()).isEqualTo(3);
        assertThat(summary.path("compute").path("hypervisors").path("vcpus").path("used").asLong()).isEqualTo(16);
        assertThat(summary.path("storage").path("volumes").path("total_size_gb").asLong()).isEqualTo(60);
        assertThat(summary.path("network").path("networks").path("external").asInt()).isEqualTo(1);
        assertThat(summary.has("error")).isFalse();
    }

    @Test
    @DisplayName("Should report per-hypervisor utilization")
    void shouldReportUtilization() {
        UtilizationReport report = assembler.assembleUtilizationReport(populatedSnapshot());

        assertThat(report.getHypervisors()).hasSize(2);
        assertThat(report.getHypervisors().get(0).isHighUtilization()).isTrue();
        assertThat(report.getSummary().getTotalHypervisors()).isEqualTo(2);
        assertThat(report.getSummary().getActiveHypervisors()).isEqualTo(1);
        assertThat(report.getSummary().getTotalVms()).isEqualTo(8);
    }

    @Test
    @DisplayName("Should return an error document when the utilization view fails")
    void shouldReturnUtilizationErrorDocument() {
        when(collector.collect(anySet())).thenThrow(new IllegalStateException("boom"));

        UtilizationReport report = assembler.generateUtilizationReport();

        assertThat(report.getError()).isEqualTo("Failed to get resource utilization: boom");
        assertThat(report.getHypervisors()).isNull();
    }
}
