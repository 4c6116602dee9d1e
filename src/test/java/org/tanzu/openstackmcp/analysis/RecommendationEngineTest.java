package org.tanzu.openstackmcp.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.tanzu.openstackmcp.inventory.FlavorRecord;
import org.tanzu.openstackmcp.inventory.HypervisorRecord;
import org.tanzu.openstackmcp.inventory.ServerRecord;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tanzu.openstackmcp.InventoryFixtures.flavor;
import static org.tanzu.openstackmcp.InventoryFixtures.hypervisor;
import static org.tanzu.openstackmcp.InventoryFixtures.server;

class RecommendationEngineTest {

    private final RecommendationEngine engine = new RecommendationEngine();

    private static CapacitySummary capacity(long vcpus, long vcpusUsed, long memory, long memoryUsed) {
        return new CapacitySummary(CapacityMetric.of(vcpus, vcpusUsed), CapacityMetric.of(memory, memoryUsed),
            CapacityMetric.of(100, 10));
    }

    @Nested
    @DisplayName("Capacity rules")
    class CapacityRules {

        @Test
        @DisplayName("Should warn when CPU utilization is above 80%")
        void shouldWarnOnHighCpu() {
            // given
            CapacitySummary summary = capacity(100, 85, 1000, 100);

            // when
            List<Recommendation> recommendations = engine.evaluate(summary,
                Collections.emptyList(), Collections.emptyList(), Collections.emptyList());

            // then
            assertThat(recommendations).hasSize(1);
            Recommendation cpu = recommendations.get(0);
            assertThat(cpu.getType()).isEqualTo(RecommendationType.CAPACITY_WARNING);
            assertThat(cpu.getResource()).isEqualTo("CPU");
            assertThat(cpu.getPriority()).isEqualTo(Priority.HIGH);
            assertThat(cpu.getMessage()).isEqualTo(
                "CPU utilization is high (85.0%). Consider adding more compute capacity.");
        }

        @Test
        @DisplayName("Should not warn at or below 80%")
        void shouldNotWarnAtThreshold() {
            assertThat(engine.cpuCapacity(CapacityMetric.of(100, 70))).isEmpty();
            assertThat(engine.cpuCapacity(CapacityMetric.of(100, 80))).isEmpty();
            assertThat(engine.memoryCapacity(CapacityMetric.of(100, 80))).isEmpty();
        }

        @Test
        @DisplayName("Should not warn when there is no capacity at all")
        void shouldNotWarnWithoutCapacity() {
            assertThat(engine.evaluate(capacity(0, 0, 0, 0),
                Collections.emptyList(), Collections.emptyList(), Collections.emptyList())).isEmpty();
        }

        @Test
        @DisplayName("Should warn about memory separately from CPU")
        void shouldWarnOnHighMemory() {
            List<Recommendation> recommendations = engine.evaluate(capacity(100, 90, 1000, 950),
                Collections.emptyList(), Collections.emptyList(), Collections.emptyList());

            assertThat(recommendations).extracting(Recommendation::getResource).containsExactly("CPU", "Memory");
            assertThat(recommendations.get(1).getMessage()).isEqualTo(
                "Memory utilization is high (95.0%). Consider adding more memory or nodes.");
        }
    }

    @Nested
    @DisplayName("Inventory rules")
    class InventoryRules {

        @Test
        @DisplayName("Should report servers in ERROR as a critical health issue")
        void shouldReportErrorServers() {
            List<ServerRecord> servers = List.of(
                server("1", "web-1", "ACTIVE"),
                server("2", "db-1", "ERROR"),
                server("3", null, "ERROR"));

            Recommendation recommendation = engine.errorServers(servers).orElseThrow();

            assertThat(recommendation.getPriority()).isEqualTo(Priority.CRITICAL);
            assertThat(recommendation.getType()).isEqualTo(RecommendationType.HEALTH_ISSUE);
            assertThat(recommendation.getMessage()).isEqualTo("2 servers are in ERROR state. Investigation required.");
            assertThat(recommendation.getAffectedKey()).isEqualTo("affected_servers");
            assertThat(recommendation.getAffected()).containsExactly("db-1", "3");
        }

        @Test
        @DisplayName("Should report hypervisors that are not enabled")
        void shouldReportDisabledHypervisors() {
            List<HypervisorRecord> hypervisors = List.of(
                hypervisor("compute-1", "enabled", 8, 2),
                hypervisor("compute-2", "disabled", 8, 0));

            Recommendation recommendation = engine.disabledHypervisors(hypervisors).orElseThrow();

            assertThat(recommendation.getPriority()).isEqualTo(Priority.MEDIUM);
            assertThat(recommendation.getAffectedKey()).isEqualTo("affected_hypervisors");
            assertThat(recommendation.getAffected()).containsExactly("compute-2");
        }

        @Test
        @DisplayName("Should list only the first five unused public flavors but count all of them")
        void shouldCapUnusedFlavors() {
            // given
            List<FlavorRecord> flavors = List.of(
                flavor("f1", "m1.tiny", true),
                flavor("f2", "m1.small", true),
                flavor("f3", "m1.medium", true),
                flavor("f4", "m1.large", true),
                flavor("f5", "m1.xlarge", true),
                flavor("f6", "m1.huge", true),
                flavor("f7", "private", false),
                flavor("f8", "used", true));
            List<ServerRecord> servers = List.of(server("s1", "vm", "ACTIVE", "f8", 1));

            // when
            Recommendation recommendation = engine.unusedFlavors(flavors, servers).orElseThrow();

            // then
            assertThat(recommendation.getPriority()).isEqualTo(Priority.LOW);
            assertThat(recommendation.getMessage()).isEqualTo("6 public flavors are unused. Consider cleanup.");
            assertThat(recommendation.getAffected())
                .containsExactly("m1.tiny", "m1.small", "m1.medium", "m1.large", "m1.xlarge");
        }

        @Test
        @DisplayName("Should keep rule order rather than sorting by priority")
        void shouldKeepRuleOrder() {
            List<Recommendation> recommendations = engine.evaluate(capacity(10, 9, 10, 1),
                List.of(server("1", "broken", "ERROR")),
                List.of(hypervisor("compute-1", "disabled", 10, 9)),
                List.of(flavor("f1", "m1.tiny", true)));

            assertThat(recommendations).extracting(Recommendation::getType).containsExactly(
                RecommendationType.CAPACITY_WARNING,
                RecommendationType.HEALTH_ISSUE,
                RecommendationType.INFRASTRUCTURE_ISSUE,
                RecommendationType.OPTIMIZATION);
        }
    }

    @Test
    @DisplayName("Should serialize the affected list under the rule's own key")
    void shouldSerializeAffectedKey() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();
        Recommendation recommendation = engine.errorServers(List.of(server("1", "db-1", "ERROR"))).orElseThrow();
        Recommendation cpu = engine.cpuCapacity(CapacityMetric.of(10, 9)).orElseThrow();

        JsonNode json = objectMapper.valueToTree(recommendation);
        JsonNode cpuJson = objectMapper.valueToTree(cpu);

        assertThat(json.path("type").asText()).isEqualTo("health_issue");
        assertThat(json.path("priority").asText()).isEqualTo("critical");
        assertThat(json.path("affected_servers").get(0).asText()).isEqualTo("db-1");
        assertThat(json.has("affected")).isFalse();
        assertThat(json.has("affected_key")).isFalse();
        assertThat(cpuJson.size()).isEqualTo(4);
    }
}
