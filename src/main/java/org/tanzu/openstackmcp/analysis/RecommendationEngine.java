package org.tanzu.openstackmcp.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.openstackmcp.inventory.FlavorRecord;
import org.tanzu.openstackmcp.inventory.HypervisorRecord;
import org.tanzu.openstackmcp.inventory.ResourceRecord;
import org.tanzu.openstackmcp.inventory.ServerRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Threshold rules that turn aggregated inventory into advisory entries.
 *
 * RULES (evaluated in this order, each independently):
 * 1. CPU: aggregate vCPU utilization above 80% is a high priority capacity warning
 * 2. Memory: same threshold for memory
 * 3. Error servers: any server in ERROR is a critical health issue
 * 4. Disabled hypervisors: any hypervisor whose status is not "enabled"
 * 5. Unused flavors: public flavors no server references, reported as a low priority cleanup
 *
 * The result keeps rule order; it is not re-sorted by priority.
 */
@Component
public class RecommendationEngine {

    private static final Logger logger = LoggerFactory.getLogger(RecommendationEngine.class);

    static final double CAPACITY_THRESHOLD = 0.8;
    static final int MAX_UNUSED_FLAVORS = 5;

    public List<Recommendation> evaluate(CapacitySummary capacity,
                                         Collection<ServerRecord> servers,
                                         Collection<HypervisorRecord> hypervisors,
                                         Collection<FlavorRecord> flavors) {
        List<Recommendation> recommendations = new ArrayList<>();
        cpuCapacity(capacity.getVcpus()).ifPresent(recommendations::add);
        memoryCapacity(capacity.getMemoryMb()).ifPresent(recommendations::add);
        errorServers(servers).ifPresent(recommendations::add);
        disabledHypervisors(hypervisors).ifPresent(recommendations::add);
        unusedFlavors(flavors, servers).ifPresent(recommendations::add);
        logger.debug("Evaluated recommendations: {}", recommendations);
        return recommendations;
    }

    Optional<Recommendation> cpuCapacity(CapacityMetric vcpus) {
        if (!vcpus.exceeds(CAPACITY_THRESHOLD)) {
            return Optional.empty();
        }
        return Optional.of(new Recommendation(RecommendationType.CAPACITY_WARNING, "CPU",
            "CPU utilization is high (" + vcpus.getUtilizationPercent() + "%). Consider adding more compute capacity.",
            Priority.HIGH));
    }

    Optional<Recommendation> memoryCapacity(CapacityMetric memory) {
        if (!memory.exceeds(CAPACITY_THRESHOLD)) {
            return Optional.empty();
        }
        return Optional.of(new Recommendation(RecommendationType.CAPACITY_WARNING, "Memory",
            "Memory utilization is high (" + memory.getUtilizationPercent() + "%). Consider adding more memory or nodes.",
            Priority.HIGH));
    }

    Optional<Recommendation> errorServers(Collection<ServerRecord> servers) {
        List<String> affected = new ArrayList<>();
        for (ServerRecord server : servers) {
            if ("ERROR".equals(server.getStatus())) {
                affected.add(ResourceRecord.displayName(server));
            }
        }
        if (affected.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Recommendation(RecommendationType.HEALTH_ISSUE, "Servers",
            affected.size() + " servers are in ERROR state. Investigation required.",
            Priority.CRITICAL, "affected_servers", affected));
    }

    Optional<Recommendation> disabledHypervisors(Collection<HypervisorRecord> hypervisors) {
        List<String> affected = new ArrayList<>();
        for (HypervisorRecord hypervisor : hypervisors) {
            if (!"enabled".equals(hypervisor.getStatus())) {
                affected.add(ResourceRecord.displayName(hypervisor));
            }
        }
        if (affected.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Recommendation(RecommendationType.INFRASTRUCTURE_ISSUE, "Hypervisors",
            affected.size() + " hypervisors are not enabled. Check hypervisor health.",
            Priority.MEDIUM, "affected_hypervisors", affected));
    }

    /**
     * Lists at most {@value #MAX_UNUSED_FLAVORS} names, in flavor order; the message counts all of them.
     */
    Optional<Recommendation> unusedFlavors(Collection<FlavorRecord> flavors, Collection<ServerRecord> servers) {
        Set<String> referenced = new HashSet<>();
        for (ServerRecord server : servers) {
            if (server.getFlavorId() != null) {
                referenced.add(server.getFlavorId());
            }
        }

        List<String> unused = new ArrayList<>();
        for (FlavorRecord flavor : flavors) {
            if (flavor.isPublic() && !referenced.contains(flavor.getId())) {
                unused.add(ResourceRecord.displayName(flavor));
            }
        }
        if (unused.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Recommendation(RecommendationType.OPTIMIZATION, "Flavors",
            unused.size() + " public flavors are unused. Consider cleanup.",
            Priority.LOW, "unused_flavors", new ArrayList<>(unused.subList(0, Math.min(unused.size(), MAX_UNUSED_FLAVORS)))));
    }
}
