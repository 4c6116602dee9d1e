package org.tanzu.openstackmcp.analysis;

import org.springframework.stereotype.Component;
import org.tanzu.openstackmcp.inventory.FlavorRecord;
import org.tanzu.openstackmcp.inventory.HypervisorRecord;
import org.tanzu.openstackmcp.inventory.ServerRecord;

import java.util.Collection;
import java.util.Optional;

/**
 * Combines a server with its flavor and hosting hypervisor.
 */
@Component
public class ServerResourceAnalyzer {

    private final ResourceHealthClassifier healthClassifier;

    public ServerResourceAnalyzer(ResourceHealthClassifier healthClassifier) {
        this.healthClassifier = healthClassifier;
    }

    /**
     * @param server the server to analyze
     * @param flavor the server's flavor, or null when it could not be resolved
     * @param hypervisors candidate hosts; may be empty
     */
    public ServerAnalysis analyze(ServerRecord server, FlavorRecord flavor, Collection<HypervisorRecord> hypervisors) {
        ServerAnalysis.ServerInfo info = new ServerAnalysis.ServerInfo(
            server.getId(), server.getName(), server.getStatus(), server.getHost(), server.getCreated());

        ServerAnalysis.ResourceAllocation allocation = flavor == null
            ? ServerAnalysis.ResourceAllocation.UNRESOLVED
            : new ServerAnalysis.ResourceAllocation(flavor.getVcpus(), flavor.getRam(), flavor.getDisk(), flavor.getEphemeral());

        ServerAnalysis.HostAnalysis host = findHost(server, hypervisors)
            .map(h -> new ServerAnalysis.HostAnalysis(h.getHypervisorHostname(), h.getStatus(), h.getState(),
                h.getVcpus(), h.getVcpusUsed(), h.getMemoryMb(), h.getMemoryMbUsed(), h.getRunningVms()))
            .orElse(ServerAnalysis.HostAnalysis.UNRESOLVED);

        return new ServerAnalysis(info, allocation, host, healthClassifier.classify(server));
    }

    /**
     * The server's host is the compute service host, which usually equals the hypervisor
     * hostname but may be its short form; either match is accepted.
     */
    Optional<HypervisorRecord> findHost(ServerRecord server, Collection<HypervisorRecord> hypervisors) {
        String host = server.getHost();
        if (host == null || host.isEmpty()) {
            return Optional.empty();
        }
        for (HypervisorRecord hypervisor : hypervisors) {
            if (host.equals(hypervisor.getHypervisorHostname()) || host.equals(hypervisor.getServiceHost())) {
                return Optional.of(hypervisor);
            }
        }
        return Optional.empty();
    }
}
