package org.tanzu.openstackmcp.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.tanzu.openstackmcp.analysis.CapacityMetric;
import org.tanzu.openstackmcp.inventory.Diagnostic;

import java.util.List;
import java.util.Map;

/**
 * Headline counts for servers, hypervisor capacity, volumes and networks.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InfrastructureSummary {

    private final String timestamp;
    private final Compute compute;
    private final Storage storage;
    private final Network network;
    private final List<Diagnostic> diagnostics;
    private final String error;

    public InfrastructureSummary(String timestamp, Compute compute, Storage storage, Network network,
                                 List<Diagnostic> diagnostics) {
        this(timestamp, compute, storage, network, diagnostics, null);
    }

    private InfrastructureSummary(String timestamp, Compute compute, Storage storage, Network network,
                                  List<Diagnostic> diagnostics, String error) {
        this.timestamp = timestamp;
        this.compute = compute;
        this.storage = storage;
        this.network = network;
        this.diagnostics = diagnostics;
        this.error = error;
    }

    public static InfrastructureSummary failed(String timestamp, String error) {
        return new InfrastructureSummary(timestamp, null, null, null, null, error);
    }

    public String getTimestamp() { return timestamp; }
    public Compute getCompute() { return compute; }
    public Storage getStorage() { return storage; }
    public Network getNetwork() { return network; }
    public List<Diagnostic> getDiagnostics() { return diagnostics; }
    public String getError() { return error; }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Compute {
        private final Servers servers;
        private final Hypervisors hypervisors;

        public Compute(Servers servers, Hypervisors hypervisors) {
            this.servers = servers;
            this.hypervisors = hypervisors;
        }

        public Servers getServers() { return servers; }
        public Hypervisors getHypervisors() { return hypervisors; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Servers {
        private final int total;
        private final Map<String, Integer> byStatus;

        public Servers(int total, Map<String, Integer> byStatus) {
            this.total = total;
            this.byStatus = byStatus;
        }

        public int getTotal() { return total; }
        public Map<String, Integer> getByStatus() { return byStatus; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Hypervisors {
        private final int total;
        private final CapacityMetric vcpus;
        private final CapacityMetric memoryMb;

        public Hypervisors(int total, CapacityMetric vcpus, CapacityMetric memoryMb) {
            this.total = total;
            this.vcpus = vcpus;
            this.memoryMb = memoryMb;
        }

        public int getTotal() { return total; }
        public CapacityMetric getVcpus() { return vcpus; }
        public CapacityMetric getMemoryMb() { return memoryMb; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Storage {
        private final Volumes volumes;

        public Storage(Volumes volumes) {
            this.volumes = volumes;
        }

        public Volumes getVolumes() { return volumes; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Volumes {
        private final int total;
        private final long totalSizeGb;

        public Volumes(int total, long totalSizeGb) {
            this.total = total;
            this.totalSizeGb = totalSizeGb;
        }

        public int getTotal() { return total; }
        public long getTotalSizeGb() { return totalSizeGb; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Network {
        private final Networks networks;

        public Network(Networks networks) {
            this.networks = networks;
        }

        public Networks getNetworks() { return networks; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Networks {
        private final int total;
        private final int external;

        public Networks(int total, int external) {
            this.total = total;
            this.external = external;
        }

        public int getTotal() { return total; }
        public int getExternal() { return external; }
    }
}
