package org.tanzu.openstackmcp.inventory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The collections read for one report, taken once and never refreshed.
 *
 * A kind that was not requested, or whose fetch failed, reads as an empty list;
 * failures are listed in {@link #getDiagnostics()}.
 */
public class InventorySnapshot {

    private final FetchResult<ServerRecord> servers;
    private final FetchResult<HypervisorRecord> hypervisors;
    private final FetchResult<FlavorRecord> flavors;
    private final FetchResult<ImageRecord> images;
    private final FetchResult<VolumeRecord> volumes;
    private final FetchResult<VolumeTypeRecord> volumeTypes;
    private final FetchResult<NetworkRecord> networks;
    private final FetchResult<SubnetRecord> subnets;
    private final FetchResult<RouterRecord> routers;

    private InventorySnapshot(Builder builder) {
        this.servers = builder.servers;
        this.hypervisors = builder.hypervisors;
        this.flavors = builder.flavors;
        this.images = builder.images;
        this.volumes = builder.volumes;
        this.volumeTypes = builder.volumeTypes;
        this.networks = builder.networks;
        this.subnets = builder.subnets;
        this.routers = builder.routers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static InventorySnapshot empty() {
        return builder().build();
    }

    public List<ServerRecord> getServers() { return records(servers); }
    public List<HypervisorRecord> getHypervisors() { return records(hypervisors); }
    public List<FlavorRecord> getFlavors() { return records(flavors); }
    public List<ImageRecord> getImages() { return records(images); }
    public List<VolumeRecord> getVolumes() { return records(volumes); }
    public List<VolumeTypeRecord> getVolumeTypes() { return records(volumeTypes); }
    public List<NetworkRecord> getNetworks() { return records(networks); }
    public List<SubnetRecord> getSubnets() { return records(subnets); }
    public List<RouterRecord> getRouters() { return records(routers); }

    /**
     * Diagnostics of the failed fetches, in resource kind order.
     */
    public List<Diagnostic> getDiagnostics() {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (FetchResult<?> result : Arrays.asList(servers, hypervisors, flavors, images, volumes,
                                                  volumeTypes, networks, subnets, routers)) {
            if (result != null && !result.isSuccess()) {
                diagnostics.add(result.getDiagnostic());
            }
        }
        return diagnostics;
    }

    private static <T> List<T> records(FetchResult<T> result) {
        return result == null ? Collections.emptyList() : result.getRecords();
    }

    /**
     * Collects one fetch result per kind; a kind never set stays empty without a diagnostic.
     */
    public static final class Builder {
        private FetchResult<ServerRecord> servers;
        private FetchResult<HypervisorRecord> hypervisors;
        private FetchResult<FlavorRecord> flavors;
        private FetchResult<ImageRecord> images;
        private FetchResult<VolumeRecord> volumes;
        private FetchResult<VolumeTypeRecord> volumeTypes;
        private FetchResult<NetworkRecord> networks;
        private FetchResult<SubnetRecord> subnets;
        private FetchResult<RouterRecord> routers;

        private Builder() {
        }

        public Builder servers(FetchResult<ServerRecord> servers) {
            this.servers = servers;
            return this;
        }

        public Builder hypervisors(FetchResult<HypervisorRecord> hypervisors) {
            this.hypervisors = hypervisors;
            return this;
        }

        public Builder flavors(FetchResult<FlavorRecord> flavors) {
            this.flavors = flavors;
            return this;
        }

        public Builder images(FetchResult<ImageRecord> images) {
            this.images = images;
            return this;
        }

        public Builder volumes(FetchResult<VolumeRecord> volumes) {
            this.volumes = volumes;
            return this;
        }

        public Builder volumeTypes(FetchResult<VolumeTypeRecord> volumeTypes) {
            this.volumeTypes = volumeTypes;
            return this;
        }

        public Builder networks(FetchResult<NetworkRecord> networks) {
            this.networks = networks;
            return this;
        }

        public Builder subnets(FetchResult<SubnetRecord> subnets) {
            this.subnets = subnets;
            return this;
        }

        public Builder routers(FetchResult<RouterRecord> routers) {
            this.routers = routers;
            return this;
        }

        public InventorySnapshot build() {
            return new InventorySnapshot(this);
        }
    }
}
