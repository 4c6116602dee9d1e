package org.tanzu.openstackmcp.openstack;

/**
 * Resource collections the inventory reads, with the REST coordinates of each.
 *
 * <p>Kinds without a detail path cannot be looked up individually.
 */
public enum ResourceKind {

    SERVERS("servers", ServiceType.COMPUTE, "/servers/detail", "servers", "/servers/", "server"),
    HYPERVISORS("hypervisors", ServiceType.COMPUTE, "/os-hypervisors/detail", "hypervisors", null, null),
    FLAVORS("flavors", ServiceType.COMPUTE, "/flavors/detail", "flavors", "/flavors/", "flavor"),
    IMAGES("images", ServiceType.COMPUTE, "/images/detail", "images", "/images/", "image"),
    VOLUMES("volumes", ServiceType.BLOCK_STORAGE, "/volumes/detail", "volumes", null, null),
    VOLUME_TYPES("volume_types", ServiceType.BLOCK_STORAGE, "/types", "volume_types", null, null),
    NETWORKS("networks", ServiceType.NETWORK, "/networks", "networks", null, null),
    SUBNETS("subnets", ServiceType.NETWORK, "/subnets", "subnets", null, null),
    ROUTERS("routers", ServiceType.NETWORK, "/routers", "routers", null, null);

    private final String label;
    private final ServiceType service;
    private final String listPath;
    private final String collectionKey;
    private final String detailPathPrefix;
    private final String detailKey;

    ResourceKind(String label, ServiceType service, String listPath, String collectionKey,
                 String detailPathPrefix, String detailKey) {
        this.label = label;
        this.service = service;
        this.listPath = listPath;
        this.collectionKey = collectionKey;
        this.detailPathPrefix = detailPathPrefix;
        this.detailKey = detailKey;
    }

    public String getLabel() { return label; }
    public ServiceType getService() { return service; }
    public String getListPath() { return listPath; }
    public String getCollectionKey() { return collectionKey; }
    public String getDetailKey() { return detailKey; }

    public boolean supportsDetails() {
        return detailPathPrefix != null;
    }

    /**
     * Builds the detail path for one resource.
     *
     * @param id the resource id, appended as a single path segment
     * @return the service-relative path
     * @throws UnsupportedOperationException if this kind has no detail endpoint
     */
    public String detailPath(String id) {
        if (!supportsDetails()) {
            throw new UnsupportedOperationException("No detail endpoint for " + label);
        }
        return detailPathPrefix + id;
    }

    @Override
    public String toString() {
        return label;
    }
}
