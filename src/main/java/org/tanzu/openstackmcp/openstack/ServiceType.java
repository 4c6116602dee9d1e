package org.tanzu.openstackmcp.openstack;

import java.util.List;

/**
 * OpenStack services backing the inventory.
 *
 * <p>Each constant knows the catalog types it may be published under and the
 * devstack-style path used when the catalog has no usable entry.
 */
public enum ServiceType {

    COMPUTE("nova", List.of("compute"), "/compute/v2.1", true),
    BLOCK_STORAGE("cinder", List.of("volumev3", "block-storage", "volume"), "/volume/v3", true),
    NETWORK("neutron", List.of("network"), "/networking/v2.0", false);

    private final String serviceName;
    private final List<String> catalogTypes;
    private final String fallbackPath;
    private final boolean projectScoped;

    ServiceType(String serviceName, List<String> catalogTypes, String fallbackPath, boolean projectScoped) {
        this.serviceName = serviceName;
        this.catalogTypes = catalogTypes;
        this.fallbackPath = fallbackPath;
        this.projectScoped = projectScoped;
    }

    /** Project code name, used as the key in health documents. */
    public String getServiceName() { return serviceName; }

    public List<String> getCatalogTypes() { return catalogTypes; }

    public String getFallbackPath() { return fallbackPath; }

    /** Whether the fallback URL carries the project id as its last segment. */
    public boolean isProjectScoped() { return projectScoped; }
}
