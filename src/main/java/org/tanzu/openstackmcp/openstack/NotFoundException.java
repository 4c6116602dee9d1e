package org.tanzu.openstackmcp.openstack;

public class NotFoundException extends OpenStackException {

    private final String resourceId;

    public NotFoundException(ResourceKind kind, String resourceId) {
        super(kind, "No " + kind.getDetailKey() + " with id " + resourceId);
        this.resourceId = resourceId;
    }

    public String getResourceId() { return resourceId; }
}
