package org.tanzu.openstackmcp.openstack;

/**
 * Base class for failures reported by an OpenStack service.
 *
 * <p>The resource kind is known for collection and detail calls and is {@code null}
 * for failures that happen before any resource is addressed, such as authentication.
 */
public class OpenStackException extends RuntimeException {

    private final ResourceKind kind;

    public OpenStackException(ResourceKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public OpenStackException(ResourceKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ResourceKind getKind() { return kind; }
}
