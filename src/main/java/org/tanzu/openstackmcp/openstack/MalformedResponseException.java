package org.tanzu.openstackmcp.openstack;

/**
 * A service answered, but not with the JSON shape the client expects.
 */
public class MalformedResponseException extends OpenStackException {

    public MalformedResponseException(ResourceKind kind, String message) {
        super(kind, message);
    }

    public MalformedResponseException(ResourceKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
