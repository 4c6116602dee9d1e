package org.tanzu.openstackmcp.openstack;

/**
 * Network failure, timeout, or an unexpected HTTP status from a service endpoint.
 */
public class TransportException extends OpenStackException {

    public TransportException(ResourceKind kind, String message) {
        super(kind, message);
    }

    public TransportException(ResourceKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
