package org.tanzu.openstackmcp.openstack;

/**
 * A tool was called with a missing or invalid argument. Raised before any service call.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
