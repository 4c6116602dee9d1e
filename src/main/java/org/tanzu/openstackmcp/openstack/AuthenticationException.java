package org.tanzu.openstackmcp.openstack;

/**
 * Keystone rejected the credentials or a token could not be obtained.
 */
public class AuthenticationException extends OpenStackException {

    public AuthenticationException(String message) {
        super(null, message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(null, message, cause);
    }
}
