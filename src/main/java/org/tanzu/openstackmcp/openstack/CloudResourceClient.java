package org.tanzu.openstackmcp.openstack;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the raw resource representations of an OpenStack cloud.
 *
 * <p>Implementations return the platform's own JSON objects; shaping them into
 * typed records is left to the caller. Any call may throw an {@link OpenStackException}.
 */
public interface CloudResourceClient {

    /**
     * Lists every resource of one kind, in the order the service returns them.
     *
     * @param kind the collection to read
     * @return the raw resource objects, never {@code null}
     */
    List<JsonNode> list(ResourceKind kind);

    /**
     * Fetches one resource by id.
     *
     * @param kind a kind for which {@link ResourceKind#supportsDetails()} is true
     * @param id the resource id
     * @return the raw resource object, or empty when the service does not know the id
     */
    Optional<JsonNode> get(ResourceKind kind, String id);
}
