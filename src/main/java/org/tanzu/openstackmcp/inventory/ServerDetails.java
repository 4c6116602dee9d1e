package org.tanzu.openstackmcp.inventory;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * A single server lookup, carrying addresses, metadata and the last fault on top of
 * the listing fields.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ServerDetails extends ServerRecord {
    private final String updated;
    private final String fault;
    private final Map<String, List<String>> addresses;
    private final Map<String, String> metadata;

    public ServerDetails(ServerRecord server, String updated, String fault,
                         Map<String, List<String>> addresses, Map<String, String> metadata) {
        super(server.getId(), server.getName(), server.getStatus(), server.getHost(), server.getCreated(),
              server.getFlavorId(), server.getImageId(), server.getPowerState(), server.getTaskState());
        this.updated = updated;
        this.fault = fault;
        this.addresses = addresses;
        this.metadata = metadata;
    }

    public String getUpdated() { return updated; }
    /** Fault message of an errored server, or null. */
    public String getFault() { return fault; }
    /** IP addresses keyed by network name. */
    public Map<String, List<String>> getAddresses() { return addresses; }
    public Map<String, String> getMetadata() { return metadata; }
}
