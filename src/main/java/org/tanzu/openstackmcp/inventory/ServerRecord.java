package org.tanzu.openstackmcp.inventory;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A Nova server as returned by the listing endpoint.
 *
 * Flavor and image references are reduced to their ids. The image id is null for
 * servers booted from a volume.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ServerRecord implements ResourceRecord {
    private final String id;
    private final String name;
    private final String status;
    private final String host;
    private final String created;
    private final String flavorId;
    private final String imageId;
    private final Integer powerState;
    private final String taskState;

    public ServerRecord(String id, String name, String status, String host, String created,
                        String flavorId, String imageId, Integer powerState, String taskState) {
        this.id = id;
        this.name = name;
        this.status = status;
        this.host = host;
        this.created = created;
        this.flavorId = flavorId;
        this.imageId = imageId;
        this.powerState = powerState;
        this.taskState = taskState;
    }

    @Override
    public String getId() { return id; }
    @Override
    public String getName() { return name; }
    public String getStatus() { return status; }
    public String getHost() { return host; }
    public String getCreated() { return created; }
    public String getFlavorId() { return flavorId; }
    public String getImageId() { return imageId; }
    /** Nova power state code; 1 means running. */
    public Integer getPowerState() { return powerState; }
    public String getTaskState() { return taskState; }

    @Override
    public String toString() {
        return "ServerRecord{id='" + id + "', name='" + name + "', status='" + status + "', powerState=" + powerState + "}";
    }
}
