package org.tanzu.openstackmcp.inventory;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * A Cinder volume. Attachments are reduced to the ids of the servers using the volume.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VolumeRecord implements ResourceRecord {
    private final String id;
    private final String name;
    private final String status;
    private final long size;
    private final String volumeType;
    private final String createdAt;
    private final List<String> attachments;
    private final String availabilityZone;
    private final boolean bootable;

    public VolumeRecord(String id, String name, String status, long size, String volumeType, String createdAt,
                        List<String> attachments, String availabilityZone, boolean bootable) {
        this.id = id;
        this.name = name;
        this.status = status;
        this.size = size;
        this.volumeType = volumeType;
        this.createdAt = createdAt;
        this.attachments = attachments;
        this.availabilityZone = availabilityZone;
        this.bootable = bootable;
    }

    @Override
    public String getId() { return id; }
    @Override
    public String getName() { return name; }
    public String getStatus() { return status; }
    /** Size in GB */
    public long getSize() { return size; }
    public String getVolumeType() { return volumeType; }
    public String getCreatedAt() { return createdAt; }
    public List<String> getAttachments() { return attachments; }
    public String getAvailabilityZone() { return availabilityZone; }
    public boolean isBootable() { return bootable; }
}
