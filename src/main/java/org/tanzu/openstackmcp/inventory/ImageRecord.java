package org.tanzu.openstackmcp.inventory;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ImageRecord implements ResourceRecord {
    private final String id;
    private final String name;
    private final String status;
    private final String created;
    private final String updated;
    private final Long size;
    private final long minDisk;
    private final long minRam;
    private final Integer progress;

    public ImageRecord(String id, String name, String status, String created, String updated,
                       Long size, long minDisk, long minRam, Integer progress) {
        this.id = id;
        this.name = name;
        this.status = status;
        this.created = created;
        this.updated = updated;
        this.size = size;
        this.minDisk = minDisk;
        this.minRam = minRam;
        this.progress = progress;
    }

    @Override
    public String getId() { return id; }
    @Override
    public String getName() { return name; }
    public String getStatus() { return status; }
    public String getCreated() { return created; }
    public String getUpdated() { return updated; }
    /** Size in bytes, null while the image is still being uploaded. */
    public Long getSize() { return size; }
    public long getMinDisk() { return minDisk; }
    public long getMinRam() { return minRam; }
    public Integer getProgress() { return progress; }
}
