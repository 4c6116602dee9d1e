package org.tanzu.openstackmcp.inventory;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ImageDetails extends ImageRecord {
    private final Map<String, String> metadata;

    public ImageDetails(ImageRecord image, Map<String, String> metadata) {
        super(image.getId(), image.getName(), image.getStatus(), image.getCreated(), image.getUpdated(),
              image.getSize(), image.getMinDisk(), image.getMinRam(), image.getProgress());
        this.metadata = metadata;
    }

    public Map<String, String> getMetadata() { return metadata; }
}
