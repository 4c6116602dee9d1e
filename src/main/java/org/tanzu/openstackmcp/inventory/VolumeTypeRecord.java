package org.tanzu.openstackmcp.inventory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VolumeTypeRecord implements ResourceRecord {
    private final String id;
    private final String name;
    private final String description;
    private final boolean isPublic;
    private final Map<String, String> extraSpecs;

    public VolumeTypeRecord(String id, String name, String description, boolean isPublic,
                            Map<String, String> extraSpecs) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.isPublic = isPublic;
        this.extraSpecs = extraSpecs;
    }

    @Override
    public String getId() { return id; }
    @Override
    public String getName() { return name; }
    public String getDescription() { return description; }
    @JsonProperty("is_public")
    public boolean isPublic() { return isPublic; }
    public Map<String, String> getExtraSpecs() { return extraSpecs; }
}
