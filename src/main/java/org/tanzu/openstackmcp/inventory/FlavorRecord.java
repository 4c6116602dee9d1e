package org.tanzu.openstackmcp.inventory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FlavorRecord implements ResourceRecord {
    private final String id;
    private final String name;
    private final long vcpus;
    private final long ram;
    private final long disk;
    private final long ephemeral;
    private final long swap;
    private final boolean isPublic;

    public FlavorRecord(String id, String name, long vcpus, long ram, long disk,
                        long ephemeral, long swap, boolean isPublic) {
        this.id = id;
        this.name = name;
        this.vcpus = vcpus;
        this.ram = ram;
        this.disk = disk;
        this.ephemeral = ephemeral;
        this.swap = swap;
        this.isPublic = isPublic;
    }

    @Override
    public String getId() { return id; }
    @Override
    public String getName() { return name; }
    public long getVcpus() { return vcpus; }
    /** RAM in MB */
    public long getRam() { return ram; }
    /** Root disk in GB */
    public long getDisk() { return disk; }
    public long getEphemeral() { return ephemeral; }
    /** Swap in MB */
    public long getSwap() { return swap; }
    @JsonProperty("is_public")
    public boolean isPublic() { return isPublic; }
}
