package org.tanzu.openstackmcp.inventory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RouterRecord implements ResourceRecord {
    private final String id;
    private final String name;
    private final String status;
    private final Boolean adminStateUp;
    private final String externalGatewayNetworkId;
    private final Boolean ha;
    private final Boolean distributed;

    public RouterRecord(String id, String name, String status, Boolean adminStateUp,
                        String externalGatewayNetworkId, Boolean ha, Boolean distributed) {
        this.id = id;
        this.name = name;
        this.status = status;
        this.adminStateUp = adminStateUp;
        this.externalGatewayNetworkId = externalGatewayNetworkId;
        this.ha = ha;
        this.distributed = distributed;
    }

    @Override
    public String getId() { return id; }
    @Override
    public String getName() { return name; }
    public String getStatus() { return status; }
    public Boolean getAdminStateUp() { return adminStateUp; }
    public String getExternalGatewayNetworkId() { return externalGatewayNetworkId; }

    @JsonProperty("has_external_gateway")
    public boolean hasExternalGateway() { return externalGatewayNetworkId != null; }

    /** Admin-only attribute; null when hidden. */
    public Boolean getHa() { return ha; }
    /** Admin-only attribute; null when hidden. */
    public Boolean getDistributed() { return distributed; }
}
