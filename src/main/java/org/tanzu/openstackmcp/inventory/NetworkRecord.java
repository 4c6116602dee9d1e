package org.tanzu.openstackmcp.inventory;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NetworkRecord implements ResourceRecord {
    private final String id;
    private final String name;
    private final String status;
    private final Boolean adminStateUp;
    private final boolean shared;
    private final boolean external;
    private final String providerNetworkType;
    private final List<String> subnets;

    public NetworkRecord(String id, String name, String status, Boolean adminStateUp, boolean shared,
                         boolean external, String providerNetworkType, List<String> subnets) {
        this.id = id;
        this.name = name;
        this.status = status;
        this.adminStateUp = adminStateUp;
        this.shared = shared;
        this.external = external;
        this.providerNetworkType = providerNetworkType;
        this.subnets = subnets;
    }

    @Override
    public String getId() { return id; }
    @Override
    public String getName() { return name; }
    public String getStatus() { return status; }
    public Boolean getAdminStateUp() { return adminStateUp; }
    public boolean isShared() { return shared; }
    /** True for provider networks flagged router:external. */
    public boolean isExternal() { return external; }
    /** Only visible to administrators; null otherwise. */
    public String getProviderNetworkType() { return providerNetworkType; }
    /** Subnet ids */
    public List<String> getSubnets() { return subnets; }
}
