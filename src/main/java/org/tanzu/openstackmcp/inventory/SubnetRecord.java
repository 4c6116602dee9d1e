package org.tanzu.openstackmcp.inventory;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SubnetRecord implements ResourceRecord {
    private final String id;
    private final String name;
    private final String networkId;
    private final String cidr;
    private final Integer ipVersion;
    private final String gatewayIp;
    private final boolean enableDhcp;
    private final List<String> allocationPools;

    public SubnetRecord(String id, String name, String networkId, String cidr, Integer ipVersion,
                        String gatewayIp, boolean enableDhcp, List<String> allocationPools) {
        this.id = id;
        this.name = name;
        this.networkId = networkId;
        this.cidr = cidr;
        this.ipVersion = ipVersion;
        this.gatewayIp = gatewayIp;
        this.enableDhcp = enableDhcp;
        this.allocationPools = allocationPools;
    }

    @Override
    public String getId() { return id; }
    @Override
    public String getName() { return name; }
    public String getNetworkId() { return networkId; }
    public String getCidr() { return cidr; }
    public Integer getIpVersion() { return ipVersion; }
    public String getGatewayIp() { return gatewayIp; }
    public boolean isEnableDhcp() { return enableDhcp; }
    /** Pools rendered as "start-end" */
    public List<String> getAllocationPools() { return allocationPools; }
}
