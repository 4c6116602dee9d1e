package org.tanzu.openstackmcp.inventory;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FlavorDetails extends FlavorRecord {
    private final Map<String, String> extraSpecs;

    public FlavorDetails(FlavorRecord flavor, Map<String, String> extraSpecs) {
        super(flavor.getId(), flavor.getName(), flavor.getVcpus(), flavor.getRam(), flavor.getDisk(),
              flavor.getEphemeral(), flavor.getSwap(), flavor.isPublic());
        this.extraSpecs = extraSpecs;
    }

    public Map<String, String> getExtraSpecs() { return extraSpecs; }
}
