package org.tanzu.openstackmcp.analysis;

import org.springframework.stereotype.Component;
import org.tanzu.openstackmcp.inventory.ServerRecord;

import java.util.Set;

/**
 * Derives a {@link ResourceHealth} from a server's status and power state.
 *
 * Rules are checked in order and the first match wins. An ACTIVE server only counts
 * as healthy when the hypervisor reports it running (power state 1); any other
 * power state leaves it transitioning.
 */
@Component
public class ResourceHealthClassifier {

    static final int POWER_STATE_RUNNING = 1;

    private static final Set<String> STOPPED_STATUSES = Set.of("SHUTOFF", "SUSPENDED");

    public ResourceHealth classify(ServerRecord server) {
        String status = server.getStatus();
        Integer powerState = server.getPowerState();
        if ("ACTIVE".equals(status) && powerState != null && powerState == POWER_STATE_RUNNING) {
            return ResourceHealth.HEALTHY;
        }
        if ("ERROR".equals(status)) {
            return ResourceHealth.ERROR;
        }
        if (status != null && STOPPED_STATUSES.contains(status)) {
            return ResourceHealth.STOPPED;
        }
        return ResourceHealth.TRANSITIONING;
    }
}
