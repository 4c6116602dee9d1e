package org.tanzu.openstackmcp.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verdict over all probed services: one failing service degrades the cloud, two or more make it critical.
 */
public enum OverallHealth {
    HEALTHY,
    DEGRADED,
    CRITICAL;

    public static OverallHealth fromUnhealthyCount(int unhealthy) {
        if (unhealthy >= 2) {
            return CRITICAL;
        }
        return unhealthy == 1 ? DEGRADED : HEALTHY;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
