package org.tanzu.openstackmcp.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse health of one server.
 */
public enum ResourceHealth {
    HEALTHY,
    ERROR,
    STOPPED,
    TRANSITIONING;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
