package org.tanzu.openstackmcp.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ServiceStatus {
    HEALTHY,
    UNHEALTHY;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
