package org.tanzu.openstackmcp.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
