package org.tanzu.openstackmcp.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationType {
    CAPACITY_WARNING,
    HEALTH_ISSUE,
    INFRASTRUCTURE_ISSUE,
    OPTIMIZATION;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
