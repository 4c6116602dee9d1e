package org.tanzu.openstackmcp.report;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verbosity of an inventory report. Only {@code detailed} includes per-resource listings.
 */
public enum ReportFormat {
    SUMMARY,
    DETAILED;

    /**
     * Parses the caller's format argument. A missing value means detailed; any value
     * other than "detailed" (ignoring case) means summary.
     */
    public static ReportFormat from(String value) {
        if (value == null) {
            return DETAILED;
        }
        return "detailed".equalsIgnoreCase(value.trim()) ? DETAILED : SUMMARY;
    }

    public boolean isDetailed() {
        return this == DETAILED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
