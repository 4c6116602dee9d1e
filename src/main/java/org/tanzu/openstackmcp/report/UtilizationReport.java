package org.tanzu.openstackmcp.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.tanzu.openstackmcp.analysis.HypervisorUtilization;
import org.tanzu.openstackmcp.inventory.Diagnostic;

import java.util.List;

/**
 * Per-hypervisor utilization with fleet totals.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UtilizationReport {

    private final String timestamp;
    private final List<HypervisorUtilization> hypervisors;
    private final Summary summary;
    private final List<Diagnostic> diagnostics;
    private final String error;

    public UtilizationReport(String timestamp, List<HypervisorUtilization> hypervisors, Summary summary,
                             List<Diagnostic> diagnostics) {
        this(timestamp, hypervisors, summary, diagnostics, null);
    }

    private UtilizationReport(String timestamp, List<HypervisorUtilization> hypervisors, Summary summary,
                              List<Diagnostic> diagnostics, String error) {
        this.timestamp = timestamp;
        this.hypervisors = hypervisors;
        this.summary = summary;
        this.diagnostics = diagnostics;
        this.error = error;
    }

    public static UtilizationReport failed(String timestamp, String error) {
        return new UtilizationReport(timestamp, null, null, null, error);
    }

    public String getTimestamp() { return timestamp; }
    public List<HypervisorUtilization> getHypervisors() { return hypervisors; }
    public Summary getSummary() { return summary; }
    public List<Diagnostic> getDiagnostics() { return diagnostics; }
    public String getError() { return error; }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Summary {
        private final int totalHypervisors;
        private final int activeHypervisors;
        private final long totalVms;

        public Summary(int totalHypervisors, int activeHypervisors, long totalVms) {
            this.totalHypervisors = totalHypervisors;
            this.activeHypervisors = activeHypervisors;
            this.totalVms = totalVms;
        }

        public int getTotalHypervisors() { return totalHypervisors; }
        public int getActiveHypervisors() { return activeHypervisors; }
        public long getTotalVms() { return totalVms; }
    }
}
