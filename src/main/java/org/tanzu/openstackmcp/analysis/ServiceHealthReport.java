package org.tanzu.openstackmcp.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of probing the compute, block storage and network services.
 *
 * Services are keyed by their OpenStack project name (nova, cinder, neutron). A report
 * that could not be produced at all carries only the timestamp, a critical verdict and
 * the error.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServiceHealthReport {

    private final String timestamp;
    private final Map<String, ServiceHealthEntry> services;
    private final OverallHealth overallStatus;
    private final Summary summary;
    private final String error;

    private ServiceHealthReport(String timestamp, Map<String, ServiceHealthEntry> services,
                                OverallHealth overallStatus, Summary summary, String error) {
        this.timestamp = timestamp;
        this.services = services;
        this.overallStatus = overallStatus;
        this.summary = summary;
        this.error = error;
    }

    public static ServiceHealthReport of(String timestamp, Map<String, ServiceHealthEntry> services) {
        int unhealthy = 0;
        for (ServiceHealthEntry entry : services.values()) {
            if (entry.getStatus() == ServiceStatus.UNHEALTHY) {
                unhealthy++;
            }
        }
        return new ServiceHealthReport(timestamp,
            Collections.unmodifiableMap(new LinkedHashMap<>(services)),
            OverallHealth.fromUnhealthyCount(unhealthy),
            new Summary(services.size() - unhealthy, unhealthy, services.size()),
            null);
    }

    public static ServiceHealthReport failed(String timestamp, String error) {
        return new ServiceHealthReport(timestamp, null, OverallHealth.CRITICAL, null, error);
    }

    public String getTimestamp() { return timestamp; }
    public Map<String, ServiceHealthEntry> getServices() { return services; }
    public OverallHealth getOverallStatus() { return overallStatus; }
    public Summary getSummary() { return summary; }
    public String getError() { return error; }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Summary {
        private final int healthyServices;
        private final int unhealthyServices;
        private final int totalServices;

        public Summary(int healthyServices, int unhealthyServices, int totalServices) {
            this.healthyServices = healthyServices;
            this.unhealthyServices = unhealthyServices;
            this.totalServices = totalServices;
        }

        public int getHealthyServices() { return healthyServices; }
        public int getUnhealthyServices() { return unhealthyServices; }
        public int getTotalServices() { return totalServices; }
    }
}
