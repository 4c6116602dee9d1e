package org.tanzu.openstackmcp.analysis;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ServiceHealthEntry {

    private final String serviceName;
    private final ServiceStatus status;
    private final String message;
    private final String lastCheck;

    public ServiceHealthEntry(String serviceName, ServiceStatus status, String message, String lastCheck) {
        this.serviceName = serviceName;
        this.status = status;
        this.message = message;
        this.lastCheck = lastCheck;
    }

    public static ServiceHealthEntry healthy(String serviceName, String message, String lastCheck) {
        return new ServiceHealthEntry(serviceName, ServiceStatus.HEALTHY, message, lastCheck);
    }

    public static ServiceHealthEntry unhealthy(String serviceName, String message, String lastCheck) {
        return new ServiceHealthEntry(serviceName, ServiceStatus.UNHEALTHY, message, lastCheck);
    }

    public String getServiceName() { return serviceName; }
    public ServiceStatus getStatus() { return status; }
    public String getMessage() { return message; }
    public String getLastCheck() { return lastCheck; }

    @Override
    public String toString() {
        return serviceName + "=" + status.value();
    }
}
