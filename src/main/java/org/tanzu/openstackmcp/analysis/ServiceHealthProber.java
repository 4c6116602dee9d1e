package org.tanzu.openstackmcp.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.tanzu.openstackmcp.config.OpenStackConfig;
import org.tanzu.openstackmcp.openstack.CloudResourceClient;
import org.tanzu.openstackmcp.openstack.ResourceKind;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Checks that each backing service answers a basic listing call.
 *
 * The compute, block storage and network probes run concurrently on the inventory
 * executor, each bounded by the probe timeout. A probe that fails or times out is
 * recorded as an unhealthy entry and never affects the other two.
 */
@Component
public class ServiceHealthProber {

    private static final Logger logger = LoggerFactory.getLogger(ServiceHealthProber.class);

    /** One listing call per service: nova, cinder, neutron */
    static final List<ResourceKind> PROBES = List.of(ResourceKind.SERVERS, ResourceKind.VOLUMES, ResourceKind.NETWORKS);

    private final CloudResourceClient client;
    private final Executor executor;
    private final Duration probeTimeout;
    private final Clock clock;

    public ServiceHealthProber(CloudResourceClient client,
                               @Qualifier("inventoryTaskExecutor") Executor executor,
                               OpenStackConfig openStackConfig,
                               Clock clock) {
        this.client = client;
        this.executor = executor;
        this.probeTimeout = openStackConfig.getProbeTimeout();
        this.clock = clock;
    }

    public ServiceHealthReport probeAll() {
        Map<String, CompletableFuture<ServiceHealthEntry>> probes = new LinkedHashMap<>();
        for (ResourceKind kind : PROBES) {
            String service = kind.getService().getServiceName();
            CompletableFuture<ServiceHealthEntry> probe;
            try {
                probe = CompletableFuture.supplyAsync(() -> probe(kind), executor);
            } catch (RejectedExecutionException e) {
                probe = CompletableFuture.completedFuture(
                    ServiceHealthEntry.unhealthy(service, serviceError(service, "probe not scheduled: " + e.getMessage()), now()));
            }
            probes.put(service, probe
                .orTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(failure -> failedProbe(service, failure)));
        }

        Map<String, ServiceHealthEntry> services = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<ServiceHealthEntry>> probe : probes.entrySet()) {
            services.put(probe.getKey(), probe.getValue().join());
        }

        ServiceHealthReport report = ServiceHealthReport.of(now(), services);
        logger.info("Service health: {} {}", report.getOverallStatus().value(), services.values());
        return report;
    }

    ServiceHealthEntry probe(ResourceKind kind) {
        String service = kind.getService().getServiceName();
        try {
            int count = client.list(kind).size();
            return ServiceHealthEntry.healthy(service, "Successfully retrieved " + count + " " + kind, now());
        } catch (RuntimeException e) {
            logger.warn("{} probe failed: {}", service, e.getMessage());
            return ServiceHealthEntry.unhealthy(service, serviceError(service, e.getMessage()), now());
        }
    }

    private ServiceHealthEntry failedProbe(String service, Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
        String message = cause instanceof TimeoutException
            ? "no response within " + probeTimeout
            : String.valueOf(cause.getMessage());
        logger.warn("{} probe did not complete: {}", service, message);
        return ServiceHealthEntry.unhealthy(service, serviceError(service, message), now());
    }

    private static String serviceError(String service, String message) {
        return Character.toUpperCase(service.charAt(0)) + service.substring(1) + " service error: " + message;
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
