package org.tanzu.openstackmcp.inventory;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.tanzu.openstackmcp.config.OpenStackConfig;
import org.tanzu.openstackmcp.openstack.CloudResourceClient;
import org.tanzu.openstackmcp.openstack.OpenStackException;
import org.tanzu.openstackmcp.openstack.ResourceKind;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Reads resource collections from the cloud and turns them into typed records.
 *
 * Service failures never escape this class: a collection that cannot be read comes
 * back as an empty {@link FetchResult} with a diagnostic, and a lookup that cannot
 * be answered comes back as an unavailable {@link LookupResult}.
 */
@Component
public class InventoryCollector {

    private static final Logger logger = LoggerFactory.getLogger(InventoryCollector.class);

    private final CloudResourceClient client;
    private final ResourceNormalizer normalizer;
    private final Executor executor;
    private final Duration fetchTimeout;
    private final Duration reportDeadline;

    public InventoryCollector(CloudResourceClient client,
                              ResourceNormalizer normalizer,
                              @Qualifier("inventoryTaskExecutor") Executor executor,
                              OpenStackConfig openStackConfig) {
        this.client = client;
        this.normalizer = normalizer;
        this.executor = executor;
        this.fetchTimeout = openStackConfig.getFetchTimeout();
        this.reportDeadline = openStackConfig.getReportDeadline();
    }

    /**
     * Fetches one collection on the calling thread.
     *
     * @param kind the collection to read
     * @param normalizer shapes each raw object, e.g. {@code ResourceNormalizer::toServer}
     * @return the normalized records, or an empty failure result with a diagnostic
     */
    public <T> FetchResult<T> fetch(ResourceKind kind, Function<JsonNode, T> normalizer) {
        try {
            List<JsonNode> raw = client.list(kind);
            List<T> records = new ArrayList<>(raw.size());
            for (JsonNode node : raw) {
                records.add(normalizer.apply(node));
            }
            logger.info("Retrieved {} {} from OpenStack", records.size(), kind);
            return FetchResult.success(kind, records);
        } catch (OpenStackException e) {
            logger.warn("Failed to list {}: {}", kind, e.getMessage());
            return FetchResult.failure(kind, e.getMessage());
        }
    }

    /**
     * Looks up one resource by id.
     *
     * @param kind a kind with a detail endpoint
     * @param id the resource id
     * @param normalizer shapes the raw object, e.g. {@code ResourceNormalizer::toServerDetails}
     * @return found, not found, or unavailable with the service's error message
     */
    public <T> LookupResult<T> lookup(ResourceKind kind, String id, Function<JsonNode, T> normalizer) {
        try {
            Optional<JsonNode> raw = client.get(kind, id);
            if (raw.isEmpty()) {
                logger.info("No {} found with id {}", kind.getDetailKey(), id);
                return LookupResult.notFound(kind, id);
            }
            return LookupResult.found(kind, id, normalizer.apply(raw.get()));
        } catch (OpenStackException e) {
            logger.warn("Failed to get {} {}: {}", kind.getDetailKey(), id, e.getMessage());
            return LookupResult.unavailable(kind, id, e.getMessage());
        }
    }

    /**
     * Fetches several collections concurrently.
     *
     * Each fetch is bounded by the fetch timeout, the whole call by the report
     * deadline. Fetches still running at the deadline are cancelled and reported as
     * diagnostics; everything that finished in time is kept.
     *
     * @param kinds the collections to read
     * @return a snapshot holding every requested kind
     * @throws IllegalStateException if shaping a collection fails, which is a defect rather than an outage
     */
    public InventorySnapshot collect(Set<ResourceKind> kinds) {
        logger.info("Collecting inventory snapshot for {}", kinds);
        long deadline = System.nanoTime() + reportDeadline.toNanos();

        InventorySnapshot.Builder snapshot = InventorySnapshot.builder();
        List<PendingFetch<?>> pending = new ArrayList<>();
        schedule(kinds, ResourceKind.SERVERS, normalizer::toServer, snapshot::servers, pending);
        schedule(kinds, ResourceKind.HYPERVISORS, normalizer::toHypervisor, snapshot::hypervisors, pending);
        schedule(kinds, ResourceKind.FLAVORS, normalizer::toFlavor, snapshot::flavors, pending);
        schedule(kinds, ResourceKind.IMAGES, normalizer::toImage, snapshot::images, pending);
        schedule(kinds, ResourceKind.VOLUMES, normalizer::toVolume, snapshot::volumes, pending);
        schedule(kinds, ResourceKind.VOLUME_TYPES, normalizer::toVolumeType, snapshot::volumeTypes, pending);
        schedule(kinds, ResourceKind.NETWORKS, normalizer::toNetwork, snapshot::networks, pending);
        schedule(kinds, ResourceKind.SUBNETS, normalizer::toSubnet, snapshot::subnets, pending);
        schedule(kinds, ResourceKind.ROUTERS, normalizer::toRouter, snapshot::routers, pending);

        for (PendingFetch<?> fetch : pending) {
            fetch.await(deadline);
        }

        InventorySnapshot result = snapshot.build();
        if (!result.getDiagnostics().isEmpty()) {
            logger.warn("Inventory snapshot is partial: {}", result.getDiagnostics());
        }
        return result;
    }

    private <T> void schedule(Set<ResourceKind> kinds, ResourceKind kind, Function<JsonNode, T> normalizer,
                              Consumer<FetchResult<T>> sink, List<PendingFetch<?>> pending) {
        if (!kinds.contains(kind)) {
            return;
        }
        try {
            CompletableFuture<FetchResult<T>> future = CompletableFuture
                .supplyAsync(() -> fetch(kind, normalizer), executor)
                .orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            pending.add(new PendingFetch<>(kind, future, sink));
        } catch (RejectedExecutionException e) {
            logger.warn("Fetch of {} rejected by the worker pool: {}", kind, e.getMessage());
            sink.accept(FetchResult.failure(kind, "not scheduled: worker pool is saturated"));
        }
    }

    /**
     * A fetch running on the worker pool and the snapshot slot its result goes to.
     */
    private final class PendingFetch<T> {
        private final ResourceKind kind;
        private final CompletableFuture<FetchResult<T>> future;
        private final Consumer<FetchResult<T>> sink;

        private PendingFetch(ResourceKind kind, CompletableFuture<FetchResult<T>> future, Consumer<FetchResult<T>> sink) {
            this.kind = kind;
            this.future = future;
            this.sink = sink;
        }

        private void await(long deadline) {
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                sink.accept(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                logger.warn("Fetch of {} still running at the report deadline of {}", kind, reportDeadline);
                sink.accept(FetchResult.failure(kind, "timed out after report deadline of " + reportDeadline));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof TimeoutException) {
                    logger.warn("Fetch of {} exceeded the fetch timeout of {}", kind, fetchTimeout);
                    sink.accept(FetchResult.failure(kind, "timed out after " + fetchTimeout));
                } else {
                    throw new IllegalStateException("Failed to normalize " + kind + ": " + cause.getMessage(), cause);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                sink.accept(FetchResult.failure(kind, "interrupted"));
            }
        }
    }
}
