package io.machinecontroller.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.WatchOption;
import io.etcd.jetcd.watch.WatchEvent;
import io.etcd.jetcd.watch.WatchResponse;
import io.machinecontroller.enums.ResourceKind;
import io.machinecontroller.metrics.MetricsProvider;
import io.machinecontroller.models.ClusterResource;
import io.machinecontroller.models.ObjectMeta;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static io.machinecontroller.config.Constants.PATH_DELIMITER;
import static io.machinecontroller.metrics.MetricsConstants.*;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Keeps the {@link ResourceCaches} current with the resource documents stored in etcd.
 *
 * For every kind: list the prefix, replace the cache content, then watch the prefix
 * from the listed revision + 1. PUT events upsert, DELETE events remove. If a watch
 * fails (e.g. the revision was compacted) the kind is relisted and re-watched after
 * the retry delay.
 */
@Slf4j
public class EtcdResourceSynchronizer {

    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;

    private final KV kvClient;
    private final Watch watchClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;
    private final ResourceCaches caches;
    private final MetricsProvider metricsProvider;
    private final String clusterName;
    private final long retryDelaySeconds;

    private final ScheduledExecutorService retryScheduler;
    private final Map<ResourceKind, Watch.Watcher> watchers = new ConcurrentHashMap<>();
    private volatile boolean running;

    public EtcdResourceSynchronizer(Client etcdClient,
                                    EtcdPathResolver pathResolver,
                                    ObjectMapper objectMapper,
                                    ResourceCaches caches,
                                    MetricsProvider metricsProvider,
                                    String clusterName,
                                    long retryDelaySeconds) {
        this.kvClient = etcdClient.getKVClient();
        this.watchClient = etcdClient.getWatchClient();
        this.pathResolver = pathResolver;
        this.objectMapper = objectMapper;
        this.caches = caches;
        this.metricsProvider = metricsProvider;
        this.clusterName = clusterName;
        this.retryDelaySeconds = retryDelaySeconds;
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "resource-cache-resync");
            thread.setDaemon(true);
            return thread;
        });

        log.info("EtcdResourceSynchronizer initialized for cluster: {}", clusterName);
    }

    /**
     * Populate every cache and start watching. Returns once the initial lists are
     * applied, so callers can serve queries right away.
     *
     * @throws Exception if the initial list of any kind fails
     */
    public void start() throws Exception {
        log.info("Starting resource synchronization for cluster: {}", clusterName);
        running = true;

        for (ResourceKind kind : ResourceKind.values()) {
            synchronize(kind);
        }

        log.info("Resource caches synced - nodes: {}, machines: {}, machinesets: {}, machinedeployments: {}",
            caches.getNodes().size(), caches.getMachines().size(),
            caches.getMachineSets().size(), caches.getMachineDeployments().size());
    }

    /**
     * Stop all watches. Cache content is left as is.
     */
    @PreDestroy
    public void stop() {
        log.info("Stopping resource synchronization for cluster: {}", clusterName);
        running = false;

        for (Map.Entry<ResourceKind, Watch.Watcher> entry : watchers.entrySet()) {
            try {
                entry.getValue().close();
            } catch (Exception e) {
                log.warn("Error closing watcher for {}: {}", entry.getKey().getKind(), e.getMessage());
            }
        }
        watchers.clear();
        retryScheduler.shutdownNow();
    }

    public boolean isRunning() {
        return running;
    }

    void synchronize(ResourceKind kind) throws Exception {
        long revision = relist(kind);
        watch(kind, revision + 1);
    }

    /**
     * List all documents of a kind and replace the cache content with them.
     *
     * @return the etcd revision the list was served at
     */
    long relist(ResourceKind kind) throws Exception {
        ByteSequence prefix = prefixBytes(kind);
        GetResponse response = kvClient.get(
            prefix,
            GetOption.newBuilder().withPrefix(prefix).build()
        ).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

        int applied = replaceCacheContent(caches.forKind(kind), response.getKvs());
        long revision = response.getHeader().getRevision();

        log.info("Listed {} {} documents at revision {}", applied, kind.getKind(), revision);
        return revision;
    }

    private void watch(ResourceKind kind, long startRevision) {
        ByteSequence prefix = prefixBytes(kind);
        WatchOption option = WatchOption.newBuilder()
            .withPrefix(prefix)
            .withRevision(startRevision)
            .build();

        Watch.Watcher watcher = watchClient.watch(prefix, option, Watch.listener(
            response -> handleWatchResponse(kind, response),
            error -> handleWatchError(kind, error)
        ));

        Watch.Watcher previous = watchers.put(kind, watcher);
        if (previous != null) {
            previous.close();
        }
        log.debug("Watching {} documents from revision {}", kind.getKind(), startRevision);
    }

    void handleWatchResponse(ResourceKind kind, WatchResponse response) {
        for (WatchEvent event : response.getEvents()) {
            applyEvent(caches.forKind(kind), event);
            metricsProvider.counter(CACHE_EVENTS_METRIC_NAME, Map.of(
                KIND_TAG, kind.getKind(),
                EVENT_TYPE_TAG, event.getEventType().name()
            )).increment();
        }
    }

    void handleWatchError(ResourceKind kind, Throwable error) {
        if (!running) {
            log.debug("Ignoring watch error for {} after stop: {}", kind.getKind(), error.getMessage());
            return;
        }
        log.warn("Watch for {} failed, relisting in {}s: {}", kind.getKind(), retryDelaySeconds, error.getMessage());
        scheduleResync(kind);
    }

    private void scheduleResync(ResourceKind kind) {
        retryScheduler.schedule(() -> {
            if (!running) {
                return;
            }
            try {
                synchronize(kind);
                metricsProvider.counter(CACHE_RESYNC_METRIC_NAME, Map.of(KIND_TAG, kind.getKind())).increment();
            } catch (Exception e) {
                log.error("Failed to resync {} documents, retrying in {}s", kind.getKind(), retryDelaySeconds, e);
                scheduleResync(kind);
            }
        }, retryDelaySeconds, TimeUnit.SECONDS);
    }

    private <T extends ClusterResource> int replaceCacheContent(InMemoryResourceCache<T> cache, List<KeyValue> kvs) {
        List<T> items = new ArrayList<>();
        for (KeyValue kv : kvs) {
            decode(cache, kv).ifPresent(items::add);
        }
        cache.replaceAll(items);
        return items.size();
    }

    private <T extends ClusterResource> void applyEvent(InMemoryResourceCache<T> cache, WatchEvent event) {
        KeyValue kv = event.getKeyValue();
        switch (event.getEventType()) {
            case PUT -> decode(cache, kv).ifPresent(cache::upsert);
            case DELETE -> {
                String path = kv.getKey().toString(UTF_8);
                pathResolver.parseResourceKey(clusterName, cache.getKind(), path)
                    .ifPresentOrElse(
                        key -> cache.delete(key.getNamespace(), key.getName()),
                        () -> log.warn("Ignoring delete of unrecognized {} path: {}", cache.getKind().getKind(), path));
            }
            default -> log.debug("Ignoring {} event for {}", event.getEventType(), cache.getKind().getKind());
        }
    }

    /**
     * Decode a document. The key is authoritative for name and namespace, the cache for
     * the kind. A document that cannot be parsed is logged and skipped so one bad value
     * cannot stall the cache.
     */
    private <T extends ClusterResource> Optional<T> decode(InMemoryResourceCache<T> cache, KeyValue kv) {
        String path = kv.getKey().toString(UTF_8);
        Optional<ResourceKey> key = pathResolver.parseResourceKey(clusterName, cache.getKind(), path);
        if (key.isEmpty()) {
            log.warn("Skipping {} document at unrecognized path: {}", cache.getKind().getKind(), path);
            return Optional.empty();
        }

        try {
            T resource = objectMapper.readValue(kv.getValue().toString(UTF_8), cache.getType());
            if (resource.getMetadata() == null) {
                resource.setMetadata(new ObjectMeta());
            }
            resource.setKind(cache.getKind().getKind());
            resource.getMetadata().setName(key.get().getName());
            if (cache.getKind().isNamespaced()) {
                resource.getMetadata().setNamespace(key.get().getNamespace());
            }
            return Optional.of(resource);
        } catch (Exception e) {
            log.warn("Skipping undecodable {} document at {}: {}", cache.getKind().getKind(), path, e.getMessage());
            return Optional.empty();
        }
    }

    private ByteSequence prefixBytes(ResourceKind kind) {
        return ByteSequence.from(pathResolver.getResourcePrefix(clusterName, kind) + PATH_DELIMITER, UTF_8);
    }
}
