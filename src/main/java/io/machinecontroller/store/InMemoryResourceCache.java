package io.machinecontroller.store;

import io.machinecontroller.enums.ResourceKind;
import io.machinecontroller.models.ClusterResource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory store for one resource kind.
 *
 * Written to by {@link EtcdResourceSynchronizer} (or directly by tests) and read by
 * the discovery components through {@link ResourceCache}.
 */
@Slf4j
public class InMemoryResourceCache<T extends ClusterResource> implements ResourceCache<T> {

    private final ResourceKind kind;
    private final Class<T> type;
    private final Map<ResourceKey, T> items = new ConcurrentHashMap<>();

    public InMemoryResourceCache(ResourceKind kind, Class<T> type) {
        this.kind = kind;
        this.type = type;
    }

    @Override
    public ResourceKind getKind() {
        return kind;
    }

    public Class<T> getType() {
        return type;
    }

    @Override
    public Optional<T> get(String namespace, String name) {
        return Optional.ofNullable(items.get(keyFor(namespace, name)));
    }

    @Override
    public List<T> list(String namespace, LabelSelector selector) {
        boolean allNamespaces = namespace == null || namespace.isEmpty();
        List<T> result = new ArrayList<>();
        for (Map.Entry<ResourceKey, T> entry : items.entrySet()) {
            if (!allNamespaces && !namespace.equals(entry.getKey().getNamespace())) {
                continue;
            }
            T item = entry.getValue();
            if (selector.matches(item.getMetadata() == null ? null : item.getMetadata().getLabels())) {
                result.add(item);
            }
        }
        return result;
    }

    /**
     * Insert or replace a resource
     */
    public void upsert(T resource) {
        ResourceKey key = keyFor(resource.getNamespace(), resource.getName());
        items.put(key, resource);
        log.trace("Cache[{}] - upserted {}", kind.getKind(), key);
    }

    /**
     * Remove a resource by key
     *
     * @return true if something was removed
     */
    public boolean delete(String namespace, String name) {
        ResourceKey key = keyFor(namespace, name);
        boolean removed = items.remove(key) != null;
        log.trace("Cache[{}] - delete {} (removed: {})", kind.getKind(), key, removed);
        return removed;
    }

    public boolean delete(T resource) {
        return delete(resource.getNamespace(), resource.getName());
    }

    /**
     * Replace the whole content of the cache, as done after a full relist.
     */
    public synchronized void replaceAll(Collection<T> resources) {
        Map<ResourceKey, T> fresh = new ConcurrentHashMap<>();
        for (T resource : resources) {
            fresh.put(keyFor(resource.getNamespace(), resource.getName()), resource);
        }
        items.keySet().retainAll(fresh.keySet());
        items.putAll(fresh);
        log.debug("Cache[{}] - replaced content with {} items", kind.getKind(), fresh.size());
    }

    public int size() {
        return items.size();
    }

    private ResourceKey keyFor(String namespace, String name) {
        return ResourceKey.of(kind.isNamespaced() ? namespace : "", name);
    }
}
