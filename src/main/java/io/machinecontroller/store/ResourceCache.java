package io.machinecontroller.store;

import io.machinecontroller.enums.ResourceKind;
import io.machinecontroller.models.ClusterResource;

import java.util.List;
import java.util.Optional;

/**
 * Read side of a synchronized, per-kind local store.
 *
 * Implementations must allow concurrent reads while updates are applied. Returned
 * objects are shared with the cache and must be deep-copied before any mutation.
 */
public interface ResourceCache<T extends ClusterResource> {

    /**
     * Kind of resource held by this cache
     */
    ResourceKind getKind();

    /**
     * Get a resource by namespace and name.
     *
     * @param namespace the namespace, null or empty for cluster-scoped kinds
     * @param name the resource name
     * @return the resource, or empty if it is not in the cache
     * @throws InvalidResourceKeyException if the key parts are malformed
     */
    Optional<T> get(String namespace, String name);

    /**
     * List resources in a namespace whose labels match the selector.
     *
     * @param namespace the namespace to list, null or empty for all namespaces
     * @param selector the label selector
     */
    List<T> list(String namespace, LabelSelector selector);

    /**
     * List every resource in every namespace
     */
    default List<T> list() {
        return list(null, LabelSelector.everything());
    }
}
