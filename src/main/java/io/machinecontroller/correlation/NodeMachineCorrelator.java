package io.machinecontroller.correlation;

import io.machinecontroller.models.Machine;
import io.machinecontroller.models.Node;
import io.machinecontroller.store.ResourceCache;
import io.machinecontroller.store.ResourceKey;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Correlates Nodes with the Machines that produced them.
 *
 * Provider IDs are set on the Machine asynchronously, after the Node already exists
 * and carries the authoritative link in its machine annotation. Lookups therefore
 * go through an ordered fallback chain where every step either finds something or
 * passes on; a missing field is never an error.
 *
 * All methods are synchronous reads against the caches.
 */
@Slf4j
public class NodeMachineCorrelator {

    private final ResourceCache<Node> nodeCache;
    private final ResourceCache<Machine> machineCache;

    public NodeMachineCorrelator(ResourceCache<Node> nodeCache, ResourceCache<Machine> machineCache) {
        this.nodeCache = nodeCache;
        this.machineCache = machineCache;
    }

    /**
     * Direct lookup of a Machine by its "namespace/name" key, no fallback.
     *
     * @throws io.machinecontroller.store.InvalidResourceKeyException if the key cannot be parsed
     */
    public Optional<Machine> findMachine(String key) {
        ResourceKey resourceKey = ResourceKey.parse(key);
        return machineCache.get(resourceKey.getNamespace(), resourceKey.getName());
    }

    /**
     * Find the Machine for a provider ID.
     *
     * <ol>
     *   <li>a Machine whose provider ID equals {@code providerId}</li>
     *   <li>the Node carrying {@code providerId}, resolved through its machine annotation</li>
     * </ol>
     *
     * @throws io.machinecontroller.store.InvalidResourceKeyException if the Node's annotation is malformed
     */
    public Optional<Machine> findMachineByProviderId(String providerId) {
        if (providerId == null || providerId.isEmpty()) {
            return Optional.empty();
        }

        for (Machine machine : machineCache.list()) {
            if (providerId.equals(machine.getProviderId())) {
                return Optional.of(machine);
            }
        }

        // The Machine may not have its provider ID yet; the Node's annotation is authoritative.
        Optional<Node> node = findNodeByProviderId(providerId);
        if (node.isEmpty()) {
            log.debug("No machine or node found for provider ID {}", providerId);
            return Optional.empty();
        }

        String machineKey = node.get().getMachineAnnotation();
        if (machineKey == null || machineKey.isEmpty()) {
            log.debug("Node {} with provider ID {} has no machine annotation", node.get().getName(), providerId);
            return Optional.empty();
        }

        return findMachine(machineKey);
    }

    /**
     * Direct lookup of a Node by name.
     */
    public Optional<Node> findNodeByName(String name) {
        return nodeCache.get(null, name);
    }

    /**
     * Find the Node carrying a provider ID.
     */
    public Optional<Node> findNodeByProviderId(String providerId) {
        if (providerId == null || providerId.isEmpty()) {
            return Optional.empty();
        }
        return nodeCache.list().stream()
            .filter(node -> providerId.equals(node.getProviderId()))
            .findFirst();
    }

    /**
     * Find the Machine for a Node: by the Node's provider ID if it has one, otherwise
     * through the Node's own machine annotation.
     */
    public Optional<Machine> findMachineForNode(Node node) {
        String providerId = node.getProviderId();
        if (providerId != null && !providerId.isEmpty()) {
            return findMachineByProviderId(providerId);
        }

        String machineKey = node.getMachineAnnotation();
        if (machineKey == null || machineKey.isEmpty()) {
            log.debug("Node {} has neither a provider ID nor a machine annotation", node.getName());
            return Optional.empty();
        }
        return findMachine(machineKey);
    }

    /**
     * Find the Node produced by a Machine: by the Machine's provider ID first, then by
     * the Machine's node reference.
     */
    public Optional<Node> findNodeForMachine(Machine machine) {
        Optional<Node> byProviderId = findNodeByProviderId(machine.getProviderId());
        if (byProviderId.isPresent()) {
            return byProviderId;
        }

        String nodeName = machine.getNodeRefName();
        if (nodeName == null || nodeName.isEmpty()) {
            return Optional.empty();
        }
        return findNodeByName(nodeName);
    }
}
