package io.machinecontroller.nodegroup;

import io.machinecontroller.correlation.NodeMachineCorrelator;
import io.machinecontroller.enums.NodeGroupKind;
import io.machinecontroller.metrics.MetricsProvider;
import io.machinecontroller.models.Machine;
import io.machinecontroller.models.MachineDeployment;
import io.machinecontroller.models.MachineSet;
import io.machinecontroller.models.Node;
import io.machinecontroller.models.OwnerReference;
import io.machinecontroller.ownership.OwnerChainResolver;
import io.machinecontroller.store.LabelSelector;
import io.machinecontroller.store.ResourceCache;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.machinecontroller.metrics.MetricsConstants.*;

/**
 * Discovers the node groups of the cluster from the MachineSet and MachineDeployment caches.
 *
 * The root of a hierarchy is the MachineDeployment when there is one, the MachineSet
 * otherwise, and bounds are read from the root only. A MachineSet whose MachineDeployment
 * owner reference does not resolve stands in for the missing deployment.
 */
@Slf4j
public class NodeGroupDirectory {

    private final ResourceCache<Machine> machineCache;
    private final ResourceCache<MachineSet> machineSetCache;
    private final ResourceCache<MachineDeployment> machineDeploymentCache;
    private final OwnerChainResolver ownerChainResolver;
    private final NodeMachineCorrelator correlator;
    private final ScalingBoundsValidator boundsValidator;
    private final ReplicaScaler replicaScaler;
    private final MetricsProvider metricsProvider;

    public NodeGroupDirectory(ResourceCache<Machine> machineCache,
                              ResourceCache<MachineSet> machineSetCache,
                              ResourceCache<MachineDeployment> machineDeploymentCache,
                              OwnerChainResolver ownerChainResolver,
                              NodeMachineCorrelator correlator,
                              ScalingBoundsValidator boundsValidator,
                              ReplicaScaler replicaScaler,
                              MetricsProvider metricsProvider) {
        this.machineCache = machineCache;
        this.machineSetCache = machineSetCache;
        this.machineDeploymentCache = machineDeploymentCache;
        this.ownerChainResolver = ownerChainResolver;
        this.correlator = correlator;
        this.boundsValidator = boundsValidator;
        this.replicaScaler = replicaScaler;
        this.metricsProvider = metricsProvider;
    }

    /**
     * Enumerate every scalable node group, sorted by kind and id.
     *
     * @throws NodeGroupConfigurationException if any candidate carries invalid bounds;
     *         no partial list is returned in that case
     */
    public List<NodeGroup> listNodeGroups() throws NodeGroupConfigurationException {
        Timer.Sample sample = Timer.start();
        try {
            List<ScalableResource> candidates = new ArrayList<>();
            for (MachineSet machineSet : machineSetCache.list(null, LabelSelector.everything())) {
                ScalableResource root = resolveRoot(machineSet);
                if (root.getKind() == NodeGroupKind.MACHINE_SET) {
                    candidates.add(root);
                }
            }
            for (MachineDeployment machineDeployment : machineDeploymentCache.list(null, LabelSelector.everything())) {
                candidates.add(ScalableResource.of(machineDeployment));
            }

            List<NodeGroup> nodeGroups = new ArrayList<>();
            for (ScalableResource candidate : candidates) {
                Optional<NodeGroup> nodeGroup = buildNodeGroup(candidate);
                if (nodeGroup.isEmpty()) {
                    continue;
                }
                if (nodeGroup.get().size() == 0) {
                    log.debug("Skipping {} with zero replicas, scaling from zero is not supported", candidate);
                    continue;
                }
                nodeGroups.add(nodeGroup.get());
            }

            nodeGroups.sort(Comparator.comparing(NodeGroup::kind).thenComparing(NodeGroup::id));
            metricsProvider.gauge(NODE_GROUPS_DISCOVERED_METRIC_NAME, Map.of()).set(nodeGroups.size());
            log.debug("Discovered {} node groups from {} candidates", nodeGroups.size(), candidates.size());
            return nodeGroups;
        } catch (NodeGroupConfigurationException e) {
            metricsProvider.counter(NODE_GROUP_CONFIGURATION_ERRORS_METRIC_NAME, Map.of()).increment();
            log.error("Node group enumeration aborted: {}", e.getMessage());
            throw e;
        } finally {
            sample.stop(metricsProvider.timer(NODE_GROUP_LIST_LATENCY_METRIC_NAME, Map.of()));
        }
    }

    /**
     * The node group a Node belongs to, if any.
     *
     * Unmanaged nodes, Machines without an owner and roots without usable bounds all give
     * an empty result. Invalid bounds are logged and also reported as empty.
     *
     * @throws io.machinecontroller.store.InvalidResourceKeyException if the Node's machine
     *         annotation is malformed
     */
    public Optional<NodeGroup> nodeGroupForNode(Node node) {
        Optional<Machine> machine = correlator.findMachineForNode(node);
        if (machine.isEmpty()) {
            log.debug("Node {} has no backing machine", node.getName());
            return Optional.empty();
        }

        Optional<MachineSet> machineSet = ownerChainResolver.findMachineOwner(machine.get());
        if (machineSet.isEmpty()) {
            log.debug("Machine {}/{} of node {} has no resolvable MachineSet owner",
                machine.get().getNamespace(), machine.get().getName(), node.getName());
            return Optional.empty();
        }

        ScalableResource root = resolveRoot(machineSet.get());
        try {
            return buildNodeGroup(root);
        } catch (NodeGroupConfigurationException e) {
            log.warn("Node {} belongs to misconfigured {}: {}", node.getName(), root, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Look up one node group by the identity of its root resource, under the same rules as
     * {@link #listNodeGroups()}. A MachineSet that is represented through its
     * MachineDeployment is not a node group of its own.
     *
     * @throws NodeGroupConfigurationException if the root carries invalid bounds
     */
    public Optional<NodeGroup> nodeGroupById(NodeGroupKind kind, String namespace, String name)
            throws NodeGroupConfigurationException {
        Optional<ScalableResource> root = switch (kind) {
            case MACHINE_SET -> machineSetCache.get(namespace, name)
                .map(this::resolveRoot)
                .filter(resolved -> resolved.getKind() == NodeGroupKind.MACHINE_SET);
            case MACHINE_DEPLOYMENT -> machineDeploymentCache.get(namespace, name)
                .map(machineDeployment -> ScalableResource.of(machineDeployment));
        };
        if (root.isEmpty()) {
            return Optional.empty();
        }
        return buildNodeGroup(root.get()).filter(nodeGroup -> nodeGroup.size() > 0);
    }

    /**
     * Root of the hierarchy a MachineSet belongs to. Falls back to the MachineSet itself when
     * its MachineDeployment owner reference does not resolve (deleted or recreated mid-query).
     */
    ScalableResource resolveRoot(MachineSet machineSet) {
        Optional<OwnerReference> deploymentRef = ownerChainResolver.machineSetDeploymentRef(machineSet);
        if (deploymentRef.isEmpty()) {
            return ScalableResource.of(machineSet);
        }

        Optional<MachineDeployment> owner = ownerChainResolver.findMachineSetOwner(machineSet);
        if (owner.isPresent()) {
            return ScalableResource.of(owner.get());
        }

        log.warn("MachineSet {}/{} references MachineDeployment {} which cannot be resolved, treating the MachineSet as root",
            machineSet.getNamespace(), machineSet.getName(), deploymentRef.get().getName());
        return ScalableResource.of(machineSet);
    }

    private Optional<NodeGroup> buildNodeGroup(ScalableResource root) throws NodeGroupConfigurationException {
        Optional<ScalingBounds> bounds;
        try {
            bounds = boundsValidator.parse(root.getAnnotations());
        } catch (NodeGroupConfigurationException e) {
            throw new NodeGroupConfigurationException(root + ": " + e.getMessage(), e);
        }

        if (bounds.isEmpty()) {
            log.debug("Skipping {} without scaling bounds", root);
            return Optional.empty();
        }
        if (!bounds.get().hasScalingRoom()) {
            log.debug("Skipping {} with fixed size {}", root, bounds.get().getMinSize());
            return Optional.empty();
        }

        return Optional.of(new NodeGroup(root, bounds.get(), machineCache, machineSetCache, correlator, replicaScaler));
    }
}
