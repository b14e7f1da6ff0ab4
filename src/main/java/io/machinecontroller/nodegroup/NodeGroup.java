package io.machinecontroller.nodegroup;

import io.machinecontroller.correlation.NodeMachineCorrelator;
import io.machinecontroller.enums.NodeGroupKind;
import io.machinecontroller.models.Machine;
import io.machinecontroller.models.MachineDeployment;
import io.machinecontroller.models.MachineSet;
import io.machinecontroller.models.Node;
import io.machinecontroller.models.NodeInstance;
import io.machinecontroller.ownership.OwnerChainResolver;
import io.machinecontroller.store.LabelSelector;
import io.machinecontroller.store.ResourceCache;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A scalable group of nodes derived from a MachineSet or MachineDeployment with valid
 * scaling bounds. Never persisted; built per query by {@link NodeGroupDirectory} and
 * reflecting the cache snapshot it was built from.
 */
@Slf4j
public class NodeGroup {

    private final ScalableResource root;
    private final ScalingBounds bounds;
    private final ResourceCache<Machine> machineCache;
    private final ResourceCache<MachineSet> machineSetCache;
    private final NodeMachineCorrelator correlator;
    private final ReplicaScaler replicaScaler;

    NodeGroup(ScalableResource root,
              ScalingBounds bounds,
              ResourceCache<Machine> machineCache,
              ResourceCache<MachineSet> machineSetCache,
              NodeMachineCorrelator correlator,
              ReplicaScaler replicaScaler) {
        this.root = root;
        this.bounds = bounds;
        this.machineCache = machineCache;
        this.machineSetCache = machineSetCache;
        this.correlator = correlator;
        this.replicaScaler = replicaScaler;
    }

    /**
     * "namespace/name" of the root resource. Unique together with {@link #kind()}.
     */
    public String id() {
        return root.getNamespace() + "/" + root.getName();
    }

    public NodeGroupKind kind() {
        return root.getKind();
    }

    public String namespace() {
        return root.getNamespace();
    }

    public String name() {
        return root.getName();
    }

    public ScalableResource root() {
        return root;
    }

    public int minSize() {
        return bounds.getMinSize();
    }

    public int maxSize() {
        return bounds.getMaxSize();
    }

    /**
     * Declared replica count of the root resource (desired state, not a count of live nodes).
     */
    public int size() {
        return root.getReplicas();
    }

    /**
     * Nodes currently linked to the group's Machines.
     *
     * Each Machine is matched to a Node by its provider ID first and by its node
     * reference second. Machines with neither (still provisioning) are skipped.
     */
    public List<NodeInstance> members() {
        List<NodeInstance> members = new ArrayList<>();
        for (Machine machine : machines()) {
            Optional<Node> node = correlator.findNodeForMachine(machine);
            if (node.isEmpty()) {
                log.debug("NodeGroup {} - machine {}/{} has no linked node yet",
                    id(), machine.getNamespace(), machine.getName());
                continue;
            }
            members.add(NodeInstance.builder()
                .id(node.get().getProviderId())
                .nodeName(node.get().getName())
                .machine(machine.getNamespace() + "/" + machine.getName())
                .build());
        }
        return members;
    }

    /**
     * Machines owned by the group: directly for a MachineSet root, through every owned
     * MachineSet for a MachineDeployment root.
     */
    public List<Machine> machines() {
        return switch (root.getKind()) {
            case MACHINE_SET -> machinesOwnedBy(root.getMachineSet());
            case MACHINE_DEPLOYMENT -> {
                List<Machine> machines = new ArrayList<>();
                for (MachineSet machineSet : machineSetsOwnedBy(root.getMachineDeployment())) {
                    machines.addAll(machinesOwnedBy(machineSet));
                }
                yield machines;
            }
        };
    }

    /**
     * Set the declared replica count of the root resource.
     *
     * @throws IllegalArgumentException if {@code size} is outside [min, max]
     * @throws ReplicaUpdateException if the update could not be applied
     */
    public void setSize(int size) throws ReplicaUpdateException {
        if (!bounds.contains(size)) {
            throw new IllegalArgumentException(String.format(
                "Size %d is outside the bounds of node group %s [%d, %d]", size, id(), minSize(), maxSize()));
        }
        log.info("NodeGroup {} - setting size {} -> {}", id(), size(), size);
        replicaScaler.setReplicas(root, size);
    }

    /**
     * Grow the group by {@code delta} replicas.
     *
     * @throws IllegalArgumentException if delta is not positive or the result exceeds the maximum
     */
    public void increaseSize(int delta) throws ReplicaUpdateException {
        if (delta <= 0) {
            throw new IllegalArgumentException("Size increase must be positive, got " + delta);
        }
        int target = size() + delta;
        if (target > maxSize()) {
            throw new IllegalArgumentException(String.format(
                "Size increase too large for node group %s - desired: %d max: %d", id(), target, maxSize()));
        }
        setSize(target);
    }

    /**
     * Shrink the declared size by {@code -delta} without removing any existing node;
     * used to drop requests for nodes that never came up.
     *
     * @throws IllegalArgumentException if delta is not negative or the result would be below
     *         the number of existing members
     */
    public void decreaseTargetSize(int delta) throws ReplicaUpdateException {
        if (delta >= 0) {
            throw new IllegalArgumentException("Size decrease must be negative, got " + delta);
        }
        int target = size() + delta;
        int existing = members().size();
        if (target < existing) {
            throw new IllegalArgumentException(String.format(
                "Attempt to delete existing nodes in node group %s - targetSize: %d delta: %d existingNodes: %d",
                id(), size(), delta, existing));
        }
        setSize(target);
    }

    public String debug() {
        return String.format("%s %s (min: %d, max: %d, replicas: %d)",
            kind().getKind(), id(), minSize(), maxSize(), size());
    }

    /**
     * Two node groups are equal when their roots share kind, namespace and name, whatever
     * the snapshot they were built from.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeGroup)) return false;
        return root.equals(((NodeGroup) o).root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return debug();
    }

    private List<Machine> machinesOwnedBy(MachineSet machineSet) {
        List<Machine> owned = new ArrayList<>();
        for (Machine machine : machineCache.list(machineSet.getNamespace(), LabelSelector.everything())) {
            if (OwnerChainResolver.isOwnedBy(machine, machineSet)) {
                owned.add(machine);
            }
        }
        return owned;
    }

    private List<MachineSet> machineSetsOwnedBy(MachineDeployment machineDeployment) {
        List<MachineSet> owned = new ArrayList<>();
        for (MachineSet machineSet : machineSetCache.list(machineDeployment.getNamespace(), LabelSelector.everything())) {
            if (OwnerChainResolver.isOwnedBy(machineSet, machineDeployment)) {
                owned.add(machineSet);
            }
        }
        return owned;
    }
}
