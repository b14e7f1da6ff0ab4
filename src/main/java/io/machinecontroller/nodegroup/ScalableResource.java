package io.machinecontroller.nodegroup;

import io.machinecontroller.enums.NodeGroupKind;
import io.machinecontroller.models.ClusterResource;
import io.machinecontroller.models.MachineDeployment;
import io.machinecontroller.models.MachineSet;

import java.util.Map;
import java.util.Objects;

/**
 * Root of a node group hierarchy: either a MachineSet or a MachineDeployment, tagged by
 * {@link NodeGroupKind}. Callers switch on the tag for the depth of the owner chain.
 */
public final class ScalableResource {

    private final NodeGroupKind kind;
    private final MachineSet machineSet;
    private final MachineDeployment machineDeployment;

    private ScalableResource(NodeGroupKind kind, MachineSet machineSet, MachineDeployment machineDeployment) {
        this.kind = kind;
        this.machineSet = machineSet;
        this.machineDeployment = machineDeployment;
    }

    public static ScalableResource of(MachineSet machineSet) {
        return new ScalableResource(NodeGroupKind.MACHINE_SET, Objects.requireNonNull(machineSet), null);
    }

    public static ScalableResource of(MachineDeployment machineDeployment) {
        return new ScalableResource(NodeGroupKind.MACHINE_DEPLOYMENT, null, Objects.requireNonNull(machineDeployment));
    }

    public NodeGroupKind getKind() {
        return kind;
    }

    /**
     * @throws IllegalStateException if this is not a MachineSet root
     */
    public MachineSet getMachineSet() {
        if (kind != NodeGroupKind.MACHINE_SET) {
            throw new IllegalStateException("Not a MachineSet root: " + this);
        }
        return machineSet;
    }

    /**
     * @throws IllegalStateException if this is not a MachineDeployment root
     */
    public MachineDeployment getMachineDeployment() {
        if (kind != NodeGroupKind.MACHINE_DEPLOYMENT) {
            throw new IllegalStateException("Not a MachineDeployment root: " + this);
        }
        return machineDeployment;
    }

    public ClusterResource getResource() {
        return switch (kind) {
            case MACHINE_SET -> machineSet;
            case MACHINE_DEPLOYMENT -> machineDeployment;
        };
    }

    public String getNamespace() {
        return getResource().getNamespace();
    }

    public String getName() {
        return getResource().getName();
    }

    public String getUid() {
        return getResource().getUid();
    }

    public Map<String, String> getAnnotations() {
        return getResource().getMetadata() == null ? Map.of() : getResource().getMetadata().annotationsOrEmpty();
    }

    public int getReplicas() {
        return switch (kind) {
            case MACHINE_SET -> machineSet.getReplicas();
            case MACHINE_DEPLOYMENT -> machineDeployment.getReplicas();
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalableResource)) return false;
        ScalableResource that = (ScalableResource) o;
        return kind == that.kind
            && Objects.equals(getNamespace(), that.getNamespace())
            && Objects.equals(getName(), that.getName());
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, getNamespace(), getName());
    }

    @Override
    public String toString() {
        return kind.getKind() + " " + getNamespace() + "/" + getName();
    }
}
