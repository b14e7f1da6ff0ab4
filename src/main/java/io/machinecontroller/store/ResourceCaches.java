package io.machinecontroller.store;

import io.machinecontroller.enums.ResourceKind;
import io.machinecontroller.models.Machine;
import io.machinecontroller.models.MachineDeployment;
import io.machinecontroller.models.MachineSet;
import io.machinecontroller.models.Node;
import lombok.Getter;

/**
 * The four synchronized caches, created together so they can be handed to the
 * synchronizer and to the discovery components as one unit.
 */
@Getter
public class ResourceCaches {

    private final InMemoryResourceCache<Node> nodes =
        new InMemoryResourceCache<>(ResourceKind.NODE, Node.class);
    private final InMemoryResourceCache<Machine> machines =
        new InMemoryResourceCache<>(ResourceKind.MACHINE, Machine.class);
    private final InMemoryResourceCache<MachineSet> machineSets =
        new InMemoryResourceCache<>(ResourceKind.MACHINE_SET, MachineSet.class);
    private final InMemoryResourceCache<MachineDeployment> machineDeployments =
        new InMemoryResourceCache<>(ResourceKind.MACHINE_DEPLOYMENT, MachineDeployment.class);

    public InMemoryResourceCache<?> forKind(ResourceKind kind) {
        return switch (kind) {
            case NODE -> nodes;
            case MACHINE -> machines;
            case MACHINE_SET -> machineSets;
            case MACHINE_DEPLOYMENT -> machineDeployments;
        };
    }
}
