package io.machinecontroller.enums;

/**
 * Tag for the root of a node group hierarchy.
 *
 * <ul>
 *   <li><strong>MACHINE_SET</strong> - the group is a MachineSet that owns Machines directly (one hop)</li>
 *   <li><strong>MACHINE_DEPLOYMENT</strong> - the group is a MachineDeployment owning MachineSets (two hops)</li>
 * </ul>
 */
public enum NodeGroupKind {
    MACHINE_SET(ResourceKind.MACHINE_SET),
    MACHINE_DEPLOYMENT(ResourceKind.MACHINE_DEPLOYMENT);

    private final ResourceKind resourceKind;

    NodeGroupKind(ResourceKind resourceKind) {
        this.resourceKind = resourceKind;
    }

    public ResourceKind getResourceKind() {
        return resourceKind;
    }

    public String getKind() {
        return resourceKind.getKind();
    }

    /**
     * @return the tag for a kind string, or null if the kind cannot root a node group
     */
    public static NodeGroupKind fromKind(String value) {
        ResourceKind kind = ResourceKind.fromKind(value);
        if (kind == null) {
            return null;
        }

        return switch (kind) {
            case MACHINE_SET -> MACHINE_SET;
            case MACHINE_DEPLOYMENT -> MACHINE_DEPLOYMENT;
            default -> null;
        };
    }
}
