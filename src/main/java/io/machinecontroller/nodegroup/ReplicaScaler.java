package io.machinecontroller.nodegroup;

/**
 * Sets the declared replica count of a node group's root resource.
 * Bounds are checked by {@link NodeGroup} before this is called.
 */
public interface ReplicaScaler {

    /**
     * @param resource the root resource to update
     * @param replicas the new declared replica count
     * @throws ReplicaUpdateException if the update could not be applied
     */
    void setReplicas(ScalableResource resource, int replicas) throws ReplicaUpdateException;
}
