package io.machinecontroller.ownership;

import io.machinecontroller.models.ClusterResource;
import io.machinecontroller.models.Machine;
import io.machinecontroller.models.MachineDeployment;
import io.machinecontroller.models.MachineSet;
import io.machinecontroller.models.OwnerReference;
import io.machinecontroller.store.ResourceCache;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the owner of a Machine (its MachineSet) and of a MachineSet (its MachineDeployment).
 *
 * Owner references are identity pointers, never followed blindly: the candidate is
 * looked up by namespace and name and accepted only when its uid equals the uid on
 * the reference. A deleted-and-recreated owner with the same name therefore does not
 * match. Every call resolves exactly one hop; Machine to MachineDeployment takes two calls.
 *
 * Absence (no reference of the expected kind, owner not cached, uid missing or different) is an
 * empty result, never an error: stale caches and deletion races are normal.
 */
@Slf4j
public class OwnerChainResolver {

    private final ResourceCache<MachineSet> machineSetCache;
    private final ResourceCache<MachineDeployment> machineDeploymentCache;

    public OwnerChainResolver(ResourceCache<MachineSet> machineSetCache,
                              ResourceCache<MachineDeployment> machineDeploymentCache) {
        this.machineSetCache = machineSetCache;
        this.machineDeploymentCache = machineDeploymentCache;
    }

    /**
     * Find the MachineSet that owns a Machine.
     *
     * @throws io.machinecontroller.store.InvalidResourceKeyException if the owner key is malformed
     */
    public Optional<MachineSet> findMachineOwner(Machine machine) {
        return resolveOwner(machine, machineSetCache);
    }

    /**
     * Find the MachineDeployment that owns a MachineSet.
     *
     * @throws io.machinecontroller.store.InvalidResourceKeyException if the owner key is malformed
     */
    public Optional<MachineDeployment> findMachineSetOwner(MachineSet machineSet) {
        return resolveOwner(machineSet, machineDeploymentCache);
    }

    /**
     * The MachineDeployment owner reference of a MachineSet, whether or not it resolves.
     */
    public Optional<OwnerReference> machineSetDeploymentRef(MachineSet machineSet) {
        return findOwnerReference(machineSet, machineDeploymentCache.getKind().getKind());
    }

    /**
     * True if the owner reference of the owner's kind on {@code resource} names exactly
     * {@code owner}: kind, name and uid all agree. Uses the same first-matching-reference
     * rule as owner resolution, so a resource is owned by at most one group.
     */
    public static boolean isOwnedBy(ClusterResource resource, ClusterResource owner) {
        if (owner.getKind() == null || owner.getName() == null) {
            return false;
        }
        return findOwnerReference(resource, owner.getKind())
            .filter(ref -> Objects.equals(ref.getName(), owner.getName()))
            .filter(ref -> uidsMatch(ref.getUid(), owner.getUid()))
            .isPresent();
    }

    /**
     * Resolve the owner of {@code resource} held in {@code ownerCache}. The first owner
     * reference whose kind matches the cache's kind is the only one considered.
     */
    <T extends ClusterResource> Optional<T> resolveOwner(ClusterResource resource, ResourceCache<T> ownerCache) {
        String ownerKind = ownerCache.getKind().getKind();
        Optional<OwnerReference> ref = findOwnerReference(resource, ownerKind);
        if (ref.isEmpty()) {
            log.debug("{} {}/{} has no {} owner reference",
                resource.getKind(), resource.getNamespace(), resource.getName(), ownerKind);
            return Optional.empty();
        }

        OwnerReference ownerRef = ref.get();
        Optional<T> candidate = ownerCache.get(resource.getNamespace(), ownerRef.getName());
        if (candidate.isEmpty()) {
            log.debug("{} owner {}/{} of {} {} is not in the cache",
                ownerKind, resource.getNamespace(), ownerRef.getName(), resource.getKind(), resource.getName());
            return Optional.empty();
        }

        if (!uidsMatch(ownerRef.getUid(), candidate.get().getUid())) {
            log.debug("{} owner {}/{} of {} {} has uid {}, reference expects {}",
                ownerKind, resource.getNamespace(), ownerRef.getName(), resource.getKind(), resource.getName(),
                candidate.get().getUid(), ownerRef.getUid());
            return Optional.empty();
        }

        return candidate;
    }

    // A missing uid on either side never matches; name alone is not identity
    private static boolean uidsMatch(String referenceUid, String ownerUid) {
        return referenceUid != null && !referenceUid.isEmpty() && referenceUid.equals(ownerUid);
    }

    private static Optional<OwnerReference> findOwnerReference(ClusterResource resource, String ownerKind) {
        if (resource.getMetadata() == null) {
            return Optional.empty();
        }
        return resource.getMetadata().ownerReferencesOrEmpty().stream()
            .filter(ref -> ownerKind.equals(ref.getKind()))
            .findFirst();
    }
}
