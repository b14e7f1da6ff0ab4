package io.machinecontroller.enums;

import static io.machinecontroller.config.Constants.*;

/**
 * Resource kinds kept in the synchronized caches.
 *
 * Each kind knows the literal kind string used in documents and owner references,
 * the etcd path segment its documents live under, and whether it is namespaced.
 */
public enum ResourceKind {
    NODE(KIND_NODE, PATH_NODES, false),
    MACHINE(KIND_MACHINE, PATH_MACHINES, true),
    MACHINE_SET(KIND_MACHINE_SET, PATH_MACHINE_SETS, true),
    MACHINE_DEPLOYMENT(KIND_MACHINE_DEPLOYMENT, PATH_MACHINE_DEPLOYMENTS, true);

    private final String kind;
    private final String pathSegment;
    private final boolean namespaced;

    ResourceKind(String kind, String pathSegment, boolean namespaced) {
        this.kind = kind;
        this.pathSegment = pathSegment;
        this.namespaced = namespaced;
    }

    public String getKind() {
        return kind;
    }

    public String getPathSegment() {
        return pathSegment;
    }

    public boolean isNamespaced() {
        return namespaced;
    }

    /**
     * Resolve a kind string (e.g. "MachineSet") to its enum value.
     * Matching is exact on the kind string, with a case-insensitive fallback on the
     * kind string and the enum name so REST paths such as "machineset" resolve too.
     *
     * @return the kind, or null for unknown kinds
     */
    public static ResourceKind fromKind(String value) {
        if (value == null) return null;

        for (ResourceKind kind : ResourceKind.values()) {
            if (kind.kind.equals(value)) {
                return kind;
            }
        }

        String trimmed = value.trim();
        for (ResourceKind kind : ResourceKind.values()) {
            if (kind.kind.equalsIgnoreCase(trimmed) || kind.name().equalsIgnoreCase(trimmed)) {
                return kind;
            }
        }

        return null;
    }
}
