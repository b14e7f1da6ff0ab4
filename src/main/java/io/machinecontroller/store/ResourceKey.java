package io.machinecontroller.store;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import static io.machinecontroller.config.Constants.KEY_DELIMITER;

/**
 * Cache key of a resource: "namespace/name" for namespaced kinds, "name" otherwise.
 */
@Getter
@EqualsAndHashCode
public final class ResourceKey {

    private final String namespace;
    private final String name;

    private ResourceKey(String namespace, String name) {
        this.namespace = namespace == null ? "" : namespace;
        this.name = name;
    }

    /**
     * Build a key from its parts.
     *
     * @param namespace the namespace, null or empty for cluster-scoped resources
     * @param name the resource name
     * @throws InvalidResourceKeyException if the name is blank or either part contains a delimiter
     */
    public static ResourceKey of(String namespace, String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidResourceKeyException("Resource name must not be empty (namespace: '" + namespace + "')");
        }
        if (name.contains(KEY_DELIMITER) || (namespace != null && namespace.contains(KEY_DELIMITER))) {
            throw new InvalidResourceKeyException("Unexpected '" + KEY_DELIMITER + "' in resource key part: "
                + namespace + KEY_DELIMITER + name);
        }
        return new ResourceKey(namespace, name);
    }

    /**
     * Parse "namespace/name" or "name".
     *
     * @throws InvalidResourceKeyException if the key has more than two parts or an empty part
     */
    public static ResourceKey parse(String key) {
        if (key == null || key.isBlank()) {
            throw new InvalidResourceKeyException("Resource key must not be empty");
        }

        String[] parts = key.split(KEY_DELIMITER, -1);
        if (parts.length == 1) {
            return of("", parts[0]);
        }
        if (parts.length == 2 && !parts[0].isEmpty() && !parts[1].isEmpty()) {
            return of(parts[0], parts[1]);
        }
        throw new InvalidResourceKeyException("Unexpected resource key format: '" + key + "'");
    }

    @Override
    public String toString() {
        return namespace.isEmpty() ? name : namespace + KEY_DELIMITER + name;
    }
}
