package io.machinecontroller.store;

import io.machinecontroller.enums.ResourceKind;

import java.nio.file.Paths;
import java.util.Optional;

import static io.machinecontroller.config.Constants.PATH_DELIMITER;

/**
 * Centralized etcd path resolver for resource documents.
 *
 * Layout:
 * <pre>
 *   /&lt;cluster-name&gt;/nodes/&lt;name&gt;
 *   /&lt;cluster-name&gt;/machines/&lt;namespace&gt;/&lt;name&gt;
 *   /&lt;cluster-name&gt;/machinesets/&lt;namespace&gt;/&lt;name&gt;
 *   /&lt;cluster-name&gt;/machinedeployments/&lt;namespace&gt;/&lt;name&gt;
 * </pre>
 * Stateless - the cluster name is passed to every method.
 */
public class EtcdPathResolver {

    private static final EtcdPathResolver INSTANCE = new EtcdPathResolver();

    private EtcdPathResolver() {
        // Private constructor for singleton
    }

    public static EtcdPathResolver getInstance() {
        return INSTANCE;
    }

    /**
     * Get prefix for all documents of a kind
     * Pattern: /<cluster-name>/<kind-segment>
     */
    public String getResourcePrefix(String clusterName, ResourceKind kind) {
        return Paths.get(PATH_DELIMITER, clusterName, kind.getPathSegment()).toString();
    }

    /**
     * Get path of a single document
     * Pattern: /<cluster-name>/<kind-segment>/<namespace>/<name> or /<cluster-name>/nodes/<name>
     */
    public String getResourcePath(String clusterName, ResourceKind kind, String namespace, String name) {
        if (kind.isNamespaced()) {
            return Paths.get(getResourcePrefix(clusterName, kind), namespace, name).toString();
        }
        return Paths.get(getResourcePrefix(clusterName, kind), name).toString();
    }

    /**
     * Recover the resource key from a document path.
     *
     * @return the key, or empty if the path does not belong to the kind's prefix or has the wrong depth
     */
    public Optional<ResourceKey> parseResourceKey(String clusterName, ResourceKind kind, String path) {
        String prefix = getResourcePrefix(clusterName, kind) + PATH_DELIMITER;
        if (path == null || !path.startsWith(prefix)) {
            return Optional.empty();
        }

        String[] parts = path.substring(prefix.length()).split(PATH_DELIMITER, -1);
        try {
            if (kind.isNamespaced() && parts.length == 2 && !parts[0].isEmpty()) {
                return Optional.of(ResourceKey.of(parts[0], parts[1]));
            }
            if (!kind.isNamespaced() && parts.length == 1) {
                return Optional.of(ResourceKey.of("", parts[0]));
            }
        } catch (InvalidResourceKeyException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }
}
