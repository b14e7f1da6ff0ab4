package io.machinecontroller.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final String DEFAULT_CLUSTER_NAME = "default-cluster";
    public static final long DEFAULT_SYNC_RETRY_DELAY_SECONDS = 5L;

    // Annotation keys (wire contract, must not change)
    public static final String NODE_GROUP_MIN_SIZE_ANNOTATION_KEY =
        "machine.openshift.io/cluster-api-autoscaler-node-group-min-size";
    public static final String NODE_GROUP_MAX_SIZE_ANNOTATION_KEY =
        "machine.openshift.io/cluster-api-autoscaler-node-group-max-size";
    public static final String MACHINE_ANNOTATION_KEY = "machine.openshift.io/machine";

    // Resource kinds as they appear in documents and owner references
    public static final String KIND_NODE = "Node";
    public static final String KIND_MACHINE = "Machine";
    public static final String KIND_MACHINE_SET = "MachineSet";
    public static final String KIND_MACHINE_DEPLOYMENT = "MachineDeployment";

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_NODES = "nodes";
    public static final String PATH_MACHINES = "machines";
    public static final String PATH_MACHINE_SETS = "machinesets";
    public static final String PATH_MACHINE_DEPLOYMENTS = "machinedeployments";

    // Key delimiter for "namespace/name" resource keys
    public static final String KEY_DELIMITER = "/";
}
