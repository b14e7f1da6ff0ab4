package io.machinecontroller.fixtures;

import io.machinecontroller.models.Machine;
import io.machinecontroller.models.MachineDeployment;
import io.machinecontroller.models.MachineSet;
import io.machinecontroller.models.Node;
import io.machinecontroller.models.ObjectReference;
import io.machinecontroller.models.OwnerReference;
import io.machinecontroller.store.ResourceCaches;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static io.machinecontroller.config.Constants.*;

/**
 * Builds consistent Node/Machine/MachineSet/MachineDeployment hierarchies for tests.
 *
 * For a group "ns/owner" with n nodes, node i is named "ns-owner-node-i", its Machine
 * "ns/ns-owner-machine-i" and its provider ID "ns-owner-nodeid-i". Every link is set:
 * owner references with uids, provider IDs on both sides, the node's machine annotation
 * and the machine's node reference. Tests remove links from copies as needed.
 */
public final class MachineTestConfigs {

    private MachineTestConfigs() {
    }

    public static Map<String, String> bounds(String min, String max) {
        Map<String, String> annotations = new HashMap<>();
        annotations.put(NODE_GROUP_MIN_SIZE_ANNOTATION_KEY, min);
        annotations.put(NODE_GROUP_MAX_SIZE_ANNOTATION_KEY, max);
        return annotations;
    }

    public static Map<String, String> bounds(int min, int max) {
        return bounds(String.valueOf(min), String.valueOf(max));
    }

    /**
     * A MachineSet without a deployment, carrying {@code annotations} and owning {@code nodeCount} machines.
     */
    public static TestConfig machineSetConfig(String namespace, String name, int nodeCount, Map<String, String> annotations) {
        MachineSet machineSet = new MachineSet(namespace, name, UUID.randomUUID().toString());
        machineSet.getMetadata().getAnnotations().putAll(annotations);
        machineSet.getSpec().setReplicas(nodeCount);

        TestConfig config = new TestConfig(namespace, machineSet, null);
        config.addMachines(nodeCount);
        return config;
    }

    /**
     * A MachineDeployment carrying {@code annotations}, owning one MachineSet that owns {@code nodeCount} machines.
     */
    public static TestConfig machineDeploymentConfig(String namespace, String name, int nodeCount, Map<String, String> annotations) {
        MachineDeployment machineDeployment = new MachineDeployment(namespace, name, UUID.randomUUID().toString());
        machineDeployment.getMetadata().getAnnotations().putAll(annotations);
        machineDeployment.getSpec().setReplicas(nodeCount);

        MachineSet machineSet = new MachineSet(namespace, name + "-ms", UUID.randomUUID().toString());
        machineSet.getMetadata().getOwnerReferences().add(ownerReference(machineDeployment.getKind(),
            machineDeployment.getName(), machineDeployment.getUid()));
        machineSet.getSpec().setReplicas(nodeCount);

        TestConfig config = new TestConfig(namespace, machineSet, machineDeployment);
        config.addMachines(nodeCount);
        return config;
    }

    public static List<TestConfig> machineSetConfigs(String namespace, int count, int nodeCount, Map<String, String> annotations) {
        List<TestConfig> configs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            configs.add(machineSetConfig(namespace, "machineset-" + i, nodeCount, annotations));
        }
        return configs;
    }

    public static List<TestConfig> machineDeploymentConfigs(String namespace, int count, int nodeCount, Map<String, String> annotations) {
        List<TestConfig> configs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            configs.add(machineDeploymentConfig(namespace, "machinedeployment-" + i, nodeCount, annotations));
        }
        return configs;
    }

    public static OwnerReference ownerReference(String kind, String name, String uid) {
        return OwnerReference.builder().kind(kind).name(name).uid(uid).build();
    }

    /**
     * One scalable hierarchy and its linked nodes.
     */
    public static final class TestConfig {
        private final String namespace;
        private final MachineSet machineSet;
        private final MachineDeployment machineDeployment;
        private final List<Machine> machines = new ArrayList<>();
        private final List<Node> nodes = new ArrayList<>();

        private TestConfig(String namespace, MachineSet machineSet, MachineDeployment machineDeployment) {
            this.namespace = namespace;
            this.machineSet = machineSet;
            this.machineDeployment = machineDeployment;
        }

        public String getNamespace() {
            return namespace;
        }

        public MachineSet getMachineSet() {
            return machineSet;
        }

        public MachineDeployment getMachineDeployment() {
            return machineDeployment;
        }

        public List<Machine> getMachines() {
            return machines;
        }

        public List<Node> getNodes() {
            return nodes;
        }

        /**
         * Name of the group root: the deployment if present, else the MachineSet.
         */
        public String getOwnerName() {
            return machineDeployment != null ? machineDeployment.getName() : machineSet.getName();
        }

        public void addTo(ResourceCaches caches) {
            if (machineDeployment != null) {
                caches.getMachineDeployments().upsert(machineDeployment);
            }
            caches.getMachineSets().upsert(machineSet);
            machines.forEach(caches.getMachines()::upsert);
            nodes.forEach(caches.getNodes()::upsert);
        }

        public void removeFrom(ResourceCaches caches) {
            if (machineDeployment != null) {
                caches.getMachineDeployments().delete(machineDeployment);
            }
            caches.getMachineSets().delete(machineSet);
            machines.forEach(caches.getMachines()::delete);
            nodes.forEach(caches.getNodes()::delete);
        }

        private void addMachines(int count) {
            String owner = getOwnerName();
            for (int i = 0; i < count; i++) {
                String nodeName = String.format("%s-%s-node-%d", namespace, owner, i);
                String machineName = String.format("%s-%s-machine-%d", namespace, owner, i);
                String providerId = String.format("%s-%s-nodeid-%d", namespace, owner, i);

                Node node = new Node(nodeName, providerId);
                node.getMetadata().setUid(UUID.randomUUID().toString());
                node.getMetadata().getAnnotations().put(MACHINE_ANNOTATION_KEY, namespace + "/" + machineName);

                Machine machine = new Machine(namespace, machineName);
                machine.getMetadata().setUid(UUID.randomUUID().toString());
                machine.getMetadata().getOwnerReferences().add(
                    ownerReference(machineSet.getKind(), machineSet.getName(), machineSet.getUid()));
                machine.getSpec().setProviderId(providerId);
                machine.getStatus().setNodeRef(ObjectReference.builder().kind(KIND_NODE).name(nodeName).build());

                nodes.add(node);
                machines.add(machine);
            }
        }
    }
}
