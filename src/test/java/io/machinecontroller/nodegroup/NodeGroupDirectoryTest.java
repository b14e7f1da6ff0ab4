package io.machinecontroller.nodegroup;

import io.machinecontroller.correlation.NodeMachineCorrelator;
import io.machinecontroller.enums.NodeGroupKind;
import io.machinecontroller.fixtures.MachineTestConfigs.TestConfig;
import io.machinecontroller.metrics.MetricsProvider;
import io.machinecontroller.models.Machine;
import io.machinecontroller.models.MachineDeployment;
import io.machinecontroller.models.MachineSet;
import io.machinecontroller.models.Node;
import io.machinecontroller.models.NodeInstance;
import io.machinecontroller.ownership.OwnerChainResolver;
import io.machinecontroller.store.ResourceCaches;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static io.machinecontroller.config.Constants.NODE_GROUP_MAX_SIZE_ANNOTATION_KEY;
import static io.machinecontroller.fixtures.MachineTestConfigs.*;
import static io.machinecontroller.metrics.MetricsConstants.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class NodeGroupDirectoryTest {

    private static final String NAMESPACE = "test-namespace";

    @Mock
    private ReplicaScaler replicaScaler;

    private ResourceCaches caches;
    private SimpleMeterRegistry meterRegistry;
    private NodeGroupDirectory directory;

    @BeforeEach
    void setUp() {
        caches = new ResourceCaches();
        meterRegistry = new SimpleMeterRegistry();
        directory = new NodeGroupDirectory(
            caches.getMachines(),
            caches.getMachineSets(),
            caches.getMachineDeployments(),
            new OwnerChainResolver(caches.getMachineSets(), caches.getMachineDeployments()),
            new NodeMachineCorrelator(caches.getNodes(), caches.getMachines()),
            new ScalingBoundsValidator(),
            replicaScaler,
            new MetricsProvider(meterRegistry, "test-controller")
        );
    }

    @Test
    void testListNodeGroups_EmptyCache() throws Exception {
        assertThat(directory.listNodeGroups()).isEmpty();
    }

    @Test
    void testListNodeGroups_AddAndDeleteHierarchies() throws Exception {
        // Given
        List<TestConfig> machineSetConfigs = machineSetConfigs(NAMESPACE, 5, 1, bounds(1, 2));
        List<TestConfig> machineDeploymentConfigs = machineDeploymentConfigs(NAMESPACE, 2, 1, bounds(1, 2));

        // When / Then
        machineSetConfigs.forEach(config -> config.addTo(caches));
        assertThat(directory.listNodeGroups()).hasSize(5);

        machineDeploymentConfigs.forEach(config -> config.addTo(caches));
        assertThat(directory.listNodeGroups()).hasSize(7);

        machineSetConfigs.forEach(config -> config.removeFrom(caches));
        assertThat(directory.listNodeGroups()).hasSize(2)
            .allMatch(nodeGroup -> nodeGroup.kind() == NodeGroupKind.MACHINE_DEPLOYMENT);

        machineDeploymentConfigs.forEach(config -> config.removeFrom(caches));
        assertThat(directory.listNodeGroups()).isEmpty();
    }

    @Test
    void testListNodeGroups_TwoMachineSetsWithFiveNodesEach() throws Exception {
        // Given
        TestConfig first = machineSetConfig(NAMESPACE, "first", 5, bounds(1, 10));
        TestConfig second = machineSetConfig(NAMESPACE, "second", 5, bounds(1, 10));
        first.addTo(caches);
        second.addTo(caches);

        // When
        List<NodeGroup> nodeGroups = directory.listNodeGroups();

        // Then
        assertThat(nodeGroups).extracting(NodeGroup::id)
            .containsExactly(NAMESPACE + "/first", NAMESPACE + "/second");

        for (NodeGroup nodeGroup : nodeGroups) {
            TestConfig config = nodeGroup.name().equals("first") ? first : second;
            List<NodeInstance> members = nodeGroup.members();

            assertThat(members).hasSize(5);
            assertThat(members).extracting(NodeInstance::getId)
                .containsExactlyInAnyOrderElementsOf(
                    config.getNodes().stream().map(Node::getProviderId).collect(Collectors.toList()));
            assertThat(nodeGroup.minSize()).isEqualTo(1);
            assertThat(nodeGroup.maxSize()).isEqualTo(10);
            assertThat(nodeGroup.size()).isEqualTo(5);
        }
    }

    @Test
    void testListNodeGroups_FixedSizeBoundsAreExcludedWithoutError() throws Exception {
        // Given
        machineSetConfigs(NAMESPACE, 5, 1, bounds(1, 1)).forEach(config -> config.addTo(caches));
        machineDeploymentConfigs(NAMESPACE, 2, 1, bounds(1, 1)).forEach(config -> config.addTo(caches));

        // When / Then
        assertThat(directory.listNodeGroups()).isEmpty();
    }

    @Test
    void testListNodeGroups_MissingBoundsAreExcluded() throws Exception {
        // Given
        machineSetConfig(NAMESPACE, "no-bounds", 3, Map.of()).addTo(caches);
        Map<String, String> minOnly = bounds(1, 3);
        minOnly.remove(NODE_GROUP_MAX_SIZE_ANNOTATION_KEY);
        machineSetConfig(NAMESPACE, "min-only", 3, minOnly).addTo(caches);

        // When / Then
        assertThat(directory.listNodeGroups()).isEmpty();
    }

    @Test
    void testListNodeGroups_NegativeMinimumAbortsEnumeration() {
        // Given
        machineSetConfig(NAMESPACE, "valid", 1, bounds(1, 3)).addTo(caches);
        machineSetConfig(NAMESPACE, "broken", 1, bounds(-1, 1)).addTo(caches);

        // When / Then
        assertThatThrownBy(() -> directory.listNodeGroups())
            .isInstanceOf(NodeGroupConfigurationException.class)
            .hasMessageContaining("MachineSet " + NAMESPACE + "/broken");
        assertThat(meterRegistry.find(NODE_GROUP_CONFIGURATION_ERRORS_METRIC_NAME).counter().count()).isEqualTo(1.0);
    }

    @Test
    void testListNodeGroups_InvalidDeploymentBoundsAbortEnumeration() {
        // Given
        machineDeploymentConfig(NAMESPACE, "broken", 1, bounds("1", "ten")).addTo(caches);

        // When / Then
        assertThatThrownBy(() -> directory.listNodeGroups())
            .isInstanceOf(NodeGroupConfigurationException.class)
            .hasMessageContaining("MachineDeployment " + NAMESPACE + "/broken")
            .hasMessageContaining("ten");
    }

    @Test
    void testListNodeGroups_OwnedMachineSetIsNotASeparateCandidate() throws Exception {
        // Given - the owned MachineSet carries bounds of its own
        TestConfig config = machineDeploymentConfig(NAMESPACE, "deployment", 2, bounds(1, 5));
        config.getMachineSet().getMetadata().getAnnotations().putAll(bounds(1, 3));
        config.addTo(caches);

        // When
        List<NodeGroup> nodeGroups = directory.listNodeGroups();

        // Then
        assertThat(nodeGroups).hasSize(1);
        assertThat(nodeGroups.get(0).kind()).isEqualTo(NodeGroupKind.MACHINE_DEPLOYMENT);
        assertThat(nodeGroups.get(0).maxSize()).isEqualTo(5);
        assertThat(nodeGroups.get(0).members()).hasSize(2);
    }

    @Test
    void testListNodeGroups_MachineSetStandsInForUnresolvableDeployment() throws Exception {
        // Given - the deployment is gone but its MachineSet still points at it
        TestConfig config = machineDeploymentConfig(NAMESPACE, "deployment", 2, bounds(1, 5));
        config.getMachineSet().getMetadata().getAnnotations().putAll(bounds(1, 3));
        config.addTo(caches);
        caches.getMachineDeployments().delete(config.getMachineDeployment());

        // When
        List<NodeGroup> nodeGroups = directory.listNodeGroups();

        // Then
        assertThat(nodeGroups).hasSize(1);
        assertThat(nodeGroups.get(0).kind()).isEqualTo(NodeGroupKind.MACHINE_SET);
        assertThat(nodeGroups.get(0).name()).isEqualTo(config.getMachineSet().getName());
        assertThat(nodeGroups.get(0).maxSize()).isEqualTo(3);
    }

    @Test
    void testListNodeGroups_RecreatedDeploymentWithNewUidDoesNotAdoptMachineSet() throws Exception {
        // Given
        TestConfig config = machineDeploymentConfig(NAMESPACE, "deployment", 2, bounds(1, 5));
        config.addTo(caches);
        MachineDeployment recreated = config.getMachineDeployment().deepCopy();
        recreated.getMetadata().setUid("recreated-uid");
        caches.getMachineDeployments().upsert(recreated);

        // When
        List<NodeGroup> nodeGroups = directory.listNodeGroups();

        // Then - the deployment is still a group but its old MachineSet is no longer traversed
        assertThat(nodeGroups).hasSize(1);
        assertThat(nodeGroups.get(0).kind()).isEqualTo(NodeGroupKind.MACHINE_DEPLOYMENT);
        assertThat(nodeGroups.get(0).members()).isEmpty();
    }

    @Test
    void testListNodeGroups_ZeroReplicasAreExcluded() throws Exception {
        // Given
        machineSetConfig(NAMESPACE, "empty", 0, bounds(1, 10)).addTo(caches);
        machineDeploymentConfig(NAMESPACE, "empty-deployment", 0, bounds(1, 10)).addTo(caches);

        // When / Then
        assertThat(directory.listNodeGroups()).isEmpty();
    }

    @Test
    void testListNodeGroups_RecordsMetrics() throws Exception {
        // Given
        machineSetConfigs(NAMESPACE, 3, 1, bounds(1, 2)).forEach(config -> config.addTo(caches));

        // When
        directory.listNodeGroups();

        // Then
        assertThat(meterRegistry.find(NODE_GROUPS_DISCOVERED_METRIC_NAME).tag("controller", "test-controller")
            .gauge().value()).isEqualTo(3.0);
        assertThat(meterRegistry.find(NODE_GROUP_LIST_LATENCY_METRIC_NAME).timer().count()).isEqualTo(1);
    }

    @Test
    void testNodeGroupForNode_MachineSet() throws Exception {
        // Given
        TestConfig config = machineSetConfig(NAMESPACE, "workers", 1, bounds(1, 10));
        config.addTo(caches);

        // When
        Optional<NodeGroup> nodeGroup = directory.nodeGroupForNode(config.getNodes().get(0));

        // Then
        assertThat(nodeGroup).isPresent();
        assertThat(nodeGroup.get().kind()).isEqualTo(NodeGroupKind.MACHINE_SET);
        assertThat(nodeGroup.get().id()).isEqualTo(NAMESPACE + "/workers");
        assertThat(nodeGroup.get().minSize()).isEqualTo(1);
        assertThat(nodeGroup.get().maxSize()).isEqualTo(10);
    }

    @Test
    void testNodeGroupForNode_MachineDeployment() throws Exception {
        // Given
        TestConfig config = machineDeploymentConfig(NAMESPACE, "workers", 1, bounds(1, 10));
        config.addTo(caches);

        // When
        Optional<NodeGroup> nodeGroup = directory.nodeGroupForNode(config.getNodes().get(0));

        // Then
        assertThat(nodeGroup).isPresent();
        assertThat(nodeGroup.get().kind()).isEqualTo(NodeGroupKind.MACHINE_DEPLOYMENT);
        assertThat(nodeGroup.get().id()).isEqualTo(NAMESPACE + "/workers");
    }

    @Test
    void testNodeGroupForNode_NodeWithoutProviderIdUsesAnnotation() {
        // Given
        TestConfig config = machineSetConfig(NAMESPACE, "workers", 1, bounds(1, 10));
        Node node = config.getNodes().get(0);
        node.getSpec().setProviderId(null);
        Machine machine = config.getMachines().get(0);
        machine.getSpec().setProviderId(null);
        config.addTo(caches);

        // When
        Optional<NodeGroup> nodeGroup = directory.nodeGroupForNode(node);

        // Then
        assertThat(nodeGroup).map(NodeGroup::id).contains(NAMESPACE + "/workers");
    }

    @Test
    void testNodeGroupForNode_UnmanagedNode() {
        // Given
        machineSetConfig(NAMESPACE, "workers", 1, bounds(1, 10)).addTo(caches);
        Node unmanaged = new Node("unmanaged", "unmanaged-provider-id");
        caches.getNodes().upsert(unmanaged);

        // When / Then
        assertThat(directory.nodeGroupForNode(unmanaged)).isEmpty();
    }

    @Test
    void testNodeGroupForNode_FixedSizeBounds() {
        // Given
        TestConfig config = machineSetConfig(NAMESPACE, "workers", 1, bounds(1, 1));
        config.addTo(caches);

        // When / Then
        assertThat(directory.nodeGroupForNode(config.getNodes().get(0))).isEmpty();
    }

    @Test
    void testNodeGroupForNode_InvalidBoundsReportedAsEmpty() {
        // Given
        TestConfig config = machineDeploymentConfig(NAMESPACE, "workers", 1, bounds(-1, 1));
        config.addTo(caches);

        // When / Then
        assertThat(directory.nodeGroupForNode(config.getNodes().get(0))).isEmpty();
    }

    @Test
    void testNodeGroupForNode_MachineWithoutOwner() {
        // Given
        TestConfig config = machineSetConfig(NAMESPACE, "workers", 1, bounds(1, 10));
        config.getMachines().get(0).getMetadata().getOwnerReferences().clear();
        config.addTo(caches);

        // When / Then
        assertThat(directory.nodeGroupForNode(config.getNodes().get(0))).isEmpty();
    }

    @Test
    void testNodeGroupById() throws Exception {
        // Given
        TestConfig machineSetConfig = machineSetConfig(NAMESPACE, "standalone", 2, bounds(1, 10));
        TestConfig deploymentConfig = machineDeploymentConfig(NAMESPACE, "deployment", 2, bounds(1, 10));
        machineSetConfig.addTo(caches);
        deploymentConfig.addTo(caches);
        MachineSet ownedMachineSet = deploymentConfig.getMachineSet();

        // When / Then
        assertThat(directory.nodeGroupById(NodeGroupKind.MACHINE_SET, NAMESPACE, "standalone"))
            .map(NodeGroup::kind).contains(NodeGroupKind.MACHINE_SET);
        assertThat(directory.nodeGroupById(NodeGroupKind.MACHINE_DEPLOYMENT, NAMESPACE, "deployment"))
            .map(NodeGroup::kind).contains(NodeGroupKind.MACHINE_DEPLOYMENT);
        assertThat(directory.nodeGroupById(NodeGroupKind.MACHINE_SET, NAMESPACE, ownedMachineSet.getName())).isEmpty();
        assertThat(directory.nodeGroupById(NodeGroupKind.MACHINE_DEPLOYMENT, NAMESPACE, "standalone")).isEmpty();
        assertThat(directory.nodeGroupById(NodeGroupKind.MACHINE_SET, "other-namespace", "standalone")).isEmpty();
        verifyNoInteractions(replicaScaler);
    }

    @Test
    void testNodeGroupById_InvalidBounds() {
        // Given
        machineSetConfig(NAMESPACE, "broken", 1, bounds(3, 1)).addTo(caches);

        // When / Then
        assertThatThrownBy(() -> directory.nodeGroupById(NodeGroupKind.MACHINE_SET, NAMESPACE, "broken"))
            .isInstanceOf(NodeGroupConfigurationException.class);
    }
}
