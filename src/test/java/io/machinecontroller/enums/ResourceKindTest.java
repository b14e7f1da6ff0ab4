package io.machinecontroller.enums;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceKindTest {

    @Test
    void testFromKind_ExactMatch() {
        assertThat(ResourceKind.fromKind("Node")).isEqualTo(ResourceKind.NODE);
        assertThat(ResourceKind.fromKind("Machine")).isEqualTo(ResourceKind.MACHINE);
        assertThat(ResourceKind.fromKind("MachineSet")).isEqualTo(ResourceKind.MACHINE_SET);
        assertThat(ResourceKind.fromKind("MachineDeployment")).isEqualTo(ResourceKind.MACHINE_DEPLOYMENT);
    }

    @Test
    void testFromKind_CaseInsensitiveAndEnumName() {
        assertThat(ResourceKind.fromKind("machineset")).isEqualTo(ResourceKind.MACHINE_SET);
        assertThat(ResourceKind.fromKind(" MACHINE_DEPLOYMENT ")).isEqualTo(ResourceKind.MACHINE_DEPLOYMENT);
    }

    @Test
    void testFromKind_Unknown() {
        assertThat(ResourceKind.fromKind(null)).isNull();
        assertThat(ResourceKind.fromKind("Pod")).isNull();
    }

    @Test
    void testOnlyNodesAreClusterScoped() {
        assertThat(ResourceKind.NODE.isNamespaced()).isFalse();
        assertThat(ResourceKind.MACHINE.isNamespaced()).isTrue();
        assertThat(ResourceKind.MACHINE_DEPLOYMENT.getPathSegment()).isEqualTo("machinedeployments");
    }

    @Test
    void testNodeGroupKind_FromKind() {
        assertThat(NodeGroupKind.fromKind("MachineSet")).isEqualTo(NodeGroupKind.MACHINE_SET);
        assertThat(NodeGroupKind.fromKind("machinedeployment")).isEqualTo(NodeGroupKind.MACHINE_DEPLOYMENT);
        assertThat(NodeGroupKind.fromKind("Machine")).isNull();
        assertThat(NodeGroupKind.fromKind("Node")).isNull();
        assertThat(NodeGroupKind.fromKind("unknown")).isNull();
        assertThat(NodeGroupKind.MACHINE_SET.getResourceKind()).isEqualTo(ResourceKind.MACHINE_SET);
    }
}
