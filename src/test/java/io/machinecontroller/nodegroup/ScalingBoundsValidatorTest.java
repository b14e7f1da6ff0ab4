package io.machinecontroller.nodegroup;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static io.machinecontroller.config.Constants.NODE_GROUP_MAX_SIZE_ANNOTATION_KEY;
import static io.machinecontroller.config.Constants.NODE_GROUP_MIN_SIZE_ANNOTATION_KEY;
import static io.machinecontroller.fixtures.MachineTestConfigs.bounds;
import static org.assertj.core.api.Assertions.*;

class ScalingBoundsValidatorTest {

    private final ScalingBoundsValidator validator = new ScalingBoundsValidator();

    @Test
    void testParse_ValidBounds() throws Exception {
        Optional<ScalingBounds> bounds = validator.parse(bounds(1, 10));

        assertThat(bounds).isPresent();
        assertThat(bounds.get().getMinSize()).isEqualTo(1);
        assertThat(bounds.get().getMaxSize()).isEqualTo(10);
        assertThat(bounds.get().hasScalingRoom()).isTrue();
        assertThat(bounds.get().contains(1)).isTrue();
        assertThat(bounds.get().contains(10)).isTrue();
        assertThat(bounds.get().contains(11)).isFalse();
    }

    @Test
    void testParse_ZeroMinimumIsValid() throws Exception {
        assertThat(validator.parse(bounds(0, 3))).map(ScalingBounds::getMinSize).contains(0);
    }

    @Test
    void testParse_EqualBoundsHaveNoScalingRoom() throws Exception {
        Optional<ScalingBounds> bounds = validator.parse(bounds(1, 1));

        assertThat(bounds).isPresent();
        assertThat(bounds.get().hasScalingRoom()).isFalse();
    }

    @Test
    void testParse_MissingAnnotations() throws Exception {
        assertThat(validator.parse(null)).isEmpty();
        assertThat(validator.parse(Map.of())).isEmpty();
        assertThat(validator.parse(Map.of(NODE_GROUP_MIN_SIZE_ANNOTATION_KEY, "1"))).isEmpty();
        assertThat(validator.parse(Map.of(NODE_GROUP_MAX_SIZE_ANNOTATION_KEY, "1"))).isEmpty();
    }

    @Test
    void testParse_NegativeMinimum() {
        assertThatThrownBy(() -> validator.parse(bounds(-1, 1)))
            .isInstanceOf(NodeGroupConfigurationException.class)
            .hasMessageContaining(NODE_GROUP_MIN_SIZE_ANNOTATION_KEY)
            .hasMessageContaining("-1");
    }

    @Test
    void testParse_MaximumBelowMinimum() {
        assertThatThrownBy(() -> validator.parse(bounds(5, 2)))
            .isInstanceOf(NodeGroupConfigurationException.class)
            .hasMessageContaining(NODE_GROUP_MAX_SIZE_ANNOTATION_KEY);
    }

    @Test
    void testParse_UnparseableValues() {
        assertThatThrownBy(() -> validator.parse(bounds("one", "10")))
            .isInstanceOf(NodeGroupConfigurationException.class)
            .hasMessageContaining("\"one\"")
            .hasCauseInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> validator.parse(bounds("1", "")))
            .isInstanceOf(NodeGroupConfigurationException.class);
        assertThatThrownBy(() -> validator.parse(bounds(" 1", "10")))
            .isInstanceOf(NodeGroupConfigurationException.class);
    }
}
