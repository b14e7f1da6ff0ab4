package io.machinecontroller.nodegroup;

import java.util.Map;
import java.util.Optional;

import static io.machinecontroller.config.Constants.NODE_GROUP_MAX_SIZE_ANNOTATION_KEY;
import static io.machinecontroller.config.Constants.NODE_GROUP_MIN_SIZE_ANNOTATION_KEY;

/**
 * Parses and validates the min/max size annotations of a MachineSet or MachineDeployment.
 *
 * <ul>
 *   <li>either annotation missing: empty, the resource is simply not a node group</li>
 *   <li>unparseable value, min &lt; 0 or max &lt; min: {@link NodeGroupConfigurationException}</li>
 *   <li>min == max: bounds are returned, but {@link ScalingBounds#hasScalingRoom()} is false</li>
 * </ul>
 */
public class ScalingBoundsValidator {

    public Optional<ScalingBounds> parse(Map<String, String> annotations) throws NodeGroupConfigurationException {
        if (annotations == null) {
            return Optional.empty();
        }

        String minValue = annotations.get(NODE_GROUP_MIN_SIZE_ANNOTATION_KEY);
        String maxValue = annotations.get(NODE_GROUP_MAX_SIZE_ANNOTATION_KEY);
        if (minValue == null || maxValue == null) {
            return Optional.empty();
        }

        int minSize = parseSize(NODE_GROUP_MIN_SIZE_ANNOTATION_KEY, minValue);
        int maxSize = parseSize(NODE_GROUP_MAX_SIZE_ANNOTATION_KEY, maxValue);

        if (minSize < 0) {
            throw new NodeGroupConfigurationException(String.format(
                "Invalid scaling bounds: %s=%d must not be negative", NODE_GROUP_MIN_SIZE_ANNOTATION_KEY, minSize));
        }
        if (maxSize < minSize) {
            throw new NodeGroupConfigurationException(String.format(
                "Invalid scaling bounds: %s=%d is less than %s=%d",
                NODE_GROUP_MAX_SIZE_ANNOTATION_KEY, maxSize, NODE_GROUP_MIN_SIZE_ANNOTATION_KEY, minSize));
        }

        return Optional.of(new ScalingBounds(minSize, maxSize));
    }

    private static int parseSize(String key, String value) throws NodeGroupConfigurationException {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new NodeGroupConfigurationException(
                String.format("Invalid scaling bounds: %s=\"%s\" is not an integer", key, value), e);
        }
    }
}
