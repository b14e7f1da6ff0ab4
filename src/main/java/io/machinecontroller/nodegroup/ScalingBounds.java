package io.machinecontroller.nodegroup;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Validated minimum and maximum replica counts of a node group (0 <= min <= max).
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ScalingBounds {

    private final int minSize;
    private final int maxSize;

    ScalingBounds(int minSize, int maxSize) {
        this.minSize = minSize;
        this.maxSize = maxSize;
    }

    /**
     * A group whose minimum equals its maximum cannot scale and is not exposed.
     */
    public boolean hasScalingRoom() {
        return maxSize > minSize;
    }

    public boolean contains(int size) {
        return size >= minSize && size <= maxSize;
    }
}
