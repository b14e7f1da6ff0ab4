package io.machinecontroller.nodegroup;

/**
 * Thrown when a scalable resource carries scaling bounds that cannot be used:
 * unparseable values, a negative minimum, or a maximum below the minimum.
 *
 * This is an operator mistake and must reach the capacity manager; group
 * enumeration aborts instead of returning a partial result.
 */
public class NodeGroupConfigurationException extends Exception {

    public NodeGroupConfigurationException(String message) {
        super(message);
    }

    public NodeGroupConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
