package io.machinecontroller.nodegroup;

/**
 * Exception thrown when a replica count update fails.
 */
public class ReplicaUpdateException extends Exception {

    public ReplicaUpdateException(String message) {
        super(message);
    }

    public ReplicaUpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}
