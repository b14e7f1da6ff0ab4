package io.machinecontroller.store;

/**
 * Thrown when a lookup key cannot be parsed into a namespace and a name.
 * This is the only error a cache lookup raises; a well-formed key that matches
 * nothing is reported as an empty result.
 */
public class InvalidResourceKeyException extends IllegalArgumentException {

    public InvalidResourceKeyException(String message) {
        super(message);
    }
}
