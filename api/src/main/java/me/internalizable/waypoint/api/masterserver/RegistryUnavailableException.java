package me.internalizable.waypoint.api.masterserver;

/**
 * Thrown when the listing registry cannot be written.
 */
public class RegistryUnavailableException extends RuntimeException {

    public RegistryUnavailableException(String message) {
        super(message);
    }

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
