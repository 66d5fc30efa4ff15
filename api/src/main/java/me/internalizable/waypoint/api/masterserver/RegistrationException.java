package me.internalizable.waypoint.api.masterserver;

/**
 * Thrown when a server registration is rejected or cannot be completed.
 *
 * <p>The message is safe to show to the registering server operator.</p>
 */
public class RegistrationException extends RuntimeException {

    public RegistrationException(String message) {
        super(message);
    }

    public RegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
