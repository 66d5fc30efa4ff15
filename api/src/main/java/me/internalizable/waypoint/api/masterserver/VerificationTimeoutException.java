package me.internalizable.waypoint.api.masterserver;

/**
 * Thrown when a server did not answer the verification challenge in time.
 *
 * <p>Usually means the game port is firewalled or not forwarded.</p>
 */
public class VerificationTimeoutException extends RegistrationException {

    public static final String MESSAGE = "Server verification timed out. Please check your ports.";

    public VerificationTimeoutException() {
        super(MESSAGE);
    }
}
