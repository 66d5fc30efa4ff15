package me.internalizable.waypoint.masterserver.verification;

/**
 * Lifecycle state of a {@link VerificationClient}.
 *
 * <pre>
 * IDLE → CONNECTING → AWAITING_RESPONSE → VERIFIED
 *             ↓               ↓
 *           CLOSED          CLOSED
 * </pre>
 */
public enum VerificationState {
    /**
     * Created, nothing sent yet.
     */
    IDLE,

    /**
     * Binding the local socket and sending the challenge.
     */
    CONNECTING,

    /**
     * Challenge sent, waiting for a matching response.
     */
    AWAITING_RESPONSE,

    /**
     * A matching response arrived.
     */
    VERIFIED,

    /**
     * Closed before a matching response arrived.
     */
    CLOSED;

    /**
     * Check if the client can no longer change state.
     *
     * @return true if verified or closed
     */
    public boolean isTerminal() {
        return this == VERIFIED || this == CLOSED;
    }
}
