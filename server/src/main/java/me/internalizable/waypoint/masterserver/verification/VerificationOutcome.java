package me.internalizable.waypoint.masterserver.verification;

/**
 * Outcome of a single verification attempt.
 */
public enum VerificationOutcome {
    PENDING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT
}
