package me.internalizable.waypoint.api.masterserver;

/**
 * Thrown when a submitted listing carries an invalid field.
 *
 * <p>Raised before any network I/O is attempted.</p>
 */
public class ListingValidationException extends RegistrationException {

    public ListingValidationException(String message) {
        super(message);
    }
}
