package me.internalizable.waypoint.masterserver.crypto;

/**
 * Thrown when a sealed packet cannot be opened.
 *
 * <p>Covers truncated packets as well as authentication failures caused by
 * a wrong key, a tampered ciphertext or a tampered tag.</p>
 */
public class PacketDecryptionException extends Exception {

    public PacketDecryptionException(String message) {
        super(message);
    }

    public PacketDecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
