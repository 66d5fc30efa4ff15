package me.internalizable.waypoint.masterserver.registry;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Primary key of a listing: the public address and port of the game server.
 *
 * <p>Storage form is {@code servers:<ip>:<port>}. IPv6 literals are kept
 * verbatim, so the port is always the segment after the last colon.</p>
 *
 * @param ip server address
 * @param port server port
 */
public record EndpointKey(@Nonnull String ip, int port) {

    public static final String PREFIX = "servers:";

    public EndpointKey {
        Objects.requireNonNull(ip, "ip");
        if (ip.isEmpty()) {
            throw new IllegalArgumentException("IP must not be empty");
        }
    }

    /**
     * Get the registry key for this endpoint.
     *
     * @return storage key
     */
    @Nonnull
    public String toStorageKey() {
        return PREFIX + ip + ":" + port;
    }

    /**
     * Parse a registry key.
     *
     * @param storageKey key in {@code servers:<ip>:<port>} form
     * @return the endpoint, or null if the key is malformed
     */
    @Nullable
    public static EndpointKey parse(@Nonnull String storageKey) {
        Objects.requireNonNull(storageKey, "storageKey");
        if (!storageKey.startsWith(PREFIX)) {
            return null;
        }

        String rest = storageKey.substring(PREFIX.length());
        int separator = rest.lastIndexOf(':');
        if (separator <= 0 || separator == rest.length() - 1) {
            return null;
        }

        try {
            int port = Integer.parseInt(rest.substring(separator + 1));
            return new EndpointKey(rest.substring(0, separator), port);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return ip + ":" + port;
    }
}
