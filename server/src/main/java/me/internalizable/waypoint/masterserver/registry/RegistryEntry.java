package me.internalizable.waypoint.masterserver.registry;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A listing as written to the registry, together with its shared secret.
 *
 * @param listing the verified listing
 * @param secret base64 encoded verification key
 */
public record RegistryEntry(@Nonnull Listing listing, @Nonnull String secret) {

    public RegistryEntry {
        Objects.requireNonNull(listing, "listing");
        Objects.requireNonNull(secret, "secret");
    }

    @Nonnull
    public EndpointKey endpoint() {
        return listing.endpoint();
    }

    @Override
    public String toString() {
        return "RegistryEntry[listing=" + listing.endpoint() + ", secret=<redacted>]";
    }
}
