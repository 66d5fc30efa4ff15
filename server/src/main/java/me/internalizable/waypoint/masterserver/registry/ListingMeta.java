package me.internalizable.waypoint.masterserver.registry;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Last known identity of a listing, kept so a server can still be described
 * after its registry entry expired.
 *
 * @param endpoint listing endpoint
 * @param name display name
 * @param map map at the time it was seen
 * @param playlist playlist at the time it was seen
 * @param requiredMods required mod ids
 */
public record ListingMeta(
        @Nonnull EndpointKey endpoint,
        @Nonnull String name,
        @Nonnull String map,
        @Nonnull String playlist,
        @Nonnull List<String> requiredMods
) {

    public ListingMeta {
        Objects.requireNonNull(endpoint, "endpoint");
        name = Objects.requireNonNullElse(name, "");
        map = Objects.requireNonNullElse(map, "");
        playlist = Objects.requireNonNullElse(playlist, "");
        requiredMods = List.copyOf(Objects.requireNonNullElse(requiredMods, List.of()));
    }

    /**
     * Capture the identity of a listing.
     *
     * @param listing the listing
     * @return its meta
     */
    @Nonnull
    public static ListingMeta of(@Nonnull Listing listing) {
        return new ListingMeta(listing.endpoint(), listing.name(), listing.map(), listing.playlist(),
                listing.requiredMods());
    }
}
