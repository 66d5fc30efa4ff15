package me.internalizable.waypoint.masterserver.registry;

import me.internalizable.waypoint.api.masterserver.RegistryUnavailableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ephemeral store of verified listings.
 *
 * <p>Every entry carries a sliding expiry that is reset by each
 * {@link #put(RegistryEntry, Duration)}. Expired entries are invisible to
 * every read. Entries are never deleted explicitly.</p>
 *
 * <p>Listing reads degrade to empty results when the backend cannot be
 * reached. Key reads and writes throw {@link RegistryUnavailableException}
 * instead, so callers that diff or persist state can tell "nothing there"
 * apart from "could not look".</p>
 */
public interface ListingStore {

    // ==================== Listings ====================

    /**
     * Write an entry and reset its expiry. Overwrites any entry for the same endpoint.
     *
     * @param entry entry to write
     * @param ttl time to live
     * @throws RegistryUnavailableException if the backend cannot be written
     */
    void put(@Nonnull RegistryEntry entry, @Nonnull Duration ttl);

    /**
     * Get every live listing.
     *
     * @return listings in no particular order
     */
    @Nonnull
    List<Listing> getAll();

    /**
     * Get every live listing in its public form.
     *
     * @param typed true for native value types, false for string values
     * @return rendered listings in no particular order
     */
    @Nonnull
    default List<Map<String, Object>> getAll(boolean typed) {
        List<Map<String, Object>> views = new ArrayList<>();
        for (Listing listing : getAll()) {
            views.add(ListingCodec.toView(listing, typed));
        }
        return views;
    }

    /**
     * Get a live listing by endpoint.
     *
     * @param ip server address
     * @param port server port
     * @return the listing, or null if absent or expired
     */
    @Nullable
    Listing getByEndpoint(@Nonnull String ip, int port);

    /**
     * Find a live listing by its token.
     *
     * @param token listing token
     * @return the listing, or null if none carries the token
     */
    @Nullable
    Listing getByToken(@Nonnull String token);

    // ==================== Keys ====================

    /**
     * Get the storage keys of every live listing.
     *
     * @return storage keys
     * @throws RegistryUnavailableException if the backend cannot be read
     */
    @Nonnull
    Set<String> allKeys();

    /**
     * Get the key set recorded by the last presence tick.
     *
     * @return storage keys
     * @throws RegistryUnavailableException if the backend cannot be read
     */
    @Nonnull
    Set<String> knownKeys();

    /**
     * Replace the recorded key set in a single step.
     *
     * @param keys new key set, may be empty
     * @throws RegistryUnavailableException if the backend cannot be written
     */
    void replaceKnownKeys(@Nonnull Collection<String> keys);

    // ==================== Meta ====================

    /**
     * Cache the last known identity of a listing.
     *
     * @param meta listing meta
     */
    void putMeta(@Nonnull ListingMeta meta);

    /**
     * Read a cached identity.
     *
     * @param endpoint listing endpoint
     * @return the meta, or null if not cached
     */
    @Nullable
    ListingMeta getMeta(@Nonnull EndpointKey endpoint);

    /**
     * Drop a cached identity.
     *
     * @param endpoint listing endpoint
     */
    void removeMeta(@Nonnull EndpointKey endpoint);

    // ==================== Lifecycle ====================

    /**
     * Check if the backend is reachable.
     *
     * @return true if available
     */
    boolean isAvailable();

    /**
     * Release backend resources.
     */
    void shutdown();
}
