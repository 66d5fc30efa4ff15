package me.internalizable.waypoint.masterserver.registry;

import me.internalizable.waypoint.api.masterserver.RegistryUnavailableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Store used when the configured backend could not be reached at startup.
 *
 * <p>Listing reads are empty; every write and key read fails.</p>
 */
public class UnavailableListingStore implements ListingStore {

    private final String reason;

    /**
     * @param reason why the backend is unavailable, included in failures
     */
    public UnavailableListingStore(@Nonnull String reason) {
        this.reason = reason;
    }

    @Override
    public void put(@Nonnull RegistryEntry entry, @Nonnull Duration ttl) {
        throw unavailable();
    }

    @Override
    @Nonnull
    public List<Listing> getAll() {
        return List.of();
    }

    @Override
    @Nullable
    public Listing getByEndpoint(@Nonnull String ip, int port) {
        return null;
    }

    @Override
    @Nullable
    public Listing getByToken(@Nonnull String token) {
        return null;
    }

    @Override
    @Nonnull
    public Set<String> allKeys() {
        throw unavailable();
    }

    @Override
    @Nonnull
    public Set<String> knownKeys() {
        throw unavailable();
    }

    @Override
    public void replaceKnownKeys(@Nonnull Collection<String> keys) {
        throw unavailable();
    }

    @Override
    public void putMeta(@Nonnull ListingMeta meta) {
        throw unavailable();
    }

    @Override
    @Nullable
    public ListingMeta getMeta(@Nonnull EndpointKey endpoint) {
        return null;
    }

    @Override
    public void removeMeta(@Nonnull EndpointKey endpoint) {
        throw unavailable();
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public void shutdown() {
    }

    private RegistryUnavailableException unavailable() {
        return new RegistryUnavailableException("Listing registry unavailable: " + reason);
    }
}
