package me.internalizable.waypoint.masterserver.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process listing store.
 *
 * <p>Entries are kept in memory with a deadline taken from the supplied
 * clock. Expired entries are skipped by reads and purged lazily. Listings
 * are held in their string form so both backends round-trip through the
 * same codec.</p>
 */
public class InMemoryListingStore implements ListingStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryListingStore.class);

    private final Clock clock;
    private final Map<String, StoredEntry> entries = new ConcurrentHashMap<>();
    private final Map<EndpointKey, ListingMeta> meta = new ConcurrentHashMap<>();
    private volatile Set<String> knownKeys = Set.of();

    public InMemoryListingStore() {
        this(Clock.systemUTC());
    }

    /**
     * Create a store reading time from the given clock.
     *
     * @param clock clock used for expiry
     */
    public InMemoryListingStore(@Nonnull Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ==================== Listings ====================

    @Override
    public void put(@Nonnull RegistryEntry entry, @Nonnull Duration ttl) {
        Objects.requireNonNull(entry, "entry");
        Objects.requireNonNull(ttl, "ttl");

        Instant deadline = clock.instant().plus(ttl);
        entries.put(entry.endpoint().toStorageKey(), new StoredEntry(ListingCodec.toHash(entry), deadline));
        LOGGER.debug("Stored listing {} until {}", entry.endpoint(), deadline);
    }

    @Override
    @Nonnull
    public List<Listing> getAll() {
        List<Listing> listings = new ArrayList<>();
        for (String key : allKeys()) {
            Listing listing = read(key);
            if (listing != null) {
                listings.add(listing);
            }
        }
        return listings;
    }

    @Override
    @Nullable
    public Listing getByEndpoint(@Nonnull String ip, int port) {
        Objects.requireNonNull(ip, "ip");
        return read(new EndpointKey(ip, port).toStorageKey());
    }

    @Override
    @Nullable
    public Listing getByToken(@Nonnull String token) {
        Objects.requireNonNull(token, "token");
        if (token.isEmpty()) {
            return null;
        }
        return getAll().stream()
                .filter(listing -> token.equals(listing.token()))
                .findFirst()
                .orElse(null);
    }

    @Nullable
    private Listing read(String key) {
        StoredEntry stored = entries.get(key);
        if (stored == null) {
            return null;
        }
        if (stored.isExpired(clock.instant())) {
            entries.remove(key, stored);
            return null;
        }
        return ListingCodec.fromHash(stored.fields());
    }

    // ==================== Keys ====================

    @Override
    @Nonnull
    public Set<String> allKeys() {
        Instant now = clock.instant();
        Set<String> keys = new HashSet<>();
        entries.forEach((key, stored) -> {
            if (stored.isExpired(now)) {
                entries.remove(key, stored);
            } else {
                keys.add(key);
            }
        });
        return keys;
    }

    @Override
    @Nonnull
    public Set<String> knownKeys() {
        return knownKeys;
    }

    @Override
    public void replaceKnownKeys(@Nonnull Collection<String> keys) {
        Objects.requireNonNull(keys, "keys");
        knownKeys = Set.copyOf(keys);
    }

    // ==================== Meta ====================

    @Override
    public void putMeta(@Nonnull ListingMeta listingMeta) {
        Objects.requireNonNull(listingMeta, "listingMeta");
        meta.put(listingMeta.endpoint(), listingMeta);
    }

    @Override
    @Nullable
    public ListingMeta getMeta(@Nonnull EndpointKey endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        return meta.get(endpoint);
    }

    @Override
    public void removeMeta(@Nonnull EndpointKey endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        meta.remove(endpoint);
    }

    // ==================== Lifecycle ====================

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public void shutdown() {
        entries.clear();
        meta.clear();
        knownKeys = Set.of();
    }

    private record StoredEntry(Map<String, String> fields, Instant deadline) {
        boolean isExpired(Instant now) {
            return !now.isBefore(deadline);
        }
    }
}
