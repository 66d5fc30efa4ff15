package me.internalizable.waypoint.masterserver.registry;

import io.lettuce.core.KeyScanCursor;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.ScanArgs;
import io.lettuce.core.ScanCursor;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import me.internalizable.waypoint.api.masterserver.RegistryUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Redis backed listing store.
 *
 * <p>Each listing is one hash at {@code servers:<ip>:<port>} with a key
 * expiry. The presence tracker's key set lives in {@code ms:servers:known}
 * and listing meta in the {@code ms:servers:meta} hash, keyed by
 * {@code <ip>:<port>} with JSON values.</p>
 */
public class RedisListingStore implements ListingStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(RedisListingStore.class);

    static final String KNOWN_KEYS_KEY = "ms:servers:known";
    static final String KNOWN_KEYS_STAGING_KEY = "ms:servers:known:next";
    static final String META_KEY = "ms:servers:meta";
    static final String LISTING_PATTERN = EndpointKey.PREFIX + "*:*";

    private static final int SCAN_BATCH = 200;
    private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(2);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;

    private RedisListingStore(RedisClient client, StatefulRedisConnection<String, String> connection) {
        this.client = client;
        this.connection = connection;
    }

    /**
     * Connect to Redis.
     *
     * @param url redis URL
     * @param password password, empty for none
     * @return connected store
     * @throws RedisException if the connection cannot be established
     */
    @Nonnull
    public static RedisListingStore connect(@Nonnull String url, @Nullable String password) {
        Objects.requireNonNull(url, "url");

        RedisURI uri = RedisURI.create(url);
        if (password != null && !password.isEmpty()) {
            uri.setPassword(password.toCharArray());
        }
        uri.setTimeout(COMMAND_TIMEOUT);

        RedisClient client = RedisClient.create(uri);
        try {
            StatefulRedisConnection<String, String> connection = client.connect();
            connection.sync().ping();
            LOGGER.info("Connected to Redis at {}:{}", uri.getHost(), uri.getPort());
            return new RedisListingStore(client, connection);
        } catch (RedisException e) {
            client.shutdown();
            throw e;
        }
    }

    private RedisCommands<String, String> commands() {
        return connection.sync();
    }

    // ==================== Listings ====================

    @Override
    public void put(@Nonnull RegistryEntry entry, @Nonnull Duration ttl) {
        Objects.requireNonNull(entry, "entry");
        Objects.requireNonNull(ttl, "ttl");

        String key = entry.endpoint().toStorageKey();
        try {
            RedisCommands<String, String> commands = commands();
            commands.hset(key, ListingCodec.toHash(entry));
            commands.expire(key, Math.max(1L, ttl.getSeconds()));
        } catch (RedisException e) {
            throw new RegistryUnavailableException("Failed to store listing " + entry.endpoint(), e);
        }
    }

    @Override
    @Nonnull
    public List<Listing> getAll() {
        try {
            RedisCommands<String, String> commands = commands();
            List<Listing> listings = new ArrayList<>();
            for (String key : scanListingKeys()) {
                Listing listing = ListingCodec.fromHash(commands.hgetall(key));
                if (listing != null) {
                    listings.add(listing);
                }
            }
            return listings;
        } catch (RedisException e) {
            LOGGER.warn("Failed to read listings: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    @Nullable
    public Listing getByEndpoint(@Nonnull String ip, int port) {
        Objects.requireNonNull(ip, "ip");
        try {
            Map<String, String> hash = commands().hgetall(new EndpointKey(ip, port).toStorageKey());
            return hash == null || hash.isEmpty() ? null : ListingCodec.fromHash(hash);
        } catch (RedisException e) {
            LOGGER.warn("Failed to read listing {}:{}: {}", ip, port, e.getMessage());
            return null;
        }
    }

    @Override
    @Nullable
    public Listing getByToken(@Nonnull String token) {
        Objects.requireNonNull(token, "token");
        if (token.isEmpty()) {
            return null;
        }
        try {
            RedisCommands<String, String> commands = commands();
            for (String key : scanListingKeys()) {
                if (token.equals(commands.hget(key, ListingCodec.FIELD_TOKEN))) {
                    Map<String, String> hash = commands.hgetall(key);
                    return hash == null || hash.isEmpty() ? null : ListingCodec.fromHash(hash);
                }
            }
            return null;
        } catch (RedisException e) {
            LOGGER.warn("Failed to look up listing by token: {}", e.getMessage());
            return null;
        }
    }

    // ==================== Keys ====================

    @Override
    @Nonnull
    public Set<String> allKeys() {
        try {
            return scanListingKeys();
        } catch (RedisException e) {
            throw new RegistryUnavailableException("Failed to scan listing keys", e);
        }
    }

    private Set<String> scanListingKeys() {
        RedisCommands<String, String> commands = commands();
        ScanArgs args = ScanArgs.Builder.matches(LISTING_PATTERN).limit(SCAN_BATCH);

        Set<String> keys = new HashSet<>();
        KeyScanCursor<String> cursor = commands.scan(ScanCursor.INITIAL, args);
        keys.addAll(cursor.getKeys());
        while (!cursor.isFinished()) {
            cursor = commands.scan(cursor, args);
            keys.addAll(cursor.getKeys());
        }
        return keys;
    }

    @Override
    @Nonnull
    public Set<String> knownKeys() {
        try {
            Set<String> members = commands().smembers(KNOWN_KEYS_KEY);
            return members != null ? members : Set.of();
        } catch (RedisException e) {
            throw new RegistryUnavailableException("Failed to read known keys", e);
        }
    }

    /**
     * Stage the new set under a scratch key and rename it over the old one,
     * so readers see either the previous or the new set.
     */
    @Override
    public void replaceKnownKeys(@Nonnull Collection<String> keys) {
        Objects.requireNonNull(keys, "keys");
        try {
            RedisCommands<String, String> commands = commands();
            if (keys.isEmpty()) {
                commands.del(KNOWN_KEYS_KEY);
                return;
            }
            commands.del(KNOWN_KEYS_STAGING_KEY);
            commands.sadd(KNOWN_KEYS_STAGING_KEY, keys.toArray(new String[0]));
            commands.rename(KNOWN_KEYS_STAGING_KEY, KNOWN_KEYS_KEY);
        } catch (RedisException e) {
            throw new RegistryUnavailableException("Failed to replace known keys", e);
        }
    }

    // ==================== Meta ====================

    @Override
    public void putMeta(@Nonnull ListingMeta meta) {
        Objects.requireNonNull(meta, "meta");
        try {
            commands().hset(META_KEY, meta.endpoint().toString(), ListingCodec.metaToJson(meta));
        } catch (RedisException e) {
            throw new RegistryUnavailableException("Failed to store meta for " + meta.endpoint(), e);
        }
    }

    @Override
    @Nullable
    public ListingMeta getMeta(@Nonnull EndpointKey endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        try {
            return ListingCodec.metaFromJson(endpoint, commands().hget(META_KEY, endpoint.toString()));
        } catch (RedisException e) {
            LOGGER.warn("Failed to read meta for {}: {}", endpoint, e.getMessage());
            return null;
        }
    }

    @Override
    public void removeMeta(@Nonnull EndpointKey endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        try {
            commands().hdel(META_KEY, endpoint.toString());
        } catch (RedisException e) {
            throw new RegistryUnavailableException("Failed to remove meta for " + endpoint, e);
        }
    }

    // ==================== Lifecycle ====================

    @Override
    public boolean isAvailable() {
        if (!connection.isOpen()) {
            return false;
        }
        try {
            return "PONG".equalsIgnoreCase(commands().ping());
        } catch (RedisException e) {
            return false;
        }
    }

    @Override
    public void shutdown() {
        try {
            connection.close();
        } finally {
            client.shutdown();
        }
        LOGGER.info("Redis connection closed");
    }
}
