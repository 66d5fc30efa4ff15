package me.internalizable.waypoint.masterserver.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.internalizable.waypoint.api.masterserver.ModInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts listings to and from the string-typed registry representation.
 *
 * <p>Listings are stored as flat string hashes; the mod lists are embedded
 * as JSON arrays. This is the only place where that representation is
 * produced or parsed. {@link #toView(Listing, boolean)} renders the public
 * form handed to clients, either with native types or with every value as
 * a string for older clients.</p>
 */
public final class ListingCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(ListingCodec.class);

    public static final int DEFAULT_PORT = 37015;

    static final String FIELD_IP = "ip";
    static final String FIELD_PORT = "port";
    static final String FIELD_NAME = "name";
    static final String FIELD_DESCRIPTION = "description";
    static final String FIELD_MAP = "map";
    static final String FIELD_PLAYLIST = "playlist";
    static final String FIELD_KEY = "key";
    static final String FIELD_HIDDEN = "hidden";
    static final String FIELD_NUM_PLAYERS = "numPlayers";
    static final String FIELD_PLAYER_COUNT = "playerCount";
    static final String FIELD_MAX_PLAYERS = "maxPlayers";
    static final String FIELD_VERSION = "version";
    static final String FIELD_CHECKSUM = "checksum";
    static final String FIELD_REGION = "region";
    static final String FIELD_TOKEN = "token";
    static final String FIELD_HAS_PASSWORD = "hasPassword";
    static final String FIELD_PASSWORD = "password";
    static final String FIELD_REQUIRED_MODS = "requiredMods";
    static final String FIELD_ENABLED_MODS = "enabledMods";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ListingCodec() {
    }

    // ==================== Storage Form ====================

    /**
     * Encode an entry as a string hash.
     *
     * <p>Every field is always written, so overwriting a previous entry never
     * leaves stale values behind.</p>
     *
     * @param entry entry to encode
     * @return field map
     */
    @Nonnull
    public static Map<String, String> toHash(@Nonnull RegistryEntry entry) {
        Objects.requireNonNull(entry, "entry");
        Listing listing = entry.listing();

        Map<String, String> hash = new LinkedHashMap<>();
        hash.put(FIELD_IP, listing.endpoint().ip());
        hash.put(FIELD_PORT, Integer.toString(listing.endpoint().port()));
        hash.put(FIELD_NAME, listing.name());
        hash.put(FIELD_DESCRIPTION, listing.description());
        hash.put(FIELD_MAP, listing.map());
        hash.put(FIELD_PLAYLIST, listing.playlist());
        hash.put(FIELD_KEY, entry.secret());
        hash.put(FIELD_HIDDEN, Boolean.toString(listing.hidden()));
        hash.put(FIELD_NUM_PLAYERS, Integer.toString(listing.playerCount()));
        hash.put(FIELD_PLAYER_COUNT, Integer.toString(listing.playerCount()));
        hash.put(FIELD_MAX_PLAYERS, Integer.toString(listing.maxPlayers()));
        hash.put(FIELD_VERSION, listing.version());
        hash.put(FIELD_CHECKSUM, Long.toString(listing.checksum()));
        hash.put(FIELD_REGION, listing.region());
        hash.put(FIELD_TOKEN, listing.token() != null ? listing.token() : "");
        hash.put(FIELD_HAS_PASSWORD, Boolean.toString(listing.hasPassword()));
        hash.put(FIELD_PASSWORD, listing.password());
        hash.put(FIELD_REQUIRED_MODS, writeJson(listing.requiredMods()));
        hash.put(FIELD_ENABLED_MODS, writeJson(modsToMaps(listing.enabledMods())));
        return hash;
    }

    /**
     * Decode a listing from a string hash.
     *
     * @param hash stored fields
     * @return the listing, or null if the hash does not describe one
     */
    @Nullable
    public static Listing fromHash(@Nonnull Map<String, String> hash) {
        Objects.requireNonNull(hash, "hash");
        String ip = hash.get(FIELD_IP);
        if (ip == null || ip.isEmpty()) {
            return null;
        }

        int port = parseInt(hash.get(FIELD_PORT), DEFAULT_PORT);
        int playerCount = parseInt(hash.getOrDefault(FIELD_PLAYER_COUNT, hash.get(FIELD_NUM_PLAYERS)), 0);

        return new Listing(
                new EndpointKey(ip, port),
                hash.get(FIELD_NAME),
                hash.get(FIELD_DESCRIPTION),
                hash.get(FIELD_MAP),
                hash.get(FIELD_PLAYLIST),
                playerCount,
                parseInt(hash.get(FIELD_MAX_PLAYERS), 0),
                hash.get(FIELD_PASSWORD),
                readRequiredMods(hash.get(FIELD_REQUIRED_MODS)),
                readEnabledMods(hash.get(FIELD_ENABLED_MODS)),
                hash.get(FIELD_VERSION),
                parseLong(hash.get(FIELD_CHECKSUM), 0L),
                hash.get(FIELD_REGION),
                Boolean.parseBoolean(hash.get(FIELD_HIDDEN)),
                hash.get(FIELD_TOKEN)
        );
    }

    /**
     * Read the shared secret from a string hash.
     *
     * @param hash stored fields
     * @return the secret, or null if absent
     */
    @Nullable
    public static String secretOf(@Nonnull Map<String, String> hash) {
        String key = hash.get(FIELD_KEY);
        return key == null || key.isEmpty() ? null : key;
    }

    // ==================== Public Form ====================

    /**
     * Render a listing as handed to clients.
     *
     * <p>Never contains the password, the shared secret or the token.</p>
     *
     * @param listing listing to render
     * @param typed true for native value types, false for string values
     * @return ordered field map
     */
    @Nonnull
    public static Map<String, Object> toView(@Nonnull Listing listing, boolean typed) {
        Objects.requireNonNull(listing, "listing");

        Map<String, Object> view = new LinkedHashMap<>();
        view.put(FIELD_NAME, listing.name());
        view.put(FIELD_DESCRIPTION, listing.description());
        view.put(FIELD_MAP, listing.map());
        view.put(FIELD_PLAYLIST, listing.playlist());
        view.put(FIELD_IP, listing.endpoint().ip());
        view.put(FIELD_PORT, value(listing.endpoint().port(), typed));
        view.put(FIELD_HIDDEN, value(listing.hidden(), typed));
        view.put(FIELD_NUM_PLAYERS, value(listing.playerCount(), typed));
        view.put(FIELD_PLAYER_COUNT, value(listing.playerCount(), typed));
        view.put(FIELD_MAX_PLAYERS, value(listing.maxPlayers(), typed));
        view.put(FIELD_VERSION, listing.version());
        view.put(FIELD_CHECKSUM, value(listing.checksum(), typed));
        view.put(FIELD_REGION, listing.region());
        view.put(FIELD_HAS_PASSWORD, value(listing.hasPassword(), typed));

        List<Map<String, String>> mods = modsToMaps(listing.enabledMods());
        view.put(FIELD_REQUIRED_MODS, typed ? listing.requiredMods() : writeJson(listing.requiredMods()));
        view.put(FIELD_ENABLED_MODS, typed ? mods : writeJson(mods));
        return view;
    }

    private static Object value(Object value, boolean typed) {
        return typed ? value : String.valueOf(value);
    }

    // ==================== Meta ====================

    /**
     * Encode listing meta as JSON.
     *
     * @param meta meta to encode
     * @return JSON document
     */
    @Nonnull
    public static String metaToJson(@Nonnull ListingMeta meta) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(FIELD_NAME, meta.name());
        fields.put(FIELD_MAP, meta.map());
        fields.put(FIELD_PLAYLIST, meta.playlist());
        fields.put(FIELD_REQUIRED_MODS, meta.requiredMods());
        return writeJson(fields);
    }

    /**
     * Decode listing meta from JSON.
     *
     * @param endpoint endpoint the meta belongs to
     * @param json stored JSON document
     * @return the meta, or null if malformed
     */
    @Nullable
    public static ListingMeta metaFromJson(@Nonnull EndpointKey endpoint, @Nullable String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            Map<String, Object> fields = MAPPER.readValue(json, new TypeReference<Map<String, Object>>() {});
            List<String> requiredMods = new ArrayList<>();
            if (fields.get(FIELD_REQUIRED_MODS) instanceof List<?> list) {
                for (Object mod : list) {
                    if (mod instanceof String id) {
                        requiredMods.add(id);
                    }
                }
            }
            return new ListingMeta(endpoint, asString(fields.get(FIELD_NAME)), asString(fields.get(FIELD_MAP)),
                    asString(fields.get(FIELD_PLAYLIST)), requiredMods);
        } catch (JsonProcessingException e) {
            LOGGER.debug("Ignoring malformed meta for {}: {}", endpoint, e.getMessage());
            return null;
        }
    }

    // ==================== Mod Lists ====================

    /**
     * Parse a JSON array of mod ids, ignoring malformed input.
     *
     * @param json JSON array
     * @return normalised ids
     */
    @Nonnull
    public static List<String> readRequiredMods(@Nullable String json) {
        List<String> ids = new ArrayList<>();
        for (Object element : readArray(json)) {
            if (element instanceof String id) {
                ids.add(id);
            }
        }
        return ModLists.normalizeRequired(ids);
    }

    /**
     * Parse a JSON array of mod objects, ignoring malformed input.
     *
     * @param json JSON array
     * @return normalised mods
     */
    @Nonnull
    public static List<ModInfo> readEnabledMods(@Nullable String json) {
        List<ModInfo> mods = new ArrayList<>();
        for (Object element : readArray(json)) {
            if (element instanceof Map<?, ?> fields) {
                mods.add(modFromMap(fields));
            }
        }
        return ModLists.normalizeEnabled(mods);
    }

    /**
     * Build a mod from loosely typed fields.
     *
     * @param fields mod fields, non-string values are treated as empty
     * @return the mod
     */
    @Nonnull
    public static ModInfo modFromMap(@Nonnull Map<?, ?> fields) {
        return new ModInfo(
                asString(fields.get("id")),
                asString(fields.get("name")),
                asString(fields.get("author")),
                asString(fields.get("version")),
                asString(fields.get("thunderstore_id")),
                asString(fields.get("description"))
        );
    }

    private static List<Map<String, String>> modsToMaps(List<ModInfo> mods) {
        List<Map<String, String>> maps = new ArrayList<>();
        for (ModInfo mod : mods) {
            Map<String, String> fields = new LinkedHashMap<>();
            fields.put("id", mod.id());
            fields.put("name", mod.name());
            fields.put("author", mod.author());
            fields.put("version", mod.version());
            fields.put("thunderstore_id", mod.thunderstoreId());
            fields.put("description", mod.description());
            maps.add(fields);
        }
        return maps;
    }

    private static List<Object> readArray(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<Object> parsed = MAPPER.readValue(json, new TypeReference<List<Object>>() {});
            return parsed != null ? parsed : List.of();
        } catch (JsonProcessingException e) {
            LOGGER.debug("Ignoring malformed mod list: {}", e.getMessage());
            return List.of();
        }
    }

    private static String writeJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize listing value", e);
        }
    }

    private static String asString(Object value) {
        return value instanceof String s ? s : "";
    }

    private static int parseInt(String value, int fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static long parseLong(String value, long fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
