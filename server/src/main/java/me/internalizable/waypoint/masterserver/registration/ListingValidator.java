package me.internalizable.waypoint.masterserver.registration;

import me.internalizable.waypoint.api.masterserver.ListingValidationException;
import me.internalizable.waypoint.api.masterserver.MasterServerAPI;
import me.internalizable.waypoint.api.masterserver.ModInfo;
import me.internalizable.waypoint.masterserver.crypto.PacketCipher;
import me.internalizable.waypoint.masterserver.registry.EndpointKey;
import me.internalizable.waypoint.masterserver.registry.Listing;
import me.internalizable.waypoint.masterserver.registry.ModLists;
import me.internalizable.waypoint.masterserver.registry.RegistryEntry;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Checks a submitted registration and turns it into a registry entry.
 *
 * <p>Runs before any network I/O. The first failing rule is reported as a
 * {@link ListingValidationException} with a message fit for the caller.</p>
 */
public class ListingValidator {

    public static final int MAX_NAME_LENGTH = 256;
    public static final int MAX_DESCRIPTION_LENGTH = 256;
    public static final int MAX_MAP_LENGTH = 32;
    public static final int MIN_PLAYERS = 1;
    public static final int MAX_PLAYERS = 128;

    private static final List<Pattern> LINK_PATTERNS = List.of(
            Pattern.compile("(https?://|ftp://)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bwww\\.[^\\s]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bdiscord\\.(gg|com/invite)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}(?::\\d+)?\\b"),
            Pattern.compile("\\[[0-9a-f:]+\\]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?\\.(?:[a-z]{2,24})(?:\\b|/)", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern PLAYLIST_PATTERN = Pattern.compile("^[a-zA-Z0-9_]+$");

    private final ListingPolicy policy;

    public ListingValidator(@Nonnull ListingPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Validate a registration.
     *
     * @param registration submitted registration
     * @return the entry to store once the endpoint is verified, without a token
     * @throws ListingValidationException if a field is rejected
     */
    @Nonnull
    public RegistryEntry validate(@Nonnull MasterServerAPI.Registration registration) {
        Objects.requireNonNull(registration, "registration");

        String name = registration.getName();
        String map = registration.getMap();
        String version = registration.getVersion();
        String playlist = registration.getPlaylist();
        String key = registration.getKey();

        if (isEmpty(name) || isEmpty(map) || isEmpty(version) || isEmpty(playlist) || isEmpty(key)) {
            throw new ListingValidationException("Missing required fields.");
        }

        if (name.length() > MAX_NAME_LENGTH) {
            throw new ListingValidationException("Name must be between 1 and 256 characters.");
        }
        if (containsLink(name)) {
            throw new ListingValidationException("Server name cannot contain URLs or invite links.");
        }

        String description = registration.getDescription();
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new ListingValidationException("Description must be below 256 characters.");
        }
        if (map.length() > MAX_MAP_LENGTH) {
            throw new ListingValidationException("Map must be between 1 and 32 characters.");
        }

        int maxPlayers = registration.getMaxPlayers();
        if (maxPlayers < MIN_PLAYERS || maxPlayers > MAX_PLAYERS) {
            throw new ListingValidationException("Max players must be between 1 and 128 players.");
        }

        String ip = registration.getIp();
        if (isEmpty(ip)) {
            throw new ListingValidationException("Couldn't retrieve an IP address.");
        }

        int port = registration.getPort();
        if (port < 0 || port > 65535) {
            throw new ListingValidationException("Port must be in the range 0-65535");
        }
        if (!PLAYLIST_PATTERN.matcher(playlist).matches()) {
            throw new ListingValidationException("Playlist must be composed of latin letters, numbers, and underscores.");
        }
        if (!isValidKey(key)) {
            throw new ListingValidationException("Key must be a base64 encoded 128-bit key.");
        }

        if (!registration.isHidden() && !policy.isVersionSupported(version)) {
            throw new ListingValidationException("Please update to the latest version of the SDK to host a public server.");
        }
        long checksum = registration.getChecksum();
        if (policy.isChecksumEnforced(version) && !policy.isChecksumAccepted(version, checksum)) {
            throw new ListingValidationException("Your remote functions checksum does not match the server checksum.\n"
                    + "Checksum: " + checksum + "\nVersion: " + version);
        }

        List<ModInfo> enabledMods = ModLists.normalizeEnabled(registration.getEnabledMods());
        List<String> requiredMods = ModLists.resolveRequired(
                ModLists.normalizeRequired(registration.getRequiredMods()), enabledMods);

        Listing listing = new Listing(
                new EndpointKey(ip, port),
                name,
                description,
                map,
                playlist,
                Math.max(0, registration.getPlayerCount()),
                maxPlayers,
                registration.getPassword(),
                requiredMods,
                enabledMods,
                version,
                checksum,
                registration.getRegion(),
                registration.isHidden(),
                null
        );
        return new RegistryEntry(listing, key);
    }

    /**
     * Check a server name for URLs, invite links, IP literals and domain names.
     *
     * @param name server name
     * @return true if the name contains a link
     */
    public static boolean containsLink(@Nonnull String name) {
        for (Pattern pattern : LINK_PATTERNS) {
            if (pattern.matcher(name).find()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isValidKey(String key) {
        try {
            return Base64.getDecoder().decode(key).length == PacketCipher.KEY_LENGTH;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean isEmpty(@Nullable String value) {
        return value == null || value.isEmpty();
    }
}
