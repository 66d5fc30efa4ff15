package me.internalizable.waypoint.masterserver.registry;

import me.internalizable.waypoint.api.masterserver.ModInfo;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * A verified game server listing.
 *
 * <p>The password is kept for join checks and never republished. The shared
 * secret used for verification is not part of a listing; it only lives in
 * the {@link RegistryEntry}.</p>
 *
 * @param endpoint primary key
 * @param name display name
 * @param description free text description
 * @param map current map
 * @param playlist current playlist/mode
 * @param playerCount connected players
 * @param maxPlayers player capacity
 * @param password join password, empty when none
 * @param requiredMods ids of mods a client must have
 * @param enabledMods mods running on the server
 * @param version game version
 * @param checksum remote functions checksum
 * @param region two-letter region code
 * @param hidden true if excluded from public queries
 * @param token stable token of a hidden listing
 */
public record Listing(
        @Nonnull EndpointKey endpoint,
        @Nonnull String name,
        @Nonnull String description,
        @Nonnull String map,
        @Nonnull String playlist,
        int playerCount,
        int maxPlayers,
        @Nonnull String password,
        @Nonnull List<String> requiredMods,
        @Nonnull List<ModInfo> enabledMods,
        @Nonnull String version,
        long checksum,
        @Nonnull String region,
        boolean hidden,
        @Nullable String token
) {

    public static final String UNKNOWN_REGION = "XX";

    public Listing {
        Objects.requireNonNull(endpoint, "endpoint");
        name = Objects.requireNonNullElse(name, "");
        description = Objects.requireNonNullElse(description, "");
        map = Objects.requireNonNullElse(map, "");
        playlist = Objects.requireNonNullElse(playlist, "");
        password = Objects.requireNonNullElse(password, "");
        requiredMods = List.copyOf(Objects.requireNonNullElse(requiredMods, List.of()));
        enabledMods = List.copyOf(Objects.requireNonNullElse(enabledMods, List.of()));
        version = Objects.requireNonNullElse(version, "");
        region = region == null || region.isBlank() ? UNKNOWN_REGION : region;
        if (token != null && token.isEmpty()) {
            token = null;
        }
    }

    /**
     * Check if joining requires a password.
     *
     * @return true if a password is set
     */
    public boolean hasPassword() {
        return !password.isEmpty();
    }

    /**
     * Copy this listing with another token.
     *
     * @param newToken token, or null
     * @return updated listing
     */
    @Nonnull
    public Listing withToken(@Nullable String newToken) {
        return new Listing(endpoint, name, description, map, playlist, playerCount, maxPlayers, password,
                requiredMods, enabledMods, version, checksum, region, hidden, newToken);
    }
}
