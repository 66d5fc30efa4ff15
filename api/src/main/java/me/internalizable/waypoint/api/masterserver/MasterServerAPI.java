package me.internalizable.waypoint.api.masterserver;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * API for the game server master list.
 *
 * <p>Game server processes register themselves through this API; the master
 * server verifies that the declared endpoint answers an encrypted challenge
 * before the listing becomes visible. Listings expire unless re-registered.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * MasterServerAPI api = masterServer.getApi();
 *
 * api.registerServer(Registration.builder()
 *     .name("My Server")
 *     .map("mp_rr_canyonlands")
 *     .playlist("survival")
 *     .version("v2.6")
 *     .ip("203.0.113.7")
 *     .port(37015)
 *     .key(base64Key)
 *     .maxPlayers(32)
 *     .build())
 *     .thenAccept(outcome -> System.out.println("Listed at " + outcome.getPort()));
 * }</pre>
 */
public interface MasterServerAPI {

    /**
     * Register or refresh a server listing.
     *
     * <p>The returned future fails with {@link ListingValidationException} when a
     * field is rejected, with {@link VerificationTimeoutException} when the
     * endpoint did not answer the challenge in time, and with
     * {@link RegistrationException} for any other failure.</p>
     *
     * @param registration the listing to register
     * @return future completing with the registration outcome
     */
    @Nonnull
    CompletableFuture<RegistrationOutcome> registerServer(@Nonnull Registration registration);

    /**
     * List the currently registered public servers.
     *
     * @param version only return servers running this version, or null for all
     * @return servers sorted by player count, busiest first
     */
    @Nonnull
    List<ServerInfo> listServers(@Nullable String version);

    /**
     * List every registered server, hidden ones included.
     *
     * @return servers sorted by player count, busiest first
     */
    @Nonnull
    List<ServerInfo> listAllServers();

    /**
     * Get a server by endpoint.
     *
     * @param ip server address
     * @param port server port
     * @return server info, or null if not registered
     */
    @Nullable
    ServerInfo getServer(@Nonnull String ip, int port);

    /**
     * Find a server by the token handed out when it registered as hidden.
     *
     * @param token stable listing token
     * @return server info, or null if not found
     */
    @Nullable
    ServerInfo findServerByToken(@Nonnull String token);

    /**
     * Check a join password against a registered server.
     *
     * @param ip server address
     * @param port server port
     * @param password candidate password
     * @return the check result
     */
    @Nonnull
    PasswordCheck verifyPassword(@Nonnull String ip, int port, @Nonnull String password);

    /**
     * Get master server statistics.
     *
     * @return statistics
     */
    @Nonnull
    MasterServerStats getStats();

    /**
     * Server information as republished to clients.
     *
     * <p>Never carries the join password or the verification key.</p>
     */
    interface ServerInfo {
        @Nonnull
        String getIp();

        int getPort();

        @Nonnull
        String getName();

        @Nonnull
        String getDescription();

        @Nonnull
        String getMap();

        @Nonnull
        String getPlaylist();

        int getPlayerCount();

        int getMaxPlayers();

        boolean hasPassword();

        @Nonnull
        List<String> getRequiredMods();

        @Nonnull
        List<ModInfo> getEnabledMods();

        @Nonnull
        String getVersion();

        long getChecksum();

        /**
         * Get the two-letter region code, {@code XX} when unknown.
         */
        @Nonnull
        String getRegion();

        boolean isHidden();
    }

    /**
     * A listing submitted for registration.
     */
    interface Registration {
        @Nullable
        String getName();

        @Nullable
        String getDescription();

        @Nullable
        String getMap();

        @Nullable
        String getVersion();

        @Nullable
        String getPlaylist();

        /**
         * Get the base64 encoded 128-bit key used to verify the endpoint.
         */
        @Nullable
        String getKey();

        /**
         * Get the public address the request came from.
         */
        @Nullable
        String getIp();

        int getPort();

        int getPlayerCount();

        int getMaxPlayers();

        long getChecksum();

        boolean isHidden();

        @Nullable
        String getPassword();

        @Nullable
        String getRegion();

        @Nonnull
        List<String> getRequiredMods();

        @Nonnull
        List<ModInfo> getEnabledMods();

        /**
         * Create a builder for a registration.
         */
        @Nonnull
        static Builder builder() {
            return new RegistrationBuilder();
        }

        /**
         * Builder for registrations.
         */
        interface Builder {
            Builder name(@Nullable String name);
            Builder description(@Nullable String description);
            Builder map(@Nullable String map);
            Builder version(@Nullable String version);
            Builder playlist(@Nullable String playlist);
            Builder key(@Nullable String key);
            Builder ip(@Nullable String ip);
            Builder port(int port);
            Builder playerCount(int playerCount);
            Builder maxPlayers(int maxPlayers);
            Builder checksum(long checksum);
            Builder hidden(boolean hidden);
            Builder password(@Nullable String password);
            Builder region(@Nullable String region);
            Builder requiredMods(@Nonnull List<String> requiredMods);
            Builder enabledMods(@Nonnull List<ModInfo> enabledMods);
            Registration build();
        }
    }

    /**
     * Result of a successful registration.
     */
    interface RegistrationOutcome {
        /**
         * Get the stable token of a hidden listing.
         *
         * @return token, or null for public listings
         */
        @Nullable
        String getToken();

        @Nonnull
        String getIp();

        int getPort();
    }

    /**
     * Result of a password check.
     */
    enum PasswordCheck {
        ACCEPTED,
        INCORRECT,
        NOT_PROTECTED,
        NOT_FOUND
    }

    /**
     * Master server statistics.
     */
    interface MasterServerStats {
        int getTotalServers();
        int getPublicServers();
        int getHiddenServers();
        int getTotalPlayers();
    }
}
