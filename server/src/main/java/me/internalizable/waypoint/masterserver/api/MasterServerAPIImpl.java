package me.internalizable.waypoint.masterserver.api;

import me.internalizable.waypoint.api.masterserver.MasterServerAPI;
import me.internalizable.waypoint.api.masterserver.ModInfo;
import me.internalizable.waypoint.masterserver.registration.RegistrationHandler;
import me.internalizable.waypoint.masterserver.registry.Listing;
import me.internalizable.waypoint.masterserver.registry.ListingStore;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Implementation of the MasterServerAPI over the listing store.
 */
public class MasterServerAPIImpl implements MasterServerAPI {

    private static final Comparator<Listing> BUSIEST_FIRST =
            Comparator.comparingInt(Listing::playerCount).reversed();

    private final ListingStore store;
    private final RegistrationHandler registrationHandler;

    public MasterServerAPIImpl(@Nonnull ListingStore store, @Nonnull RegistrationHandler registrationHandler) {
        this.store = Objects.requireNonNull(store, "store");
        this.registrationHandler = Objects.requireNonNull(registrationHandler, "registrationHandler");
    }

    @Override
    @Nonnull
    public CompletableFuture<RegistrationOutcome> registerServer(@Nonnull Registration registration) {
        Objects.requireNonNull(registration, "registration");
        return registrationHandler.register(registration);
    }

    @Override
    @Nonnull
    public List<ServerInfo> listServers(@Nullable String version) {
        return store.getAll().stream()
                .filter(listing -> !listing.hidden())
                .filter(listing -> version == null || version.equals(listing.version()))
                .sorted(BUSIEST_FIRST)
                .map(MasterServerAPIImpl::toServerInfo)
                .collect(Collectors.toList());
    }

    @Override
    @Nonnull
    public List<ServerInfo> listAllServers() {
        return store.getAll().stream()
                .sorted(BUSIEST_FIRST)
                .map(MasterServerAPIImpl::toServerInfo)
                .collect(Collectors.toList());
    }

    @Override
    @Nullable
    public ServerInfo getServer(@Nonnull String ip, int port) {
        Objects.requireNonNull(ip, "ip");
        Listing listing = store.getByEndpoint(ip, port);
        return listing != null ? toServerInfo(listing) : null;
    }

    @Override
    @Nullable
    public ServerInfo findServerByToken(@Nonnull String token) {
        Objects.requireNonNull(token, "token");
        Listing listing = store.getByToken(token);
        return listing != null ? toServerInfo(listing) : null;
    }

    @Override
    @Nonnull
    public PasswordCheck verifyPassword(@Nonnull String ip, int port, @Nonnull String password) {
        Objects.requireNonNull(ip, "ip");
        Objects.requireNonNull(password, "password");

        Listing listing = store.getByEndpoint(ip, port);
        if (listing == null) {
            return PasswordCheck.NOT_FOUND;
        }
        if (!listing.hasPassword()) {
            return PasswordCheck.NOT_PROTECTED;
        }
        return listing.password().equals(password) ? PasswordCheck.ACCEPTED : PasswordCheck.INCORRECT;
    }

    @Override
    @Nonnull
    public MasterServerStats getStats() {
        int total = 0;
        int hidden = 0;
        int players = 0;

        for (Listing listing : store.getAll()) {
            total++;
            if (listing.hidden()) {
                hidden++;
            } else {
                players += listing.playerCount();
            }
        }

        return new MasterServerStatsImpl(total, total - hidden, hidden, players);
    }

    // ==================== Conversion ====================

    @Nonnull
    static ServerInfo toServerInfo(@Nonnull Listing listing) {
        return new ServerInfoImpl(listing);
    }

    private record ServerInfoImpl(Listing listing) implements ServerInfo {

        @Override
        @Nonnull
        public String getIp() {
            return listing.endpoint().ip();
        }

        @Override
        public int getPort() {
            return listing.endpoint().port();
        }

        @Override
        @Nonnull
        public String getName() {
            return listing.name();
        }

        @Override
        @Nonnull
        public String getDescription() {
            return listing.description();
        }

        @Override
        @Nonnull
        public String getMap() {
            return listing.map();
        }

        @Override
        @Nonnull
        public String getPlaylist() {
            return listing.playlist();
        }

        @Override
        public int getPlayerCount() {
            return listing.playerCount();
        }

        @Override
        public int getMaxPlayers() {
            return listing.maxPlayers();
        }

        @Override
        public boolean hasPassword() {
            return listing.hasPassword();
        }

        @Override
        @Nonnull
        public List<String> getRequiredMods() {
            return listing.requiredMods();
        }

        @Override
        @Nonnull
        public List<ModInfo> getEnabledMods() {
            return listing.enabledMods();
        }

        @Override
        @Nonnull
        public String getVersion() {
            return listing.version();
        }

        @Override
        public long getChecksum() {
            return listing.checksum();
        }

        @Override
        @Nonnull
        public String getRegion() {
            return listing.region();
        }

        @Override
        public boolean isHidden() {
            return listing.hidden();
        }

        @Override
        public String toString() {
            return "ServerInfo[" + listing.endpoint() + ", name=" + listing.name() + "]";
        }
    }

    private record MasterServerStatsImpl(
            int totalServers,
            int publicServers,
            int hiddenServers,
            int totalPlayers
    ) implements MasterServerStats {

        @Override
        public int getTotalServers() {
            return totalServers;
        }

        @Override
        public int getPublicServers() {
            return publicServers;
        }

        @Override
        public int getHiddenServers() {
            return hiddenServers;
        }

        @Override
        public int getTotalPlayers() {
            return totalPlayers;
        }
    }
}
