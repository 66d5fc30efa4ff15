package me.internalizable.waypoint.api.masterserver;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Builder implementation for registrations.
 */
public class RegistrationBuilder implements MasterServerAPI.Registration.Builder {

    private String name;
    private String description;
    private String map;
    private String version;
    private String playlist;
    private String key;
    private String ip;
    private int port;
    private int playerCount;
    private int maxPlayers;
    private long checksum;
    private boolean hidden;
    private String password;
    private String region;
    private final List<String> requiredMods = new ArrayList<>();
    private final List<ModInfo> enabledMods = new ArrayList<>();

    @Override
    public MasterServerAPI.Registration.Builder name(@Nullable String name) {
        this.name = name;
        return this;
    }

    @Override
    public MasterServerAPI.Registration.Builder description(@Nullable String description) {
        this.description = description;
        return this;
    }

    @Override
    public MasterServerAPI.Registration.Builder map(@Nullable String map) {
        this.map = map;
        return this;
    }

    @Override
    public MasterServerAPI.Registration.Builder version(@Nullable String version) {
        this.version = version;
        return this;
    }

    @Override
    public MasterServerAPI.Registration.Builder playlist(@Nullable String playlist) {
        this.playlist = playlist;
        return this;
    }

    @Override
    public MasterServerAPI.Registration.Builder key(@Nullable String key) {
        this.key = key;
        return this;
    }

    @Override
    public MasterServerAPI.Registration.Builder ip(@Nullable String ip) {
        this.ip = ip;
        return this;
    }

    @Override
    public MasterServerAPI.Registration.Builder port(int port) {
        this.port = port;
        return this;
    }

    @Override
    public MasterServerAPI.Registration.Builder playerCount(int playerCount) {
        this.playerCount = playerCount;
        return this;
    }

    @Override
    public MasterServerAPI.Registration.Builder maxPlayers(int maxPlayers) {
        this.maxPlayers = maxPlayers;
        return this;
    }

    @Override
    public MasterServerAPI.Registration.Builder checksum(long checksum) {
        this.checksum = checksum;
        return this;
    }

    @Override
    public MasterServerAPI.Registration.Builder hidden(boolean hidden) {
        this.hidden = hidden;
        return this;
    }

    @Override
    public MasterServerAPI.Registration.Builder password(@Nullable String password) {
        this.password = password;
        return this;
    }

    @Override
    public MasterServerAPI.Registration.Builder region(@Nullable String region) {
        this.region = region;
        return this;
    }

    @Override
    public MasterServerAPI.Registration.Builder requiredMods(@Nonnull List<String> requiredMods) {
        Objects.requireNonNull(requiredMods, "requiredMods");
        this.requiredMods.clear();
        this.requiredMods.addAll(requiredMods);
        return this;
    }

    @Override
    public MasterServerAPI.Registration.Builder enabledMods(@Nonnull List<ModInfo> enabledMods) {
        Objects.requireNonNull(enabledMods, "enabledMods");
        this.enabledMods.clear();
        this.enabledMods.addAll(enabledMods);
        return this;
    }

    @Override
    public MasterServerAPI.Registration build() {
        return new RegistrationImpl(name, description, map, version, playlist, key, ip, port,
                playerCount, maxPlayers, checksum, hidden, password, region,
                new ArrayList<>(requiredMods), new ArrayList<>(enabledMods));
    }

    private record RegistrationImpl(
            String name,
            String description,
            String map,
            String version,
            String playlist,
            String key,
            String ip,
            int port,
            int playerCount,
            int maxPlayers,
            long checksum,
            boolean hidden,
            String password,
            String region,
            List<String> requiredMods,
            List<ModInfo> enabledMods
    ) implements MasterServerAPI.Registration {

        @Override
        @Nullable
        public String getName() {
            return name;
        }

        @Override
        @Nullable
        public String getDescription() {
            return description;
        }

        @Override
        @Nullable
        public String getMap() {
            return map;
        }

        @Override
        @Nullable
        public String getVersion() {
            return version;
        }

        @Override
        @Nullable
        public String getPlaylist() {
            return playlist;
        }

        @Override
        @Nullable
        public String getKey() {
            return key;
        }

        @Override
        @Nullable
        public String getIp() {
            return ip;
        }

        @Override
        public int getPort() {
            return port;
        }

        @Override
        public int getPlayerCount() {
            return playerCount;
        }

        @Override
        public int getMaxPlayers() {
            return maxPlayers;
        }

        @Override
        public long getChecksum() {
            return checksum;
        }

        @Override
        public boolean isHidden() {
            return hidden;
        }

        @Override
        @Nullable
        public String getPassword() {
            return password;
        }

        @Override
        @Nullable
        public String getRegion() {
            return region;
        }

        @Override
        @Nonnull
        public List<String> getRequiredMods() {
            return Collections.unmodifiableList(requiredMods);
        }

        @Override
        @Nonnull
        public List<ModInfo> getEnabledMods() {
            return Collections.unmodifiableList(enabledMods);
        }
    }
}
