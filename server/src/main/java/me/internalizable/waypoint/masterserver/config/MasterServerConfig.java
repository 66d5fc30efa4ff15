package me.internalizable.waypoint.masterserver.config;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.nodes.Tag;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the master server.
 *
 * <p>Loaded from {@code config.yml} and defines the HTTP listener, the
 * listing registry backend, verification and presence timings, and the
 * version policy.</p>
 */
public class MasterServerConfig {

    private HttpConfig http = new HttpConfig();
    private RegistryConfig registry = new RegistryConfig();
    private VerificationConfig verification = new VerificationConfig();
    private PresenceConfig presence = new PresenceConfig();
    private PolicyConfig policy = new PolicyConfig();
    private String apiKey = "";

    /**
     * Load configuration from file, creating default if not exists.
     *
     * @param path path to config file
     * @return loaded configuration
     * @throws IOException if loading fails
     */
    @Nonnull
    public static MasterServerConfig load(@Nonnull Path path) throws IOException {
        if (!Files.exists(path)) {
            MasterServerConfig config = new MasterServerConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(MasterServerConfig.class, options));
        try (InputStream is = Files.newInputStream(path)) {
            MasterServerConfig config = yaml.load(is);
            return config != null ? config : new MasterServerConfig();
        }
    }

    /**
     * Save configuration to file.
     *
     * @param path path to save to
     * @throws IOException if saving fails
     */
    public void save(@Nonnull Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Yaml yaml = new Yaml();
        try (Writer writer = Files.newBufferedWriter(path)) {
            // plain map root so the file loads back without a global class tag
            writer.write(yaml.dumpAs(this, Tag.MAP, DumperOptions.FlowStyle.BLOCK));
        }
    }

    // Getters and Setters

    public HttpConfig getHttp() {
        return http;
    }

    public void setHttp(HttpConfig http) {
        this.http = http;
    }

    public RegistryConfig getRegistry() {
        return registry;
    }

    public void setRegistry(RegistryConfig registry) {
        this.registry = registry;
    }

    public VerificationConfig getVerification() {
        return verification;
    }

    public void setVerification(VerificationConfig verification) {
        this.verification = verification;
    }

    public PresenceConfig getPresence() {
        return presence;
    }

    public void setPresence(PresenceConfig presence) {
        this.presence = presence;
    }

    public PolicyConfig getPolicy() {
        return policy;
    }

    public void setPolicy(PolicyConfig policy) {
        this.policy = policy;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    /**
     * Configuration for the HTTP listener.
     */
    public static class HttpConfig {
        private boolean enabled = true;
        private String host = "0.0.0.0";
        private int port = 8080;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }
    }

    /**
     * Configuration for the listing registry.
     */
    public static class RegistryConfig {
        private String backend = "redis";
        private String redisUrl = "redis://localhost:6379";
        private String redisPassword = "";
        private int serverTtlSeconds = 30;

        /**
         * Get the backend name, {@code redis} or {@code memory}.
         */
        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public String getRedisUrl() {
            return redisUrl;
        }

        public void setRedisUrl(String redisUrl) {
            this.redisUrl = redisUrl;
        }

        public String getRedisPassword() {
            return redisPassword;
        }

        public void setRedisPassword(String redisPassword) {
            this.redisPassword = redisPassword;
        }

        public int getServerTtlSeconds() {
            return serverTtlSeconds;
        }

        public void setServerTtlSeconds(int serverTtlSeconds) {
            this.serverTtlSeconds = serverTtlSeconds;
        }
    }

    /**
     * Configuration for endpoint verification.
     */
    public static class VerificationConfig {
        private int timeoutMillis = 800;
        private long challengeUid = 1000000001337L;

        public int getTimeoutMillis() {
            return timeoutMillis;
        }

        public void setTimeoutMillis(int timeoutMillis) {
            this.timeoutMillis = timeoutMillis;
        }

        /**
         * Get the 64-bit identifier sent in every challenge.
         */
        public long getChallengeUid() {
            return challengeUid;
        }

        public void setChallengeUid(long challengeUid) {
            this.challengeUid = challengeUid;
        }
    }

    /**
     * Configuration for the presence tracker.
     */
    public static class PresenceConfig {
        private boolean enabled = true;
        private int diffIntervalSeconds = 15;
        private int countIntervalSeconds = 600;
        private int summaryIntervalSeconds = 300;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getDiffIntervalSeconds() {
            return diffIntervalSeconds;
        }

        public void setDiffIntervalSeconds(int diffIntervalSeconds) {
            this.diffIntervalSeconds = diffIntervalSeconds;
        }

        public int getCountIntervalSeconds() {
            return countIntervalSeconds;
        }

        public void setCountIntervalSeconds(int countIntervalSeconds) {
            this.countIntervalSeconds = countIntervalSeconds;
        }

        public int getSummaryIntervalSeconds() {
            return summaryIntervalSeconds;
        }

        public void setSummaryIntervalSeconds(int summaryIntervalSeconds) {
            this.summaryIntervalSeconds = summaryIntervalSeconds;
        }
    }

    /**
     * Version and checksum policy.
     *
     * <p>An empty supported-version list accepts every version.</p>
     */
    public static class PolicyConfig {
        private List<String> supportedVersions = new ArrayList<>();
        private List<String> realTypeVersions = new ArrayList<>();
        private List<String> checksumEnforcedVersions = new ArrayList<>();
        private Map<String, List<Long>> acceptedChecksums = new HashMap<>();
        private String updateUrl = "discord.gg/GcJSMUGJyD";

        public List<String> getSupportedVersions() {
            return supportedVersions;
        }

        public void setSupportedVersions(List<String> supportedVersions) {
            this.supportedVersions = supportedVersions;
        }

        public List<String> getRealTypeVersions() {
            return realTypeVersions;
        }

        public void setRealTypeVersions(List<String> realTypeVersions) {
            this.realTypeVersions = realTypeVersions;
        }

        public List<String> getChecksumEnforcedVersions() {
            return checksumEnforcedVersions;
        }

        public void setChecksumEnforcedVersions(List<String> checksumEnforcedVersions) {
            this.checksumEnforcedVersions = checksumEnforcedVersions;
        }

        public Map<String, List<Long>> getAcceptedChecksums() {
            return acceptedChecksums;
        }

        public void setAcceptedChecksums(Map<String, List<Long>> acceptedChecksums) {
            this.acceptedChecksums = acceptedChecksums;
        }

        /**
         * Get where players of unsupported versions find the new one.
         */
        public String getUpdateUrl() {
            return updateUrl;
        }

        public void setUpdateUrl(String updateUrl) {
            this.updateUrl = updateUrl;
        }
    }
}
