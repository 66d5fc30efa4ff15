package me.internalizable.waypoint.masterserver;

import io.lettuce.core.RedisException;
import me.internalizable.waypoint.api.masterserver.MasterServerAPI;
import me.internalizable.waypoint.masterserver.api.MasterServerAPIImpl;
import me.internalizable.waypoint.masterserver.config.MasterServerConfig;
import me.internalizable.waypoint.masterserver.http.MasterServerHttpApi;
import me.internalizable.waypoint.masterserver.presence.LoggingPresenceListener;
import me.internalizable.waypoint.masterserver.presence.PresenceListener;
import me.internalizable.waypoint.masterserver.presence.PresenceTracker;
import me.internalizable.waypoint.masterserver.registration.ConfiguredListingPolicy;
import me.internalizable.waypoint.masterserver.registration.ListingPolicy;
import me.internalizable.waypoint.masterserver.registration.ListingValidator;
import me.internalizable.waypoint.masterserver.registration.RegistrationHandler;
import me.internalizable.waypoint.masterserver.registry.InMemoryListingStore;
import me.internalizable.waypoint.masterserver.registry.ListingStore;
import me.internalizable.waypoint.masterserver.registry.RedisListingStore;
import me.internalizable.waypoint.masterserver.registry.UnavailableListingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Main orchestrator of the master server.
 *
 * <p>Wires the listing store, registration handler, presence tracker and
 * HTTP front end from a {@link MasterServerConfig}.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * MasterServer server = new MasterServer(MasterServerConfig.load(Path.of("config.yml")));
 * server.initialize();
 *
 * server.getApi().listServers(null).forEach(info -> System.out.println(info.getName()));
 *
 * server.shutdown();
 * }</pre>
 */
public class MasterServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(MasterServer.class);

    public static final String BACKEND_MEMORY = "memory";
    public static final String BACKEND_REDIS = "redis";

    private final MasterServerConfig config;
    private final PresenceListener presenceListener;

    private ListingStore store;
    private ListingPolicy policy;
    private RegistrationHandler registrationHandler;
    private MasterServerAPI api;
    private PresenceTracker presenceTracker;
    private MasterServerHttpApi httpApi;
    private ExecutorService receiveExecutor;

    private volatile boolean initialized = false;
    private volatile boolean shutdown = false;

    public MasterServer(@Nonnull MasterServerConfig config) {
        this(config, new LoggingPresenceListener());
    }

    /**
     * Create a master server.
     *
     * @param config configuration
     * @param presenceListener receiver of presence notifications
     */
    public MasterServer(@Nonnull MasterServerConfig config, @Nonnull PresenceListener presenceListener) {
        this.config = Objects.requireNonNull(config, "config");
        this.presenceListener = Objects.requireNonNull(presenceListener, "presenceListener");
    }

    // ==================== Initialization ====================

    /**
     * Initialize all components and start the schedules and HTTP listener.
     */
    public synchronized void initialize() {
        if (initialized) {
            throw new IllegalStateException("Master server already initialized");
        }

        LOGGER.info("Initializing master server...");

        store = createStore(config.getRegistry());
        policy = new ConfiguredListingPolicy(config.getPolicy());

        receiveExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "MasterServer-Verification");
            t.setDaemon(true);
            return t;
        });

        MasterServerConfig.VerificationConfig verification = config.getVerification();
        registrationHandler = new RegistrationHandler(
                store,
                new ListingValidator(policy),
                receiveExecutor,
                Duration.ofMillis(verification.getTimeoutMillis()),
                Duration.ofSeconds(config.getRegistry().getServerTtlSeconds()),
                verification.getChallengeUid()
        );
        api = new MasterServerAPIImpl(store, registrationHandler);

        presenceTracker = new PresenceTracker(store, presenceListener, config.getPresence());
        if (config.getPresence().isEnabled()) {
            presenceTracker.start();
        }

        MasterServerConfig.HttpConfig http = config.getHttp();
        if (http.isEnabled()) {
            httpApi = new MasterServerHttpApi(api, store, policy,
                    config.getApiKey() != null ? config.getApiKey() : "");
            httpApi.start(http.getHost(), http.getPort());
        }

        initialized = true;
        LOGGER.info("Master server initialized");
        LOGGER.info("  Registry: {} ({})", config.getRegistry().getBackend(),
                store.isAvailable() ? "available" : "unavailable");
        LOGGER.info("  Listing TTL: {}s, verification timeout: {}ms",
                config.getRegistry().getServerTtlSeconds(), verification.getTimeoutMillis());
    }

    private ListingStore createStore(MasterServerConfig.RegistryConfig registry) {
        String backend = registry.getBackend() != null ? registry.getBackend().toLowerCase() : BACKEND_REDIS;
        if (BACKEND_MEMORY.equals(backend)) {
            LOGGER.info("Using in-memory listing registry");
            return new InMemoryListingStore();
        }
        if (!BACKEND_REDIS.equals(backend)) {
            throw new IllegalArgumentException("Unknown registry backend: " + registry.getBackend());
        }

        try {
            return RedisListingStore.connect(registry.getRedisUrl(), registry.getRedisPassword());
        } catch (RedisException e) {
            LOGGER.error("Failed to connect to Redis at {}: {}", registry.getRedisUrl(), e.getMessage());
            return new UnavailableListingStore(e.getMessage() != null ? e.getMessage() : "connection failed");
        }
    }

    // ==================== Accessors ====================

    /**
     * Get the public API.
     *
     * @return master server API
     */
    @Nonnull
    public MasterServerAPI getApi() {
        checkInitialized();
        return api;
    }

    @Nonnull
    public ListingStore getStore() {
        checkInitialized();
        return store;
    }

    @Nonnull
    public PresenceTracker getPresenceTracker() {
        checkInitialized();
        return presenceTracker;
    }

    /**
     * Get the HTTP port actually bound.
     *
     * @return port, or -1 if HTTP is disabled
     */
    public int getHttpPort() {
        checkInitialized();
        return httpApi != null ? httpApi.getPort() : -1;
    }

    @Nonnull
    public MasterServerConfig getConfig() {
        return config;
    }

    // ==================== Lifecycle ====================

    public boolean isInitialized() {
        return initialized;
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Master server not initialized");
        }
    }

    /**
     * Stop all components and release their resources.
     */
    public synchronized void shutdown() {
        if (!initialized || shutdown) {
            return;
        }

        shutdown = true;
        LOGGER.info("Shutting down master server...");

        if (httpApi != null) {
            httpApi.stop();
        }
        presenceTracker.stop();

        receiveExecutor.shutdownNow();
        try {
            if (!receiveExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                LOGGER.warn("Verification threads did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        store.shutdown();
        LOGGER.info("Master server shut down");
    }
}
