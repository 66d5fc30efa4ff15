package me.internalizable.waypoint.masterserver.presence;

import me.internalizable.waypoint.masterserver.config.MasterServerConfig;
import me.internalizable.waypoint.masterserver.event.ServerOfflineEvent;
import me.internalizable.waypoint.masterserver.event.ServerOnlineEvent;
import me.internalizable.waypoint.masterserver.registry.EndpointKey;
import me.internalizable.waypoint.masterserver.registry.Listing;
import me.internalizable.waypoint.masterserver.registry.ListingMeta;
import me.internalizable.waypoint.masterserver.registry.ListingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Watches the registry for servers coming and going.
 *
 * <p>Runs three schedules: a key diff that emits online and offline events,
 * a public server/player count snapshot, and a rendered summary of the
 * public listings. Each runs once on {@link #start()} and then at a fixed
 * rate on its own thread.</p>
 *
 * <p>While running, listener calls are handed to notifier threads so a slow
 * listener never holds up a tick. Events keep their order on one thread;
 * snapshots go to another. Ticks driven directly before {@link #start()}
 * notify inline. A failing notification is logged and the diff carries on.
 * A failing store read skips the tick and keeps the previous known set.</p>
 */
public class PresenceTracker {

    private static final Logger LOGGER = LoggerFactory.getLogger(PresenceTracker.class);

    public static final int MIN_DIFF_INTERVAL_SECONDS = 5;

    private final ListingStore store;
    private final PresenceListener listener;
    private final MasterServerConfig.PresenceConfig config;

    private ScheduledExecutorService scheduler;
    private volatile ExecutorService eventNotifier;
    private volatile ExecutorService snapshotNotifier;
    private volatile boolean running = false;

    /**
     * Create a presence tracker.
     *
     * @param store listing store to watch
     * @param listener receiver of presence notifications
     * @param config presence intervals
     */
    public PresenceTracker(
            @Nonnull ListingStore store,
            @Nonnull PresenceListener listener,
            @Nonnull MasterServerConfig.PresenceConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Start the schedules. Does nothing if already running.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;

        eventNotifier = Executors.newSingleThreadExecutor(daemon("PresenceTracker-Events"));
        snapshotNotifier = Executors.newSingleThreadExecutor(daemon("PresenceTracker-Snapshots"));
        scheduler = Executors.newScheduledThreadPool(3, daemon("PresenceTracker-Scheduler"));

        long diffInterval = Math.max(MIN_DIFF_INTERVAL_SECONDS, config.getDiffIntervalSeconds());
        scheduler.scheduleAtFixedRate(this::tick, 0, diffInterval, TimeUnit.SECONDS);
        scheduler.scheduleAtFixedRate(this::countTick, 0,
                Math.max(1, config.getCountIntervalSeconds()), TimeUnit.SECONDS);
        scheduler.scheduleAtFixedRate(this::summaryTick, 0,
                Math.max(1, config.getSummaryIntervalSeconds()), TimeUnit.SECONDS);

        LOGGER.info("Presence tracker started (diff every {}s)", diffInterval);
    }

    /**
     * Stop the schedules.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        terminate(scheduler);
        terminate(eventNotifier);
        terminate(snapshotNotifier);
        eventNotifier = null;
        snapshotNotifier = null;
        LOGGER.info("Presence tracker stopped");
    }

    private static void terminate(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    public boolean isRunning() {
        return running;
    }

    // ==================== Ticks ====================

    /**
     * Diff the registry against the known key set and emit events.
     *
     * <p>Listener failures do not stop the diff; the known set is replaced
     * whenever the store calls succeed.</p>
     *
     * @return true if the tick completed and the known set was replaced
     */
    public boolean tick() {
        try {
            Set<String> current = store.allKeys();
            Set<String> previous = store.knownKeys();

            Set<String> added = new HashSet<>(current);
            added.removeAll(previous);
            Set<String> removed = new HashSet<>(previous);
            removed.removeAll(current);

            for (String key : added) {
                handleAdded(key);
            }
            for (String key : removed) {
                handleRemoved(key);
            }

            store.replaceKnownKeys(current);
            if (!added.isEmpty() || !removed.isEmpty()) {
                LOGGER.debug("Presence diff: {} added, {} removed, {} online", added.size(), removed.size(), current.size());
            }
            return true;
        } catch (RuntimeException e) {
            LOGGER.warn("Presence tick failed, keeping previous state: {}", e.getMessage());
            return false;
        }
    }

    private void handleAdded(String key) {
        EndpointKey endpoint = EndpointKey.parse(key);
        if (endpoint == null) {
            LOGGER.debug("Skipping malformed listing key {}", key);
            return;
        }

        Listing listing = store.getByEndpoint(endpoint.ip(), endpoint.port());
        if (listing != null && !listing.name().isEmpty()) {
            store.putMeta(ListingMeta.of(listing));
        }
        ServerOnlineEvent event = new ServerOnlineEvent(endpoint, listing);
        dispatch(eventNotifier, "online " + endpoint, () -> listener.onServerOnline(event));
    }

    private void handleRemoved(String key) {
        EndpointKey endpoint = EndpointKey.parse(key);
        if (endpoint == null) {
            LOGGER.debug("Skipping malformed listing key {}", key);
            return;
        }

        ListingMeta meta = store.getMeta(endpoint);
        ServerOfflineEvent event = new ServerOfflineEvent(endpoint, meta);
        dispatch(eventNotifier, "offline " + endpoint, () -> listener.onServerOffline(event));
        store.removeMeta(endpoint);
    }

    /**
     * Report public server and player totals.
     */
    public void countTick() {
        try {
            List<Listing> listings = publicListings();
            int players = listings.stream().mapToInt(Listing::playerCount).sum();
            int servers = listings.size();
            dispatch(snapshotNotifier, "count snapshot", () -> listener.onCountSnapshot(servers, players));
        } catch (RuntimeException e) {
            LOGGER.warn("Count snapshot failed: {}", e.getMessage());
        }
    }

    /**
     * Render and report the public listing summary.
     */
    public void summaryTick() {
        try {
            String summary = ListingSummaryRenderer.render(publicListings());
            dispatch(snapshotNotifier, "listing summary", () -> listener.onListingSummary(summary));
        } catch (RuntimeException e) {
            LOGGER.warn("Listing summary failed: {}", e.getMessage());
        }
    }

    private void dispatch(@Nullable ExecutorService notifier, String what, Runnable call) {
        Runnable guarded = () -> {
            try {
                call.run();
            } catch (RuntimeException e) {
                LOGGER.warn("Presence listener failed on {}", what, e);
            }
        };

        if (notifier == null) {
            guarded.run();
            return;
        }
        try {
            notifier.execute(guarded);
        } catch (RejectedExecutionException e) {
            LOGGER.debug("Dropping {} notification, tracker stopped", what);
        }
    }

    private List<Listing> publicListings() {
        return store.getAll().stream()
                .filter(listing -> !listing.hidden())
                .sorted(Comparator.comparingInt(Listing::playerCount).reversed())
                .collect(Collectors.toList());
    }
}
