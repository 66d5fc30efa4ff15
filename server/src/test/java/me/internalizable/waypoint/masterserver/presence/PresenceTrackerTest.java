package me.internalizable.waypoint.masterserver.presence;

import me.internalizable.waypoint.api.masterserver.RegistryUnavailableException;
import me.internalizable.waypoint.masterserver.config.MasterServerConfig;
import me.internalizable.waypoint.masterserver.event.ServerOnlineEvent;
import me.internalizable.waypoint.masterserver.registry.EndpointKey;
import me.internalizable.waypoint.masterserver.registry.InMemoryListingStore;
import me.internalizable.waypoint.masterserver.registry.MutableClock;
import me.internalizable.waypoint.masterserver.registry.TestListings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class PresenceTrackerTest {

    private static final Duration TTL = Duration.ofSeconds(30);

    private MutableClock clock;
    private InMemoryListingStore store;
    private RecordingPresenceListener listener;
    private PresenceTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        store = new InMemoryListingStore(clock);
        listener = new RecordingPresenceListener();
        tracker = new PresenceTracker(store, listener, new MasterServerConfig.PresenceConfig());
    }

    private void register(String name, int port, int players, boolean hidden) {
        store.put(TestListings.entry(TestListings.listing("10.0.0.1", port, name, players, hidden)), TTL);
    }

    @Test
    void diffEmitsAddedAndRemoved() {
        register("a", 1, 0, false);
        register("b", 2, 0, false);
        assertTrue(tracker.tick());
        assertEquals(2, listener.online.size());

        listener.clear();
        clock.advance(TTL);
        register("b", 2, 0, false);
        register("c", 3, 0, false);
        assertTrue(tracker.tick());

        assertEquals(1, listener.online.size());
        assertEquals("c", listener.online.get(0).getName());
        assertEquals(1, listener.offline.size());
        assertEquals(new EndpointKey("10.0.0.1", 1), listener.offline.get(0).getEndpoint());
        assertEquals("a", listener.offline.get(0).getName());
        assertEquals(Set.of("servers:10.0.0.1:2", "servers:10.0.0.1:3"), store.knownKeys());
    }

    @Test
    void unchangedRegistryEmitsNothing() {
        register("a", 1, 0, false);
        tracker.tick();
        listener.clear();

        tracker.tick();

        assertTrue(listener.online.isEmpty());
        assertTrue(listener.offline.isEmpty());
    }

    @Test
    void metaIsCachedWhileOnlineAndDroppedAfterOffline() {
        register("a", 1, 0, false);
        tracker.tick();
        EndpointKey endpoint = new EndpointKey("10.0.0.1", 1);
        assertNotNull(store.getMeta(endpoint));

        clock.advance(TTL);
        tracker.tick();

        assertNull(store.getMeta(endpoint));
        assertNotNull(listener.offline.get(0).getMeta());
    }

    @Test
    void offlineWithoutMetaFallsBackToEndpoint() {
        store.replaceKnownKeys(Set.of("servers:10.0.0.9:5"));

        tracker.tick();

        assertEquals(1, listener.offline.size());
        assertNull(listener.offline.get(0).getMeta());
        assertEquals("10.0.0.9:5", listener.offline.get(0).getName());
    }

    @Test
    void failingStoreKeepsPreviousKnownSet() {
        AtomicBoolean failing = new AtomicBoolean(false);
        InMemoryListingStore flaky = new InMemoryListingStore(clock) {
            @Override
            public Set<String> allKeys() {
                if (failing.get()) {
                    throw new RegistryUnavailableException("down");
                }
                return super.allKeys();
            }
        };
        PresenceTracker flakyTracker = new PresenceTracker(flaky, listener, new MasterServerConfig.PresenceConfig());

        flaky.put(TestListings.entry(TestListings.listing("10.0.0.1", 1)), TTL);
        assertTrue(flakyTracker.tick());

        failing.set(true);
        listener.clear();
        assertFalse(flakyTracker.tick());
        assertEquals(Set.of("servers:10.0.0.1:1"), flaky.knownKeys());
        assertTrue(listener.offline.isEmpty());

        failing.set(false);
        assertTrue(flakyTracker.tick());
        assertTrue(listener.online.isEmpty());
    }

    @Test
    void failingListenerDoesNotStallDiff() {
        RecordingPresenceListener throwing = new RecordingPresenceListener() {
            @Override
            public void onServerOnline(@Nonnull ServerOnlineEvent event) {
                if ("bad".equals(event.getName())) {
                    throw new IllegalStateException("listener down");
                }
                super.onServerOnline(event);
            }
        };
        PresenceTracker throwingTracker = new PresenceTracker(store, throwing, new MasterServerConfig.PresenceConfig());
        register("good", 1, 0, false);
        register("bad", 2, 0, false);

        assertTrue(throwingTracker.tick());
        assertEquals(1, throwing.online.size());
        assertEquals("good", throwing.online.get(0).getName());
        assertEquals(Set.of("servers:10.0.0.1:1", "servers:10.0.0.1:2"), store.knownKeys());
        assertNotNull(store.getMeta(new EndpointKey("10.0.0.1", 2)));

        throwing.clear();
        assertTrue(throwingTracker.tick());
        assertTrue(throwing.online.isEmpty());
    }

    @Test
    void slowListenerDoesNotHoldUpTicks() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        RecordingPresenceListener slow = new RecordingPresenceListener() {
            @Override
            public void onServerOnline(@Nonnull ServerOnlineEvent event) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                super.onServerOnline(event);
            }
        };
        PresenceTracker slowTracker = new PresenceTracker(store, slow, new MasterServerConfig.PresenceConfig());
        register("a", 1, 0, false);

        slowTracker.start();
        try {
            long deadline = System.currentTimeMillis() + 2000;
            while ((slow.counts.isEmpty() || slow.summaries.isEmpty() || store.knownKeys().isEmpty())
                    && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }

            assertEquals(1, slow.counts.size());
            assertEquals(1, slow.summaries.size());
            assertEquals(Set.of("servers:10.0.0.1:1"), store.knownKeys());
            assertTrue(slow.online.isEmpty());
        } finally {
            release.countDown();
            slowTracker.stop();
        }
        assertEquals(1, slow.online.size());
    }

    @Test
    void countSnapshotCoversPublicListingsOnly() {
        register("a", 1, 4, false);
        register("b", 2, 6, false);
        register("hidden", 3, 50, true);

        tracker.countTick();

        assertEquals(1, listener.counts.size());
        assertArrayEquals(new int[]{2, 10}, listener.counts.get(0));
    }

    @Test
    void summaryListsPublicServersBusiestFirst() {
        register("quiet", 1, 1, false);
        register("busy", 2, 9, false);
        register("secret", 3, 5, true);

        tracker.summaryTick();

        String summary = listener.summaries.get(0);
        assertTrue(summary.startsWith("Servers: 2 | Players: 10"));
        assertTrue(summary.indexOf("busy") < summary.indexOf("quiet"));
        assertFalse(summary.contains("secret"));
    }

    @Test
    void startAndStopAreIdempotent() {
        tracker.start();
        tracker.start();
        assertTrue(tracker.isRunning());

        tracker.stop();
        tracker.stop();
        assertFalse(tracker.isRunning());
    }
}
