package me.internalizable.waypoint.masterserver.registration;

import me.internalizable.waypoint.api.masterserver.ListingValidationException;
import me.internalizable.waypoint.api.masterserver.MasterServerAPI;
import me.internalizable.waypoint.api.masterserver.ModInfo;
import me.internalizable.waypoint.api.masterserver.RegistryUnavailableException;
import me.internalizable.waypoint.api.masterserver.VerificationTimeoutException;
import me.internalizable.waypoint.masterserver.config.MasterServerConfig;
import me.internalizable.waypoint.masterserver.crypto.PacketCipher;
import me.internalizable.waypoint.masterserver.registry.InMemoryListingStore;
import me.internalizable.waypoint.masterserver.registry.EndpointKey;
import me.internalizable.waypoint.masterserver.registry.Listing;
import me.internalizable.waypoint.masterserver.registry.ListingStore;
import me.internalizable.waypoint.masterserver.registry.MutableClock;
import me.internalizable.waypoint.masterserver.registry.RegistryEntry;
import me.internalizable.waypoint.masterserver.registry.UnavailableListingStore;
import me.internalizable.waypoint.masterserver.verification.FakeGameServer;
import me.internalizable.waypoint.masterserver.verification.VerificationClient;
import me.internalizable.waypoint.masterserver.verification.VerificationOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RegistrationHandlerTest {

    private static final long UID = 1000000001337L;
    private static final Duration TIMEOUT = Duration.ofMillis(800);
    private static final Duration TTL = Duration.ofSeconds(30);
    private static final PacketCipher CIPHER = PacketCipher.fromBase64(ListingValidatorTest.KEY);

    private ExecutorService executor;
    private MutableClock clock;
    private InMemoryListingStore store;
    private RegistrationHandler handler;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        store = new InMemoryListingStore(clock);
        handler = createHandler(store);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private RegistrationHandler createHandler(ListingStore listingStore) {
        ListingValidator validator = new ListingValidator(new ConfiguredListingPolicy(new MasterServerConfig.PolicyConfig()));
        return new RegistrationHandler(listingStore, validator, executor, TIMEOUT, TTL, UID);
    }

    @Test
    void reachableServerIsListed() throws Exception {
        try (FakeGameServer server = FakeGameServer.responding(CIPHER)) {
            MasterServerAPI.RegistrationOutcome outcome = handler.register(
                    ListingValidatorTest.valid().port(server.getPort()).build()).get(2, TimeUnit.SECONDS);

            assertNull(outcome.getToken());
            assertEquals("127.0.0.1", outcome.getIp());
            assertEquals(server.getPort(), outcome.getPort());

            Listing listing = store.getByEndpoint("127.0.0.1", server.getPort());
            assertNotNull(listing);
            assertEquals("My Server", listing.name());
            assertEquals(1, server.getChallengesReceived());
        }
    }

    @Test
    void storedListingMatchesSubmission() throws Exception {
        ModInfo mod = new ModInfo("core", "Core", "dev", "1.0.0", "dev-core", "Core mod");
        try (FakeGameServer server = FakeGameServer.responding(CIPHER)) {
            handler.register(ListingValidatorTest.valid()
                    .port(server.getPort())
                    .password("hunter2")
                    .checksum(77L)
                    .region("US")
                    .requiredMods(List.of("core"))
                    .enabledMods(List.of(mod))
                    .build()).get(2, TimeUnit.SECONDS);

            Listing expected = new Listing(
                    new EndpointKey("127.0.0.1", server.getPort()),
                    "My Server",
                    "Friendly games",
                    "mp_lobby",
                    "survival",
                    3,
                    32,
                    "hunter2",
                    List.of("core"),
                    List.of(mod),
                    "v1.0",
                    77L,
                    "US",
                    false,
                    null
            );
            assertEquals(expected, store.getByEndpoint("127.0.0.1", server.getPort()));
        }
    }

    @Test
    void timedOutVerificationReleasesSocket() throws Exception {
        AtomicReference<VerificationClient> created = new AtomicReference<>();
        ListingValidator validator = new ListingValidator(new ConfiguredListingPolicy(new MasterServerConfig.PolicyConfig()));
        RegistrationHandler capturing = new RegistrationHandler(store, validator, executor, TIMEOUT, TTL, UID) {
            @Override
            VerificationClient createClient(RegistryEntry entry) {
                VerificationClient client = super.createClient(entry);
                created.set(client);
                return client;
            }
        };

        try (FakeGameServer server = FakeGameServer.silent(CIPHER)) {
            ExecutionException error = assertThrows(ExecutionException.class, () -> capturing.register(
                    ListingValidatorTest.valid().port(server.getPort()).build()).get(5, TimeUnit.SECONDS));

            assertInstanceOf(VerificationTimeoutException.class, error.getCause());
            VerificationClient client = created.get();
            assertNotNull(client);
            assertTrue(client.isClosed());
            assertEquals(VerificationOutcome.TIMED_OUT, client.getOutcome());
        }
    }

    @Test
    void unreachableServerTimesOutWithoutEntry() throws Exception {
        try (FakeGameServer server = FakeGameServer.silent(CIPHER)) {
            long start = System.nanoTime();

            ExecutionException error = assertThrows(ExecutionException.class, () -> handler.register(
                    ListingValidatorTest.valid().port(server.getPort()).build()).get(5, TimeUnit.SECONDS));

            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertInstanceOf(VerificationTimeoutException.class, error.getCause());
            assertEquals(VerificationTimeoutException.MESSAGE, error.getCause().getMessage());
            assertTrue(elapsedMillis >= TIMEOUT.toMillis() - 50, "finished after " + elapsedMillis + "ms");
            assertTrue(elapsedMillis < TIMEOUT.toMillis() + 1500, "finished after " + elapsedMillis + "ms");
            assertNull(store.getByEndpoint("127.0.0.1", server.getPort()));
            assertTrue(store.allKeys().isEmpty());
        }
    }

    @Test
    void reRegistrationUpdatesAndRefreshesEntry() throws Exception {
        try (FakeGameServer server = FakeGameServer.responding(CIPHER)) {
            handler.register(ListingValidatorTest.valid().port(server.getPort()).playerCount(1).build())
                    .get(2, TimeUnit.SECONDS);

            clock.advance(Duration.ofSeconds(20));
            handler.register(ListingValidatorTest.valid().port(server.getPort()).playerCount(8).build())
                    .get(2, TimeUnit.SECONDS);
            clock.advance(Duration.ofSeconds(20));

            assertEquals(1, store.getAll().size());
            Listing listing = store.getByEndpoint("127.0.0.1", server.getPort());
            assertNotNull(listing);
            assertEquals(8, listing.playerCount());
        }
    }

    @Test
    void hiddenServerKeepsItsToken() throws Exception {
        try (FakeGameServer server = FakeGameServer.responding(CIPHER)) {
            MasterServerAPI.Registration registration =
                    ListingValidatorTest.valid().port(server.getPort()).hidden(true).build();

            String first = handler.register(registration).get(2, TimeUnit.SECONDS).getToken();
            String second = handler.register(registration).get(2, TimeUnit.SECONDS).getToken();

            assertNotNull(first);
            assertEquals(first, second);
            assertEquals(first, store.getByEndpoint("127.0.0.1", server.getPort()).token());
            assertNotNull(store.getByToken(first));
        }
    }

    @Test
    void invalidRegistrationSendsNothing() throws Exception {
        try (FakeGameServer server = FakeGameServer.responding(CIPHER)) {
            ExecutionException error = assertThrows(ExecutionException.class, () -> handler.register(
                    ListingValidatorTest.valid().port(server.getPort()).maxPlayers(500).build()).get(2, TimeUnit.SECONDS));

            assertInstanceOf(ListingValidationException.class, error.getCause());
            Thread.sleep(100);
            assertEquals(0, server.getChallengesReceived());
        }
    }

    @Test
    void unavailableRegistryFailsRegistration() throws Exception {
        RegistrationHandler unavailable = createHandler(new UnavailableListingStore("down"));
        try (FakeGameServer server = FakeGameServer.responding(CIPHER)) {
            ExecutionException error = assertThrows(ExecutionException.class, () -> unavailable.register(
                    ListingValidatorTest.valid().port(server.getPort()).build()).get(2, TimeUnit.SECONDS));

            assertInstanceOf(RegistryUnavailableException.class, error.getCause());
        }
    }
}
