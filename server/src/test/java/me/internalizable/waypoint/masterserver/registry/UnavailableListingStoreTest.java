package me.internalizable.waypoint.masterserver.registry;

import me.internalizable.waypoint.api.masterserver.RegistryUnavailableException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UnavailableListingStoreTest {

    private final UnavailableListingStore store = new UnavailableListingStore("connection refused");

    @Test
    void readsAreEmpty() {
        assertTrue(store.getAll().isEmpty());
        assertNull(store.getByEndpoint("1.2.3.4", 1));
        assertNull(store.getByToken("t"));
        assertFalse(store.isAvailable());
    }

    @Test
    void writesFail() {
        RegistryUnavailableException error = assertThrows(RegistryUnavailableException.class,
                () -> store.put(TestListings.entry(TestListings.listing("1.2.3.4", 1)), Duration.ofSeconds(30)));
        assertTrue(error.getMessage().contains("connection refused"));

        assertThrows(RegistryUnavailableException.class, () -> store.replaceKnownKeys(List.of()));
        assertThrows(RegistryUnavailableException.class, store::allKeys);
    }
}
