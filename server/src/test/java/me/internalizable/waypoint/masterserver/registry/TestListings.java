package me.internalizable.waypoint.masterserver.registry;

import me.internalizable.waypoint.api.masterserver.ModInfo;

import java.util.List;

/**
 * Listing fixtures.
 */
public final class TestListings {

    public static final String SECRET = "MDEyMzQ1Njc4OWFiY2RlZg==";

    private TestListings() {
    }

    public static Listing listing(String ip, int port) {
        return listing(ip, port, "Server " + port, 0, false);
    }

    public static Listing listing(String ip, int port, String name, int players, boolean hidden) {
        return new Listing(
                new EndpointKey(ip, port),
                name,
                "A test server",
                "mp_lobby",
                "survival",
                players,
                32,
                "",
                List.of("core"),
                List.of(new ModInfo("core", "Core", "dev", "1.0.0", "dev-core", "Core mod")),
                "v1.0",
                42L,
                "DE",
                hidden,
                hidden ? "token-" + port : null
        );
    }

    public static RegistryEntry entry(Listing listing) {
        return new RegistryEntry(listing, SECRET);
    }
}
