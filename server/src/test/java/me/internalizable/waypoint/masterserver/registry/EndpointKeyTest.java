package me.internalizable.waypoint.masterserver.registry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EndpointKeyTest {

    @Test
    void storageKeyHasPrefix() {
        assertEquals("servers:203.0.113.7:37015", new EndpointKey("203.0.113.7", 37015).toStorageKey());
    }

    @Test
    void parseReadsStorageKey() {
        assertEquals(new EndpointKey("203.0.113.7", 37015), EndpointKey.parse("servers:203.0.113.7:37015"));
    }

    @Test
    void parseKeepsIpv6Literal() {
        EndpointKey key = EndpointKey.parse("servers:2001:db8::1:37015");

        assertNotNull(key);
        assertEquals("2001:db8::1", key.ip());
        assertEquals(37015, key.port());
    }

    @Test
    void parseRejectsMalformedKeys() {
        assertNull(EndpointKey.parse("ms:servers:known"));
        assertNull(EndpointKey.parse("servers:1.2.3.4"));
        assertNull(EndpointKey.parse("servers:1.2.3.4:"));
        assertNull(EndpointKey.parse("servers::37015"));
        assertNull(EndpointKey.parse("servers:1.2.3.4:port"));
    }

    @Test
    void rejectsEmptyIp() {
        assertThrows(IllegalArgumentException.class, () -> new EndpointKey("", 1));
    }

    @Test
    void toStringIsIpAndPort() {
        assertEquals("1.2.3.4:5", new EndpointKey("1.2.3.4", 5).toString());
    }
}
