package me.internalizable.waypoint.masterserver.registration;

import me.internalizable.waypoint.masterserver.config.MasterServerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredListingPolicyTest {

    @Test
    void emptyPolicyAcceptsEverything() {
        ConfiguredListingPolicy policy = new ConfiguredListingPolicy(new MasterServerConfig.PolicyConfig());

        assertTrue(policy.isVersionSupported("anything"));
        assertFalse(policy.isChecksumEnforced("anything"));
        assertFalse(policy.usesRealTypes("anything"));
        assertFalse(policy.usesRealTypes(null));
    }

    @Test
    void configuredVersionsAreHonoured() {
        MasterServerConfig.PolicyConfig config = new MasterServerConfig.PolicyConfig();
        config.setSupportedVersions(List.of("v2.0"));
        config.setRealTypeVersions(List.of("v2.0"));
        config.setChecksumEnforcedVersions(List.of("v2.0"));
        config.setAcceptedChecksums(Map.of("v2.0", List.of(7L, 8L)));

        ConfiguredListingPolicy policy = new ConfiguredListingPolicy(config);

        assertTrue(policy.isVersionSupported("v2.0"));
        assertFalse(policy.isVersionSupported("v1.0"));
        assertTrue(policy.usesRealTypes("v2.0"));
        assertTrue(policy.isChecksumEnforced("v2.0"));
        assertTrue(policy.isChecksumAccepted("v2.0", 8));
        assertFalse(policy.isChecksumAccepted("v2.0", 9));
        assertFalse(policy.isChecksumAccepted("v1.0", 7));
    }

    @Test
    void blankListEntriesAreIgnored(@TempDir Path dir) throws Exception {
        Path path = dir.resolve("config.yml");
        Files.writeString(path, String.join("\n",
                "policy:",
                "  supportedVersions:",
                "    - v2.0",
                "    -",
                "  realTypeVersions:",
                "    -",
                "  checksumEnforcedVersions: [v2.0, null]",
                ""));

        ConfiguredListingPolicy policy = new ConfiguredListingPolicy(MasterServerConfig.load(path).getPolicy());

        assertTrue(policy.isVersionSupported("v2.0"));
        assertFalse(policy.isVersionSupported("v1.0"));
        assertFalse(policy.usesRealTypes("v2.0"));
        assertTrue(policy.isChecksumEnforced("v2.0"));
    }

    @Test
    void nullEntriesInListsAreSkipped() {
        MasterServerConfig.PolicyConfig config = new MasterServerConfig.PolicyConfig();
        config.setSupportedVersions(Arrays.asList(null, "v3.0"));
        config.setRealTypeVersions(null);

        ConfiguredListingPolicy policy = new ConfiguredListingPolicy(config);

        assertTrue(policy.isVersionSupported("v3.0"));
        assertFalse(policy.usesRealTypes("v3.0"));
    }

    @Test
    void updateUrlComesFromConfig() {
        MasterServerConfig.PolicyConfig config = new MasterServerConfig.PolicyConfig();
        config.setUpdateUrl("example.com/get");
        assertEquals("example.com/get", new ConfiguredListingPolicy(config).getUpdateUrl());

        config.setUpdateUrl(null);
        assertEquals("", new ConfiguredListingPolicy(config).getUpdateUrl());
    }
}
