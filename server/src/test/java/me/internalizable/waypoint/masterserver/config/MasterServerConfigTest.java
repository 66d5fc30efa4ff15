package me.internalizable.waypoint.masterserver.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MasterServerConfigTest {

    @TempDir
    Path dir;

    @Test
    void missingFileIsCreatedWithDefaults() throws Exception {
        Path path = dir.resolve("nested").resolve("config.yml");

        MasterServerConfig config = MasterServerConfig.load(path);

        assertTrue(Files.exists(path));
        assertEquals(8080, config.getHttp().getPort());
        assertEquals("redis", config.getRegistry().getBackend());
        assertEquals(30, config.getRegistry().getServerTtlSeconds());
        assertEquals(800, config.getVerification().getTimeoutMillis());
        assertEquals(15, config.getPresence().getDiffIntervalSeconds());
        assertEquals("", config.getApiKey());
    }

    @Test
    void savedDefaultsLoadBack() throws Exception {
        Path path = dir.resolve("config.yml");
        MasterServerConfig.load(path);

        MasterServerConfig reloaded = MasterServerConfig.load(path);

        assertEquals(8080, reloaded.getHttp().getPort());
        assertEquals(1000000001337L, reloaded.getVerification().getChallengeUid());
    }

    @Test
    void valuesAreReadFromYaml() throws Exception {
        Path path = dir.resolve("config.yml");
        Files.writeString(path, String.join("\n",
                "apiKey: admin-secret",
                "http:",
                "  host: 127.0.0.1",
                "  port: 9000",
                "registry:",
                "  backend: memory",
                "  serverTtlSeconds: 45",
                "verification:",
                "  timeoutMillis: 500",
                "presence:",
                "  enabled: false",
                "  diffIntervalSeconds: 20",
                "policy:",
                "  supportedVersions: [v1.0, v1.1]",
                "  checksumEnforcedVersions: [v1.1]",
                ""));

        MasterServerConfig config = MasterServerConfig.load(path);

        assertEquals("admin-secret", config.getApiKey());
        assertEquals("127.0.0.1", config.getHttp().getHost());
        assertEquals(9000, config.getHttp().getPort());
        assertEquals("memory", config.getRegistry().getBackend());
        assertEquals(45, config.getRegistry().getServerTtlSeconds());
        assertEquals(500, config.getVerification().getTimeoutMillis());
        assertFalse(config.getPresence().isEnabled());
        assertEquals(20, config.getPresence().getDiffIntervalSeconds());
        assertEquals(List.of("v1.0", "v1.1"), config.getPolicy().getSupportedVersions());
        assertEquals(List.of("v1.1"), config.getPolicy().getChecksumEnforcedVersions());
    }

    @Test
    void emptyFileGivesDefaults() throws Exception {
        Path path = dir.resolve("config.yml");
        Files.writeString(path, "");

        assertEquals(8080, MasterServerConfig.load(path).getHttp().getPort());
    }
}
