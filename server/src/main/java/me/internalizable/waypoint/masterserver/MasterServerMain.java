package me.internalizable.waypoint.masterserver;

import me.internalizable.waypoint.masterserver.config.MasterServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;

/**
 * Command line entry point.
 *
 * <p>Usage: {@code java -jar waypoint-server.jar [config.yml]}</p>
 */
public final class MasterServerMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(MasterServerMain.class);

    private static final Path DEFAULT_CONFIG_PATH = Paths.get("config.yml");

    private MasterServerMain() {
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        Path configPath = args.length > 0 ? Paths.get(args[0]) : DEFAULT_CONFIG_PATH;
        MasterServerConfig config = MasterServerConfig.load(configPath);
        LOGGER.info("Loaded configuration from {}", configPath.toAbsolutePath());

        MasterServer server = new MasterServer(config);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.shutdown();
            stopped.countDown();
        }, "MasterServer-Shutdown"));

        server.initialize();
        stopped.await();
    }
}
