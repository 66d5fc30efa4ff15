package me.internalizable.waypoint.masterserver.presence;

import me.internalizable.waypoint.masterserver.event.ServerOfflineEvent;
import me.internalizable.waypoint.masterserver.event.ServerOnlineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * Presence listener that writes notifications to the log.
 */
public class LoggingPresenceListener implements PresenceListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingPresenceListener.class);

    @Override
    public void onServerOnline(@Nonnull ServerOnlineEvent event) {
        if (event.getListing() != null) {
            LOGGER.info("Server online: {} ({} on {})", event.getName(),
                    event.getListing().playlist(), event.getListing().map());
        } else {
            LOGGER.info("Server online: {}", event.getName());
        }
    }

    @Override
    public void onServerOffline(@Nonnull ServerOfflineEvent event) {
        LOGGER.info("Server offline: {}", event.getName());
    }

    @Override
    public void onCountSnapshot(int servers, int players) {
        LOGGER.info("{} public servers online with {} players", servers, players);
    }

    @Override
    public void onListingSummary(@Nonnull String summary) {
        LOGGER.debug("Active servers:\n{}", summary);
    }
}
