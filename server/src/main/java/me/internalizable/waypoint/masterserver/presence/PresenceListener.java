package me.internalizable.waypoint.masterserver.presence;

import me.internalizable.waypoint.masterserver.event.ServerOfflineEvent;
import me.internalizable.waypoint.masterserver.event.ServerOnlineEvent;

import javax.annotation.Nonnull;

/**
 * Receives presence notifications.
 *
 * <p>Called from the presence scheduler thread. An exception thrown here is
 * logged and ends the current tick.</p>
 */
public interface PresenceListener {

    void onServerOnline(@Nonnull ServerOnlineEvent event);

    void onServerOffline(@Nonnull ServerOfflineEvent event);

    /**
     * Called with the current public server and player totals.
     *
     * @param servers public servers online
     * @param players players on public servers
     */
    void onCountSnapshot(int servers, int players);

    /**
     * Called with a rendered summary of the public listings.
     *
     * @param summary rendered summary text
     */
    void onListingSummary(@Nonnull String summary);
}
