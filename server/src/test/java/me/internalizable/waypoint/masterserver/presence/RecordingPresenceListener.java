package me.internalizable.waypoint.masterserver.presence;

import me.internalizable.waypoint.masterserver.event.ServerOfflineEvent;
import me.internalizable.waypoint.masterserver.event.ServerOnlineEvent;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Presence listener that keeps everything it receives.
 */
class RecordingPresenceListener implements PresenceListener {

    final List<ServerOnlineEvent> online = new CopyOnWriteArrayList<>();
    final List<ServerOfflineEvent> offline = new CopyOnWriteArrayList<>();
    final List<int[]> counts = new CopyOnWriteArrayList<>();
    final List<String> summaries = new CopyOnWriteArrayList<>();

    @Override
    public void onServerOnline(@Nonnull ServerOnlineEvent event) {
        online.add(event);
    }

    @Override
    public void onServerOffline(@Nonnull ServerOfflineEvent event) {
        offline.add(event);
    }

    @Override
    public void onCountSnapshot(int servers, int players) {
        counts.add(new int[]{servers, players});
    }

    @Override
    public void onListingSummary(@Nonnull String summary) {
        summaries.add(summary);
    }

    void clear() {
        online.clear();
        offline.clear();
        counts.clear();
        summaries.clear();
    }
}
