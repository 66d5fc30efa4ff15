package me.internalizable.waypoint.masterserver.event;

import me.internalizable.waypoint.masterserver.registry.EndpointKey;
import me.internalizable.waypoint.masterserver.registry.ListingMeta;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Event fired when a listing is gone from the registry.
 *
 * <p>Carries the identity cached when the server came online, if any.</p>
 */
public class ServerOfflineEvent {

    private final EndpointKey endpoint;
    private final ListingMeta meta;

    /**
     * Create a server offline event.
     *
     * @param endpoint endpoint that went offline
     * @param meta cached identity, or null if none was recorded
     */
    public ServerOfflineEvent(@Nonnull EndpointKey endpoint, @Nullable ListingMeta meta) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.meta = meta;
    }

    @Nonnull
    public EndpointKey getEndpoint() {
        return endpoint;
    }

    @Nullable
    public ListingMeta getMeta() {
        return meta;
    }

    /**
     * Get the display name.
     *
     * @return last known name, or the endpoint if unknown
     */
    @Nonnull
    public String getName() {
        return meta != null && !meta.name().isEmpty() ? meta.name() : endpoint.toString();
    }
}
