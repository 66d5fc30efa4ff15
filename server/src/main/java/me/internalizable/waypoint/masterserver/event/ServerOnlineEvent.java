package me.internalizable.waypoint.masterserver.event;

import me.internalizable.waypoint.masterserver.registry.EndpointKey;
import me.internalizable.waypoint.masterserver.registry.Listing;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Event fired when a listing appears in the registry.
 *
 * <p>The listing may be null if it expired between the key scan and the
 * lookup that followed it.</p>
 */
public class ServerOnlineEvent {

    private final EndpointKey endpoint;
    private final Listing listing;

    /**
     * Create a server online event.
     *
     * @param endpoint endpoint that came online
     * @param listing its listing, if still readable
     */
    public ServerOnlineEvent(@Nonnull EndpointKey endpoint, @Nullable Listing listing) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.listing = listing;
    }

    /**
     * Get the endpoint.
     *
     * @return endpoint key
     */
    @Nonnull
    public EndpointKey getEndpoint() {
        return endpoint;
    }

    /**
     * Get the listing.
     *
     * @return the listing, or null if it already expired
     */
    @Nullable
    public Listing getListing() {
        return listing;
    }

    /**
     * Get the display name.
     *
     * @return server name, or the endpoint if unknown
     */
    @Nonnull
    public String getName() {
        return listing != null && !listing.name().isEmpty() ? listing.name() : endpoint.toString();
    }

    /**
     * Check if the server is hidden from public queries.
     *
     * @return true if hidden
     */
    public boolean isHidden() {
        return listing != null && listing.hidden();
    }
}
