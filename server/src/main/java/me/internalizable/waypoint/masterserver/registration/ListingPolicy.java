package me.internalizable.waypoint.masterserver.registration;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Version and checksum rules applied to registrations and listing queries.
 */
public interface ListingPolicy {

    /**
     * Check if public servers may run this version.
     *
     * @param version game version
     * @return true if supported
     */
    boolean isVersionSupported(@Nonnull String version);

    /**
     * Check if registrations for this version must carry an accepted checksum.
     *
     * @param version game version
     * @return true if enforced
     */
    boolean isChecksumEnforced(@Nonnull String version);

    /**
     * Check if a checksum is accepted for a version.
     *
     * @param version game version
     * @param checksum remote functions checksum
     * @return true if accepted
     */
    boolean isChecksumAccepted(@Nonnull String version, long checksum);

    /**
     * Check if clients of this version expect listings with native value types.
     *
     * @param version client version, or null if not sent
     * @return true for typed listings, false for string values
     */
    boolean usesRealTypes(@Nullable String version);

    /**
     * Get where players of unsupported versions can download a supported one.
     *
     * @return update location, shown to outdated clients
     */
    @Nonnull
    String getUpdateUrl();
}
