/**
 * Listing registry.
 *
 * <p>Listings are keyed by endpoint and expire unless rewritten. The
 * {@link me.internalizable.waypoint.masterserver.registry.ListingCodec} is
 * the only converter between typed listings and their stored form.</p>
 */
package me.internalizable.waypoint.masterserver.registry;
