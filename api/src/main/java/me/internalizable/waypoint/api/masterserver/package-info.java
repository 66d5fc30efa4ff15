/**
 * API for the game server master list.
 *
 * <p>Provides interfaces for registering game servers, querying the
 * published listings and checking join passwords.</p>
 *
 * @see me.internalizable.waypoint.api.masterserver.MasterServerAPI
 */
package me.internalizable.waypoint.api.masterserver;
