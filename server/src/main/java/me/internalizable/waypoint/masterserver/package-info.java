/**
 * Master server for self-registering game servers.
 *
 * <p>Game servers report a listing; the master server proves the claimed
 * endpoint answers an encrypted UDP challenge, republishes the verified
 * listing and lets it lapse when it stops renewing.</p>
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link me.internalizable.waypoint.masterserver.MasterServer} - Main orchestrator</li>
 *   <li>{@link me.internalizable.waypoint.masterserver.registration.RegistrationHandler} - Validation, verification and storage of listings</li>
 *   <li>{@link me.internalizable.waypoint.masterserver.verification.VerificationClient} - UDP challenge/response</li>
 *   <li>{@link me.internalizable.waypoint.masterserver.registry.ListingStore} - Expiring listing registry</li>
 *   <li>{@link me.internalizable.waypoint.masterserver.presence.PresenceTracker} - Online/offline diffing</li>
 *   <li>{@link me.internalizable.waypoint.masterserver.http.MasterServerHttpApi} - HTTP front end</li>
 * </ul>
 *
 * @see me.internalizable.waypoint.masterserver.MasterServer
 */
package me.internalizable.waypoint.masterserver;
