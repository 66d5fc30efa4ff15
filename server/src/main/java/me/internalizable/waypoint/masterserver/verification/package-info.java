/**
 * Endpoint verification over the encrypted UDP challenge protocol.
 */
package me.internalizable.waypoint.masterserver.verification;
