package me.internalizable.waypoint.masterserver.protocol;

/**
 * A decoded challenge response.
 *
 * @param challenge challenge value chosen by the game server
 * @param uid identifier echoed back from the challenge request
 */
public record ChallengeResponse(int challenge, long uid) {
}
