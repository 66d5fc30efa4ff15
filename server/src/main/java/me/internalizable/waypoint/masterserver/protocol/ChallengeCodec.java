package me.internalizable.waypoint.masterserver.protocol;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Builds challenge requests and parses challenge responses.
 *
 * <p>All fields are little-endian, matching the game engine's bit stream.</p>
 *
 * <h2>Challenge request</h2>
 * <pre>
 * int32  header     = -1
 * uint8  type       = 0x48 ('H')
 * string "connect"  NUL terminated ASCII
 * uint32 uid low
 * uint32 uid high
 * uint8  protocol   = 2
 * </pre>
 *
 * <h2>Challenge response</h2>
 * <pre>
 * offset 0  int32 header    = -1
 * offset 4  uint8 type      = 73 ('I')
 * offset 5  int32 challenge
 * offset 9  int64 uid       = uid of the request
 * </pre>
 */
public final class ChallengeCodec {

    public static final int HEADER_MAGIC = -1;
    public static final int CHALLENGE_REQUEST_TYPE = 0x48;
    public static final int CHALLENGE_RESPONSE_TYPE = 73;
    public static final int PROTOCOL_VERSION = 2;
    public static final String CONNECT_COMMAND = "connect";

    /**
     * Shortest plaintext that can hold a challenge response.
     */
    public static final int RESPONSE_LENGTH = 17;

    private static final long UID_LOW_MASK = 0xffffffffL;

    private ChallengeCodec() {
    }

    /**
     * Build a plaintext challenge request.
     *
     * @param uid 64-bit session identifier
     * @return encoded request
     */
    @Nonnull
    public static byte[] encodeChallenge(long uid) {
        byte[] command = CONNECT_COMMAND.getBytes(StandardCharsets.US_ASCII);
        ByteBuffer buffer = ByteBuffer.allocate(4 + 1 + command.length + 1 + 4 + 4 + 1)
                .order(ByteOrder.LITTLE_ENDIAN);

        buffer.putInt(HEADER_MAGIC);
        buffer.put((byte) CHALLENGE_REQUEST_TYPE);
        buffer.put(command);
        buffer.put((byte) 0);
        buffer.putInt((int) (uid & UID_LOW_MASK));
        buffer.putInt((int) (uid >>> 32));
        buffer.put((byte) PROTOCOL_VERSION);

        return buffer.array();
    }

    /**
     * Parse a plaintext challenge response.
     *
     * @param plaintext opened datagram
     * @param expectedUid identifier sent in the request
     * @return the response, or null if the datagram is not a matching response
     */
    @Nullable
    public static ChallengeResponse decodeResponse(@Nonnull byte[] plaintext, long expectedUid) {
        Objects.requireNonNull(plaintext, "plaintext");
        if (plaintext.length < RESPONSE_LENGTH) {
            return null;
        }

        ByteBuffer buffer = ByteBuffer.wrap(plaintext).order(ByteOrder.LITTLE_ENDIAN);
        if (buffer.getInt(0) != HEADER_MAGIC) {
            return null;
        }
        if ((buffer.get(4) & 0xff) != CHALLENGE_RESPONSE_TYPE) {
            return null;
        }

        long uid = buffer.getLong(9);
        if (uid != expectedUid) {
            return null;
        }

        return new ChallengeResponse(buffer.getInt(5), uid);
    }

    /**
     * Parse a plaintext challenge request, as a game server would receive it.
     *
     * @param plaintext opened datagram
     * @return the requested uid, or null if the datagram is not a challenge request
     */
    @Nullable
    public static Long decodeChallengeUid(@Nonnull byte[] plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        byte[] command = CONNECT_COMMAND.getBytes(StandardCharsets.US_ASCII);
        int uidOffset = 4 + 1 + command.length + 1;
        if (plaintext.length < uidOffset + 4 + 4 + 1) {
            return null;
        }

        ByteBuffer buffer = ByteBuffer.wrap(plaintext).order(ByteOrder.LITTLE_ENDIAN);
        if (buffer.getInt(0) != HEADER_MAGIC || (buffer.get(4) & 0xff) != CHALLENGE_REQUEST_TYPE) {
            return null;
        }
        for (int i = 0; i < command.length; i++) {
            if (plaintext[5 + i] != command[i]) {
                return null;
            }
        }
        if (plaintext[5 + command.length] != 0 || (buffer.get(uidOffset + 8) & 0xff) != PROTOCOL_VERSION) {
            return null;
        }

        long low = buffer.getInt(uidOffset) & UID_LOW_MASK;
        long high = buffer.getInt(uidOffset + 4) & UID_LOW_MASK;
        return (high << 32) | low;
    }

    /**
     * Build a plaintext challenge response, as a game server would send it.
     *
     * @param challenge challenge value
     * @param uid identifier to echo
     * @return encoded response
     */
    @Nonnull
    public static byte[] encodeResponse(int challenge, long uid) {
        ByteBuffer buffer = ByteBuffer.allocate(RESPONSE_LENGTH).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(HEADER_MAGIC);
        buffer.put((byte) CHALLENGE_RESPONSE_TYPE);
        buffer.putInt(challenge);
        buffer.putLong(uid);
        return buffer.array();
    }
}
