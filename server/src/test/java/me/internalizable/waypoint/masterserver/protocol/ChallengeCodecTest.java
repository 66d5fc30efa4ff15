package me.internalizable.waypoint.masterserver.protocol;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.junit.jupiter.api.Assertions.*;

class ChallengeCodecTest {

    private static final long UID = 1000000001337L;

    @Test
    void challengeHasExpectedLayout() {
        byte[] challenge = ChallengeCodec.encodeChallenge(UID);
        ByteBuffer buffer = ByteBuffer.wrap(challenge).order(ByteOrder.LITTLE_ENDIAN);

        assertEquals(22, challenge.length);
        assertEquals(-1, buffer.getInt(0));
        assertEquals(0x48, challenge[4]);
        assertEquals('c', challenge[5]);
        assertEquals('t', challenge[11]);
        assertEquals(0, challenge[12]);
        assertEquals((int) (UID & 0xffffffffL), buffer.getInt(13));
        assertEquals((int) (UID >>> 32), buffer.getInt(17));
        assertEquals(2, challenge[21]);
    }

    @Test
    void decodesChallengeUid() {
        assertEquals(UID, ChallengeCodec.decodeChallengeUid(ChallengeCodec.encodeChallenge(UID)));
    }

    @Test
    void decodeChallengeUidRejectsWrongCommand() {
        byte[] challenge = ChallengeCodec.encodeChallenge(UID);
        challenge[5] = 'x';
        assertNull(ChallengeCodec.decodeChallengeUid(challenge));
    }

    @Test
    void decodesMatchingResponse() {
        byte[] response = ChallengeCodec.encodeResponse(123456, UID);

        ChallengeResponse decoded = ChallengeCodec.decodeResponse(response, UID);

        assertNotNull(decoded);
        assertEquals(123456, decoded.challenge());
        assertEquals(UID, decoded.uid());
    }

    @Test
    void responseLayoutIsLittleEndian() {
        byte[] response = ChallengeCodec.encodeResponse(0x01020304, UID);

        assertEquals(ChallengeCodec.RESPONSE_LENGTH, response.length);
        assertEquals(73, response[4]);
        assertEquals(0x04, response[5]);
        assertEquals(0x01, response[8]);
    }

    @Test
    void acceptsResponseWithTrailingBytes() {
        byte[] response = new byte[ChallengeCodec.RESPONSE_LENGTH + 4];
        System.arraycopy(ChallengeCodec.encodeResponse(7, UID), 0, response, 0, ChallengeCodec.RESPONSE_LENGTH);

        assertNotNull(ChallengeCodec.decodeResponse(response, UID));
    }

    @Test
    void rejectsShortResponse() {
        assertNull(ChallengeCodec.decodeResponse(new byte[ChallengeCodec.RESPONSE_LENGTH - 1], UID));
    }

    @Test
    void rejectsWrongHeader() {
        byte[] response = ChallengeCodec.encodeResponse(1, UID);
        response[0] = 0;
        assertNull(ChallengeCodec.decodeResponse(response, UID));
    }

    @Test
    void rejectsWrongType() {
        byte[] response = ChallengeCodec.encodeResponse(1, UID);
        response[4] = 0x48;
        assertNull(ChallengeCodec.decodeResponse(response, UID));
    }

    @Test
    void rejectsUidMismatch() {
        byte[] response = ChallengeCodec.encodeResponse(1, UID + 1);
        assertNull(ChallengeCodec.decodeResponse(response, UID));
    }
}
