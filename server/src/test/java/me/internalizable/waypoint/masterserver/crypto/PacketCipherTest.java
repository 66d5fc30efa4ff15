package me.internalizable.waypoint.masterserver.crypto;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class PacketCipherTest {

    private static final byte[] KEY = "0123456789abcdef".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] OTHER_KEY = "fedcba9876543210".getBytes(StandardCharsets.US_ASCII);

    @Test
    void sealThenOpenReturnsPlaintext() throws Exception {
        PacketCipher cipher = new PacketCipher(KEY);
        byte[] plaintext = "connect".getBytes(StandardCharsets.US_ASCII);

        byte[] packet = cipher.seal(plaintext);

        assertEquals(PacketCipher.HEADER_LENGTH + plaintext.length, packet.length);
        assertArrayEquals(plaintext, cipher.open(packet));
    }

    @Test
    void sealUsesFreshNonce() {
        PacketCipher cipher = new PacketCipher(KEY);
        byte[] plaintext = new byte[8];

        byte[] first = cipher.seal(plaintext);
        byte[] second = cipher.seal(plaintext);

        assertFalse(Arrays.equals(
                Arrays.copyOf(first, PacketCipher.NONCE_LENGTH),
                Arrays.copyOf(second, PacketCipher.NONCE_LENGTH)));
    }

    @Test
    void openWithWrongKeyFails() {
        byte[] packet = new PacketCipher(KEY).seal(new byte[]{1, 2, 3});
        assertThrows(PacketDecryptionException.class, () -> new PacketCipher(OTHER_KEY).open(packet));
    }

    @Test
    void openRejectsTamperedCiphertext() {
        PacketCipher cipher = new PacketCipher(KEY);
        byte[] packet = cipher.seal(new byte[]{1, 2, 3, 4});
        packet[PacketCipher.HEADER_LENGTH] ^= 0x01;

        assertThrows(PacketDecryptionException.class, () -> cipher.open(packet));
    }

    @Test
    void openRejectsTamperedTag() {
        PacketCipher cipher = new PacketCipher(KEY);
        byte[] packet = cipher.seal(new byte[]{1, 2, 3, 4});
        packet[PacketCipher.NONCE_LENGTH] ^= 0x01;

        assertThrows(PacketDecryptionException.class, () -> cipher.open(packet));
    }

    @Test
    void openRejectsShortPacket() {
        PacketCipher cipher = new PacketCipher(KEY);
        assertThrows(PacketDecryptionException.class, () -> cipher.open(new byte[PacketCipher.HEADER_LENGTH - 1]));
    }

    @Test
    void openReadsPacketFromBufferOffset() throws Exception {
        PacketCipher cipher = new PacketCipher(KEY);
        byte[] packet = cipher.seal(new byte[]{9, 8, 7});

        byte[] buffer = new byte[packet.length + 10];
        System.arraycopy(packet, 0, buffer, 5, packet.length);

        assertArrayEquals(new byte[]{9, 8, 7}, cipher.open(buffer, 5, packet.length));
    }

    @Test
    void emptyPlaintextRoundTrips() throws Exception {
        PacketCipher cipher = new PacketCipher(KEY);
        byte[] packet = cipher.seal(new byte[0]);

        assertEquals(PacketCipher.HEADER_LENGTH, packet.length);
        assertEquals(0, cipher.open(packet).length);
    }

    @Test
    void rejectsKeyOfWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> new PacketCipher(new byte[15]));
        assertThrows(IllegalArgumentException.class, () -> new PacketCipher(new byte[32]));
    }

    @Test
    void fromBase64AcceptsEncodedKey() throws Exception {
        PacketCipher cipher = PacketCipher.fromBase64(Base64.getEncoder().encodeToString(KEY));
        byte[] packet = new PacketCipher(KEY).seal(new byte[]{42});

        assertArrayEquals(new byte[]{42}, cipher.open(packet));
    }

    @Test
    void fromBase64RejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> PacketCipher.fromBase64("not base64!"));
    }
}
