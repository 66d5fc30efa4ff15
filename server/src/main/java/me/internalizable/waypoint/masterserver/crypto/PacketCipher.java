package me.internalizable.waypoint.masterserver.crypto;

import javax.annotation.Nonnull;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * AES-128-GCM sealing of verification datagrams.
 *
 * <p>Sealed packet layout:</p>
 * <pre>
 * nonce (12 bytes) | tag (16 bytes) | ciphertext
 * </pre>
 *
 * <p>Every packet binds the same 16 byte additional authenticated data
 * ({@code 0x01..0x10}) that the game server uses.</p>
 */
public final class PacketCipher {

    public static final int KEY_LENGTH = 16;
    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH = 16;
    public static final int HEADER_LENGTH = NONCE_LENGTH + TAG_LENGTH;

    private static final String CIPHER_ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH_BITS = TAG_LENGTH * 8;
    private static final byte[] ADDITIONAL_DATA = {
            0x01, 0x02, 0x03, 0x04, 0x05, 0x06, 0x07, 0x08,
            0x09, 0x0a, 0x0b, 0x0c, 0x0d, 0x0e, 0x0f, 0x10
    };

    private static final SecureRandom RANDOM = new SecureRandom();

    private final SecretKey key;

    /**
     * Create a cipher from raw key material.
     *
     * @param keyBytes 16 byte key
     * @throws IllegalArgumentException if the key is not 128 bits
     */
    public PacketCipher(@Nonnull byte[] keyBytes) {
        Objects.requireNonNull(keyBytes, "keyBytes");
        if (keyBytes.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Key must be " + KEY_LENGTH + " bytes, got " + keyBytes.length);
        }
        this.key = new SecretKeySpec(Arrays.copyOf(keyBytes, KEY_LENGTH), "AES");
    }

    /**
     * Create a cipher from a base64 encoded key.
     *
     * @param base64Key base64 encoded 16 byte key
     * @return the cipher
     * @throws IllegalArgumentException if the key is not valid base64 or not 128 bits
     */
    @Nonnull
    public static PacketCipher fromBase64(@Nonnull String base64Key) {
        Objects.requireNonNull(base64Key, "base64Key");
        return new PacketCipher(Base64.getDecoder().decode(base64Key.trim()));
    }

    /**
     * Seal a datagram payload under a fresh random nonce.
     *
     * @param plaintext payload to seal
     * @return sealed packet
     */
    @Nonnull
    public byte[] seal(@Nonnull byte[] plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        byte[] nonce = new byte[NONCE_LENGTH];
        RANDOM.nextBytes(nonce);

        byte[] sealed;
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, nonce));
            cipher.updateAAD(ADDITIONAL_DATA);
            sealed = cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }

        // JCE appends the tag, the wire format puts it before the ciphertext
        int ciphertextLength = sealed.length - TAG_LENGTH;
        byte[] packet = new byte[HEADER_LENGTH + ciphertextLength];
        System.arraycopy(nonce, 0, packet, 0, NONCE_LENGTH);
        System.arraycopy(sealed, ciphertextLength, packet, NONCE_LENGTH, TAG_LENGTH);
        System.arraycopy(sealed, 0, packet, HEADER_LENGTH, ciphertextLength);
        return packet;
    }

    /**
     * Open a sealed packet.
     *
     * @param packet sealed packet
     * @return the authenticated plaintext
     * @throws PacketDecryptionException if the packet is truncated or fails authentication
     */
    @Nonnull
    public byte[] open(@Nonnull byte[] packet) throws PacketDecryptionException {
        return open(packet, 0, packet.length);
    }

    /**
     * Open a sealed packet held in part of a buffer.
     *
     * @param buffer buffer holding the packet
     * @param offset packet start
     * @param length packet length
     * @return the authenticated plaintext
     * @throws PacketDecryptionException if the packet is truncated or fails authentication
     */
    @Nonnull
    public byte[] open(@Nonnull byte[] buffer, int offset, int length) throws PacketDecryptionException {
        Objects.requireNonNull(buffer, "buffer");
        if (length < HEADER_LENGTH) {
            throw new PacketDecryptionException("Packet too short: " + length + " bytes");
        }

        int ciphertextLength = length - HEADER_LENGTH;
        byte[] joined = new byte[ciphertextLength + TAG_LENGTH];
        System.arraycopy(buffer, offset + HEADER_LENGTH, joined, 0, ciphertextLength);
        System.arraycopy(buffer, offset + NONCE_LENGTH, joined, ciphertextLength, TAG_LENGTH);

        try {
            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            GCMParameterSpec spec = new GCMParameterSpec(GCM_TAG_LENGTH_BITS, buffer, offset, NONCE_LENGTH);
            cipher.init(Cipher.DECRYPT_MODE, key, spec);
            cipher.updateAAD(ADDITIONAL_DATA);
            return cipher.doFinal(joined);
        } catch (AEADBadTagException e) {
            throw new PacketDecryptionException("Authentication failed", e);
        } catch (GeneralSecurityException e) {
            throw new PacketDecryptionException("Decryption failed", e);
        }
    }
}
