package checkin.crypto;

import checkin.spi.PhoneDecryptor;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM decryption of stored phone numbers.
 *
 * <p>Stored values are hex-encoded {@code iv(12) || ciphertext || tag(16)}; the key is
 * 32 bytes given as 64 hex characters.
 */
public final class AesGcmPhoneDecryptor implements PhoneDecryptor {
    static final int IV_LENGTH = 12;
    static final int TAG_BITS = 128;

    private final SecretKeySpec key;

    public AesGcmPhoneDecryptor(String keyHex) {
        Objects.requireNonNull(keyHex, "keyHex");
        byte[] keyBytes;
        try {
            keyBytes = HexFormat.of().parseHex(keyHex.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Encryption key must be hex encoded", e);
        }
        if (keyBytes.length != 32) {
            throw new IllegalArgumentException("Encryption key must be 32 bytes, got: " + keyBytes.length);
        }
        this.key = new SecretKeySpec(keyBytes, "AES");
    }

    @Override
    public String decrypt(String ciphertext) {
        if (ciphertext == null || ciphertext.isEmpty()) {
            throw new IllegalArgumentException("ciphertext is empty");
        }
        byte[] combined;
        try {
            combined = HexFormat.of().parseHex(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("ciphertext is not hex encoded", e);
        }
        if (combined.length <= IV_LENGTH + TAG_BITS / 8) {
            throw new IllegalArgumentException("ciphertext too short");
        }
        byte[] iv = Arrays.copyOfRange(combined, 0, IV_LENGTH);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] plain = cipher.doFinal(combined, IV_LENGTH, combined.length - IV_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Failed to decrypt phone number", e);
        }
    }
}
