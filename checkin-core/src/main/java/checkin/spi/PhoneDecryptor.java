package checkin.spi;

/**
 * Decrypts a contact's stored phone number at send time.
 *
 * @see checkin.crypto.AesGcmPhoneDecryptor
 */
@FunctionalInterface
public interface PhoneDecryptor {

    /**
     * @param ciphertext opaque stored value
     * @return the E.164 phone number
     * @throws IllegalArgumentException if the value cannot be decrypted
     */
    String decrypt(String ciphertext);
}
