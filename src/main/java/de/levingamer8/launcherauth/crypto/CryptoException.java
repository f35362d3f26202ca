package de.levingamer8.launcherauth.crypto;

/**
 * Encryption or decryption failed: bad key material, a malformed envelope, or a tag that
 * does not verify.
 */
public class CryptoException extends Exception {

    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
