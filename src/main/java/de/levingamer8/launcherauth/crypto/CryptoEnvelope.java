package de.levingamer8.launcherauth.crypto;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * AES-256-GCM over a single blob. Every call to {@link #encrypt} draws a fresh IV.
 */
public final class CryptoEnvelope {

    public static final int KEY_LENGTH = 32;
    public static final int IV_LENGTH = 16;
    public static final int TAG_LENGTH = 16;

    private static final String ALGORITHM = "AES";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final SecureRandom RANDOM = new SecureRandom();

    private CryptoEnvelope() {}

    public static byte[] generateKey() {
        byte[] key = new byte[KEY_LENGTH];
        RANDOM.nextBytes(key);
        return key;
    }

    public static Envelope encrypt(byte[] plaintext, byte[] key) throws CryptoException {
        checkKey(key);
        byte[] iv = new byte[IV_LENGTH];
        RANDOM.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, ALGORITHM),
                    new GCMParameterSpec(TAG_LENGTH * 8, iv));
            byte[] out = cipher.doFinal(plaintext);

            // JCE haengt den Tag hinten an den Ciphertext
            int split = out.length - TAG_LENGTH;
            return new Envelope(iv, Arrays.copyOfRange(out, 0, split), Arrays.copyOfRange(out, split, out.length));
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Encryption error: " + e.getMessage(), e);
        }
    }

    public static byte[] decrypt(Envelope envelope, byte[] key) throws CryptoException {
        checkKey(key);
        if (envelope.iv().length != IV_LENGTH) {
            throw new CryptoException("Decryption error: IV must be " + IV_LENGTH + " bytes, got " + envelope.iv().length);
        }
        if (envelope.authTag().length != TAG_LENGTH) {
            throw new CryptoException("Decryption error: auth tag must be " + TAG_LENGTH + " bytes, got " + envelope.authTag().length);
        }

        byte[] in = new byte[envelope.ciphertext().length + TAG_LENGTH];
        System.arraycopy(envelope.ciphertext(), 0, in, 0, envelope.ciphertext().length);
        System.arraycopy(envelope.authTag(), 0, in, envelope.ciphertext().length, TAG_LENGTH);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, ALGORITHM),
                    new GCMParameterSpec(TAG_LENGTH * 8, envelope.iv()));
            return cipher.doFinal(in);
        } catch (AEADBadTagException e) {
            throw new CryptoException("Decryption error: authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Decryption error: " + e.getMessage(), e);
        }
    }

    private static void checkKey(byte[] key) throws CryptoException {
        if (key == null || key.length != KEY_LENGTH) {
            throw new CryptoException("Key must be " + KEY_LENGTH + " bytes, got " + (key == null ? "none" : key.length));
        }
    }
}
