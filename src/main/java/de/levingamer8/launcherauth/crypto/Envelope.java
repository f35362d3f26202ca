package de.levingamer8.launcherauth.crypto;

import java.util.Objects;

public record Envelope(byte[] iv, byte[] ciphertext, byte[] authTag) {

    public Envelope {
        Objects.requireNonNull(iv, "iv");
        Objects.requireNonNull(ciphertext, "ciphertext");
        Objects.requireNonNull(authTag, "authTag");
    }
}
