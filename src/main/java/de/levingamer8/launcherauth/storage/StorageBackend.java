package de.levingamer8.launcherauth.storage;

import java.util.Optional;

/**
 * Where the encryption key and the encrypted account blob live.
 * Both resources are opaque to the backend; a missing resource reads as empty.
 */
public interface StorageBackend {
    Optional<String> readBlob() throws StorageException;   // Envelope-JSON laden

    void writeBlob(String blob) throws StorageException;   // komplett ueberschreiben

    Optional<byte[]> readKey() throws StorageException;

    void writeKey(byte[] key) throws StorageException;

    String location();                                     // nur fuer Logging/Debug
}
