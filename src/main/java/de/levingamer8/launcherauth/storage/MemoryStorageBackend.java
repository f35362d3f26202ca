package de.levingamer8.launcherauth.storage;

import java.util.Optional;

/**
 * Keeps key and blob on the heap of this instance only. A new instance (or a new process)
 * starts empty.
 */
public final class MemoryStorageBackend implements StorageBackend {

    private volatile String blob;
    private volatile byte[] key;

    @Override
    public Optional<String> readBlob() {
        return Optional.ofNullable(blob);
    }

    @Override
    public void writeBlob(String blob) {
        this.blob = blob;
    }

    @Override
    public Optional<byte[]> readKey() {
        byte[] k = key;
        return k == null ? Optional.empty() : Optional.of(k.clone());
    }

    @Override
    public void writeKey(byte[] key) {
        this.key = key.clone();
    }

    @Override
    public String location() {
        return "memory";
    }
}
