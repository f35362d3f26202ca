package de.levingamer8.launcherauth.storage;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Backend made of caller-supplied callbacks. Every callback is optional: a missing reader
 * reads as "not found", a missing writer silently drops the write.
 */
public final class CustomStorageBackend implements StorageBackend {

    private final Supplier<String> blobReader;
    private final Consumer<String> blobWriter;
    private final Supplier<byte[]> keyReader;
    private final Consumer<byte[]> keyWriter;

    private CustomStorageBackend(Builder b) {
        this.blobReader = b.blobReader;
        this.blobWriter = b.blobWriter;
        this.keyReader = b.keyReader;
        this.keyWriter = b.keyWriter;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<String> readBlob() throws StorageException {
        if (blobReader == null) return Optional.empty();
        try {
            return Optional.ofNullable(blobReader.get()).filter(s -> !s.isBlank());
        } catch (RuntimeException e) {
            throw new StorageException("Custom readBlob callback failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void writeBlob(String blob) throws StorageException {
        if (blobWriter == null) return;
        try {
            blobWriter.accept(blob);
        } catch (RuntimeException e) {
            throw new StorageException("Custom writeBlob callback failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<byte[]> readKey() throws StorageException {
        if (keyReader == null) return Optional.empty();
        try {
            return Optional.ofNullable(keyReader.get()).map(byte[]::clone);
        } catch (RuntimeException e) {
            throw new StorageException("Custom readKey callback failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void writeKey(byte[] key) throws StorageException {
        if (keyWriter == null) return;
        try {
            keyWriter.accept(key.clone());
        } catch (RuntimeException e) {
            throw new StorageException("Custom writeKey callback failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String location() {
        return "custom";
    }

    public static final class Builder {
        private Supplier<String> blobReader;
        private Consumer<String> blobWriter;
        private Supplier<byte[]> keyReader;
        private Consumer<byte[]> keyWriter;

        private Builder() {}

        public Builder readBlob(Supplier<String> reader) {
            this.blobReader = reader;
            return this;
        }

        public Builder writeBlob(Consumer<String> writer) {
            this.blobWriter = writer;
            return this;
        }

        public Builder readKey(Supplier<byte[]> reader) {
            this.keyReader = reader;
            return this;
        }

        public Builder writeKey(Consumer<byte[]> writer) {
            this.keyWriter = writer;
            return this;
        }

        public CustomStorageBackend build() {
            return new CustomStorageBackend(this);
        }
    }
}
