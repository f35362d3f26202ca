package de.levingamer8.launcherauth.storage;

import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;

/**
 * Two entries in a host-supplied {@link KeyValueHandle}. The key is stored hex-encoded
 * because the handle only speaks strings.
 */
public final class KeyValueStorageBackend implements StorageBackend {

    public static final String DEFAULT_BLOB_ENTRY = "accounts";
    public static final String DEFAULT_KEY_ENTRY = "encryptionKey";

    private static final HexFormat HEX = HexFormat.of();

    private final KeyValueHandle handle;
    private final String blobEntry;
    private final String keyEntry;

    public KeyValueStorageBackend(KeyValueHandle handle) {
        this(handle, DEFAULT_BLOB_ENTRY, DEFAULT_KEY_ENTRY);
    }

    public KeyValueStorageBackend(KeyValueHandle handle, String blobEntry, String keyEntry) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.blobEntry = Objects.requireNonNull(blobEntry, "blobEntry");
        this.keyEntry = Objects.requireNonNull(keyEntry, "keyEntry");
    }

    @Override
    public Optional<String> readBlob() throws StorageException {
        return handle.get(blobEntry).filter(s -> !s.isBlank());
    }

    @Override
    public void writeBlob(String blob) throws StorageException {
        handle.put(blobEntry, blob);
    }

    @Override
    public Optional<byte[]> readKey() throws StorageException {
        Optional<String> hex = handle.get(keyEntry).filter(s -> !s.isBlank());
        if (hex.isEmpty()) return Optional.empty();
        try {
            return Optional.of(HEX.parseHex(hex.get().trim()));
        } catch (IllegalArgumentException e) {
            throw new StorageException("Stored key under '" + keyEntry + "' is not valid hex", e);
        }
    }

    @Override
    public void writeKey(byte[] key) throws StorageException {
        handle.put(keyEntry, HEX.formatHex(key));
    }

    @Override
    public String location() {
        return "key-value[" + blobEntry + ", " + keyEntry + "]";
    }
}
