package de.levingamer8.launcherauth.storage;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Which backend the account store should use. Only the field matching {@link #type()} is
 * set; the others are {@code null}.
 */
public record StorageConfig(
        StorageType type,
        Path location,              // FILE
        KeyValueHandle handle,      // KEY_VALUE
        CustomStorageBackend custom // CUSTOM
) {

    public StorageConfig {
        Objects.requireNonNull(type, "type");
        switch (type) {
            case KEY_VALUE -> Objects.requireNonNull(handle, "handle is required for KEY_VALUE storage");
            case CUSTOM -> Objects.requireNonNull(custom, "callbacks are required for CUSTOM storage");
            default -> { }
        }
    }

    public static StorageConfig defaults() {
        return file(FileStorageBackend.defaultDir());
    }

    public static StorageConfig file(Path location) {
        return new StorageConfig(StorageType.FILE, location, null, null);
    }

    public static StorageConfig memory() {
        return new StorageConfig(StorageType.MEMORY, null, null, null);
    }

    public static StorageConfig keyValue(KeyValueHandle handle) {
        return new StorageConfig(StorageType.KEY_VALUE, null, handle, null);
    }

    /** Key-value storage in the user Preferences node of {@code owner}'s package. */
    public static StorageConfig preferences(Class<?> owner) {
        return keyValue(PreferencesKeyValueHandle.forClass(owner));
    }

    public static StorageConfig custom(CustomStorageBackend callbacks) {
        return new StorageConfig(StorageType.CUSTOM, null, null, callbacks);
    }

    public StorageBackend createBackend() {
        return switch (type) {
            case FILE -> new FileStorageBackend(location != null ? location : FileStorageBackend.defaultDir());
            case MEMORY -> new MemoryStorageBackend();
            case KEY_VALUE -> new KeyValueStorageBackend(handle);
            case CUSTOM -> custom;
        };
    }
}
