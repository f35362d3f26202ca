package de.levingamer8.launcherauth.storage;

import java.util.Optional;

/**
 * String key-value store owned by the host application, e.g. its own settings store.
 */
public interface KeyValueHandle {
    Optional<String> get(String key) throws StorageException;

    void put(String key, String value) throws StorageException;
}
