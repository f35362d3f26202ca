package de.levingamer8.launcherauth.storage;

public enum StorageType {
    FILE, MEMORY, KEY_VALUE, CUSTOM
}
