package de.levingamer8.launcherauth.storage;

import java.util.Objects;
import java.util.Optional;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * {@link KeyValueHandle} over a {@link Preferences} node, the store the launcher already
 * keeps its settings in.
 */
public final class PreferencesKeyValueHandle implements KeyValueHandle {

    // Preferences kappt Werte bei MAX_VALUE_LENGTH (8 KB); darueber wird gestueckelt.
    private static final int CHUNK = Preferences.MAX_VALUE_LENGTH;
    private static final String CHUNKS_SUFFIX = ".chunks";

    private final Preferences node;

    public PreferencesKeyValueHandle(Preferences node) {
        this.node = Objects.requireNonNull(node, "node");
    }

    public static PreferencesKeyValueHandle forClass(Class<?> owner) {
        return new PreferencesKeyValueHandle(Preferences.userNodeForPackage(owner).node("accounts"));
    }

    @Override
    public Optional<String> get(String key) throws StorageException {
        try {
            int chunks = node.getInt(key + CHUNKS_SUFFIX, 0);
            if (chunks == 0) return Optional.ofNullable(node.get(key, null));

            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < chunks; i++) {
                String part = node.get(key + "." + i, null);
                if (part == null) {
                    throw new StorageException("Preferences entry '" + key + "' is missing chunk " + i);
                }
                sb.append(part);
            }
            return Optional.of(sb.toString());
        } catch (IllegalStateException e) {
            throw new StorageException("Preferences node " + node.absolutePath() + " was removed", e);
        }
    }

    @Override
    public void put(String key, String value) throws StorageException {
        try {
            clearChunks(key);
            if (value.length() <= CHUNK) {
                node.put(key, value);
            } else {
                node.remove(key);
                int chunks = (value.length() + CHUNK - 1) / CHUNK;
                for (int i = 0; i < chunks; i++) {
                    node.put(key + "." + i, value.substring(i * CHUNK, Math.min(value.length(), (i + 1) * CHUNK)));
                }
                node.putInt(key + CHUNKS_SUFFIX, chunks);
            }
            node.flush();
        } catch (BackingStoreException | IllegalStateException e) {
            throw new StorageException("Failed to write preferences entry '" + key + "': " + e.getMessage(), e);
        }
    }

    private void clearChunks(String key) {
        int chunks = node.getInt(key + CHUNKS_SUFFIX, 0);
        for (int i = 0; i < chunks; i++) {
            node.remove(key + "." + i);
        }
        node.remove(key + CHUNKS_SUFFIX);
    }
}
