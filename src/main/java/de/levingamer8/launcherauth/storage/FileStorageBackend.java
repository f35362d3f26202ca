package de.levingamer8.launcherauth.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Set;

/**
 * Key and blob as two files in one directory. Directory 0700, files 0600 where the file
 * system understands POSIX permissions.
 */
public final class FileStorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(FileStorageBackend.class);

    public static final String ACCOUNTS_FILE = "accounts.json";
    public static final String KEY_FILE = ".key";

    private static final Set<PosixFilePermission> DIR_PERMS = PosixFilePermissions.fromString("rwx------");
    private static final Set<PosixFilePermission> FILE_PERMS = PosixFilePermissions.fromString("rw-------");

    private final Path dir;
    private final Path accountsFile;
    private final Path keyFile;

    public FileStorageBackend(Path dir) {
        this.dir = dir.toAbsolutePath().normalize();
        this.accountsFile = this.dir.resolve(ACCOUNTS_FILE);
        this.keyFile = this.dir.resolve(KEY_FILE);
    }

    public static Path defaultDir() {
        return Path.of(System.getProperty("user.home"), ".minecraft-launcher-accounts");
    }

    public Path dir() { return dir; }
    public Path accountsFile() { return accountsFile; }
    public Path keyFile() { return keyFile; }

    @Override
    public Optional<String> readBlob() throws StorageException {
        if (!Files.exists(accountsFile)) return Optional.empty();
        try {
            String json = Files.readString(accountsFile, StandardCharsets.UTF_8);
            return json.isBlank() ? Optional.empty() : Optional.of(json);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + accountsFile + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void writeBlob(String blob) throws StorageException {
        write(accountsFile, blob.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public Optional<byte[]> readKey() throws StorageException {
        if (!Files.exists(keyFile)) return Optional.empty();
        try {
            return Optional.of(Files.readAllBytes(keyFile));
        } catch (IOException e) {
            throw new StorageException("Failed to read " + keyFile + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void writeKey(byte[] key) throws StorageException {
        write(keyFile, key);
    }

    @Override
    public String location() {
        return dir.toString();
    }

    private void write(Path file, byte[] data) throws StorageException {
        try {
            ensureDir();
            if (!Files.exists(file) && isPosix()) {
                Files.createFile(file, PosixFilePermissions.asFileAttribute(FILE_PERMS));
            }
            Files.write(file, data, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            restrict(file, FILE_PERMS);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + file + ": " + e.getMessage(), e);
        }
    }

    private void ensureDir() throws IOException {
        if (Files.isDirectory(dir)) return;
        if (isPosix()) {
            Files.createDirectories(dir, PosixFilePermissions.asFileAttribute(DIR_PERMS));
            // umask kann die Rechte beim Anlegen verwaessern
            restrict(dir, DIR_PERMS);
        } else {
            Files.createDirectories(dir);
        }
    }

    private void restrict(Path path, Set<PosixFilePermission> perms) throws IOException {
        if (!isPosix()) {
            log.debug("No POSIX permissions on this file system, leaving {} as is", path);
            return;
        }
        Files.setPosixFilePermissions(path, perms);
    }

    private boolean isPosix() {
        return dir.getFileSystem().supportedFileAttributeViews().contains("posix");
    }
}
