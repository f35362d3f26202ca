package de.levingamer8.launcherauth.account;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import de.levingamer8.launcherauth.crypto.CryptoEnvelope;
import de.levingamer8.launcherauth.crypto.CryptoException;
import de.levingamer8.launcherauth.storage.StorageBackend;
import de.levingamer8.launcherauth.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Encrypted list of accounts with at most one active entry.
 *
 * <p>The whole list is re-encrypted and written on every mutation. Mutators report
 * through {@link StoreResult} and log the cause; if the write fails the in-memory list is
 * rolled back so a retry starts from what is on disk.
 *
 * <p>Initialisation is lazy: the first call loads (or creates) the key and decrypts the
 * blob. A blob that does not decrypt is treated as corrupt and the store starts empty.
 */
public final class SecureAccountStore {

    private static final Logger log = LoggerFactory.getLogger(SecureAccountStore.class);

    private static final TypeReference<List<Account>> ACCOUNT_LIST = new TypeReference<>() {};

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private final EnvelopeCodec codec = new EnvelopeCodec(om);
    private final Clock clock;

    private StorageBackend backend;
    private byte[] key;
    private List<Account> accounts = new ArrayList<>();

    public SecureAccountStore(StorageBackend backend) {
        this(backend, Clock.systemUTC());
    }

    public SecureAccountStore(StorageBackend backend, Clock clock) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized StorageBackend backend() {
        return backend;
    }

    /**
     * Drops the loaded key and accounts and switches to another backend. Nothing is copied
     * over; the next call initialises against the new backend.
     */
    public synchronized void reconfigure(StorageBackend newBackend) {
        Objects.requireNonNull(newBackend, "newBackend");
        log.info("Account storage switched from {} to {}", backend.location(), newBackend.location());
        this.backend = newBackend;
        this.key = null;
        this.accounts = new ArrayList<>();
    }

    public synchronized StoreResult initialize() {
        if (key != null) return StoreResult.ok();

        byte[] k;
        try {
            Optional<byte[]> stored = backend.readKey();
            if (stored.isPresent()) {
                k = stored.get();
                if (k.length != CryptoEnvelope.KEY_LENGTH) {
                    log.error("Encryption key at {} has {} bytes, expected {}", backend.location(), k.length, CryptoEnvelope.KEY_LENGTH);
                    return StoreResult.failed("Encryption key has wrong length", null);
                }
            } else {
                k = CryptoEnvelope.generateKey();
                backend.writeKey(k);
                log.info("Generated new encryption key at {}", backend.location());
            }
        } catch (StorageException e) {
            log.error("Error initializing account storage at {}: {}", backend.location(), e.getMessage());
            return StoreResult.failed("Could not initialize account storage", e);
        }

        List<Account> loaded = new ArrayList<>();
        boolean writeEmpty = false;
        try {
            Optional<String> blob = backend.readBlob();
            if (blob.isPresent()) {
                loaded = decode(blob.get(), k);
            } else {
                writeEmpty = true;
            }
        } catch (StorageException e) {
            log.error("Error reading accounts from {}: {}", backend.location(), e.getMessage());
            return StoreResult.failed("Could not read account storage", e);
        } catch (CryptoException | IOException e) {
            log.warn("Stored accounts at {} could not be decrypted, starting with an empty list: {}",
                    backend.location(), e.getMessage());
        }

        if (writeEmpty) {
            try {
                backend.writeBlob(encode(List.of(), k));
            } catch (StorageException | CryptoException e) {
                log.error("Error writing empty account list to {}: {}", backend.location(), e.getMessage());
                return StoreResult.failed("Could not initialize account storage", e);
            }
        }

        this.key = k;
        this.accounts = normalizeActive(loaded);
        log.debug("Account storage ready at {} with {} account(s)", backend.location(), accounts.size());
        return StoreResult.ok();
    }

    /**
     * Adds or replaces (same uuid, same position) an account and makes it the active one.
     */
    public synchronized StoreResult addAccount(Account account) {
        if (account == null || isBlank(account.uuid()) || isBlank(account.accessToken()) || isBlank(account.clientToken())) {
            log.warn("Rejected account without uuid, accessToken or clientToken");
            return StoreResult.invalid("Invalid authentication data");
        }
        StoreResult init = initialize();
        if (!init.isSuccess()) return init;

        Instant now = clock.instant();
        Account stamped = account.stamped(true, now);

        List<Account> next = new ArrayList<>(accounts.size() + 1);
        boolean replaced = false;
        for (Account a : accounts) {
            if (a.uuid().equals(stamped.uuid())) {
                next.add(stamped);
                replaced = true;
            } else {
                next.add(a.withActive(false));
            }
        }
        if (!replaced) next.add(stamped);

        StoreResult r = commit(next, "adding account " + stamped.uuid());
        if (r.isSuccess()) {
            log.info("{} account {} ({})", replaced ? "Updated" : "Added", stamped.username(), stamped.type());
        }
        return r;
    }

    public synchronized StoreResult removeAccount(String uuid) {
        StoreResult init = initialize();
        if (!init.isSuccess()) return init;

        int idx = indexOf(uuid);
        if (idx < 0) return StoreResult.notFound(uuid);

        List<Account> next = new ArrayList<>(accounts);
        Account removed = next.remove(idx);
        if (removed.active() && !next.isEmpty()) {
            next.set(0, next.get(0).withActive(true));
        }

        StoreResult r = commit(next, "removing account " + uuid);
        if (r.isSuccess()) log.info("Removed account {}", removed.username());
        return r;
    }

    public synchronized List<AccountSummary> getAccounts() {
        if (!initialize().isSuccess()) return List.of();
        return accounts.stream().map(Account::summary).toList();
    }

    public synchronized Optional<AccountSummary> getActiveAccount() {
        return active().map(Account::summary);
    }

    public synchronized StoreResult setActiveAccount(String uuid) {
        StoreResult init = initialize();
        if (!init.isSuccess()) return init;
        if (indexOf(uuid) < 0) return StoreResult.notFound(uuid);

        List<Account> next = new ArrayList<>(accounts.size());
        for (Account a : accounts) {
            next.add(a.withActive(a.uuid().equals(uuid)));
        }
        return commit(next, "activating account " + uuid);
    }

    /** Full record of the active account, tokens included. */
    public synchronized Optional<Account> getAuthData() {
        return active();
    }

    /** Full record for {@code uuid}, or for the active account if {@code uuid} is null. */
    public synchronized Optional<Account> getAuthData(String uuid) {
        if (uuid == null) return active();
        if (!initialize().isSuccess()) return Optional.empty();
        int idx = indexOf(uuid);
        return idx < 0 ? Optional.empty() : Optional.of(accounts.get(idx));
    }

    public synchronized StoreResult updateAuthData(String uuid, AuthUpdate update) {
        Objects.requireNonNull(update, "update");
        StoreResult init = initialize();
        if (!init.isSuccess()) return init;

        int idx = indexOf(uuid);
        if (idx < 0) return StoreResult.notFound(uuid);

        List<Account> next = new ArrayList<>(accounts);
        next.set(idx, accounts.get(idx).apply(update, clock.instant()));
        return commit(next, "updating account " + uuid);
    }

    // ---------------- helpers ----------------

    private Optional<Account> active() {
        if (!initialize().isSuccess()) return Optional.empty();
        return accounts.stream().filter(Account::active).findFirst();
    }

    private int indexOf(String uuid) {
        if (uuid == null) return -1;
        for (int i = 0; i < accounts.size(); i++) {
            if (accounts.get(i).uuid().equals(uuid)) return i;
        }
        return -1;
    }

    private StoreResult commit(List<Account> next, String what) {
        try {
            backend.writeBlob(encode(next, key));
        } catch (StorageException | CryptoException e) {
            log.error("Error saving accounts while {}: {}", what, e.getMessage());
            return StoreResult.failed("Failed to save accounts", e);
        }
        accounts = next;
        return StoreResult.ok();
    }

    private String encode(List<Account> list, byte[] k) throws CryptoException {
        byte[] plain;
        try {
            plain = om.writeValueAsBytes(list);
        } catch (JsonProcessingException e) {
            throw new CryptoException("Failed to serialize accounts: " + e.getOriginalMessage(), e);
        }
        return codec.toJson(CryptoEnvelope.encrypt(plain, k));
    }

    private List<Account> decode(String blob, byte[] k) throws CryptoException, IOException {
        byte[] plain = CryptoEnvelope.decrypt(codec.fromJson(blob), k);
        List<Account> list = om.readValue(plain, ACCOUNT_LIST);
        return list == null ? new ArrayList<>() : new ArrayList<>(list);
    }

    private static List<Account> normalizeActive(List<Account> list) {
        List<Account> out = new ArrayList<>(list.size());
        boolean seen = false;
        for (Account a : list) {
            if (a == null || a.uuid() == null) continue;
            if (a.active() && seen) {
                out.add(a.withActive(false));
            } else {
                seen |= a.active();
                out.add(a);
            }
        }
        return out;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
