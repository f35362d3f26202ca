package de.levingamer8.launcherauth.account;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.levingamer8.launcherauth.storage.CustomStorageBackend;
import de.levingamer8.launcherauth.storage.FileStorageBackend;
import de.levingamer8.launcherauth.storage.MemoryStorageBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

class SecureAccountStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private MemoryStorageBackend backend;
    private SecureAccountStore store;

    @BeforeEach
    void setUp() {
        backend = new MemoryStorageBackend();
        store = new SecureAccountStore(backend, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    static Account mojang(String uuid, String name) {
        return Account.of(uuid, name, ProviderType.MOJANG, "access-" + uuid, "client-" + uuid, null, null, null);
    }

    static Account microsoft(String uuid, String name, Instant expiresAt) {
        return Account.of(uuid, name, ProviderType.MICROSOFT, "mc-" + uuid, "session-" + uuid,
                "refresh-" + uuid, expiresAt, "{\"id\":\"" + uuid + "\"}");
    }

    private long activeCount() {
        return store.getAccounts().stream().filter(AccountSummary::active).count();
    }

    // ========================================
    // ADD / REPLACE
    // ========================================

    @Test
    @DisplayName("add A, add B, add A' -> two accounts, A' first and active, B inactive")
    void addAccount_shouldReplaceInPlace_whenUuidExists() {
        store.addAccount(mojang("a", "Alice"));
        store.addAccount(mojang("b", "Bob"));

        Account aPrime = Account.of("a", "Alice2", ProviderType.MOJANG, "new-access", "new-client", null, null, null);
        StoreResult r = store.addAccount(aPrime);

        assertThat(r.isSuccess()).isTrue();
        List<AccountSummary> all = store.getAccounts();
        assertThat(all).extracting(AccountSummary::uuid).containsExactly("a", "b");
        assertThat(all.get(0).username()).isEqualTo("Alice2");
        assertThat(all.get(0).active()).isTrue();
        assertThat(all.get(1).active()).isFalse();
        assertThat(store.getAuthData("a")).get().extracting(Account::accessToken).isEqualTo("new-access");
    }

    @Test
    @DisplayName("new account becomes active and deactivates the others")
    void addAccount_shouldActivateNewAccount() {
        store.addAccount(mojang("a", "Alice"));
        store.addAccount(mojang("b", "Bob"));

        assertThat(store.getActiveAccount()).get().extracting(AccountSummary::uuid).isEqualTo("b");
        assertThat(activeCount()).isEqualTo(1);
        assertThat(store.getAccounts().get(1).lastUsed()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("records without uuid, accessToken or clientToken are rejected")
    void addAccount_shouldRejectIncompleteRecords() {
        assertThat(store.addAccount(null).status()).isEqualTo(StoreResult.Status.INVALID);
        assertThat(store.addAccount(Account.of(null, "x", ProviderType.MOJANG, "t", "c", null, null, null)).status())
                .isEqualTo(StoreResult.Status.INVALID);
        assertThat(store.addAccount(Account.of("u", "x", ProviderType.MOJANG, "", "c", null, null, null)).status())
                .isEqualTo(StoreResult.Status.INVALID);
        assertThat(store.addAccount(Account.of("u", "x", ProviderType.MOJANG, "t", null, null, null, null)).status())
                .isEqualTo(StoreResult.Status.INVALID);
        assertThat(store.getAccounts()).isEmpty();
    }

    @Test
    void addAccount_shouldDefaultMissingTypeToMojang() {
        store.addAccount(Account.of("u", "x", null, "t", "c", null, null, null));

        assertThat(store.getAccounts().get(0).type()).isEqualTo(ProviderType.MOJANG);
    }

    // ========================================
    // REMOVE / ACTIVATE
    // ========================================

    @Test
    @DisplayName("removing the active account promotes the first remaining one")
    void removeAccount_shouldPromoteFirstRemaining() {
        store.addAccount(mojang("a", "Alice"));
        store.addAccount(mojang("b", "Bob"));
        store.addAccount(mojang("c", "Carol"));   // active

        assertThat(store.removeAccount("c").isSuccess()).isTrue();

        assertThat(store.getActiveAccount()).get().extracting(AccountSummary::uuid).isEqualTo("a");
        assertThat(activeCount()).isEqualTo(1);
    }

    @Test
    void removeAccount_shouldKeepActive_whenRemovingInactive() {
        store.addAccount(mojang("a", "Alice"));
        store.addAccount(mojang("b", "Bob"));

        store.removeAccount("a");

        assertThat(store.getActiveAccount()).get().extracting(AccountSummary::uuid).isEqualTo("b");
    }

    @Test
    void removeAccount_shouldReportNotFound_forUnknownUuid() {
        store.addAccount(mojang("a", "Alice"));

        assertThat(store.removeAccount("zzz").status()).isEqualTo(StoreResult.Status.NOT_FOUND);
        assertThat(store.getAccounts()).hasSize(1);
    }

    @Test
    void removeAccount_shouldLeaveNoActive_whenStoreBecomesEmpty() {
        store.addAccount(mojang("a", "Alice"));

        store.removeAccount("a");

        assertThat(store.getAccounts()).isEmpty();
        assertThat(store.getActiveAccount()).isEmpty();
        assertThat(store.getAuthData()).isEmpty();
    }

    @Test
    void setActiveAccount_shouldFlipExactlyOne() {
        store.addAccount(mojang("a", "Alice"));
        store.addAccount(mojang("b", "Bob"));

        assertThat(store.setActiveAccount("a").isSuccess()).isTrue();
        assertThat(store.getActiveAccount()).get().extracting(AccountSummary::uuid).isEqualTo("a");
        assertThat(activeCount()).isEqualTo(1);

        assertThat(store.setActiveAccount("nope").status()).isEqualTo(StoreResult.Status.NOT_FOUND);
        assertThat(store.getActiveAccount()).get().extracting(AccountSummary::uuid).isEqualTo("a");
    }

    @Test
    @DisplayName("any sequence of add/remove/activate keeps exactly one active account while non-empty")
    void activeInvariant_shouldHoldForRandomSequences() {
        Random random = new Random(7);
        String[] ids = {"a", "b", "c", "d"};

        for (int step = 0; step < 500; step++) {
            String id = ids[random.nextInt(ids.length)];
            switch (random.nextInt(3)) {
                case 0 -> store.addAccount(mojang(id, id.toUpperCase()));
                case 1 -> store.removeAccount(id);
                default -> store.setActiveAccount(id);
            }
            int size = store.getAccounts().size();
            assertThat(activeCount()).as("step %d", step).isEqualTo(size == 0 ? 0 : 1);
            assertThat(store.getAccounts()).extracting(AccountSummary::uuid).doesNotHaveDuplicates();
        }
    }

    // ========================================
    // READS / UPDATES
    // ========================================

    @Test
    @DisplayName("listings carry no tokens, getAuthData does")
    void getAccounts_shouldNotExposeSecrets() {
        store.addAccount(microsoft("m", "Steve", NOW.plusSeconds(3600)));

        AccountSummary summary = store.getAccounts().get(0);
        assertThat(AccountSummary.class.getRecordComponents())
                .extracting(c -> c.getName())
                .containsExactly("uuid", "username", "type", "active", "lastUsed");
        assertThat(summary.toString()).doesNotContain("mc-m", "session-m", "refresh-m");

        Account full = store.getAuthData("m").orElseThrow();
        assertThat(full.accessToken()).isEqualTo("mc-m");
        assertThat(full.clientToken()).isEqualTo("session-m");
        assertThat(full.refreshToken()).isEqualTo("refresh-m");
        assertThat(full.toString()).doesNotContain("mc-m", "session-m", "refresh-m");
    }

    @Test
    void getAuthData_withoutUuid_shouldReturnActive() {
        store.addAccount(mojang("a", "Alice"));
        store.addAccount(mojang("b", "Bob"));

        assertThat(store.getAuthData()).get().extracting(Account::uuid).isEqualTo("b");
        assertThat(store.getAuthData(null)).get().extracting(Account::uuid).isEqualTo("b");
        assertThat(store.getAuthData("missing")).isEmpty();
    }

    @Test
    @DisplayName("updateAuthData only touches the fields that are set")
    void updateAuthData_shouldApplyPartialUpdate() {
        store.addAccount(microsoft("m", "Steve", NOW.plusSeconds(60)));
        Instant later = NOW.plusSeconds(86400);

        StoreResult r = store.updateAuthData("m", AuthUpdate.tokens("mc-new", null, later));

        assertThat(r.isSuccess()).isTrue();
        Account a = store.getAuthData("m").orElseThrow();
        assertThat(a.accessToken()).isEqualTo("mc-new");
        assertThat(a.refreshToken()).isEqualTo("refresh-m");
        assertThat(a.expiresAt()).isEqualTo(later);
        assertThat(a.profile()).isEqualTo("{\"id\":\"m\"}");
        assertThat(a.username()).isEqualTo("Steve");
        assertThat(a.clientToken()).isEqualTo("session-m");
        assertThat(a.active()).isTrue();

        assertThat(store.updateAuthData("ghost", AuthUpdate.accessToken("x")).status())
                .isEqualTo(StoreResult.Status.NOT_FOUND);
    }

    // ========================================
    // PERSISTENCE
    // ========================================

    @Nested
    class Persistence {

        @TempDir
        Path tmp;

        @Test
        @DisplayName("a second store on the same directory sees the same accounts")
        void shouldReloadFromFileBackend() {
            SecureAccountStore first = new SecureAccountStore(new FileStorageBackend(tmp));
            first.addAccount(mojang("a", "Alice"));
            first.addAccount(microsoft("m", "Steve", NOW.plusSeconds(3600)));
            first.setActiveAccount("a");

            SecureAccountStore second = new SecureAccountStore(new FileStorageBackend(tmp));

            assertThat(second.getAccounts()).extracting(AccountSummary::uuid).containsExactly("a", "m");
            assertThat(second.getActiveAccount()).get().extracting(AccountSummary::uuid).isEqualTo("a");
            Account m = second.getAuthData("m").orElseThrow();
            assertThat(m.type()).isEqualTo(ProviderType.MICROSOFT);
            assertThat(m.expiresAt()).isEqualTo(NOW.plusSeconds(3600));
            assertThat(m.refreshToken()).isEqualTo("refresh-m");
        }

        @Test
        @DisplayName("accounts.json is an {iv, encrypted, authTag} hex envelope without any plaintext token")
        void shouldWriteEncryptedEnvelope() throws Exception {
            FileStorageBackend files = new FileStorageBackend(tmp);
            new SecureAccountStore(files).addAccount(mojang("a", "Alice"));

            String json = Files.readString(files.accountsFile());
            JsonNode node = new ObjectMapper().readTree(json);
            assertThat(node.fieldNames()).toIterable().containsExactlyInAnyOrder("iv", "encrypted", "authTag");
            assertThat(node.get("iv").asText()).matches("[0-9a-f]{32}");
            assertThat(node.get("authTag").asText()).matches("[0-9a-f]{32}");
            assertThat(json).doesNotContain("access-a", "Alice");
            assertThat(Files.readAllBytes(files.keyFile())).hasSize(32);
        }

        @Test
        @DisplayName("initialize on an empty location writes an encrypted empty list")
        void initialize_shouldCreateKeyAndEmptyBlob() {
            FileStorageBackend files = new FileStorageBackend(tmp);

            assertThat(new SecureAccountStore(files).initialize().isSuccess()).isTrue();

            assertThat(Files.exists(files.keyFile())).isTrue();
            assertThat(Files.exists(files.accountsFile())).isTrue();
        }

        @Test
        @DisplayName("a blob that fails authentication resets the store to empty instead of failing")
        void initialize_shouldResetOnCorruptBlob() throws Exception {
            FileStorageBackend files = new FileStorageBackend(tmp);
            new SecureAccountStore(files).addAccount(mojang("a", "Alice"));

            JsonNode node = new ObjectMapper().readTree(Files.readString(files.accountsFile()));
            String tag = node.get("authTag").asText();
            String flipped = (tag.charAt(0) == '0' ? "1" : "0") + tag.substring(1);
            Files.writeString(files.accountsFile(),
                    "{\"iv\":\"" + node.get("iv").asText() + "\",\"encrypted\":\"" + node.get("encrypted").asText()
                            + "\",\"authTag\":\"" + flipped + "\"}");

            SecureAccountStore reopened = new SecureAccountStore(files);
            assertThat(reopened.initialize().isSuccess()).isTrue();
            assertThat(reopened.getAccounts()).isEmpty();

            // und bleibt benutzbar
            assertThat(reopened.addAccount(mojang("b", "Bob")).isSuccess()).isTrue();
            assertThat(new SecureAccountStore(files).getAccounts()).extracting(AccountSummary::uuid).containsExactly("b");
        }

        @Test
        void initialize_shouldResetOnGarbageBlob() throws Exception {
            FileStorageBackend files = new FileStorageBackend(tmp);
            files.writeKey(new byte[32]);
            files.writeBlob("this is not json");

            SecureAccountStore s = new SecureAccountStore(files);

            assertThat(s.initialize().isSuccess()).isTrue();
            assertThat(s.getAccounts()).isEmpty();
        }

        @Test
        void initialize_shouldFail_whenStoredKeyHasWrongLength() throws Exception {
            FileStorageBackend files = new FileStorageBackend(tmp);
            files.writeKey(new byte[10]);

            SecureAccountStore s = new SecureAccountStore(files);

            assertThat(s.initialize().status()).isEqualTo(StoreResult.Status.FAILED);
            assertThat(s.addAccount(mojang("a", "Alice")).status()).isEqualTo(StoreResult.Status.FAILED);
            assertThat(s.getAccounts()).isEmpty();
        }
    }

    @Test
    @DisplayName("reconfigure drops loaded accounts and does not copy them to the new backend")
    void reconfigure_shouldStartFromNewBackend() {
        store.addAccount(mojang("a", "Alice"));
        MemoryStorageBackend other = new MemoryStorageBackend();

        store.reconfigure(other);

        assertThat(store.getAccounts()).isEmpty();
        assertThat(store.backend()).isSameAs(other);

        store.reconfigure(backend);
        assertThat(store.getAccounts()).extracting(AccountSummary::uuid).containsExactly("a");
    }

    @Test
    @DisplayName("a failed write reports FAILED and leaves the in-memory list as it was")
    void mutation_shouldRollBack_whenWriteFails() {
        AtomicBoolean broken = new AtomicBoolean(false);
        List<String> written = new ArrayList<>();
        SecureAccountStore s = new SecureAccountStore(CustomStorageBackend.builder()
                .writeBlob(blob -> {
                    if (broken.get()) throw new IllegalStateException("disk full");
                    written.add(blob);
                })
                .build());
        s.addAccount(mojang("a", "Alice"));

        broken.set(true);
        StoreResult r = s.addAccount(mojang("b", "Bob"));

        assertThat(r.status()).isEqualTo(StoreResult.Status.FAILED);
        assertThat(r.cause()).hasMessageContaining("disk full");
        assertThat(s.getAccounts()).extracting(AccountSummary::uuid).containsExactly("a");
        assertThat(s.getActiveAccount()).get().extracting(AccountSummary::uuid).isEqualTo("a");

        broken.set(false);
        assertThat(s.addAccount(mojang("b", "Bob")).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("a custom backend with no callbacks still works for the life of the store")
    void shouldWorkWithEmptyCustomBackend() {
        SecureAccountStore s = new SecureAccountStore(CustomStorageBackend.builder().build());

        assertThat(s.addAccount(mojang("a", "Alice")).isSuccess()).isTrue();
        assertThat(s.getAccounts()).hasSize(1);
    }
}
