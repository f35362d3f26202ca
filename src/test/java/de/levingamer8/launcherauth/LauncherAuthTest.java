package de.levingamer8.launcherauth;

import de.levingamer8.launcherauth.account.Account;
import de.levingamer8.launcherauth.account.AccountSummary;
import de.levingamer8.launcherauth.account.ProviderType;
import de.levingamer8.launcherauth.auth.AuthSettings;
import de.levingamer8.launcherauth.auth.AuthorizationUrl;
import de.levingamer8.launcherauth.http.StubHttpClient;
import de.levingamer8.launcherauth.storage.FileStorageBackend;
import de.levingamer8.launcherauth.storage.StorageConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class LauncherAuthTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private StubHttpClient stub;
    private LauncherAuth auth;

    @BeforeEach
    void setUp() {
        stub = new StubHttpClient();
        auth = new LauncherAuth(StorageConfig.memory(),
                AuthSettings.builder().microsoftClientId("client-id").build(), stub.client(), CLOCK);
    }

    private void stubMicrosoftLogin() {
        stub.on("/oauth20_token.srf", 200, "{\"access_token\":\"ms\",\"refresh_token\":\"ms-r\",\"expires_in\":3600}")
                .on("/user/authenticate", 200, "{\"Token\":\"xbl\",\"DisplayClaims\":{\"xui\":[{\"uhs\":\"h\"}]}}")
                .on("/xsts/authorize", 200, "{\"Token\":\"xsts\"}")
                .on("/authentication/login_with_xbox", 200, "{\"access_token\":\"mc\",\"expires_in\":86400}")
                .on("/minecraft/profile", 200, "{\"id\":\"ms-uuid\",\"name\":\"Steve\"}");
    }

    @Test
    void microsoftLogin_thenValidate_thenLogout() throws Exception {
        stubMicrosoftLogin();

        AuthorizationUrl url = auth.microsoftGenerateAuthUrl("http://localhost:8080/cb");
        assertThat(url.url()).contains("client_id=client-id");

        Account a = auth.microsoftAuthenticateWithCode("code", "http://localhost:8080/cb");
        assertThat(auth.getActiveAccount()).get().extracting(AccountSummary::uuid).isEqualTo(a.uuid());
        assertThat(auth.getAuthData()).get().extracting(Account::accessToken).isEqualTo("mc");

        int before = stub.requests().size();
        assertThat(auth.validateToken()).isTrue();
        assertThat(stub.requests()).hasSize(before);

        assertThat(auth.logoutAccount()).isTrue();
        assertThat(auth.getAccounts()).isEmpty();
    }

    @Test
    void mojangAndMicrosoftAccountsCoexist() throws Exception {
        stub.on("/authenticate", 200,
                "{\"accessToken\":\"acc\",\"clientToken\":\"c\",\"selectedProfile\":{\"id\":\"mj-uuid\",\"name\":\"Alice\"}}");
        stubMicrosoftLogin();

        auth.mojangAuthenticate("alice", "pw");
        auth.microsoftAuthenticateWithCode("code", "http://localhost/cb");

        assertThat(auth.getAccounts()).extracting(AccountSummary::uuid, AccountSummary::type, AccountSummary::active)
                .containsExactly(
                        tuple("mj-uuid", ProviderType.MOJANG, false),
                        tuple("ms-uuid", ProviderType.MICROSOFT, true));

        assertThat(auth.setActiveAccount("mj-uuid").isSuccess()).isTrue();
        assertThat(auth.getAuthData()).get().extracting(Account::uuid).isEqualTo("mj-uuid");
    }

    @Test
    void configureStorage_shouldDropLoadedAccounts(@TempDir Path dir) {
        auth.addAccount(Account.of("u1", "Alice", ProviderType.MOJANG, "acc", "client", null, null, null));
        assertThat(auth.getAccounts()).hasSize(1);

        auth.configureStorage(StorageConfig.file(dir));

        assertThat(auth.getAccounts()).isEmpty();
        assertThat(auth.store().backend()).isInstanceOf(FileStorageBackend.class);
        assertThat(dir.resolve(FileStorageBackend.KEY_FILE)).exists();
    }
}
