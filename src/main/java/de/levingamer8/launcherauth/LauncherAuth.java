package de.levingamer8.launcherauth;

import de.levingamer8.launcherauth.account.Account;
import de.levingamer8.launcherauth.account.AccountSummary;
import de.levingamer8.launcherauth.account.AuthUpdate;
import de.levingamer8.launcherauth.account.SecureAccountStore;
import de.levingamer8.launcherauth.account.StoreResult;
import de.levingamer8.launcherauth.auth.AuthException;
import de.levingamer8.launcherauth.auth.AuthSettings;
import de.levingamer8.launcherauth.auth.AuthorizationUrl;
import de.levingamer8.launcherauth.auth.CredentialExchange;
import de.levingamer8.launcherauth.auth.TokenLifecycleManager;
import de.levingamer8.launcherauth.http.ProviderHttp;
import de.levingamer8.launcherauth.storage.StorageConfig;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for the launcher: account list, logins, token checks and storage setup.
 *
 * <p>Skin, cape and version lookups only need {@link #getAuthData} and
 * {@link #getActiveAccount}.
 */
public final class LauncherAuth {

    private final SecureAccountStore store;
    private final CredentialExchange exchange;
    private final TokenLifecycleManager lifecycle;

    /** File storage in the default location, client id from the environment. */
    public LauncherAuth() {
        this(StorageConfig.defaults(), AuthSettings.fromEnvironment());
    }

    public LauncherAuth(StorageConfig storage, AuthSettings settings) {
        this(storage, settings, new ProviderHttp(settings.requestTimeout()), Clock.systemUTC());
    }

    public LauncherAuth(StorageConfig storage, AuthSettings settings, HttpClient http, Clock clock) {
        this(storage, settings, new ProviderHttp(http, settings.requestTimeout()), clock);
    }

    private LauncherAuth(StorageConfig storage, AuthSettings settings, ProviderHttp http, Clock clock) {
        this.store = new SecureAccountStore(storage.createBackend(), clock);
        this.exchange = new CredentialExchange(store, http, settings, clock);
        this.lifecycle = new TokenLifecycleManager(store, exchange, clock);
    }

    /** Accounts in the user Preferences, next to the launcher's other settings. */
    public static StorageConfig preferencesStorage() {
        return StorageConfig.preferences(LauncherAuth.class);
    }

    /**
     * Switches the storage backend. Loaded accounts are dropped, not migrated.
     */
    public void configureStorage(StorageConfig storage) {
        store.reconfigure(storage.createBackend());
    }

    public SecureAccountStore store() {
        return store;
    }

    // ---- accounts ----

    public StoreResult addAccount(Account account) { return store.addAccount(account); }
    public StoreResult removeAccount(String uuid) { return store.removeAccount(uuid); }
    public List<AccountSummary> getAccounts() { return store.getAccounts(); }
    public Optional<AccountSummary> getActiveAccount() { return store.getActiveAccount(); }
    public StoreResult setActiveAccount(String uuid) { return store.setActiveAccount(uuid); }
    public Optional<Account> getAuthData() { return store.getAuthData(); }
    public Optional<Account> getAuthData(String uuid) { return store.getAuthData(uuid); }
    public StoreResult updateAuthData(String uuid, AuthUpdate update) { return store.updateAuthData(uuid, update); }

    // ---- auth ----

    public Account mojangAuthenticate(String username, String password) throws AuthException, InterruptedException {
        return exchange.mojangAuthenticate(username, password);
    }

    public Account refreshMojangToken(String uuid) throws AuthException, InterruptedException {
        return exchange.refreshMojangToken(uuid);
    }

    public AuthorizationUrl microsoftGenerateAuthUrl(String redirectUri) throws AuthException {
        return exchange.microsoftGenerateAuthUrl(redirectUri);
    }

    public Account microsoftAuthenticateWithCode(String code, String redirectUri) throws AuthException, InterruptedException {
        return exchange.microsoftAuthenticateWithCode(code, redirectUri);
    }

    public Account refreshMicrosoftToken(String uuid) throws AuthException, InterruptedException {
        return exchange.refreshMicrosoftToken(uuid);
    }

    /** {@code null} checks the active account. */
    public boolean validateToken(String uuid) throws AuthException, InterruptedException {
        return lifecycle.validateToken(uuid);
    }

    public boolean validateToken() throws AuthException, InterruptedException {
        return lifecycle.validateToken(null);
    }

    /** {@code null} logs out the active account. */
    public boolean logoutAccount(String uuid) {
        return lifecycle.logoutAccount(uuid);
    }

    public boolean logoutAccount() {
        return lifecycle.logoutAccount(null);
    }
}
