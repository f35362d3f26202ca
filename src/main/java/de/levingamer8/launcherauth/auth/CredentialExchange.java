package de.levingamer8.launcherauth.auth;

import de.levingamer8.launcherauth.account.Account;
import de.levingamer8.launcherauth.account.AuthUpdate;
import de.levingamer8.launcherauth.account.ProviderType;
import de.levingamer8.launcherauth.account.SecureAccountStore;
import de.levingamer8.launcherauth.account.StoreResult;
import de.levingamer8.launcherauth.http.ProviderHttp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Logs accounts in with Mojang or Microsoft and refreshes their tokens. Successful logins
 * end in {@link SecureAccountStore#addAccount}, refreshes in
 * {@link SecureAccountStore#updateAuthData}. No state is kept between calls.
 */
public class CredentialExchange {

    private static final Logger log = LoggerFactory.getLogger(CredentialExchange.class);

    private static final SecureRandom RANDOM = new SecureRandom();

    private final SecureAccountStore store;
    private final LegacyAuthClient mojang;
    private final MicrosoftAuthChain microsoft;
    private final AuthSettings settings;
    private final Clock clock;

    public CredentialExchange(SecureAccountStore store, AuthSettings settings) {
        this(store, new ProviderHttp(settings.requestTimeout()), settings, Clock.systemUTC());
    }

    public CredentialExchange(SecureAccountStore store, ProviderHttp http, AuthSettings settings, Clock clock) {
        this(store, new LegacyAuthClient(http, settings), new MicrosoftAuthChain(http, settings), settings, clock);
    }

    public CredentialExchange(SecureAccountStore store, LegacyAuthClient mojang, MicrosoftAuthChain microsoft,
                              AuthSettings settings, Clock clock) {
        this.store = store;
        this.mojang = mojang;
        this.microsoft = microsoft;
        this.settings = settings;
        this.clock = clock;
    }

    LegacyAuthClient mojang() {
        return mojang;
    }

    // ---------------- Mojang ----------------

    public Account mojangAuthenticate(String username, String password) throws AuthException, InterruptedException {
        if (isBlank(username) || isBlank(password)) {
            throw new AuthException(AuthFailure.VALIDATION, "Username and password are required");
        }

        String clientToken = randomHex(16);
        LegacyAuthClient.LegacySession s = mojang.authenticate(username, password, clientToken);

        Account account = Account.of(s.uuid(), s.username(), ProviderType.MOJANG,
                s.accessToken(), s.clientToken(), null, null, null);
        return save(account);
    }

    /**
     * Swaps the stored Mojang access token for a fresh one. Only the access token changes.
     */
    public Account refreshMojangToken(String uuid) throws AuthException, InterruptedException {
        Account current = require(uuid);
        if (current.type() != ProviderType.MOJANG) {
            throw new AuthException(AuthFailure.VALIDATION, "Account " + uuid + " is not a Mojang account");
        }

        LegacyAuthClient.LegacySession s = mojang.refresh(current.accessToken(), current.clientToken());
        update(uuid, AuthUpdate.accessToken(s.accessToken()));
        log.info("Refreshed Mojang token for {}", current.username());
        return require(uuid);
    }

    // ---------------- Microsoft ----------------

    public AuthorizationUrl microsoftGenerateAuthUrl(String redirectUri) throws AuthException {
        String clientId = settings.requireClientId();
        if (isBlank(redirectUri)) {
            throw new AuthException(AuthFailure.VALIDATION, "Redirect URI is required");
        }

        String state = randomHex(16);
        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", clientId);
        params.put("response_type", "code");
        params.put("redirect_uri", redirectUri);
        params.put("scope", AuthSettings.SCOPES);
        params.put("state", state);

        return new AuthorizationUrl(settings.microsoftAuthorizeUrl() + "?" + ProviderHttp.form(params), state);
    }

    public Account microsoftAuthenticateWithCode(String code, String redirectUri)
            throws AuthException, InterruptedException {
        if (isBlank(code) || isBlank(redirectUri)) {
            throw new AuthException(AuthFailure.VALIDATION, "Authorization code and redirect URI are required");
        }
        String clientId = settings.requireClientId();

        MicrosoftAuthChain.MicrosoftToken ms = microsoft.exchangeCode(clientId, code, redirectUri);
        MicrosoftAuthChain.XboxToken xbl = microsoft.xboxLive(ms);
        MicrosoftAuthChain.XstsToken xsts = microsoft.xsts(xbl);
        MicrosoftAuthChain.MinecraftToken mc = microsoft.loginWithXbox(xbl, xsts);
        MicrosoftAuthChain.MinecraftProfile profile = microsoft.profile(mc);

        Account account = Account.of(profile.id(), profile.name(), ProviderType.MICROSOFT,
                mc.accessToken(), UUID.randomUUID().toString(), ms.refreshToken(),
                expiresAt(ms), profile.rawJson());
        return save(account);
    }

    /**
     * Runs the chain again from the stored refresh token and writes back access token,
     * refresh token and expiry. Profile and username are left alone.
     */
    public Account refreshMicrosoftToken(String uuid) throws AuthException, InterruptedException {
        Account current = require(uuid);
        if (isBlank(current.refreshToken())) {
            throw new AuthException(AuthFailure.NO_REFRESH_TOKEN, "No refresh token available");
        }
        String clientId = settings.requireClientId();

        MicrosoftAuthChain.MicrosoftToken ms = microsoft.refresh(clientId, current.refreshToken());
        MicrosoftAuthChain.XboxToken xbl = microsoft.xboxLive(ms);
        MicrosoftAuthChain.XstsToken xsts = microsoft.xsts(xbl);
        MicrosoftAuthChain.MinecraftToken mc = microsoft.loginWithXbox(xbl, xsts);

        // MS rotiert den Refresh-Token nicht immer; null laesst den alten stehen
        update(uuid, AuthUpdate.tokens(mc.accessToken(), ms.refreshToken(), expiresAt(ms)));
        log.info("Refreshed Microsoft token for {}", current.username());
        return require(uuid);
    }

    // ---------------- helpers ----------------

    /** Expiry from the lifetime the Microsoft token endpoint reports. */
    private Instant expiresAt(MicrosoftAuthChain.MicrosoftToken ms) {
        return clock.instant().plusSeconds(ms.expiresInSec());
    }

    private Account save(Account account) throws AuthException {
        StoreResult r = store.addAccount(account);
        if (!r.isSuccess()) {
            throw new AuthException(AuthFailure.STORAGE, "Failed to save account: " + r.message(), r.cause());
        }
        log.info("Logged in {} account {}", account.type().id(), account.username());
        return store.getAuthData(account.uuid()).orElse(account);
    }

    private void update(String uuid, AuthUpdate update) throws AuthException {
        StoreResult r = store.updateAuthData(uuid, update);
        if (r.status() == StoreResult.Status.NOT_FOUND) {
            throw new AuthException(AuthFailure.NOT_FOUND, "Account " + uuid + " was removed during refresh");
        }
        if (!r.isSuccess()) {
            throw new AuthException(AuthFailure.STORAGE, "Failed to update account auth data: " + r.message(), r.cause());
        }
    }

    private Account require(String uuid) throws AuthException {
        if (isBlank(uuid)) {
            throw new AuthException(AuthFailure.VALIDATION, "Account uuid is required");
        }
        return store.getAuthData(uuid)
                .orElseThrow(() -> new AuthException(AuthFailure.NOT_FOUND, "No account with uuid " + uuid));
    }

    private static String randomHex(int bytes) {
        byte[] b = new byte[bytes];
        RANDOM.nextBytes(b);
        return HexFormat.of().formatHex(b);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
