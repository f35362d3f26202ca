package de.levingamer8.launcherauth.auth;

import de.levingamer8.launcherauth.account.Account;
import de.levingamer8.launcherauth.account.ProviderType;
import de.levingamer8.launcherauth.account.SecureAccountStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Validation and logout of stored accounts. A {@code null} uuid means the active account.
 */
public class TokenLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(TokenLifecycleManager.class);

    private final SecureAccountStore store;
    private final CredentialExchange exchange;
    private final LegacyAuthClient mojang;
    private final Clock clock;

    public TokenLifecycleManager(SecureAccountStore store, CredentialExchange exchange, Clock clock) {
        this.store = store;
        this.exchange = exchange;
        this.mojang = exchange.mojang();
        this.clock = clock;
    }

    /**
     * Whether the account's access token can be used right now.
     *
     * <p>Microsoft tokens that have not expired are valid without a network call; expired ones
     * are refreshed and count as valid if that works. Mojang tokens are checked with the auth
     * server. Returns false if there is no active account.
     *
     * @throws AuthException NOT_FOUND for an unknown uuid; TIMEOUT, NETWORK, CONFIGURATION or
     *                       STORAGE when the answer could not be determined
     */
    public boolean validateToken(String uuid) throws AuthException, InterruptedException {
        Optional<Account> found = store.getAuthData(uuid);
        if (found.isEmpty()) {
            if (uuid != null) throw new AuthException(AuthFailure.NOT_FOUND, "No account with uuid " + uuid);
            return false;
        }
        Account account = found.get();

        if (account.type() == ProviderType.MICROSOFT) {
            if (account.validAt(clock.instant())) return true;
            try {
                exchange.refreshMicrosoftToken(account.uuid());
                return true;
            } catch (AuthException e) {
                if (e.failure().isTransient() || e.failure() == AuthFailure.CONFIGURATION
                        || e.failure() == AuthFailure.STORAGE) {
                    throw e;
                }
                log.info("Token of {} is expired and could not be refreshed: {}", account.username(), e.getMessage());
                return false;
            }
        }

        return mojang.validate(account.accessToken(), account.clientToken());
    }

    /**
     * Removes the account locally. Mojang tokens are invalidated on the server first, but a
     * failure there never stops the local logout.
     *
     * @return whether an account was removed
     */
    public boolean logoutAccount(String uuid) {
        Optional<Account> found = store.getAuthData(uuid);
        if (found.isEmpty()) return false;
        Account account = found.get();

        if (account.type() == ProviderType.MOJANG) {
            try {
                mojang.invalidate(account.accessToken(), account.clientToken());
            } catch (AuthException e) {
                log.warn("Failed to invalidate token on Mojang servers, continuing with local logout: {}", e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while invalidating token on Mojang servers, continuing with local logout");
            }
        }

        var result = store.removeAccount(account.uuid());
        if (!result.isSuccess()) {
            log.error("Error logging out {}: {}", account.username(), result.message());
        }
        return result.isSuccess();
    }
}
