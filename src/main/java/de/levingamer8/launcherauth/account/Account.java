package de.levingamer8.launcherauth.account;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * One linked identity with its tokens. This is the secret-bearing form; listings use
 * {@link AccountSummary}.
 *
 * <p>{@code refreshToken} and {@code expiresAt} are only set for Microsoft accounts.
 * {@code profile} is the raw profile JSON from the provider and is not interpreted here.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Account(
        String uuid,
        String username,
        ProviderType type,
        String accessToken,
        String clientToken,
        String refreshToken,
        Instant expiresAt,
        String profile,
        boolean active,
        Instant lastUsed
) {

    /** Freshly logged-in account, before the store stamps it. */
    public static Account of(String uuid, String username, ProviderType type,
                             String accessToken, String clientToken,
                             String refreshToken, Instant expiresAt, String profile) {
        return new Account(uuid, username, type, accessToken, clientToken,
                refreshToken, expiresAt, profile, false, null);
    }

    public Account withActive(boolean active) {
        return new Account(uuid, username, type, accessToken, clientToken,
                refreshToken, expiresAt, profile, active, lastUsed);
    }

    public Account stamped(boolean active, Instant now) {
        return new Account(uuid, username, type == null ? ProviderType.MOJANG : type, accessToken, clientToken,
                refreshToken, expiresAt, profile, active, now);
    }

    public Account apply(AuthUpdate u, Instant now) {
        return new Account(uuid, username, type,
                u.accessToken() != null ? u.accessToken() : accessToken,
                clientToken,
                u.refreshToken() != null ? u.refreshToken() : refreshToken,
                u.expiresAt() != null ? u.expiresAt() : expiresAt,
                u.profile() != null ? u.profile() : profile,
                active, now);
    }

    public AccountSummary summary() {
        return new AccountSummary(uuid, username, type, active, lastUsed);
    }

    public boolean validAt(Instant now) {
        return expiresAt != null && expiresAt.isAfter(now);
    }

    @Override
    public String toString() {
        // keine Tokens in Logs
        return "Account[uuid=" + uuid + ", username=" + username + ", type=" + type
                + ", active=" + active + ", lastUsed=" + lastUsed + "]";
    }
}
