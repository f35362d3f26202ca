package de.levingamer8.launcherauth.account;

import java.time.Instant;

/**
 * Partial update for a stored account. {@code null} fields are left untouched.
 */
public record AuthUpdate(
        String accessToken,
        String refreshToken,
        Instant expiresAt,
        String profile
) {

    public static AuthUpdate tokens(String accessToken, String refreshToken, Instant expiresAt) {
        return new AuthUpdate(accessToken, refreshToken, expiresAt, null);
    }

    public static AuthUpdate accessToken(String accessToken) {
        return new AuthUpdate(accessToken, null, null, null);
    }
}
