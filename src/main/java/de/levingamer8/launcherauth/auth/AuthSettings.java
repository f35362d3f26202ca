package de.levingamer8.launcherauth.auth;

import java.time.Duration;
import java.util.Objects;

/**
 * Provider configuration: Microsoft client id, per-request timeout and endpoint bases.
 */
public record AuthSettings(
        String microsoftClientId,   // null = nicht konfiguriert
        Duration requestTimeout,
        String mojangAuthServer,
        String microsoftLogin,
        String xboxUserAuth,
        String xboxXsts,
        String minecraftServices
) {

    public static final String CLIENT_ID_PROPERTY = "launcherauth.ms.clientId";
    public static final String CLIENT_ID_ENV = "MS_CLIENT_ID";

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    public static final String MOJANG_AUTH_SERVER = "https://authserver.mojang.com";
    public static final String MICROSOFT_LOGIN = "https://login.live.com";
    public static final String XBOX_USER_AUTH = "https://user.auth.xboxlive.com";
    public static final String XBOX_XSTS = "https://xsts.auth.xboxlive.com";
    public static final String MINECRAFT_SERVICES = "https://api.minecraftservices.com";

    public static final String SCOPES = "XboxLive.signin offline_access";

    public AuthSettings {
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        mojangAuthServer = trimSlash(Objects.requireNonNull(mojangAuthServer, "mojangAuthServer"));
        microsoftLogin = trimSlash(Objects.requireNonNull(microsoftLogin, "microsoftLogin"));
        xboxUserAuth = trimSlash(Objects.requireNonNull(xboxUserAuth, "xboxUserAuth"));
        xboxXsts = trimSlash(Objects.requireNonNull(xboxXsts, "xboxXsts"));
        minecraftServices = trimSlash(Objects.requireNonNull(minecraftServices, "minecraftServices"));
        if (microsoftClientId != null && microsoftClientId.isBlank()) microsoftClientId = null;
    }

    /** Client id from system property, then environment. */
    public static AuthSettings fromEnvironment() {
        String id = System.getProperty(CLIENT_ID_PROPERTY);
        if (id == null || id.isBlank()) id = System.getenv(CLIENT_ID_ENV);
        return builder().microsoftClientId(id).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .microsoftClientId(microsoftClientId)
                .requestTimeout(requestTimeout)
                .mojangAuthServer(mojangAuthServer)
                .microsoftLogin(microsoftLogin)
                .xboxUserAuth(xboxUserAuth)
                .xboxXsts(xboxXsts)
                .minecraftServices(minecraftServices);
    }

    public String requireClientId() throws AuthException {
        if (microsoftClientId == null) {
            throw new AuthException(AuthFailure.CONFIGURATION,
                    "Microsoft client ID is not configured (set " + CLIENT_ID_ENV + " or -D" + CLIENT_ID_PROPERTY + ")");
        }
        return microsoftClientId;
    }

    // ---- endpoints ----
    public String mojangAuthenticateUrl() { return mojangAuthServer + "/authenticate"; }
    public String mojangRefreshUrl() { return mojangAuthServer + "/refresh"; }
    public String mojangValidateUrl() { return mojangAuthServer + "/validate"; }
    public String mojangInvalidateUrl() { return mojangAuthServer + "/invalidate"; }

    public String microsoftAuthorizeUrl() { return microsoftLogin + "/oauth20_authorize.srf"; }
    public String microsoftTokenUrl() { return microsoftLogin + "/oauth20_token.srf"; }
    public String xboxUserAuthUrl() { return xboxUserAuth + "/user/authenticate"; }
    public String xstsAuthorizeUrl() { return xboxXsts + "/xsts/authorize"; }
    public String minecraftLoginUrl() { return minecraftServices + "/authentication/login_with_xbox"; }
    public String minecraftProfileUrl() { return minecraftServices + "/minecraft/profile"; }

    private static String trimSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    public static final class Builder {
        private String microsoftClientId;
        private Duration requestTimeout = DEFAULT_TIMEOUT;
        private String mojangAuthServer = MOJANG_AUTH_SERVER;
        private String microsoftLogin = MICROSOFT_LOGIN;
        private String xboxUserAuth = XBOX_USER_AUTH;
        private String xboxXsts = XBOX_XSTS;
        private String minecraftServices = MINECRAFT_SERVICES;

        private Builder() {}

        public Builder microsoftClientId(String v) { this.microsoftClientId = v; return this; }
        public Builder requestTimeout(Duration v) { this.requestTimeout = v; return this; }
        public Builder mojangAuthServer(String v) { this.mojangAuthServer = v; return this; }
        public Builder microsoftLogin(String v) { this.microsoftLogin = v; return this; }
        public Builder xboxUserAuth(String v) { this.xboxUserAuth = v; return this; }
        public Builder xboxXsts(String v) { this.xboxXsts = v; return this; }
        public Builder minecraftServices(String v) { this.minecraftServices = v; return this; }

        public AuthSettings build() {
            return new AuthSettings(microsoftClientId, requestTimeout, mojangAuthServer, microsoftLogin,
                    xboxUserAuth, xboxXsts, minecraftServices);
        }
    }
}
