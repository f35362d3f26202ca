package de.levingamer8.launcherauth.auth;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import de.levingamer8.launcherauth.http.Json;
import de.levingamer8.launcherauth.http.ProviderHttp;
import de.levingamer8.launcherauth.http.ProviderResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Microsoft login chain: MS token -> Xbox Live -> XSTS -> Minecraft token -> profile.
 *
 * <p>Each hop is a separate method taking the previous hop's result, so every hop can be
 * driven and checked on its own. Failures are thrown as {@link AuthException} tagged with
 * the {@link Hop} that produced them. Nothing here touches the account store.
 */
public class MicrosoftAuthChain {

    private static final Logger log = LoggerFactory.getLogger(MicrosoftAuthChain.class);

    /** XSTS "XErr" codes. */
    static final long XERR_NO_XBOX_ACCOUNT = 2148916233L;
    static final long XERR_REGION_BLOCKED = 2148916235L;
    static final long XERR_ADULT_VERIFICATION = 2148916236L;
    static final long XERR_AGE_VERIFICATION = 2148916237L;
    static final long XERR_CHILD_ACCOUNT = 2148916238L;

    public enum Hop {
        MICROSOFT_TOKEN("Microsoft token"),
        XBOX_LIVE("Xbox Live"),
        XSTS("XSTS"),
        MINECRAFT_LOGIN("Minecraft login"),
        PROFILE("Minecraft profile");

        private final String label;

        Hop(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    // Ergebnis pro Hop
    public record MicrosoftToken(String accessToken, String refreshToken, long expiresInSec) {}

    public record XboxToken(String token, String userHash) {}

    public record XstsToken(String token) {}

    public record MinecraftToken(String accessToken, long expiresInSec) {}

    public record MinecraftProfile(String id, String name, String rawJson) {}

    private final ProviderHttp http;
    private final AuthSettings settings;

    public MicrosoftAuthChain(ProviderHttp http, AuthSettings settings) {
        this.http = http;
        this.settings = settings;
    }

    /**
     * Hop 1, authorization-code grant.
     */
    public MicrosoftToken exchangeCode(String clientId, String code, String redirectUri)
            throws AuthException, InterruptedException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", clientId);
        form.put("code", code);
        form.put("grant_type", "authorization_code");
        form.put("redirect_uri", redirectUri);
        return microsoftToken(form, "Failed to get Microsoft token");
    }

    /**
     * Hop 1, refresh-token grant.
     */
    public MicrosoftToken refresh(String clientId, String refreshToken) throws AuthException, InterruptedException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", clientId);
        form.put("refresh_token", refreshToken);
        form.put("grant_type", "refresh_token");
        return microsoftToken(form, "Failed to refresh token");
    }

    /**
     * Hop 2: Microsoft access token -> Xbox Live user token plus user hash.
     */
    public XboxToken xboxLive(MicrosoftToken ms) throws AuthException, InterruptedException {
        try {
            JsonObject props = new JsonObject();
            props.addProperty("AuthMethod", "RPS");
            props.addProperty("SiteName", "user.auth.xboxlive.com");
            props.addProperty("RpsTicket", "d=" + ms.accessToken());

            JsonObject req = new JsonObject();
            req.add("Properties", props);
            req.addProperty("RelyingParty", "http://auth.xboxlive.com");
            req.addProperty("TokenType", "JWT");

            ProviderResponse resp = http.postXbox(settings.xboxUserAuthUrl(), Json.write(req));
            if (!resp.isSuccess()) {
                throw httpError(resp, "Failed to authenticate with Xbox Live");
            }

            JsonObject j = body(resp);
            String token = Json.string(j, "Token")
                    .orElseThrow(() -> protocol("no Token in response"));
            String userHash = userHash(j)
                    .orElseThrow(() -> protocol("no user hash (DisplayClaims.xui[0].uhs) in response"));
            log.debug("Microsoft login: {} ok", Hop.XBOX_LIVE.label());
            return new XboxToken(token, userHash);
        } catch (AuthException e) {
            throw e.at(Hop.XBOX_LIVE);
        }
    }

    /**
     * Hop 3: Xbox Live token -> XSTS token for Minecraft services. An account without an
     * Xbox profile fails with {@link AuthFailure#NO_LINKED_ACCOUNT}.
     */
    public XstsToken xsts(XboxToken xbl) throws AuthException, InterruptedException {
        try {
            JsonArray userTokens = new JsonArray();
            userTokens.add(xbl.token());

            JsonObject props = new JsonObject();
            props.addProperty("SandboxId", "RETAIL");
            props.add("UserTokens", userTokens);

            JsonObject req = new JsonObject();
            req.add("Properties", props);
            req.addProperty("RelyingParty", "rp://api.minecraftservices.com/");
            req.addProperty("TokenType", "JWT");

            ProviderResponse resp = http.postXbox(settings.xstsAuthorizeUrl(), Json.write(req));
            if (!resp.isSuccess()) {
                throw xstsError(resp);
            }

            JsonObject j = body(resp);
            String token = Json.string(j, "Token")
                    .orElseThrow(() -> protocol("no Token in response"));
            log.debug("Microsoft login: {} ok", Hop.XSTS.label());
            return new XstsToken(token);
        } catch (AuthException e) {
            throw e.at(Hop.XSTS);
        }
    }

    /**
     * Hop 4: XSTS token + user hash -> Minecraft access token. The hash is the one from hop 2.
     */
    public MinecraftToken loginWithXbox(XboxToken xbl, XstsToken xsts) throws AuthException, InterruptedException {
        try {
            JsonObject req = new JsonObject();
            req.addProperty("identityToken", "XBL3.0 x=" + xbl.userHash() + ";" + xsts.token());

            ProviderResponse resp = http.postJson(settings.minecraftLoginUrl(), Json.write(req));
            if (!resp.isSuccess()) {
                throw httpError(resp, "Failed to authenticate with Minecraft");
            }

            JsonObject j = body(resp);
            String accessToken = Json.string(j, "access_token")
                    .orElseThrow(() -> protocol("no access_token in response"));
            long expiresIn = Json.number(j, "expires_in").orElse(0L);
            log.debug("Microsoft login: {} ok", Hop.MINECRAFT_LOGIN.label());
            return new MinecraftToken(accessToken, expiresIn);
        } catch (AuthException e) {
            throw e.at(Hop.MINECRAFT_LOGIN);
        }
    }

    /**
     * Minecraft profile for the token. 404 means the account does not own the game and
     * fails with {@link AuthFailure#NO_ENTITLEMENT}.
     */
    public MinecraftProfile profile(MinecraftToken mc) throws AuthException, InterruptedException {
        try {
            ProviderResponse resp = http.getJson(settings.minecraftProfileUrl(), mc.accessToken());
            if (resp.status() == 404) {
                throw AuthException.of(AuthFailure.NO_ENTITLEMENT, 404, resp.field("errorMessage").orElse(null),
                        "This account does not own Minecraft");
            }
            if (!resp.isSuccess()) {
                throw httpError(resp, "Failed to get Minecraft profile");
            }

            JsonObject j = body(resp);
            String id = Json.string(j, "id").orElseThrow(() -> protocol("profile without id"));
            String name = Json.string(j, "name").orElseThrow(() -> protocol("profile without name"));
            log.debug("Microsoft login: {} ok", Hop.PROFILE.label());
            return new MinecraftProfile(id, name, resp.body());
        } catch (AuthException e) {
            throw e.at(Hop.PROFILE);
        }
    }

    // ---------------- helpers ----------------

    private MicrosoftToken microsoftToken(Map<String, String> form, String failure)
            throws AuthException, InterruptedException {
        try {
            ProviderResponse resp = http.postForm(settings.microsoftTokenUrl(), form);
            if (!resp.isSuccess()) {
                throw httpError(resp, failure);
            }

            JsonObject j = body(resp);
            String accessToken = Json.string(j, "access_token")
                    .orElseThrow(() -> protocol("no access_token in response"));
            String refreshToken = Json.string(j, "refresh_token").orElse(null);
            long expiresIn = Json.number(j, "expires_in").orElse(0L);
            log.debug("Microsoft login: {} ok", Hop.MICROSOFT_TOKEN.label());
            return new MicrosoftToken(accessToken, refreshToken, expiresIn);
        } catch (AuthException e) {
            throw e.at(Hop.MICROSOFT_TOKEN);
        }
    }

    private static AuthException xstsError(ProviderResponse resp) {
        long xerr = resp.json().flatMap(j -> Json.number(j, "XErr")).orElse(0L);
        String providerMessage = resp.field("Message").orElse(null);
        if (xerr == XERR_NO_XBOX_ACCOUNT) {
            return AuthException.of(AuthFailure.NO_LINKED_ACCOUNT, resp.status(), providerMessage,
                    "The Microsoft account does not have an Xbox account");
        }
        String known = knownXstsMessage(xerr);
        if (known != null) {
            return AuthException.http(resp.status(), known, known + " (XErr " + xerr + ")");
        }
        return httpError(resp, "Failed to get XSTS token");
    }

    static String knownXstsMessage(long xerr) {
        if (xerr == XERR_REGION_BLOCKED) return "Xbox Live is not available in this account's country";
        if (xerr == XERR_ADULT_VERIFICATION || xerr == XERR_AGE_VERIFICATION) {
            return "The account needs adult verification on the Xbox page";
        }
        if (xerr == XERR_CHILD_ACCOUNT) return "The account is a child account and must be added to a Family by an adult";
        return null;
    }

    private static AuthException httpError(ProviderResponse resp, String what) {
        String providerMessage = resp.field("error_description")
                .or(() -> resp.field("errorMessage"))
                .or(() -> resp.field("Message"))
                .orElse(null);
        String message = what + ": " + resp.status() + (providerMessage != null ? " (" + providerMessage + ")" : "");
        return AuthException.http(resp.status(), providerMessage, message);
    }

    private static JsonObject body(ProviderResponse resp) throws AuthException {
        return resp.json().orElseThrow(() -> protocol("response is not a JSON object"));
    }

    private static Optional<String> userHash(JsonObject j) {
        return Json.object(j, "DisplayClaims")
                .flatMap(c -> Json.firstOf(c, "xui"))
                .flatMap(x -> Json.string(x, "uhs"));
    }

    private static AuthException protocol(String what) {
        return new AuthException(AuthFailure.PROTOCOL, "Unexpected response: " + what);
    }
}
