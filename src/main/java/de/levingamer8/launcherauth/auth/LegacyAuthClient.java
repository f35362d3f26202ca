package de.levingamer8.launcherauth.auth;

import com.google.gson.JsonObject;
import de.levingamer8.launcherauth.http.Json;
import de.levingamer8.launcherauth.http.ProviderHttp;
import de.levingamer8.launcherauth.http.ProviderResponse;

/**
 * Yggdrasil-style calls against the Mojang auth server.
 */
public class LegacyAuthClient {

    /** What the auth server hands back for a username/password or refresh call. */
    public record LegacySession(String accessToken, String clientToken, String uuid, String username) {}

    private final ProviderHttp http;
    private final AuthSettings settings;

    public LegacyAuthClient(ProviderHttp http, AuthSettings settings) {
        this.http = http;
        this.settings = settings;
    }

    public LegacySession authenticate(String username, String password, String clientToken)
            throws AuthException, InterruptedException {
        JsonObject agent = new JsonObject();
        agent.addProperty("name", "Minecraft");
        agent.addProperty("version", 1);

        JsonObject body = new JsonObject();
        body.add("agent", agent);
        body.addProperty("username", username);
        body.addProperty("password", password);
        body.addProperty("clientToken", clientToken);
        body.addProperty("requestUser", true);

        ProviderResponse resp = http.postJson(settings.mojangAuthenticateUrl(), Json.write(body));
        requireSuccess(resp);
        return session(resp, clientToken, true);
    }

    /**
     * Exchanges a still-known access token for a new one. The old one is invalidated by the
     * server. uuid and username are null if the server left out the profile.
     */
    public LegacySession refresh(String accessToken, String clientToken) throws AuthException, InterruptedException {
        ProviderResponse resp = http.postJson(settings.mojangRefreshUrl(), tokenPair(accessToken, clientToken));
        requireSuccess(resp);
        return session(resp, clientToken, false);
    }

    /** The server answers 204 for a usable token and 403 otherwise; only 204 counts. */
    public boolean validate(String accessToken, String clientToken) throws AuthException, InterruptedException {
        ProviderResponse resp = http.postJson(settings.mojangValidateUrl(), tokenPair(accessToken, clientToken));
        return resp.status() == 204;
    }

    public void invalidate(String accessToken, String clientToken) throws AuthException, InterruptedException {
        ProviderResponse resp = http.postJson(settings.mojangInvalidateUrl(), tokenPair(accessToken, clientToken));
        requireSuccess(resp);
    }

    // ---------------- helpers ----------------

    private static String tokenPair(String accessToken, String clientToken) {
        JsonObject body = new JsonObject();
        body.addProperty("accessToken", accessToken);
        body.addProperty("clientToken", clientToken == null ? "" : clientToken);
        return Json.write(body);
    }

    private static void requireSuccess(ProviderResponse resp) throws AuthException {
        if (resp.isSuccess()) return;
        String providerMessage = resp.field("errorMessage").orElse(null);
        String message = providerMessage != null
                ? providerMessage
                : "Error " + resp.status() + ": " + resp.field("error").orElse(HttpStatusText.of(resp.status()));
        throw AuthException.http(resp.status(), providerMessage, message);
    }

    private static LegacySession session(ProviderResponse resp, String fallbackClientToken, boolean requireProfile)
            throws AuthException {
        var json = resp.json().orElseThrow(() -> new AuthException(AuthFailure.PROTOCOL, "Invalid authentication response"));
        String accessToken = Json.string(json, "accessToken")
                .orElseThrow(() -> new AuthException(AuthFailure.PROTOCOL, "Invalid authentication response: no accessToken"));
        String clientToken = Json.string(json, "clientToken").orElse(fallbackClientToken);

        var selected = Json.object(json, "selectedProfile");
        if (selected.isEmpty() && !requireProfile) {
            return new LegacySession(accessToken, clientToken, null, null);
        }
        var profile = selected
                .orElseThrow(() -> new AuthException(AuthFailure.PROTOCOL, "Invalid authentication response: no selected profile"));
        String id = Json.string(profile, "id")
                .orElseThrow(() -> new AuthException(AuthFailure.PROTOCOL, "Invalid authentication response: profile without id"));
        String name = Json.string(profile, "name")
                .orElseThrow(() -> new AuthException(AuthFailure.PROTOCOL, "Invalid authentication response: profile without name"));
        return new LegacySession(accessToken, clientToken, id, name);
    }
}
