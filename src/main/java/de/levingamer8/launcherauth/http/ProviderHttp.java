package de.levingamer8.launcherauth.http;

import de.levingamer8.launcherauth.auth.AuthException;
import de.levingamer8.launcherauth.auth.AuthFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * The only place that talks HTTP to the identity providers. Every request gets its own
 * timeout; timeouts and transport errors become {@link AuthException}s, statuses are
 * handed back untouched in a {@link ProviderResponse}.
 */
public class ProviderHttp {

    private static final Logger log = LoggerFactory.getLogger(ProviderHttp.class);

    private final HttpClient http;
    private final Duration timeout;

    public ProviderHttp(Duration timeout) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build(), timeout);
    }

    public ProviderHttp(HttpClient http, Duration timeout) {
        this.http = http;
        this.timeout = timeout;
    }

    public ProviderResponse postForm(String url, Map<String, String> form) throws AuthException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(form(form)))
                .build();
        return send(req);
    }

    public ProviderResponse postJson(String url, String json) throws AuthException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        return send(req);
    }

    /** POST with the Xbox contract header the XBL/XSTS endpoints expect. */
    public ProviderResponse postXbox(String url, String json) throws AuthException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("x-xbl-contract-version", "1")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        return send(req);
    }

    public ProviderResponse getJson(String url, String bearerToken) throws AuthException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("Authorization", "Bearer " + bearerToken)
                .GET()
                .build();
        return send(req);
    }

    private ProviderResponse send(HttpRequest req) throws AuthException, InterruptedException {
        String what = req.method() + " " + req.uri();
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            log.debug("{} -> {}", what, resp.statusCode());
            return new ProviderResponse(resp.statusCode(), resp.body());
        } catch (HttpTimeoutException e) {
            throw new AuthException(AuthFailure.TIMEOUT, "Timed out after " + timeout.toMillis() + " ms: " + what, e);
        } catch (IOException e) {
            throw new AuthException(AuthFailure.NETWORK, "Request failed: " + what + " (" + e.getMessage() + ")", e);
        }
    }

    public static String form(Map<String, String> kv) {
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (var e : kv.entrySet()) {
            if (!first) sb.append("&");
            first = false;
            sb.append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8));
            sb.append("=");
            sb.append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
        }
        return sb.toString();
    }
}
