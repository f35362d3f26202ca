package de.levingamer8.launcherauth.http;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.Optional;

/**
 * Status and raw body of one provider call. Non-2xx statuses are not errors at this level;
 * each caller decides what a status means for its hop.
 */
public record ProviderResponse(int status, String body) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    /** Body as JSON object, empty if the body is blank or not an object. */
    public Optional<JsonObject> json() {
        if (body == null || body.isBlank()) return Optional.empty();
        try {
            JsonElement e = JsonParser.parseString(body);
            return e.isJsonObject() ? Optional.of(e.getAsJsonObject()) : Optional.empty();
        } catch (JsonParseException e) {
            return Optional.empty();
        }
    }

    /** A string field from the JSON body, if both exist. */
    public Optional<String> field(String name) {
        return json().flatMap(j -> Json.string(j, name));
    }
}
