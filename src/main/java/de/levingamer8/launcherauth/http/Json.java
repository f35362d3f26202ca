package de.levingamer8.launcherauth.http;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Optional;

/**
 * Null-tolerant accessors for Gson trees; provider responses omit fields freely.
 */
public final class Json {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private Json() {}

    public static Optional<String> string(JsonObject o, String name) {
        if (o == null) return Optional.empty();
        JsonElement e = o.get(name);
        if (e == null || !e.isJsonPrimitive()) return Optional.empty();
        String s = e.getAsString();
        return s.isEmpty() ? Optional.empty() : Optional.of(s);
    }

    public static Optional<Long> number(JsonObject o, String name) {
        if (o == null) return Optional.empty();
        JsonElement e = o.get(name);
        if (e == null || !e.isJsonPrimitive()) return Optional.empty();
        try {
            return Optional.of(e.getAsLong());
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    public static Optional<JsonObject> object(JsonObject o, String name) {
        if (o == null) return Optional.empty();
        JsonElement e = o.get(name);
        return e != null && e.isJsonObject() ? Optional.of(e.getAsJsonObject()) : Optional.empty();
    }

    public static Optional<JsonObject> firstOf(JsonObject o, String arrayName) {
        if (o == null) return Optional.empty();
        JsonElement e = o.get(arrayName);
        if (e == null || !e.isJsonArray()) return Optional.empty();
        JsonArray a = e.getAsJsonArray();
        if (a.isEmpty() || !a.get(0).isJsonObject()) return Optional.empty();
        return Optional.of(a.get(0).getAsJsonObject());
    }

    /** Request body text; control characters and quotes are escaped by Gson. */
    public static String write(JsonElement body) {
        return GSON.toJson(body);
    }
}
