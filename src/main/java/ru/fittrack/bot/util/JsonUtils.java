package ru.fittrack.bot.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class JsonUtils {
    private static final Logger log = LoggerFactory.getLogger(JsonUtils.class);

    private JsonUtils() {}

    public static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    public static JsonObject obj() {
        return new JsonObject();
    }

    public static JsonObject parseObj(String s) {
        if (s == null || s.isBlank()) return new JsonObject();
        try {
            JsonObject o = GSON.fromJson(s, JsonObject.class);
            return o != null ? o : new JsonObject();
        } catch (JsonParseException e) {
            log.warn("Unreadable JSON payload, treating as empty: {}", s);
            return new JsonObject();
        }
    }

    public static String str(JsonObject o, String key) {
        if (o == null || !o.has(key) || o.get(key).isJsonNull()) return null;
        return o.get(key).getAsString();
    }
}
