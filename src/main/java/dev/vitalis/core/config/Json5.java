/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.Map;

/** JSON5-tolerant parsing and typed accessors shared by every configuration document. */
public final class Json5 {
  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  private Json5() {}

  /** Removes comments and trailing commas so Gson's lenient parser accepts the text. */
  public static String strip(String raw) {
    return raw.replaceAll("(?s)/\\*.*?\\*/", "")
        .replaceAll("(?m)//.*$", "")
        .replaceAll(",(?=\\s*[}\\]])", "");
  }

  /**
   * Parses a JSON5 document.
   *
   * @param raw document text
   * @return root object
   * @throws IllegalStateException when the root is not an object
   * @throws com.google.gson.JsonParseException when the text is malformed
   */
  public static JsonObject parse(String raw) {
    JsonElement root = JsonParser.parseString(strip(raw));
    if (root == null || !root.isJsonObject()) {
      throw new IllegalStateException("config root must be an object");
    }
    return root.getAsJsonObject();
  }

  /** Pretty-printed JSON for writing documents back to disk. */
  public static String toJson(JsonObject document) {
    return GSON.toJson(document) + System.lineSeparator();
  }

  /**
   * Copies every key of {@code overlay} onto {@code base}, recursing into nested objects so keys
   * only present in {@code base} survive.
   */
  public static JsonObject deepMerge(JsonObject base, JsonObject overlay) {
    for (Map.Entry<String, JsonElement> entry : overlay.entrySet()) {
      JsonElement existing = base.get(entry.getKey());
      JsonElement incoming = entry.getValue();
      if (existing != null
          && existing.isJsonObject()
          && incoming != null
          && incoming.isJsonObject()) {
        deepMerge(existing.getAsJsonObject(), incoming.getAsJsonObject());
      } else {
        base.add(entry.getKey(), incoming == null ? null : incoming.deepCopy());
      }
    }
    return base;
  }

  public static JsonObject optObject(JsonObject parent, String key) {
    return parent != null && parent.has(key) && parent.get(key).isJsonObject()
        ? parent.getAsJsonObject(key)
        : null;
  }

  public static boolean optBoolean(JsonObject obj, String key, boolean def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsBoolean() : def;
  }

  public static int optInt(JsonObject obj, String key, int def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsInt() : def;
  }

  public static long optLong(JsonObject obj, String key, long def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsLong() : def;
  }

  public static double optDouble(JsonObject obj, String key, double def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsDouble() : def;
  }

  public static String optString(JsonObject obj, String key, String def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsString() : def;
  }
}
