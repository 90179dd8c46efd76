package sid.io;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.List;
import sid.model.StructuralException;

/** Lenient accessors over Gson trees; wrong types read as absent. */
public final class JsonFields {
  private JsonFields() {}

  public static String string(JsonObject obj, String key) {
    JsonElement value = obj.get(key);
    if (value == null || !value.isJsonPrimitive()) {
      return null;
    }
    return value.getAsString();
  }

  public static String requireString(JsonObject obj, String key, String context) {
    String value = string(obj, key);
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException(context + " missing '" + key + "'");
    }
    return value;
  }

  /** First non-empty string among {@code keys}. */
  public static String firstString(JsonObject obj, String... keys) {
    for (String key : keys) {
      String value = string(obj, key);
      if (value != null && !value.isEmpty()) {
        return value;
      }
    }
    return null;
  }

  public static List<String> strings(JsonObject obj, String key) {
    JsonElement value = obj.get(key);
    if (value == null || !value.isJsonArray()) {
      return List.of();
    }
    List<String> list = new ArrayList<>();
    for (JsonElement element : value.getAsJsonArray()) {
      if (element.isJsonPrimitive()) {
        list.add(element.getAsString());
      }
    }
    return list;
  }

  /** Integral number field; a fractional or out-of-range number is a structural error. */
  public static Integer integer(JsonObject obj, String key) {
    JsonElement value = obj.get(key);
    if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
      return null;
    }
    try {
      return value.getAsBigDecimal().intValueExact();
    } catch (ArithmeticException | NumberFormatException ex) {
      throw new StructuralException("'" + key + "' must be an integer, got " + value);
    }
  }

  public static int integer(JsonObject obj, String key, int defaultValue) {
    Integer value = integer(obj, key);
    return value == null ? defaultValue : value;
  }

  public static long longValue(JsonObject obj, String key, long defaultValue) {
    JsonElement value = obj.get(key);
    if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
      return defaultValue;
    }
    return value.getAsLong();
  }

  public static boolean bool(JsonObject obj, String key, boolean defaultValue) {
    JsonElement value = obj.get(key);
    if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isBoolean()) {
      return defaultValue;
    }
    return value.getAsBoolean();
  }

  public static JsonObject object(JsonObject obj, String key) {
    JsonElement value = obj.get(key);
    return value != null && value.isJsonObject() ? value.getAsJsonObject() : null;
  }

  /** Object entries of an array field; non-object entries are dropped. */
  public static List<JsonObject> objects(JsonObject obj, String key) {
    JsonElement value = obj.get(key);
    if (value == null || !value.isJsonArray()) {
      return List.of();
    }
    List<JsonObject> list = new ArrayList<>();
    for (JsonElement element : value.getAsJsonArray()) {
      if (element.isJsonObject()) {
        list.add(element.getAsJsonObject());
      }
    }
    return list;
  }

  public static JsonArray array(List<String> values) {
    JsonArray array = new JsonArray();
    values.forEach(array::add);
    return array;
  }
}
