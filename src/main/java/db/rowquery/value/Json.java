package db.rowquery.value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Gson bridge for {@link Value}: conversion in both directions and compact JSON text.
 */
public final class Json {
    private static final Gson GSON = new GsonBuilder()
        .disableHtmlEscaping()
        .serializeNulls()
        .serializeSpecialFloatingPointValues()
        .create();

    private Json() {}

    public static Gson gson() { return GSON; }

    public static String compact(Value value) {
        return GSON.toJson(toJson(value));
    }

    public static JsonElement toJson(Value value) {
        return switch (value.kind()) {
            case NULL -> JsonNull.INSTANCE;
            case BOOL -> new JsonPrimitive(value.asBool());
            case INT -> new JsonPrimitive(value.asLong());
            case FLOAT -> new JsonPrimitive(value.asDouble());
            case STRING -> new JsonPrimitive(value.asString());
            case SEQUENCE -> {
                JsonArray arr = new JsonArray();
                for (Value v : value.asSequence()) arr.add(toJson(v));
                yield arr;
            }
            case MAP -> {
                JsonObject obj = new JsonObject();
                for (Map.Entry<String, Value> e : value.asMap().entrySet()) obj.add(e.getKey(), toJson(e.getValue()));
                yield obj;
            }
        };
    }

    public static Value fromJson(JsonElement element) {
        if (element == null || element.isJsonNull()) return Value.NULL;
        if (element.isJsonArray()) {
            List<Value> items = new ArrayList<>();
            for (JsonElement e : element.getAsJsonArray()) items.add(fromJson(e));
            return Value.ofSequence(items);
        }
        if (element.isJsonObject()) {
            Map<String, Value> entries = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> e : element.getAsJsonObject().entrySet()) {
                entries.put(e.getKey(), fromJson(e.getValue()));
            }
            return Value.ofMap(entries);
        }
        JsonPrimitive p = element.getAsJsonPrimitive();
        if (p.isBoolean()) return Value.ofBool(p.getAsBoolean());
        if (p.isString()) return Value.ofString(p.getAsString());
        String text = p.getAsString();
        if (text.contains(".") || text.contains("e") || text.contains("E")) {
            return Value.ofFloat(p.getAsDouble());
        }
        try {
            return Value.ofInt(Long.parseLong(text));
        } catch (NumberFormatException e) {
            // integral but beyond long range
            return Value.ofFloat(p.getAsDouble());
        }
    }
}
