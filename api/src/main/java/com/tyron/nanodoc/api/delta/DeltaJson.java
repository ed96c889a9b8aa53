package com.tyron.nanodoc.api.delta;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes deltas in the ops-list interchange format:
 * <pre>
 * [{"insert": "Hello", "attributes": {"bold": true}},
 *  {"insert": {"image": "https://..."}},
 *  {"retain": 5, "attributes": {"header": null}},
 *  {"delete": 2}]
 * </pre>
 * Attribute order is preserved and {@code null} attribute values are written out, so the
 * representation round-trips exactly.
 */
public final class DeltaJson {

    private static final String ATTRIBUTES = "attributes";

    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private DeltaJson() {
    }

    public static String toJson(@NotNull Delta delta) {
        return GSON.toJson(toJsonTree(delta));
    }

    public static JsonArray toJsonTree(@NotNull Delta delta) {
        Objects.requireNonNull(delta, "delta");
        JsonArray ops = new JsonArray(delta.size());
        for (Operation op : delta) {
            ops.add(toJsonTree(op));
        }
        return ops;
    }

    public static JsonObject toJsonTree(@NotNull Operation op) {
        JsonObject record = new JsonObject();
        switch (op.getKind()) {
            case INSERT -> {
                if (op.getData() instanceof Embed embed) {
                    JsonObject value = new JsonObject();
                    value.add(embed.type(), toJsonValue(embed.data()));
                    record.add(Operation.Kind.INSERT.getKey(), value);
                } else {
                    record.addProperty(Operation.Kind.INSERT.getKey(), op.getText());
                }
            }
            case RETAIN -> record.addProperty(Operation.Kind.RETAIN.getKey(), op.getLength());
            case DELETE -> record.addProperty(Operation.Kind.DELETE.getKey(), op.getLength());
        }
        if (op.getAttributes() != null) {
            record.add(ATTRIBUTES, toJsonValue(op.getAttributes()));
        }
        return record;
    }

    public static Delta fromJson(@NotNull String json) {
        Objects.requireNonNull(json, "json");
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new DeltaFormatException("Malformed delta json", e);
        }
        return fromJsonTree(root);
    }

    public static Delta fromJsonTree(@NotNull JsonElement root) {
        if (!root.isJsonArray()) {
            throw new DeltaFormatException("Delta json must be an array of operations, got " + root);
        }

        Delta delta = new Delta();
        int position = 0;
        for (JsonElement element : root.getAsJsonArray()) {
            if (!element.isJsonObject()) {
                throw new DeltaFormatException("Operation #" + position + " is not an object: " + element);
            }
            delta.push(readOperation(element.getAsJsonObject(), position));
            position++;
        }
        return delta;
    }

    private static Operation readOperation(JsonObject record, int position) {
        Operation.Kind kind = null;
        for (Operation.Kind candidate : Operation.Kind.values()) {
            if (record.has(candidate.getKey())) {
                if (kind != null) {
                    throw new DeltaFormatException("Operation #" + position + " has both "
                            + kind.getKey() + " and " + candidate.getKey());
                }
                kind = candidate;
            }
        }
        if (kind == null) {
            throw new DeltaFormatException("Operation #" + position + " has no insert, retain or delete key: " + record);
        }

        Map<String, Object> attributes = readAttributes(record.get(ATTRIBUTES), position);
        JsonElement value = record.get(kind.getKey());

        try {
            return switch (kind) {
                case INSERT -> readInsert(value, attributes, position);
                case RETAIN -> Operation.retain(readLength(value, position), attributes);
                case DELETE -> {
                    if (attributes != null) {
                        throw new DeltaFormatException("Operation #" + position + ": delete cannot carry attributes");
                    }
                    yield Operation.delete(readLength(value, position));
                }
            };
        } catch (IllegalArgumentException e) {
            throw new DeltaFormatException("Operation #" + position + " is invalid: " + e.getMessage(), e);
        }
    }

    private static Operation readInsert(JsonElement value, Map<String, Object> attributes, int position) {
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()) {
            return Operation.insert(value.getAsString(), attributes);
        }
        if (value.isJsonObject() && value.getAsJsonObject().size() == 1) {
            Map.Entry<String, JsonElement> entry = value.getAsJsonObject().entrySet().iterator().next();
            return Operation.insert(new Embed(entry.getKey(), fromJsonValue(entry.getValue())), attributes);
        }
        throw new DeltaFormatException("Operation #" + position + ": insert must be a string or a single-key embed object");
    }

    private static int readLength(JsonElement value, int position) {
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
            throw new DeltaFormatException("Operation #" + position + ": length must be a number, got " + value);
        }
        try {
            return new BigDecimal(value.getAsString()).intValueExact();
        } catch (ArithmeticException e) {
            throw new DeltaFormatException("Operation #" + position + ": length must be an integer, got " + value, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> readAttributes(JsonElement element, int position) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonObject()) {
            throw new DeltaFormatException("Operation #" + position + ": attributes must be an object");
        }
        return (Map<String, Object>) fromJsonValue(element);
    }

    static JsonElement toJsonValue(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof String s) {
            return new JsonPrimitive(s);
        }
        if (value instanceof Number n) {
            return new JsonPrimitive(n);
        }
        if (value instanceof Boolean b) {
            return new JsonPrimitive(b);
        }
        if (value instanceof Map<?, ?> map) {
            JsonObject object = new JsonObject();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                object.add(String.valueOf(e.getKey()), toJsonValue(e.getValue()));
            }
            return object;
        }
        if (value instanceof Iterable<?> iterable) {
            JsonArray array = new JsonArray();
            for (Object item : iterable) {
                array.add(toJsonValue(item));
            }
            return array;
        }
        throw new IllegalArgumentException("Unsupported attribute value type: " + value.getClass().getName());
    }

    static Object fromJsonValue(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> e : element.getAsJsonObject().entrySet()) {
                map.put(e.getKey(), fromJsonValue(e.getValue()));
            }
            return map;
        }
        if (element.isJsonArray()) {
            List<Object> list = new ArrayList<>();
            for (JsonElement item : element.getAsJsonArray()) {
                list.add(fromJsonValue(item));
            }
            return list;
        }

        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            return readNumber(primitive.getAsString());
        }
        return primitive.getAsString();
    }

    private static Number readNumber(String raw) {
        if (raw.indexOf('.') >= 0 || raw.indexOf('e') >= 0 || raw.indexOf('E') >= 0) {
            return Double.parseDouble(raw);
        }
        BigDecimal decimal = new BigDecimal(raw);
        try {
            return decimal.intValueExact();
        } catch (ArithmeticException notAnInt) {
            try {
                return decimal.longValueExact();
            } catch (ArithmeticException notALong) {
                return decimal.doubleValue();
            }
        }
    }
}
