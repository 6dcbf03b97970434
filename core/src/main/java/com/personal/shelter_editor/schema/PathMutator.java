package com.personal.shelter_editor.schema;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes values in a Gson tree by {@link FieldPath}.
 *
 * Writes always succeed: missing intermediate objects are created, and an
 * intermediate that holds a non-object value is replaced by an empty object.
 * After {@code set(root, p, v)}, {@code get(root, p)} returns {@code v}.
 */
public final class PathMutator {

    private PathMutator() {}

    /**
     * Looks up the value at a path.
     *
     * @return The value, or empty if any segment is missing. A JSON {@code null}
     * stored at the path is returned as {@link JsonNull}, not as empty.
     */
    public static Optional<JsonElement> get(JsonObject root, FieldPath path) {
        JsonElement current = root;
        for (String segment : path.segments()) {
            if (current == null || !current.isJsonObject()) {
                return Optional.empty();
            }
            current = current.getAsJsonObject().get(segment);
        }
        return Optional.ofNullable(current);
    }

    /**
     * Looks up an object at a path; empty if missing or not an object.
     */
    public static Optional<JsonObject> getObject(JsonObject root, FieldPath path) {
        return get(root, path).filter(JsonElement::isJsonObject).map(JsonElement::getAsJsonObject);
    }

    /**
     * Looks up an array at a path; empty if missing or not an array.
     */
    public static Optional<JsonArray> getArray(JsonObject root, FieldPath path) {
        return get(root, path).filter(JsonElement::isJsonArray).map(JsonElement::getAsJsonArray);
    }

    /**
     * Writes a value at a path, creating containers on the way.
     *
     * @param root The tree to modify in place.
     * @param path Where to write.
     * @param value The value; {@code null} is stored as JSON {@code null}.
     */
    public static void set(JsonObject root, FieldPath path, JsonElement value) {
        List<String> segments = path.segments();
        JsonObject current = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            String segment = segments.get(i);
            JsonElement next = current.get(segment);
            if (next == null || !next.isJsonObject()) {
                next = new JsonObject();
                current.add(segment, next);
            }
            current = next.getAsJsonObject();
        }
        current.add(path.leaf(), value == null ? JsonNull.INSTANCE : value);
    }

    /**
     * Writes a number at a path. Whole numbers are stored as JSON integers.
     */
    public static void setNumber(JsonObject root, FieldPath path, double value) {
        set(root, path, JsonValues.number(value));
    }
}
