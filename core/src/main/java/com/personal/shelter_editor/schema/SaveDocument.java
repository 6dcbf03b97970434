package com.personal.shelter_editor.schema;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A decrypted save, held as a mutable Gson tree.
 *
 * The document is edited in place. Sections are checked only when an
 * operation needs them: a save without residents still parses, it simply has
 * an empty {@link #residents()} list.
 */
public final class SaveDocument {

    private final JsonObject root;

    public SaveDocument(JsonObject root) {
        if (root == null) {
            throw new IllegalArgumentException("Document root cannot be null.");
        }
        this.root = root;
    }

    /**
     * Parses decrypted save text.
     *
     * @throws ParseException If the text is not JSON or its root is not an object.
     */
    public static SaveDocument parse(String json) throws ParseException {
        return new SaveDocument(SaveJson.parseObject(json));
    }

    public JsonObject root() {
        return root;
    }

    public Optional<JsonElement> get(FieldPath path) {
        return PathMutator.get(root, path);
    }

    public void set(FieldPath path, JsonElement value) {
        PathMutator.set(root, path, value);
    }

    public ShelterView shelter() {
        return new ShelterView(this);
    }

    /**
     * The resident list, if the save has one.
     */
    public Optional<JsonArray> residentArray() {
        return PathMutator.getArray(root, SaveLayout.RESIDENTS);
    }

    /**
     * Views over every resident record. Entries that are not objects are skipped
     * but keep their index, so indexes always match the raw list.
     */
    public List<ResidentView> residents() {
        Optional<JsonArray> array = residentArray();
        if (array.isEmpty()) {
            return Collections.emptyList();
        }
        List<ResidentView> views = new ArrayList<>();
        JsonArray entries = array.get();
        for (int i = 0; i < entries.size(); i++) {
            JsonElement entry = entries.get(i);
            if (entry.isJsonObject()) {
                views.add(new ResidentView(entry.getAsJsonObject(), i));
            }
        }
        return views;
    }

    /**
     * The resident at a raw list index; empty if out of range or not an object.
     */
    public Optional<ResidentView> resident(int index) {
        Optional<JsonArray> array = residentArray();
        if (array.isEmpty() || index < 0 || index >= array.get().size()) {
            return Optional.empty();
        }
        JsonElement entry = array.get().get(index);
        return entry.isJsonObject() ? Optional.of(new ResidentView(entry.getAsJsonObject(), index)) : Optional.empty();
    }

    /**
     * Compact JSON text, ready for encryption.
     */
    public String toJson() {
        return SaveJson.serialize(root);
    }

    public String toPrettyJson() {
        return SaveJson.serializePretty(root);
    }
}
