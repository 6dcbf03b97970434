package com.personal.shelter_editor.schema;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import java.io.IOException;
import java.io.StringReader;

/**
 * Reads save text into a Gson tree and writes it back.
 *
 * Parsing is strict (no comments, unquoted names or trailing garbage). Object
 * members keep their input order and numbers keep their literal text, so a
 * document that is only read and written comes back unchanged apart from
 * whitespace.
 */
public final class SaveJson {

    private static final Gson COMPACT = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private static final Gson PRETTY = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .setPrettyPrinting()
            .create();

    private static final TypeAdapter<JsonElement> ELEMENT_ADAPTER = COMPACT.getAdapter(JsonElement.class);

    private SaveJson() {}

    /**
     * Parses JSON text whose root must be an object.
     *
     * @param json The decrypted save text.
     * @return The root object.
     * @throws ParseException If the text is not valid JSON or the root is not an object.
     */
    public static JsonObject parseObject(String json) throws ParseException {
        if (json == null) {
            throw new ParseException("Save data is empty.");
        }
        JsonElement root;
        try (JsonReader reader = new JsonReader(new StringReader(json))) {
            reader.setLenient(false);
            root = ELEMENT_ADAPTER.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new ParseException("Unexpected content after the end of the save document.");
            }
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new ParseException("Save data is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isJsonObject()) {
            throw new ParseException("Save data must be a JSON object.");
        }
        return root.getAsJsonObject();
    }

    /**
     * Renders a tree as compact JSON, the form the game writes itself.
     */
    public static String serialize(JsonElement tree) {
        return COMPACT.toJson(tree);
    }

    /**
     * Renders a tree as indented JSON for people to read.
     */
    public static String serializePretty(JsonElement tree) {
        return PRETTY.toJson(tree);
    }
}
