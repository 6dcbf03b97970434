package com.personal.shelter_editor.schema;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Typed access to one resident record ("dweller" in the save format).
 */
public class ResidentView {

    private final JsonObject record;
    private final int index;

    public ResidentView(JsonObject record, int index) {
        this.record = record;
        this.index = index;
    }

    /**
     * Position of this resident in the save's resident list.
     */
    public int index() {
        return index;
    }

    public JsonObject record() {
        return record;
    }

    public Optional<JsonElement> get(FieldPath path) {
        return PathMutator.get(record, path);
    }

    public void set(FieldPath path, JsonElement value) {
        PathMutator.set(record, path, value);
    }

    public Optional<String> name() {
        return JsonValues.asString(get(SaveLayout.RESIDENT_NAME));
    }

    /**
     * First and last name, or a positional label when the record has no name.
     */
    public String displayName() {
        String first = name().orElse("Dweller " + (index + 1));
        return JsonValues.asString(get(SaveLayout.RESIDENT_LAST_NAME))
                .filter(last -> !last.isBlank())
                .map(last -> first + " " + last)
                .orElse(first);
    }

    public Optional<Gender> gender() {
        OptionalInt raw = JsonValues.asInt(get(SaveLayout.RESIDENT_GENDER));
        return raw.isPresent() ? Optional.of(Gender.fromRaw(raw.getAsInt())) : Optional.empty();
    }

    public void setGender(Gender gender) {
        set(SaveLayout.RESIDENT_GENDER, new JsonPrimitive(gender.rawValue()));
    }

    public boolean isPregnant() {
        return JsonValues.asBoolean(get(SaveLayout.RESIDENT_PREGNANT)).orElse(false);
    }

    public void setPregnant(boolean pregnant) {
        set(SaveLayout.RESIDENT_PREGNANT, new JsonPrimitive(pregnant));
    }

    public OptionalDouble value(ResidentField field) {
        return JsonValues.asDouble(get(field.path()));
    }

    public void setValue(ResidentField field, double value) {
        PathMutator.setNumber(record, field.path(), value);
    }

    public OptionalInt special(SpecialStat stat) {
        return JsonValues.asInt(get(stat.path()));
    }

    public void setSpecial(SpecialStat stat, int value) {
        set(stat.path(), new JsonPrimitive(value));
    }
}
