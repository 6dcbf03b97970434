package com.personal.shelter_editor.schema;

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Conversions between Gson leaves and Java values.
 */
public final class JsonValues {

    private JsonValues() {}

    /**
     * Wraps a number, writing whole values without a fraction (999999, not 999999.0).
     */
    public static JsonPrimitive number(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 0x1p53) {
            return new JsonPrimitive((long) value);
        }
        return new JsonPrimitive(value);
    }

    public static OptionalDouble asDouble(Optional<JsonElement> element) {
        return element.filter(JsonValues::isNumber)
                .map(e -> OptionalDouble.of(e.getAsDouble()))
                .orElse(OptionalDouble.empty());
    }

    /**
     * Reads an integer leaf; numbers with a fraction are truncated toward zero.
     */
    public static OptionalInt asInt(Optional<JsonElement> element) {
        return element.filter(JsonValues::isNumber)
                .map(e -> OptionalInt.of((int) e.getAsDouble()))
                .orElse(OptionalInt.empty());
    }

    public static Optional<String> asString(Optional<JsonElement> element) {
        return element.filter(e -> e.isJsonPrimitive() && e.getAsJsonPrimitive().isString())
                .map(JsonElement::getAsString);
    }

    public static Optional<Boolean> asBoolean(Optional<JsonElement> element) {
        return element.filter(e -> e.isJsonPrimitive() && e.getAsJsonPrimitive().isBoolean())
                .map(JsonElement::getAsBoolean);
    }

    private static boolean isNumber(JsonElement element) {
        return element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber();
    }
}
