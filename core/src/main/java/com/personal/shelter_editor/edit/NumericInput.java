package com.personal.shelter_editor.edit;

import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Reads edit values that arrive either as numbers or as text typed by a user.
 */
final class NumericInput {

    private NumericInput() {}

    /**
     * @return The value as a finite double, or empty for blank text, text that is
     * not a number, NaN and infinities.
     */
    static OptionalDouble parseFinite(Object value) {
        double parsed;
        if (value instanceof Number) {
            parsed = ((Number) value).doubleValue();
        } else if (value instanceof CharSequence) {
            String text = value.toString().trim();
            if (text.isEmpty()) {
                return OptionalDouble.empty();
            }
            try {
                parsed = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        } else {
            return OptionalDouble.empty();
        }
        return Double.isFinite(parsed) ? OptionalDouble.of(parsed) : OptionalDouble.empty();
    }

    /**
     * @return The value as an int if it is a finite number without a fraction
     * that fits in an int.
     */
    static OptionalInt parseInteger(Object value) {
        OptionalDouble parsed = parseFinite(value);
        if (parsed.isEmpty()) {
            return OptionalInt.empty();
        }
        double number = parsed.getAsDouble();
        if (number != Math.rint(number) || number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) number);
    }
}
