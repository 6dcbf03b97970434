package com.personal.shelter_editor.schema;

public enum Gender {
    MALE(1),
    FEMALE(2);

    private final int rawValue;

    Gender(int rawValue) {
        this.rawValue = rawValue;
    }

    public int rawValue() {
        return rawValue;
    }

    // The game only ever writes 1 or 2; anything else reads as male.
    public static Gender fromRaw(int raw) {
        return raw == FEMALE.rawValue ? FEMALE : MALE;
    }
}
