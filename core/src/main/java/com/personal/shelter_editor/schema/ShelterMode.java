package com.personal.shelter_editor.schema;

import java.util.Optional;

public enum ShelterMode {
    NORMAL("Normal"),
    SURVIVAL("Survival");

    private final String rawValue;

    ShelterMode(String rawValue) {
        this.rawValue = rawValue;
    }

    public String rawValue() {
        return rawValue;
    }

    /**
     * Matches the exact spelling the game writes.
     */
    public static Optional<ShelterMode> fromRaw(String raw) {
        for (ShelterMode mode : values()) {
            if (mode.rawValue.equals(raw)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
