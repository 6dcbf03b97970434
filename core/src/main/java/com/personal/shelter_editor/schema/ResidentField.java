package com.personal.shelter_editor.schema;

import java.util.Optional;

/**
 * Numeric resident attributes and where each lives inside a resident record.
 * None of them is range-checked on write.
 */
public enum ResidentField {
    LEVEL("level", FieldPath.of("experience", "currentLevel")),
    EXPERIENCE("experience", FieldPath.of("experience", "experienceValue")),
    HAPPINESS("happiness", FieldPath.of("happiness", "happinessValue")),
    HEALTH("health", FieldPath.of("health", "healthValue"));

    private final String logicalName;
    private final FieldPath path;

    ResidentField(String logicalName, FieldPath path) {
        this.logicalName = logicalName;
        this.path = path;
    }

    public String logicalName() {
        return logicalName;
    }

    public FieldPath path() {
        return path;
    }

    public static Optional<ResidentField> fromLogicalName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (ResidentField field : values()) {
            if (field.logicalName.equalsIgnoreCase(name.trim())) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
