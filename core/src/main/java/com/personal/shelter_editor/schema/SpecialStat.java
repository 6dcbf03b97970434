package com.personal.shelter_editor.schema;

import java.util.Optional;

/**
 * The seven SPECIAL attributes, stored under
 * {@code serializeableSpecialStats.stats} with keys "1" to "7".
 */
public enum SpecialStat {
    STRENGTH(1, "strength"),
    PERCEPTION(2, "perception"),
    ENDURANCE(3, "endurance"),
    CHARISMA(4, "charisma"),
    INTELLIGENCE(5, "intelligence"),
    AGILITY(6, "agility"),
    LUCK(7, "luck");

    public static final int MIN_VALUE = 1;
    public static final int MAX_VALUE = 10;

    private final int id;
    private final String logicalName;

    SpecialStat(int id, String logicalName) {
        this.id = id;
        this.logicalName = logicalName;
    }

    public int id() {
        return id;
    }

    public String logicalName() {
        return logicalName;
    }

    /**
     * Path relative to a resident record.
     */
    public FieldPath path() {
        return SaveLayout.RESIDENT_SPECIAL.child(Integer.toString(id));
    }

    public static boolean isValid(int value) {
        return value >= MIN_VALUE && value <= MAX_VALUE;
    }

    public static Optional<SpecialStat> fromLogicalName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (SpecialStat stat : values()) {
            if (stat.logicalName.equalsIgnoreCase(name.trim())) {
                return Optional.of(stat);
            }
        }
        return Optional.empty();
    }
}
