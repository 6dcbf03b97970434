package com.personal.shelter_editor.schema;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * The resources a shelter stores, keyed by the name editors use and mapped to
 * the key the game writes under {@code vault.storage.resources}.
 *
 * Adding a resource only takes a new constant here.
 */
public enum ResourceType {
    CAPS("caps", "Nuka", 999_999),
    FOOD("food", "Food", 999_999),
    WATER("water", "Water", 999_999),
    POWER("power", "Energy", 999_999),
    STIMPAKS("stimpaks", "StimPack", 999_999),
    RADAWAY("radaway", "RadAway", 999_999),
    QUANTUM("quantum", "NukaColaQuantum", 999),
    LUNCHBOX("lunchbox", "Lunchbox", 999),
    ROBOT_COMPANION("robotCompanion", "MrHandy", 99),
    PET_CARRIER("petCarrier", "PetCarrier", 999),
    // Editable, but never touched by "max all"
    CRAFTED_OUTFIT("craftedOutfit", "CraftedOutfit"),
    CRAFTED_WEAPON("craftedWeapon", "CraftedWeapon"),
    CRAFTED_THEME("craftedTheme", "CraftedTheme");

    private static final long NO_CEILING = -1;

    private final String logicalName;
    private final String rawKey;
    private final long maxAmount;

    ResourceType(String logicalName, String rawKey) {
        this(logicalName, rawKey, NO_CEILING);
    }

    ResourceType(String logicalName, String rawKey, long maxAmount) {
        this.logicalName = logicalName;
        this.rawKey = rawKey;
        this.maxAmount = maxAmount;
    }

    public String logicalName() {
        return logicalName;
    }

    public String rawKey() {
        return rawKey;
    }

    /**
     * The amount "max all resources" sets, if this resource takes part in it.
     */
    public OptionalLong maxAmount() {
        return maxAmount == NO_CEILING ? OptionalLong.empty() : OptionalLong.of(maxAmount);
    }

    public FieldPath path() {
        return SaveLayout.RESOURCES.child(rawKey);
    }

    /**
     * Finds a resource by its logical name, ignoring case.
     */
    public static Optional<ResourceType> fromLogicalName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (ResourceType type : values()) {
            if (type.logicalName.equalsIgnoreCase(name.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
