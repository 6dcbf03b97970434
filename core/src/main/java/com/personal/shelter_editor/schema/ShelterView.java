package com.personal.shelter_editor.schema;

import com.google.gson.JsonPrimitive;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Typed access to the shelter section of a save document.
 *
 * Getters report absence explicitly instead of falling back to defaults.
 * Setters write unconditionally through {@link PathMutator}; validation is
 * the job of the editors.
 */
public class ShelterView {

    private final SaveDocument document;

    ShelterView(SaveDocument document) {
        this.document = document;
    }

    public boolean exists() {
        return PathMutator.getObject(document.root(), SaveLayout.VAULT).isPresent();
    }

    public Optional<String> name() {
        return JsonValues.asString(document.get(SaveLayout.VAULT_NAME));
    }

    public void setName(String name) {
        document.set(SaveLayout.VAULT_NAME, new JsonPrimitive(name));
    }

    /**
     * The mode as written, even if it is not one the editor knows.
     */
    public Optional<String> rawMode() {
        return JsonValues.asString(document.get(SaveLayout.VAULT_MODE));
    }

    public Optional<ShelterMode> mode() {
        return rawMode().flatMap(ShelterMode::fromRaw);
    }

    public void setMode(ShelterMode mode) {
        document.set(SaveLayout.VAULT_MODE, new JsonPrimitive(mode.rawValue()));
    }

    public OptionalInt theme() {
        return JsonValues.asInt(document.get(SaveLayout.VAULT_THEME));
    }

    public void setTheme(int theme) {
        document.set(SaveLayout.VAULT_THEME, new JsonPrimitive(theme));
    }

    public boolean hasResources() {
        return PathMutator.getObject(document.root(), SaveLayout.RESOURCES).isPresent();
    }

    public OptionalDouble resource(ResourceType type) {
        return JsonValues.asDouble(document.get(type.path()));
    }

    public void setResource(ResourceType type, double amount) {
        PathMutator.setNumber(document.root(), type.path(), amount);
    }

    /**
     * Every known resource present in the save, in table order.
     */
    public Map<ResourceType, Double> resources() {
        Map<ResourceType, Double> amounts = new EnumMap<>(ResourceType.class);
        for (ResourceType type : ResourceType.values()) {
            resource(type).ifPresent(amount -> amounts.put(type, amount));
        }
        return amounts;
    }
}
