package com.personal.shelter_editor.edit;

import com.personal.shelter_editor.schema.ResourceType;
import com.personal.shelter_editor.schema.SaveDocument;
import com.personal.shelter_editor.schema.ShelterView;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Batch edits on the shelter's stored resources.
 */
public final class ResourceEditor {

    private static final Logger LOG = LoggerFactory.getLogger(ResourceEditor.class);

    private ResourceEditor() {}

    /**
     * Writes resource amounts by logical name ({@code caps}, {@code food}, ...).
     *
     * An edit is applied when its name is a known {@link ResourceType} and its
     * value is a finite number of at least zero. Anything else is skipped without
     * an error. Nothing is written when the save has no resource section.
     *
     * @param document The document to modify.
     * @param edits Logical resource name to amount, as a {@link Number} or text.
     * @return The number of edits applied.
     */
    public static int applyResourceEdits(SaveDocument document, Map<String, ?> edits) {
        ShelterView shelter = document.shelter();
        if (!shelter.hasResources()) {
            LOG.debug("No vault storage resources in save; skipping {} resource edits", edits.size());
            return 0;
        }

        int applied = 0;
        for (Map.Entry<String, ?> edit : edits.entrySet()) {
            ResourceType type = ResourceType.fromLogicalName(edit.getKey()).orElse(null);
            if (type == null) {
                LOG.debug("Skipping unknown resource '{}'", edit.getKey());
                continue;
            }
            OptionalDouble amount = NumericInput.parseFinite(edit.getValue());
            if (amount.isEmpty() || amount.getAsDouble() < 0) {
                LOG.debug("Skipping invalid amount '{}' for {}", edit.getValue(), type.rawKey());
                continue;
            }
            LOG.debug("Changing {} from {} to {}", type.rawKey(), shelter.resource(type), amount.getAsDouble());
            shelter.setResource(type, amount.getAsDouble());
            applied++;
        }
        LOG.info("Applied {} resource changes", applied);
        return applied;
    }

    /**
     * Sets every resource that has a ceiling to that ceiling.
     *
     * @return The number of resources written.
     */
    public static int maxAllResources(SaveDocument document) {
        Map<String, Object> ceilings = new LinkedHashMap<>();
        for (ResourceType type : ResourceType.values()) {
            type.maxAmount().ifPresent(max -> ceilings.put(type.logicalName(), max));
        }
        return applyResourceEdits(document, ceilings);
    }
}
