package com.personal.shelter_editor.edit;

import com.personal.shelter_editor.schema.SaveDocument;
import com.personal.shelter_editor.schema.ShelterMode;
import com.personal.shelter_editor.schema.ShelterView;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Edits the shelter's name, mode and theme.
 */
public final class ShelterEditor {

    private static final Logger LOG = LoggerFactory.getLogger(ShelterEditor.class);

    private ShelterEditor() {}

    /**
     * Applies whichever of the given values are valid; {@code null} means "leave as is".
     *
     * @param document The document to modify.
     * @param name New name; applied if not blank, stored trimmed.
     * @param mode New mode; applied if exactly {@code Normal} or {@code Survival}.
     * @param theme New theme id; applied if it is an integer of at least zero.
     * @return The number of fields written. Zero when the save has no vault section.
     */
    public static int applyShelterEdits(SaveDocument document, String name, String mode, String theme) {
        ShelterView shelter = document.shelter();
        if (!shelter.exists()) {
            LOG.debug("No vault section in save; skipping shelter edits");
            return 0;
        }

        int applied = 0;
        if (name != null && !name.trim().isEmpty()) {
            shelter.setName(name.trim());
            applied++;
        }

        if (mode != null) {
            Optional<ShelterMode> parsedMode = ShelterMode.fromRaw(mode);
            if (parsedMode.isPresent()) {
                shelter.setMode(parsedMode.get());
                applied++;
            } else {
                LOG.debug("Skipping unknown vault mode '{}'", mode);
            }
        }

        if (theme != null) {
            OptionalInt parsedTheme = NumericInput.parseInteger(theme);
            if (parsedTheme.isPresent() && parsedTheme.getAsInt() >= 0) {
                shelter.setTheme(parsedTheme.getAsInt());
                applied++;
            } else {
                LOG.debug("Skipping invalid vault theme '{}'", theme);
            }
        }

        LOG.info("Applied {} vault changes", applied);
        return applied;
    }
}
