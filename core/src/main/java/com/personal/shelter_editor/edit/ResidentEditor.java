package com.personal.shelter_editor.edit;

import com.google.gson.JsonArray;
import com.personal.shelter_editor.schema.ResidentField;
import com.personal.shelter_editor.schema.ResidentView;
import com.personal.shelter_editor.schema.SaveDocument;
import com.personal.shelter_editor.schema.SpecialStat;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Edits resident records.
 *
 * Level, experience, happiness and health take any finite number; the game's
 * nominal ranges (level 1-50, happiness and health 0-100) are not enforced.
 * SPECIAL stats only take whole numbers from 1 to 10.
 */
public final class ResidentEditor {

    private static final Logger LOG = LoggerFactory.getLogger(ResidentEditor.class);

    public static final int MAX_LEVEL = 50;
    /** Experience the game requires for level 50. */
    public static final int MAX_LEVEL_EXPERIENCE = 2_916_000;
    public static final int MAX_HAPPINESS = 100;
    public static final int MAX_HEALTH = 100;

    private ResidentEditor() {}

    /**
     * Applies edits keyed by logical name: a {@link ResidentField} name
     * ({@code level}, {@code happiness}, ...) or a {@link SpecialStat} name
     * ({@code strength}, {@code luck}, ...). Values may be numbers or text.
     * Invalid values and unknown names are skipped one by one.
     *
     * @return The number of edits applied.
     */
    public static int applyResidentEdits(ResidentView resident, Map<String, ?> edits) {
        int applied = 0;
        for (Map.Entry<String, ?> edit : edits.entrySet()) {
            if (applyEdit(resident, edit.getKey(), edit.getValue())) {
                applied++;
            }
        }
        LOG.info("Applied {} changes to {}", applied, resident.displayName());
        return applied;
    }

    /**
     * Sets all seven SPECIAL stats to 10 on one resident.
     *
     * @return Always 7.
     */
    public static int maxResidentSpecial(ResidentView resident) {
        return maxResidentSpecial(resident, Collections.emptyMap());
    }

    /**
     * Sets all seven SPECIAL stats to 10, then applies the remaining edits.
     * SPECIAL entries in {@code edits} are ignored since they are overridden.
     *
     * @return 7 plus the number of other edits applied.
     */
    public static int maxResidentSpecial(ResidentView resident, Map<String, ?> edits) {
        for (SpecialStat stat : SpecialStat.values()) {
            resident.setSpecial(stat, SpecialStat.MAX_VALUE);
        }
        int applied = SpecialStat.values().length;
        for (Map.Entry<String, ?> edit : edits.entrySet()) {
            if (SpecialStat.fromLogicalName(edit.getKey()).isPresent()) {
                continue;
            }
            if (applyEdit(resident, edit.getKey(), edit.getValue())) {
                applied++;
            }
        }
        LOG.info("Maxed SPECIAL for {} ({} changes)", resident.displayName(), applied);
        return applied;
    }

    /**
     * Forces every resident to level 50 with full experience, happiness, health
     * and SPECIAL. Values are written directly, creating any missing sections.
     *
     * @return The number of residents processed; 0 if the save has no residents.
     */
    public static int maxAllResidents(SaveDocument document) {
        Optional<JsonArray> array = document.residentArray();
        if (array.isEmpty() || array.get().size() == 0) {
            LOG.debug("No dwellers found in save");
            return 0;
        }

        List<ResidentView> residents = document.residents();
        for (ResidentView resident : residents) {
            resident.setValue(ResidentField.LEVEL, MAX_LEVEL);
            resident.setValue(ResidentField.EXPERIENCE, MAX_LEVEL_EXPERIENCE);
            resident.setValue(ResidentField.HAPPINESS, MAX_HAPPINESS);
            resident.setValue(ResidentField.HEALTH, MAX_HEALTH);
            for (SpecialStat stat : SpecialStat.values()) {
                resident.setSpecial(stat, SpecialStat.MAX_VALUE);
            }
        }
        LOG.info("Maxed out {} dwellers", residents.size());
        return residents.size();
    }

    private static boolean applyEdit(ResidentView resident, String key, Object value) {
        Optional<ResidentField> field = ResidentField.fromLogicalName(key);
        if (field.isPresent()) {
            OptionalDouble number = NumericInput.parseFinite(value);
            if (number.isEmpty()) {
                LOG.debug("Skipping non-numeric {} '{}'", key, value);
                return false;
            }
            resident.setValue(field.get(), number.getAsDouble());
            return true;
        }

        Optional<SpecialStat> stat = SpecialStat.fromLogicalName(key);
        if (stat.isPresent()) {
            OptionalInt number = NumericInput.parseInteger(value);
            if (number.isEmpty() || !SpecialStat.isValid(number.getAsInt())) {
                LOG.debug("Skipping out-of-range {} '{}'", key, value);
                return false;
            }
            resident.setSpecial(stat.get(), number.getAsInt());
            return true;
        }

        LOG.debug("Skipping unknown resident field '{}'", key);
        return false;
    }
}
