package com.personal.shelter_editor;

import com.personal.shelter_editor.edit.ResidentEditor;
import com.personal.shelter_editor.edit.ResourceEditor;
import com.personal.shelter_editor.edit.ShelterEditor;
import com.personal.shelter_editor.schema.ParseException;
import com.personal.shelter_editor.schema.ResidentView;
import com.personal.shelter_editor.schema.SaveDocument;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One editing session over a single save document.
 *
 * The session owns the open document, the file it came from and whether it has
 * unsaved changes. Opening another save replaces the document without merging.
 * A load that fails leaves the previous document in place.
 */
public class SaveEditorSession {

    private static final Logger LOG = LoggerFactory.getLogger(SaveEditorSession.class);

    private final SaveCodecInterface codec;
    private final SaveFileVault vault;

    private SaveDocument document;
    private Path currentFile;
    private boolean modified;

    /**
     * @param codec The codec for save containers.
     * @param storage Where save files are read from and written to.
     */
    public SaveEditorSession(SaveCodecInterface codec, SaveStorage storage) {
        this.codec = codec;
        this.vault = new SaveFileVault(codec, storage);
    }

    /**
     * Loads a save file and makes it the open document.
     *
     * @throws IOException If the file cannot be read.
     * @throws DecodeException If the file is not a valid save container.
     * @throws ParseException If the decrypted content is not a JSON object.
     */
    public SaveDocument openFile(Path file) throws IOException, DecodeException, ParseException {
        SaveDocument loaded;
        try {
            loaded = SaveDocument.parse(vault.loadData(file));
        } catch (IOException | DecodeException | ParseException e) {
            LOG.warn("Error loading save file {}: {}", file, e.getMessage());
            throw e;
        }
        install(loaded, file);
        LOG.info("Save file loaded successfully: {}", file);
        return loaded;
    }

    /**
     * Loads a save container held in memory. The session has no file afterwards,
     * so {@link #save()} needs a prior {@link #saveAs(Path)}.
     */
    public SaveDocument open(String cipherBase64) throws DecodeException, ParseException {
        SaveDocument loaded = SaveDocument.parse(codec.decrypt(cipherBase64));
        install(loaded, null);
        return loaded;
    }

    /**
     * Replaces the open document with hand-edited JSON text. The current file is
     * kept and the session is marked modified. Invalid JSON leaves the session as
     * it was.
     *
     * @throws ParseException If {@code json} is not a JSON object.
     */
    public SaveDocument importJson(String json) throws ParseException {
        SaveDocument imported = SaveDocument.parse(json);
        this.document = imported;
        this.modified = true;
        LOG.info("Imported raw JSON ({} characters)", json.length());
        return imported;
    }

    private void install(SaveDocument loaded, Path file) {
        this.document = loaded;
        this.currentFile = file;
        this.modified = false;
    }

    public boolean isLoaded() {
        return document != null;
    }

    public boolean isModified() {
        return modified;
    }

    public Optional<Path> currentFile() {
        return Optional.ofNullable(currentFile);
    }

    /**
     * @throws IllegalStateException If no save is loaded.
     */
    public SaveDocument document() {
        if (document == null) {
            throw new IllegalStateException("No save data loaded");
        }
        return document;
    }

    public int applyResourceEdits(Map<String, ?> edits) {
        return track(ResourceEditor.applyResourceEdits(document(), edits));
    }

    public int maxAllResources() {
        return track(ResourceEditor.maxAllResources(document()));
    }

    public int applyShelterEdits(String name, String mode, String theme) {
        return track(ShelterEditor.applyShelterEdits(document(), name, mode, theme));
    }

    /**
     * @return The number of edits applied; 0 if there is no resident at {@code index}.
     */
    public int applyResidentEdits(int index, Map<String, ?> edits) {
        return resident(index)
                .map(resident -> track(ResidentEditor.applyResidentEdits(resident, edits)))
                .orElse(0);
    }

    public int maxResidentSpecial(int index, Map<String, ?> edits) {
        return resident(index)
                .map(resident -> track(ResidentEditor.maxResidentSpecial(resident, edits)))
                .orElse(0);
    }

    public int maxAllResidents() {
        return track(ResidentEditor.maxAllResidents(document()));
    }

    private Optional<ResidentView> resident(int index) {
        Optional<ResidentView> resident = document().resident(index);
        if (resident.isEmpty()) {
            LOG.warn("Dweller {} not found", index);
        }
        return resident;
    }

    private int track(int applied) {
        if (applied > 0) {
            modified = true;
        }
        return applied;
    }

    /**
     * Serializes and encrypts the open document without writing it anywhere.
     */
    public String export() {
        return codec.encrypt(document().toJson());
    }

    /**
     * Writes the open document back to the file it was loaded from.
     *
     * @throws IllegalStateException If nothing is loaded or the document has no file.
     */
    public void save() throws IOException {
        if (currentFile == null) {
            throw new IllegalStateException("No file loaded to save");
        }
        saveAs(currentFile);
    }

    /**
     * Writes the open document to {@code file}, which becomes the current file.
     */
    public void saveAs(Path file) throws IOException {
        vault.saveData(file, document().toJson());
        currentFile = file;
        modified = false;
    }

    /**
     * Copies the current file to a timestamped backup.
     *
     * @return The backup path.
     * @throws IllegalStateException If the session has no file.
     */
    public Path createBackup() throws IOException {
        if (currentFile == null) {
            throw new IllegalStateException("No file loaded to backup");
        }
        return vault.backup(currentFile);
    }
}
