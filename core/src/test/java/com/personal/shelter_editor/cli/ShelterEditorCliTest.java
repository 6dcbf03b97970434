package com.personal.shelter_editor.cli;

import com.personal.shelter_editor.FileSaveStorage;
import com.personal.shelter_editor.Fixtures;
import com.personal.shelter_editor.SaveCodec;
import com.personal.shelter_editor.schema.ResidentField;
import com.personal.shelter_editor.schema.ResidentView;
import com.personal.shelter_editor.schema.ResourceType;
import com.personal.shelter_editor.schema.SaveDocument;
import com.personal.shelter_editor.schema.SpecialStat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Stream;
import static org.assertj.core.api.Assertions.*;

class ShelterEditorCliTest {

    @TempDir
    Path tempDir;

    private final SaveCodec codec = new SaveCodec();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private Path saveFile;
    private ShelterEditorCli cli;

    @BeforeEach
    void setUp() throws Exception {
        saveFile = tempDir.resolve("Vault1.sav");
        Files.writeString(saveFile, Fixtures.read(Fixtures.SAVE_FILE));
        cli = newCli(new FileSaveStorage());
    }

    private ShelterEditorCli newCli(FileSaveStorage storage) {
        return new ShelterEditorCli(codec, storage,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private SaveDocument reload() throws Exception {
        return SaveDocument.parse(codec.decrypt(Files.readString(saveFile)));
    }

    private long backupCount() throws Exception {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.filter(p -> p.getFileName().toString().startsWith("Vault1.sav.backup_")).count();
        }
    }

    @Test
    void info_shouldPrintShelterSummary() {
        int code = cli.execute("info", saveFile.toString());

        assertThat(code).isEqualTo(ShelterEditorCli.EXIT_OK);
        assertThat(stdout())
                .contains("Vault Name:  111")
                .contains("Vault Mode:  Normal")
                .contains("caps")
                .contains("1520")
                .contains("Dwellers: 2")
                .contains("[0] Adam Reyes [MALE] level 3 happiness 75 health 105 SPECIAL 3/2/5/1/4/2/3")
                .contains("[1] Bea [FEMALE]")
                .contains("(pregnant)");
    }

    @Test
    void maxResources_shouldSaveInPlaceWithBackup() throws Exception {
        int code = cli.execute("max-resources", saveFile.toString());

        assertThat(code).isEqualTo(ShelterEditorCli.EXIT_OK);
        assertThat(stdout()).contains("Applied 10 resource changes").contains("Backup created");
        assertThat(reload().shelter().resource(ResourceType.CAPS)).hasValue(999_999.0);
        assertThat(backupCount()).isEqualTo(1);
    }

    @Test
    void noBackupFlag_shouldSkipBackup() throws Exception {
        int code = cli.execute("max-residents", saveFile.toString(), "--no-backup");

        assertThat(code).isEqualTo(ShelterEditorCli.EXIT_OK);
        assertThat(stdout()).contains("Applied 2 dweller changes");
        assertThat(backupCount()).isZero();
    }

    @Test
    void repeatedEditsWithinOneSecond_shouldAllBeSaved() throws Exception {
        Clock frozen = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        ShelterEditorCli frozenCli = newCli(new FileSaveStorage(frozen));

        int first = frozenCli.execute("set-resources", saveFile.toString(), "caps=10");
        int second = frozenCli.execute("set-resources", saveFile.toString(), "caps=20");

        assertThat(first).isEqualTo(ShelterEditorCli.EXIT_OK);
        assertThat(second).isEqualTo(ShelterEditorCli.EXIT_OK);
        assertThat(stderr()).isEmpty();
        assertThat(reload().shelter().resource(ResourceType.CAPS)).hasValue(20.0);
        assertThat(tempDir.resolve("Vault1.sav.backup_20240101_000000")).exists();
        assertThat(tempDir.resolve("Vault1.sav.backup_20240101_000000_1")).exists();
    }

    @Test
    void setResources_shouldApplyValidAssignmentsOnly() throws Exception {
        int code = cli.execute("set-resources", saveFile.toString(), "caps=42", "food=-3", "--no-backup");

        assertThat(code).isEqualTo(ShelterEditorCli.EXIT_OK);
        assertThat(stdout()).contains("Applied 1 resource changes");
        assertThat(reload().shelter().resource(ResourceType.CAPS)).hasValue(42.0);
        assertThat(reload().shelter().resource(ResourceType.FOOD)).hasValue(310.25);
    }

    @Test
    void setShelter_shouldReportWhenNothingChanged() throws Exception {
        String before = Files.readString(saveFile);

        int code = cli.execute("set-shelter", saveFile.toString(), "mode=Chaos");

        assertThat(code).isEqualTo(ShelterEditorCli.EXIT_OK);
        assertThat(stdout()).contains("No valid changes to apply");
        assertThat(Files.readString(saveFile)).isEqualTo(before);
    }

    @Test
    void setShelter_shouldRenameVault() throws Exception {
        int code = cli.execute("set-shelter", saveFile.toString(), "name=Vault 76", "--no-backup");

        assertThat(code).isEqualTo(ShelterEditorCli.EXIT_OK);
        assertThat(reload().shelter().name()).contains("Vault 76");
    }

    @Test
    void setResident_shouldEditOneDweller() throws Exception {
        int code = cli.execute("set-resident", saveFile.toString(), "0", "level=20", "strength=9", "luck=11", "--no-backup");

        assertThat(code).isEqualTo(ShelterEditorCli.EXIT_OK);
        assertThat(stdout()).contains("Applied 2 dweller changes");
        ResidentView adam = reload().resident(0).orElseThrow();
        assertThat(adam.value(ResidentField.LEVEL)).hasValue(20.0);
        assertThat(adam.special(SpecialStat.STRENGTH)).hasValue(9);
        assertThat(adam.special(SpecialStat.LUCK)).hasValue(3);
        assertThat(reload().resident(1).orElseThrow().value(ResidentField.LEVEL)).hasValue(1.0);
    }

    @Test
    void setResident_shouldReportMissingDweller() throws Exception {
        String before = Files.readString(saveFile);

        int code = cli.execute("set-resident", saveFile.toString(), "9", "level=20");

        assertThat(code).isEqualTo(ShelterEditorCli.EXIT_OK);
        assertThat(stdout()).contains("No valid changes to apply");
        assertThat(Files.readString(saveFile)).isEqualTo(before);
    }

    @Test
    void maxSpecial_shouldMaxOneDwellerAndApplyExtraEdits() throws Exception {
        int code = cli.execute("max-special", saveFile.toString(), "1", "happiness=100", "--no-backup");

        assertThat(code).isEqualTo(ShelterEditorCli.EXIT_OK);
        assertThat(stdout()).contains("Applied 8 dweller changes");
        ResidentView bea = reload().resident(1).orElseThrow();
        for (SpecialStat stat : SpecialStat.values()) {
            assertThat(bea.special(stat)).hasValue(10);
        }
        assertThat(bea.value(ResidentField.HAPPINESS)).hasValue(100.0);
        assertThat(reload().resident(0).orElseThrow().special(SpecialStat.STRENGTH)).hasValue(3);
    }

    @Test
    void export_shouldWritePrettyJson() throws Exception {
        Path target = tempDir.resolve("vault1.json");

        int code = cli.execute("export", saveFile.toString(), target.toString());

        assertThat(code).isEqualTo(ShelterEditorCli.EXIT_OK);
        assertThat(Files.readString(target)).contains("\"VaultName\": \"111\"");
    }

    @Test
    void import_shouldEncryptEditedJsonIntoSave() throws Exception {
        Path exported = tempDir.resolve("vault1.json");
        cli.execute("export", saveFile.toString(), exported.toString());
        Files.writeString(exported, Files.readString(exported).replace("\"VaultName\": \"111\"", "\"VaultName\": \"222\""));

        int code = cli.execute("import", saveFile.toString(), exported.toString());

        assertThat(code).isEqualTo(ShelterEditorCli.EXIT_OK);
        assertThat(stdout()).contains("Imported JSON from").contains("Backup created");
        assertThat(reload().shelter().name()).contains("222");
        assertThat(reload().shelter().resource(ResourceType.CAPS)).hasValue(1520.5);
        assertThat(backupCount()).isEqualTo(1);
    }

    @Test
    void import_shouldLeaveSaveUntouchedOnInvalidJson() throws Exception {
        String before = Files.readString(saveFile);
        Path broken = Files.writeString(tempDir.resolve("broken.json"), "{\"vault\": ");

        int code = cli.execute("import", saveFile.toString(), broken.toString());

        assertThat(code).isEqualTo(ShelterEditorCli.EXIT_FAILURE);
        assertThat(stderr()).contains("Error loading save file");
        assertThat(Files.readString(saveFile)).isEqualTo(before);
        assertThat(backupCount()).isZero();
    }

    @Test
    void corruptedSave_shouldFailWithDecryptionMessage() throws Exception {
        Files.writeString(saveFile, "garbage!!");

        int code = cli.execute("info", saveFile.toString());

        assertThat(code).isEqualTo(ShelterEditorCli.EXIT_FAILURE);
        assertThat(stderr()).contains("Decryption failed (INVALID_BASE64)");
    }

    @Test
    void missingSave_shouldFailWithIoMessage() {
        int code = cli.execute("info", tempDir.resolve("nowhere.sav").toString());

        assertThat(code).isEqualTo(ShelterEditorCli.EXIT_FAILURE);
        assertThat(stderr()).contains("I/O error: Save file not found");
    }

    @Test
    void badArguments_shouldPrintUsage() {
        assertThat(cli.execute()).isEqualTo(ShelterEditorCli.EXIT_USAGE);
        assertThat(cli.execute("info")).isEqualTo(ShelterEditorCli.EXIT_USAGE);
        assertThat(cli.execute("explode", saveFile.toString())).isEqualTo(ShelterEditorCli.EXIT_USAGE);
        assertThat(cli.execute("set-resources", saveFile.toString(), "caps")).isEqualTo(ShelterEditorCli.EXIT_USAGE);
        assertThat(cli.execute("set-resident", saveFile.toString(), "first", "level=2")).isEqualTo(ShelterEditorCli.EXIT_USAGE);
        assertThat(stderr())
                .contains("Usage:")
                .contains("Missing required subcommand")
                .contains("explode")
                .contains("KEY=VALUE");
    }
}
