package com.personal.shelter_editor.cli;

import com.personal.shelter_editor.DecodeException;
import com.personal.shelter_editor.FileSaveStorage;
import com.personal.shelter_editor.SaveCodec;
import com.personal.shelter_editor.SaveCodecInterface;
import com.personal.shelter_editor.SaveEditorSession;
import com.personal.shelter_editor.SaveStorage;
import com.personal.shelter_editor.schema.ParseException;
import com.personal.shelter_editor.schema.ResidentField;
import com.personal.shelter_editor.schema.ResidentView;
import com.personal.shelter_editor.schema.ResourceType;
import com.personal.shelter_editor.schema.SaveDocument;
import com.personal.shelter_editor.schema.ShelterView;
import com.personal.shelter_editor.schema.SpecialStat;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Console front end for the save editor.
 *
 * Every subcommand takes the save file as its first parameter. Editing
 * commands back the save up before overwriting it unless {@code --no-backup}
 * is given. Dwellers are addressed by their position in the save, starting at
 * 0, as listed by {@code info}.
 */
@Command(
        name = "shelter-editor",
        mixinStandardHelpOptions = true,
        version = "shelter-editor 1.0",
        description = "Inspect and edit encrypted shelter save files.",
        subcommands = {
                HelpCommand.class,
                ShelterEditorCli.InfoCommand.class,
                ShelterEditorCli.ExportCommand.class,
                ShelterEditorCli.ImportCommand.class,
                ShelterEditorCli.BackupCommand.class,
                ShelterEditorCli.MaxResourcesCommand.class,
                ShelterEditorCli.MaxResidentsCommand.class,
                ShelterEditorCli.SetResourcesCommand.class,
                ShelterEditorCli.SetShelterCommand.class,
                ShelterEditorCli.SetResidentCommand.class,
                ShelterEditorCli.MaxSpecialCommand.class
        })
public final class ShelterEditorCli implements Runnable {

    static final int EXIT_OK = CommandLine.ExitCode.OK;
    static final int EXIT_FAILURE = CommandLine.ExitCode.SOFTWARE;
    static final int EXIT_USAGE = CommandLine.ExitCode.USAGE;

    private final SaveStorage storage;
    private final SaveEditorSession session;
    private final PrintStream out;
    private final PrintStream err;

    @Spec
    CommandSpec spec;

    public ShelterEditorCli(SaveCodecInterface codec, SaveStorage storage, PrintStream out, PrintStream err) {
        this.storage = storage;
        this.session = new SaveEditorSession(codec, storage);
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        ShelterEditorCli cli = new ShelterEditorCli(new SaveCodec(), new FileSaveStorage(), System.out, System.err);
        System.exit(cli.execute(args));
    }

    /**
     * Parses {@code args} and runs the selected subcommand.
     *
     * @return The process exit code.
     */
    public int execute(String... args) {
        return new CommandLine(this)
                .setOut(new PrintWriter(out, true))
                .setErr(new PrintWriter(err, true))
                .setExecutionExceptionHandler(this::handleFailure)
                .execute(args);
    }

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    private int handleFailure(Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult)
            throws Exception {
        if (e instanceof DecodeException) {
            err.println("Decryption failed (" + ((DecodeException) e).getReason() + "): " + e.getMessage());
        } else if (e instanceof ParseException) {
            err.println("Error loading save file: " + e.getMessage());
        } else if (e instanceof IOException) {
            err.println("I/O error: " + e.getMessage());
        } else {
            throw e;
        }
        return EXIT_FAILURE;
    }

    /**
     * Base for subcommands that work on one save file.
     */
    abstract static class SaveCommand implements Callable<Integer> {

        @ParentCommand
        ShelterEditorCli cli;

        @Parameters(index = "0", paramLabel = "SAVE", description = "The encrypted save file.")
        Path saveFile;

        @Override
        public Integer call() throws Exception {
            cli.session.openFile(saveFile);
            return run(cli.session);
        }

        abstract int run(SaveEditorSession session) throws Exception;
    }

    /**
     * Base for subcommands that write the save back in place.
     */
    abstract static class EditCommand extends SaveCommand {

        @Option(names = "--no-backup", description = "Overwrite the save without backing it up first.")
        boolean noBackup;

        int finishEdit(int applied, String what) throws IOException {
            if (applied == 0) {
                cli.out.println("No valid changes to apply");
                return EXIT_OK;
            }
            saveInPlace();
            cli.out.println("Applied " + applied + " " + what + " changes");
            cli.out.println("File saved successfully");
            return EXIT_OK;
        }

        void saveInPlace() throws IOException {
            if (!noBackup) {
                cli.out.println("Backup created: " + cli.session.createBackup());
            }
            cli.session.save();
        }
    }

    @Command(name = "info", description = "Print the vault, its resources and its dwellers.")
    static final class InfoCommand extends SaveCommand {

        @Override
        int run(SaveEditorSession session) {
            cli.printInfo(session.document());
            return EXIT_OK;
        }
    }

    @Command(name = "export", description = "Write the decrypted save as pretty-printed JSON.")
    static final class ExportCommand extends SaveCommand {

        @Parameters(index = "1", arity = "0..1", paramLabel = "OUT", description = "Target JSON file; stdout if omitted.")
        Path target;

        @Override
        int run(SaveEditorSession session) throws IOException {
            String json = session.document().toPrettyJson();
            if (target == null) {
                cli.out.println(json);
            } else {
                cli.storage.writeText(target, json);
                cli.out.println("Exported JSON to " + target);
            }
            return EXIT_OK;
        }
    }

    @Command(name = "import", description = "Replace the save's content with a JSON file and re-encrypt it.")
    static final class ImportCommand extends EditCommand {

        @Parameters(index = "1", paramLabel = "IN", description = "The JSON file to import.")
        Path source;

        @Override
        int run(SaveEditorSession session) throws Exception {
            session.importJson(cli.storage.readText(source));
            saveInPlace();
            cli.out.println("Imported JSON from " + source);
            cli.out.println("File saved successfully");
            return EXIT_OK;
        }
    }

    @Command(name = "backup", description = "Copy the save to a timestamped backup.")
    static final class BackupCommand extends SaveCommand {

        @Override
        int run(SaveEditorSession session) throws IOException {
            cli.out.println("Backup created: " + session.createBackup());
            return EXIT_OK;
        }
    }

    @Command(name = "max-resources", description = "Raise every capped resource to its ceiling.")
    static final class MaxResourcesCommand extends EditCommand {

        @Override
        int run(SaveEditorSession session) throws IOException {
            return finishEdit(session.maxAllResources(), "resource");
        }
    }

    @Command(name = "max-residents", description = "Max out level, stats and SPECIAL of every dweller.")
    static final class MaxResidentsCommand extends EditCommand {

        @Override
        int run(SaveEditorSession session) throws IOException {
            return finishEdit(session.maxAllResidents(), "dweller");
        }
    }

    @Command(name = "set-resources", description = "Set resource amounts, e.g. caps=5000 food=200.")
    static final class SetResourcesCommand extends EditCommand {

        @Parameters(index = "1..*", arity = "1..*", paramLabel = "RESOURCE=AMOUNT")
        Map<String, String> edits = new LinkedHashMap<>();

        @Override
        int run(SaveEditorSession session) throws IOException {
            return finishEdit(session.applyResourceEdits(edits), "resource");
        }
    }

    @Command(name = "set-shelter", description = "Set vault name, mode (Normal or Survival) and theme.")
    static final class SetShelterCommand extends EditCommand {

        @Parameters(index = "1..*", arity = "1..*", paramLabel = "KEY=VALUE",
                description = "Any of name=..., mode=..., theme=...")
        Map<String, String> edits = new LinkedHashMap<>();

        @Override
        int run(SaveEditorSession session) throws IOException {
            int applied = session.applyShelterEdits(edits.get("name"), edits.get("mode"), edits.get("theme"));
            return finishEdit(applied, "vault");
        }
    }

    @Command(name = "set-resident", description = "Edit one dweller, e.g. level=20 health=150 strength=7.")
    static final class SetResidentCommand extends EditCommand {

        @Parameters(index = "1", paramLabel = "INDEX", description = "Dweller position, starting at 0.")
        int index;

        @Parameters(index = "2..*", arity = "1..*", paramLabel = "FIELD=VALUE")
        Map<String, String> edits = new LinkedHashMap<>();

        @Override
        int run(SaveEditorSession session) throws IOException {
            return finishEdit(session.applyResidentEdits(index, edits), "dweller");
        }
    }

    @Command(name = "max-special", description = "Set all SPECIAL stats of one dweller to 10, then apply any extra edits.")
    static final class MaxSpecialCommand extends EditCommand {

        @Parameters(index = "1", paramLabel = "INDEX", description = "Dweller position, starting at 0.")
        int index;

        @Parameters(index = "2..*", arity = "0..*", paramLabel = "FIELD=VALUE")
        Map<String, String> edits = new LinkedHashMap<>();

        @Override
        int run(SaveEditorSession session) throws IOException {
            return finishEdit(session.maxResidentSpecial(index, edits), "dweller");
        }
    }

    private void printInfo(SaveDocument document) {
        ShelterView shelter = document.shelter();
        out.println("Vault Name:  " + shelter.name().orElse("-"));
        out.println("Vault Mode:  " + shelter.rawMode().orElse("-"));
        out.println("Vault Theme: " + (shelter.theme().isPresent() ? shelter.theme().getAsInt() : "-"));

        out.println("Resources:");
        if (!shelter.hasResources()) {
            out.println("  (no vault storage found)");
        }
        for (Map.Entry<ResourceType, Double> resource : shelter.resources().entrySet()) {
            out.printf("  %-15s %d%n", resource.getKey().logicalName(), (long) Math.floor(resource.getValue()));
        }

        List<ResidentView> residents = document.residents();
        out.println("Dwellers: " + residents.size());
        for (ResidentView resident : residents) {
            StringBuilder line = new StringBuilder("  [").append(resident.index()).append("] ")
                    .append(resident.displayName())
                    .append(" [").append(resident.gender().map(Enum::name).orElse("?")).append("]")
                    .append(" level ").append(format(resident.value(ResidentField.LEVEL)))
                    .append(" happiness ").append(format(resident.value(ResidentField.HAPPINESS)))
                    .append(" health ").append(format(resident.value(ResidentField.HEALTH)))
                    .append(" SPECIAL ");
            for (SpecialStat stat : SpecialStat.values()) {
                if (stat != SpecialStat.STRENGTH) {
                    line.append('/');
                }
                line.append(resident.special(stat).isPresent() ? resident.special(stat).getAsInt() : "-");
            }
            if (resident.isPregnant()) {
                line.append(" (pregnant)");
            }
            out.println(line);
        }
    }

    private static String format(OptionalDouble value) {
        return value.isPresent() ? Long.toString(Math.round(value.getAsDouble())) : "-";
    }
}
