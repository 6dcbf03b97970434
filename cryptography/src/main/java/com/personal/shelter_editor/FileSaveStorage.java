package com.personal.shelter_editor;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SaveStorage} backed by the local file system.
 *
 * Backups are written beside the source as {@code <file>.backup_<yyyyMMdd_HHmmss>}.
 * A second backup within the same second gets a {@code _1}, {@code _2}, ... suffix.
 */
public class FileSaveStorage implements SaveStorage {

    private static final Logger LOG = LoggerFactory.getLogger(FileSaveStorage.class);

    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Clock clock;

    public FileSaveStorage() {
        this(Clock.systemDefaultZone());
    }

    /**
     * @param clock The clock used to stamp backup file names.
     */
    public FileSaveStorage(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String readText(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new FileNotFoundException("Save file not found: " + file.toAbsolutePath());
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    @Override
    public void writeText(Path file, String text) throws IOException {
        Path parentDir = file.toAbsolutePath().getParent();
        if (parentDir != null && !Files.exists(parentDir)) {
            Files.createDirectories(parentDir);
            LOG.info("Created directory '{}'", parentDir);
        }
        Files.writeString(file, text, StandardCharsets.UTF_8);
        LOG.info("Wrote {} characters to {}", text.length(), file.toAbsolutePath());
    }

    @Override
    public Path copyFile(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new FileNotFoundException("Save file not found: " + file.toAbsolutePath());
        }
        Path stamped = backupPathFor(file);
        Path backup = stamped;
        for (int suffix = 1; Files.exists(backup); suffix++) {
            backup = stamped.resolveSibling(stamped.getFileName() + "_" + suffix);
        }
        Files.copy(file, backup, StandardCopyOption.COPY_ATTRIBUTES);
        LOG.info("Backup created: {}", backup.toAbsolutePath());
        return backup;
    }

    /**
     * Computes the backup name for a file at the current clock time.
     */
    Path backupPathFor(Path file) {
        String stamp = LocalDateTime.now(clock).format(BACKUP_STAMP);
        return file.resolveSibling(file.getFileName() + ".backup_" + stamp);
    }
}
