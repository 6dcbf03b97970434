package com.personal.shelter_editor;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Defines the raw file access a save editor needs from its host.
 * Implementations move text in and out; they never interpret it.
 */
public interface SaveStorage {

    /**
     * Reads the full content of a save file.
     *
     * @param file The save file.
     * @return The file content as text.
     * @throws IOException If the file is missing or cannot be read.
     */
    String readText(Path file) throws IOException;

    /**
     * Replaces the content of a save file.
     *
     * @param file The save file.
     * @param text The content to write.
     * @throws IOException If the file cannot be written.
     */
    void writeText(Path file, String text) throws IOException;

    /**
     * Copies a save file to a new backup file next to it.
     *
     * @param file The save file to copy.
     * @return The path of the backup that was created.
     * @throws IOException If the source is missing or the copy fails.
     */
    Path copyFile(Path file) throws IOException;
}
