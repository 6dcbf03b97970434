package com.personal.shelter_editor;

import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes encrypted save files.
 *
 * The vault pairs a {@link SaveCodecInterface} with a {@link SaveStorage}: the
 * codec owns the cipher, the storage owns the bytes on disk. Saving encrypts
 * before anything is written, so a failed encryption leaves the file untouched.
 */
public class SaveFileVault {

    private static final Logger LOG = LoggerFactory.getLogger(SaveFileVault.class);

    private final SaveCodecInterface codec;
    private final SaveStorage storage;

    /**
     * Creates a new SaveFileVault.
     *
     * @param codec The codec used to encrypt and decrypt save containers.
     * @param storage The storage the save files live in.
     */
    public SaveFileVault(SaveCodecInterface codec, SaveStorage storage) {
        if (codec == null || storage == null) {
            throw new IllegalArgumentException("Codec and storage are required.");
        }
        this.codec = codec;
        this.storage = storage;
    }

    /**
     * Loads and decrypts a save file.
     *
     * @param file The save file to read.
     * @return The plaintext JSON string.
     * @throws IOException If the file cannot be read.
     * @throws DecodeException If the content is not a valid save container.
     */
    public String loadData(Path file) throws IOException, DecodeException {
        String container = storage.readText(file);
        String json = codec.decrypt(container);
        LOG.info("Decrypted {} ({} characters of JSON)", file.getFileName(), json.length());
        return json;
    }

    /**
     * Encrypts a JSON string and writes it to a save file.
     *
     * @param file The save file to write.
     * @param jsonData The plaintext JSON to store.
     * @throws IOException If the file cannot be written.
     */
    public void saveData(Path file, String jsonData) throws IOException {
        String container = codec.encrypt(jsonData);
        storage.writeText(file, container);
        LOG.info("Secure data saved to: {}", file.toAbsolutePath());
    }

    /**
     * Copies a save file to a timestamped backup.
     *
     * @param file The save file to back up.
     * @return The backup path.
     * @throws IOException If the copy fails.
     */
    public Path backup(Path file) throws IOException {
        return storage.copyFile(file);
    }

    public SaveCodecInterface getCodec() {
        return codec;
    }
}
