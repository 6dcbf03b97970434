package com.personal.shelter_editor;

import com.personal.shelter_editor.schema.ParseException;
import com.personal.shelter_editor.schema.SaveDocument;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Test fixtures shared by the core tests.
 * {@code Vault1.sav} is {@code vault1.json} encrypted with the game's key and IV.
 */
public final class Fixtures {

    public static final String SAVE_FILE = "Vault1.sav";
    public static final String SAVE_JSON = "vault1.json";

    private Fixtures() {}

    public static String read(String name) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalStateException("Missing test resource " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static SaveDocument vault1() throws ParseException {
        return SaveDocument.parse(read(SAVE_JSON));
    }
}
