package com.personal.shelter_editor.schema;

/**
 * Thrown when decrypted save text is not a JSON document with an object root.
 */
public class ParseException extends Exception {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
