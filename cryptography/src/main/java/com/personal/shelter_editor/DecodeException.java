package com.personal.shelter_editor;

/**
 * Thrown when a save container cannot be turned back into plaintext.
 *
 * The {@link Reason} tells the caller which stage of the decode failed, so a
 * corrupted download can be told apart from a file encrypted with another key.
 */
public class DecodeException extends Exception {

    /**
     * The stage of {@link SaveCodecInterface#decrypt(String)} that failed.
     */
    public enum Reason {
        /** The container is not valid base64 text. */
        INVALID_BASE64,
        /** The ciphertext is truncated, empty, or its PKCS7 padding is malformed. */
        INVALID_PADDING,
        /** The depadded plaintext is not valid UTF-8. */
        INVALID_UTF8
    }

    private final Reason reason;

    public DecodeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DecodeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
