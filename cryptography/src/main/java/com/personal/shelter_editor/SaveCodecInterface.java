package com.personal.shelter_editor;

/**
 * Defines the contract for turning a save container into plaintext and back.
 */
public interface SaveCodecInterface {

    /**
     * Decodes a base64 save container and decrypts it to UTF-8 text.
     *
     * @param cipherBase64 The full content of a save file.
     * @return The decrypted plaintext (normally a JSON document).
     * @throws DecodeException If the text is not base64, the padding is malformed
     * (wrong key, corrupted or truncated data), or the plaintext is not UTF-8.
     */
    String decrypt(String cipherBase64) throws DecodeException;

    /**
     * Encrypts UTF-8 text and encodes it as a base64 save container.
     * Identical input always yields identical output.
     *
     * @param plaintext The text to encrypt.
     * @return The base64 ciphertext, ready to be written as a save file.
     */
    String encrypt(String plaintext);
}
