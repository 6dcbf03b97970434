package com.personal.shelter_editor;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Security;
import java.util.Base64;
import java.util.regex.Pattern;
import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.SecretKey;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

/**
 * Encrypts and decrypts shelter save containers.
 *
 * A save file is the base64 encoding of AES-256/CBC ciphertext with PKCS7
 * padding. The key and the IV are fixed by the game client, so they are
 * program constants here: no salt, no per-file IV and no header. Because the IV
 * never changes, encrypting the same document twice gives the same file, which
 * the game client relies on.
 */
public class SaveCodec implements SaveCodecInterface {

    /**
     * The transformation requested from the Bouncy Castle provider.
     */
    private static final String ALGORITHM = "AES/CBC/PKCS7Padding";

    private static final int BLOCK_SIZE_BYTES = 16;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * The game's AES-256 key as eight big-endian 32-bit words.
     */
    private static final int[] KEY_WORDS = {
        0xA7CA9F33, 0x66D892C2, 0xF0BEF417, 0x341CA971,
        0xB69AE9F7, 0xBACCCFFC, 0xF43C62D1, 0xD7D021F9
    };

    /**
     * The game's fixed IV, the ASCII bytes of "tu89geji340t89u2".
     */
    private static final byte[] IV = "tu89geji340t89u2".getBytes(StandardCharsets.US_ASCII);

    // Register the Bouncy Castle Provider if it hasn't been already
    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private final SecretKey secretKey;

    public SaveCodec() {
        ByteBuffer keyBytes = ByteBuffer.allocate(KEY_WORDS.length * Integer.BYTES);
        for (int word : KEY_WORDS) {
            keyBytes.putInt(word);
        }
        this.secretKey = new SecretKeySpec(keyBytes.array(), "AES");
    }

    @Override
    public String decrypt(String cipherBase64) throws DecodeException {
        if (cipherBase64 == null) {
            throw new IllegalArgumentException("Save container cannot be null.");
        }

        byte[] cipherText;
        try {
            // Line breaks from wrapped base64 are dropped; any other stray character is an error
            cipherText = Base64.getDecoder().decode(WHITESPACE.matcher(cipherBase64).replaceAll(""));
        } catch (IllegalArgumentException e) {
            throw new DecodeException(DecodeException.Reason.INVALID_BASE64,
                    "Save container is not valid base64: " + e.getMessage(), e);
        }

        if (cipherText.length == 0 || cipherText.length % BLOCK_SIZE_BYTES != 0) {
            throw new DecodeException(DecodeException.Reason.INVALID_PADDING,
                    "Ciphertext length " + cipherText.length + " is not a positive multiple of the block size.");
        }

        byte[] plainTextBytes;
        try {
            plainTextBytes = newCipher(Cipher.DECRYPT_MODE).doFinal(cipherText);
        } catch (BadPaddingException | IllegalBlockSizeException e) {
            throw new DecodeException(DecodeException.Reason.INVALID_PADDING,
                    "Decryption failed - invalid key or corrupted data", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES cipher is not available.", e);
        }

        return decodeUtf8(plainTextBytes);
    }

    @Override
    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext cannot be null.");
        }
        try {
            byte[] cipherText = newCipher(Cipher.ENCRYPT_MODE).doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(cipherText);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES cipher is not available.", e);
        }
    }

    private Cipher newCipher(int mode) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(ALGORITHM, BouncyCastleProvider.PROVIDER_NAME);
        cipher.init(mode, secretKey, new IvParameterSpec(IV));
        return cipher;
    }

    private static String decodeUtf8(byte[] bytes) throws DecodeException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer chars = decoder.decode(ByteBuffer.wrap(bytes));
            return chars.toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException(DecodeException.Reason.INVALID_UTF8,
                    "Decrypted data is not valid UTF-8 text.", e);
        }
    }
}
