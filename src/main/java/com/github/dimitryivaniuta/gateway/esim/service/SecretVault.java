package com.github.dimitryivaniuta.gateway.esim.service;

import com.github.dimitryivaniuta.gateway.esim.config.AppProperties;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.regex.Pattern;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * AES-256-GCM encryption of activation payloads at rest.
 *
 * <p>Blob layout: {@code base64(nonce[12] || tag[16] || ciphertext)}. The key is read once at startup from
 * {@code app.crypto.encryption-key}: 64 hex chars are decoded as hex, base64 decoding to exactly 32 bytes
 * is used as is, anything else is treated as a passphrase and hashed with SHA-256.</p>
 *
 * <p>Decryption fails closed: any tampering surfaces as {@link SecretVaultException}.</p>
 */
@Component
public class SecretVault {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_LENGTH = 16;

    private static final Pattern HEX_KEY = Pattern.compile("^[0-9a-fA-F]{64}$");
    private static final Pattern BASE64_KEY = Pattern.compile("^[A-Za-z0-9+/=]+$");

    private final SecretKey key;
    private final SecureRandom random = new SecureRandom();

    @Autowired
    public SecretVault(AppProperties props) {
        this(props.getCrypto().getEncryptionKey());
    }

    /**
     * Creates a vault for the given key material.
     *
     * @param encryptionKey hex, base64 or passphrase
     */
    public SecretVault(String encryptionKey) {
        if (encryptionKey == null || encryptionKey.isEmpty()) {
            throw new IllegalStateException("app.crypto.encryption-key is required");
        }
        this.key = new SecretKeySpec(deriveKey(encryptionKey), "AES");
    }

    /**
     * Encrypts a UTF-8 string with a fresh random nonce.
     *
     * @param plaintext text
     * @return base64 blob
     */
    public String encrypt(String plaintext) {
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            // JCE appends the tag to the ciphertext
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            int ctLength = sealed.length - TAG_LENGTH;

            ByteBuffer blob = ByteBuffer.allocate(NONCE_LENGTH + sealed.length);
            blob.put(nonce);
            blob.put(sealed, ctLength, TAG_LENGTH);
            blob.put(sealed, 0, ctLength);
            return Base64.getEncoder().encodeToString(blob.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    /**
     * Decrypts a blob produced by {@link #encrypt(String)}.
     *
     * @param blob base64 blob
     * @return plaintext
     * @throws SecretVaultException if the blob is malformed or fails authentication
     */
    public String decrypt(String blob) {
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(blob);
        } catch (IllegalArgumentException e) {
            throw new SecretVaultException("Encrypted payload is not valid base64", e);
        }
        if (raw.length < NONCE_LENGTH + TAG_LENGTH) {
            throw new SecretVaultException("Encrypted payload is truncated");
        }

        int ctLength = raw.length - NONCE_LENGTH - TAG_LENGTH;
        byte[] sealed = new byte[ctLength + TAG_LENGTH];
        System.arraycopy(raw, NONCE_LENGTH + TAG_LENGTH, sealed, 0, ctLength);
        System.arraycopy(raw, NONCE_LENGTH, sealed, ctLength, TAG_LENGTH);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, raw, 0, NONCE_LENGTH));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new SecretVaultException("Encrypted payload failed authentication", e);
        } catch (GeneralSecurityException e) {
            throw new SecretVaultException("Encrypted payload could not be decrypted", e);
        }
    }

    static byte[] deriveKey(String material) {
        if (HEX_KEY.matcher(material).matches()) {
            return HexFormat.of().parseHex(material);
        }
        if (BASE64_KEY.matcher(material).matches()) {
            byte[] decoded = tryBase64(material);
            if (decoded != null && decoded.length == 32) {
                return decoded;
            }
        }
        try {
            return MessageDigest.getInstance("SHA-256").digest(material.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static byte[] tryBase64(String s) {
        try {
            return Base64.getDecoder().decode(s);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
