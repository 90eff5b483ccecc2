package com.github.dimitryivaniuta.gateway.esim.service;

/**
 * A blob could not be decrypted (wrong key, tampered, truncated or not base64).
 */
public class SecretVaultException extends RuntimeException {

    public SecretVaultException(String message) {
        super(message);
    }

    public SecretVaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
