package com.github.dimitryivaniuta.gateway.esim.service;

/**
 * A provisioning attempt did not produce usable activation data. The delivery is FAILED and the job
 * is retried.
 */
public class ProvisioningFailedException extends RuntimeException {

    public ProvisioningFailedException(String message) {
        super(message);
    }

    public ProvisioningFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
