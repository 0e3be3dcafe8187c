package com.cipherchat.crypto;

/**
 * The platform could not supply cryptographically secure randomness.
 * Fatal: no key pair and no nonce can be produced until this is resolved.
 */
public class EntropyUnavailableException extends SecretMessagingException {

    public EntropyUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRecoverable() {
        return false;
    }
}
