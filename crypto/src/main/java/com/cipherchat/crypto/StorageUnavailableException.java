package com.cipherchat.crypto;

/**
 * The local key storage could not be read or written.
 *
 * <p>Callers must refuse to continue with secret messaging: a key pair that
 * only ever lived in memory makes every later message undecryptable.
 */
public class StorageUnavailableException extends SecretMessagingException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRecoverable() {
        return false;
    }
}
