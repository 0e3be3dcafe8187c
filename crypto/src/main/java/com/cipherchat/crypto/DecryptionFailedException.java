package com.cipherchat.crypto;

/**
 * A wire payload could not be authenticated or parsed. Affects a single message only.
 */
public class DecryptionFailedException extends SecretMessagingException {

    public DecryptionFailedException(String message) {
        super(message);
    }

    public DecryptionFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }
}
