package com.cipherchat.crypto;

/**
 * Root of the secret-conversation failure taxonomy.
 *
 * <p>Every failure the crypto core or the local key storage can raise is one of
 * the subclasses, so callers can branch on the concrete type instead of parsing
 * messages. {@link #isRecoverable()} tells whether the failure is local to one
 * call (a peer key, a message) or blocks secret messaging on this device.
 */
public abstract class SecretMessagingException extends RuntimeException {

    protected SecretMessagingException(String message) {
        super(message);
    }

    protected SecretMessagingException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRecoverable();
}
