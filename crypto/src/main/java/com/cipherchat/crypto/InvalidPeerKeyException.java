package com.cipherchat.crypto;

/**
 * A public key received from the other side is malformed or is not usable for
 * X25519 agreement. Retrying with the same key will not help.
 */
public class InvalidPeerKeyException extends SecretMessagingException {

    public InvalidPeerKeyException(String message) {
        super(message);
    }

    public InvalidPeerKeyException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }
}
