package com.cipherchat.crypto;

import java.security.MessageDigest;
import java.util.Arrays;

import javax.crypto.SecretKey;

/**
 * A 256-bit symmetric key agreed between the two members of a secret conversation.
 *
 * <p>Never persisted. Implements {@link SecretKey} so it can be handed straight to
 * a JCA {@code Cipher}, and unlike {@code SecretKeySpec} its {@link #destroy()}
 * actually wipes the key bytes.
 */
public final class SharedSecret implements SecretKey, AutoCloseable {

    private static final long serialVersionUID = 1L;

    public static final int LENGTH = 32;

    private final byte[] key;
    private volatile boolean destroyed = false;

    private SharedSecret(byte[] key) {
        this.key = key;
    }

    /**
     * Wraps externally supplied key bytes. Anything other than exactly 32 bytes
     * is rejected rather than truncated or padded.
     */
    public static SharedSecret fromBytes(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Shared secret is missing");
        }
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException(
                    "Shared secret must be exactly " + LENGTH + " bytes, got " + bytes.length);
        }
        return new SharedSecret(bytes.clone());
    }

    static SharedSecret adopt(byte[] owned) {
        if (owned.length != LENGTH) {
            throw new IllegalArgumentException("Derived secret has wrong length: " + owned.length);
        }
        return new SharedSecret(owned);
    }

    @Override
    public String getAlgorithm() {
        return "AES";
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    @Override
    public byte[] getEncoded() {
        if (destroyed) {
            throw new IllegalStateException("Shared secret has been destroyed");
        }
        return key.clone();
    }

    @Override
    public void destroy() {
        Arrays.fill(key, (byte) 0);
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof SharedSecret that && MessageDigest.isEqual(key, that.key);
    }

    @Override
    public int hashCode() {
        return SharedSecret.class.hashCode();
    }

    @Override
    public String toString() {
        return "SharedSecret[REDACTED]";
    }
}
