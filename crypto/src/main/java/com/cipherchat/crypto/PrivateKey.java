package com.cipherchat.crypto;

import java.security.MessageDigest;
import java.util.Arrays;

import javax.security.auth.Destroyable;

import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;

/**
 * An X25519 private scalar. Never transmitted; only crosses the local key
 * storage boundary. {@link #destroy()} zeroes the buffer.
 */
public final class PrivateKey implements Destroyable, AutoCloseable {

    public static final int LENGTH = X25519PrivateKeyParameters.KEY_SIZE;

    private final byte[] scalar;
    private volatile boolean destroyed = false;

    private PrivateKey(byte[] scalar) {
        this.scalar = scalar;
    }

    /**
     * Restores a private key from its raw 32-byte encoding, e.g. when loading it
     * back from a key store. The caller keeps ownership of {@code bytes}.
     */
    public static PrivateKey fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("X25519 private key must be " + LENGTH + " bytes");
        }
        return new PrivateKey(bytes.clone());
    }

    static PrivateKey adopt(byte[] owned) {
        return new PrivateKey(owned);
    }

    public byte[] getEncoded() {
        return checkNotDestroyed().clone();
    }

    public PublicKey publicKey() {
        return PublicKey.fromBytes(toParameters().generatePublicKey().getEncoded());
    }

    X25519PrivateKeyParameters toParameters() {
        return new X25519PrivateKeyParameters(checkNotDestroyed(), 0);
    }

    private byte[] checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("Private key has been destroyed");
        }
        return scalar;
    }

    @Override
    public void destroy() {
        Arrays.fill(scalar, (byte) 0);
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
        return other instanceof PrivateKey that && MessageDigest.isEqual(scalar, that.scalar);
    }

    @Override
    public int hashCode() {
        // Deliberately not derived from the key bytes.
        return PrivateKey.class.hashCode();
    }

    @Override
    public String toString() {
        return "PrivateKey[REDACTED]";
    }
}
