package com.cipherchat.crypto;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Base64;

import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

/**
 * An X25519 public key (32-byte u-coordinate). Safe to transmit; travels as Base64.
 *
 * <p>Construction rejects encodings that are not canonical: the wrong length,
 * a set top bit, or a u-coordinate at or above the field prime. Whether the
 * point lies on Curve25519 rather than its twist, and whether it has low
 * order, is checked by {@link SharedSecretDeriver} before agreement.
 */
public final class PublicKey {

    public static final int LENGTH = X25519PublicKeyParameters.KEY_SIZE;

    // 2^255 - 19
    static final BigInteger FIELD_PRIME = BigInteger.TWO.pow(255).subtract(BigInteger.valueOf(19));

    private static final BigInteger CURVE_A = BigInteger.valueOf(486662);
    private static final BigInteger LEGENDRE_EXPONENT = FIELD_PRIME.subtract(BigInteger.ONE).shiftRight(1);

    private final byte[] encoded;

    private PublicKey(byte[] encoded) {
        this.encoded = encoded;
    }

    public static PublicKey fromBytes(byte[] bytes) {
        if (bytes == null) {
            throw new InvalidPeerKeyException("Public key is missing");
        }
        if (bytes.length != LENGTH) {
            throw new InvalidPeerKeyException(
                    "X25519 public key must be " + LENGTH + " bytes, got " + bytes.length);
        }
        if ((bytes[LENGTH - 1] & 0x80) != 0) {
            throw new InvalidPeerKeyException("X25519 public key has its top bit set");
        }
        if (uCoordinate(bytes).compareTo(FIELD_PRIME) >= 0) {
            throw new InvalidPeerKeyException("X25519 public key is not reduced modulo 2^255 - 19");
        }
        return new PublicKey(bytes.clone());
    }

    public static PublicKey fromBase64(String base64) {
        if (base64 == null || base64.isBlank()) {
            throw new InvalidPeerKeyException("Public key is missing");
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(base64.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidPeerKeyException("Public key is not valid Base64", e);
        }
        return fromBytes(decoded);
    }

    public byte[] getEncoded() {
        return encoded.clone();
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(encoded);
    }

    /**
     * True when u^3 + A*u^2 + u is a square mod p, i.e. the point is on
     * Curve25519 and not on its quadratic twist.
     */
    boolean isOnCurve() {
        BigInteger u = uCoordinate(encoded);
        BigInteger rhs = u.pow(3).add(CURVE_A.multiply(u.pow(2))).add(u).mod(FIELD_PRIME);
        return !rhs.modPow(LEGENDRE_EXPONENT, FIELD_PRIME).equals(FIELD_PRIME.subtract(BigInteger.ONE));
    }

    X25519PublicKeyParameters toParameters() {
        return new X25519PublicKeyParameters(encoded, 0);
    }

    private static BigInteger uCoordinate(byte[] littleEndian) {
        byte[] bigEndian = new byte[littleEndian.length];
        for (int i = 0; i < littleEndian.length; i++) {
            bigEndian[i] = littleEndian[littleEndian.length - 1 - i];
        }
        return new BigInteger(1, bigEndian);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof PublicKey that && MessageDigest.isEqual(encoded, that.encoded);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(encoded);
    }

    @Override
    public String toString() {
        return "PublicKey[" + toBase64() + "]";
    }
}
