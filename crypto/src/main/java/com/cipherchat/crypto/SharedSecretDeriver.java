package com.cipherchat.crypto;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.Objects.requireNonNull;

import java.util.Arrays;

import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;

/**
 * X25519 agreement followed by HKDF-SHA256.
 *
 * <p>{@code derive(a.private, b.public)} and {@code derive(b.private, a.public)}
 * produce identical output. Peer points on the quadratic twist are refused
 * before agreement. The raw agreement value is checked against the
 * all-zero result that a low-order peer point forces, per RFC 7748 section 6.1.
 */
public class SharedSecretDeriver {

    static final byte[] HKDF_INFO = "cipherchat/secret-conversation/v1".getBytes(US_ASCII);

    public SharedSecret derive(PrivateKey localPrivateKey, PublicKey peerPublicKey) {
        requireNonNull(localPrivateKey, "localPrivateKey");
        if (peerPublicKey == null) {
            throw new InvalidPeerKeyException("Peer has not published a public key");
        }
        if (!peerPublicKey.isOnCurve()) {
            throw new InvalidPeerKeyException("Peer public key is not a point on Curve25519");
        }

        X25519Agreement agreement = new X25519Agreement();
        agreement.init(localPrivateKey.toParameters());
        byte[] raw = new byte[agreement.getAgreementSize()];
        try {
            agreement.calculateAgreement(peerPublicKey.toParameters(), raw, 0);
            if (isAllZero(raw)) {
                throw new InvalidPeerKeyException("Peer public key is a low-order point");
            }
            return SharedSecret.adopt(expand(raw));
        } catch (IllegalStateException e) {
            // BouncyCastle refuses agreements that end in the all-zero value
            throw new InvalidPeerKeyException("Peer public key is a low-order point", e);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    private static byte[] expand(byte[] ikm) {
        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(ikm, null, HKDF_INFO));
        byte[] okm = new byte[SharedSecret.LENGTH];
        hkdf.generateBytes(okm, 0, okm.length);
        return okm;
    }

    private static boolean isAllZero(byte[] bytes) {
        int acc = 0;
        for (byte b : bytes) {
            acc |= b;
        }
        return acc == 0;
    }
}
