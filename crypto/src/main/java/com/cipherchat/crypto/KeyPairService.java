package com.cipherchat.crypto;

import static java.util.Objects.requireNonNull;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.generators.X25519KeyPairGenerator;
import org.bouncycastle.crypto.params.X25519KeyGenerationParameters;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates the Curve25519 (X25519) key pair a device uses for one secret conversation.
 *
 * <p>Generation is stateless; making it idempotent per conversation is the job of
 * the key store that persists the result.
 */
public class KeyPairService {
    private static final Logger logger = LoggerFactory.getLogger(KeyPairService.class);

    private final SecureRandom random;

    public KeyPairService(SecureRandom random) {
        this.random = requireNonNull(random, "random");
    }

    /**
     * Creates a service backed by the JDK's DRBG.
     *
     * @throws EntropyUnavailableException if the platform offers no DRBG
     */
    public static KeyPairService withSystemEntropy() {
        return new KeyPairService(systemRandom());
    }

    static SecureRandom systemRandom() {
        try {
            return SecureRandom.getInstance("DRBG");
        } catch (NoSuchAlgorithmException e) {
            throw new EntropyUnavailableException("No DRBG SecureRandom available on this platform", e);
        }
    }

    public AgreementKeyPair generate() {
        X25519KeyPairGenerator generator = new X25519KeyPairGenerator();
        generator.init(new X25519KeyGenerationParameters(random));

        AsymmetricCipherKeyPair pair;
        try {
            pair = generator.generateKeyPair();
        } catch (RuntimeException e) {
            // SecureRandom implementations report seeding failures as unchecked ProviderExceptions
            logger.error("Secure random source failed during key generation", e);
            throw new EntropyUnavailableException("Secure random source failed", e);
        }

        byte[] scalar = ((X25519PrivateKeyParameters) pair.getPrivate()).getEncoded();
        byte[] point = ((X25519PublicKeyParameters) pair.getPublic()).getEncoded();
        return new AgreementKeyPair(PrivateKey.adopt(scalar), PublicKey.fromBytes(point));
    }
}
