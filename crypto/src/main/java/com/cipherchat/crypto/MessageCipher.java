package com.cipherchat.crypto;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.Provider;
import java.security.SecureRandom;
import java.util.Base64;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

/**
 * AES-256-GCM over message plaintext.
 *
 * <p>Wire payload: {@code base64(nonce(12) || ciphertext || tag(16))}. A fresh
 * random nonce is drawn for every call.
 */
public class MessageCipher {

    // Used directly, never installed in java.security.Security.
    private static final Provider PROVIDER = new BouncyCastleProvider();

    private static final String AES_ALGO = "AES/GCM/NoPadding";
    static final int IV_SIZE = 12;
    private static final int TAG_SIZE = 128;
    static final int MIN_PAYLOAD_SIZE = IV_SIZE + TAG_SIZE / 8;

    private final SecureRandom random;

    public MessageCipher(SecureRandom random) {
        this.random = requireNonNull(random, "random");
    }

    public static MessageCipher withSystemEntropy() {
        return new MessageCipher(KeyPairService.systemRandom());
    }

    public String encrypt(SharedSecret secret, String plaintext) {
        checkKey(secret);
        requireNonNull(plaintext, "plaintext");

        byte[] iv = new byte[IV_SIZE];
        try {
            random.nextBytes(iv);
        } catch (RuntimeException e) {
            throw new EntropyUnavailableException("Secure random source failed while drawing a nonce", e);
        }

        byte[] ciphertext;
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, PROVIDER);
            cipher.init(Cipher.ENCRYPT_MODE, secret, new GCMParameterSpec(TAG_SIZE, iv));
            ciphertext = cipher.doFinal(plaintext.getBytes(UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM is unavailable", e);
        }

        return Base64.getEncoder().encodeToString(ByteBuffer.allocate(IV_SIZE + ciphertext.length)
                .put(iv)
                .put(ciphertext)
                .array());
    }

    /**
     * Authenticates and decrypts a wire payload. Fails closed: any structural or
     * authentication problem raises {@link DecryptionFailedException}, never a
     * partially decrypted result.
     */
    public String decrypt(SharedSecret secret, String payload) {
        checkKey(secret);
        if (payload == null) {
            throw new DecryptionFailedException("Payload is missing");
        }

        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new DecryptionFailedException("Payload is not Base64", e);
        }
        // the decoder ignores unused trailing bits, so several strings map to one byte sequence
        if (!Base64.getEncoder().encodeToString(decoded).equals(payload)) {
            throw new DecryptionFailedException("Payload is not canonical Base64");
        }
        if (decoded.length < MIN_PAYLOAD_SIZE) {
            throw new DecryptionFailedException("Payload too short: " + decoded.length + " bytes");
        }

        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, PROVIDER);
            cipher.init(Cipher.DECRYPT_MODE, secret, new GCMParameterSpec(TAG_SIZE, decoded, 0, IV_SIZE));
            byte[] plaintext = cipher.doFinal(decoded, IV_SIZE, decoded.length - IV_SIZE);
            return new String(plaintext, UTF_8);
        } catch (AEADBadTagException e) {
            throw new DecryptionFailedException("Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionFailedException("Payload could not be decrypted", e);
        }
    }

    private static void checkKey(SharedSecret secret) {
        requireNonNull(secret, "secret");
        if (secret.isDestroyed()) {
            throw new IllegalStateException("Shared secret has been destroyed");
        }
    }
}
