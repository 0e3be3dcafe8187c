package com.cipherchat.client.keystore;

import java.util.Optional;
import java.util.UUID;

import com.cipherchat.crypto.AgreementKeyPair;
import com.cipherchat.crypto.PrivateKey;
import com.cipherchat.crypto.PublicKey;

/**
 * Device-local mapping from conversation id to that conversation's key pair.
 *
 * <p>An entry is written once and never replaced: replacing it would make every
 * earlier message of the conversation undecryptable. Implementations must make
 * {@link #putIfAbsent} atomic with respect to concurrent callers in the same
 * process, and report persistence failures as
 * {@link com.cipherchat.crypto.StorageUnavailableException}.
 */
public interface KeyStore {

    /**
     * Stores the key pair unless one already exists for the conversation.
     *
     * @return {@code true} if a new entry was created, {@code false} if an existing one was kept
     */
    boolean putIfAbsent(UUID conversationId, PrivateKey privateKey, PublicKey publicKey);

    /**
     * Returns a fresh copy of the stored key pair. The caller owns the copy and
     * should destroy it once done.
     */
    Optional<AgreementKeyPair> get(UUID conversationId);

    /** Drops the key pair of a deleted or abandoned conversation. */
    boolean remove(UUID conversationId);

    /** Wipes all key pairs held on this device. */
    void clear();
}
