package com.cipherchat.client.keystore;

import static java.util.Objects.requireNonNull;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.cipherchat.crypto.AgreementKeyPair;
import com.cipherchat.crypto.PrivateKey;
import com.cipherchat.crypto.PublicKey;

/**
 * Key store whose lifetime is that of the instance. Keys are lost with the process,
 * so this suits ephemeral sessions and tests only.
 */
public class InMemoryKeyStore implements KeyStore {

    private final ConcurrentHashMap<UUID, StoredKeyPair> entries = new ConcurrentHashMap<>();

    @Override
    public boolean putIfAbsent(UUID conversationId, PrivateKey privateKey, PublicKey publicKey) {
        requireNonNull(conversationId, "conversationId");
        StoredKeyPair candidate = StoredKeyPair.of(privateKey, publicKey);
        StoredKeyPair existing = entries.putIfAbsent(conversationId, candidate);
        if (existing != null) {
            candidate.wipe();
            return false;
        }
        return true;
    }

    @Override
    public Optional<AgreementKeyPair> get(UUID conversationId) {
        return Optional.ofNullable(entries.get(conversationId)).map(StoredKeyPair::toKeyPair);
    }

    @Override
    public boolean remove(UUID conversationId) {
        StoredKeyPair removed = entries.remove(conversationId);
        if (removed == null) {
            return false;
        }
        removed.wipe();
        return true;
    }

    @Override
    public void clear() {
        entries.values().forEach(StoredKeyPair::wipe);
        entries.clear();
    }
}
