package com.cipherchat.client.keystore;

import java.util.Arrays;

import com.cipherchat.crypto.AgreementKeyPair;
import com.cipherchat.crypto.PrivateKey;
import com.cipherchat.crypto.PublicKey;

/**
 * Raw encodings as held by a key store. Jackson writes the arrays as Base64.
 */
public record StoredKeyPair(byte[] privateKey, byte[] publicKey) {

    static StoredKeyPair of(PrivateKey privateKey, PublicKey publicKey) {
        return new StoredKeyPair(privateKey.getEncoded(), publicKey.getEncoded());
    }

    AgreementKeyPair toKeyPair() {
        return new AgreementKeyPair(PrivateKey.fromBytes(privateKey), PublicKey.fromBytes(publicKey));
    }

    void wipe() {
        Arrays.fill(privateKey, (byte) 0);
    }
}
