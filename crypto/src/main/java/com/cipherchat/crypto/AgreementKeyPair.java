package com.cipherchat.crypto;

import static java.util.Objects.requireNonNull;

import javax.security.auth.Destroyable;

/**
 * One X25519 key pair. In this system every secret conversation gets its own.
 */
public record AgreementKeyPair(PrivateKey privateKey, PublicKey publicKey) implements Destroyable {

    public AgreementKeyPair {
        requireNonNull(privateKey, "privateKey");
        requireNonNull(publicKey, "publicKey");
    }

    @Override
    public void destroy() {
        privateKey.destroy();
    }

    @Override
    public boolean isDestroyed() {
        return privateKey.isDestroyed();
    }
}
