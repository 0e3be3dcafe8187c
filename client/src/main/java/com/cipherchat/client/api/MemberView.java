package com.cipherchat.client.api;

import java.time.Instant;
import java.util.UUID;

/**
 * A member record as returned by the chat service. {@code publicKey} stays
 * {@code null} until the member has accepted a secret conversation.
 */
public record MemberView(
        UUID userId,
        String publicKey,
        UUID lastReadMessageId,
        Instant joinedAt
) {

    public boolean hasPublicKey() {
        return publicKey != null && !publicKey.isBlank();
    }
}
