package com.cipherchat.client.api;

import java.util.List;
import java.util.UUID;

import com.cipherchat.crypto.PublicKey;

public record CreateConversationRequest(
        ConversationType type,
        ConversationSubtype subtype,
        String name,
        List<UUID> memberUserIds,
        String creatorPublicKey
) {

    public static CreateConversationRequest secret(UUID peerUserId, PublicKey creatorPublicKey) {
        return new CreateConversationRequest(ConversationType.PRIVATE, ConversationSubtype.SECRET, null,
                List.of(peerUserId), creatorPublicKey.toBase64());
    }

    public static CreateConversationRequest normal(UUID peerUserId) {
        return new CreateConversationRequest(ConversationType.PRIVATE, ConversationSubtype.NORMAL, null,
                List.of(peerUserId), null);
    }
}
