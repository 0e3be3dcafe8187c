package com.cipherchat.conversation;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A conversation with all of its members and their current public keys, so an
 * accepting device can derive the shared secret right away.
 */
public record ConversationResponse(
        UUID conversationId,
        ConversationType type,
        ConversationSubtype subtype,
        String name,
        Instant createdAt,
        List<MemberResponse> members
) {

    static ConversationResponse from(Conversation conversation) {
        ConversationEntity entity = conversation.entity();
        return new ConversationResponse(
                entity.getConversationId(),
                entity.getType(),
                entity.getSubtype(),
                entity.getName(),
                entity.getCreatedAt(),
                conversation.members().stream().map(MemberResponse::from).toList());
    }
}
