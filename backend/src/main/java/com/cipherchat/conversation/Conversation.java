package com.cipherchat.conversation;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A conversation row together with its member rows, as loaded for one request.
 */
public record Conversation(ConversationEntity entity, List<ConversationMemberEntity> members) {

    public Conversation {
        members = List.copyOf(members);
    }

    public UUID id() {
        return entity.getConversationId();
    }

    public boolean isSecret() {
        return entity.getType() == ConversationType.PRIVATE && entity.getSubtype() == ConversationSubtype.SECRET;
    }

    public Optional<ConversationMemberEntity> member(UUID userId) {
        return members.stream().filter(m -> m.getKey().userId().equals(userId)).findFirst();
    }

    /**
     * True once every member of a secret conversation has published a key and
     * nobody has left. Non-secret conversations need no consent.
     */
    public boolean consentComplete() {
        if (!isSecret()) {
            return true;
        }
        return members.size() >= 2 && members.stream().allMatch(ConversationMemberEntity::hasPublicKey);
    }
}
