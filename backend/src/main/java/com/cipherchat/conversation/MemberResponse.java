package com.cipherchat.conversation;

import java.time.Instant;
import java.util.UUID;

public record MemberResponse(
        UUID userId,
        String publicKey,
        UUID lastReadMessageId,
        Instant joinedAt
) {

    static MemberResponse from(ConversationMemberEntity entity) {
        return new MemberResponse(
                entity.getKey().userId(),
                entity.getPublicKey(),
                entity.getLastReadMessageId(),
                entity.getJoinedAt());
    }
}
