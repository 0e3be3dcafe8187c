package com.cipherchat.client.api;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record ConversationView(
        UUID conversationId,
        ConversationType type,
        ConversationSubtype subtype,
        String name,
        Instant createdAt,
        List<MemberView> members
) {

    public ConversationView {
        members = members != null ? List.copyOf(members) : List.of();
    }

    @JsonIgnore
    public boolean isSecret() {
        return type == ConversationType.PRIVATE && subtype == ConversationSubtype.SECRET;
    }

    public Optional<MemberView> member(UUID userId) {
        return members.stream().filter(m -> m.userId().equals(userId)).findFirst();
    }

    /** The other member of a private conversation, if still present. */
    public Optional<MemberView> peerOf(UUID userId) {
        return members.stream().filter(m -> !m.userId().equals(userId)).findFirst();
    }
}
