package com.cipherchat.conversation;

import java.util.List;
import java.util.UUID;

/**
 * creatorPublicKey: the creator's X25519 public key (Base64). Required for
 *                   SECRET conversations and stored on the creator's member
 *                   record only. Ignored for every other kind.
 */
public record CreateConversationRequest(
        ConversationType type,
        ConversationSubtype subtype,
        String name,
        List<UUID> memberUserIds,
        String creatorPublicKey
) {}
