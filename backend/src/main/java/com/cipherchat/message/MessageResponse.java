package com.cipherchat.message;

import java.time.Instant;
import java.util.UUID;

/**
 * sentAt is read off the timeuuid message id; there is no separate column.
 */
public record MessageResponse(
        UUID messageId,
        UUID conversationId,
        UUID senderId,
        String content,
        Instant sentAt
) {}
