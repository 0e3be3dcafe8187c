package com.cipherchat.client.api;

import java.time.Instant;
import java.util.UUID;

/**
 * A message as stored by the chat service. {@code content} is opaque: plaintext
 * in normal conversations, a cipher payload or attachment URI in secret ones.
 */
public record ChatMessage(
        UUID messageId,
        UUID conversationId,
        UUID senderId,
        String content,
        Instant sentAt
) {}
