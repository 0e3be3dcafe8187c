package com.cipherchat.client.pipeline;

import java.time.Instant;
import java.util.UUID;

import com.cipherchat.client.api.ChatMessage;

/**
 * A message ready for display.
 *
 * <p>For {@link Outcome#UNDECRYPTABLE}, {@code content} keeps the original payload
 * and {@link #displayText()} returns a placeholder.
 */
public record DecryptedMessage(
        UUID messageId,
        UUID senderId,
        String content,
        Instant sentAt,
        Outcome outcome
) {

    public static final String UNDECRYPTABLE_PLACEHOLDER = "🔒 This message could not be decrypted";

    public enum Outcome {
        /** Not encrypted: a normal conversation, or an attachment URI. */
        PLAINTEXT,
        DECRYPTED,
        UNDECRYPTABLE
    }

    static DecryptedMessage plaintext(ChatMessage message) {
        return new DecryptedMessage(message.messageId(), message.senderId(), message.content(),
                message.sentAt(), Outcome.PLAINTEXT);
    }

    static DecryptedMessage decrypted(ChatMessage message, String plaintext) {
        return new DecryptedMessage(message.messageId(), message.senderId(), plaintext,
                message.sentAt(), Outcome.DECRYPTED);
    }

    static DecryptedMessage undecryptable(ChatMessage message) {
        return new DecryptedMessage(message.messageId(), message.senderId(), message.content(),
                message.sentAt(), Outcome.UNDECRYPTABLE);
    }

    public String displayText() {
        return outcome == Outcome.UNDECRYPTABLE ? UNDECRYPTABLE_PLACEHOLDER : content;
    }
}
