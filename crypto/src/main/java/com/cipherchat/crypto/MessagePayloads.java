package com.cipherchat.crypto;

import java.util.List;

/**
 * Cheap structural checks on message content in a secret conversation.
 *
 * <p>Attachments share the {@code content} field with ciphertext but carry a URI.
 * Those are passed through untouched; everything else is treated as a
 * {@link MessageCipher} payload.
 */
public final class MessagePayloads {

    static final List<String> PASS_THROUGH_PREFIXES = List.of("http://", "https://", "data:", "blob:");

    private MessagePayloads() {
    }

    public static boolean isPassThrough(String content) {
        if (content == null) {
            return false;
        }
        for (String prefix : PASS_THROUGH_PREFIXES) {
            if (content.regionMatches(true, 0, prefix, 0, prefix.length())) {
                return true;
            }
        }
        return false;
    }
}
