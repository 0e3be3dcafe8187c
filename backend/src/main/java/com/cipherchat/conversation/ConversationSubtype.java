package com.cipherchat.conversation;

/**
 * Only private conversations carry a subtype. SECRET ones are end-to-end
 * encrypted on the devices; the server just relays ciphertext.
 */
public enum ConversationSubtype {
    NORMAL,
    SECRET
}
