package com.cipherchat.conversation;

public enum ConversationType {
    PRIVATE,
    GROUP
}
