package com.cipherchat.client.api;

public enum ConversationType {
    PRIVATE,
    GROUP
}
