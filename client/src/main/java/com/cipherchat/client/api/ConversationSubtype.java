package com.cipherchat.client.api;

public enum ConversationSubtype {
    NORMAL,
    SECRET
}
