package com.cipherchat.conversation;

public record AcceptConversationRequest(String publicKey) {}
