package com.cipherchat.client.api;

public record AcceptConversationRequest(String publicKey) {}
