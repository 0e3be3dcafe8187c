package com.cipherchat.client.api;

import java.util.UUID;

public record SendMessageRequest(UUID conversationId, String content) {}
