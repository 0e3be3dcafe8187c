package com.cipherchat.message;

import java.util.UUID;

public record SendMessageRequest(UUID conversationId, String content) {}
