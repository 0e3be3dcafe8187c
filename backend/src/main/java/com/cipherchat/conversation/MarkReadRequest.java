package com.cipherchat.conversation;

import java.util.UUID;

public record MarkReadRequest(UUID lastReadMessageId) {}
