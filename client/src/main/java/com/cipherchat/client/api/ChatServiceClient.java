package com.cipherchat.client.api;

import java.util.UUID;

import com.cipherchat.crypto.PublicKey;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The chat service as seen from one device, acting for one user.
 */
public interface ChatServiceClient {

    Mono<ConversationView> createConversation(CreateConversationRequest request);

    Mono<ConversationView> getConversation(UUID conversationId);

    Flux<ConversationView> getConversations();

    /**
     * Publishes the caller's public key for a secret conversation. The returned
     * view carries every member's current key, so the peer's key can be used
     * straight away.
     */
    Mono<ConversationView> acceptSecretConversation(UUID conversationId, PublicKey publicKey);

    /** Leaves (or rejects) a conversation. No key material is sent. */
    Mono<Void> leaveConversation(UUID conversationId);

    Mono<ChatMessage> sendMessage(UUID conversationId, String content);

    Flux<ChatMessage> getMessages(UUID conversationId);
}
