package com.cipherchat.conversation;

import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/chat/conversations")
public class ConversationController {

    /** Identifies the calling user. Authentication happens in front of this service. */
    public static final String USER_HEADER = "X-User-Id";

    private final ConversationService conversationService;

    public ConversationController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ConversationResponse> createConversation(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestBody CreateConversationRequest request) {
        return conversationService.create(userId, request);
    }

    @GetMapping
    public Flux<ConversationResponse> getConversations(@RequestHeader(USER_HEADER) UUID userId) {
        return conversationService.getConversations(userId);
    }

    @GetMapping("/{conversationId}")
    public Mono<ConversationResponse> getConversation(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable UUID conversationId) {
        return conversationService.getConversation(userId, conversationId);
    }

    /**
     * Publishes the caller's public key for a secret conversation.
     * Returns every member's current key so the device can derive immediately.
     */
    @PatchMapping("/{conversationId}/accept")
    public Mono<ConversationResponse> acceptSecretConversation(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable UUID conversationId,
            @RequestBody AcceptConversationRequest request) {
        return conversationService.acceptSecretConversation(userId, conversationId, request);
    }

    /** Leave, or reject a pending secret invitation. */
    @DeleteMapping("/{conversationId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> leaveConversation(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable UUID conversationId) {
        return conversationService.leaveConversation(userId, conversationId);
    }

    @PostMapping("/{conversationId}/read")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> markRead(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable UUID conversationId,
            @RequestBody MarkReadRequest request) {
        return conversationService.markRead(userId, conversationId, request);
    }
}
