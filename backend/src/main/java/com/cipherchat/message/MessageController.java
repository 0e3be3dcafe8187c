package com.cipherchat.message;

import static com.cipherchat.conversation.ConversationController.USER_HEADER;

import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
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
@RequestMapping("/api/chat/messages")
public class MessageController {

    private final MessageService messageService;

    public MessageController(MessageService messageService) {
        this.messageService = messageService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<MessageResponse> sendMessage(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestBody SendMessageRequest request) {
        return messageService.sendMessage(userId, request);
    }

    @GetMapping("/{conversationId}")
    public Flux<MessageResponse> getMessages(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable UUID conversationId) {
        return messageService.getMessages(userId, conversationId);
    }
}
