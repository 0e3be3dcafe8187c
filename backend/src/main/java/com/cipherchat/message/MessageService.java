package com.cipherchat.message;

import java.time.Instant;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import com.cipherchat.conversation.ConversationService;
import com.datastax.oss.driver.api.core.uuid.Uuids;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Stores and lists messages for conversation members.
 *
 * <p>Content is never inspected. For secret conversations the server only
 * enforces that the handshake is complete before anything is stored, so a
 * device cannot post into a conversation whose peer has no key yet.
 */
@Service
public class MessageService {
    private static final Logger logger = LoggerFactory.getLogger(MessageService.class);

    private final MessageRepository repository;
    private final ConversationService conversationService;

    public MessageService(MessageRepository repository, ConversationService conversationService) {
        this.repository = repository;
        this.conversationService = conversationService;
    }

    public Mono<MessageResponse> sendMessage(UUID senderId, SendMessageRequest request) {
        if (request == null || request.conversationId() == null) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "conversationId is required"));
        }
        if (request.content() == null || request.content().isEmpty()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "content is required"));
        }

        return conversationService.requireMembership(senderId, request.conversationId())
                .flatMap(conversation -> {
                    if (!conversation.consentComplete()) {
                        logger.warn("Rejected message from {} to secret conversation {} before both keys were set",
                                senderId, conversation.id());
                        return Mono.error(new ResponseStatusException(HttpStatus.CONFLICT,
                                "Secret conversation has not been accepted by every member"));
                    }
                    MessageEntity entity = new MessageEntity();
                    entity.setKey(new MessageKey(conversation.id(), Uuids.timeBased()));
                    entity.setSenderId(senderId);
                    entity.setContent(request.content());
                    return repository.save(entity);
                })
                .map(this::mapToResponse);
    }

    /** Full history of a conversation, oldest first. Members only. */
    public Flux<MessageResponse> getMessages(UUID userId, UUID conversationId) {
        return conversationService.requireMembership(userId, conversationId)
                .flatMapMany(conversation -> repository.findAllByKeyConversationId(conversationId))
                .map(this::mapToResponse);
    }

    private MessageResponse mapToResponse(MessageEntity entity) {
        return new MessageResponse(
                entity.getKey().messageId(),
                entity.getKey().conversationId(),
                entity.getSenderId(),
                entity.getContent(),
                Instant.ofEpochMilli(Uuids.unixTimestamp(entity.getKey().messageId()))
        );
    }
}
