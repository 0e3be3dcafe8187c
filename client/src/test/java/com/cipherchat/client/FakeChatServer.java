package com.cipherchat.client;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.cipherchat.client.api.ChatMessage;
import com.cipherchat.client.api.ChatServiceClient;
import com.cipherchat.client.api.ConversationSubtype;
import com.cipherchat.client.api.ConversationView;
import com.cipherchat.client.api.CreateConversationRequest;
import com.cipherchat.client.api.MemberView;
import com.cipherchat.crypto.PublicKey;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * In-memory stand-in for the chat service, applying the same membership and
 * consent rules. Hands out one {@link ChatServiceClient} per user.
 */
public class FakeChatServer {

    private final Map<UUID, ConversationView> conversations = new HashMap<>();
    private final Map<UUID, List<ChatMessage>> messages = new HashMap<>();

    public ChatServiceClient clientFor(UUID userId) {
        return new Client(userId);
    }

    public synchronized List<ChatMessage> storedMessages(UUID conversationId) {
        return List.copyOf(messages.getOrDefault(conversationId, List.of()));
    }

    private synchronized ConversationView create(UUID creator, CreateConversationRequest request) {
        Instant now = Instant.now();
        boolean secret = request.subtype() == ConversationSubtype.SECRET;
        List<MemberView> members = new ArrayList<>();
        for (UUID userId : request.memberUserIds()) {
            members.add(new MemberView(userId, null, null, now));
        }
        members.add(new MemberView(creator, secret ? request.creatorPublicKey() : null, null, now));
        ConversationView view = new ConversationView(UUID.randomUUID(), request.type(), request.subtype(),
                request.name(), now, members);
        conversations.put(view.conversationId(), view);
        return view;
    }

    private synchronized ConversationView find(UUID userId, UUID conversationId) {
        ConversationView view = conversations.get(conversationId);
        if (view == null) {
            throw new IllegalArgumentException("Conversation not found");
        }
        if (view.member(userId).isEmpty()) {
            throw new IllegalStateException("Not a member");
        }
        return view;
    }

    private synchronized ConversationView accept(UUID userId, UUID conversationId, PublicKey key) {
        ConversationView view = find(userId, conversationId);
        if (view.member(userId).orElseThrow().hasPublicKey()) {
            throw new IllegalStateException("Public key already set");
        }
        List<MemberView> members = view.members().stream()
                .map(m -> m.userId().equals(userId)
                        ? new MemberView(m.userId(), key.toBase64(), m.lastReadMessageId(), m.joinedAt())
                        : m)
                .toList();
        return replace(view, members);
    }

    private synchronized void leave(UUID userId, UUID conversationId) {
        ConversationView view = find(userId, conversationId);
        replace(view, view.members().stream().filter(m -> !m.userId().equals(userId)).toList());
    }

    private synchronized ChatMessage send(UUID userId, UUID conversationId, String content) {
        ConversationView view = find(userId, conversationId);
        if (view.isSecret() && !view.members().stream().allMatch(MemberView::hasPublicKey)) {
            throw new IllegalStateException("Secret conversation not accepted yet");
        }
        ChatMessage message = new ChatMessage(UUID.randomUUID(), conversationId, userId, content, Instant.now());
        messages.computeIfAbsent(conversationId, id -> new ArrayList<>()).add(message);
        return message;
    }

    private ConversationView replace(ConversationView view, List<MemberView> members) {
        ConversationView updated = new ConversationView(view.conversationId(), view.type(), view.subtype(),
                view.name(), view.createdAt(), members);
        conversations.put(updated.conversationId(), updated);
        return updated;
    }

    private synchronized List<ConversationView> conversationsOf(UUID userId) {
        return conversations.values().stream().filter(c -> c.member(userId).isPresent()).toList();
    }

    private final class Client implements ChatServiceClient {
        private final UUID userId;

        private Client(UUID userId) {
            this.userId = userId;
        }

        @Override
        public Mono<ConversationView> createConversation(CreateConversationRequest request) {
            return Mono.fromCallable(() -> create(userId, request));
        }

        @Override
        public Mono<ConversationView> getConversation(UUID conversationId) {
            return Mono.fromCallable(() -> find(userId, conversationId));
        }

        @Override
        public Flux<ConversationView> getConversations() {
            return Flux.defer(() -> Flux.fromIterable(conversationsOf(userId)));
        }

        @Override
        public Mono<ConversationView> acceptSecretConversation(UUID conversationId, PublicKey publicKey) {
            return Mono.fromCallable(() -> accept(userId, conversationId, publicKey));
        }

        @Override
        public Mono<Void> leaveConversation(UUID conversationId) {
            return Mono.fromRunnable(() -> leave(userId, conversationId));
        }

        @Override
        public Mono<ChatMessage> sendMessage(UUID conversationId, String content) {
            return Mono.fromCallable(() -> send(userId, conversationId, content));
        }

        @Override
        public Flux<ChatMessage> getMessages(UUID conversationId) {
            return Flux.defer(() -> {
                find(userId, conversationId);
                return Flux.fromIterable(storedMessages(conversationId));
            });
        }
    }
}
