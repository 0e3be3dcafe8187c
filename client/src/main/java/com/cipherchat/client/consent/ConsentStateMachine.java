package com.cipherchat.client.consent;

import static java.util.Objects.requireNonNull;

import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cipherchat.client.api.ChatServiceClient;
import com.cipherchat.client.api.ConversationView;
import com.cipherchat.client.api.CreateConversationRequest;
import com.cipherchat.client.api.MemberView;
import com.cipherchat.client.keystore.KeyStore;
import com.cipherchat.crypto.AgreementKeyPair;
import com.cipherchat.crypto.KeyPairService;
import com.cipherchat.crypto.PublicKey;
import com.cipherchat.crypto.StorageUnavailableException;

import reactor.core.publisher.Mono;

/**
 * Propose / accept / reject handshake for secret conversations.
 *
 * <p>No status flag is kept anywhere: the state is read off which member records
 * carry a public key. Each conversation gets its own key pair, created through
 * {@link KeyStore#putIfAbsent} so that repeated or concurrent accepts reuse the
 * first pair instead of replacing it.
 */
public class ConsentStateMachine {
    private static final Logger logger = LoggerFactory.getLogger(ConsentStateMachine.class);

    private final KeyPairService keyPairService;
    private final KeyStore keyStore;
    private final ChatServiceClient chatService;
    private final UUID selfUserId;

    public ConsentStateMachine(KeyPairService keyPairService, KeyStore keyStore,
                               ChatServiceClient chatService, UUID selfUserId) {
        this.keyPairService = requireNonNull(keyPairService, "keyPairService");
        this.keyStore = requireNonNull(keyStore, "keyStore");
        this.chatService = requireNonNull(chatService, "chatService");
        this.selfUserId = requireNonNull(selfUserId, "selfUserId");
    }

    public UUID selfUserId() {
        return selfUserId;
    }

    public ConsentState state(ConversationView conversation) {
        requireSecret(conversation);
        Optional<MemberView> self = conversation.member(selfUserId);
        Optional<MemberView> peer = conversation.peerOf(selfUserId);
        if (self.isEmpty() || peer.isEmpty()) {
            return ConsentState.LEFT;
        }
        if (self.get().hasPublicKey() && peer.get().hasPublicKey()) {
            return ConsentState.ACCEPTED;
        }
        return ConsentState.PROPOSED;
    }

    /** True when this user is the invitee of a pending proposal. */
    public boolean awaitsLocalAcceptance(ConversationView conversation) {
        return state(conversation) == ConsentState.PROPOSED
                && conversation.member(selfUserId).map(m -> !m.hasPublicKey()).orElse(false);
    }

    /**
     * Creates a secret conversation with {@code peerUserId}, carrying a fresh public
     * key. If the key pair cannot be persisted afterwards, the new conversation is
     * left again and the call fails with {@link StorageUnavailableException}, or with
     * {@link IllegalStateException} when a different pair is already stored for it.
     */
    public Mono<ConversationView> propose(UUID peerUserId) {
        requireNonNull(peerUserId, "peerUserId");
        return Mono.fromCallable(keyPairService::generate)
                .flatMap(keys -> chatService
                        .createConversation(CreateConversationRequest.secret(peerUserId, keys.publicKey()))
                        .flatMap(conversation -> persist(conversation, keys))
                        .doFinally(signal -> keys.destroy()))
                .doOnNext(conversation -> logger.info("Proposed secret conversation {} to user {}",
                        conversation.conversationId(), peerUserId));
    }

    private Mono<ConversationView> persist(ConversationView conversation, AgreementKeyPair keys) {
        UUID conversationId = conversation.conversationId();
        return Mono.fromCallable(() -> keyStore.putIfAbsent(conversationId, keys.privateKey(), keys.publicKey()))
                .flatMap(created -> created
                        ? Mono.just(conversation)
                        : Mono.<ConversationView>error(new IllegalStateException(
                                "Conversation " + conversationId + " already has a local key pair")))
                .onErrorResume(e -> e instanceof StorageUnavailableException || e instanceof IllegalStateException, e -> {
                    logger.error("Could not persist key pair for new conversation {}, withdrawing it", conversationId, e);
                    return chatService.leaveConversation(conversationId)
                            .onErrorResume(leaveFailure -> {
                                logger.warn("Withdrawing conversation {} failed", conversationId, leaveFailure);
                                e.addSuppressed(leaveFailure);
                                return Mono.empty();
                            })
                            .then(Mono.<ConversationView>error(e));
                });
    }

    /**
     * Accepts a pending invitation: makes sure this device holds a key pair for the
     * conversation, then publishes its public key.
     */
    public Mono<ConversationView> accept(UUID conversationId) {
        requireNonNull(conversationId, "conversationId");
        return Mono.fromCallable(() -> ensureKeyPair(conversationId))
                .flatMap(publicKey -> chatService.acceptSecretConversation(conversationId, publicKey))
                .doOnNext(conversation -> logger.info("Accepted secret conversation {}", conversationId));
    }

    PublicKey ensureKeyPair(UUID conversationId) {
        Optional<AgreementKeyPair> existing = keyStore.get(conversationId);
        if (existing.isPresent()) {
            existing.get().destroy();
            return existing.get().publicKey();
        }

        AgreementKeyPair fresh = keyPairService.generate();
        try {
            if (keyStore.putIfAbsent(conversationId, fresh.privateKey(), fresh.publicKey())) {
                return fresh.publicKey();
            }
        } finally {
            fresh.destroy();
        }

        // Lost a race with a concurrent accept; use the pair that won.
        AgreementKeyPair retained = keyStore.get(conversationId)
                .orElseThrow(() -> new StorageUnavailableException(
                        "Key pair for conversation " + conversationId + " vanished after insert", null));
        retained.destroy();
        return retained.publicKey();
    }

    /**
     * Rejects an invitation or leaves the conversation, then drops this device's
     * key pair for it. Messages already exchanged stay undecryptable for anyone
     * who never held the key.
     */
    public Mono<Void> reject(UUID conversationId) {
        requireNonNull(conversationId, "conversationId");
        return chatService.leaveConversation(conversationId)
                .then(Mono.fromRunnable(() -> {
                    if (keyStore.remove(conversationId)) {
                        logger.debug("Dropped local key pair for conversation {}", conversationId);
                    }
                }))
                .doOnSuccess(ignored -> logger.info("Left secret conversation {}", conversationId))
                .then();
    }

    private static void requireSecret(ConversationView conversation) {
        requireNonNull(conversation, "conversation");
        if (!conversation.isSecret()) {
            throw new IllegalArgumentException(
                    "Conversation " + conversation.conversationId() + " is not a secret conversation");
        }
    }
}
