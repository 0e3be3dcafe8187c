package com.cipherchat.client.pipeline;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cipherchat.client.api.ChatMessage;
import com.cipherchat.client.api.ChatServiceClient;
import com.cipherchat.client.api.ConversationView;
import com.cipherchat.client.api.MemberView;
import com.cipherchat.client.consent.ConsentState;
import com.cipherchat.client.consent.ConsentStateMachine;
import com.cipherchat.client.keystore.KeyStore;
import com.cipherchat.crypto.AgreementKeyPair;
import com.cipherchat.crypto.DecryptionFailedException;
import com.cipherchat.crypto.MessageCipher;
import com.cipherchat.crypto.MessagePayloads;
import com.cipherchat.crypto.PrivateKey;
import com.cipherchat.crypto.PublicKey;
import com.cipherchat.crypto.SharedSecret;
import com.cipherchat.crypto.SharedSecretDeriver;

import reactor.core.publisher.Mono;

/**
 * Sits between the message transport and the display.
 *
 * <p>Outgoing: plaintext is encrypted before it is sent, and only once consent is
 * complete. Incoming: history is loaded in full first, then turned into a list of
 * {@link DecryptedMessage} by one batched transform that derives the shared
 * secret once. A message that fails to decrypt becomes
 * {@link DecryptedMessage.Outcome#UNDECRYPTABLE} without affecting the others.
 */
public class SecretMessagePipeline {
    private static final Logger logger = LoggerFactory.getLogger(SecretMessagePipeline.class);

    private final KeyStore keyStore;
    private final SharedSecretDeriver deriver;
    private final MessageCipher cipher;
    private final ConsentStateMachine consent;
    private final ChatServiceClient chatService;

    public SecretMessagePipeline(KeyStore keyStore, SharedSecretDeriver deriver, MessageCipher cipher,
                                 ConsentStateMachine consent, ChatServiceClient chatService) {
        this.keyStore = requireNonNull(keyStore, "keyStore");
        this.deriver = requireNonNull(deriver, "deriver");
        this.cipher = requireNonNull(cipher, "cipher");
        this.consent = requireNonNull(consent, "consent");
        this.chatService = requireNonNull(chatService, "chatService");
    }

    public Mono<ChatMessage> send(ConversationView conversation, String plaintext) {
        return encryptOutgoing(conversation, plaintext)
                .flatMap(content -> chatService.sendMessage(conversation.conversationId(), content));
    }

    public Mono<String> encryptOutgoing(ConversationView conversation, String plaintext) {
        requireNonNull(conversation, "conversation");
        requireNonNull(plaintext, "plaintext");
        if (!conversation.isSecret()) {
            return Mono.just(plaintext);
        }
        return Mono.fromCallable(() -> {
            ConsentState state = consent.state(conversation);
            if (state != ConsentState.ACCEPTED) {
                throw new IllegalStateException("Secret conversation " + conversation.conversationId()
                        + " is " + state + "; messages cannot be sent yet");
            }
            try (SharedSecret secret = deriveSecret(conversation).orElseThrow(() -> new IllegalStateException(
                    "No local key pair for secret conversation " + conversation.conversationId()))) {
                return cipher.encrypt(secret, plaintext);
            }
        });
    }

    public Mono<List<DecryptedMessage>> loadHistory(ConversationView conversation) {
        requireNonNull(conversation, "conversation");
        return chatService.getMessages(conversation.conversationId())
                .collectList()
                .flatMap(messages -> decryptAll(conversation, messages));
    }

    public Mono<List<DecryptedMessage>> decryptAll(ConversationView conversation, List<ChatMessage> messages) {
        requireNonNull(conversation, "conversation");
        requireNonNull(messages, "messages");
        if (!conversation.isSecret()) {
            return Mono.just(messages.stream().map(DecryptedMessage::plaintext).toList());
        }
        return Mono.fromCallable(() -> {
            Optional<SharedSecret> secret = deriveSecret(conversation);
            try {
                return messages.stream().map(message -> open(secret, message)).toList();
            } finally {
                secret.ifPresent(SharedSecret::destroy);
            }
        });
    }

    private DecryptedMessage open(Optional<SharedSecret> secret, ChatMessage message) {
        if (MessagePayloads.isPassThrough(message.content())) {
            return DecryptedMessage.plaintext(message);
        }
        if (secret.isEmpty()) {
            return DecryptedMessage.undecryptable(message);
        }
        try {
            return DecryptedMessage.decrypted(message, cipher.decrypt(secret.get(), message.content()));
        } catch (DecryptionFailedException e) {
            logger.warn("Message {} in conversation {} could not be decrypted: {}",
                    message.messageId(), message.conversationId(), e.getMessage());
            return DecryptedMessage.undecryptable(message);
        }
    }

    /**
     * Empty when no channel can exist yet: the peer has not published a key or has
     * left, or this device holds no key pair for the conversation. A published but
     * invalid peer key fails with {@link com.cipherchat.crypto.InvalidPeerKeyException}.
     */
    private Optional<SharedSecret> deriveSecret(ConversationView conversation) {
        UUID conversationId = conversation.conversationId();
        Optional<String> peerKey = conversation.peerOf(consent.selfUserId())
                .filter(MemberView::hasPublicKey)
                .map(MemberView::publicKey);
        if (peerKey.isEmpty()) {
            return Optional.empty();
        }

        Optional<AgreementKeyPair> local = keyStore.get(conversationId);
        if (local.isEmpty()) {
            logger.warn("No local key pair for secret conversation {}", conversationId);
            return Optional.empty();
        }
        try (PrivateKey privateKey = local.get().privateKey()) {
            return Optional.of(deriver.derive(privateKey, PublicKey.fromBase64(peerKey.get())));
        }
    }
}
