package com.cipherchat.client.api;

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.cipherchat.crypto.PublicKey;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * {@link ChatServiceClient} over the chat service's REST API.
 *
 * <p>Every call is bounded by a timeout. Reads, leave and accept are retried
 * with exponential backoff on connection failures, timeouts and 5xx responses;
 * create and send are not, since repeating them could duplicate data.
 */
public class WebClientChatServiceClient implements ChatServiceClient {
    private static final Logger logger = LoggerFactory.getLogger(WebClientChatServiceClient.class);

    public static final String USER_HEADER = "X-User-Id";
    static final Duration RETRY_BACKOFF = Duration.ofMillis(100);

    private final WebClient webClient;
    private final UUID userId;
    private final Duration timeout;
    private final int maxRetries;

    public WebClientChatServiceClient(WebClient.Builder builder, String baseUrl, UUID userId,
                                      Duration timeout, int maxRetries) {
        this.userId = requireNonNull(userId, "userId");
        this.webClient = builder
                .baseUrl(requireNonNull(baseUrl, "baseUrl"))
                .defaultHeader(USER_HEADER, userId.toString())
                .build();
        this.timeout = requireNonNull(timeout, "timeout");
        this.maxRetries = maxRetries;
    }

    @Override
    public Mono<ConversationView> createConversation(CreateConversationRequest request) {
        return webClient.post()
                .uri("/api/chat/conversations")
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ConversationView.class)
                .timeout(timeout);
    }

    @Override
    public Mono<ConversationView> getConversation(UUID conversationId) {
        return webClient.get()
                .uri("/api/chat/conversations/{id}", conversationId)
                .retrieve()
                .bodyToMono(ConversationView.class)
                .timeout(timeout)
                .retryWhen(transientFailures());
    }

    @Override
    public Flux<ConversationView> getConversations() {
        return webClient.get()
                .uri("/api/chat/conversations")
                .retrieve()
                .bodyToFlux(ConversationView.class)
                .timeout(timeout)
                .retryWhen(transientFailures());
    }

    /**
     * A 409 means our key is already on the member record, e.g. because an earlier
     * attempt succeeded but its response was lost. If the stored key is ours the
     * accept counts as done; if another device's key landed there, it fails.
     */
    @Override
    public Mono<ConversationView> acceptSecretConversation(UUID conversationId, PublicKey publicKey) {
        return webClient.patch()
                .uri("/api/chat/conversations/{id}/accept", conversationId)
                .bodyValue(new AcceptConversationRequest(publicKey.toBase64()))
                .retrieve()
                .bodyToMono(ConversationView.class)
                .timeout(timeout)
                .retryWhen(transientFailures())
                .onErrorResume(WebClientResponseException.Conflict.class,
                        e -> getConversation(conversationId).flatMap(view -> confirmOwnKey(view, publicKey, e)));
    }

    private Mono<ConversationView> confirmOwnKey(ConversationView view, PublicKey publicKey,
                                                 WebClientResponseException conflict) {
        boolean ours = view.member(userId)
                .filter(MemberView::hasPublicKey)
                .map(m -> m.publicKey().equals(publicKey.toBase64()))
                .orElse(false);
        if (ours) {
            logger.debug("Accept of conversation {} had already been applied", view.conversationId());
            return Mono.just(view);
        }
        return Mono.error(new IllegalStateException(
                "Conversation " + view.conversationId() + " was already accepted with a different key", conflict));
    }

    @Override
    public Mono<Void> leaveConversation(UUID conversationId) {
        return webClient.delete()
                .uri("/api/chat/conversations/{id}", conversationId)
                .retrieve()
                .bodyToMono(Void.class)
                .timeout(timeout)
                .retryWhen(transientFailures());
    }

    @Override
    public Mono<ChatMessage> sendMessage(UUID conversationId, String content) {
        return webClient.post()
                .uri("/api/chat/messages")
                .bodyValue(new SendMessageRequest(conversationId, content))
                .retrieve()
                .bodyToMono(ChatMessage.class)
                .timeout(timeout);
    }

    @Override
    public Flux<ChatMessage> getMessages(UUID conversationId) {
        return webClient.get()
                .uri("/api/chat/messages/{id}", conversationId)
                .retrieve()
                .bodyToFlux(ChatMessage.class)
                .timeout(timeout)
                .retryWhen(transientFailures());
    }

    private Retry transientFailures() {
        return Retry.backoff(maxRetries, RETRY_BACKOFF)
                .filter(WebClientChatServiceClient::isTransient)
                .doBeforeRetry(signal -> logger.warn("Retrying chat service call (attempt {}): {}",
                        signal.totalRetries() + 1, signal.failure().toString()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    static boolean isTransient(Throwable failure) {
        if (failure instanceof WebClientResponseException response) {
            return response.getStatusCode().is5xxServerError();
        }
        return failure instanceof WebClientRequestException || failure instanceof TimeoutException;
    }
}
