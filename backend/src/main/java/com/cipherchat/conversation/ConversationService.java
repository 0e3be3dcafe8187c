package com.cipherchat.conversation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import com.cipherchat.crypto.InvalidPeerKeyException;
import com.cipherchat.crypto.PublicKey;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Conversations, memberships and the server half of the secret conversation
 * handshake.
 *
 * <p><strong>Blind carrier:</strong> the server stores public keys and relays
 * opaque message content. It never holds a private key or a shared secret. Public
 * keys are only checked for being a well-formed 32-byte X25519 encoding; whether
 * a point is usable is decided on the devices.
 *
 * <p>The consent state of a secret conversation is not stored anywhere. It follows
 * from which member records carry a public key.
 */
@Service
public class ConversationService {
    private static final Logger logger = LoggerFactory.getLogger(ConversationService.class);

    private final ConversationRepository conversationRepository;
    private final ConversationMemberRepository memberRepository;

    public ConversationService(ConversationRepository conversationRepository,
                               ConversationMemberRepository memberRepository) {
        this.conversationRepository = conversationRepository;
        this.memberRepository = memberRepository;
    }

    // ── Creation ──────────────────────────────────────────────────────────────

    /**
     * Creates a conversation. The creator is always a member. For a SECRET
     * conversation only the creator's record gets a public key; the invitee's
     * stays null until they accept.
     */
    public Mono<ConversationResponse> create(UUID creatorId, CreateConversationRequest request) {
        return Mono.fromCallable(() -> validate(creatorId, request))
                .flatMap(invitees -> {
                    Instant now = Instant.now();
                    ConversationEntity conversation = new ConversationEntity();
                    conversation.setConversationId(UUID.randomUUID());
                    conversation.setType(request.type());
                    conversation.setSubtype(request.subtype());
                    conversation.setName(request.type() == ConversationType.GROUP ? request.name().trim() : null);
                    conversation.setCreatedAt(now);

                    List<ConversationMemberEntity> members = new ArrayList<>();
                    ConversationMemberEntity creator = newMember(conversation.getConversationId(), creatorId, now);
                    if (request.subtype() == ConversationSubtype.SECRET) {
                        creator.setPublicKey(checkPublicKey(request.creatorPublicKey()));
                    }
                    members.add(creator);
                    invitees.forEach(userId -> members.add(newMember(conversation.getConversationId(), userId, now)));

                    return conversationRepository.save(conversation)
                            .flatMap(saved -> memberRepository.saveAll(members).collectList()
                                    .map(savedMembers -> new Conversation(saved, savedMembers)));
                })
                .doOnNext(conversation -> logger.info("User {} created {} conversation {}",
                        creatorId, describe(conversation.entity()), conversation.id()))
                .map(ConversationResponse::from);
    }

    private Set<UUID> validate(UUID creatorId, CreateConversationRequest request) {
        if (request == null || request.type() == null) {
            throw badRequest("Conversation type is required");
        }
        boolean named = request.name() != null && !request.name().isBlank();
        Set<UUID> invitees = new LinkedHashSet<>(request.memberUserIds() != null ? request.memberUserIds() : List.of());
        invitees.remove(null);
        invitees.remove(creatorId);

        if (request.type() == ConversationType.PRIVATE) {
            if (named) {
                throw badRequest("Private conversations cannot have a name");
            }
            if (request.subtype() == null) {
                throw badRequest("Private conversations must have a subtype (NORMAL or SECRET)");
            }
            if (invitees.size() != 1) {
                throw badRequest("Private conversations need exactly one other member");
            }
        } else {
            if (!named) {
                throw badRequest("Group conversations must have a name");
            }
            if (request.subtype() != null) {
                throw badRequest("Only private conversations can have a subtype");
            }
            if (invitees.isEmpty()) {
                throw badRequest("Group conversations need at least one other member");
            }
        }

        if (request.subtype() == ConversationSubtype.SECRET) {
            checkPublicKey(request.creatorPublicKey());
        }
        return invitees;
    }

    private static ConversationMemberEntity newMember(UUID conversationId, UUID userId, Instant joinedAt) {
        ConversationMemberEntity member = new ConversationMemberEntity();
        member.setKey(new MemberKey(conversationId, userId));
        member.setJoinedAt(joinedAt);
        return member;
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    /** Every conversation the user belongs to, newest first. */
    public Flux<ConversationResponse> getConversations(UUID userId) {
        return memberRepository.findAllByKeyUserId(userId)
                .flatMap(membership -> findConversation(membership.getKey().conversationId()))
                .sort(Comparator.comparing((Conversation c) -> c.entity().getCreatedAt(),
                        Comparator.nullsFirst(Comparator.<Instant>naturalOrder())).reversed())
                .map(ConversationResponse::from);
    }

    public Mono<ConversationResponse> getConversation(UUID userId, UUID conversationId) {
        return requireMembership(userId, conversationId).map(ConversationResponse::from);
    }

    /**
     * Loads a conversation on behalf of a member.
     * 404 if it does not exist, 403 if the user is not (or no longer) a member.
     */
    public Mono<Conversation> requireMembership(UUID userId, UUID conversationId) {
        return load(conversationId).flatMap(conversation -> {
            if (conversation.member(userId).isEmpty()) {
                return Mono.error(new ResponseStatusException(HttpStatus.FORBIDDEN,
                        "You are not a member of this conversation"));
            }
            return Mono.just(conversation);
        });
    }

    private Mono<Conversation> load(UUID conversationId) {
        return findConversation(conversationId)
                .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Conversation not found: " + conversationId)));
    }

    private Mono<Conversation> findConversation(UUID conversationId) {
        return conversationRepository.findById(conversationId)
                .flatMap(entity -> memberRepository.findAllByKeyConversationId(conversationId)
                        .collectList()
                        .map(members -> new Conversation(entity, members)));
    }

    // ── Secret conversation handshake ─────────────────────────────────────────

    /**
     * Records the caller's public key on their member record, completing the
     * handshake from their side. A key that is already set is never replaced:
     * replacing it would desynchronise the secret the peer derives.
     *
     * <p>Check-then-write: two devices of the same user accepting at the same
     * moment can still both pass the check, and the later write wins.
     */
    public Mono<ConversationResponse> acceptSecretConversation(UUID userId, UUID conversationId,
                                                               AcceptConversationRequest request) {
        return load(conversationId)
                .flatMap(conversation -> {
                    if (!conversation.isSecret()) {
                        return Mono.error(badRequest("Not a secret private conversation"));
                    }
                    ConversationMemberEntity member = conversation.member(userId).orElse(null);
                    if (member == null) {
                        return Mono.error(new ResponseStatusException(HttpStatus.FORBIDDEN,
                                "You are not a member of this conversation"));
                    }
                    String publicKey = checkPublicKey(request != null ? request.publicKey() : null);
                    if (member.hasPublicKey()) {
                        return Mono.error(new ResponseStatusException(HttpStatus.CONFLICT, "Public key already set"));
                    }
                    member.setPublicKey(publicKey);
                    return memberRepository.save(member).thenReturn(conversation);
                })
                .doOnNext(conversation -> logger.info("User {} accepted secret conversation {}",
                        userId, conversationId))
                .map(ConversationResponse::from);
    }

    /**
     * Leaves a conversation, which is also how a secret invitation is rejected.
     * Only the caller's member record is removed; messages already stored stay.
     */
    public Mono<Void> leaveConversation(UUID userId, UUID conversationId) {
        return requireMembership(userId, conversationId)
                .flatMap(conversation -> memberRepository.deleteById(new MemberKey(conversationId, userId)))
                .doOnSuccess(ignored -> logger.info("User {} left conversation {}", userId, conversationId));
    }

    public Mono<Void> markRead(UUID userId, UUID conversationId, MarkReadRequest request) {
        if (request == null || request.lastReadMessageId() == null) {
            return Mono.error(badRequest("lastReadMessageId is required"));
        }
        return requireMembership(userId, conversationId)
                .flatMap(conversation -> {
                    ConversationMemberEntity member = conversation.member(userId).orElseThrow();
                    member.setLastReadMessageId(request.lastReadMessageId());
                    return memberRepository.save(member);
                })
                .then();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    /** Returns the key in canonical Base64, or fails with 400. */
    private static String checkPublicKey(String publicKey) {
        try {
            return PublicKey.fromBase64(publicKey).toBase64();
        } catch (InvalidPeerKeyException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    private static String describe(ConversationEntity entity) {
        return entity.getSubtype() != null
                ? entity.getType() + "/" + entity.getSubtype()
                : entity.getType().toString();
    }
}
