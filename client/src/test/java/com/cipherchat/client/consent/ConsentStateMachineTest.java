package com.cipherchat.client.consent;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.cipherchat.client.api.ChatServiceClient;
import com.cipherchat.client.api.ConversationSubtype;
import com.cipherchat.client.api.ConversationType;
import com.cipherchat.client.api.ConversationView;
import com.cipherchat.client.api.CreateConversationRequest;
import com.cipherchat.client.api.MemberView;
import com.cipherchat.client.keystore.InMemoryKeyStore;
import com.cipherchat.client.keystore.KeyStore;
import com.cipherchat.crypto.AgreementKeyPair;
import com.cipherchat.crypto.KeyPairService;
import com.cipherchat.crypto.PrivateKey;
import com.cipherchat.crypto.PublicKey;
import com.cipherchat.crypto.StorageUnavailableException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConsentStateMachineTest {

    private static final UUID SELF = UUID.randomUUID();
    private static final UUID PEER = UUID.randomUUID();
    private static final UUID CONVERSATION = UUID.randomUUID();

    @Mock
    private ChatServiceClient chatService;

    private final KeyPairService keyPairService = new KeyPairService(new SecureRandom());
    private KeyStore keyStore;
    private ConsentStateMachine consent;

    @BeforeEach
    void setup() {
        keyStore = new InMemoryKeyStore();
        consent = new ConsentStateMachine(keyPairService, keyStore, chatService, SELF);
    }

    private static ConversationView secret(MemberView... members) {
        return new ConversationView(CONVERSATION, ConversationType.PRIVATE, ConversationSubtype.SECRET,
                null, Instant.now(), List.of(members));
    }

    private static MemberView member(UUID userId, String publicKey) {
        return new MemberView(userId, publicKey, null, Instant.now());
    }

    private String someKey() {
        return keyPairService.generate().publicKey().toBase64();
    }

    // ── State derivation ──────────────────────────────────────────────────────

    @Test
    void stateIsDerivedFromMemberKeys() {
        assertEquals(ConsentState.PROPOSED, consent.state(secret(member(SELF, null), member(PEER, someKey()))));
        assertEquals(ConsentState.PROPOSED, consent.state(secret(member(SELF, someKey()), member(PEER, null))));
        assertEquals(ConsentState.ACCEPTED,
                consent.state(secret(member(SELF, someKey()), member(PEER, someKey()))));
        assertEquals(ConsentState.LEFT, consent.state(secret(member(SELF, someKey()))));
        assertEquals(ConsentState.LEFT, consent.state(secret(member(PEER, someKey()))));
    }

    @Test
    void blankKeyCountsAsMissing() {
        assertEquals(ConsentState.PROPOSED, consent.state(secret(member(SELF, " "), member(PEER, someKey()))));
    }

    @Test
    void onlyTheInviteeAwaitsLocalAcceptance() {
        assertTrue(consent.awaitsLocalAcceptance(secret(member(SELF, null), member(PEER, someKey()))));
        assertFalse(consent.awaitsLocalAcceptance(secret(member(SELF, someKey()), member(PEER, null))));
        assertFalse(consent.awaitsLocalAcceptance(secret(member(SELF, someKey()), member(PEER, someKey()))));
    }

    @Test
    void normalConversationsHaveNoConsentState() {
        ConversationView normal = new ConversationView(CONVERSATION, ConversationType.PRIVATE,
                ConversationSubtype.NORMAL, null, Instant.now(), List.of(member(SELF, null), member(PEER, null)));

        assertThrows(IllegalArgumentException.class, () -> consent.state(normal));
    }

    // ── Propose ───────────────────────────────────────────────────────────────

    @Test
    void proposeStoresTheKeyPairWhosePublicHalfWasSent() {
        when(chatService.createConversation(any())).thenAnswer(invocation -> {
            CreateConversationRequest request = invocation.getArgument(0);
            return Mono.just(secret(member(SELF, request.creatorPublicKey()), member(PEER, null)));
        });

        StepVerifier.create(consent.propose(PEER))
                .assertNext(view -> assertEquals(ConsentState.PROPOSED, consent.state(view)))
                .verifyComplete();

        ArgumentCaptor<CreateConversationRequest> captor = ArgumentCaptor.forClass(CreateConversationRequest.class);
        verify(chatService).createConversation(captor.capture());
        CreateConversationRequest sent = captor.getValue();
        assertEquals(ConversationSubtype.SECRET, sent.subtype());
        assertEquals(List.of(PEER), sent.memberUserIds());

        AgreementKeyPair stored = keyStore.get(CONVERSATION).orElseThrow();
        assertEquals(sent.creatorPublicKey(), stored.publicKey().toBase64());
        assertEquals(stored.publicKey(), stored.privateKey().publicKey(), "Stored halves must belong together");
    }

    @Test
    void proposeWithdrawsTheConversationWhenTheKeyCannotBeStored() {
        KeyStore broken = mock(KeyStore.class);
        when(broken.putIfAbsent(any(), any(), any()))
                .thenThrow(new StorageUnavailableException("disk full", null));
        ConsentStateMachine machine = new ConsentStateMachine(keyPairService, broken, chatService, SELF);
        when(chatService.createConversation(any()))
                .thenReturn(Mono.just(secret(member(SELF, someKey()), member(PEER, null))));
        when(chatService.leaveConversation(CONVERSATION)).thenReturn(Mono.empty());

        StepVerifier.create(machine.propose(PEER))
                .expectError(StorageUnavailableException.class)
                .verify();

        verify(chatService).leaveConversation(CONVERSATION);
    }

    @Test
    void proposeFailsWhenAKeyPairIsAlreadyStoredForTheConversation() {
        AgreementKeyPair existing = keyPairService.generate();
        keyStore.putIfAbsent(CONVERSATION, existing.privateKey(), existing.publicKey());
        when(chatService.createConversation(any())).thenAnswer(invocation -> {
            CreateConversationRequest request = invocation.getArgument(0);
            return Mono.just(secret(member(SELF, request.creatorPublicKey()), member(PEER, null)));
        });
        when(chatService.leaveConversation(CONVERSATION)).thenReturn(Mono.empty());

        StepVerifier.create(consent.propose(PEER))
                .expectError(IllegalStateException.class)
                .verify();

        verify(chatService).leaveConversation(CONVERSATION);
        assertEquals(existing.publicKey(), keyStore.get(CONVERSATION).orElseThrow().publicKey(),
                "The previously stored pair must be left untouched");
    }

    @Test
    void failedWithdrawalIsAttachedToTheStorageError() {
        KeyStore broken = mock(KeyStore.class);
        when(broken.putIfAbsent(any(), any(), any()))
                .thenThrow(new StorageUnavailableException("disk full", null));
        ConsentStateMachine machine = new ConsentStateMachine(keyPairService, broken, chatService, SELF);
        when(chatService.createConversation(any()))
                .thenReturn(Mono.just(secret(member(SELF, someKey()), member(PEER, null))));
        when(chatService.leaveConversation(CONVERSATION))
                .thenReturn(Mono.error(new IllegalStateException("offline")));

        StepVerifier.create(machine.propose(PEER))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(StorageUnavailableException.class, e);
                    assertEquals(1, e.getSuppressed().length);
                })
                .verify();
    }

    @Test
    void proposeDoesNotStoreAnythingWhenCreationFails() {
        when(chatService.createConversation(any())).thenReturn(Mono.error(new IllegalStateException("boom")));

        StepVerifier.create(consent.propose(PEER))
                .expectError(IllegalStateException.class)
                .verify();

        verify(chatService, never()).leaveConversation(any());
        assertTrue(keyStore.get(CONVERSATION).isEmpty());
    }

    // ── Accept ────────────────────────────────────────────────────────────────

    @Test
    void acceptPublishesTheStoredKey() {
        when(chatService.acceptSecretConversation(eq(CONVERSATION), any()))
                .thenAnswer(invocation -> {
                    PublicKey key = invocation.getArgument(1);
                    return Mono.just(secret(member(SELF, key.toBase64()), member(PEER, someKey())));
                });

        StepVerifier.create(consent.accept(CONVERSATION))
                .assertNext(view -> assertEquals(ConsentState.ACCEPTED, consent.state(view)))
                .verifyComplete();

        ArgumentCaptor<PublicKey> captor = ArgumentCaptor.forClass(PublicKey.class);
        verify(chatService).acceptSecretConversation(eq(CONVERSATION), captor.capture());
        assertEquals(keyStore.get(CONVERSATION).orElseThrow().publicKey(), captor.getValue());
    }

    @Test
    void ensureKeyPairReusesTheFirstPair() {
        PublicKey first = consent.ensureKeyPair(CONVERSATION);
        PublicKey second = consent.ensureKeyPair(CONVERSATION);

        assertEquals(first, second);
        assertEquals(first, keyStore.get(CONVERSATION).orElseThrow().publicKey());
    }

    @Test
    void ensureKeyPairUsesTheWinnerOfARace() {
        AgreementKeyPair winner = keyPairService.generate();
        KeyStore racing = mock(KeyStore.class);
        when(racing.get(CONVERSATION)).thenReturn(Optional.empty(), Optional.of(winner));
        when(racing.putIfAbsent(eq(CONVERSATION), any(PrivateKey.class), any(PublicKey.class))).thenReturn(false);
        ConsentStateMachine machine = new ConsentStateMachine(keyPairService, racing, chatService, SELF);

        assertEquals(winner.publicKey(), machine.ensureKeyPair(CONVERSATION));
    }

    @Test
    void acceptFailureKeepsTheKeyForARetry() {
        when(chatService.acceptSecretConversation(eq(CONVERSATION), any()))
                .thenReturn(Mono.error(new IllegalStateException("offline")));

        StepVerifier.create(consent.accept(CONVERSATION)).expectError().verify();

        assertTrue(keyStore.get(CONVERSATION).isPresent());
    }

    // ── Reject ────────────────────────────────────────────────────────────────

    @Test
    void rejectLeavesAndDropsTheKey() {
        consent.ensureKeyPair(CONVERSATION);
        when(chatService.leaveConversation(CONVERSATION)).thenReturn(Mono.empty());

        StepVerifier.create(consent.reject(CONVERSATION)).verifyComplete();

        assertTrue(keyStore.get(CONVERSATION).isEmpty());
    }

    @Test
    void rejectKeepsTheKeyWhenLeavingFails() {
        consent.ensureKeyPair(CONVERSATION);
        when(chatService.leaveConversation(CONVERSATION))
                .thenReturn(Mono.error(new IllegalStateException("offline")));

        StepVerifier.create(consent.reject(CONVERSATION)).expectError().verify();

        assertTrue(keyStore.get(CONVERSATION).isPresent());
    }
}
