package com.cipherchat.client;

import java.security.SecureRandom;
import java.util.UUID;

import com.cipherchat.client.api.ChatServiceClient;
import com.cipherchat.client.consent.ConsentStateMachine;
import com.cipherchat.client.keystore.InMemoryKeyStore;
import com.cipherchat.client.keystore.KeyStore;
import com.cipherchat.client.pipeline.SecretMessagePipeline;
import com.cipherchat.crypto.KeyPairService;
import com.cipherchat.crypto.MessageCipher;
import com.cipherchat.crypto.SharedSecretDeriver;

/**
 * One user's device: its own key store, consent machine and pipeline.
 */
public record Device(UUID userId, KeyStore keyStore, ChatServiceClient chat,
                     ConsentStateMachine consent, SecretMessagePipeline pipeline) {

    public static Device of(UUID userId, FakeChatServer server) {
        KeyStore keyStore = new InMemoryKeyStore();
        ChatServiceClient chat = server.clientFor(userId);
        ConsentStateMachine consent = new ConsentStateMachine(
                new KeyPairService(new SecureRandom()), keyStore, chat, userId);
        SecretMessagePipeline pipeline = new SecretMessagePipeline(keyStore, new SharedSecretDeriver(),
                new MessageCipher(new SecureRandom()), consent, chat);
        return new Device(userId, keyStore, chat, consent, pipeline);
    }
}
