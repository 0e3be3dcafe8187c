package com.cipherchat.client.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import com.cipherchat.client.api.ChatServiceClient;
import com.cipherchat.client.api.WebClientChatServiceClient;
import com.cipherchat.client.consent.ConsentStateMachine;
import com.cipherchat.client.keystore.FileKeyStore;
import com.cipherchat.client.keystore.InMemoryKeyStore;
import com.cipherchat.client.keystore.KeyStore;
import com.cipherchat.client.pipeline.SecretMessagePipeline;
import com.cipherchat.crypto.KeyPairService;
import com.cipherchat.crypto.MessageCipher;
import com.cipherchat.crypto.SharedSecretDeriver;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Wires the device-side secret conversation components. One key store instance
 * per context; nothing is held in static state.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(ClientProperties.class)
public class SecretChatClientConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(SecretChatClientConfiguration.class);

    @Bean
    public KeyPairService keyPairService() {
        return KeyPairService.withSystemEntropy();
    }

    @Bean
    public SharedSecretDeriver sharedSecretDeriver() {
        return new SharedSecretDeriver();
    }

    @Bean
    public MessageCipher messageCipher() {
        return MessageCipher.withSystemEntropy();
    }

    @Bean
    public KeyStore conversationKeyStore(ClientProperties properties, ObjectProvider<ObjectMapper> mappers) {
        ClientProperties.KeyStoreProperties keyStore = properties.keyStore();
        if (keyStore.type() == ClientProperties.KeyStoreType.MEMORY) {
            logger.warn("Using an in-memory key store; secret conversation keys will not survive a restart");
            return new InMemoryKeyStore();
        }
        logger.info("Using file key store at {}", keyStore.resolvedPath());
        return new FileKeyStore(keyStore.resolvedPath(), mappers.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public ChatServiceClient chatServiceClient(ClientProperties properties,
                                               ObjectProvider<WebClient.Builder> builders) {
        return new WebClientChatServiceClient(builders.getIfAvailable(WebClient::builder),
                properties.baseUrl(), properties.userId(), properties.timeout(), properties.maxRetries());
    }

    @Bean
    public ConsentStateMachine consentStateMachine(KeyPairService keyPairService, KeyStore keyStore,
                                                   ChatServiceClient chatServiceClient,
                                                   ClientProperties properties) {
        return new ConsentStateMachine(keyPairService, keyStore, chatServiceClient, properties.userId());
    }

    @Bean
    public SecretMessagePipeline secretMessagePipeline(KeyStore keyStore, SharedSecretDeriver deriver,
                                                       MessageCipher cipher, ConsentStateMachine consent,
                                                       ChatServiceClient chatServiceClient) {
        return new SecretMessagePipeline(keyStore, deriver, cipher, consent, chatServiceClient);
    }
}
