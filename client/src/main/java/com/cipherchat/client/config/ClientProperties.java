package com.cipherchat.client.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * {@code cipherchat.client.*} settings for one device acting for one user.
 */
@ConfigurationProperties(prefix = "cipherchat.client")
public record ClientProperties(
        String baseUrl,
        UUID userId,
        @DefaultValue("10s") Duration timeout,
        @DefaultValue("3") int maxRetries,
        @DefaultValue KeyStoreProperties keyStore
) {

    public enum KeyStoreType {
        FILE,
        MEMORY
    }

    /**
     * @param path where the file key store lives; defaults to
     *             {@code ~/.cipherchat/conversation-keys.json}
     */
    public record KeyStoreProperties(
            @DefaultValue("file") KeyStoreType type,
            Path path
    ) {

        public Path resolvedPath() {
            return path != null
                    ? path
                    : Path.of(System.getProperty("user.home"), ".cipherchat", "conversation-keys.json");
        }
    }
}
