package com.cipherchat.message;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;
import java.util.UUID;

@Table("messages")
public class MessageEntity {

    @PrimaryKey
    private MessageKey key;

    @Column("sender_id")
    private UUID senderId;

    /**
     * Opaque to the server. Plaintext in normal conversations; in secret ones
     * either base64(nonce ‖ ciphertext ‖ tag) or an attachment URI.
     */
    @Column("content")
    private String content;

    public MessageKey getKey() { return key; }
    public void setKey(MessageKey key) { this.key = key; }

    public UUID getSenderId() { return senderId; }
    public void setSenderId(UUID senderId) { this.senderId = senderId; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }
}
