package com.cipherchat.conversation;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

import java.time.Instant;
import java.util.UUID;

@Table("conversations")
public class ConversationEntity {

    @PrimaryKey("conversation_id")
    private UUID conversationId;

    @Column("type")
    private ConversationType type;

    /** Null for group conversations. */
    @Column("subtype")
    private ConversationSubtype subtype;

    /** Null for private conversations. */
    @Column("name")
    private String name;

    @Column("created_at")
    private Instant createdAt;

    public UUID getConversationId() { return conversationId; }
    public void setConversationId(UUID conversationId) { this.conversationId = conversationId; }

    public ConversationType getType() { return type; }
    public void setType(ConversationType type) { this.type = type; }

    public ConversationSubtype getSubtype() { return subtype; }
    public void setSubtype(ConversationSubtype subtype) { this.subtype = subtype; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
