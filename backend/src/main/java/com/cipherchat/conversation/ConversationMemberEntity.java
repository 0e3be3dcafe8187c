package com.cipherchat.conversation;

import org.springframework.data.cassandra.core.mapping.CassandraType;
import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Membership of one user in one conversation.
 *
 * publicKey: the member's X25519 public key for a secret conversation, Base64.
 *            Null until the member has accepted; its presence is the consent
 *            signal. Always null for non-secret conversations. The matching
 *            private key lives only on the member's device.
 */
@Table("conversation_members")
public class ConversationMemberEntity {

    @PrimaryKey
    private MemberKey key;

    @Column("public_key")
    private String publicKey;

    @Column("last_read_message_id")
    @CassandraType(type = CassandraType.Name.TIMEUUID)
    private UUID lastReadMessageId;

    @Column("joined_at")
    private Instant joinedAt;

    public boolean hasPublicKey() {
        return publicKey != null && !publicKey.isBlank();
    }

    public MemberKey getKey() { return key; }
    public void setKey(MemberKey key) { this.key = key; }

    public String getPublicKey() { return publicKey; }
    public void setPublicKey(String publicKey) { this.publicKey = publicKey; }

    public UUID getLastReadMessageId() { return lastReadMessageId; }
    public void setLastReadMessageId(UUID lastReadMessageId) { this.lastReadMessageId = lastReadMessageId; }

    public Instant getJoinedAt() { return joinedAt; }
    public void setJoinedAt(Instant joinedAt) { this.joinedAt = joinedAt; }
}
