package com.cipherchat.conversation;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;
import java.util.UUID;

@Repository
public interface ConversationRepository extends ReactiveCassandraRepository<ConversationEntity, UUID> {
}
