package com.cipherchat.message;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import java.util.UUID;

@Repository
public interface MessageRepository extends ReactiveCassandraRepository<MessageEntity, MessageKey> {

    // Whole partition, clustering order: oldest first
    Flux<MessageEntity> findAllByKeyConversationId(UUID conversationId);
}
