package com.cipherchat.conversation;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import java.util.UUID;

@Repository
public interface ConversationMemberRepository extends ReactiveCassandraRepository<ConversationMemberEntity, MemberKey> {

    Flux<ConversationMemberEntity> findAllByKeyConversationId(UUID conversationId);

    // Served by the secondary index on user_id
    Flux<ConversationMemberEntity> findAllByKeyUserId(UUID userId);
}
