package com.example.messaging.persistence;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MessageJpaRepository extends JpaRepository<MessageEntity, String> {

    @Query("select coalesce(max(m.sequence), 0) from MessageEntity m where m.conversationId = :conversationId")
    long findMaxSequence(@Param("conversationId") String conversationId);

    List<MessageEntity> findByConversationIdOrderBySequenceAsc(String conversationId);

    Optional<MessageEntity> findFirstByConversationIdOrderBySequenceDesc(String conversationId);

    List<MessageEntity> findByConversationIdAndReceiverIdAndReadAtIsNullOrderBySequenceAsc(
            String conversationId, String receiverId);

    @Query("select m.conversationId, count(m) from MessageEntity m "
            + "where m.receiverId = :receiverId and m.readAt is null group by m.conversationId")
    List<Object[]> countUnreadByConversation(@Param("receiverId") String receiverId);

    List<MessageEntity> findByReadAtIsNullAndCreatedAtGreaterThanEqualOrderByCreatedAtAsc(Instant since);

    @Modifying
    @Query("update MessageEntity m set m.readAt = :readAt where m.id = :id and m.readAt is null")
    int markRead(@Param("id") String id, @Param("readAt") Instant readAt);
}
