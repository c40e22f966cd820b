package com.example.messaging.persistence;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ConversationJpaRepository extends JpaRepository<ConversationEntity, String> {

    Optional<ConversationEntity> findByParticipantKeyAndProjectKey(String participantKey, String projectKey);

    @Query("select c from ConversationEntity c where :userId member of c.participants order by c.lastActivityAt desc")
    List<ConversationEntity> findForParticipant(@Param("userId") String userId);

    @Modifying
    @Query("update ConversationEntity c set c.lastActivityAt = :at where c.id = :id and c.lastActivityAt < :at")
    int updateLastActivity(@Param("id") String id, @Param("at") Instant at);
}
