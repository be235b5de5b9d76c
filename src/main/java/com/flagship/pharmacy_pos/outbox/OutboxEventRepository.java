package com.flagship.pharmacy_pos.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Next batch in commit order. Rows another publisher instance is
     * already working on are skipped, not waited for.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL AND attempts < :maxAttempts
        ORDER BY sequence_number
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> findUnpublishedEventsForUpdate(@Param("limit") int limit,
                                                          @Param("maxAttempts") int maxAttempts);

    List<OutboxEventEntity> findByTerminalIdOrderBySequenceNumberAsc(UUID terminalId);

    @Modifying
    @Query("UPDATE OutboxEventEntity e SET e.publishedAt = :publishedAt, e.lastError = NULL WHERE e.id = :id")
    int markPublished(@Param("id") UUID id, @Param("publishedAt") Instant publishedAt);

    @Modifying
    @Query("UPDATE OutboxEventEntity e SET e.attempts = e.attempts + 1, e.lastError = :error WHERE e.id = :id")
    int recordFailure(@Param("id") UUID id, @Param("error") String error);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL AND e.attempts >= :maxAttempts")
    long countDeadLettered(@Param("maxAttempts") int maxAttempts);

    @Query("SELECT MIN(e.createdAt) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    Optional<Instant> findOldestUnpublishedCreatedAt();
}
