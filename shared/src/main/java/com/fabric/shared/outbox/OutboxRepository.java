package com.fabric.shared.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface OutboxRepository extends JpaRepository<OutboxRecord, String> {

    /** SKIP LOCKED lets several relay instances drain disjoint batches */
    @Query(value = """
        SELECT * FROM outbox
        WHERE published_at IS NULL
          AND retry_count < :maxAttempts
          AND (next_retry_at IS NULL OR next_retry_at <= :now)
        ORDER BY created_at ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxRecord> findUnpublishedForRelay(@Param("now") Instant now,
                                               @Param("maxAttempts") int maxAttempts,
                                               @Param("limit") int limit);
}
