package com.fabric.shared.state;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface StateRecordRepository extends JpaRepository<StateRecordEntity, String> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE StateRecordEntity s
           SET s.value = :value, s.version = s.version + 1,
               s.expiresAt = :expiresAt, s.updatedAt = :now
         WHERE s.stateKey = :key
        """)
    int overwrite(@Param("key") String key, @Param("value") String value,
                  @Param("expiresAt") Instant expiresAt, @Param("now") Instant now);

    /** Conditional write; an expired row counts as version 0 only through the insert path */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE StateRecordEntity s
           SET s.value = :value, s.version = s.version + 1,
               s.expiresAt = :expiresAt, s.updatedAt = :now
         WHERE s.stateKey = :key AND s.version = :expected
           AND (s.expiresAt IS NULL OR s.expiresAt > :now)
        """)
    int overwriteIfVersion(@Param("key") String key, @Param("value") String value,
                           @Param("expected") long expected,
                           @Param("expiresAt") Instant expiresAt, @Param("now") Instant now);

    /** Re-create over an expired row, used by create-if-absent */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE StateRecordEntity s
           SET s.value = :value, s.version = s.version + 1,
               s.expiresAt = :expiresAt, s.updatedAt = :now
         WHERE s.stateKey = :key AND s.expiresAt IS NOT NULL AND s.expiresAt <= :now
        """)
    int replaceExpired(@Param("key") String key, @Param("value") String value,
                       @Param("expiresAt") Instant expiresAt, @Param("now") Instant now);

    @Query("SELECT s.version FROM StateRecordEntity s WHERE s.stateKey = :key")
    Optional<Long> findVersion(@Param("key") String key);

    @Query("""
        SELECT s FROM StateRecordEntity s
         WHERE s.tenantId = :tenantId AND s.namespace = :namespace
           AND (s.expiresAt IS NULL OR s.expiresAt > :now)
         ORDER BY s.stateKey
        """)
    List<StateRecordEntity> findLive(@Param("tenantId") String tenantId,
                                     @Param("namespace") StateNamespace namespace,
                                     @Param("now") Instant now);

    @Query("SELECT DISTINCT s.tenantId FROM StateRecordEntity s")
    List<String> findDistinctTenants();
}
