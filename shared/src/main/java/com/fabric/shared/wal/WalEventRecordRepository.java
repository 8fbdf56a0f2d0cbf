package com.fabric.shared.wal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface WalEventRecordRepository extends JpaRepository<WalEventRecord, String> {

    List<WalEventRecord> findByTenantIdAndExecutionIdOrderBySequenceNoAsc(String tenantId, String executionId);

    @Query("SELECT COALESCE(MAX(e.sequenceNo), 0) FROM WalEventRecord e " +
           "WHERE e.tenantId = :tenantId AND e.executionId = :executionId")
    long findMaxSequence(@Param("tenantId") String tenantId, @Param("executionId") String executionId);
}
