package com.fabric.shared.wal;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * WAL row. Rows are only ever inserted; the unique (execution_id, sequence_no) index rejects
 * a second writer that raced the execution lock.
 */
@Entity
@Table(name = "wal_events",
       uniqueConstraints = @UniqueConstraint(name = "uq_wal_execution_sequence",
                                             columnNames = {"execution_id", "sequence_no"}),
       indexes = {
           @Index(name = "idx_wal_tenant_execution", columnList = "tenant_id, execution_id, sequence_no"),
           @Index(name = "idx_wal_type", columnList = "event_type")
       })
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalEventRecord {

    @Id
    @Column(name = "event_id", length = 36)
    private String eventId;

    @Column(name = "execution_id", nullable = false, length = 36)
    private String executionId;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(name = "session_id", length = 36)
    private String sessionId;

    @Column(name = "sequence_no", nullable = false)
    private long sequenceNo;

    @Column(name = "event_type", nullable = false, length = 40)
    @Enumerated(EnumType.STRING)
    private WalEventType eventType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", nullable = false, columnDefinition = "jsonb")
    private String payload;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;
}
