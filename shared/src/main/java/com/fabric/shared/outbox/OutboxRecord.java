package com.fabric.shared.outbox;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Outbox row, inserted in the same transaction as the WAL event it announces.
 *
 * The relay publishes it after commit and marks it published. Failed publishes back off
 * 5s, 10s, 20s, 40s, 80s; after {@link #MAX_ATTEMPTS} the row is left for operators.
 */
@Entity
@Table(name = "outbox", indexes = {
    @Index(name = "idx_outbox_unpublished",
           columnList = "published_at, retry_count, created_at"),
    @Index(name = "idx_outbox_aggregate",
           columnList = "aggregate_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxRecord {

    public static final int MAX_ATTEMPTS = 5;

    /** Same id as the relayed event */
    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "aggregate_id", nullable = false, length = 100)
    private String aggregateId;

    @Column(name = "aggregate_type", nullable = false, length = 50)
    private String aggregateType;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "topic", nullable = false, length = 200)
    private String topic;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", nullable = false, columnDefinition = "jsonb")
    private String payload;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private int retryCount = 0;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onPrePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isExhausted() {
        return retryCount >= MAX_ATTEMPTS;
    }

    public void markPublished(Instant now) {
        this.publishedAt = now;
        this.updatedAt = now;
    }

    public void recordFailure(String errorMessage, Instant now) {
        this.retryCount++;
        this.lastError = errorMessage;
        this.nextRetryAt = now.plusSeconds((1L << (retryCount - 1)) * 5L);
        this.updatedAt = now;
    }
}
