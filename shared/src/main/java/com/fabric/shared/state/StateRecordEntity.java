package com.fabric.shared.state;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Durable tier row of the state surface. The rendered key is the primary key; tenant,
 * namespace and scope are denormalized for per-tenant queries.
 */
@Entity
@Table(name = "state_records", indexes = {
    @Index(name = "idx_state_tenant_namespace",
           columnList = "tenant_id, namespace, scope_id"),
    @Index(name = "idx_state_expires_at",
           columnList = "expires_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateRecordEntity implements Persistable<String> {

    @Id
    @Column(name = "state_key", length = 512)
    private String stateKey;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(name = "namespace", nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    private StateNamespace namespace;

    @Column(name = "scope_id", nullable = false, length = 200)
    private String scopeId;

    @Column(name = "name", length = 100)
    private String name;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "value", nullable = false, columnDefinition = "jsonb")
    private String value;

    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /** Rows built in memory are always inserted, never merged over an existing key */
    @Transient
    @Builder.Default
    private boolean fresh = true;

    @PostLoad
    void markLoaded() {
        fresh = false;
    }

    @Override
    public String getId() {
        return stateKey;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    public StateKey toKey() {
        return StateKey.of(tenantId, namespace, scopeId, name);
    }
}
