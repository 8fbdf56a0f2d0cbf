package com.fabric.runtime.contract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Authorization record for one externally sourced artifact, stored under
 * {@code tenant/{tenantId}/contract/{contractId}}.
 *
 *   pending ──authorize(scope)──▶ active
 *   pending | active ──revoke──▶ revoked
 *   pending | active ──TTL──▶ expired
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BoundaryContract {

    private String contractId;
    private String tenantId;
    private String artifactReference;
    private ContractStatus status;
    private MaterializationScope scope;
    private Instant createdAt;
    private Instant authorizedAt;
    private Instant revokedAt;
    private Instant expiresAt;

    /** Stored status, or EXPIRED once the TTL passed even if the sweep has not run yet. */
    public ContractStatus effectiveStatus(Instant now) {
        boolean live = status == ContractStatus.PENDING || status == ContractStatus.ACTIVE;
        if (live && expiresAt != null && !now.isBefore(expiresAt)) {
            return ContractStatus.EXPIRED;
        }
        return status;
    }

    @JsonIgnore
    public boolean isActiveAt(Instant now) {
        return effectiveStatus(now) == ContractStatus.ACTIVE;
    }
}
