package com.fabric.shared.wal;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/** Execution an event belongs to, rooted at its tenant. */
@Getter
@EqualsAndHashCode
@ToString
public final class WalScope {

    private final String tenantId;
    private final String sessionId;
    private final String executionId;

    public WalScope(String tenantId, String sessionId, String executionId) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.sessionId = sessionId;
        this.executionId = Objects.requireNonNull(executionId, "executionId");
    }
}
