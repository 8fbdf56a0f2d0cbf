package com.fabric.shared.wal;

import com.fabric.shared.infra.InfraRetry;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Wraps a WAL with bounded retry of transient store failures. Retried appends reuse the
 * event id, so a commit that succeeded before the failure was reported is not duplicated.
 */
@RequiredArgsConstructor
public class RetryingWriteAheadLog implements WriteAheadLog {

    private final WriteAheadLog delegate;
    private final InfraRetry retry;

    @Override
    public WalEvent append(String eventId, WalScope scope, WalEventType type, JsonNode payload) {
        return retry.call("wal.append", () -> delegate.append(eventId, scope, type, payload));
    }

    @Override
    public List<WalEvent> replay(String tenantId, String executionId) {
        return retry.call("wal.replay", () -> delegate.replay(tenantId, executionId));
    }

    @Override
    public long lastSequence(String tenantId, String executionId) {
        return retry.call("wal.lastSequence", () -> delegate.lastSequence(tenantId, executionId));
    }
}
