package com.fabric.shared.wal;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.UUID;

/**
 * Append-only, per-execution ordered event log.
 *
 * Appends for one execution must come from its single writer (the execution lock owner).
 * An append is durable before it returns.
 */
public interface WriteAheadLog {

    /**
     * Appends under a caller-chosen event id. Re-appending an id that is already stored is a
     * no-op that returns the stored event, so an append whose outcome was ambiguous can be retried.
     */
    WalEvent append(String eventId, WalScope scope, WalEventType type, JsonNode payload);

    default WalEvent append(WalScope scope, WalEventType type, JsonNode payload) {
        return append(UUID.randomUUID().toString(), scope, type, payload);
    }

    /** Events of one execution ordered by sequence number; empty if unknown to the tenant. */
    List<WalEvent> replay(String tenantId, String executionId);

    /** Highest sequence number of the execution, 0 if it has no events. */
    long lastSequence(String tenantId, String executionId);
}
