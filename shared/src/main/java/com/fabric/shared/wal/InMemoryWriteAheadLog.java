package com.fabric.shared.wal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local WAL for tests and {@code runtime.storage.mode=memory}.
 */
public class InMemoryWriteAheadLog implements WriteAheadLog {

    private final Map<String, List<WalEvent>> logs = new ConcurrentHashMap<>();
    private final Map<String, WalEvent> byEventId = new ConcurrentHashMap<>();

    @Override
    public WalEvent append(String eventId, WalScope scope, WalEventType type, JsonNode payload) {
        List<WalEvent> log = logs.computeIfAbsent(logKey(scope.getTenantId(), scope.getExecutionId()),
                k -> new ArrayList<>());
        synchronized (log) {
            WalEvent existing = byEventId.get(eventId);
            if (existing != null) {
                WalEvents.requireSameScope(existing, scope);
                return existing;
            }
            WalEvent event = WalEvent.builder()
                    .eventId(eventId)
                    .executionId(scope.getExecutionId())
                    .tenantId(scope.getTenantId())
                    .sessionId(scope.getSessionId())
                    .sequenceNo(log.size() + 1L)
                    .type(type)
                    .payload(payload == null ? JsonNodeFactory.instance.objectNode() : payload.deepCopy())
                    .recordedAt(Instant.now())
                    .build();
            log.add(event);
            byEventId.put(eventId, event);
            return event;
        }
    }

    @Override
    public List<WalEvent> replay(String tenantId, String executionId) {
        List<WalEvent> log = logs.get(logKey(tenantId, executionId));
        if (log == null) return List.of();
        synchronized (log) {
            return List.copyOf(log);
        }
    }

    @Override
    public long lastSequence(String tenantId, String executionId) {
        List<WalEvent> log = logs.get(logKey(tenantId, executionId));
        if (log == null) return 0L;
        synchronized (log) {
            return log.size();
        }
    }

    private static String logKey(String tenantId, String executionId) {
        return tenantId + "/" + executionId;
    }
}
