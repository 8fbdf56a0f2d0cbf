package com.fabric.shared.wal;

import com.fabric.shared.events.WalRecordedEvent;
import com.fabric.shared.outbox.OutboxService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable WAL on PostgreSQL.
 *
 * Each append assigns {@code max(sequence_no) + 1} and, in the same transaction, enqueues an
 * outbox record so the event is relayed to Kafka exactly when it is committed here.
 */
@Slf4j
@RequiredArgsConstructor
public class JpaWriteAheadLog implements WriteAheadLog {

    private final WalEventRecordRepository repository;
    private final OutboxService outboxService;
    private final ObjectMapper objectMapper;
    private final String walTopic;

    @Override
    @Transactional
    public WalEvent append(String eventId, WalScope scope, WalEventType type, JsonNode payload) {
        Optional<WalEventRecord> existing = repository.findById(eventId);
        if (existing.isPresent()) {
            WalEvent stored = toEvent(existing.get());
            WalEvents.requireSameScope(stored, scope);
            log.debug("WAL append replayed: eventId={}, executionId={}", eventId, scope.getExecutionId());
            return stored;
        }

        long nextSequence = repository.findMaxSequence(scope.getTenantId(), scope.getExecutionId()) + 1;
        JsonNode body = payload == null ? JsonNodeFactory.instance.objectNode() : payload;
        WalEventRecord record = WalEventRecord.builder()
                .eventId(eventId)
                .executionId(scope.getExecutionId())
                .tenantId(scope.getTenantId())
                .sessionId(scope.getSessionId())
                .sequenceNo(nextSequence)
                .eventType(type)
                .payload(write(body))
                .recordedAt(Instant.now())
                .build();
        repository.save(record);

        WalEvent event = toEvent(record);
        outboxService.append(scope.getExecutionId(), "Execution", type.cloudEventType(),
                walTopic, new WalRecordedEvent(event));

        log.debug("WAL append: executionId={}, sequenceNo={}, type={}", scope.getExecutionId(), nextSequence, type);
        return event;
    }

    @Override
    @Transactional(readOnly = true)
    public List<WalEvent> replay(String tenantId, String executionId) {
        return repository.findByTenantIdAndExecutionIdOrderBySequenceNoAsc(tenantId, executionId)
                .stream()
                .map(this::toEvent)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long lastSequence(String tenantId, String executionId) {
        return repository.findMaxSequence(tenantId, executionId);
    }

    private WalEvent toEvent(WalEventRecord record) {
        try {
            return WalEvent.builder()
                    .eventId(record.getEventId())
                    .executionId(record.getExecutionId())
                    .tenantId(record.getTenantId())
                    .sessionId(record.getSessionId())
                    .sequenceNo(record.getSequenceNo())
                    .type(record.getEventType())
                    .payload(objectMapper.readTree(record.getPayload()))
                    .recordedAt(record.getRecordedAt())
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable WAL payload: eventId=" + record.getEventId(), e);
        }
    }

    private String write(JsonNode payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize WAL payload", e);
        }
    }
}
